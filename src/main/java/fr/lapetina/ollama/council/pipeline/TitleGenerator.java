package fr.lapetina.ollama.council.pipeline;

import fr.lapetina.ollama.council.domain.model.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asks a model for a 3-5 word conversation title. Runs beside the stages and never fails:
 * any problem gives {@value #FALLBACK_TITLE}.
 */
public final class TitleGenerator {

    static final String STAGE = "title";
    public static final String FALLBACK_TITLE = "New Conversation";
    public static final int MAX_LENGTH = 50;

    private static final Logger log = LoggerFactory.getLogger(TitleGenerator.class);

    private final AdvisorInvoker invoker;
    private final String model;
    private final Duration timeout;

    /**
     * @param model title model; the caller substitutes the chairman model when none is configured
     */
    public TitleGenerator(AdvisorInvoker invoker, String model, Duration timeout) {
        this.invoker = invoker;
        this.model = model;
        this.timeout = timeout;
    }

    public CompletableFuture<String> generate(String question) {
        List<ChatMessage> messages = List.of(ChatMessage.user(PromptTemplates.title(question)));
        return invoker.invoke(STAGE, STAGE, model, messages, null, timeout)
                .thenApply(outcome -> normalize(outcome.contentOrEmpty()))
                .exceptionally(e -> {
                    log.warn("Title generation failed: model={}, error={}", model, e.getMessage());
                    return FALLBACK_TITLE;
                });
    }

    static String normalize(String raw) {
        String title = ResponseSanitizer.clean(raw);
        int newline = title.indexOf('\n');
        if (newline >= 0) {
            title = title.substring(0, newline);
        }
        title = stripQuotes(title.strip());

        if (title.isEmpty()) {
            return FALLBACK_TITLE;
        }
        if (title.length() > MAX_LENGTH) {
            title = title.substring(0, MAX_LENGTH - 3) + "...";
        }
        return title;
    }

    // Apostrophes inside the title ("What's") are kept
    private static String stripQuotes(String title) {
        int start = 0;
        int end = title.length();
        while (start < end && isQuote(title.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(title.charAt(end - 1))) {
            end--;
        }
        return title.substring(start, end).strip();
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
