package fr.lapetina.ollama.council.pipeline;

import fr.lapetina.ollama.council.domain.model.AdvisorResponse;
import fr.lapetina.ollama.council.domain.model.AdvisorSpec;
import fr.lapetina.ollama.council.domain.model.ChatMessage;
import fr.lapetina.ollama.council.domain.model.GatewayResponse;
import fr.lapetina.ollama.council.domain.port.SystemPromptLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Stage 1: sends the question to every advisor concurrently.
 *
 * <p>Returns one {@link AdvisorResponse} per advisor, in roster order, whatever order the
 * calls finished in. A failed or timed-out advisor yields an empty response.
 */
public final class ResponseCollector {

    static final String STAGE = "stage1";

    private static final Logger log = LoggerFactory.getLogger(ResponseCollector.class);

    private final AdvisorInvoker invoker;
    private final SystemPromptLoader promptLoader;
    private final Duration timeout;

    public ResponseCollector(AdvisorInvoker invoker, SystemPromptLoader promptLoader, Duration timeout) {
        this.invoker = invoker;
        this.promptLoader = promptLoader != null ? promptLoader : SystemPromptLoader.NONE;
        this.timeout = timeout;
    }

    public List<AdvisorResponse> collect(String question, List<AdvisorSpec> advisors) {
        List<ChatMessage> messages = List.of(ChatMessage.user(question));

        List<CompletableFuture<GatewayResponse>> calls = new ArrayList<>(advisors.size());
        for (AdvisorSpec advisor : advisors) {
            String systemPrompt = PromptResolver.resolve(promptLoader, advisor.name(), advisor.promptFile());
            calls.add(invoker.invoke(STAGE, advisor.name(), advisor.model(), messages, systemPrompt, timeout));
        }

        List<GatewayResponse> outcomes = AdvisorInvoker.joinAll(calls);

        List<AdvisorResponse> responses = new ArrayList<>(advisors.size());
        for (int i = 0; i < advisors.size(); i++) {
            String text = ResponseSanitizer.clean(outcomes.get(i).contentOrEmpty());
            responses.add(new AdvisorResponse(advisors.get(i).name(), text));
        }

        long answered = responses.stream().filter(r -> !r.isEmpty()).count();
        log.info("Stage 1 collected: advisors={}, answered={}", advisors.size(), answered);
        return responses;
    }
}
