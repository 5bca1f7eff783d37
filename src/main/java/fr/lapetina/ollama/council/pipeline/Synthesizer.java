package fr.lapetina.ollama.council.pipeline;

import fr.lapetina.ollama.council.domain.model.AdvisorResponse;
import fr.lapetina.ollama.council.domain.model.ChairmanSpec;
import fr.lapetina.ollama.council.domain.model.ChatMessage;
import fr.lapetina.ollama.council.domain.model.GatewayResponse;
import fr.lapetina.ollama.council.domain.model.RankingEntry;
import fr.lapetina.ollama.council.domain.model.SynthesisResult;
import fr.lapetina.ollama.council.domain.port.SystemPromptLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Stage 3: one call to the chairman with every answer and every ranking, attributed.
 * A failed call gives an empty result; there is no retry.
 */
public final class Synthesizer {

    static final String STAGE = "stage3";

    private static final Logger log = LoggerFactory.getLogger(Synthesizer.class);

    private final AdvisorInvoker invoker;
    private final SystemPromptLoader promptLoader;
    private final Duration timeout;

    public Synthesizer(AdvisorInvoker invoker, SystemPromptLoader promptLoader, Duration timeout) {
        this.invoker = invoker;
        this.promptLoader = promptLoader != null ? promptLoader : SystemPromptLoader.NONE;
        this.timeout = timeout;
    }

    public SynthesisResult synthesize(
            String question,
            List<AdvisorResponse> stage1,
            List<RankingEntry> stage2,
            ChairmanSpec chairman
    ) {
        List<ChatMessage> messages = List.of(ChatMessage.user(PromptTemplates.synthesis(question, stage1, stage2)));
        String systemPrompt = PromptResolver.resolve(promptLoader, chairman.name(), chairman.promptFile());

        GatewayResponse outcome = invoker
                .invoke(STAGE, chairman.name(), chairman.model(), messages, systemPrompt, timeout)
                .join();

        String text = ResponseSanitizer.clean(outcome.contentOrEmpty());
        if (text.isEmpty()) {
            log.warn("Chairman produced no synthesis: chairman={}, model={}", chairman.name(), chairman.model());
        }
        return new SynthesisResult(chairman.model(), text);
    }
}
