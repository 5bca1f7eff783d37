package fr.lapetina.ollama.council.domain.port;

import fr.lapetina.ollama.council.domain.model.ChatMessage;
import fr.lapetina.ollama.council.domain.model.GatewayResponse;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Single-call boundary to a language-model host.
 *
 * <p>Implementations should complete the returned future with a {@link GatewayResponse}
 * describing the failure rather than completing it exceptionally, but callers must not
 * rely on that: the pipeline treats an exceptional completion, a synchronous throw and a
 * future that never completes the same way, as one failed call.
 */
public interface ModelGateway {

    /**
     * Asks one model for one completion.
     *
     * @param model        model identifier
     * @param messages     conversation, oldest first
     * @param systemPrompt persona instructions, or null for none
     * @param timeout      upper bound on the whole call
     * @return future completed with the generated text or a classified failure
     */
    CompletableFuture<GatewayResponse> invoke(
            String model,
            List<ChatMessage> messages,
            String systemPrompt,
            Duration timeout
    );
}
