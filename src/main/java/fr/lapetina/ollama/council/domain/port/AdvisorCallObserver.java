package fr.lapetina.ollama.council.domain.port;

import fr.lapetina.ollama.council.domain.model.GatewayResponse;

/**
 * Receives the outcome of every advisor and chairman call, successful or not.
 * This is the failure channel for per-advisor errors, which never reach the caller as
 * exceptions.
 */
@FunctionalInterface
public interface AdvisorCallObserver {

    /** Observer that ignores every outcome. */
    AdvisorCallObserver NONE = (stage, advisor, response) -> { };

    /**
     * @param stage    "stage1", "stage2", "stage3" or "title"
     * @param advisor  advisor identity that made the call
     * @param response outcome of the call
     */
    void onCallCompleted(String stage, String advisor, GatewayResponse response);
}
