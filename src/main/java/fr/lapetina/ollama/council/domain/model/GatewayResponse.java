package fr.lapetina.ollama.council.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a single model gateway call: either generated content or a classified failure.
 * Immutable and thread-safe.
 */
public record GatewayResponse(
        String model,
        String content,
        ErrorType errorType,
        String errorMessage,
        Duration latency
) {
    public GatewayResponse {
        Objects.requireNonNull(model, "Model is required");
        if (latency == null) {
            latency = Duration.ZERO;
        }
        if (errorType == null && content == null) {
            content = "";
        }
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    /**
     * Returns the generated text, or an empty string for failed calls.
     */
    public String contentOrEmpty() {
        return content != null ? content : "";
    }

    /**
     * Creates a successful response.
     */
    public static GatewayResponse success(String model, String content, Duration latency) {
        return new GatewayResponse(model, content, null, null, latency);
    }

    /**
     * Creates a failed response.
     */
    public static GatewayResponse failure(String model, ErrorType errorType, String errorMessage, Duration latency) {
        Objects.requireNonNull(errorType, "Error type is required for a failure");
        return new GatewayResponse(model, null, errorType, errorMessage, latency);
    }
}
