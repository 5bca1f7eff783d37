package fr.lapetina.ollama.council.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the deliberation pipeline.
 *
 * @param requestTimeout bound on each advisor and chairman call
 * @param titleTimeout   bound on the title call
 * @param synthesisFailurePolicy what to emit when the chairman yields nothing
 * @param titleModel     model asked for conversation titles; null means the chairman's
 */
public record PipelineSettings(
        Duration requestTimeout,
        Duration titleTimeout,
        SynthesisFailurePolicy synthesisFailurePolicy,
        String titleModel
) {
    /** Long enough for slow local inference on a laptop. */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_TITLE_TIMEOUT = Duration.ofSeconds(30);

    public PipelineSettings {
        Objects.requireNonNull(requestTimeout, "Request timeout is required");
        Objects.requireNonNull(titleTimeout, "Title timeout is required");
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("Request timeout must be positive");
        }
        if (titleTimeout.isNegative() || titleTimeout.isZero()) {
            throw new IllegalArgumentException("Title timeout must be positive");
        }
        if (titleModel != null && titleModel.isBlank()) {
            titleModel = null;
        }
        if (synthesisFailurePolicy == null) {
            synthesisFailurePolicy = SynthesisFailurePolicy.EMPTY_RESULT;
        }
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(DEFAULT_REQUEST_TIMEOUT, DEFAULT_TITLE_TIMEOUT, SynthesisFailurePolicy.EMPTY_RESULT, null);
    }

    public PipelineSettings withRequestTimeout(Duration timeout) {
        return new PipelineSettings(timeout, titleTimeout, synthesisFailurePolicy, titleModel);
    }

    public PipelineSettings withSynthesisFailurePolicy(SynthesisFailurePolicy policy) {
        return new PipelineSettings(requestTimeout, titleTimeout, policy, titleModel);
    }
}
