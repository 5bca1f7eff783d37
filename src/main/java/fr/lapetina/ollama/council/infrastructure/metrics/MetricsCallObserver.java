package fr.lapetina.ollama.council.infrastructure.metrics;

import fr.lapetina.ollama.council.domain.event.DeliberationState;
import fr.lapetina.ollama.council.domain.model.GatewayResponse;
import fr.lapetina.ollama.council.domain.port.AdvisorCallObserver;
import fr.lapetina.ollama.council.domain.port.DeliberationObserver;

import java.time.Duration;

/**
 * Feeds pipeline callbacks into the {@link MetricsRegistry}.
 */
public final class MetricsCallObserver implements AdvisorCallObserver, DeliberationObserver {

    private final MetricsRegistry metrics;

    public MetricsCallObserver(MetricsRegistry metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onCallCompleted(String stage, String advisor, GatewayResponse response) {
        metrics.recordModelCall(response.model(), response.errorType(), response.latency());
        if (response.isError()) {
            metrics.incrementAdvisorFailure(stage, advisor, response.errorType());
        }
    }

    @Override
    public void onDeliberationStarted(String deliberationId) {
        metrics.deliberationStarted();
    }

    @Override
    public void onStageCompleted(String stage, Duration elapsed) {
        metrics.recordStageLatency(stage, elapsed);
    }

    @Override
    public void onDeliberationFinished(String deliberationId, DeliberationState finalState, Duration elapsed) {
        metrics.deliberationFinished(finalState.name());
    }
}
