package fr.lapetina.ollama.council.infrastructure.metrics;

import fr.lapetina.ollama.council.domain.event.DeliberationState;
import fr.lapetina.ollama.council.domain.model.ErrorType;
import fr.lapetina.ollama.council.domain.model.GatewayResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class MetricsRegistryTest {

    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("test");
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should aggregate call totals per model and globally")
    void shouldAggregateStats() {
        metrics.recordModelCall("llama3", null, Duration.ofMillis(100));
        metrics.recordModelCall("llama3", null, Duration.ofMillis(200));
        metrics.recordModelCall("llama3", ErrorType.TIMEOUT, Duration.ofMillis(5000));
        metrics.recordModelCall("qwen", null, Duration.ofMillis(50));

        RequestStats stats = metrics.stats();

        assertThat(stats.global().totalRequests()).isEqualTo(4);
        assertThat(stats.global().failedRequests()).isEqualTo(1);
        // Failed calls do not count towards latency
        assertThat(stats.global().averageLatencyMs()).isCloseTo(116.67, offset(0.001));
        assertThat(stats.models().get("llama3"))
                .isEqualTo(new RequestStats.ModelStats(3, 1, 150.0));
        assertThat(stats.models().keySet()).containsExactly("llama3", "qwen");
    }

    @Test
    @DisplayName("should report zero averages when nothing succeeded")
    void shouldHandleNoSuccesses() {
        metrics.recordModelCall("llama3", ErrorType.UPSTREAM_ERROR, Duration.ofMillis(10));

        RequestStats stats = metrics.stats();

        assertThat(stats.global().averageLatencyMs()).isZero();
        assertThat(stats.models().get("llama3").errors()).isEqualTo(1);
    }

    @Test
    @DisplayName("should expose meters in the Prometheus scrape")
    void shouldExposeMeters() {
        metrics.recordModelCall("llama3", null, Duration.ofMillis(10));
        metrics.incrementAdvisorFailure("stage1", "Alice", ErrorType.TIMEOUT);
        metrics.recordStageLatency("stage2", Duration.ofMillis(30));
        metrics.deliberationStarted();
        metrics.deliberationFinished("COMPLETE");

        String scrape = metrics.scrape();

        assertThat(scrape)
                .contains("test_model_requests_total")
                .contains("test_advisor_failures_total")
                .contains("test_stage_latency")
                .contains("test_deliberations_total")
                .contains("test_inflight_deliberations");
        assertThat(metrics.getInFlightDeliberations()).isZero();
    }

    @Test
    @DisplayName("observer should count calls, failures and deliberations")
    void observerShouldFeedRegistry() {
        MetricsCallObserver observer = new MetricsCallObserver(metrics);

        observer.onDeliberationStarted("d1");
        assertThat(metrics.getInFlightDeliberations()).isEqualTo(1);

        observer.onCallCompleted("stage1", "Alice", GatewayResponse.success("llama3", "hi", Duration.ofMillis(20)));
        observer.onCallCompleted("stage1", "Bob",
                GatewayResponse.failure("qwen", ErrorType.TRANSPORT_ERROR, "refused", Duration.ofMillis(5)));
        observer.onStageCompleted("stage1", Duration.ofMillis(25));
        observer.onDeliberationFinished("d1", DeliberationState.COMPLETE, Duration.ofMillis(100));

        assertThat(metrics.getInFlightDeliberations()).isZero();
        assertThat(metrics.stats().global().totalRequests()).isEqualTo(2);
        assertThat(metrics.getRegistry().get("test_advisor_failures_total")
                .tag("advisor", "Bob").tag("type", "TRANSPORT_ERROR").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("test_deliberations_total")
                .tag("outcome", "COMPLETE").counter().count()).isEqualTo(1.0);
    }
}
