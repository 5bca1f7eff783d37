package fr.lapetina.ollama.council.infrastructure.metrics;

import fr.lapetina.ollama.council.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Model call counters (by outcome) and latency timers per model
 * - Advisor failure counters by stage, advisor and error type
 * - Stage latency timers and deliberation counters
 * - In-flight deliberation gauge
 * - JVM and system metrics
 * - Prometheus exposition
 *
 * Also keeps plain per-model totals for the monitoring endpoint ({@link #stats()}).
 */
public final class MetricsRegistry implements AutoCloseable {

    public static final String OUTCOME_SUCCESS = "success";

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> failureCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> deliberationCounters = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, ModelTotals> modelTotals = new ConcurrentHashMap<>();

    private final AtomicInteger inFlightDeliberations = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_inflight_deliberations", inFlightDeliberations, AtomicInteger::get)
                .description("Number of deliberations currently running")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("ollama_council");
    }

    /**
     * Records one model call: outcome counter, latency timer and monitoring totals.
     *
     * @param errorType null for a successful call
     */
    public void recordModelCall(String model, ErrorType errorType, Duration latency) {
        String outcome = errorType == null ? OUTCOME_SUCCESS : errorType.name();
        requestCounters.computeIfAbsent(model + ":" + outcome, k ->
                Counter.builder(prefix + "_model_requests_total")
                        .description("Total number of model calls")
                        .tag("model", model)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        latencyTimers.computeIfAbsent(model, k ->
                Timer.builder(prefix + "_model_request_latency")
                        .description("Model call latency")
                        .tag("model", model)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);

        modelTotals.computeIfAbsent(model, k -> new ModelTotals()).record(errorType == null, latency);
    }

    /**
     * Counts an advisor whose call failed within a stage.
     */
    public void incrementAdvisorFailure(String stage, String advisor, ErrorType errorType) {
        String key = stage + ":" + advisor + ":" + errorType.name();
        failureCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_advisor_failures_total")
                        .description("Advisor calls that degraded to an empty result")
                        .tag("stage", stage)
                        .tag("advisor", advisor)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records the wall time of one pipeline stage.
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Deliberation stage latency")
                        .tag("stage", stage)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    public void deliberationStarted() {
        inFlightDeliberations.incrementAndGet();
    }

    /**
     * @param outcome final state name, e.g. {@code COMPLETE} or {@code ERRORED}
     */
    public void deliberationFinished(String outcome) {
        inFlightDeliberations.decrementAndGet();
        deliberationCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_deliberations_total")
                        .description("Total number of deliberations")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public int getInFlightDeliberations() {
        return inFlightDeliberations.get();
    }

    /**
     * Snapshot of call totals, overall and per model. Average latency counts successful
     * calls only.
     */
    public RequestStats stats() {
        long total = 0;
        long failed = 0;
        long successLatencyMs = 0;
        Map<String, RequestStats.ModelStats> models = new TreeMap<>();

        for (Map.Entry<String, ModelTotals> entry : modelTotals.entrySet()) {
            ModelTotals totals = entry.getValue();
            long count = totals.count.sum();
            long errors = totals.errors.sum();
            long latencyMs = totals.successLatencyMs.sum();

            total += count;
            failed += errors;
            successLatencyMs += latencyMs;
            models.put(entry.getKey(), new RequestStats.ModelStats(count, errors, average(latencyMs, count - errors)));
        }

        return new RequestStats(
                new RequestStats.GlobalStats(total, failed, average(successLatencyMs, total - failed)),
                models
        );
    }

    private static double average(long sumMs, long count) {
        if (count <= 0) {
            return 0.0;
        }
        return Math.round(sumMs * 100.0 / count) / 100.0;
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }

    private static final class ModelTotals {
        private final LongAdder count = new LongAdder();
        private final LongAdder errors = new LongAdder();
        private final LongAdder successLatencyMs = new LongAdder();

        void record(boolean success, Duration latency) {
            count.increment();
            if (success) {
                successLatencyMs.add(latency.toMillis());
            } else {
                errors.increment();
            }
        }
    }
}
