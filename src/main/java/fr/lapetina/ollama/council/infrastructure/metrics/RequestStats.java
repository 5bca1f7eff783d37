package fr.lapetina.ollama.council.infrastructure.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Model call totals served by the monitoring endpoint.
 */
public record RequestStats(
        @JsonProperty("global") GlobalStats global,
        @JsonProperty("models") Map<String, ModelStats> models
) {
    public RequestStats {
        models = models != null ? Collections.unmodifiableMap(new LinkedHashMap<>(models)) : Map.of();
    }

    public record GlobalStats(
            @JsonProperty("total_requests") long totalRequests,
            @JsonProperty("failed_requests") long failedRequests,
            @JsonProperty("average_latency_ms") double averageLatencyMs
    ) {
    }

    public record ModelStats(
            @JsonProperty("count") long count,
            @JsonProperty("errors") long errors,
            @JsonProperty("average_latency_ms") double averageLatencyMs
    ) {
    }
}
