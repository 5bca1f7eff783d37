package fr.lapetina.ollama.council.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.ollama.council.domain.model.AdvisorResponse;
import fr.lapetina.ollama.council.domain.model.AggregateRankingEntry;
import fr.lapetina.ollama.council.domain.model.LabelMap;
import fr.lapetina.ollama.council.domain.model.RankingEntry;
import fr.lapetina.ollama.council.domain.model.SynthesisResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A progress marker emitted by the pipeline. Serializes to the streaming wire format
 * {@code {"type": "...", "data": ..., "metadata": ..., "message": ...}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeliberationEvent(
        EventType type,
        Object data,
        Map<String, Object> metadata,
        String message
) {
    public DeliberationEvent {
        Objects.requireNonNull(type, "Event type is required");
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : null;
    }

    public static DeliberationEvent stage1Start() {
        return new DeliberationEvent(EventType.STAGE1_START, null, null, null);
    }

    public static DeliberationEvent stage1Complete(List<AdvisorResponse> stage1) {
        return new DeliberationEvent(EventType.STAGE1_COMPLETE, stage1, null, null);
    }

    public static DeliberationEvent stage2Start() {
        return new DeliberationEvent(EventType.STAGE2_START, null, null, null);
    }

    public static DeliberationEvent stage2Complete(
            List<RankingEntry> stage2,
            LabelMap labelMap,
            List<AggregateRankingEntry> aggregate
    ) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("label_to_model", labelMap.asMap());
        metadata.put("aggregate_rankings", aggregate);
        return new DeliberationEvent(EventType.STAGE2_COMPLETE, stage2, metadata, null);
    }

    public static DeliberationEvent stage3Start() {
        return new DeliberationEvent(EventType.STAGE3_START, null, null, null);
    }

    public static DeliberationEvent stage3Complete(SynthesisResult stage3) {
        return new DeliberationEvent(EventType.STAGE3_COMPLETE, stage3, null, null);
    }

    public static DeliberationEvent titleComplete(String title) {
        return new DeliberationEvent(EventType.TITLE_COMPLETE, Map.of("title", title), null, null);
    }

    public static DeliberationEvent complete() {
        return new DeliberationEvent(EventType.COMPLETE, null, null, null);
    }

    public static DeliberationEvent error(String message) {
        return new DeliberationEvent(EventType.ERROR, null, null, message != null ? message : "Unknown error");
    }
}
