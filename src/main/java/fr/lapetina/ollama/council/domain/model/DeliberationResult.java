package fr.lapetina.ollama.council.domain.model;

import fr.lapetina.ollama.council.domain.event.DeliberationState;

import java.util.List;
import java.util.Objects;

/**
 * Everything one deliberation produced. Returned to the caller once the pipeline stops,
 * whether it reached {@link DeliberationState#COMPLETE} or stopped after Stage 3 failed.
 */
public record DeliberationResult(
        String id,
        String question,
        String title,
        List<AdvisorResponse> stage1,
        List<RankingEntry> stage2,
        LabelMap labelMap,
        List<AggregateRankingEntry> aggregateRankings,
        SynthesisResult stage3,
        DeliberationState state
) {
    public DeliberationResult {
        Objects.requireNonNull(id, "Deliberation ID is required");
        Objects.requireNonNull(state, "State is required");
        stage1 = stage1 != null ? List.copyOf(stage1) : List.of();
        stage2 = stage2 != null ? List.copyOf(stage2) : List.of();
        aggregateRankings = aggregateRankings != null ? List.copyOf(aggregateRankings) : List.of();
        if (labelMap == null) {
            labelMap = LabelMap.empty();
        }
    }

    public boolean isComplete() {
        return state == DeliberationState.COMPLETE;
    }

    public DeliberationTranscript toTranscript() {
        return DeliberationTranscript.of(id, question, title, stage1, stage2, stage3);
    }
}
