package fr.lapetina.ollama.council.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The unit handed to storage after each user turn: question plus the three stage outputs.
 */
public record DeliberationTranscript(
        String id,
        String question,
        String title,
        List<AdvisorResponse> stage1,
        List<RankingEntry> stage2,
        SynthesisResult stage3,
        @JsonProperty("created_at") Instant createdAt
) {
    public DeliberationTranscript {
        Objects.requireNonNull(id, "Transcript ID is required");
        stage1 = stage1 != null ? List.copyOf(stage1) : List.of();
        stage2 = stage2 != null ? List.copyOf(stage2) : List.of();
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static DeliberationTranscript of(
            String id,
            String question,
            String title,
            List<AdvisorResponse> stage1,
            List<RankingEntry> stage2,
            SynthesisResult stage3
    ) {
        return new DeliberationTranscript(id, question, title, stage1, stage2, stage3, null);
    }
}
