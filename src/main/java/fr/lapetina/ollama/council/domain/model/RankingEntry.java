package fr.lapetina.ollama.council.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Stage 2 output of one ranking advisor.
 *
 * @param model         the ranking advisor
 * @param ranking       raw evaluation text as returned by the model (sanitized)
 * @param parsedRanking labels in the advisor's order, best first; empty when parsing failed
 */
public record RankingEntry(
        String model,
        String ranking,
        @JsonProperty("parsed_ranking") List<Label> parsedRanking
) {
    public RankingEntry {
        Objects.requireNonNull(model, "Model is required");
        if (ranking == null) {
            ranking = "";
        }
        parsedRanking = parsedRanking != null ? List.copyOf(parsedRanking) : List.of();
    }

    public boolean hasParsedRanking() {
        return !parsedRanking.isEmpty();
    }

    public static RankingEntry empty(String model) {
        return new RankingEntry(model, "", List.of());
    }
}
