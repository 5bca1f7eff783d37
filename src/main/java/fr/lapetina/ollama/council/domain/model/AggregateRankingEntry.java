package fr.lapetina.ollama.council.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mean peer-assigned position of one advisor's answer. Lower is better.
 * Derived from a set of {@link RankingEntry} and a {@link LabelMap}; never stored on its own.
 */
public record AggregateRankingEntry(
        String model,
        @JsonProperty("average_rank") double averageRank,
        @JsonProperty("rankings_count") int votes
) {
}
