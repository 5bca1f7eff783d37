package fr.lapetina.ollama.council.pipeline;

import fr.lapetina.ollama.council.domain.model.AdvisorResponse;
import fr.lapetina.ollama.council.domain.model.AggregateRankingEntry;
import fr.lapetina.ollama.council.domain.model.Label;
import fr.lapetina.ollama.council.domain.model.LabelMap;
import fr.lapetina.ollama.council.domain.model.RankingEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RankAggregatorTest {

    private static final Label A = Label.ofLetters("A");
    private static final Label B = Label.ofLetters("B");
    private static final Label C = Label.ofLetters("C");
    private static final Label Z = Label.ofLetters("Z");

    private static LabelMap labels(String... models) {
        return LabelMap.assign(Arrays.stream(models)
                .map(model -> new AdvisorResponse(model, "answer"))
                .toList());
    }

    private static RankingEntry ranking(String model, Label... labels) {
        return new RankingEntry(model, "", List.of(labels));
    }

    @Test
    @DisplayName("should average 1-based positions across rankings")
    void shouldAveragePositions() {
        LabelMap map = labels("x", "y");
        List<RankingEntry> entries = List.of(
                ranking("x", A, B),
                ranking("y", B, A)
        );

        List<AggregateRankingEntry> result = RankAggregator.aggregate(entries, map);

        assertThat(result).containsExactly(
                new AggregateRankingEntry("x", 1.5, 2),
                new AggregateRankingEntry("y", 1.5, 2)
        );
    }

    @Test
    @DisplayName("should sort ascending by average and keep Stage 1 order on ties")
    void shouldSortAndBreakTiesByStageOneOrder() {
        LabelMap map = labels("alpha", "beta", "gamma");
        List<RankingEntry> entries = List.of(
                ranking("alpha", C, A, B),
                ranking("beta", A, C, B)
        );

        List<AggregateRankingEntry> result = RankAggregator.aggregate(entries, map);

        assertThat(result).extracting(AggregateRankingEntry::model)
                .containsExactly("alpha", "gamma", "beta");
        assertThat(result.get(2).averageRank()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("should add no votes for an empty ranking")
    void shouldIgnoreEmptyRankings() {
        LabelMap map = labels("x", "y");
        List<RankingEntry> entries = List.of(
                ranking("x", B, A),
                RankingEntry.empty("y")
        );

        List<AggregateRankingEntry> result = RankAggregator.aggregate(entries, map);

        assertThat(result).containsExactly(
                new AggregateRankingEntry("y", 1.0, 1),
                new AggregateRankingEntry("x", 2.0, 1)
        );
    }

    @Test
    @DisplayName("should not change averages when an empty ranking is added")
    void shouldNotShiftAveragesForEmptyRanking() {
        LabelMap map = labels("x", "y", "z");
        List<RankingEntry> rankings = List.of(ranking("x", C, A, B), ranking("y", A, B, C));
        List<RankingEntry> withEmpty = List.of(ranking("x", C, A, B), RankingEntry.empty("z"), ranking("y", A, B, C));

        assertThat(RankAggregator.aggregate(withEmpty, map)).isEqualTo(RankAggregator.aggregate(rankings, map));
    }

    @Test
    @DisplayName("should leave out answers nobody ranked")
    void shouldLeaveOutUnrankedAnswers() {
        LabelMap map = labels("x", "y", "z");

        List<AggregateRankingEntry> result = RankAggregator.aggregate(List.of(ranking("x", B)), map);

        assertThat(result).containsExactly(new AggregateRankingEntry("y", 1.0, 1));
    }

    @Test
    @DisplayName("should skip unknown labels but keep their position")
    void shouldSkipUnknownLabels() {
        LabelMap map = labels("x", "y");

        List<AggregateRankingEntry> result = RankAggregator.aggregate(List.of(ranking("x", Z, A, B)), map);

        assertThat(result).containsExactly(
                new AggregateRankingEntry("x", 2.0, 1),
                new AggregateRankingEntry("y", 3.0, 1)
        );
    }

    @Test
    @DisplayName("should return empty when there is nothing to aggregate")
    void shouldReturnEmptyForNoInput() {
        assertThat(RankAggregator.aggregate(List.of(), LabelMap.empty())).isEmpty();
    }

    @Test
    @DisplayName("should give the same result for the same input")
    void shouldBePure() {
        LabelMap map = labels("x", "y", "z");
        List<RankingEntry> entries = List.of(ranking("x", C, B, A), ranking("y", B, C, A));

        assertThat(RankAggregator.aggregate(entries, map))
                .isEqualTo(RankAggregator.aggregate(entries, map));
    }
}
