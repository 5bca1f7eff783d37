package fr.lapetina.ollama.council.pipeline;

import fr.lapetina.ollama.council.domain.model.AggregateRankingEntry;
import fr.lapetina.ollama.council.domain.model.Label;
import fr.lapetina.ollama.council.domain.model.LabelMap;
import fr.lapetina.ollama.council.domain.model.RankingEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Combines peer rankings into one order: the mean 1-based position of each answer.
 *
 * <p>Pure function of its inputs. Labels the map cannot resolve are skipped but still take
 * up their position. Answers nobody ranked are left out. Equal averages keep Stage 1 order.
 */
public final class RankAggregator {

    private RankAggregator() {
        // Utility class
    }

    public static List<AggregateRankingEntry> aggregate(List<RankingEntry> entries, LabelMap labelMap) {
        // Pre-seeded in label order so the stable sort below breaks ties by Stage 1 order
        Map<String, List<Integer>> votes = new LinkedHashMap<>();
        for (String model : labelMap.models()) {
            votes.put(model, new ArrayList<>());
        }

        for (RankingEntry entry : entries) {
            List<Label> ranking = entry.parsedRanking();
            for (int position = 1; position <= ranking.size(); position++) {
                Optional<String> model = labelMap.resolve(ranking.get(position - 1));
                if (model.isPresent()) {
                    votes.get(model.get()).add(position);
                }
            }
        }

        List<AggregateRankingEntry> aggregate = new ArrayList<>();
        votes.forEach((model, positions) -> {
            if (!positions.isEmpty()) {
                double average = positions.stream().mapToInt(Integer::intValue).average().orElseThrow();
                aggregate.add(new AggregateRankingEntry(model, average, positions.size()));
            }
        });

        aggregate.sort(Comparator.comparingDouble(AggregateRankingEntry::averageRank));
        return List.copyOf(aggregate);
    }
}
