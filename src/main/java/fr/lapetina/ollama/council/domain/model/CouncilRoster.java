package fr.lapetina.ollama.council.domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of who sits on the council for one deliberation.
 * A roster with no advisors can be built; the pipeline refuses to run it.
 */
public record CouncilRoster(List<AdvisorSpec> advisors, ChairmanSpec chairman) {

    public CouncilRoster {
        Objects.requireNonNull(chairman, "Chairman is required");
        advisors = advisors != null ? List.copyOf(advisors) : List.of();

        Set<String> names = new HashSet<>();
        for (AdvisorSpec advisor : advisors) {
            if (!names.add(advisor.name())) {
                throw new IllegalArgumentException("Duplicate advisor name: " + advisor.name());
            }
        }
    }

    public boolean isEmpty() {
        return advisors.isEmpty();
    }

    public int size() {
        return advisors.size();
    }
}
