package fr.lapetina.ollama.council.domain.model;

import java.util.Objects;

/**
 * One council member: a model plus the persona it speaks with.
 *
 * @param id          stable identifier, used for file names and metrics tags
 * @param name        display name; the advisor's identity inside a deliberation
 * @param model       model identifier understood by the gateway
 * @param promptFile  opaque reference resolved by a {@code SystemPromptLoader}, may be null
 * @param description free text shown to users, may be null
 */
public record AdvisorSpec(
        String id,
        String name,
        String model,
        String promptFile,
        String description
) {
    public AdvisorSpec {
        Objects.requireNonNull(name, "Advisor name is required");
        Objects.requireNonNull(model, "Advisor model is required");
        if (id == null || id.isBlank()) {
            id = name.toLowerCase().replaceAll("[^a-z0-9]+", "_");
        }
    }

    public static AdvisorSpec of(String name, String model) {
        return new AdvisorSpec(null, name, model, null, null);
    }

    public static AdvisorSpec of(String name, String model, String promptFile) {
        return new AdvisorSpec(null, name, model, promptFile, null);
    }
}
