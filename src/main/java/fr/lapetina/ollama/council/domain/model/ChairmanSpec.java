package fr.lapetina.ollama.council.domain.model;

import java.util.Objects;

/**
 * The advisor whose model writes the final synthesized answer.
 */
public record ChairmanSpec(String name, String model, String promptFile) {

    public ChairmanSpec {
        Objects.requireNonNull(model, "Chairman model is required");
        if (name == null || name.isBlank()) {
            name = "Chairman";
        }
    }

    public static ChairmanSpec of(String model) {
        return new ChairmanSpec(null, model, null);
    }
}
