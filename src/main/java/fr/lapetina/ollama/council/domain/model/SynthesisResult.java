package fr.lapetina.ollama.council.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * The chairman's final answer. An empty response means Stage 3 failed.
 */
public record SynthesisResult(String model, String response) {

    public SynthesisResult {
        Objects.requireNonNull(model, "Model is required");
        if (response == null) {
            response = "";
        }
    }

    @JsonIgnore
    public boolean isEmpty() {
        return response.isBlank();
    }
}
