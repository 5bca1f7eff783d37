package fr.lapetina.ollama.council.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Stage 1 answer of one advisor.
 *
 * @param model    the advisor identity (its name within the roster)
 * @param response sanitized answer; empty when the advisor could not be reached
 */
public record AdvisorResponse(String model, String response) {

    public AdvisorResponse {
        Objects.requireNonNull(model, "Model is required");
        if (response == null) {
            response = "";
        }
    }

    @JsonIgnore
    public boolean isEmpty() {
        return response.isBlank();
    }

    public static AdvisorResponse empty(String model) {
        return new AdvisorResponse(model, "");
    }
}
