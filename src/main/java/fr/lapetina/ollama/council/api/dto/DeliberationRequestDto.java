package fr.lapetina.ollama.council.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.ollama.council.domain.model.CouncilRoster;
import fr.lapetina.ollama.council.pipeline.DeliberationRequest;

/**
 * Body of the deliberation endpoints: {@code {"content": "...", "generate_title": true}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeliberationRequestDto {

    private String content;

    @JsonProperty("generate_title")
    private Boolean generateTitle;

    // Getters and setters
    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public Boolean getGenerateTitle() { return generateTitle; }
    public void setGenerateTitle(Boolean generateTitle) { this.generateTitle = generateTitle; }

    /**
     * Converts to a pipeline request against the given roster.
     *
     * @param titleByDefault used when the body does not say whether to generate a title
     */
    public DeliberationRequest toDeliberationRequest(CouncilRoster roster, boolean titleByDefault) {
        boolean title = generateTitle != null ? generateTitle : titleByDefault;
        return new DeliberationRequest(content, roster, title);
    }
}
