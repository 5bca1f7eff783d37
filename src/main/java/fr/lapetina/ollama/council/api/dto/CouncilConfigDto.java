package fr.lapetina.ollama.council.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.ollama.council.domain.model.AdvisorSpec;
import fr.lapetina.ollama.council.domain.model.CouncilRoster;

import java.util.List;

/**
 * Read-only view of the current roster.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CouncilConfigDto {

    private List<Advisor> advisors;
    private Chairman chairman;

    public List<Advisor> getAdvisors() { return advisors; }
    public void setAdvisors(List<Advisor> advisors) { this.advisors = advisors; }

    public Chairman getChairman() { return chairman; }
    public void setChairman(Chairman chairman) { this.chairman = chairman; }

    public static CouncilConfigDto fromRoster(CouncilRoster roster) {
        CouncilConfigDto dto = new CouncilConfigDto();
        dto.setAdvisors(roster.advisors().stream().map(Advisor::fromSpec).toList());
        dto.setChairman(new Chairman(roster.chairman().name(), roster.chairman().model()));
        return dto;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Advisor(
            String id,
            String name,
            String model,
            @JsonProperty("prompt_file") String promptFile,
            String description
    ) {
        static Advisor fromSpec(AdvisorSpec spec) {
            return new Advisor(spec.id(), spec.name(), spec.model(), spec.promptFile(), spec.description());
        }
    }

    public record Chairman(String name, String model) {
    }
}
