package fr.lapetina.ollama.council.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.ollama.council.domain.model.AdvisorResponse;
import fr.lapetina.ollama.council.domain.model.AggregateRankingEntry;
import fr.lapetina.ollama.council.domain.model.DeliberationResult;
import fr.lapetina.ollama.council.domain.model.RankingEntry;
import fr.lapetina.ollama.council.domain.model.SynthesisResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Non-streaming deliberation result, in the same shape as the streamed events.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeliberationResponseDto {

    private String id;
    private String title;
    private String state;
    private List<AdvisorResponse> stage1;
    private List<RankingEntry> stage2;
    private SynthesisResult stage3;
    private Metadata metadata;

    // Getters and setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getState() { return state; }
    public void setState(String state) { this.state = state; }

    public List<AdvisorResponse> getStage1() { return stage1; }
    public void setStage1(List<AdvisorResponse> stage1) { this.stage1 = stage1; }

    public List<RankingEntry> getStage2() { return stage2; }
    public void setStage2(List<RankingEntry> stage2) { this.stage2 = stage2; }

    public SynthesisResult getStage3() { return stage3; }
    public void setStage3(SynthesisResult stage3) { this.stage3 = stage3; }

    public Metadata getMetadata() { return metadata; }
    public void setMetadata(Metadata metadata) { this.metadata = metadata; }

    public static DeliberationResponseDto fromResult(DeliberationResult result) {
        DeliberationResponseDto dto = new DeliberationResponseDto();
        dto.setId(result.id());
        dto.setTitle(result.title());
        dto.setState(result.state().name());
        dto.setStage1(result.stage1());
        dto.setStage2(result.stage2());
        dto.setStage3(result.stage3());

        Metadata metadata = new Metadata();
        metadata.setLabelToModel(result.labelMap().asMap());
        metadata.setAggregateRankings(result.aggregateRankings());
        dto.setMetadata(metadata);
        return dto;
    }

    public static class Metadata {
        @JsonProperty("label_to_model")
        private Map<String, String> labelToModel = new LinkedHashMap<>();

        @JsonProperty("aggregate_rankings")
        private List<AggregateRankingEntry> aggregateRankings = List.of();

        public Map<String, String> getLabelToModel() { return labelToModel; }
        public void setLabelToModel(Map<String, String> labelToModel) { this.labelToModel = labelToModel; }

        public List<AggregateRankingEntry> getAggregateRankings() { return aggregateRankings; }
        public void setAggregateRankings(List<AggregateRankingEntry> aggregateRankings) { this.aggregateRankings = aggregateRankings; }
    }
}
