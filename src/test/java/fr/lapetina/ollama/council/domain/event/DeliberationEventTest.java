package fr.lapetina.ollama.council.domain.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.ollama.council.domain.model.AdvisorResponse;
import fr.lapetina.ollama.council.domain.model.AggregateRankingEntry;
import fr.lapetina.ollama.council.domain.model.Label;
import fr.lapetina.ollama.council.domain.model.LabelMap;
import fr.lapetina.ollama.council.domain.model.RankingEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DeliberationEventTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("should serialize stage1_complete with the answers as data")
    void shouldSerializeStage1() throws Exception {
        DeliberationEvent event = DeliberationEvent.stage1Complete(List.of(new AdvisorResponse("Alice", "Hi")));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(event));

        assertThat(json.get("type").asText()).isEqualTo("stage1_complete");
        assertThat(json.get("data").get(0).get("model").asText()).isEqualTo("Alice");
        assertThat(json.get("data").get(0).get("response").asText()).isEqualTo("Hi");
        assertThat(json.has("metadata")).isFalse();
        assertThat(json.has("message")).isFalse();
    }

    @Test
    @DisplayName("should serialize stage2_complete with labels and aggregate as metadata")
    void shouldSerializeStage2() throws Exception {
        LabelMap labels = LabelMap.assign(List.of(new AdvisorResponse("Alice", "Hi")));
        DeliberationEvent event = DeliberationEvent.stage2Complete(
                List.of(new RankingEntry("Alice", "FINAL RANKING:\n1. Response A", List.of(Label.ofIndex(0)))),
                labels,
                List.of(new AggregateRankingEntry("Alice", 1.0, 1)));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(event));

        assertThat(json.get("data").get(0).get("parsed_ranking").get(0).asText()).isEqualTo("Response A");
        assertThat(json.get("metadata").get("label_to_model").get("Response A").asText()).isEqualTo("Alice");
        JsonNode aggregate = json.get("metadata").get("aggregate_rankings").get(0);
        assertThat(aggregate.get("average_rank").asDouble()).isEqualTo(1.0);
        assertThat(aggregate.get("rankings_count").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("should serialize error events with a message")
    void shouldSerializeError() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(DeliberationEvent.error(null)));

        assertThat(json.get("type").asText()).isEqualTo("error");
        assertThat(json.get("message").asText()).isEqualTo("Unknown error");
        assertThat(DeliberationEvent.error(null).type().isTerminal()).isTrue();
    }

    @Test
    @DisplayName("should serialize title_complete with the title in data")
    void shouldSerializeTitle() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(DeliberationEvent.titleComplete("Sky Color")));

        assertThat(json.get("type").asText()).isEqualTo("title_complete");
        assertThat(json.get("data").get("title").asText()).isEqualTo("Sky Color");
    }
}
