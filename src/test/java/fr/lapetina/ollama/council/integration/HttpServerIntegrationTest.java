package fr.lapetina.ollama.council.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.ollama.council.api.HttpServer;
import fr.lapetina.ollama.council.domain.model.ErrorType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerIntegrationTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();

    private TestCouncilFactory factory;
    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        factory = TestCouncilFactory.create();
        server = new HttpServer(0, 10, factory);
        server.start();
        baseUrl = "http://localhost:" + server.getPort();
    }

    @AfterEach
    void tearDown() {
        server.close();
        factory.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("should answer a deliberation with all stages and metadata")
    void shouldDeliberate() throws Exception {
        HttpResponse<String> response = post("/api/council/deliberate",
                "{\"content\":\"What is 2+2?\",\"generate_title\":true}");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode json = mapper.readTree(response.body());
        assertThat(json.get("state").asText()).isEqualTo("COMPLETE");
        assertThat(json.get("title").asText()).isEqualTo(StubModelGateway.DEFAULT_TITLE);
        assertThat(json.get("stage1").size()).isEqualTo(2);
        assertThat(json.get("stage1").get(0).get("model").asText()).isEqualTo("Alpha");
        assertThat(json.get("stage2").get(0).get("parsed_ranking").get(0).asText()).isEqualTo("Response A");
        assertThat(json.get("stage3").get("response").asText()).isEqualTo("Final answer from model-chair");
        assertThat(json.get("metadata").get("label_to_model").get("Response B").asText()).isEqualTo("Beta");
        assertThat(json.get("metadata").get("aggregate_rankings").get(0).get("model").asText()).isEqualTo("Alpha");
    }

    @Test
    @DisplayName("should stream events as Server-Sent Events in order")
    void shouldStreamEvents() throws Exception {
        HttpResponse<String> response = post("/api/council/deliberate/stream", "{\"content\":\"Why?\"}");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).contains("text/event-stream");

        List<String> types = new ArrayList<>();
        for (String frame : response.body().split("\n\n")) {
            if (frame.startsWith("data: ")) {
                types.add(mapper.readTree(frame.substring("data: ".length())).get("type").asText());
            }
        }
        assertThat(types).containsExactly(
                "stage1_start", "stage1_complete", "stage2_start", "stage2_complete",
                "stage3_start", "stage3_complete", "title_complete", "complete");
    }

    @Test
    @DisplayName("should reject a request without content")
    void shouldRejectMissingContent() throws Exception {
        assertThat(post("/api/council/deliberate", "{\"content\":\"  \"}").statusCode()).isEqualTo(400);
        assertThat(post("/api/council/deliberate", "not json").statusCode()).isEqualTo(400);
        assertThat(get("/api/council/deliberate").statusCode()).isEqualTo(405);
        assertThat(factory.getStubGateway().callCount()).isZero();
    }

    @Test
    @DisplayName("should reject a deliberation when the roster is empty")
    void shouldRejectEmptyRoster() throws Exception {
        String yaml = "chairman:\n  model: model-chair\n";
        factory.getConfigLoader().loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        HttpResponse<String> response = post("/api/council/deliberate", "{\"content\":\"Anyone?\"}");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(response.body()).get("error").asText()).contains("no advisors");
        assertThat(factory.getStubGateway().callCount()).isZero();
    }

    @Test
    @DisplayName("should still answer when every advisor fails")
    void shouldAnswerWhenAdvisorsFail() throws Exception {
        factory.getStubGateway().fail("model-a", ErrorType.TIMEOUT).fail("model-b", ErrorType.TRANSPORT_ERROR);

        HttpResponse<String> response = post("/api/council/deliberate", "{\"content\":\"Q\",\"generate_title\":false}");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode json = mapper.readTree(response.body());
        assertThat(json.get("stage1").get(0).get("response").asText()).isEmpty();
        assertThat(json.get("stage2").size()).isZero();
        assertThat(json.has("title")).isFalse();
    }

    @Test
    @DisplayName("should list and fetch stored transcripts")
    void shouldServeTranscripts() throws Exception {
        JsonNode result = mapper.readTree(post("/api/council/deliberate", "{\"content\":\"Remember me\"}").body());
        String id = result.get("id").asText();

        JsonNode list = mapper.readTree(get("/api/transcripts").body());
        assertThat(list.size()).isEqualTo(1);
        assertThat(list.get(0).get("question").asText()).isEqualTo("Remember me");

        HttpResponse<String> one = get("/api/transcripts/" + id);
        assertThat(one.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(one.body()).get("stage3").get("response").asText()).isNotEmpty();

        assertThat(get("/api/transcripts/unknown").statusCode()).isEqualTo(404);
    }

    @Test
    @DisplayName("should expose health, roster, metrics and monitoring")
    void shouldExposeOperationalEndpoints() throws Exception {
        JsonNode health = mapper.readTree(get("/health").body());
        assertThat(health.get("status").asText()).isEqualTo("UP");
        assertThat(health.get("advisors").asInt()).isEqualTo(2);

        JsonNode config = mapper.readTree(get("/api/council/config").body());
        assertThat(config.get("advisors").get(1).get("model").asText()).isEqualTo("model-b");
        assertThat(config.get("chairman").get("model").asText()).isEqualTo("model-chair");

        post("/api/council/deliberate", "{\"content\":\"Q\"}");
        HttpResponse<String> metrics = get("/metrics");
        assertThat(metrics.statusCode()).isEqualTo(200);
        assertThat(metrics.body()).contains("test_council_model_requests_total");

        // The test configuration points at an address where nothing listens
        JsonNode monitoring = mapper.readTree(get("/api/monitoring").body());
        assertThat(monitoring.get("status").get("service").asText()).isEqualTo("offline");
        assertThat(monitoring.get("stats").get("global").get("total_requests").asLong()).isPositive();

        JsonNode models = mapper.readTree(get("/api/models").body());
        assertThat(models.get("models").size()).isZero();
    }
}
