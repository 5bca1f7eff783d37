package fr.lapetina.ollama.council.pipeline;

import fr.lapetina.ollama.council.domain.model.AdvisorResponse;
import fr.lapetina.ollama.council.domain.model.ChairmanSpec;
import fr.lapetina.ollama.council.domain.model.ErrorType;
import fr.lapetina.ollama.council.domain.model.RankingEntry;
import fr.lapetina.ollama.council.domain.model.SynthesisResult;
import fr.lapetina.ollama.council.domain.port.AdvisorCallObserver;
import fr.lapetina.ollama.council.integration.StubModelGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SynthesizerTest {

    private static final ChairmanSpec CHAIRMAN = new ChairmanSpec("Chair", "chair-model", "chairman.md");

    private StubModelGateway gateway;
    private Synthesizer synthesizer;

    @BeforeEach
    void setUp() {
        gateway = new StubModelGateway();
        synthesizer = new Synthesizer(
                new AdvisorInvoker(gateway, AdvisorCallObserver.NONE),
                reference -> "You chair the council.",
                Duration.ofSeconds(2)
        );
    }

    @Test
    @DisplayName("should give the chairman every answer and ranking by advisor name")
    void shouldBuildChairmanPrompt() {
        List<AdvisorResponse> stage1 = List.of(
                new AdvisorResponse("Alice", "Answer one"),
                AdvisorResponse.empty("Bob")
        );
        List<RankingEntry> stage2 = List.of(
                new RankingEntry("Alice", "FINAL RANKING:\n1. Response A", List.of()),
                RankingEntry.empty("Bob")
        );

        SynthesisResult result = synthesizer.synthesize("Question?", stage1, stage2, CHAIRMAN);

        assertThat(result.model()).isEqualTo("chair-model");
        assertThat(result.response()).isEqualTo("Final answer from chair-model");

        StubModelGateway.Call call = gateway.callsTo("chair-model").get(0);
        assertThat(call.systemPrompt()).isEqualTo("You chair the council.");
        assertThat(call.userMessage())
                .contains("Original Question: Question?")
                .contains("Advisor: Alice\nResponse: Answer one")
                .contains("Advisor: Bob\nResponse: (no response)")
                .contains("Advisor: Alice\nRanking: FINAL RANKING:\n1. Response A")
                .contains("Advisor: Bob\nRanking: (no ranking)");
    }

    @Test
    @DisplayName("should return an empty result when the chairman fails")
    void shouldReturnEmptyOnFailure() {
        gateway.fail("chair-model", ErrorType.TIMEOUT);

        SynthesisResult result = synthesizer.synthesize("Question?", List.of(), List.of(), CHAIRMAN);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.model()).isEqualTo("chair-model");
    }

    @Test
    @DisplayName("should sanitize the chairman's answer")
    void shouldSanitize() {
        gateway.respondWith(call -> "<think>summarize</think>The council agrees.");

        SynthesisResult result = synthesizer.synthesize("Question?", List.of(), List.of(), CHAIRMAN);

        assertThat(result.response()).isEqualTo("The council agrees.");
    }
}
