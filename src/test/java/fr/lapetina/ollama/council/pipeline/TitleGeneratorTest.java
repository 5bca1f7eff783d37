package fr.lapetina.ollama.council.pipeline;

import fr.lapetina.ollama.council.domain.model.ErrorType;
import fr.lapetina.ollama.council.domain.port.AdvisorCallObserver;
import fr.lapetina.ollama.council.integration.StubModelGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TitleGeneratorTest {

    private StubModelGateway gateway;
    private TitleGenerator generator;

    @BeforeEach
    void setUp() {
        gateway = new StubModelGateway();
        generator = new TitleGenerator(new AdvisorInvoker(gateway, AdvisorCallObserver.NONE),
                "title-model", Duration.ofMillis(300));
    }

    @Test
    @DisplayName("should generate a title from the title model")
    void shouldGenerateTitle() {
        assertThat(generator.generate("Why is the sky blue?").join()).isEqualTo(StubModelGateway.DEFAULT_TITLE);

        StubModelGateway.Call call = gateway.callsTo("title-model").get(0);
        assertThat(call.userMessage()).contains("Question: Why is the sky blue?");
        assertThat(call.systemPrompt()).isNull();
    }

    @Test
    @DisplayName("should fall back when the title call fails or hangs")
    void shouldFallBack() {
        gateway.fail("title-model", ErrorType.TRANSPORT_ERROR);
        assertThat(generator.generate("Q").join()).isEqualTo(TitleGenerator.FALLBACK_TITLE);

        gateway.reset();
        gateway.hang("title-model");
        assertThat(generator.generate("Q").join()).isEqualTo(TitleGenerator.FALLBACK_TITLE);
    }

    @Test
    @DisplayName("should strip quotes and keep the first line")
    void shouldNormalize() {
        assertThat(TitleGenerator.normalize("\"Sky Color Physics\"")).isEqualTo("Sky Color Physics");
        assertThat(TitleGenerator.normalize("<think>short</think>Rayleigh Scattering\nExplained below"))
                .isEqualTo("Rayleigh Scattering");
        assertThat(TitleGenerator.normalize("  '' ")).isEqualTo(TitleGenerator.FALLBACK_TITLE);
        assertThat(TitleGenerator.normalize("'What's Rayleigh Scattering'")).isEqualTo("What's Rayleigh Scattering");
        assertThat(TitleGenerator.normalize("\" Newton's Laws \"")).isEqualTo("Newton's Laws");
        assertThat(TitleGenerator.normalize(null)).isEqualTo(TitleGenerator.FALLBACK_TITLE);
    }

    @Test
    @DisplayName("should truncate long titles to 50 characters")
    void shouldTruncate() {
        String title = TitleGenerator.normalize("A".repeat(80));

        assertThat(title).hasSize(TitleGenerator.MAX_LENGTH).endsWith("...");
        assertThat(TitleGenerator.normalize("B".repeat(50))).isEqualTo("B".repeat(50));
    }
}
