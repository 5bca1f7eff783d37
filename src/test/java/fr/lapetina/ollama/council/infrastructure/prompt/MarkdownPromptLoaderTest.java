package fr.lapetina.ollama.council.infrastructure.prompt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownPromptLoaderTest {

    private static final String PERSONA = """
            # Marcus Aurelius

            Roman emperor and stoic.

            ## System Prompt

            You are Marcus Aurelius.
            Answer calmly.

            ## Background

            Born in 121.
            """;

    @Test
    @DisplayName("should extract only the system prompt section")
    void shouldExtractSection() {
        assertThat(MarkdownPromptLoader.extractSystemPrompt(PERSONA))
                .isEqualTo("You are Marcus Aurelius.\nAnswer calmly.");
    }

    @Test
    @DisplayName("should remove a markdown fence around the prompt")
    void shouldStripFence() {
        String fenced = "## System Prompt\n\n```markdown\nYou are Seneca.\n```\n\n## Notes\nx";

        assertThat(MarkdownPromptLoader.extractSystemPrompt(fenced)).isEqualTo("You are Seneca.");
    }

    @Test
    @DisplayName("should return empty without a system prompt section")
    void shouldReturnEmptyWithoutSection() {
        assertThat(MarkdownPromptLoader.extractSystemPrompt("# Title\n\nJust prose.")).isEmpty();
    }

    @Test
    @DisplayName("should load a prompt relative to the base directory")
    void shouldLoadRelativeToBase(@TempDir Path dir) throws IOException {
        Path prompts = Files.createDirectory(dir.resolve("prompts"));
        Files.writeString(prompts.resolve("marcus.md"), PERSONA);
        MarkdownPromptLoader loader = new MarkdownPromptLoader(prompts);

        assertThat(loader.load("marcus.md")).startsWith("You are Marcus Aurelius.");
        // Same file written relative to the working directory
        assertThat(loader.load("prompts/marcus.md")).startsWith("You are Marcus Aurelius.");
    }

    @Test
    @DisplayName("should load an absolute reference")
    void shouldLoadAbsolute(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("seneca.md");
        Files.writeString(file, "## System Prompt\nYou are Seneca.");

        assertThat(new MarkdownPromptLoader(dir.resolve("elsewhere")).load(file.toString()))
                .isEqualTo("You are Seneca.");
    }

    @Test
    @DisplayName("should return empty for missing or blank references")
    void shouldReturnEmptyForMissing(@TempDir Path dir) {
        MarkdownPromptLoader loader = new MarkdownPromptLoader(dir);

        assertThat(loader.load("ghost.md")).isEmpty();
        assertThat(loader.load("ghost.md")).isEmpty();
        assertThat(loader.load(null)).isEmpty();
        assertThat(loader.load(" ")).isEmpty();
    }
}
