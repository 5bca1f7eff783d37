package fr.lapetina.ollama.council.infrastructure.prompt;

import fr.lapetina.ollama.council.domain.port.SystemPromptLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads persona prompts from markdown files.
 *
 * <p>A persona file looks like:
 * <pre>
 * # Marcus Aurelius
 *
 * ## System Prompt
 *
 * You are Marcus Aurelius...
 *
 * ## Background
 * ...
 * </pre>
 * Only the text of the {@code ## System Prompt} section is used, up to the next {@code ## }
 * heading. A {@code ```markdown} fence around that text is removed.
 *
 * <p>Relative references resolve against the base directory first, then against its parent.
 * Missing or unreadable files give an empty prompt; the problem is logged once per reference.
 */
public final class MarkdownPromptLoader implements SystemPromptLoader {

    static final String SECTION_HEADING = "## System Prompt";

    private static final Logger log = LoggerFactory.getLogger(MarkdownPromptLoader.class);

    private final Path baseDirectory;
    private final ConcurrentHashMap<String, Boolean> reportedMissing = new ConcurrentHashMap<>();

    public MarkdownPromptLoader(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    public MarkdownPromptLoader() {
        this(Paths.get("."));
    }

    @Override
    public String load(String reference) {
        if (reference == null || reference.isBlank()) {
            return "";
        }

        Optional<Path> file = resolve(reference);
        if (file.isEmpty()) {
            if (reportedMissing.putIfAbsent(reference, Boolean.TRUE) == null) {
                log.warn("Prompt file not found: reference={}, baseDirectory={}", reference, baseDirectory);
            }
            return "";
        }

        try {
            String content = Files.readString(file.get(), StandardCharsets.UTF_8);
            String prompt = extractSystemPrompt(content);
            if (prompt.isEmpty()) {
                log.warn("Prompt file has no system prompt section: file={}", file.get());
            }
            return prompt;
        } catch (IOException e) {
            log.warn("Failed to read prompt file: file={}, error={}", file.get(), e.getMessage());
            return "";
        }
    }

    Optional<Path> resolve(String reference) {
        Path path = Paths.get(reference);
        if (path.isAbsolute()) {
            return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
        }

        Path candidate = baseDirectory.resolve(path).normalize();
        if (Files.isRegularFile(candidate)) {
            return Optional.of(candidate);
        }

        Path parent = baseDirectory.getParent();
        if (parent != null) {
            Path fallback = parent.resolve(path).normalize();
            if (Files.isRegularFile(fallback)) {
                return Optional.of(fallback);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the trimmed body of the system prompt section, or an empty string.
     */
    static String extractSystemPrompt(String markdown) {
        String text = markdown.replace("\r\n", "\n");
        String[] lines = text.split("\n", -1);

        int start = -1;
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].strip().equals(SECTION_HEADING)) {
                start = i + 1;
                break;
            }
        }
        if (start < 0) {
            return "";
        }

        StringBuilder section = new StringBuilder();
        for (int i = start; i < lines.length; i++) {
            if (lines[i].startsWith("## ")) {
                break;
            }
            section.append(lines[i]).append('\n');
        }

        return stripFence(section.toString().strip());
    }

    private static String stripFence(String body) {
        if (!body.startsWith("```markdown")) {
            return body;
        }
        int firstNewline = body.indexOf('\n');
        if (firstNewline < 0) {
            return "";
        }
        String inner = body.substring(firstNewline + 1);
        int closing = inner.lastIndexOf("```");
        if (closing >= 0) {
            inner = inner.substring(0, closing);
        }
        return inner.strip();
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }
}
