package fr.lapetina.ollama.council.pipeline;

import fr.lapetina.ollama.council.domain.port.SystemPromptLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up a persona prompt, treating a failing loader as "no prompt".
 */
final class PromptResolver {

    private static final Logger log = LoggerFactory.getLogger(PromptResolver.class);

    private PromptResolver() {
        // Utility class
    }

    static String resolve(SystemPromptLoader loader, String advisor, String reference) {
        if (reference == null || reference.isBlank()) {
            return "";
        }
        try {
            String prompt = loader.load(reference);
            return prompt != null ? prompt : "";
        } catch (RuntimeException e) {
            log.warn("System prompt unavailable, continuing without: advisor={}, reference={}, error={}",
                    advisor, reference, e.getMessage());
            return "";
        }
    }
}
