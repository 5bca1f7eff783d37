package fr.lapetina.ollama.council.domain.port;

/**
 * Resolves an advisor's opaque prompt reference into system prompt text.
 */
@FunctionalInterface
public interface SystemPromptLoader {

    /** Loader that never supplies a system prompt. */
    SystemPromptLoader NONE = reference -> "";

    /**
     * @param reference prompt reference from the advisor configuration, may be null
     * @return the prompt text, or an empty string when there is none
     */
    String load(String reference);
}
