package fr.lapetina.ollama.council.pipeline;

import java.util.Locale;

/**
 * What the pipeline reports when the chairman call yields nothing.
 */
public enum SynthesisFailurePolicy {

    /** Emit an empty {@code stage3_complete} and finish normally. */
    EMPTY_RESULT("empty-result"),

    /** Emit {@code error} instead of {@code stage3_complete} and stop. */
    ERROR_EVENT("error-event");

    private final String configName;

    SynthesisFailurePolicy(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Resolves a configuration value, falling back to {@link #EMPTY_RESULT}.
     */
    public static SynthesisFailurePolicy fromConfig(String value) {
        if (value == null) {
            return EMPTY_RESULT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (SynthesisFailurePolicy policy : values()) {
            if (policy.configName.equals(normalized)) {
                return policy;
            }
        }
        return EMPTY_RESULT;
    }
}
