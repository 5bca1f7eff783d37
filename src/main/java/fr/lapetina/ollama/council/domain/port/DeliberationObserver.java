package fr.lapetina.ollama.council.domain.port;

import fr.lapetina.ollama.council.domain.event.DeliberationState;

import java.time.Duration;

/**
 * Lifecycle hooks of whole deliberations, for metrics. Called on the deliberating thread.
 */
public interface DeliberationObserver {

    /** Observer that ignores everything. */
    DeliberationObserver NONE = new DeliberationObserver() { };

    default void onDeliberationStarted(String deliberationId) {
    }

    default void onStageCompleted(String stage, Duration elapsed) {
    }

    /**
     * @param finalState {@code COMPLETE} or {@code ERRORED}
     */
    default void onDeliberationFinished(String deliberationId, DeliberationState finalState, Duration elapsed) {
    }
}
