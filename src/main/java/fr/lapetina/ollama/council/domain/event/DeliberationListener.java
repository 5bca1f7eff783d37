package fr.lapetina.ollama.council.domain.event;

/**
 * Receives pipeline checkpoints as they happen. Called on the thread running the
 * deliberation, one event at a time, in order.
 */
@FunctionalInterface
public interface DeliberationListener {

    /** Listener that discards every event. */
    DeliberationListener NONE = event -> { };

    void onEvent(DeliberationEvent event);
}
