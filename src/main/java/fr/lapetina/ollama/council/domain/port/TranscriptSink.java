package fr.lapetina.ollama.council.domain.port;

import fr.lapetina.ollama.council.domain.model.DeliberationTranscript;

/**
 * Receives the outputs of each deliberation as one unit. What happens next is up to
 * the implementation.
 */
@FunctionalInterface
public interface TranscriptSink {

    /** Sink that keeps nothing. */
    TranscriptSink NONE = transcript -> { };

    void store(DeliberationTranscript transcript);
}
