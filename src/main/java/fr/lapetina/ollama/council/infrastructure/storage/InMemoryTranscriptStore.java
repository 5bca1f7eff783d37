package fr.lapetina.ollama.council.infrastructure.storage;

import fr.lapetina.ollama.council.domain.model.DeliberationTranscript;
import fr.lapetina.ollama.council.domain.port.TranscriptSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the most recent transcripts in memory, newest first. Once full, the oldest
 * transcript is dropped for each new one. Thread-safe.
 */
public final class InMemoryTranscriptStore implements TranscriptSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTranscriptStore.class);

    private final int capacity;
    private final Deque<DeliberationTranscript> transcripts;

    public InMemoryTranscriptStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.transcripts = new ArrayDeque<>(capacity);
    }

    @Override
    public synchronized void store(DeliberationTranscript transcript) {
        if (transcripts.size() == capacity) {
            DeliberationTranscript evicted = transcripts.removeLast();
            log.debug("Transcript evicted: id={}", evicted.id());
        }
        transcripts.addFirst(transcript);
        log.debug("Transcript stored: id={}, stored={}", transcript.id(), transcripts.size());
    }

    public synchronized List<DeliberationTranscript> list() {
        return List.copyOf(transcripts);
    }

    public synchronized Optional<DeliberationTranscript> get(String id) {
        return transcripts.stream()
                .filter(t -> t.id().equals(id))
                .findFirst();
    }

    public synchronized int size() {
        return transcripts.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
