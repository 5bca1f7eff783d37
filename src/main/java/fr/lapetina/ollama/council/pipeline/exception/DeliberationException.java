package fr.lapetina.ollama.council.pipeline.exception;

/**
 * Thrown when a deliberation cannot start or cannot finish.
 *
 * This occurs when:
 * - The roster has no advisors (rejected before any model call)
 * - The question is blank (rejected before any model call)
 * - Something other than a single advisor call failed during orchestration
 *
 * A single advisor failing never raises this; it degrades that advisor's result instead.
 */
public final class DeliberationException extends RuntimeException {

    private final Reason reason;

    public DeliberationException(Reason reason) {
        super(reason.getMessage());
        this.reason = reason;
    }

    public DeliberationException(Reason reason, String details) {
        super(reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public DeliberationException(Reason reason, String details, Throwable cause) {
        super(reason.getMessage() + " - " + details, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        EMPTY_ROSTER("Council has no advisors"),
        INVALID_QUESTION("Question must not be blank"),
        SYNTHESIS_FAILED("Chairman produced no synthesis"),
        ORCHESTRATION_FAILURE("Deliberation failed");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
