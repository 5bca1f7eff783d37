package fr.lapetina.ollama.council.domain.event;

/**
 * Lifecycle state of one deliberation.
 */
public enum DeliberationState {
    /** Request accepted, preconditions not yet checked */
    NOT_STARTED,

    /** Stage 1 fan-out in progress */
    STAGE1_RUNNING,

    /** All Stage 1 calls joined */
    STAGE1_DONE,

    /** Stage 2 fan-out in progress */
    STAGE2_RUNNING,

    /** All Stage 2 calls joined and aggregated */
    STAGE2_DONE,

    /** Chairman call in progress */
    STAGE3_RUNNING,

    /** Final answer produced and handed off */
    COMPLETE,

    /** Stopped by a fault that is not a single advisor failing */
    ERRORED;

    public boolean isRunning() {
        return this == STAGE1_RUNNING || this == STAGE2_RUNNING || this == STAGE3_RUNNING;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERRORED;
    }
}
