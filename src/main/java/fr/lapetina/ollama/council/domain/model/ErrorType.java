package fr.lapetina.ollama.council.domain.model;

/**
 * Error taxonomy for model gateway calls.
 * Every per-advisor failure is classified into one of these before it reaches
 * the pipeline, so failures can be counted and logged uniformly.
 */
public enum ErrorType {
    /** Call did not complete within the per-call timeout */
    TIMEOUT,

    /** Connection refused, reset, or other I/O failure talking to the model host */
    TRANSPORT_ERROR,

    /** Model host answered with a non-2xx status (unknown model, load failure, etc.) */
    UPSTREAM_ERROR,

    /** Model host answered 2xx but the body could not be read as a chat response */
    MALFORMED_RESPONSE,

    /** Anything else, including failures while building the request */
    INTERNAL_ERROR
}
