/**
 * Collaborators the deliberation pipeline depends on but does not implement.
 *
 * <p>The pipeline only sees these interfaces. Concrete implementations live under
 * {@code fr.lapetina.ollama.council.infrastructure} and are wired by
 * {@link fr.lapetina.ollama.council.CouncilFactory}; tests substitute stubs.
 */
package fr.lapetina.ollama.council.domain.port;
