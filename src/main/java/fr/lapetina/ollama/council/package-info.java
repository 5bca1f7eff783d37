/**
 * Ollama Council - several local models answer a question, rank each other's answers
 * anonymously, and a chairman model writes the final answer.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ollama.council.CouncilFactory} - Builds a fully-wired pipeline from
 *       YAML configuration</li>
 *   <li>{@link fr.lapetina.ollama.council.CouncilApplication} - Standalone HTTP server with
 *       JSON and Server-Sent Events endpoints</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (CouncilFactory factory = CouncilFactory.create("council.yaml").start()) {
 *     DeliberationResult result = factory.getPipeline().deliberate(
 *             DeliberationRequest.of("Should we rewrite it in Rust?", factory.currentRoster()),
 *             event -> System.out.println(event.type()));
 *
 *     System.out.println(result.stage3().response());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Parallel Stage 1 answers with per-advisor timeout and failure isolation</li>
 *   <li>Blind peer ranking under anonymous labels, aggregated by mean position</li>
 *   <li>Chairman synthesis and a concurrent conversation title</li>
 *   <li>Hot-reload configuration without restart</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.ollama.council.pipeline.CouncilPipeline
 */
package fr.lapetina.ollama.council;
