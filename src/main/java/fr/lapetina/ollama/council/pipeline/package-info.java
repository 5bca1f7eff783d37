/**
 * The three-stage deliberation engine.
 *
 * <h2>Stages</h2>
 * <pre>
 * Stage 1 (ResponseCollector) → Stage 2 (RankingCollector + RankAggregator) → Stage 3 (Synthesizer)
 * </pre>
 * Stage 1 and Stage 2 fan out one call per advisor over {@code CompletableFuture} and join
 * all of them before moving on; results are put back in roster order at join time.
 * A title can be generated alongside ({@link fr.lapetina.ollama.council.pipeline.TitleGenerator}).
 *
 * <h2>Failure model</h2>
 * A single advisor failing, timing out or answering garbage degrades that advisor's result to
 * empty and is reported to the {@link fr.lapetina.ollama.council.domain.port.AdvisorCallObserver}.
 * Only invalid requests and orchestration faults raise
 * {@link fr.lapetina.ollama.council.pipeline.exception.DeliberationException}.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ollama.council.pipeline.CouncilPipeline} - orchestrator and state machine</li>
 *   <li>{@link fr.lapetina.ollama.council.pipeline.RankingParser} - reads the {@code FINAL RANKING:} protocol</li>
 *   <li>{@link fr.lapetina.ollama.council.pipeline.ResponseSanitizer} - strips reasoning blocks</li>
 * </ul>
 */
package fr.lapetina.ollama.council.pipeline;
