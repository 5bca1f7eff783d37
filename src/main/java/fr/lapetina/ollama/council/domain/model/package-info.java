/**
 * Domain model of a council deliberation.
 *
 * <p>Everything here is an immutable value: records for the stage outputs and an immutable
 * {@link fr.lapetina.ollama.council.domain.model.LabelMap}. Values are created once per stage
 * and never mutated, so they can be handed to concurrent callbacks and listeners freely.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ollama.council.domain.model.CouncilRoster} - advisors and chairman for one invocation</li>
 *   <li>{@link fr.lapetina.ollama.council.domain.model.AdvisorResponse} - Stage 1 answer</li>
 *   <li>{@link fr.lapetina.ollama.council.domain.model.RankingEntry} - Stage 2 peer ranking</li>
 *   <li>{@link fr.lapetina.ollama.council.domain.model.AggregateRankingEntry} - derived mean rank</li>
 *   <li>{@link fr.lapetina.ollama.council.domain.model.SynthesisResult} - Stage 3 answer</li>
 *   <li>{@link fr.lapetina.ollama.council.domain.model.GatewayResponse} - success/failure of one model call</li>
 * </ul>
 */
package fr.lapetina.ollama.council.domain.model;
