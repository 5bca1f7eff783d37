package fr.lapetina.ollama.council.pipeline;

import fr.lapetina.ollama.council.domain.event.DeliberationEvent;
import fr.lapetina.ollama.council.domain.event.DeliberationListener;
import fr.lapetina.ollama.council.domain.event.DeliberationState;
import fr.lapetina.ollama.council.domain.model.AdvisorResponse;
import fr.lapetina.ollama.council.domain.model.AggregateRankingEntry;
import fr.lapetina.ollama.council.domain.model.CouncilRoster;
import fr.lapetina.ollama.council.domain.model.DeliberationResult;
import fr.lapetina.ollama.council.domain.model.SynthesisResult;
import fr.lapetina.ollama.council.domain.port.AdvisorCallObserver;
import fr.lapetina.ollama.council.domain.port.DeliberationObserver;
import fr.lapetina.ollama.council.domain.port.ModelGateway;
import fr.lapetina.ollama.council.domain.port.SystemPromptLoader;
import fr.lapetina.ollama.council.domain.port.TranscriptSink;
import fr.lapetina.ollama.council.pipeline.exception.DeliberationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Runs one deliberation: Stage 1 answers, Stage 2 blind peer ranking, aggregation,
 * Stage 3 chairman synthesis, plus an optional title generated alongside.
 *
 * <p>State machine:
 * <pre>
 * NOT_STARTED → STAGE1_RUNNING → STAGE1_DONE → STAGE2_RUNNING → STAGE2_DONE → STAGE3_RUNNING → COMPLETE
 *                      any running state ──────────────────────────────────────────────────→ ERRORED
 * </pre>
 *
 * <p>Events go to the {@link DeliberationListener} in order, on the calling thread:
 * {@code stage1_start, stage1_complete, stage2_start, stage2_complete, stage3_start,
 * stage3_complete, [title_complete], complete}, or {@code error} as the last event.
 *
 * <p>The pipeline keeps no state between calls. Each call works on the roster it is given,
 * so one instance can serve concurrent deliberations.
 */
public final class CouncilPipeline {

    public static final String MDC_DELIBERATION_ID = "deliberationId";

    private static final Logger log = LoggerFactory.getLogger(CouncilPipeline.class);

    private final ResponseCollector responseCollector;
    private final RankingCollector rankingCollector;
    private final Synthesizer synthesizer;
    private final AdvisorInvoker invoker;
    private final TranscriptSink transcriptSink;
    private final DeliberationObserver deliberationObserver;
    private final PipelineSettings settings;

    private CouncilPipeline(Builder builder) {
        this.settings = builder.settings;
        this.invoker = new AdvisorInvoker(builder.gateway, builder.callObserver);
        this.responseCollector = new ResponseCollector(invoker, builder.promptLoader, settings.requestTimeout());
        this.rankingCollector = new RankingCollector(invoker, builder.promptLoader, settings.requestTimeout());
        this.synthesizer = new Synthesizer(invoker, builder.promptLoader, settings.requestTimeout());
        this.transcriptSink = builder.transcriptSink;
        this.deliberationObserver = builder.deliberationObserver;
    }

    /**
     * Runs the three stages for one question.
     *
     * @return the outputs; state {@code COMPLETE}, or {@code ERRORED} when the chairman
     *         failed under {@link SynthesisFailurePolicy#ERROR_EVENT}
     * @throws DeliberationException if the request is invalid or orchestration fails
     */
    public DeliberationResult deliberate(DeliberationRequest request, DeliberationListener listener) {
        Objects.requireNonNull(request, "Request is required");
        DeliberationListener events = listener != null ? listener : DeliberationListener.NONE;
        String id = UUID.randomUUID().toString();
        MDC.put(MDC_DELIBERATION_ID, id);
        try {
            checkPreconditions(request, events);
            return run(id, request, events);
        } finally {
            MDC.remove(MDC_DELIBERATION_ID);
        }
    }

    public DeliberationResult deliberate(DeliberationRequest request) {
        return deliberate(request, DeliberationListener.NONE);
    }

    private void checkPreconditions(DeliberationRequest request, DeliberationListener events) {
        if (request.question() == null || request.question().isBlank()) {
            reject(new DeliberationException(DeliberationException.Reason.INVALID_QUESTION), events);
        }
        if (request.roster() == null || request.roster().isEmpty()) {
            reject(new DeliberationException(DeliberationException.Reason.EMPTY_ROSTER), events);
        }
    }

    private void reject(DeliberationException e, DeliberationListener events) {
        log.warn("Deliberation rejected: reason={}", e.getReason());
        emitError(events, e.getMessage());
        throw e;
    }

    private DeliberationResult run(String id, DeliberationRequest request, DeliberationListener events) {
        String question = request.question();
        CouncilRoster roster = request.roster();
        Instant startTime = Instant.now();
        DeliberationState state = DeliberationState.NOT_STARTED;

        log.info("Deliberation started: advisors={}, chairman={}, generateTitle={}",
                roster.size(), roster.chairman().name(), request.generateTitle());
        notifyStarted(id);

        try {
            CompletableFuture<String> titleTask = request.generateTitle()
                    ? titleGenerator(roster).generate(question)
                    : null;

            state = DeliberationState.STAGE1_RUNNING;
            events.onEvent(DeliberationEvent.stage1Start());
            List<AdvisorResponse> stage1 = timed(ResponseCollector.STAGE,
                    () -> responseCollector.collect(question, roster.advisors()));
            state = DeliberationState.STAGE1_DONE;
            events.onEvent(DeliberationEvent.stage1Complete(stage1));

            state = DeliberationState.STAGE2_RUNNING;
            events.onEvent(DeliberationEvent.stage2Start());
            RankingCollector.RankingOutcome stage2 = timed(RankingCollector.STAGE,
                    () -> rankingCollector.rank(question, stage1, roster.advisors()));
            List<AggregateRankingEntry> aggregate = RankAggregator.aggregate(stage2.entries(), stage2.labelMap());
            state = DeliberationState.STAGE2_DONE;
            events.onEvent(DeliberationEvent.stage2Complete(stage2.entries(), stage2.labelMap(), aggregate));

            state = DeliberationState.STAGE3_RUNNING;
            events.onEvent(DeliberationEvent.stage3Start());
            SynthesisResult stage3 = timed(Synthesizer.STAGE,
                    () -> synthesizer.synthesize(question, stage1, stage2.entries(), roster.chairman()));

            if (stage3.isEmpty() && settings.synthesisFailurePolicy() == SynthesisFailurePolicy.ERROR_EVENT) {
                state = DeliberationState.ERRORED;
                emitError(events, DeliberationException.Reason.SYNTHESIS_FAILED.getMessage());
                finish(id, state, startTime);
                return new DeliberationResult(id, question, null, stage1, stage2.entries(),
                        stage2.labelMap(), aggregate, stage3, state);
            }
            events.onEvent(DeliberationEvent.stage3Complete(stage3));

            String title = null;
            if (titleTask != null) {
                title = titleTask.join();
                events.onEvent(DeliberationEvent.titleComplete(title));
            }

            state = DeliberationState.COMPLETE;
            DeliberationResult result = new DeliberationResult(id, question, title, stage1, stage2.entries(),
                    stage2.labelMap(), aggregate, stage3, state);
            transcriptSink.store(result.toTranscript());
            events.onEvent(DeliberationEvent.complete());

            finish(id, state, startTime);
            return result;

        } catch (RuntimeException e) {
            log.error("Deliberation failed: state={}", state, e);
            finish(id, DeliberationState.ERRORED, startTime);
            emitError(events, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            throw new DeliberationException(DeliberationException.Reason.ORCHESTRATION_FAILURE,
                    "failed while " + state, e);
        }
    }

    private TitleGenerator titleGenerator(CouncilRoster roster) {
        String model = settings.titleModel() != null ? settings.titleModel() : roster.chairman().model();
        return new TitleGenerator(invoker, model, settings.titleTimeout());
    }

    private <T> T timed(String stage, Supplier<T> work) {
        Instant stageStart = Instant.now();
        T result = work.get();
        Duration elapsed = Duration.between(stageStart, Instant.now());
        log.debug("Stage finished: stage={}, elapsedMs={}", stage, elapsed.toMillis());
        deliberationObserver.onStageCompleted(stage, elapsed);
        return result;
    }

    private void notifyStarted(String id) {
        try {
            deliberationObserver.onDeliberationStarted(id);
        } catch (RuntimeException e) {
            log.error("Deliberation observer failed on start", e);
        }
    }

    private void finish(String id, DeliberationState state, Instant startTime) {
        Duration elapsed = Duration.between(startTime, Instant.now());
        log.info("Deliberation finished: state={}, elapsedMs={}", state, elapsed.toMillis());
        try {
            deliberationObserver.onDeliberationFinished(id, state, elapsed);
        } catch (RuntimeException e) {
            log.error("Deliberation observer failed: state={}", state, e);
        }
    }

    private static void emitError(DeliberationListener events, String message) {
        try {
            events.onEvent(DeliberationEvent.error(message));
        } catch (RuntimeException e) {
            log.error("Listener failed while receiving error event", e);
        }
    }

    public PipelineSettings getSettings() {
        return settings;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link CouncilPipeline}. Only the gateway is required.
     */
    public static final class Builder {
        private ModelGateway gateway;
        private SystemPromptLoader promptLoader = SystemPromptLoader.NONE;
        private TranscriptSink transcriptSink = TranscriptSink.NONE;
        private AdvisorCallObserver callObserver = AdvisorCallObserver.NONE;
        private DeliberationObserver deliberationObserver = DeliberationObserver.NONE;
        private PipelineSettings settings = PipelineSettings.defaults();

        private Builder() {
        }

        public Builder gateway(ModelGateway gateway) {
            this.gateway = gateway;
            return this;
        }

        public Builder promptLoader(SystemPromptLoader promptLoader) {
            this.promptLoader = promptLoader;
            return this;
        }

        public Builder transcriptSink(TranscriptSink transcriptSink) {
            this.transcriptSink = transcriptSink;
            return this;
        }

        public Builder callObserver(AdvisorCallObserver callObserver) {
            this.callObserver = callObserver;
            return this;
        }

        public Builder deliberationObserver(DeliberationObserver deliberationObserver) {
            this.deliberationObserver = deliberationObserver;
            return this;
        }

        public Builder settings(PipelineSettings settings) {
            this.settings = settings;
            return this;
        }

        public CouncilPipeline build() {
            Objects.requireNonNull(gateway, "Model gateway is required");
            Objects.requireNonNull(settings, "Pipeline settings are required");
            if (promptLoader == null) {
                promptLoader = SystemPromptLoader.NONE;
            }
            if (transcriptSink == null) {
                transcriptSink = TranscriptSink.NONE;
            }
            if (deliberationObserver == null) {
                deliberationObserver = DeliberationObserver.NONE;
            }
            return new CouncilPipeline(this);
        }
    }
}
