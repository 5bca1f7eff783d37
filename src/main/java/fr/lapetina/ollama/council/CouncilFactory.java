package fr.lapetina.ollama.council;

import fr.lapetina.ollama.council.domain.model.AdvisorSpec;
import fr.lapetina.ollama.council.domain.model.ChairmanSpec;
import fr.lapetina.ollama.council.domain.model.CouncilRoster;
import fr.lapetina.ollama.council.domain.port.AdvisorCallObserver;
import fr.lapetina.ollama.council.domain.port.DeliberationObserver;
import fr.lapetina.ollama.council.domain.port.ModelGateway;
import fr.lapetina.ollama.council.infrastructure.config.ConfigLoader;
import fr.lapetina.ollama.council.infrastructure.config.CouncilConfig;
import fr.lapetina.ollama.council.infrastructure.http.OllamaModelGateway;
import fr.lapetina.ollama.council.infrastructure.metrics.MetricsCallObserver;
import fr.lapetina.ollama.council.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ollama.council.infrastructure.prompt.MarkdownPromptLoader;
import fr.lapetina.ollama.council.infrastructure.storage.InMemoryTranscriptStore;
import fr.lapetina.ollama.council.pipeline.CouncilPipeline;
import fr.lapetina.ollama.council.pipeline.PipelineSettings;
import fr.lapetina.ollama.council.pipeline.SynthesisFailurePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wires a council from configuration: config → metrics → gateway → prompt loader →
 * transcript store → pipeline.
 *
 * <p>The roster and the pipeline are swapped atomically when the configuration file is
 * reloaded. A deliberation already running keeps the roster it captured.
 *
 * <p>Usage:
 * <pre>{@code
 * try (CouncilFactory factory = CouncilFactory.create("council.yaml")) {
 *     DeliberationResult result = factory.getPipeline()
 *             .deliberate(DeliberationRequest.of("Why is the sky blue?", factory.currentRoster()));
 * }
 * }</pre>
 */
public class CouncilFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CouncilFactory.class);

    private final ConfigLoader configLoader;
    private final AtomicReference<CouncilConfig> config = new AtomicReference<>();
    private final MetricsRegistry metricsRegistry;
    private final MetricsCallObserver metricsObserver;
    private final OllamaModelGateway ollamaGateway;
    private final ModelGateway gateway;
    private final MarkdownPromptLoader promptLoader;
    private final InMemoryTranscriptStore transcriptStore;
    private final AtomicReference<CouncilRoster> roster = new AtomicReference<>();
    private final AtomicReference<CouncilPipeline> pipeline = new AtomicReference<>();

    protected CouncilFactory(String configPath, ModelGateway gatewayOverride) {
        log.info("Initializing CouncilFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        CouncilConfig initial = configLoader.load();
        this.config.set(initial);

        this.metricsRegistry = new MetricsRegistry(initial.getMetrics().getPrefix());
        this.metricsObserver = new MetricsCallObserver(metricsRegistry);

        // The Ollama client also serves the model list and status endpoints, so it exists even when overridden
        this.ollamaGateway = new OllamaModelGateway(
                initial.getOllama().getUrl(),
                Duration.ofMillis(initial.getOllama().getConnectTimeoutMs())
        );
        this.gateway = gatewayOverride != null ? gatewayOverride : ollamaGateway;

        this.promptLoader = new MarkdownPromptLoader(resolvePromptsDirectory(initial));
        this.transcriptStore = new InMemoryTranscriptStore(initial.getCouncil().getTranscriptCapacity());

        apply(initial);
        configLoader.addListener(this::onConfigChanged);

        log.info("CouncilFactory initialized with {} advisors, chairman={}",
                roster.get().size(), roster.get().chairman().model());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static CouncilFactory create(String configPath) {
        return new CouncilFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration ({@value ConfigLoader#DEFAULT_CONFIG_FILE}).
     */
    public static CouncilFactory create() {
        return create(ConfigLoader.DEFAULT_CONFIG_FILE);
    }

    /**
     * Starts watching the configuration file.
     */
    public CouncilFactory start() {
        configLoader.startWatching();
        return this;
    }

    /**
     * Roster to capture for the next deliberation.
     */
    public CouncilRoster currentRoster() {
        return roster.get();
    }

    public CouncilPipeline getPipeline() {
        return pipeline.get();
    }

    public CouncilConfig getConfig() {
        return config.get();
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public OllamaModelGateway getOllamaGateway() {
        return ollamaGateway;
    }

    public InMemoryTranscriptStore getTranscriptStore() {
        return transcriptStore;
    }

    public boolean isTitleEnabled() {
        return config.get().getTitle().isEnabled();
    }

    static CouncilRoster toRoster(CouncilConfig config) {
        List<AdvisorSpec> advisors = config.getAdvisors().stream()
                .map(a -> new AdvisorSpec(a.getId(), a.getName(), a.getModel(), a.getPromptFile(), a.getDescription()))
                .toList();
        CouncilConfig.ChairmanConfig chairman = config.getChairman();
        return new CouncilRoster(advisors, new ChairmanSpec(chairman.getName(), chairman.getModel(), chairman.getPromptFile()));
    }

    static PipelineSettings toSettings(CouncilConfig config) {
        return new PipelineSettings(
                Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getTitleTimeoutMs()),
                SynthesisFailurePolicy.fromConfig(config.getCouncil().getSynthesisFailure()),
                config.getTitle().getModel()
        );
    }

    /**
     * Roster references may be written relative to the prompts directory ("marcus.md") or to
     * the working directory ("prompts/marcus.md"); the loader's parent fallback covers the latter.
     */
    private static Path resolvePromptsDirectory(CouncilConfig config) {
        return Paths.get(config.getCouncil().getPromptsDirectory()).toAbsolutePath();
    }

    private void apply(CouncilConfig newConfig) {
        boolean metricsEnabled = newConfig.getMetrics().isEnabled();
        CouncilPipeline newPipeline = CouncilPipeline.builder()
                .gateway(gateway)
                .promptLoader(promptLoader)
                .transcriptSink(transcriptStore)
                .callObserver(metricsEnabled ? metricsObserver : AdvisorCallObserver.NONE)
                .deliberationObserver(metricsEnabled ? metricsObserver : DeliberationObserver.NONE)
                .settings(toSettings(newConfig))
                .build();
        CouncilRoster newRoster = toRoster(newConfig);

        pipeline.set(newPipeline);
        roster.set(newRoster);
        config.set(newConfig);
    }

    private void onConfigChanged(CouncilConfig oldConfig, CouncilConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying updates...");
        apply(newConfig);
        log.info("Configuration updates applied: advisors={}, chairman={}",
                newConfig.getAdvisors().size(), newConfig.getChairman().getModel());
    }

    @Override
    public void close() {
        log.info("Shutting down CouncilFactory...");

        try {
            ollamaGateway.close();
        } catch (Exception e) {
            log.warn("Error closing Ollama gateway", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("CouncilFactory shut down");
    }
}
