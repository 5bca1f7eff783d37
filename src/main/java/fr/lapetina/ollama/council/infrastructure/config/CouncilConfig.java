package fr.lapetina.ollama.council.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the council service.
 * Designed to be populated from YAML.
 */
public class CouncilConfig {

    private ServerConfig server = new ServerConfig();
    private OllamaConfig ollama = new OllamaConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private CouncilSettings council = new CouncilSettings();
    private List<AdvisorConfig> advisors = new ArrayList<>();
    private ChairmanConfig chairman = new ChairmanConfig();
    private TitleConfig title = new TitleConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public OllamaConfig getOllama() { return ollama; }
    public void setOllama(OllamaConfig ollama) { this.ollama = ollama; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public CouncilSettings getCouncil() { return council; }
    public void setCouncil(CouncilSettings council) { this.council = council; }

    public List<AdvisorConfig> getAdvisors() { return advisors; }
    public void setAdvisors(List<AdvisorConfig> advisors) { this.advisors = advisors; }

    public ChairmanConfig getChairman() { return chairman; }
    public void setChairman(ChairmanConfig chairman) { this.chairman = chairman; }

    public TitleConfig getTitle() { return title; }
    public void setTitle(TitleConfig title) { this.title = title; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8001;
        private int backlog = 100;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }
    }

    /**
     * Model host the gateway talks to.
     */
    public static class OllamaConfig {
        private String url = "http://localhost:11434";
        private long connectTimeoutMs = 5000;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Per-call timeouts.
     */
    public static class TimeoutsConfig {
        private long requestTimeoutMs = 300000;
        private long titleTimeoutMs = 30000;

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public long getTitleTimeoutMs() { return titleTimeoutMs; }
        public void setTitleTimeoutMs(long titleTimeoutMs) { this.titleTimeoutMs = titleTimeoutMs; }
    }

    /**
     * Pipeline behaviour.
     */
    public static class CouncilSettings {
        private String promptsDirectory = "prompts";
        private String synthesisFailure = "empty-result";
        private int transcriptCapacity = 100;

        public String getPromptsDirectory() { return promptsDirectory; }
        public void setPromptsDirectory(String promptsDirectory) { this.promptsDirectory = promptsDirectory; }

        public String getSynthesisFailure() { return synthesisFailure; }
        public void setSynthesisFailure(String synthesisFailure) { this.synthesisFailure = synthesisFailure; }

        public int getTranscriptCapacity() { return transcriptCapacity; }
        public void setTranscriptCapacity(int transcriptCapacity) { this.transcriptCapacity = transcriptCapacity; }
    }

    /**
     * One council member.
     */
    public static class AdvisorConfig {
        private String id;
        private String name;
        private String model;
        private String promptFile;
        private String description;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getPromptFile() { return promptFile; }
        public void setPromptFile(String promptFile) { this.promptFile = promptFile; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
    }

    /**
     * The synthesizing member.
     */
    public static class ChairmanConfig {
        private String name = "Chairman";
        private String model;
        private String promptFile;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getPromptFile() { return promptFile; }
        public void setPromptFile(String promptFile) { this.promptFile = promptFile; }
    }

    /**
     * Conversation title generation. A blank model means the chairman's.
     */
    public static class TitleConfig {
        private boolean enabled = true;
        private String model;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "ollama_council";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
