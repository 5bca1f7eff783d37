package fr.lapetina.ollama.council.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Council configuration loader with hot-reload support.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Validation of the advisor roster before a configuration is accepted
 * - File watching for automatic reload
 * - Listener notification on changes
 *
 * An invalid file on reload is logged and the previous configuration is kept.
 */
public final class ConfigLoader implements AutoCloseable {

    public static final String DEFAULT_CONFIG_FILE = "council.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<CouncilConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(CouncilConfig.class, loaderOptions));
    }

    /**
     * Loads and validates configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public CouncilConfig load() {
        CouncilConfig config = validate(loadFromPath());
        CouncilConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private CouncilConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private CouncilConfig loadFromFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            log.info("Loading configuration from file: {}", path);
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private CouncilConfig parse(InputStream is, String source) {
        try {
            CouncilConfig config = yaml.load(is);
            // An empty document yields null
            return config != null ? config : new CouncilConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public CouncilConfig loadFromStream(InputStream inputStream) {
        CouncilConfig config = validate(parse(inputStream, "stream"));
        CouncilConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    /**
     * Checks the parts of the configuration the pipeline cannot run without.
     * An empty advisor list is accepted; the pipeline rejects it per deliberation.
     *
     * @throws ConfigurationException on the first problem found
     */
    static CouncilConfig validate(CouncilConfig config) {
        if (config.getAdvisors() == null) {
            config.setAdvisors(new ArrayList<>());
        }
        // A section present in YAML with no body maps to null
        if (config.getServer() == null) {
            config.setServer(new CouncilConfig.ServerConfig());
        }
        if (config.getOllama() == null) {
            config.setOllama(new CouncilConfig.OllamaConfig());
        }
        if (config.getTimeouts() == null) {
            config.setTimeouts(new CouncilConfig.TimeoutsConfig());
        }
        if (config.getCouncil() == null) {
            config.setCouncil(new CouncilConfig.CouncilSettings());
        }
        if (config.getTitle() == null) {
            config.setTitle(new CouncilConfig.TitleConfig());
        }
        if (config.getMetrics() == null) {
            config.setMetrics(new CouncilConfig.MetricsConfig());
        }

        Set<String> names = new HashSet<>();
        for (CouncilConfig.AdvisorConfig advisor : config.getAdvisors()) {
            if (advisor.getName() == null || advisor.getName().isBlank()) {
                throw new ConfigurationException("Advisor without a name");
            }
            if (advisor.getModel() == null || advisor.getModel().isBlank()) {
                throw new ConfigurationException("Advisor has no model: " + advisor.getName());
            }
            if (!names.add(advisor.getName())) {
                throw new ConfigurationException("Duplicate advisor name: " + advisor.getName());
            }
        }

        if (config.getChairman() == null
                || config.getChairman().getModel() == null
                || config.getChairman().getModel().isBlank()) {
            throw new ConfigurationException("Chairman model is required");
        }
        if (config.getTimeouts().getRequestTimeoutMs() <= 0) {
            throw new ConfigurationException("timeouts.requestTimeoutMs must be positive");
        }
        if (config.getTimeouts().getTitleTimeoutMs() <= 0) {
            throw new ConfigurationException("timeouts.titleTimeoutMs must be positive");
        }
        return config;
    }

    /**
     * Returns the current configuration.
     */
    public CouncilConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())) {
                    // Editors fire several events per save
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload, keeping the current one if the new file is invalid.
     */
    public CouncilConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current: {}", e.getMessage());
            return currentConfig.get();
        }
    }

    /**
     * Adds a listener for configuration changes.
     */
    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a configuration change listener.
     */
    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(CouncilConfig oldConfig, CouncilConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
