package fr.lapetina.orchestrator.infrastructure.config;

import fr.lapetina.orchestrator.admission.UserTier;
import fr.lapetina.orchestrator.domain.strategy.SelectionStrategyType;
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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@link OrchestratorConfig} from YAML, with hot reload.
 *
 * Supports:
 * - Loading from the file system, then the classpath
 * - Validation of the loaded configuration
 * - File watching for automatic reload
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<OrchestratorConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(OrchestratorConfig.class, new LoaderOptions()));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public OrchestratorConfig load() {
        OrchestratorConfig config = validate(loadFromPath());
        OrchestratorConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private OrchestratorConfig loadFromPath() {
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

    private OrchestratorConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private OrchestratorConfig parse(InputStream is, String source) {
        try {
            OrchestratorConfig config = yaml.load(is);
            // an empty document yields null
            return config != null ? config : new OrchestratorConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public OrchestratorConfig loadFromStream(InputStream inputStream) {
        OrchestratorConfig config = validate(parse(inputStream, "stream"));
        OrchestratorConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    public OrchestratorConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Checks the values components cannot default on their own.
     *
     * @throws ConfigurationException on the first problem found
     */
    static OrchestratorConfig validate(OrchestratorConfig config) {
        Set<String> instanceIds = new HashSet<>();
        for (OrchestratorConfig.InstanceConfig instance : config.getInstances()) {
            if (instance.getId() == null || instance.getId().isBlank()) {
                throw new ConfigurationException("Instance without id");
            }
            if (instance.getUrl() == null || instance.getUrl().isBlank()) {
                throw new ConfigurationException("Instance " + instance.getId() + " has no url");
            }
            if (!instanceIds.add(instance.getId())) {
                throw new ConfigurationException("Duplicate instance id: " + instance.getId());
            }
        }

        try {
            SelectionStrategyType.fromName(config.getSelection().getStrategy());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown selection strategy: " + config.getSelection().getStrategy(), e);
        }
        if (config.getSelection().getFailoverThreshold() < 1) {
            throw new ConfigurationException("selection.failoverThreshold must be positive");
        }

        Set<String> ruleIds = new HashSet<>();
        for (OrchestratorConfig.RuleConfig rule : config.getRateLimit().getRules()) {
            if (rule.getId() == null || rule.getPattern() == null) {
                throw new ConfigurationException("Rate-limit rule needs an id and a pattern");
            }
            if (!ruleIds.add(rule.getId())) {
                throw new ConfigurationException("Duplicate rule id: " + rule.getId());
            }
            for (UserTier tier : UserTier.values()) {
                boolean present = rule.getLimits().keySet().stream()
                        .anyMatch(name -> name.equalsIgnoreCase(tier.name()));
                if (!present) {
                    throw new ConfigurationException("Rule " + rule.getId() + " has no limit for tier " + tier);
                }
            }
        }

        if (config.getQueue().getMaxConcurrent() < 1 || config.getQueue().getMaxQueueSize() < 1) {
            throw new ConfigurationException("queue.maxConcurrent and queue.maxQueueSize must be positive");
        }
        return config;
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
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

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
     * Forces a reload; keeps the current configuration if the new one cannot be loaded.
     */
    public OrchestratorConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(OrchestratorConfig oldConfig, OrchestratorConfig newConfig) {
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

    public static OrchestratorConfig createDefault() {
        return new OrchestratorConfig();
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
