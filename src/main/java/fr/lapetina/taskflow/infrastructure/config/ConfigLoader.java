package fr.lapetina.taskflow.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads {@link TaskflowConfig} from YAML and holds the live copy.
 *
 * The location is tried as a file first, then as a classpath resource. A file
 * location is polled for modification once {@link #startWatching()} is called;
 * every successful load is published to the listeners together with the
 * configuration it replaces.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Duration POLL_INTERVAL = Duration.ofSeconds(2);

    private final String location;
    private final Yaml yaml;
    private final AtomicReference<TaskflowConfig> current = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();

    private volatile FileTime loadedVersion;
    private ScheduledExecutorService poller;

    public ConfigLoader(String location) {
        this.location = location;
        this.yaml = new Yaml(new Constructor(TaskflowConfig.class, new LoaderOptions()));
    }

    /**
     * Reads the configuration, makes it current and notifies listeners.
     *
     * @throws ConfigurationException when the location is missing or the YAML is invalid
     */
    public synchronized TaskflowConfig load() {
        TaskflowConfig next = read();
        TaskflowConfig previous = current.getAndSet(next);
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(previous, next);
            } catch (RuntimeException e) {
                log.error("Configuration listener failed: listener={}", listener, e);
            }
        }
        return next;
    }

    /**
     * Like {@link #load()}, but a broken file keeps the running configuration.
     */
    public TaskflowConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Configuration reload failed, keeping the running configuration: location={}", location, e);
            return current.get();
        }
    }

    public TaskflowConfig getCurrentConfig() {
        return current.get();
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Starts polling the file for changes. Classpath configurations are never reloaded.
     */
    public synchronized void startWatching() {
        if (poller != null) {
            return;
        }
        if (!Files.isRegularFile(Path.of(location))) {
            log.info("Configuration is not a file, hot reload disabled: location={}", location);
            return;
        }
        poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-poller");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = POLL_INTERVAL.toMillis();
        poller.scheduleWithFixedDelay(this::reloadIfModified, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Configuration hot reload enabled: location={}, intervalMs={}", location, intervalMs);
    }

    /**
     * Reloads when the file is newer than the last version read.
     *
     * @return true if a reload was attempted
     */
    boolean reloadIfModified() {
        try {
            FileTime modified = Files.getLastModifiedTime(Path.of(location));
            if (loadedVersion != null && modified.compareTo(loadedVersion) <= 0) {
                return false;
            }
            // a broken edit is reported once, not on every poll
            loadedVersion = modified;
            log.info("Configuration file changed: location={}", location);
            reload();
            return true;
        } catch (IOException e) {
            log.warn("Cannot read configuration timestamp: location={}, error={}", location, e.getMessage());
            return false;
        }
    }

    private TaskflowConfig read() {
        Path file = Path.of(location);
        if (Files.isRegularFile(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                loadedVersion = Files.getLastModifiedTime(file);
                log.info("Loading configuration: file={}", file);
                return parse(in, file.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read configuration file " + file, e);
            }
        }

        String resource = location.replace('\\', '/');
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration not found on disk or classpath: " + location);
            }
            log.info("Loading configuration: classpath={}", resource);
            return parse(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration resource " + resource, e);
        }
    }

    private TaskflowConfig parse(InputStream in, String source) {
        try {
            TaskflowConfig config = yaml.load(in);
            // empty document
            return config != null ? config : new TaskflowConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (poller != null) {
            poller.shutdownNow();
            poller = null;
        }
    }

    /**
     * Missing or unreadable configuration.
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
