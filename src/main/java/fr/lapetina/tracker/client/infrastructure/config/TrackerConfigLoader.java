package fr.lapetina.tracker.client.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads {@link TrackerProperties} from a YAML document.
 *
 * Supports:
 * - Loading from the file system, then from the classpath
 * - Loading from an arbitrary input stream
 */
public final class TrackerConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(TrackerConfigLoader.class);

    private final Yaml yaml;

    public TrackerConfigLoader() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(TrackerProperties.class, loaderOptions));
    }

    /**
     * Loads configuration from a file path or classpath resource.
     *
     * @throws ConfigurationException if the document is missing or unreadable
     */
    public TrackerProperties load(String location) {
        Path path = Paths.get(location);
        if (Files.exists(path)) {
            return loadFromFile(path);
        }

        String classpathResource = location.startsWith("/") ? location.substring(1) : location;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading tracker configuration from classpath: {}", classpathResource);
                return loadFromStream(is);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read tracker configuration from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("No tracker configuration at " + location + ", neither on disk nor on the classpath");
    }

    private TrackerProperties loadFromFile(Path path) {
        log.info("Loading tracker configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return loadFromStream(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read tracker configuration file: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream. An empty document yields defaults.
     */
    public TrackerProperties loadFromStream(InputStream inputStream) {
        TrackerProperties properties = yaml.load(inputStream);
        return properties != null ? properties : new TrackerProperties();
    }

    /**
     * Exception for configuration loading errors.
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
