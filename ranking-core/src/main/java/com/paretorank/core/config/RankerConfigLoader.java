package com.paretorank.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link RankerConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * <li>Built-in defaults, if neither exists</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates after parsing so that a bad setting
 * fails at startup rather than during ranking.
 * </p>
 *
 * @since 1.0.0
 */
public final class RankerConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RankerConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "RANKER_CONFIG_PATH";

    /** Classpath resource consulted when the environment does not name a file. */
    public static final String DEFAULT_RESOURCE = "ranker.yml";

    private RankerConfigLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static RankerConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading ranker config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (RankerConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading ranker config from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.warn("No ranker configuration found; using defaults");
        return RankerConfig.defaults();
    }

    /**
     * Load the configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RankerConfig fromFile(String path) {
        Objects.requireNonNull(path, "Ranker config path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Ranker config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ranker config file: " + path, e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RankerConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RankerConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static RankerConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(RankerConfig.class, options));

        RankerConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed ranker config in " + source + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Ranker configuration {} is empty; using defaults", source);
            config = RankerConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded {}", config);
        return config;
    }
}
