package com.validatorsentinel.core.config;

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
 * Loads and validates {@link ThresholdsConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_THRESHOLDS_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * <li>Built-in {@link ThresholdsConfig#defaults()}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link ThresholdsConfig#validate()} after
 * parsing so that the application <strong>fails fast</strong> on invalid
 * thresholds instead of misclassifying changes at runtime.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdsLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_THRESHOLDS_PATH = "THRESHOLDS_CONFIG_PATH";

    /** Classpath resource consulted when no path is configured. */
    public static final String DEFAULT_RESOURCE = "thresholds.yml";

    private ThresholdsLoader() {
        // utility class, not instantiable
    }

    /**
     * Load thresholds using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static ThresholdsConfig load() {
        String envPath = System.getenv(ENV_THRESHOLDS_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading thresholds from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (ThresholdsLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading thresholds from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.warn("No thresholds configuration found - using built-in defaults");
        return ThresholdsConfig.defaults();
    }

    /**
     * Load thresholds from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static ThresholdsConfig fromFile(String path) {
        Objects.requireNonNull(path, "Thresholds file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Thresholds file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read thresholds file: " + path, e);
        }
    }

    /**
     * Load thresholds from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static ThresholdsConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ThresholdsLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static ThresholdsConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(ThresholdsConfig.class, options));

        ThresholdsConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed thresholds YAML in " + source + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Thresholds source {} is empty - using built-in defaults", source);
            config = ThresholdsConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded thresholds: {}", config);
        return config;
    }
}
