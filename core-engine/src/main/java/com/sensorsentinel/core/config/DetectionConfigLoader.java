package com.sensorsentinel.core.config;

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
 * Loads and validates {@link DetectionConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * Every {@code from*} method validates after parsing, so a bad setting fails
 * at startup instead of producing skewed scores later.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "DETECTION_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "detection.yml";

    private DetectionConfigLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution.
     *
     * <ol>
     * <li>If {@code DETECTION_CONFIG_PATH} is set and the file exists, load from
     * there.</li>
     * <li>Otherwise fall back to {@code detection.yml} on the classpath.</li>
     * </ol>
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static DetectionConfig load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    /**
     * @param overridePath value of {@value #ENV_CONFIG_PATH}; {@code null},
     *                     blank or a missing file selects the classpath default
     */
    static DetectionConfig load(String overridePath) {
        if (overridePath != null && !overridePath.isBlank() && Files.exists(Path.of(overridePath))) {
            LOG.info("Loading detection config from environment path: {}", overridePath);
            return fromFile(overridePath);
        }
        LOG.info("Loading detection config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static DetectionConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Detection config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read detection config file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static DetectionConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DetectionConfigLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static DetectionConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectionConfig.class, options));

        DetectionConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed detection config in " + source + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Detection config {} is empty – using built-in defaults", source);
            config = DetectionConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded detection config: {}", config);
        return config;
    }
}
