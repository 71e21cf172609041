package com.perfsentinel.core.config;

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
import java.util.Objects;

/**
 * Loads and validates {@link AnalysisConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Explicit file system path passed to {@link #load(String)} or
 * {@link #fromFile(String)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE} via
 * {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * Where the path comes from (a command line, an environment variable) is
 * up to the caller.
 * </p>
 *
 * <p>
 * Every {@code load*} method validates the parsed configuration and fails
 * fast on invalid values.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "analysis.yml";

    private AnalysisConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration from {@code path} when one is given, otherwise
     * from {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @param path file system path; {@code null} or blank selects the
     *             bundled defaults
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AnalysisConfig load(String path) {
        if (path != null && !path.isBlank()) {
            LOG.info("Loading analysis config from file: {}", path);
            return fromFile(path);
        }
        LOG.info("Loading analysis config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load the configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AnalysisConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Analysis config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read analysis config file: " + path, e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AnalysisConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AnalysisConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AnalysisConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AnalysisConfig.class, options));

        AnalysisConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed analysis configuration: " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Empty analysis configuration, using defaults");
            config = new AnalysisConfig();
        }
        config.validate();

        LOG.info("Loaded {}", config);
        return config;
    }
}
