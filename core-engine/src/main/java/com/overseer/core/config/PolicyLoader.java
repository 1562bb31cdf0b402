package com.overseer.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Loads and validates {@link PolicyConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Configured file system path ({@code OVERSEER_POLICY_PATH})</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link PolicyConfig#validate()} after parsing
 * so that the application <strong>fails fast</strong> on invalid rules rather
 * than producing undefined runtime behaviour.
 * </p>
 *
 * @since 1.0.0
 */
public final class PolicyLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyLoader.class);

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "policy.yml";

    private PolicyLoader() {
        // utility class - not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the policy from {@code path}, or from {@value #DEFAULT_RESOURCE} on
     * the classpath when no path is configured.
     *
     * @param path configured policy path; may be {@code null} or blank
     * @return parsed and validated policy configuration
     * @throws IllegalArgumentException if the path or resource does not exist
     * @throws IllegalStateException    if rule validation fails
     */
    public static PolicyConfig load(String path) {
        if (path != null && !path.isBlank()) {
            LOG.info("Loading policy from path: {}", path);
            return fromFile(path);
        }
        LOG.info("Loading policy from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load the policy from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated policy configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails or rule validation fails
     */
    public static PolicyConfig fromFile(String path) {
        Objects.requireNonNull(path, "Policy file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Policy file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read policy file: " + path, e);
        }
    }

    /**
     * Load the policy from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated policy configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails or rule validation fails
     */
    public static PolicyConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = PolicyLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static PolicyConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(PolicyConfig.class, options));
        PolicyConfig config = yaml.load(is);

        if (config == null || config.getRules().isEmpty()) {
            LOG.warn("No policy rules defined in configuration");
            config = new PolicyConfig();
        } else {
            // Fail fast if any rule is misconfigured
            config.validate();
        }

        LOG.info("Loaded {} policy rule(s)", config.getRules().size());
        return config;
    }
}
