package com.rulesync.service;

import com.rulesync.core.model.ReconcileSettings;
import com.rulesync.core.model.SourceSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Reads the {@link ReconcileSettings} that say what to sync.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>A YAML mapping in the settings file, when one is configured</li>
 * <li>Otherwise environment variables named after the upper-cased keys
 * (e.g. {@code GIT_REPO})</li>
 * </ol>
 *
 * <h3>Keys</h3>
 * <p>
 * {@value #GIT_REPO}, {@value #GIT_BRANCH} (default {@code master}),
 * {@value #GIT_REV} (default {@code HEAD}), {@value #GIT_DEPTH} (default
 * {@code 1}), {@value #GIT_SSH_KEY}, and one subpath per downstream kind.
 * An absent or blank {@value #GIT_REPO} means "not configured".
 * </p>
 *
 * <p>
 * {@link #get()} returns the settings of the last successful
 * {@link #refresh()}; a settings file that cannot be read or parsed keeps the
 * previous settings in force.
 * </p>
 *
 * @since 1.0.0
 */
public class SettingsLoader implements Supplier<ReconcileSettings> {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    public static final String GIT_REPO = "git_repo";
    public static final String GIT_BRANCH = "git_branch";
    public static final String GIT_REV = "git_rev";
    public static final String GIT_DEPTH = "git_depth";
    public static final String GIT_SSH_KEY = "git_ssh_key";
    public static final String METRIC_RULES_PATH = "prometheus_alert_rules_path";
    public static final String LOG_RULES_PATH = "loki_alert_rules_path";
    public static final String DASHBOARDS_PATH = "grafana_dashboards_path";

    private final Path settingsFile;
    private final Function<String, String> env;
    private volatile ReconcileSettings current = ReconcileSettings.withDefaults(null);

    /**
     * @param settingsFile YAML settings file, or {@code null} to use the
     *                     environment
     * @param env          environment lookup
     */
    public SettingsLoader(Path settingsFile, Function<String, String> env) {
        this.settingsFile = settingsFile;
        this.env = Objects.requireNonNull(env, "env must not be null");
    }

    @Override
    public ReconcileSettings get() {
        return current;
    }

    /**
     * Re-read the settings.
     *
     * @return {@code true} if the settings changed
     */
    public boolean refresh() {
        ReconcileSettings loaded;
        try {
            loaded = settingsFile != null
                    ? fromFile(settingsFile)
                    : fromValues(key -> env.apply(key.toUpperCase(Locale.ROOT)));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Cannot read settings from {}, keeping previous settings: {}",
                    settingsFile != null ? settingsFile : "environment", e.getMessage());
            return false;
        }
        if (loaded.equals(current)) {
            return false;
        }
        LOG.info("Settings changed: {}", loaded);
        current = loaded;
        return true;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static ReconcileSettings fromFile(Path file) throws IOException {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));
        Object document;
        try (InputStream is = Files.newInputStream(file)) {
            document = yaml.load(is);
        }
        if (document == null) {
            return ReconcileSettings.withDefaults(null);
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Settings file must contain a mapping");
        }
        return fromValues(key -> {
            Object value = map.get(key);
            return value == null ? null : value.toString();
        });
    }

    static ReconcileSettings fromValues(Function<String, String> values) {
        String location = values.apply(GIT_REPO);
        SourceSpec source = null;
        if (location != null && !location.isBlank()) {
            source = SourceSpec.builder()
                    .location(location)
                    .branch(valueOr(values, GIT_BRANCH, "master"))
                    .revision(valueOr(values, GIT_REV, "HEAD"))
                    .depth(parseDepth(valueOr(values, GIT_DEPTH, "1")))
                    .credential(values.apply(GIT_SSH_KEY))
                    .build();
        }
        return new ReconcileSettings(source,
                valueOr(values, METRIC_RULES_PATH, ReconcileSettings.DEFAULT_METRIC_RULES_PATH),
                valueOr(values, LOG_RULES_PATH, ReconcileSettings.DEFAULT_LOG_RULES_PATH),
                valueOr(values, DASHBOARDS_PATH, ReconcileSettings.DEFAULT_DASHBOARDS_PATH));
    }

    private static String valueOr(Function<String, String> values, String key, String defaultValue) {
        String value = values.apply(key);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static int parseDepth(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(GIT_DEPTH + " must be an integer, got: " + value, e);
        }
    }
}
