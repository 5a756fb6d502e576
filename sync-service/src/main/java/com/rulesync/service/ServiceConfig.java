package com.rulesync.service;

import com.rulesync.core.model.DownstreamKind;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Typed, immutable process configuration of the rule-sync service.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configured through Deployment env vars or Docker {@code -e}
 * flags. What to sync (repository, branch, subpaths) is not part of this
 * object; it is re-read on every tick by {@link SettingsLoader}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Mirror / git-sync
    // ---------------------------------------------------------------
    private final Path mirrorRoot;
    private final String syncSubdir;
    private final String gitSyncBinary;
    private final long syncPeriodSeconds;
    private final long oneShotTimeoutSeconds;
    private final Path sshKeyFile;
    private final Path knownHostsFile;

    // ---------------------------------------------------------------
    // Proxy
    // ---------------------------------------------------------------
    private final String httpProxy;
    private final String httpsProxy;
    private final String noProxy;

    // ---------------------------------------------------------------
    // Reconcile
    // ---------------------------------------------------------------
    private final long reconcileIntervalSeconds;
    private final Path settingsFile;

    // ---------------------------------------------------------------
    // Downstream directories
    // ---------------------------------------------------------------
    private final Path metricRulesOutputDir;
    private final Path logRulesOutputDir;
    private final Path dashboardsOutputDir;

    // ---------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------
    private final int statusPort;

    private ServiceConfig(Builder b) {
        this.mirrorRoot = b.mirrorRoot;
        this.syncSubdir = b.syncSubdir;
        this.gitSyncBinary = b.gitSyncBinary;
        this.syncPeriodSeconds = b.syncPeriodSeconds;
        this.oneShotTimeoutSeconds = b.oneShotTimeoutSeconds;
        this.sshKeyFile = b.sshKeyFile;
        this.knownHostsFile = b.knownHostsFile;
        this.httpProxy = b.httpProxy;
        this.httpsProxy = b.httpsProxy;
        this.noProxy = b.noProxy;
        this.reconcileIntervalSeconds = b.reconcileIntervalSeconds;
        this.settingsFile = b.settingsFile;
        this.metricRulesOutputDir = b.metricRulesOutputDir;
        this.logRulesOutputDir = b.logRulesOutputDir;
        this.dashboardsOutputDir = b.dashboardsOutputDir;
        this.statusPort = b.statusPort;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromLookup(System::getenv);
    }

    static ServiceConfig fromLookup(Function<String, String> env) {
        try {
            String settings = value(env, "SETTINGS_FILE", "");
            return new Builder()
                    .mirrorRoot(Path.of(value(env, "MIRROR_ROOT", "/git")))
                    .syncSubdir(value(env, "SYNC_SUBDIR", "repo"))
                    .gitSyncBinary(value(env, "GIT_SYNC_BINARY", "/git-sync"))
                    .syncPeriodSeconds(Long.parseLong(value(env, "SYNC_PERIOD_SECONDS", "60")))
                    .oneShotTimeoutSeconds(Long.parseLong(value(env, "ONE_SHOT_TIMEOUT_SECONDS", "120")))
                    .sshKeyFile(Path.of(value(env, "SSH_KEY_FILE", "/run/rule-sync/ssh-key")))
                    .knownHostsFile(Path.of(value(env, "KNOWN_HOSTS_FILE", "/run/rule-sync/known_hosts")))
                    .httpProxy(value(env, "HTTP_PROXY", ""))
                    .httpsProxy(value(env, "HTTPS_PROXY", ""))
                    .noProxy(value(env, "NO_PROXY", ""))
                    .reconcileIntervalSeconds(Long.parseLong(value(env, "RECONCILE_INTERVAL_SECONDS", "30")))
                    .settingsFile(settings.isEmpty() ? null : Path.of(settings))
                    .metricRulesOutputDir(Path.of(value(env, "METRIC_RULES_OUTPUT_DIR",
                            "/var/lib/rule-sync/metric-rules")))
                    .logRulesOutputDir(Path.of(value(env, "LOG_RULES_OUTPUT_DIR",
                            "/var/lib/rule-sync/log-rules")))
                    .dashboardsOutputDir(Path.of(value(env, "DASHBOARDS_OUTPUT_DIR",
                            "/var/lib/rule-sync/dashboards")))
                    .statusPort(Integer.parseInt(value(env, "STATUS_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    /**
     * @return directory holding the checked-out tree
     */
    public Path getContentRoot() {
        return mirrorRoot.resolve(syncSubdir);
    }

    /**
     * Proxy variables for the sync process; blank values are left out.
     *
     * @return lower-case proxy variables, in a stable order
     */
    public Map<String, String> proxyEnvironment() {
        Map<String, String> env = new LinkedHashMap<>();
        if (!httpProxy.isBlank()) {
            env.put("http_proxy", httpProxy);
        }
        if (!httpsProxy.isBlank()) {
            env.put("https_proxy", httpsProxy);
        }
        if (!noProxy.isBlank()) {
            env.put("no_proxy", noProxy);
        }
        return env;
    }

    public Path outputDir(DownstreamKind kind) {
        return switch (kind) {
            case METRIC_RULES -> metricRulesOutputDir;
            case LOG_RULES -> logRulesOutputDir;
            case DASHBOARDS -> dashboardsOutputDir;
        };
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getMirrorRoot() {
        return mirrorRoot;
    }

    public String getSyncSubdir() {
        return syncSubdir;
    }

    public String getGitSyncBinary() {
        return gitSyncBinary;
    }

    public Duration getSyncPeriod() {
        return Duration.ofSeconds(syncPeriodSeconds);
    }

    public Duration getOneShotTimeout() {
        return Duration.ofSeconds(oneShotTimeoutSeconds);
    }

    public Path getSshKeyFile() {
        return sshKeyFile;
    }

    public Path getKnownHostsFile() {
        return knownHostsFile;
    }

    public Duration getReconcileInterval() {
        return Duration.ofSeconds(reconcileIntervalSeconds);
    }

    /**
     * @return settings file, or {@code null} to read settings from the
     *         environment
     */
    public Path getSettingsFile() {
        return settingsFile;
    }

    public int getStatusPort() {
        return statusPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (periods and timeouts &gt; 0, port in [1, 65535], non-blank
     * subdirectory and binary).
     * </p>
     */
    public static class Builder {
        private Path mirrorRoot = Path.of("/git");
        private String syncSubdir = "repo";
        private String gitSyncBinary = "/git-sync";
        private long syncPeriodSeconds = 60;
        private long oneShotTimeoutSeconds = 120;
        private Path sshKeyFile = Path.of("/run/rule-sync/ssh-key");
        private Path knownHostsFile = Path.of("/run/rule-sync/known_hosts");
        private String httpProxy = "";
        private String httpsProxy = "";
        private String noProxy = "";
        private long reconcileIntervalSeconds = 30;
        private Path settingsFile;
        private Path metricRulesOutputDir = Path.of("/var/lib/rule-sync/metric-rules");
        private Path logRulesOutputDir = Path.of("/var/lib/rule-sync/log-rules");
        private Path dashboardsOutputDir = Path.of("/var/lib/rule-sync/dashboards");
        private int statusPort = 8080;

        public Builder mirrorRoot(Path v) {
            this.mirrorRoot = v;
            return this;
        }

        public Builder syncSubdir(String v) {
            this.syncSubdir = v;
            return this;
        }

        public Builder gitSyncBinary(String v) {
            this.gitSyncBinary = v;
            return this;
        }

        public Builder syncPeriodSeconds(long v) {
            this.syncPeriodSeconds = v;
            return this;
        }

        public Builder oneShotTimeoutSeconds(long v) {
            this.oneShotTimeoutSeconds = v;
            return this;
        }

        public Builder sshKeyFile(Path v) {
            this.sshKeyFile = v;
            return this;
        }

        public Builder knownHostsFile(Path v) {
            this.knownHostsFile = v;
            return this;
        }

        public Builder httpProxy(String v) {
            this.httpProxy = v == null ? "" : v;
            return this;
        }

        public Builder httpsProxy(String v) {
            this.httpsProxy = v == null ? "" : v;
            return this;
        }

        public Builder noProxy(String v) {
            this.noProxy = v == null ? "" : v;
            return this;
        }

        public Builder reconcileIntervalSeconds(long v) {
            this.reconcileIntervalSeconds = v;
            return this;
        }

        public Builder settingsFile(Path v) {
            this.settingsFile = v;
            return this;
        }

        public Builder metricRulesOutputDir(Path v) {
            this.metricRulesOutputDir = v;
            return this;
        }

        public Builder logRulesOutputDir(Path v) {
            this.logRulesOutputDir = v;
            return this;
        }

        public Builder dashboardsOutputDir(Path v) {
            this.dashboardsOutputDir = v;
            return this;
        }

        public Builder statusPort(int v) {
            this.statusPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(mirrorRoot, "mirrorRoot required");
            Objects.requireNonNull(sshKeyFile, "sshKeyFile required");
            Objects.requireNonNull(knownHostsFile, "knownHostsFile required");
            Objects.requireNonNull(metricRulesOutputDir, "metricRulesOutputDir required");
            Objects.requireNonNull(logRulesOutputDir, "logRulesOutputDir required");
            Objects.requireNonNull(dashboardsOutputDir, "dashboardsOutputDir required");
            requireNonBlank(syncSubdir, "syncSubdir");
            requireNonBlank(gitSyncBinary, "gitSyncBinary");

            if (syncSubdir.contains("/") || syncSubdir.equals("..") || syncSubdir.equals(".")) {
                throw new IllegalArgumentException("syncSubdir must be a single directory name, got: " + syncSubdir);
            }
            requirePositive(syncPeriodSeconds, "syncPeriodSeconds");
            requirePositive(oneShotTimeoutSeconds, "oneShotTimeoutSeconds");
            requirePositive(reconcileIntervalSeconds, "reconcileIntervalSeconds");
            if (statusPort < 1 || statusPort > 65_535) {
                throw new IllegalArgumentException(
                        "statusPort must be in [1, 65535], got: " + statusPort);
            }

            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requirePositive(long value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Function<String, String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "mirrorRoot=" + mirrorRoot +
                ", syncSubdir='" + syncSubdir + '\'' +
                ", gitSyncBinary='" + gitSyncBinary + '\'' +
                ", syncPeriodSeconds=" + syncPeriodSeconds +
                ", oneShotTimeoutSeconds=" + oneShotTimeoutSeconds +
                ", reconcileIntervalSeconds=" + reconcileIntervalSeconds +
                ", settingsFile=" + settingsFile +
                ", metricRulesOutputDir=" + metricRulesOutputDir +
                ", logRulesOutputDir=" + logRulesOutputDir +
                ", dashboardsOutputDir=" + dashboardsOutputDir +
                ", statusPort=" + statusPort +
                ", proxy=" + !proxyEnvironment().isEmpty() +
                '}';
    }
}
