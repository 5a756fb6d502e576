package com.rulesync.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Externally supplied configuration for one reconcile pass: the optional
 * source and the subpath of each downstream kind inside the mirrored tree.
 *
 * @since 1.0.0
 */
public final class ReconcileSettings {

    public static final String DEFAULT_METRIC_RULES_PATH = "prometheus_alert_rules";
    public static final String DEFAULT_LOG_RULES_PATH = "loki_alert_rules";
    public static final String DEFAULT_DASHBOARDS_PATH = "grafana_dashboards";

    private final SourceSpec source;
    private final String metricRulesPath;
    private final String logRulesPath;
    private final String dashboardsPath;

    public ReconcileSettings(SourceSpec source,
            String metricRulesPath,
            String logRulesPath,
            String dashboardsPath) {
        this.source = source;
        this.metricRulesPath = Objects.requireNonNull(metricRulesPath, "metricRulesPath");
        this.logRulesPath = Objects.requireNonNull(logRulesPath, "logRulesPath");
        this.dashboardsPath = Objects.requireNonNull(dashboardsPath, "dashboardsPath");
    }

    /**
     * Settings with the default subpaths.
     *
     * @param source the source, or {@code null} when unconfigured
     * @return new settings
     */
    public static ReconcileSettings withDefaults(SourceSpec source) {
        return new ReconcileSettings(source, DEFAULT_METRIC_RULES_PATH,
                DEFAULT_LOG_RULES_PATH, DEFAULT_DASHBOARDS_PATH);
    }

    public Optional<SourceSpec> getSource() {
        return Optional.ofNullable(source);
    }

    public String subpathFor(DownstreamKind kind) {
        return switch (kind) {
            case METRIC_RULES -> metricRulesPath;
            case LOG_RULES -> logRulesPath;
            case DASHBOARDS -> dashboardsPath;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ReconcileSettings that))
            return false;
        return Objects.equals(source, that.source)
                && metricRulesPath.equals(that.metricRulesPath)
                && logRulesPath.equals(that.logRulesPath)
                && dashboardsPath.equals(that.dashboardsPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, metricRulesPath, logRulesPath, dashboardsPath);
    }

    @Override
    public String toString() {
        return "ReconcileSettings{" +
                "source=" + source +
                ", metricRulesPath='" + metricRulesPath + '\'' +
                ", logRulesPath='" + logRulesPath + '\'' +
                ", dashboardsPath='" + dashboardsPath + '\'' +
                '}';
    }
}
