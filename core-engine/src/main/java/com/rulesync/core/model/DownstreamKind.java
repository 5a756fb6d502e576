package com.rulesync.core.model;

/**
 * The three independent publication targets.
 *
 * @since 1.0.0
 */
public enum DownstreamKind {

    /** Alerting and recording rules for the metrics rule store. */
    METRIC_RULES("metric-rules"),

    /** Alerting and recording rules for the log rule store. */
    LOG_RULES("log-rules"),

    /** Dashboard documents for the dashboard store. */
    DASHBOARDS("dashboards");

    private final String id;

    DownstreamKind(String id) {
        this.id = id;
    }

    /**
     * @return stable, lower-case identifier used in logs and status output
     */
    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
