package com.rulesync.core.model;

import java.util.Objects;

/**
 * Operator-facing status of the workload.
 *
 * @since 1.0.0
 */
public final class WorkloadStatus {

    public enum Level {
        ACTIVE,
        BLOCKED,
        MAINTENANCE
    }

    private final Level level;
    private final String message;

    private WorkloadStatus(Level level, String message) {
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.message = message == null ? "" : message;
    }

    public static WorkloadStatus active(String message) {
        return new WorkloadStatus(Level.ACTIVE, message);
    }

    public static WorkloadStatus blocked(String message) {
        return new WorkloadStatus(Level.BLOCKED, message);
    }

    public static WorkloadStatus maintenance(String message) {
        return new WorkloadStatus(Level.MAINTENANCE, message);
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WorkloadStatus that))
            return false;
        return level == that.level && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, message);
    }

    @Override
    public String toString() {
        return message.isEmpty() ? level.name() : level + ": " + message;
    }
}
