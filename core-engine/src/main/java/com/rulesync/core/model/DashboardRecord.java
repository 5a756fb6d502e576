package com.rulesync.core.model;

import java.util.Objects;

/**
 * A dashboard document parsed from one file.
 *
 * @since 1.0.0
 */
public final class DashboardRecord implements PublishRecord {

    private final String name;
    private final String payload;
    private final String sourcePath;
    private final String title;

    public DashboardRecord(String name, String payload, String sourcePath, String title) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath must not be null");
        this.title = title;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getPayload() {
        return payload;
    }

    @Override
    public String getSourcePath() {
        return sourcePath;
    }

    /**
     * @return the document's {@code title}, or {@code null} when it has none
     */
    public String getTitle() {
        return title;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DashboardRecord that))
            return false;
        return name.equals(that.name) && payload.equals(that.payload)
                && sourcePath.equals(that.sourcePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, payload, sourcePath);
    }

    @Override
    public String toString() {
        return "DashboardRecord{name='" + name + "', sourcePath='" + sourcePath
                + "', title='" + title + "'}";
    }
}
