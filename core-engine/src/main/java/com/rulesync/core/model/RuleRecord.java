package com.rulesync.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Rule groups parsed from one rule file.
 *
 * @since 1.0.0
 */
public final class RuleRecord implements PublishRecord {

    private final String name;
    private final String payload;
    private final String sourcePath;
    private final List<String> groupNames;
    private final int ruleCount;

    public RuleRecord(String name, String payload, String sourcePath,
            List<String> groupNames, int ruleCount) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath must not be null");
        this.groupNames = List.copyOf(groupNames);
        this.ruleCount = ruleCount;
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
     * @return published group names, in file order
     */
    public List<String> getGroupNames() {
        return groupNames;
    }

    public int getRuleCount() {
        return ruleCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleRecord that))
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
        return "RuleRecord{name='" + name + "', sourcePath='" + sourcePath
                + "', groups=" + groupNames + ", rules=" + ruleCount + '}';
    }
}
