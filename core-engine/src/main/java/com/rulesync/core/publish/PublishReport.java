package com.rulesync.core.publish;

import com.rulesync.core.model.DownstreamKind;
import com.rulesync.core.model.FileError;

import java.util.List;
import java.util.Objects;

/**
 * Delta applied to one downstream kind by a single publish call.
 *
 * @since 1.0.0
 */
public final class PublishReport {

    private final DownstreamKind kind;
    private final List<String> added;
    private final List<String> updated;
    private final List<String> removed;
    private final List<FileError> errors;

    public PublishReport(DownstreamKind kind, List<String> added, List<String> updated,
            List<String> removed, List<FileError> errors) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.added = List.copyOf(added);
        this.updated = List.copyOf(updated);
        this.removed = List.copyOf(removed);
        this.errors = List.copyOf(errors);
    }

    public DownstreamKind getKind() {
        return kind;
    }

    public List<String> getAdded() {
        return added;
    }

    public List<String> getUpdated() {
        return updated;
    }

    public List<String> getRemoved() {
        return removed;
    }

    /**
     * @return duplicate-identity errors found while building the new set
     */
    public List<FileError> getErrors() {
        return errors;
    }

    /**
     * @return number of downstream writes issued
     */
    public int getWriteCount() {
        return added.size() + updated.size() + removed.size();
    }

    public boolean isNoOp() {
        return getWriteCount() == 0;
    }

    @Override
    public String toString() {
        return "PublishReport{kind=" + kind +
                ", added=" + added +
                ", updated=" + updated +
                ", removed=" + removed +
                ", errors=" + errors.size() +
                '}';
    }
}
