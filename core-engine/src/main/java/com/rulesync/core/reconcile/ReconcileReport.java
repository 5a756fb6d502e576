package com.rulesync.core.reconcile;

import com.rulesync.core.model.DownstreamKind;
import com.rulesync.core.model.FileError;
import com.rulesync.core.model.WorkloadState;
import com.rulesync.core.model.WorkloadStatus;
import com.rulesync.core.sync.SyncResult;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one completed reconcile pass.
 *
 * @since 1.0.0
 */
public final class ReconcileReport {

    private final TriggerReason reason;
    private final WorkloadState state;
    private final WorkloadStatus status;
    private final SyncResult syncResult;
    private final Map<DownstreamKind, KindOutcome> outcomes;
    private final Instant finishedAt;

    ReconcileReport(TriggerReason reason, WorkloadState state, WorkloadStatus status,
            SyncResult syncResult, Map<DownstreamKind, KindOutcome> outcomes, Instant finishedAt) {
        this.reason = reason;
        this.state = state;
        this.status = status;
        this.syncResult = syncResult;
        this.outcomes = outcomes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(outcomes));
        this.finishedAt = finishedAt;
    }

    public TriggerReason getReason() {
        return reason;
    }

    public WorkloadState getState() {
        return state;
    }

    public WorkloadStatus getStatus() {
        return status;
    }

    /**
     * @return sync result the pass acted on; {@code null} when not configured
     */
    public SyncResult getSyncResult() {
        return syncResult;
    }

    public Map<DownstreamKind, KindOutcome> getOutcomes() {
        return outcomes;
    }

    public KindOutcome getOutcome(DownstreamKind kind) {
        return outcomes.get(kind);
    }

    /**
     * @return per-file errors of every kind
     */
    public List<FileError> getErrors() {
        return outcomes.values().stream()
                .flatMap(o -> o.getErrors().stream())
                .toList();
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    @Override
    public String toString() {
        return "ReconcileReport{" +
                "reason=" + reason +
                ", state=" + state +
                ", status=" + status +
                ", sync=" + syncResult +
                ", outcomes=" + outcomes.values() +
                '}';
    }
}
