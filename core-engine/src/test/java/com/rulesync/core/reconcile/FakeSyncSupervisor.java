package com.rulesync.core.reconcile;

import com.rulesync.core.model.SourceSpec;
import com.rulesync.core.sync.SyncResult;
import com.rulesync.core.sync.SyncSupervisor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Scriptable supervisor: reports whatever result the test sets.
 */
class FakeSyncSupervisor implements SyncSupervisor {

    private volatile SyncResult result = SyncResult.succeeded("rev-1", Instant.now());
    private volatile SyncResult oneShotResult;
    private volatile SourceSpec runningFor;
    private final List<String> calls = new ArrayList<>();

    @Override
    public synchronized void ensureRunning(SourceSpec spec) {
        calls.add("ensureRunning");
        runningFor = spec;
    }

    @Override
    public synchronized void stop() {
        calls.add("stop");
        runningFor = null;
    }

    @Override
    public synchronized SyncResult triggerOneShot(SourceSpec spec, Duration timeout) {
        calls.add("oneShot");
        if (oneShotResult != null) {
            result = oneShotResult;
        }
        return result;
    }

    @Override
    public SyncResult lastResult() {
        return result;
    }

    void setResult(SyncResult result) {
        this.result = result;
    }

    void setOneShotResult(SyncResult oneShotResult) {
        this.oneShotResult = oneShotResult;
    }

    boolean isRunning() {
        return runningFor != null;
    }

    SourceSpec runningFor() {
        return runningFor;
    }

    synchronized List<String> calls() {
        return new ArrayList<>(calls);
    }
}
