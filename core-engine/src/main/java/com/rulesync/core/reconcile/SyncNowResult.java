package com.rulesync.core.reconcile;

import java.util.List;

/**
 * Result of the manual sync-now action.
 *
 * @since 1.0.0
 */
public final class SyncNowResult {

    private final boolean success;
    private final String message;
    private final String output;
    private final List<String> details;
    private final ReconcileReport report;

    private SyncNowResult(boolean success, String message, String output,
            List<String> details, ReconcileReport report) {
        this.success = success;
        this.message = message == null ? "" : message;
        this.output = output == null ? "" : output;
        this.details = List.copyOf(details);
        this.report = report;
    }

    static SyncNowResult succeeded(String output, List<String> warnings, ReconcileReport report) {
        return new SyncNowResult(true, "", output, warnings, report);
    }

    static SyncNowResult failed(String message, List<String> details, ReconcileReport report) {
        return new SyncNowResult(false, message, null, details, report);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return failure message; empty on success
     */
    public String getMessage() {
        return message;
    }

    /**
     * @return captured output of the one-shot sync
     */
    public String getOutput() {
        return output;
    }

    /**
     * @return warning lines on success, diagnostic lines on failure
     */
    public List<String> getDetails() {
        return details;
    }

    /**
     * @return the pass that followed the sync; {@code null} if none ran
     */
    public ReconcileReport getReport() {
        return report;
    }

    @Override
    public String toString() {
        return "SyncNowResult{success=" + success + ", message='" + message + "'}";
    }
}
