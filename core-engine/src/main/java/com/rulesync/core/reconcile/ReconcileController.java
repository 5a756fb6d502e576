package com.rulesync.core.reconcile;

import com.rulesync.core.hash.ContentHasher;
import com.rulesync.core.loader.AbstractFileLoader;
import com.rulesync.core.loader.DashboardLoader;
import com.rulesync.core.loader.RuleLoader;
import com.rulesync.core.model.ContentDigest;
import com.rulesync.core.model.DownstreamKind;
import com.rulesync.core.model.FileError;
import com.rulesync.core.model.LoadResult;
import com.rulesync.core.model.ReconcileSettings;
import com.rulesync.core.model.SourceSpec;
import com.rulesync.core.model.WorkloadState;
import com.rulesync.core.model.WorkloadStatus;
import com.rulesync.core.publish.DownstreamChannel;
import com.rulesync.core.publish.PublishException;
import com.rulesync.core.publish.PublishReport;
import com.rulesync.core.publish.RelationPublisher;
import com.rulesync.core.support.ContentReadException;
import com.rulesync.core.sync.SyncResult;
import com.rulesync.core.sync.SyncSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Drives the workload towards the state its settings describe.
 *
 * <h3>Pass algorithm</h3>
 * <ol>
 * <li>Read the current {@link ReconcileSettings} and compute the desired
 * {@link WorkloadState}.</li>
 * <li>Not configured: stop the sync agent, clear every attached kind and
 * forget all applied digests.</li>
 * <li>Configured: make sure the agent runs (or run a one-shot sync for a
 * manual request) and read its result. A failed or pending sync leaves
 * published content untouched.</li>
 * <li>After a successful sync, per kind: hash the subpath; when the digest
 * equals the last applied one, stop there. Otherwise load, publish, and
 * record the digest once the publish has completed.</li>
 * </ol>
 *
 * <h3>Serialization</h3>
 * <p>
 * At most one pass runs at a time. A trigger that arrives while a pass is in
 * flight sets a rerun flag and returns; the running thread performs exactly
 * one more pass when it finishes, however many triggers were coalesced.
 * Channel attach and detach requests are queued and applied at the start of
 * the next pass, so the publisher and the applied digests are only touched
 * from inside a pass.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Nothing escapes a pass. Per-file problems are reported as warnings; a read
 * or publish failure marks that kind {@link KindOutcome.Status#FAILED} and
 * leaves its digest unchanged so the whole kind is retried on the next
 * trigger.
 * </p>
 *
 * @since 1.0.0
 */
public class ReconcileController {

    private static final Logger LOG = LoggerFactory.getLogger(ReconcileController.class);

    static final String NOT_CONFIGURED = "Source location not configured";

    private final SyncSupervisor supervisor;
    private final ContentHasher hasher;
    private final RelationPublisher publisher;
    private final Map<DownstreamKind, AbstractFileLoader<?>> loaders;
    private final Supplier<ReconcileSettings> settingsSource;
    private final Path contentRoot;
    private final Duration oneShotTimeout;

    private final ReentrantLock passLock = new ReentrantLock();
    private final AtomicBoolean rerunRequested = new AtomicBoolean(false);
    private final AtomicReference<TriggerReason> pendingReason = new AtomicReference<>(TriggerReason.STARTUP);
    private final Queue<ChannelChange> channelChanges = new ConcurrentLinkedQueue<>();
    private final AtomicLong passCount = new AtomicLong();

    /** Guarded by {@link #passLock}. */
    private final Map<DownstreamKind, ContentDigest> lastApplied = new EnumMap<>(DownstreamKind.class);

    private volatile WorkloadState state = WorkloadState.UNINITIALIZED;
    private volatile WorkloadStatus status = WorkloadStatus.maintenance("Starting");
    private volatile ReconcileReport lastReport;

    private ReconcileController(Builder b) {
        this.supervisor = b.supervisor;
        this.hasher = b.hasher;
        this.publisher = b.publisher;
        this.loaders = new EnumMap<>(b.loaders);
        this.settingsSource = b.settingsSource;
        this.contentRoot = b.contentRoot;
        this.oneShotTimeout = b.oneShotTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Triggers
    // ---------------------------------------------------------------

    /**
     * Request a reconcile pass.
     *
     * <p>
     * If no pass is running, the calling thread runs it (and any pass
     * requested meanwhile). Otherwise the request is coalesced into a single
     * rerun performed by the thread that owns the current pass.
     * </p>
     *
     * @param reason why the pass is requested
     * @return {@code true} if this call ran at least one pass, {@code false}
     *         if it was coalesced
     */
    public boolean requestReconcile(TriggerReason reason) {
        Objects.requireNonNull(reason, "reason must not be null");
        pendingReason.set(reason);
        rerunRequested.set(true);

        boolean ran = false;
        // Re-check after unlocking: a trigger may have lost tryLock just before we released it.
        while (rerunRequested.get()) {
            if (!passLock.tryLock()) {
                LOG.debug("Pass in flight; coalesced trigger {}", reason);
                return ran;
            }
            try {
                while (rerunRequested.getAndSet(false)) {
                    runPass(pendingReason.get(), settingsSource.get(), false);
                    ran = true;
                }
            } finally {
                passLock.unlock();
            }
        }
        return ran;
    }

    /**
     * Manual re-sync: run a one-shot sync, then a full pass. Waits for an
     * in-flight pass to finish first.
     *
     * @return success with the sync output, or failure with its message
     */
    public SyncNowResult syncNow() {
        SyncNowResult result;
        passLock.lock();
        try {
            ReconcileSettings settings = settingsSource.get();
            if (settings.getSource().isEmpty()) {
                return SyncNowResult.failed(NOT_CONFIGURED, List.of(), null);
            }
            LOG.info("Manual sync requested");
            ReconcileReport report = runPass(TriggerReason.MANUAL_SYNC, settings, true);
            SyncResult sync = report.getSyncResult();
            result = sync != null && sync.isSucceeded()
                    ? SyncNowResult.succeeded(sync.getOutput(), sync.getDetails(), report)
                    : SyncNowResult.failed(sync != null ? sync.getMessage() : NOT_CONFIGURED,
                            sync != null ? sync.getDetails() : List.of(), report);
        } finally {
            passLock.unlock();
        }
        if (rerunRequested.get()) {
            requestReconcile(pendingReason.get());
        }
        return result;
    }

    /**
     * Attach a downstream channel; takes effect at the start of the next pass,
     * which this call requests. The kind is fully re-evaluated against the
     * channel's current content.
     *
     * @param channel joined channel
     */
    public void attachChannel(DownstreamChannel channel) {
        Objects.requireNonNull(channel, "channel must not be null");
        channelChanges.add(new ChannelChange(channel.getKind(), channel));
        requestReconcile(TriggerReason.CHANNEL_JOINED);
    }

    /**
     * Detach the channel of a kind; publishing for it is deferred until a
     * channel joins again.
     *
     * @param kind departed kind
     */
    public void detachChannel(DownstreamKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        channelChanges.add(new ChannelChange(kind, null));
        requestReconcile(TriggerReason.CHANNEL_LEFT);
    }

    // ---------------------------------------------------------------
    // Observers
    // ---------------------------------------------------------------

    public WorkloadState getState() {
        return state;
    }

    public WorkloadStatus getStatus() {
        return status;
    }

    /**
     * @return report of the last completed pass; {@code null} before the
     *         first one
     */
    public ReconcileReport getLastReport() {
        return lastReport;
    }

    public long getPassCount() {
        return passCount.get();
    }

    // ---------------------------------------------------------------
    // Pass
    // ---------------------------------------------------------------

    private ReconcileReport runPass(TriggerReason reason, ReconcileSettings settings, boolean oneShot) {
        applyChannelChanges();

        WorkloadState desired = state.next(settings.getSource().isPresent());
        LOG.debug("Reconcile pass ({}): {} -> {}", reason, state, desired);

        ReconcileReport report = desired == WorkloadState.CONFIGURED
                ? convergeConfigured(reason, settings, settings.getSource().get(), oneShot)
                : convergeUnconfigured(reason, desired);

        status = report.getStatus();
        lastReport = report;
        passCount.incrementAndGet();
        return report;
    }

    private ReconcileReport convergeUnconfigured(TriggerReason reason, WorkloadState desired) {
        try {
            supervisor.stop();
        } catch (RuntimeException e) {
            LOG.warn("Failed to stop sync agent: {}", e.getMessage(), e);
        }

        Map<DownstreamKind, KindOutcome> outcomes = new EnumMap<>(DownstreamKind.class);
        for (DownstreamKind kind : DownstreamKind.values()) {
            if (!publisher.isAttached(kind)) {
                outcomes.put(kind, KindOutcome.of(kind, KindOutcome.Status.DEFERRED, "No channel attached"));
                continue;
            }
            try {
                PublishReport cleared = publisher.clear(kind);
                outcomes.put(kind, new KindOutcome(kind, KindOutcome.Status.CLEARED, null,
                        cleared, List.of(), ""));
            } catch (PublishException e) {
                LOG.warn("Failed to clear {}: {}", kind, e.getMessage());
                outcomes.put(kind, KindOutcome.of(kind, KindOutcome.Status.FAILED, e.getMessage()));
            }
        }
        lastApplied.clear();
        transition(desired);

        return new ReconcileReport(reason, state, WorkloadStatus.blocked(NOT_CONFIGURED),
                null, outcomes, Instant.now());
    }

    private ReconcileReport convergeConfigured(TriggerReason reason, ReconcileSettings settings,
            SourceSpec spec, boolean oneShot) {
        SyncResult sync = oneShot ? runOneShot(spec) : pollAgent(spec);
        transition(WorkloadState.CONFIGURED);

        Map<DownstreamKind, KindOutcome> outcomes = new EnumMap<>(DownstreamKind.class);
        WorkloadStatus passStatus;

        switch (sync.getOutcome()) {
            case FAILED -> {
                LOG.warn("Sync failed, keeping published content: {}", sync.getMessage());
                skipAll(outcomes, "Sync failed");
                passStatus = WorkloadStatus.blocked("Sync failed: " + sync.getMessage());
            }
            case PENDING -> {
                LOG.info("No mirrored revision yet; nothing to publish");
                skipAll(outcomes, "Waiting for first sync");
                passStatus = WorkloadStatus.blocked(sync.getMessage().isEmpty()
                        ? "Waiting for first sync"
                        : "Waiting for first sync: " + sync.getMessage());
            }
            default -> {
                for (DownstreamKind kind : DownstreamKind.values()) {
                    outcomes.put(kind, reconcileKindSafely(kind, settings.subpathFor(kind), spec));
                }
                passStatus = summarize(outcomes);
            }
        }

        return new ReconcileReport(reason, state, passStatus, sync, outcomes, Instant.now());
    }

    /**
     * One kind's failure must not abort the pass for the others.
     */
    private KindOutcome reconcileKindSafely(DownstreamKind kind, String subpath, SourceSpec spec) {
        try {
            return reconcileKind(kind, subpath, spec);
        } catch (RuntimeException e) {
            LOG.warn("Reconciling {} failed: {}", kind, e.getMessage(), e);
            return KindOutcome.of(kind, KindOutcome.Status.FAILED, String.valueOf(e.getMessage()));
        }
    }

    private KindOutcome reconcileKind(DownstreamKind kind, String subpath, SourceSpec spec) {
        if (!publisher.isAttached(kind)) {
            return KindOutcome.of(kind, KindOutcome.Status.DEFERRED, "No channel attached");
        }
        AbstractFileLoader<?> loader = loaders.get(kind);

        ContentDigest digest;
        try {
            digest = hasher.digest(contentRoot, subpath, loader::accepts, spec.fingerprint() + '|' + kind.id());
        } catch (ContentReadException e) {
            LOG.warn("Cannot hash {} content: {}", kind, e.getMessage());
            return failedRead(kind, subpath, e);
        }

        if (digest.equals(lastApplied.get(kind))) {
            LOG.debug("{} unchanged (digest {}); skipping", kind, digest);
            return new KindOutcome(kind, KindOutcome.Status.UNCHANGED, digest, null, List.of(), "");
        }

        LoadResult<?> loaded;
        try {
            loaded = loader.load(contentRoot, subpath);
        } catch (ContentReadException e) {
            LOG.warn("Cannot load {} content: {}", kind, e.getMessage());
            return failedRead(kind, subpath, e);
        }

        PublishReport report;
        try {
            report = publisher.publish(kind, loaded.getRecords());
        } catch (PublishException e) {
            LOG.warn("Publishing {} failed; will retry on next trigger: {}", kind, e.getMessage());
            return new KindOutcome(kind, KindOutcome.Status.FAILED, digest, null,
                    loaded.getErrors(), e.getMessage());
        }
        lastApplied.put(kind, digest);

        List<FileError> errors = new ArrayList<>(loaded.getErrors());
        errors.addAll(report.getErrors());
        return new KindOutcome(kind, KindOutcome.Status.PUBLISHED, digest, report, errors, "");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private SyncResult pollAgent(SourceSpec spec) {
        try {
            supervisor.ensureRunning(spec);
            return supervisor.lastResult();
        } catch (RuntimeException e) {
            LOG.warn("Sync agent unavailable: {}", e.getMessage(), e);
            return SyncResult.failed("Sync agent unavailable: " + e.getMessage(), Instant.now());
        }
    }

    private SyncResult runOneShot(SourceSpec spec) {
        try {
            // restart continuous syncing for this source too, not only the one-shot
            supervisor.ensureRunning(spec);
            return supervisor.triggerOneShot(spec, oneShotTimeout);
        } catch (RuntimeException e) {
            LOG.warn("One-shot sync could not run: {}", e.getMessage(), e);
            return SyncResult.failed("One-shot sync could not run: " + e.getMessage(), Instant.now());
        }
    }

    private void applyChannelChanges() {
        ChannelChange change;
        while ((change = channelChanges.poll()) != null) {
            if (change.channel == null) {
                publisher.detach(change.kind);
            } else {
                publisher.attach(change.channel);
            }
            lastApplied.remove(change.kind);
        }
    }

    private void transition(WorkloadState desired) {
        if (state != desired) {
            LOG.info("Workload state {} -> {}", state, desired);
            state = desired;
        }
    }

    private static void skipAll(Map<DownstreamKind, KindOutcome> outcomes, String message) {
        for (DownstreamKind kind : DownstreamKind.values()) {
            outcomes.put(kind, KindOutcome.of(kind, KindOutcome.Status.SKIPPED, message));
        }
    }

    private static KindOutcome failedRead(DownstreamKind kind, String subpath, ContentReadException e) {
        FileError error = new FileError(kind, subpath, FileError.Type.CONTENT_READ, e.getMessage());
        return new KindOutcome(kind, KindOutcome.Status.FAILED, null, null, List.of(error), e.getMessage());
    }

    private static WorkloadStatus summarize(Map<DownstreamKind, KindOutcome> outcomes) {
        List<String> failed = outcomes.values().stream()
                .filter(o -> o.getStatus() == KindOutcome.Status.FAILED)
                .map(o -> o.getKind().id())
                .toList();
        if (!failed.isEmpty()) {
            return WorkloadStatus.blocked("Publishing failed for " + String.join(", ", failed));
        }
        long rejected = outcomes.values().stream()
                .mapToLong(o -> o.getErrors().size())
                .sum();
        return rejected == 0
                ? WorkloadStatus.active("")
                : WorkloadStatus.active(rejected + " file(s) rejected");
    }

    private static final class ChannelChange {
        private final DownstreamKind kind;
        private final DownstreamChannel channel;

        private ChannelChange(DownstreamKind kind, DownstreamChannel channel) {
            this.kind = kind;
            this.channel = channel;
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ReconcileController}.
     *
     * <p>
     * Loaders default to a {@link RuleLoader} per rule kind and a
     * {@link DashboardLoader}; the hasher and publisher default to fresh
     * instances.
     * </p>
     */
    public static class Builder {
        private SyncSupervisor supervisor;
        private ContentHasher hasher = new ContentHasher();
        private RelationPublisher publisher = new RelationPublisher();
        private final Map<DownstreamKind, AbstractFileLoader<?>> loaders = new EnumMap<>(DownstreamKind.class);
        private Supplier<ReconcileSettings> settingsSource;
        private Path contentRoot;
        private Duration oneShotTimeout = Duration.ofMinutes(2);

        private Builder() {
            loaders.put(DownstreamKind.METRIC_RULES, new RuleLoader(DownstreamKind.METRIC_RULES));
            loaders.put(DownstreamKind.LOG_RULES, new RuleLoader(DownstreamKind.LOG_RULES));
            loaders.put(DownstreamKind.DASHBOARDS, new DashboardLoader());
        }

        public Builder supervisor(SyncSupervisor v) {
            this.supervisor = v;
            return this;
        }

        public Builder hasher(ContentHasher v) {
            this.hasher = v;
            return this;
        }

        public Builder publisher(RelationPublisher v) {
            this.publisher = v;
            return this;
        }

        /**
         * Replace the loader for the loader's own kind.
         */
        public Builder loader(AbstractFileLoader<?> v) {
            this.loaders.put(v.getKind(), v);
            return this;
        }

        public Builder settingsSource(Supplier<ReconcileSettings> v) {
            this.settingsSource = v;
            return this;
        }

        public Builder contentRoot(Path v) {
            this.contentRoot = v;
            return this;
        }

        public Builder oneShotTimeout(Duration v) {
            this.oneShotTimeout = v;
            return this;
        }

        /**
         * @return a new controller in state {@link WorkloadState#UNINITIALIZED}
         * @throws NullPointerException     if a required collaborator is missing
         * @throws IllegalArgumentException if the timeout is not positive
         */
        public ReconcileController build() {
            Objects.requireNonNull(supervisor, "supervisor required");
            Objects.requireNonNull(hasher, "hasher required");
            Objects.requireNonNull(publisher, "publisher required");
            Objects.requireNonNull(settingsSource, "settingsSource required");
            Objects.requireNonNull(contentRoot, "contentRoot required");
            Objects.requireNonNull(oneShotTimeout, "oneShotTimeout required");
            if (oneShotTimeout.isZero() || oneShotTimeout.isNegative()) {
                throw new IllegalArgumentException("oneShotTimeout must be positive, got: " + oneShotTimeout);
            }
            return new ReconcileController(this);
        }
    }
}
