package com.rulesync.core.reconcile;

import com.rulesync.core.loader.RuleLoader;
import com.rulesync.core.model.DownstreamKind;
import com.rulesync.core.model.FileError;
import com.rulesync.core.model.ReconcileSettings;
import com.rulesync.core.model.SourceSpec;
import com.rulesync.core.model.WorkloadState;
import com.rulesync.core.model.WorkloadStatus;
import com.rulesync.core.publish.InMemoryChannel;
import com.rulesync.core.sync.SyncResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link ReconcileController}.
 */
class ReconcileControllerTest {

    private static final SourceSpec SPEC = SourceSpec.builder()
            .location("https://example.com/rules.git")
            .branch("main")
            .build();

    private static final String VALID_RULE = "alert: InstanceDown\nexpr: up == 0\n";

    @TempDir
    Path root;

    private FakeSyncSupervisor supervisor;
    private AtomicReference<ReconcileSettings> settings;
    private Map<DownstreamKind, InMemoryChannel> channels;
    private RuleLoader metricLoader;
    private ReconcileController controller;

    @BeforeEach
    void setUp() {
        supervisor = new FakeSyncSupervisor();
        settings = new AtomicReference<>(ReconcileSettings.withDefaults(null));
        metricLoader = spy(new RuleLoader(DownstreamKind.METRIC_RULES));
        controller = ReconcileController.builder()
                .supervisor(supervisor)
                .loader(metricLoader)
                .settingsSource(settings::get)
                .contentRoot(root)
                .build();

        channels = new EnumMap<>(DownstreamKind.class);
        for (DownstreamKind kind : DownstreamKind.values()) {
            InMemoryChannel channel = new InMemoryChannel(kind);
            channels.put(kind, channel);
            controller.attachChannel(channel);
        }
        settings.set(ReconcileSettings.withDefaults(SPEC));
    }

    @Test
    @DisplayName("Two valid rule files and one malformed file: 2 records published, 1 warning, CONFIGURED")
    void shouldPublishValidFilesAndReportInvalidOne() throws IOException {
        write("prometheus_alert_rules/a.rule", VALID_RULE);
        write("prometheus_alert_rules/b.rule", "groups:\n  - name: g\n    rules:\n      - record: r\n        expr: sum(up)\n");
        write("prometheus_alert_rules/c.rule", "alert: [");

        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);

        ReconcileReport report = controller.getLastReport();
        KindOutcome metric = report.getOutcome(DownstreamKind.METRIC_RULES);
        assertThat(controller.getState()).isEqualTo(WorkloadState.CONFIGURED);
        assertThat(metric.getStatus()).isEqualTo(KindOutcome.Status.PUBLISHED);
        assertThat(metric.getPublishReport().getAdded()).containsExactly("a", "b");
        assertThat(metric.getErrors()).singleElement()
                .satisfies(e -> assertThat(e.getSourcePath()).isEqualTo("c.rule"));
        assertThat(channels.get(DownstreamKind.METRIC_RULES).content()).containsOnlyKeys("a", "b");
        assertThat(controller.getStatus()).isEqualTo(WorkloadStatus.active("1 file(s) rejected"));
    }

    @Test
    @DisplayName("Unchanged content skips loaders and keeps the digest")
    void shouldTakeFastPathWhenDigestUnchanged() throws IOException {
        write("prometheus_alert_rules/a.rule", VALID_RULE);
        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);
        KindOutcome first = controller.getLastReport().getOutcome(DownstreamKind.METRIC_RULES);
        channels.get(DownstreamKind.METRIC_RULES).resetCounters();

        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);

        KindOutcome second = controller.getLastReport().getOutcome(DownstreamKind.METRIC_RULES);
        assertThat(second.getStatus()).isEqualTo(KindOutcome.Status.UNCHANGED);
        assertThat(second.getDigest()).isEqualTo(first.getDigest());
        assertThat(channels.get(DownstreamKind.METRIC_RULES).writes()).isZero();
        verify(metricLoader, times(1)).load(any(), anyString());
    }

    @Test
    @DisplayName("Changed content is republished with only the delta")
    void shouldRepublishOnChange() throws IOException {
        write("prometheus_alert_rules/a.rule", VALID_RULE);
        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);
        channels.get(DownstreamKind.METRIC_RULES).resetCounters();

        write("prometheus_alert_rules/b.rule", VALID_RULE);
        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);

        KindOutcome outcome = controller.getLastReport().getOutcome(DownstreamKind.METRIC_RULES);
        assertThat(outcome.getPublishReport().getAdded()).containsExactly("b");
        assertThat(channels.get(DownstreamKind.METRIC_RULES).writes()).isEqualTo(1);
    }

    @Test
    @DisplayName("Clearing the location clears all kinds and goes IDLE")
    void shouldClearEverythingWhenLocationRemoved() throws IOException {
        write("prometheus_alert_rules/a.rule", VALID_RULE);
        write("loki_alert_rules/a.rule", "alert: Errors\nexpr: sum(rate({job=\"x\"} |= \"error\" [5m])) > 0\n");
        write("grafana_dashboards/board.json", "{\"title\": \"Board\"}");
        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);
        assertThat(channels.values()).allSatisfy(c -> assertThat(c.content()).isNotEmpty());

        settings.set(ReconcileSettings.withDefaults(null));
        controller.requestReconcile(TriggerReason.SETTINGS_CHANGED);

        assertThat(controller.getState()).isEqualTo(WorkloadState.IDLE);
        assertThat(channels.values()).allSatisfy(c -> assertThat(c.content()).isEmpty());
        assertThat(supervisor.isRunning()).isFalse();
        assertThat(controller.getStatus().getLevel()).isEqualTo(WorkloadStatus.Level.BLOCKED);
    }

    @Test
    @DisplayName("Without a location the workload stays UNINITIALIZED and publishes nothing")
    void shouldStayUninitializedWithoutLocation() throws IOException {
        write("prometheus_alert_rules/a.rule", VALID_RULE);
        settings.set(ReconcileSettings.withDefaults(null));

        controller.requestReconcile(TriggerReason.STARTUP);

        assertThat(controller.getState()).isEqualTo(WorkloadState.UNINITIALIZED);
        assertThat(controller.getPassCount()).isEqualTo(4);
        assertThat(channels.values()).allSatisfy(c -> assertThat(c.content()).isEmpty());
        assertThat(supervisor.calls()).doesNotContain("ensureRunning");
    }

    @Test
    @DisplayName("A failed sync keeps published content and the applied digest")
    void shouldKeepContentWhenSyncFails() throws IOException {
        write("prometheus_alert_rules/a.rule", VALID_RULE);
        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);
        Map<String, String> before = Map.copyOf(channels.get(DownstreamKind.METRIC_RULES).content());

        supervisor.setResult(SyncResult.failed("could not resolve host", Instant.now()));
        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);

        assertThat(controller.getState()).isEqualTo(WorkloadState.CONFIGURED);
        assertThat(controller.getStatus())
                .isEqualTo(WorkloadStatus.blocked("Sync failed: could not resolve host"));
        assertThat(channels.get(DownstreamKind.METRIC_RULES).content()).isEqualTo(before);
        assertThat(controller.getLastReport().getOutcome(DownstreamKind.METRIC_RULES).getStatus())
                .isEqualTo(KindOutcome.Status.SKIPPED);

        supervisor.setResult(SyncResult.succeeded("rev-1", Instant.now()));
        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);

        assertThat(controller.getLastReport().getOutcome(DownstreamKind.METRIC_RULES).getStatus())
                .isEqualTo(KindOutcome.Status.UNCHANGED);
    }

    @Test
    @DisplayName("Pending sync publishes nothing and reports waiting")
    void shouldWaitForFirstSync() throws IOException {
        write("prometheus_alert_rules/a.rule", VALID_RULE);
        supervisor.setResult(SyncResult.pending(""));

        controller.requestReconcile(TriggerReason.STARTUP);

        assertThat(controller.getStatus()).isEqualTo(WorkloadStatus.blocked("Waiting for first sync"));
        assertThat(channels.get(DownstreamKind.METRIC_RULES).content()).isEmpty();
        verify(metricLoader, never()).load(any(), anyString());
    }

    @Test
    @DisplayName("Publish failure leaves the digest so the next trigger retries the whole kind")
    void shouldRetryAfterPublishFailure() throws IOException {
        write("prometheus_alert_rules/a.rule", VALID_RULE);
        InMemoryChannel metric = channels.get(DownstreamKind.METRIC_RULES);
        metric.setFailing(true);

        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);

        assertThat(controller.getLastReport().getOutcome(DownstreamKind.METRIC_RULES).getStatus())
                .isEqualTo(KindOutcome.Status.FAILED);
        assertThat(controller.getStatus().getLevel()).isEqualTo(WorkloadStatus.Level.BLOCKED);

        metric.setFailing(false);
        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);

        assertThat(controller.getLastReport().getOutcome(DownstreamKind.METRIC_RULES).getStatus())
                .isEqualTo(KindOutcome.Status.PUBLISHED);
        assertThat(metric.content()).containsOnlyKeys("a");
    }

    @Test
    @DisplayName("A kind without a channel is deferred and published once it joins")
    void shouldDeferUntilChannelJoins() throws IOException {
        write("grafana_dashboards/board.json", "{\"title\": \"Board\"}");
        controller.detachChannel(DownstreamKind.DASHBOARDS);

        assertThat(controller.getState()).isEqualTo(WorkloadState.CONFIGURED);
        assertThat(controller.getLastReport().getOutcome(DownstreamKind.DASHBOARDS).getStatus())
                .isEqualTo(KindOutcome.Status.DEFERRED);

        InMemoryChannel rejoined = new InMemoryChannel(DownstreamKind.DASHBOARDS);
        controller.attachChannel(rejoined);

        assertThat(controller.getLastReport().getReason()).isEqualTo(TriggerReason.CHANNEL_JOINED);
        assertThat(rejoined.content()).containsOnlyKeys("board");
    }

    @Test
    @DisplayName("Duplicate record names: earlier path published, later one reported")
    void shouldReportDuplicateIdentity() throws IOException {
        write("prometheus_alert_rules/team/api.rule", VALID_RULE);
        write("prometheus_alert_rules/team_api.rule", "alert: Other\nexpr: up == 1\n");

        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);

        KindOutcome outcome = controller.getLastReport().getOutcome(DownstreamKind.METRIC_RULES);
        assertThat(channels.get(DownstreamKind.METRIC_RULES).content()).containsOnlyKeys("team_api");
        assertThat(channels.get(DownstreamKind.METRIC_RULES).content().get("team_api")).contains("InstanceDown");
        assertThat(outcome.getErrors()).singleElement().satisfies(e -> {
            assertThat(e.getType()).isEqualTo(FileError.Type.DUPLICATE_IDENTITY);
            assertThat(e.getSourcePath()).isEqualTo("team_api.rule");
        });
    }

    @Test
    @DisplayName("Manual sync runs a one-shot before the pass and returns its output")
    void shouldRunOneShotOnManualSync() throws IOException {
        write("prometheus_alert_rules/a.rule", VALID_RULE);
        supervisor.setOneShotResult(SyncResult.succeeded("rev-2", Instant.now(), "synced rev-2", List.of()));

        SyncNowResult result = controller.syncNow();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutput()).isEqualTo("synced rev-2");
        assertThat(result.getReport().getReason()).isEqualTo(TriggerReason.MANUAL_SYNC);
        assertThat(supervisor.calls()).contains("oneShot");
        assertThat(channels.get(DownstreamKind.METRIC_RULES).content()).containsOnlyKeys("a");
    }

    @Test
    @DisplayName("Manual sync after a source change moves continuous syncing to the new source")
    void shouldRestartContinuousSyncOnManualSync() throws IOException {
        write("prometheus_alert_rules/a.rule", VALID_RULE);
        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);
        assertThat(supervisor.runningFor()).isEqualTo(SPEC);

        SourceSpec other = SourceSpec.builder().location("https://example.com/other.git").build();
        settings.set(ReconcileSettings.withDefaults(other));
        controller.syncNow();

        List<String> calls = supervisor.calls();
        assertThat(calls.subList(calls.size() - 2, calls.size())).containsExactly("ensureRunning", "oneShot");
        assertThat(supervisor.runningFor()).isEqualTo(other);
    }

    @Test
    @DisplayName("Manual sync fails fast without a location")
    void shouldFailManualSyncWithoutLocation() {
        settings.set(ReconcileSettings.withDefaults(null));
        int callsBefore = supervisor.calls().size();

        SyncNowResult result = controller.syncNow();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo(ReconcileController.NOT_CONFIGURED);
        assertThat(supervisor.calls()).hasSize(callsBefore);
    }

    @Test
    @DisplayName("Manual sync failure is reported and leaves content untouched")
    void shouldReportManualSyncFailure() throws IOException {
        write("prometheus_alert_rules/a.rule", VALID_RULE);
        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);
        supervisor.setOneShotResult(SyncResult.failed("Exited with code 1.", Instant.now(),
                List.of("fatal: repository not found")));

        SyncNowResult result = controller.syncNow();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Exited with code 1.");
        assertThat(result.getDetails()).containsExactly("fatal: repository not found");
        assertThat(channels.get(DownstreamKind.METRIC_RULES).content()).containsOnlyKeys("a");
    }

    @Test
    @DisplayName("A malformed subpath fails only its own kind and the pass completes")
    void shouldIsolateMalformedSubpath() throws IOException {
        write("loki_alert_rules/a.rule", "alert: Errors\nexpr: sum(rate({job=\"x\"} |= \"error\" [5m])) > 0\n");
        write("grafana_dashboards/board.json", "{\"title\": \"Board\"}");
        settings.set(new ReconcileSettings(SPEC, "bad\u0000path",
                ReconcileSettings.DEFAULT_LOG_RULES_PATH, ReconcileSettings.DEFAULT_DASHBOARDS_PATH));
        long passesBefore = controller.getPassCount();

        controller.requestReconcile(TriggerReason.SETTINGS_CHANGED);

        ReconcileReport report = controller.getLastReport();
        assertThat(controller.getPassCount()).isEqualTo(passesBefore + 1);
        assertThat(report.getOutcome(DownstreamKind.METRIC_RULES).getStatus()).isEqualTo(KindOutcome.Status.FAILED);
        assertThat(report.getOutcome(DownstreamKind.LOG_RULES).getStatus()).isEqualTo(KindOutcome.Status.PUBLISHED);
        assertThat(report.getOutcome(DownstreamKind.DASHBOARDS).getStatus()).isEqualTo(KindOutcome.Status.PUBLISHED);
        assertThat(controller.getStatus().getLevel()).isEqualTo(WorkloadStatus.Level.BLOCKED);
    }

    @Test
    @DisplayName("A symlinked rules directory is published through its target")
    void shouldPublishThroughSymlinkedSubpath() throws IOException {
        write("shared/rules/a.rule", VALID_RULE);
        try {
            Files.createSymbolicLink(root.resolve("prometheus_alert_rules"), root.resolve("shared/rules"));
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported: " + e.getMessage());
        }

        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);

        KindOutcome metric = controller.getLastReport().getOutcome(DownstreamKind.METRIC_RULES);
        assertThat(metric.getStatus()).isEqualTo(KindOutcome.Status.PUBLISHED);
        assertThat(channels.get(DownstreamKind.METRIC_RULES).content()).containsOnlyKeys("a");
    }

    @Test
    @DisplayName("Changing the source location republishes even with identical files")
    void shouldRepublishWhenSourceChanges() throws IOException {
        write("prometheus_alert_rules/a.rule", VALID_RULE);
        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);

        settings.set(ReconcileSettings.withDefaults(
                SourceSpec.builder().location("https://example.com/other.git").build()));
        controller.requestReconcile(TriggerReason.SETTINGS_CHANGED);

        KindOutcome outcome = controller.getLastReport().getOutcome(DownstreamKind.METRIC_RULES);
        assertThat(outcome.getStatus()).isEqualTo(KindOutcome.Status.PUBLISHED);
        assertThat(outcome.getPublishReport().isNoOp()).isTrue();
    }

    @Test
    @DisplayName("Triggers during a running pass collapse into exactly one rerun")
    void shouldCoalesceTriggersDuringPass() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean firstCall = new AtomicBoolean(true);
        FakeSyncSupervisor blocking = new FakeSyncSupervisor() {
            @Override
            public void ensureRunning(SourceSpec spec) {
                if (firstCall.getAndSet(false)) {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                super.ensureRunning(spec);
            }
        };
        ReconcileController serial = ReconcileController.builder()
                .supervisor(blocking)
                .settingsSource(() -> ReconcileSettings.withDefaults(SPEC))
                .contentRoot(root)
                .build();

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> owner = executor.submit(() -> serial.requestReconcile(TriggerReason.SCHEDULED_TICK));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(serial.requestReconcile(TriggerReason.SETTINGS_CHANGED)).isFalse();
            assertThat(serial.requestReconcile(TriggerReason.SCHEDULED_TICK)).isFalse();
            assertThat(serial.requestReconcile(TriggerReason.SCHEDULED_TICK)).isFalse();
            release.countDown();

            assertThat(owner.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }
        assertThat(serial.getPassCount()).isEqualTo(2);
        assertThat(serial.getLastReport().getReason()).isEqualTo(TriggerReason.SCHEDULED_TICK);
    }

    @Test
    @DisplayName("A restarted controller over already published content writes nothing")
    void shouldNotRewriteAfterRestart() throws IOException {
        write("prometheus_alert_rules/a.rule", VALID_RULE);
        write("grafana_dashboards/board.json", "{\"title\": \"Board\"}");
        controller.requestReconcile(TriggerReason.SCHEDULED_TICK);

        ReconcileController restarted = ReconcileController.builder()
                .supervisor(supervisor)
                .settingsSource(settings::get)
                .contentRoot(root)
                .build();
        channels.values().forEach(InMemoryChannel::resetCounters);
        channels.values().forEach(restarted::attachChannel);

        assertThat(restarted.getState()).isEqualTo(WorkloadState.CONFIGURED);
        assertThat(channels.values()).allSatisfy(c -> assertThat(c.writes()).isZero());
        assertThat(channels.get(DownstreamKind.DASHBOARDS).content()).containsOnlyKeys("board");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
