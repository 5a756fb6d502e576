package com.rulesync.service;

import com.rulesync.core.model.DownstreamKind;
import com.rulesync.core.reconcile.ReconcileController;
import com.rulesync.core.reconcile.TriggerReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point of the rule-sync service.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   SettingsLoader (file / env)        git-sync (GitSyncSupervisor)
 *            \                               /
 *             → ReconcileController (one pass at a time)
 *                 → ContentHasher → Loaders → RelationPublisher
 *                     → DirectoryChannel × 3 (metric rules, log rules, dashboards)
 * </pre>
 *
 * <h3>Triggers</h3>
 * <p>
 * A single scheduler thread runs a tick every reconcile interval: it detects
 * channel directories appearing or disappearing, reloads the settings and
 * requests a pass. A git-sync cycle that yields a new revision requests a pass
 * on the same thread. {@code POST /sync-now} goes through the same
 * controller, which serializes it with the scheduled passes.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleSyncService {

    private static final Logger LOG = LoggerFactory.getLogger(RuleSyncService.class);

    private RuleSyncService() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting rule-sync with config: {}", config);

        SettingsLoader settings = new SettingsLoader(config.getSettingsFile(), System::getenv);
        settings.refresh();

        // 2. Sync agent
        GitSyncSupervisor supervisor = new GitSyncSupervisor(GitSyncCommand.from(config),
                config.proxyEnvironment(), config.getSyncPeriod(), config.getOneShotTimeout());
        String version = supervisor.gitSyncVersion().orElse(null);
        if (version != null) {
            LOG.info("git-sync version {}", version);
        }

        // 3. Controller and downstream channels
        ReconcileController controller = ReconcileController.builder()
                .supervisor(supervisor)
                .settingsSource(settings)
                .contentRoot(config.getContentRoot())
                .oneShotTimeout(config.getOneShotTimeout())
                .build();
        ChannelWatcher watcher = new ChannelWatcher(directoryChannels(config), controller);

        // 4. Scheduler
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(
                r -> new Thread(r, "reconcile"));
        supervisor.onResultChanged(() -> scheduler.execute(
                () -> controller.requestReconcile(TriggerReason.SCHEDULED_TICK)));

        // 5. Status server with shutdown hook
        StatusServer statusServer = new StatusServer(controller, () -> {
            settings.refresh();
            return controller.syncNow();
        }, version);
        statusServer.start(config.getStatusPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down rule-sync");
            scheduler.shutdownNow();
            statusServer.stop();
            supervisor.shutdown();
        }, "rule-sync-shutdown"));

        // 6. Run
        long interval = config.getReconcileInterval().toMillis();
        scheduler.execute(() -> tick(watcher, settings, controller, TriggerReason.STARTUP));
        scheduler.scheduleWithFixedDelay(
                () -> tick(watcher, settings, controller, TriggerReason.SCHEDULED_TICK),
                interval, interval, TimeUnit.MILLISECONDS);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * One scheduler tick. Never throws: an exception would cancel the
     * periodic schedule.
     */
    static void tick(ChannelWatcher watcher, SettingsLoader settings,
            ReconcileController controller, TriggerReason reason) {
        try {
            watcher.poll();
            boolean changed = settings.refresh();
            controller.requestReconcile(changed ? TriggerReason.SETTINGS_CHANGED : reason);
        } catch (RuntimeException e) {
            LOG.error("Reconcile tick failed: {}", e.getMessage(), e);
        }
    }

    static List<DirectoryChannel> directoryChannels(ServiceConfig config) {
        List<DirectoryChannel> channels = new ArrayList<>();
        for (DownstreamKind kind : DownstreamKind.values()) {
            channels.add(new DirectoryChannel(kind, config.outputDir(kind)));
        }
        return channels;
    }
}
