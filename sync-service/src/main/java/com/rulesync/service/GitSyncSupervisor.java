package com.rulesync.service;

import com.rulesync.core.model.SourceSpec;
import com.rulesync.core.sync.SyncResult;
import com.rulesync.core.sync.SyncSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * {@link SyncSupervisor} backed by the {@code git-sync} binary.
 *
 * <h3>Modes</h3>
 * <ul>
 * <li><b>Continuous</b>: {@link #ensureRunning(SourceSpec)} schedules a
 * {@code git-sync --one-time} cycle every sync period on a background
 * thread; each cycle's exit status and the mirror's revision become the
 * {@link #lastResult()}.</li>
 * <li><b>One-shot</b>: {@link #triggerOneShot(SourceSpec, Duration)} runs a
 * cycle on the calling thread and waits for it, bounded by a timeout.</li>
 * </ul>
 *
 * <p>
 * At most one git-sync process runs at a time. git-sync keeps the previous
 * checkout when a cycle fails, so a failed result never empties the mirror.
 * </p>
 *
 * <h3>Credentials</h3>
 * <p>
 * An SSH key in the {@link SourceSpec} is written to a file only the owner can
 * read, and the keys of the repository host are added to the known-hosts file
 * with {@code ssh-keyscan} before the first cycle for that source.
 * </p>
 *
 * @since 1.0.0
 */
public class GitSyncSupervisor implements SyncSupervisor {

    private static final Logger LOG = LoggerFactory.getLogger(GitSyncSupervisor.class);

    private static final Set<PosixFilePermission> OWNER_READ_WRITE = PosixFilePermissions.fromString("rw-------");

    private final GitSyncCommand command;
    private final Map<String, String> processEnvironment;
    private final Duration syncPeriod;
    private final Duration cycleTimeout;
    private final ScheduledExecutorService agent;

    private final ReentrantLock cycleLock = new ReentrantLock();

    private volatile SyncResult last = SyncResult.pending("");
    private volatile Runnable listener = () -> {
    };

    /** Guarded by {@code this}. */
    private SourceSpec runningFor;
    /** Guarded by {@code this}. */
    private ScheduledFuture<?> schedule;
    /** Guarded by {@link #cycleLock}. */
    private SourceSpec credentialsPreparedFor;

    /**
     * @param command            git-sync command lines and mirror layout
     * @param processEnvironment extra variables for child processes (proxy)
     * @param syncPeriod         delay between continuous cycles
     * @param cycleTimeout       upper bound of a continuous cycle
     */
    public GitSyncSupervisor(GitSyncCommand command, Map<String, String> processEnvironment,
            Duration syncPeriod, Duration cycleTimeout) {
        this.command = Objects.requireNonNull(command, "command must not be null");
        this.processEnvironment = Map.copyOf(processEnvironment);
        this.syncPeriod = Objects.requireNonNull(syncPeriod, "syncPeriod must not be null");
        this.cycleTimeout = Objects.requireNonNull(cycleTimeout, "cycleTimeout must not be null");
        this.agent = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "git-sync-agent");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Register a callback run after a continuous cycle whose result differs
     * from the previous one (new revision, or success turning into failure).
     *
     * @param listener callback; runs on the agent thread
     */
    public void onResultChanged(Runnable listener) {
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    // ---------------------------------------------------------------
    // SyncSupervisor
    // ---------------------------------------------------------------

    @Override
    public synchronized void ensureRunning(SourceSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (spec.equals(runningFor) && schedule != null && !schedule.isDone()) {
            return;
        }
        if (schedule != null) {
            schedule.cancel(false);
        }
        if (runningFor != null && !spec.equals(runningFor)) {
            LOG.info("Source changed, restarting git-sync for {}", spec.getLocation());
            last = SyncResult.pending("");
        } else {
            LOG.info("Starting git-sync for {} every {}s", spec.getLocation(), syncPeriod.toSeconds());
        }
        runningFor = spec;
        schedule = agent.scheduleWithFixedDelay(() -> continuousCycle(spec),
                0, syncPeriod.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void stop() {
        synchronized (this) {
            if (schedule != null) {
                schedule.cancel(false);
                schedule = null;
            }
            runningFor = null;
        }
        cycleLock.lock();
        try {
            purgeMirror();
            credentialsPreparedFor = null;
            last = SyncResult.pending("");
        } finally {
            cycleLock.unlock();
        }
    }

    @Override
    public SyncResult triggerOneShot(SourceSpec spec, Duration timeout) {
        Objects.requireNonNull(spec, "spec must not be null");
        LOG.info("Calling git-sync with --one-time for {}", spec.getLocation());
        try {
            if (!cycleLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return SyncResult.failed("Timed out waiting for a running sync to finish", Instant.now());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SyncResult.failed("Interrupted while waiting for a running sync", Instant.now());
        }
        try {
            SyncResult result = runCycle(spec, timeout);
            last = result;
            return result;
        } finally {
            cycleLock.unlock();
        }
    }

    @Override
    public SyncResult lastResult() {
        return last;
    }

    /**
     * Stop the agent thread. The mirror is left in place.
     */
    public void shutdown() {
        agent.shutdownNow();
    }

    /**
     * @return git-sync's version, if the binary reports one
     */
    public Optional<String> gitSyncVersion() {
        try {
            ProcessOutput out = execute(command.versionCommandLine(), Duration.ofSeconds(10));
            return GitSyncCommand.parseVersion(out.stdout + "\n" + out.stderr);
        } catch (SyncException e) {
            LOG.warn("Could not get git-sync version: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ---------------------------------------------------------------
    // Cycles
    // ---------------------------------------------------------------

    private void continuousCycle(SourceSpec spec) {
        SyncResult result;
        cycleLock.lock();
        try {
            synchronized (this) {
                if (!spec.equals(runningFor)) {
                    return;
                }
            }
            result = runCycle(spec, cycleTimeout);
            synchronized (this) {
                if (!spec.equals(runningFor)) {
                    return;
                }
            }
        } finally {
            cycleLock.unlock();
        }

        SyncResult previous = last;
        last = result;
        if (previous.getOutcome() != result.getOutcome()
                || !Objects.equals(previous.getRevision(), result.getRevision())) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                LOG.warn("Sync result listener failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Run one git-sync cycle. Caller holds {@link #cycleLock}.
     */
    private SyncResult runCycle(SourceSpec spec, Duration timeout) {
        try {
            prepareCredentials(spec);
            ProcessOutput out = execute(command.syncCommandLine(spec), timeout);
            List<String> warnings = out.stderrLines();
            for (String line : warnings) {
                LOG.info("git-sync: {}", line);
            }
            Optional<String> revision = command.readRevision();
            if (revision.isEmpty()) {
                return SyncResult.pending("Mirror has no revision yet");
            }
            LOG.debug("git-sync at revision {}", revision.get());
            return SyncResult.succeeded(revision.get(), Instant.now(), out.stdout, warnings);
        } catch (SyncException e) {
            LOG.warn("git-sync failed: {}", e.getMessage());
            for (String line : e.getDetails()) {
                LOG.warn("git-sync: {}", line);
            }
            return SyncResult.failed(e.getMessage(), Instant.now(), e.getDetails());
        }
    }

    private void prepareCredentials(SourceSpec spec) {
        if (spec.equals(credentialsPreparedFor)) {
            return;
        }
        Optional<String> key = spec.getCredential();
        try {
            if (key.isPresent()) {
                writeOwnerOnly(command.getSshKeyFile(), key.get().endsWith("\n") ? key.get() : key.get() + "\n");
                trustRemote(spec.getLocation());
            } else {
                Files.deleteIfExists(command.getSshKeyFile());
            }
        } catch (IOException e) {
            throw new SyncException("Cannot write SSH credentials: " + e.getMessage(), List.of(), e);
        }
        credentialsPreparedFor = spec;
    }

    private void trustRemote(String location) throws IOException {
        Optional<String> host = GitSyncCommand.remoteHost(location);
        if (host.isEmpty()) {
            return;
        }
        LOG.debug("Remote extracted from the repo: {}", host.get());
        ProcessOutput out = execute(List.of("ssh-keyscan", host.get()), Duration.ofSeconds(30));
        Path knownHosts = command.getKnownHostsFile();
        if (knownHosts.getParent() != null) {
            Files.createDirectories(knownHosts.getParent());
        }
        Files.writeString(knownHosts, out.stdout, StandardCharsets.UTF_8);
        LOG.info("{} public keys added to {}", host.get(), knownHosts);
    }

    /**
     * Remove the checked-out tree and git-sync's repository data. The
     * mirror path is a symlink into git-sync's worktrees, so its target is
     * removed along with the link when it lies under the root.
     */
    private void purgeMirror() {
        Path mirror = command.mirrorPath();
        Path root = command.getRoot();
        List<Path> trees = new ArrayList<>();
        if (Files.isSymbolicLink(mirror)) {
            try {
                Path target = mirror.toRealPath();
                if (target.startsWith(root.toRealPath())) {
                    trees.add(target);
                } else {
                    LOG.warn("Mirror {} points outside {}; removing the link only", mirror, root);
                }
            } catch (IOException e) {
                LOG.debug("Mirror link {} does not resolve: {}", mirror, e.getMessage());
            }
        }
        trees.add(mirror);
        trees.add(root.resolve(".git"));
        trees.add(root.resolve(".worktrees"));
        for (Path tree : trees) {
            deleteTree(tree);
        }
    }

    private static void deleteTree(Path tree) {
        if (!Files.exists(tree, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(tree)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
            LOG.info("Removed {}", tree);
        } catch (IOException | UncheckedIOException e) {
            LOG.warn("Could not remove {}: {}", tree, e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Process execution
    // ---------------------------------------------------------------

    private ProcessOutput execute(List<String> commandLine, Duration timeout) {
        Path stdout = null;
        Path stderr = null;
        Process process = null;
        try {
            stdout = Files.createTempFile("git-sync", ".out");
            stderr = Files.createTempFile("git-sync", ".err");
            ProcessBuilder pb = new ProcessBuilder(commandLine)
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile());
            pb.environment().putAll(processEnvironment);
            process = pb.start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new SyncException("Timed out after " + timeout.toMillis() + " ms.");
            }
            ProcessOutput out = new ProcessOutput(
                    Files.readString(stdout, StandardCharsets.UTF_8),
                    Files.readString(stderr, StandardCharsets.UTF_8));
            if (process.exitValue() != 0) {
                throw new SyncException("Exited with code " + process.exitValue() + ".", out.stderrLines());
            }
            return out;
        } catch (IOException e) {
            throw new SyncException("Cannot run " + commandLine.get(0) + ": " + e.getMessage(), List.of(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            throw new SyncException("Interrupted while running " + commandLine.get(0), List.of(), e);
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private static void writeOwnerOnly(Path file, String content) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        Files.deleteIfExists(file);
        Files.createFile(file, PosixFilePermissions.asFileAttribute(OWNER_READ_WRITE));
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }

    private static final class ProcessOutput {
        private final String stdout;
        private final String stderr;

        private ProcessOutput(String stdout, String stderr) {
            this.stdout = stdout;
            this.stderr = stderr;
        }

        private List<String> stderrLines() {
            return stderr.lines()
                    .map(String::strip)
                    .filter(line -> !line.isEmpty())
                    .toList();
        }
    }
}
