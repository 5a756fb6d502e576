package com.rulesync.service;

import com.rulesync.core.model.SourceSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Command lines and on-disk conventions of the {@code git-sync} agent.
 *
 * <h3>Mirror layout</h3>
 * <p>
 * git-sync checks the repository out under {@code <root>/<dest>}. The
 * {@code .git} entry there is a file pointing at the worktree, whose name is
 * the checked-out commit:
 * </p>
 *
 * <pre>
 *   gitdir: ../.git/worktrees/901551c1bdd2ff5a10f14027667c15a6b3a16777
 * </pre>
 *
 * @since 1.0.0
 */
public final class GitSyncCommand {

    private static final Logger LOG = LoggerFactory.getLogger(GitSyncCommand.class);

    /** Host part of {@code git@host:org/repo} and {@code ssh://user@host/org/repo}. */
    static final Pattern REMOTE_HOST = Pattern.compile("@(.+?)[:/]");

    static final Pattern VERSION = Pattern.compile("v(\\d*\\.\\d*\\.\\d*)");

    static final Pattern WORKTREE_POINTER = Pattern.compile(".+/(.+)$");

    private final String binary;
    private final Path root;
    private final String dest;
    private final Path sshKeyFile;
    private final Path knownHostsFile;

    public GitSyncCommand(String binary, Path root, String dest, Path sshKeyFile, Path knownHostsFile) {
        this.binary = Objects.requireNonNull(binary, "binary must not be null");
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.dest = Objects.requireNonNull(dest, "dest must not be null");
        this.sshKeyFile = Objects.requireNonNull(sshKeyFile, "sshKeyFile must not be null");
        this.knownHostsFile = Objects.requireNonNull(knownHostsFile, "knownHostsFile must not be null");
    }

    /**
     * Build the command from the service configuration.
     *
     * @param config service configuration
     * @return new command
     */
    public static GitSyncCommand from(ServiceConfig config) {
        return new GitSyncCommand(config.getGitSyncBinary(), config.getMirrorRoot(),
                config.getSyncSubdir(), config.getSshKeyFile(), config.getKnownHostsFile());
    }

    // ---------------------------------------------------------------
    // Command lines
    // ---------------------------------------------------------------

    /**
     * Command line for a single sync cycle of {@code spec}.
     *
     * @param spec source to mirror
     * @return argument list, binary first
     */
    public List<String> syncCommandLine(SourceSpec spec) {
        List<String> cmd = new ArrayList<>();
        cmd.add(binary);
        cmd.add("--repo");
        cmd.add(spec.getLocation());
        if (spec.getBranch() != null) {
            cmd.add("--branch");
            cmd.add(spec.getBranch());
        }
        if (spec.getRevision() != null) {
            cmd.add("--rev");
            cmd.add(spec.getRevision());
        }
        if (spec.getDepth() > 0) {
            cmd.add("--depth");
            cmd.add(Integer.toString(spec.getDepth()));
        }
        cmd.add("--root");
        cmd.add(root.toString());
        cmd.add("--dest");
        cmd.add(dest);
        if (spec.getCredential().isPresent()) {
            cmd.add("--ssh");
            cmd.add("--ssh-key-file");
            cmd.add(sshKeyFile.toString());
            cmd.add("--ssh-known-hosts-file");
            cmd.add(knownHostsFile.toString());
        }
        cmd.add("--one-time");
        return cmd;
    }

    public List<String> versionCommandLine() {
        return List.of(binary, "-version");
    }

    // ---------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------

    /**
     * Extract the SSH host from a repository location.
     *
     * @param location repository URL
     * @return host, or empty for locations without a {@code user@host} part
     */
    public static Optional<String> remoteHost(String location) {
        Matcher m = REMOTE_HOST.matcher(location);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /**
     * @param output output of {@code git-sync -version}, e.g. {@code v3.5.0}
     * @return version without the {@code v} prefix, if recognised
     */
    public static Optional<String> parseVersion(String output) {
        Matcher m = VERSION.matcher(output);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /**
     * @param pointer content of the worktree's {@code .git} file
     * @return the commit the worktree is named after, if recognised
     */
    public static Optional<String> parseRevision(String pointer) {
        Matcher m = WORKTREE_POINTER.matcher(pointer.strip());
        return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
    }

    // ---------------------------------------------------------------
    // Mirror
    // ---------------------------------------------------------------

    /**
     * Read the revision currently checked out in the mirror.
     *
     * @return the revision; empty when nothing has been synced yet or the
     *         pointer is unreadable
     */
    public Optional<String> readRevision() {
        Path pointer = mirrorPath().resolve(".git");
        try {
            Optional<String> revision = parseRevision(Files.readString(pointer, StandardCharsets.UTF_8));
            if (revision.isEmpty()) {
                LOG.debug("Unrecognized worktree pointer in {}", pointer);
            }
            return revision;
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            LOG.debug("Cannot read worktree pointer {}: {}", pointer, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return directory holding the checked-out tree
     */
    public Path mirrorPath() {
        return root.resolve(dest);
    }

    /**
     * @return git-sync's {@code --root}, holding its repository data
     */
    public Path getRoot() {
        return root;
    }

    public Path getSshKeyFile() {
        return sshKeyFile;
    }

    public Path getKnownHostsFile() {
        return knownHostsFile;
    }
}
