package com.rulesync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.rulesync.core.model.DownstreamKind;
import com.rulesync.core.publish.DownstreamChannel;
import com.rulesync.core.publish.PublishException;
import com.rulesync.core.support.CanonicalJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.representer.Representer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Downstream channel backed by a directory the consumer reads from, such as
 * a rule-file directory or a dashboard provisioning directory.
 *
 * <h3>Layout</h3>
 * <ul>
 * <li>Rule kinds: one {@code <name>.yaml} rule-group file per record</li>
 * <li>Dashboards: one {@code <name>.json} file per record</li>
 * </ul>
 *
 * <p>
 * The channel is joined while its directory exists; this service never
 * creates it. Writes go to a hidden temporary file that is then moved into
 * place, so consumers never see a partial file. {@link #readCurrent()}
 * parses every record file back into canonical JSON; a file that no longer
 * parses is returned verbatim, so it compares unequal and is rewritten.
 * </p>
 *
 * @since 1.0.0
 */
public class DirectoryChannel implements DownstreamChannel {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryChannel.class);

    private final DownstreamKind kind;
    private final Path directory;
    private final String extension;

    public DirectoryChannel(DownstreamKind kind, Path directory) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.extension = kind == DownstreamKind.DASHBOARDS ? ".json" : ".yaml";
    }

    @Override
    public DownstreamKind getKind() {
        return kind;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * @return {@code true} while the consumer's directory exists
     */
    public boolean isJoined() {
        return Files.isDirectory(directory);
    }

    @Override
    public Map<String, String> readCurrent() {
        requireJoined();
        Map<String, String> current = new TreeMap<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(Files::isRegularFile).toList()) {
                String fileName = file.getFileName().toString();
                if (fileName.startsWith(".") || !fileName.endsWith(extension)) {
                    continue;
                }
                String name = fileName.substring(0, fileName.length() - extension.length());
                current.put(name, canonicalize(file, Files.readString(file, StandardCharsets.UTF_8)));
            }
        } catch (IOException e) {
            throw new PublishException("Cannot read " + directory + ": " + e.getMessage(), e);
        }
        return current;
    }

    @Override
    public void put(String name, String payload) {
        requireJoined();
        Path target = directory.resolve(name + extension);
        Path temp = directory.resolve("." + name + extension + ".tmp");
        try {
            Files.writeString(temp, render(payload), StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Wrote {}", target);
        } catch (IOException e) {
            throw new PublishException("Cannot write " + target + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void remove(String name) {
        requireJoined();
        Path target = directory.resolve(name + extension);
        try {
            if (Files.deleteIfExists(target)) {
                LOG.debug("Removed {}", target);
            }
        } catch (IOException e) {
            throw new PublishException("Cannot remove " + target + ": " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void requireJoined() {
        if (!isJoined()) {
            throw new PublishException("Channel directory for " + kind + " does not exist: " + directory);
        }
    }

    private String render(String payload) {
        Object tree = CanonicalJson.read(payload);
        if (kind == DownstreamKind.DASHBOARDS) {
            try {
                return CanonicalJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(tree) + "\n";
            } catch (IOException e) {
                throw new PublishException("Cannot render dashboard: " + e.getMessage(), e);
            }
        }
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        return new Yaml(new Representer(options), options).dump(tree);
    }

    private String canonicalize(Path file, String content) {
        try {
            if (kind == DownstreamKind.DASHBOARDS) {
                JsonNode node = CanonicalJson.mapper().readTree(content);
                return CanonicalJson.write(node);
            }
            LoaderOptions options = new LoaderOptions();
            options.setAllowDuplicateKeys(false);
            return CanonicalJson.write((Object) new Yaml(new SafeConstructor(options)).load(content));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Unreadable record file {}, it will be rewritten: {}", file, e.getMessage());
            return content;
        }
    }
}
