package com.rulesync.core.publish;

import com.rulesync.core.model.DownstreamKind;
import com.rulesync.core.model.FileError;
import com.rulesync.core.model.PublishRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Projects validated records into downstream channels, writing only what
 * changed.
 *
 * <h3>Published sets</h3>
 * <p>
 * For each attached kind the publisher keeps the name-to-payload map it
 * believes the consumer holds. The map is a cache: it is built from
 * {@link DownstreamChannel#readCurrent()} on the first publish after a
 * channel is attached, and dropped whenever a write fails, so the next
 * publish starts again from ground truth.
 * </p>
 *
 * <h3>Duplicate names</h3>
 * <p>
 * Records are considered in lexical source-path order. When two records
 * share a name the first one wins and every later one is reported as a
 * {@link FileError.Type#DUPLICATE_IDENTITY} error.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. The reconcile controller calls it from within a pass
 * only.
 * </p>
 *
 * @since 1.0.0
 */
public class RelationPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(RelationPublisher.class);

    private final Map<DownstreamKind, DownstreamChannel> channels = new EnumMap<>(DownstreamKind.class);
    private final Map<DownstreamKind, TreeMap<String, String>> published = new EnumMap<>(DownstreamKind.class);

    // ---------------------------------------------------------------
    // Channel management
    // ---------------------------------------------------------------

    /**
     * Attach (or replace) the channel for its kind. The published set for
     * that kind is rebuilt from the channel on the next publish.
     *
     * @param channel channel to attach
     */
    public void attach(DownstreamChannel channel) {
        Objects.requireNonNull(channel, "channel must not be null");
        channels.put(channel.getKind(), channel);
        published.remove(channel.getKind());
        LOG.info("Attached downstream channel for {}", channel.getKind());
    }

    /**
     * Detach the channel of a kind and forget its published set.
     *
     * @param kind downstream kind
     */
    public void detach(DownstreamKind kind) {
        if (channels.remove(kind) != null) {
            LOG.info("Detached downstream channel for {}", kind);
        }
        published.remove(kind);
    }

    public boolean isAttached(DownstreamKind kind) {
        return channels.containsKey(kind);
    }

    // ---------------------------------------------------------------
    // Publishing
    // ---------------------------------------------------------------

    /**
     * Make the consumer of {@code kind} hold exactly {@code records}.
     *
     * @param kind    downstream kind
     * @param records new record set; may contain name collisions
     * @return the delta that was applied
     * @throws ChannelUnavailableException if no channel is attached
     * @throws PublishException            if reading or writing the channel
     *                                     fails; writes applied before the
     *                                     failure stay applied
     */
    public PublishReport publish(DownstreamKind kind, Collection<? extends PublishRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        DownstreamChannel channel = channels.get(kind);
        if (channel == null) {
            throw new ChannelUnavailableException(kind);
        }

        List<FileError> errors = new ArrayList<>();
        TreeMap<String, String> desired = buildDesired(kind, records, errors);
        TreeMap<String, String> current = publishedSet(kind, channel);

        List<String> added = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<String> removed = new ArrayList<>();

        try {
            for (Map.Entry<String, String> entry : desired.entrySet()) {
                String previous = current.get(entry.getKey());
                if (previous == null) {
                    channel.put(entry.getKey(), entry.getValue());
                    current.put(entry.getKey(), entry.getValue());
                    added.add(entry.getKey());
                } else if (!previous.equals(entry.getValue())) {
                    channel.put(entry.getKey(), entry.getValue());
                    current.put(entry.getKey(), entry.getValue());
                    updated.add(entry.getKey());
                }
            }
            for (String name : new ArrayList<>(current.keySet())) {
                if (!desired.containsKey(name)) {
                    channel.remove(name);
                    current.remove(name);
                    removed.add(name);
                }
            }
        } catch (RuntimeException e) {
            published.remove(kind);
            throw e instanceof PublishException pe ? pe
                    : new PublishException("Write to " + kind + " failed: " + e.getMessage(), e);
        }

        PublishReport report = new PublishReport(kind, added, updated, removed, errors);
        if (report.isNoOp()) {
            LOG.debug("{} already up to date ({} record(s))", kind, current.size());
        } else {
            LOG.info("Published {}: {} added, {} updated, {} removed",
                    kind, added.size(), updated.size(), removed.size());
        }
        return report;
    }

    /**
     * Remove every record from the consumer of {@code kind}.
     *
     * @param kind downstream kind
     * @return the removals that were applied
     * @throws ChannelUnavailableException if no channel is attached
     * @throws PublishException            if the channel fails
     */
    public PublishReport clear(DownstreamKind kind) {
        return publish(kind, List.of());
    }

    /**
     * @param kind downstream kind
     * @return copy of the cached published set; empty if not yet known
     */
    public Map<String, String> snapshot(DownstreamKind kind) {
        TreeMap<String, String> set = published.get(kind);
        return set == null ? Map.of() : Map.copyOf(set);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private TreeMap<String, String> publishedSet(DownstreamKind kind, DownstreamChannel channel) {
        TreeMap<String, String> set = published.get(kind);
        if (set == null) {
            try {
                set = new TreeMap<>(channel.readCurrent());
            } catch (PublishException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new PublishException("Cannot read current " + kind + " content: " + e.getMessage(), e);
            }
            LOG.info("Rebuilt {} published set from downstream: {} record(s)", kind, set.size());
            published.put(kind, set);
        }
        return set;
    }

    private static TreeMap<String, String> buildDesired(DownstreamKind kind,
            Collection<? extends PublishRecord> records, List<FileError> errors) {
        List<PublishRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparing(PublishRecord::getSourcePath));

        TreeMap<String, String> desired = new TreeMap<>();
        Map<String, String> owners = new TreeMap<>();
        for (PublishRecord record : ordered) {
            String owner = owners.putIfAbsent(record.getName(), record.getSourcePath());
            if (owner == null) {
                desired.put(record.getName(), record.getPayload());
            } else {
                FileError error = new FileError(kind, record.getSourcePath(),
                        FileError.Type.DUPLICATE_IDENTITY,
                        "Record name '" + record.getName() + "' already provided by " + owner);
                LOG.warn("Rejected {} file {}: {}", kind, error.getSourcePath(), error.getMessage());
                errors.add(error);
            }
        }
        return desired;
    }
}
