package com.rulesync.service;

import com.rulesync.core.model.DownstreamKind;
import com.rulesync.core.reconcile.ReconcileController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Detects directory channels joining and leaving, and reports each change to
 * the controller, which reconciles the affected kind.
 *
 * @since 1.0.0
 */
public class ChannelWatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelWatcher.class);

    private final List<DirectoryChannel> channels;
    private final ReconcileController controller;
    private final Map<DownstreamKind, Boolean> joined = new EnumMap<>(DownstreamKind.class);

    public ChannelWatcher(List<DirectoryChannel> channels, ReconcileController controller) {
        this.channels = List.copyOf(channels);
        this.controller = Objects.requireNonNull(controller, "controller must not be null");
    }

    /**
     * Compare each channel's presence with the previous poll.
     *
     * @return {@code true} if any channel joined or left
     */
    public synchronized boolean poll() {
        boolean changed = false;
        for (DirectoryChannel channel : channels) {
            boolean now = channel.isJoined();
            Boolean before = joined.put(channel.getKind(), now);
            if (before == null && !now) {
                LOG.info("{} channel not present yet: {}", channel.getKind().id(), channel.getDirectory());
                continue;
            }
            if (before != null && before == now) {
                continue;
            }
            changed = true;
            if (now) {
                LOG.info("{} channel joined: {}", channel.getKind().id(), channel.getDirectory());
                controller.attachChannel(channel);
            } else {
                LOG.info("{} channel left: {}", channel.getKind().id(), channel.getDirectory());
                controller.detachChannel(channel.getKind());
            }
        }
        return changed;
    }
}
