package com.rulesync.service;

import com.rulesync.core.model.DownstreamKind;
import com.rulesync.core.reconcile.ReconcileController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;

/**
 * Unit tests for {@link ChannelWatcher}.
 */
@ExtendWith(MockitoExtension.class)
class ChannelWatcherTest {

    @Mock
    ReconcileController controller;

    @TempDir
    Path dir;

    private DirectoryChannel dashboards;
    private ChannelWatcher watcher;

    @BeforeEach
    void setUp() {
        dashboards = new DirectoryChannel(DownstreamKind.DASHBOARDS, dir.resolve("dashboards"));
        watcher = new ChannelWatcher(List.of(dashboards), controller);
    }

    @Test
    @DisplayName("An absent directory on the first poll is not a change")
    void shouldIgnoreInitiallyAbsentChannel() {
        assertThat(watcher.poll()).isFalse();

        verifyNoInteractions(controller);
    }

    @Test
    @DisplayName("A directory appearing attaches the channel once")
    void shouldAttachOnJoin() throws IOException {
        watcher.poll();
        Files.createDirectories(dashboards.getDirectory());

        assertThat(watcher.poll()).isTrue();
        assertThat(watcher.poll()).isFalse();

        verify(controller).attachChannel(dashboards);
        verifyNoMoreInteractions(controller);
    }

    @Test
    @DisplayName("A directory disappearing detaches the kind")
    void shouldDetachOnLeave() throws IOException {
        Files.createDirectories(dashboards.getDirectory());
        watcher.poll();
        Files.delete(dashboards.getDirectory());

        assertThat(watcher.poll()).isTrue();

        verify(controller).attachChannel(dashboards);
        verify(controller).detachChannel(DownstreamKind.DASHBOARDS);
    }

    @Test
    @DisplayName("A directory present from the start is attached on the first poll")
    void shouldAttachPresentChannel() throws IOException {
        Files.createDirectories(dashboards.getDirectory());

        assertThat(watcher.poll()).isTrue();

        verify(controller).attachChannel(dashboards);
        verify(controller, never()).detachChannel(any());
    }
}
