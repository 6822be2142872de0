package com.arenabox.core.scheduler;

import com.arenabox.core.model.Instance;
import com.arenabox.core.model.OrchestratorConfig;
import com.arenabox.core.model.Participant;
import com.arenabox.core.model.SandboxKind;
import com.arenabox.core.persistence.InstanceTracker;
import com.arenabox.core.persistence.OrchestratorConfigStore;
import com.arenabox.sandbox.InstanceTerminator;
import com.arenabox.sandbox.SandboxProperties;
import com.arenabox.transport.OrchestratorResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CleanupSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Participant USER = Participant.user("17");
    private static final OrchestratorConfig CONFIG =
            new OrchestratorConfig("docker.local:2375", false, null, null, null, List.of());

    private InstanceTracker tracker;
    private InstanceTerminator terminator;
    private OrchestratorConfigStore configStore;
    private CleanupScheduler scheduler;

    @BeforeEach
    void setUp() {
        tracker = mock(InstanceTracker.class);
        terminator = mock(InstanceTerminator.class);
        configStore = mock(OrchestratorConfigStore.class);
        var properties = new SandboxProperties();
        properties.setKillBatchSize(2);
        scheduler = new CleanupScheduler(tracker, terminator, configStore, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Instance instance(long id, String handle) {
        return new Instance(id, USER, id, "nginx:alpine", SandboxKind.SINGLE, handle, List.of(), "docker.local",
                NOW.minusSeconds(7201), NOW.minusSeconds(6901));
    }

    @Test
    @DisplayName("stale cutoff is exactly two hours before now")
    void reclaimUsesTwoHourCutoff() {
        when(tracker.findStale(USER, NOW.minusSeconds(7200))).thenReturn(List.of(instance(1, "c1")));
        when(terminator.terminate(any(), any(), eq("stale"))).thenReturn(OrchestratorResult.success(true));

        assertEquals(1, scheduler.reclaimStale(CONFIG, USER));
        verify(tracker).findStale(USER, NOW.minusSeconds(7200));
    }

    @Test
    void reclaimContinuesPastFailures() {
        Instance failing = instance(1, "c1");
        Instance ok = instance(2, "c2");
        when(tracker.findStale(eq(USER), any())).thenReturn(List.of(failing, ok));
        when(terminator.terminate(CONFIG, failing, "stale")).thenReturn(OrchestratorResult.failure("timeout"));
        when(terminator.terminate(CONFIG, ok, "stale")).thenReturn(OrchestratorResult.success(true));

        assertEquals(1, scheduler.reclaimStale(CONFIG, USER));
        verify(terminator).terminate(CONFIG, ok, "stale");
    }

    @Test
    void sweepPagesThroughAllStaleInstances() {
        Instant cutoff = NOW.minusSeconds(7200);
        when(tracker.findStaleBatch(cutoff, 0, 2)).thenReturn(List.of(instance(1, "c1"), instance(4, "c4")));
        when(tracker.findStaleBatch(cutoff, 4, 2)).thenReturn(List.of(instance(9, "c9")));
        when(terminator.terminate(any(), any(), eq("stale"))).thenReturn(OrchestratorResult.success(true));

        assertEquals(3, scheduler.sweep(CONFIG));
        verify(tracker, never()).findStaleBatch(cutoff, 9, 2);
    }

    @Test
    void scheduledSweepSkipsWithoutConfiguration() {
        when(configStore.get()).thenReturn(Optional.empty());

        scheduler.sweep();

        verifyNoInteractions(tracker, terminator);
    }
}
