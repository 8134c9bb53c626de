package me.golemcore.sessions.domain.service;

import me.golemcore.sessions.domain.model.LastExit;
import me.golemcore.sessions.domain.model.ProcessState;
import me.golemcore.sessions.domain.model.SessionActivity;
import me.golemcore.sessions.domain.model.SessionPhase;
import me.golemcore.sessions.domain.model.SessionRuntime;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionRuntimeTrackerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final SessionRuntimeTracker tracker = new SessionRuntimeTracker(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void shouldStartIdleAndStopped() {
        SessionRuntime runtime = tracker.initial();

        assertEquals(SessionPhase.IDLE, runtime.phase());
        assertEquals(ProcessState.STOPPED, runtime.processState());
        assertEquals(SessionActivity.IDLE, runtime.activity());
        assertNull(runtime.lastExit());
        assertEquals(NOW, runtime.updatedAt());
    }

    @Test
    void shouldDeriveRunningFromAliveProcess() {
        SessionRuntime runtime = tracker.fromStatus(true, true, null);

        assertEquals(SessionPhase.RUNNING, runtime.phase());
        assertEquals(ProcessState.ALIVE, runtime.processState());
        assertEquals(SessionActivity.WORKING, runtime.activity());
    }

    @Test
    void shouldDeriveErrorFromUnexpectedLastExit() {
        SessionRuntime afterCrash = tracker.fromStatus(false, false, LastExit.of(137, NOW));
        SessionRuntime afterCleanExit = tracker.fromStatus(false, false, LastExit.of(0, NOW));

        assertEquals(SessionPhase.ERROR, afterCrash.phase());
        assertEquals(SessionPhase.IDLE, afterCleanExit.phase());
    }

    @Test
    void shouldTreatOnlyZeroExitCodeAsExpected() {
        SessionRuntime clean = tracker.afterExit(0);
        SessionRuntime failed = tracker.afterExit(1);
        SessionRuntime unknown = tracker.afterExit(null);

        assertEquals(SessionPhase.IDLE, clean.phase());
        assertFalse(clean.lastExit().unexpected());
        assertEquals(SessionPhase.ERROR, failed.phase());
        assertTrue(failed.lastExit().unexpected());
        assertEquals(SessionPhase.ERROR, unknown.phase());
        assertTrue(unknown.lastExit().unexpected());
        assertNull(unknown.lastExit().code());
        assertEquals(ProcessState.STOPPED, unknown.processState());
    }

    @Test
    void shouldKeepLastExitAcrossTransitions() {
        SessionRuntime crashed = tracker.afterExit(2);

        SessionRuntime restarted = tracker.transition(crashed, SessionPhase.RUNNING, ProcessState.ALIVE,
                SessionActivity.IDLE);

        assertEquals(SessionPhase.RUNNING, restarted.phase());
        assertEquals(crashed.lastExit(), restarted.lastExit());
        assertTrue(restarted.sameStateAs(restarted.toBuilder().updatedAt(NOW.plusSeconds(5)).build()));
    }
}
