package me.golemcore.sessions.domain.service;

import me.golemcore.sessions.domain.model.TranscriptEntry;
import me.golemcore.sessions.domain.model.TranscriptSource;
import me.golemcore.sessions.domain.model.event.AssistantMessageEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HydrationCoordinatorTest {

    private static final String SESSION_ID = "session-1";
    private static final String LOCATION = "ext-1|/work/project";
    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private HydrationCoordinator coordinator;
    private List<List<TranscriptEntry>> installed;

    @BeforeEach
    void setUp() {
        coordinator = new HydrationCoordinator();
        installed = new ArrayList<>();
    }

    @Test
    void shouldLoadOnceForConcurrentCallers() {
        AtomicInteger loads = new AtomicInteger();
        CompletableFuture<List<TranscriptEntry>> read = new CompletableFuture<>();

        List<CompletableFuture<Void>> callers = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            callers.add(coordinator.ensureHydrated(SESSION_ID, LOCATION, () -> {
                loads.incrementAndGet();
                return read;
            }, installed::add));
        }

        assertTrue(coordinator.isHydrating(SESSION_ID));
        read.complete(List.of(entry("A")));
        callers.forEach(CompletableFuture::join);

        assertEquals(1, loads.get());
        assertEquals(1, installed.size());
        assertTrue(coordinator.isHydrated(SESSION_ID));
        assertFalse(coordinator.isHydrating(SESSION_ID));
    }

    @Test
    void shouldSkipLoaderWhenAlreadyHydrated() {
        AtomicInteger loads = new AtomicInteger();
        coordinator.ensureHydrated(SESSION_ID, LOCATION, () -> {
            loads.incrementAndGet();
            return CompletableFuture.completedFuture(List.of());
        }, installed::add).join();

        coordinator.ensureHydrated(SESSION_ID, LOCATION, () -> {
            loads.incrementAndGet();
            return CompletableFuture.completedFuture(List.of());
        }, installed::add).join();

        assertEquals(1, loads.get());
    }

    @Test
    void shouldReloadAfterInvalidation() {
        coordinator.ensureHydrated(SESSION_ID, LOCATION,
                () -> CompletableFuture.completedFuture(List.of(entry("A"))), installed::add).join();

        coordinator.invalidate(SESSION_ID);
        assertFalse(coordinator.isHydrated(SESSION_ID));

        coordinator.ensureHydrated(SESSION_ID, LOCATION,
                () -> CompletableFuture.completedFuture(List.of(entry("B"))), installed::add).join();

        assertEquals(2, installed.size());
        assertEquals("B", installed.get(1).get(0).id());
    }

    @Test
    void shouldDiscardLoadStartedBeforeInvalidation() {
        CompletableFuture<List<TranscriptEntry>> staleRead = new CompletableFuture<>();
        AtomicInteger loads = new AtomicInteger();

        CompletableFuture<Void> caller = coordinator.ensureHydrated(SESSION_ID, LOCATION, () -> {
            if (loads.incrementAndGet() == 1) {
                return staleRead;
            }
            return CompletableFuture.completedFuture(List.of(entry("fresh")));
        }, installed::add);

        coordinator.invalidate(SESSION_ID);
        staleRead.complete(List.of(entry("stale")));
        caller.join();

        assertEquals(2, loads.get());
        assertEquals(1, installed.size());
        assertEquals("fresh", installed.get(0).get(0).id());
    }

    @Test
    void shouldSurfaceLoadFailureAndAllowRetry() {
        CompletableFuture<Void> failed = coordinator.ensureHydrated(SESSION_ID, LOCATION,
                () -> CompletableFuture.failedFuture(new IllegalStateException("unreadable")), installed::add);

        assertThrows(CompletionException.class, failed::join);
        assertFalse(coordinator.isHydrated(SESSION_ID));
        assertFalse(coordinator.isHydrating(SESSION_ID));

        coordinator.ensureHydrated(SESSION_ID, LOCATION,
                () -> CompletableFuture.completedFuture(List.of(entry("A"))), installed::add).join();
        assertTrue(coordinator.isHydrated(SESSION_ID));
        assertEquals(1, installed.size());
    }

    @Test
    void shouldForgetSession() {
        coordinator.ensureHydrated(SESSION_ID, LOCATION, () -> CompletableFuture.completedFuture(List.of()),
                installed::add).join();

        coordinator.forget(SESSION_ID);

        assertFalse(coordinator.isHydrated(SESSION_ID));
    }

    @Test
    void shouldReloadWhenLogLocationChanges() {
        coordinator.ensureHydrated(SESSION_ID, LOCATION,
                () -> CompletableFuture.completedFuture(List.of(entry("A"))), installed::add).join();

        coordinator.ensureHydrated(SESSION_ID, "ext-2|/work/project",
                () -> CompletableFuture.completedFuture(List.of(entry("B"))), installed::add).join();
        coordinator.ensureHydrated(SESSION_ID, "ext-2|/work/project",
                () -> CompletableFuture.completedFuture(List.of(entry("C"))), installed::add).join();

        assertEquals(2, installed.size());
        assertEquals("B", installed.get(1).get(0).id());
    }

    @Test
    void shouldNotMarkHydratedWithoutLogLocation() {
        AtomicInteger loads = new AtomicInteger();

        coordinator.ensureHydrated(SESSION_ID, null, () -> {
            loads.incrementAndGet();
            return CompletableFuture.completedFuture(List.of());
        }, installed::add).join();

        assertEquals(0, loads.get());
        assertFalse(coordinator.isHydrated(SESSION_ID));
        assertTrue(installed.isEmpty());
    }

    @Test
    void shouldAbandonLoadOfForgottenSession() {
        CompletableFuture<List<TranscriptEntry>> read = new CompletableFuture<>();
        AtomicInteger loads = new AtomicInteger();
        CompletableFuture<Void> caller = coordinator.ensureHydrated(SESSION_ID, LOCATION, () -> {
            loads.incrementAndGet();
            return read;
        }, installed::add);

        coordinator.forget(SESSION_ID);
        read.complete(List.of(entry("A")));

        CompletionException error = assertThrows(CompletionException.class, caller::join);
        assertInstanceOf(CancellationException.class, error.getCause());
        assertEquals(1, loads.get());
        assertTrue(installed.isEmpty());
        assertFalse(coordinator.isHydrated(SESSION_ID));
    }

    private static TranscriptEntry entry(String id) {
        return TranscriptEntry.builder()
                .id(id)
                .source(TranscriptSource.AGENT)
                .payload(AssistantMessageEvent.ofText(id, NOW))
                .timestamp(NOW)
                .order(0)
                .build();
    }
}
