package me.golemcore.sessions.domain.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExclusiveOperationGuardTest {

    private final ExclusiveOperationGuard<String, String> guard = new ExclusiveOperationGuard<>("Test");

    @Test
    void shouldShareInFlightOperationBetweenCallers() {
        AtomicInteger invocations = new AtomicInteger();
        CompletableFuture<String> operation = new CompletableFuture<>();

        CompletableFuture<String> first = guard.run("key", () -> {
            invocations.incrementAndGet();
            return operation;
        });
        CompletableFuture<String> second = guard.run("key", () -> {
            invocations.incrementAndGet();
            return CompletableFuture.completedFuture("other");
        });

        assertEquals(1, invocations.get());
        assertTrue(guard.isInFlight("key"));

        operation.complete("result");

        assertEquals("result", first.join());
        assertEquals("result", second.join());
        assertFalse(guard.isInFlight("key"));
    }

    @Test
    void shouldRunIndependentKeysSeparately() {
        CompletableFuture<String> a = guard.run("a", () -> new CompletableFuture<String>());
        CompletableFuture<String> b = guard.run("b", () -> new CompletableFuture<String>());

        assertEquals(2, guard.inFlightCount());
        assertFalse(a.isDone());
        assertFalse(b.isDone());
    }

    @Test
    void shouldReleaseKeyAfterFailure() {
        CompletableFuture<String> operation = new CompletableFuture<>();
        CompletableFuture<String> result = guard.run("key", () -> operation);

        operation.completeExceptionally(new IllegalStateException("read failed"));

        CompletionException error = assertThrows(CompletionException.class, result::join);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertFalse(guard.isInFlight("key"));
        assertEquals("again", guard.run("key", () -> CompletableFuture.completedFuture("again")).join());
    }

    @Test
    void shouldConvertSynchronousThrowIntoFailedOutcome() {
        CompletableFuture<String> result = guard.run("key", () -> {
            throw new IllegalArgumentException("boom");
        });

        assertTrue(result.isCompletedExceptionally());
        assertFalse(guard.isInFlight("key"));
        CompletionException error = assertThrows(CompletionException.class, result::join);
        assertEquals("boom", error.getCause().getMessage());
    }

    @Test
    void shouldTreatMissingFutureAsFailure() {
        CompletableFuture<String> result = guard.run("key", () -> null);

        assertTrue(result.isCompletedExceptionally());
        assertFalse(guard.isInFlight("key"));
    }

    @Test
    void shouldNotLetCallerCompleteSharedOutcome() {
        CompletableFuture<String> operation = new CompletableFuture<>();
        CompletableFuture<String> first = guard.run("key", () -> operation);
        CompletableFuture<String> second = guard.run("key", () -> new CompletableFuture<String>());

        first.complete("hijacked");
        operation.complete("real");

        assertEquals("real", second.join());
    }
}
