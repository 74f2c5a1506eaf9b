package com.mailattribution.cache;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InFlightRegistryTest {

    private final InFlightRegistry<String> registry = new InFlightRegistry<>("test");

    @Test
    @DisplayName("Concurrent requests for one key launch a single job")
    void launch_SingleJobPerKey() {
        // Arrange
        AtomicInteger launches = new AtomicInteger();
        CompletableFuture<Long> job = new CompletableFuture<>();

        // Act
        Optional<CompletableFuture<Long>> first =
                registry.launch("2026-01-01|2026-01-31", () -> { launches.incrementAndGet(); return job; });
        Optional<CompletableFuture<Long>> second =
                registry.launch("2026-01-01|2026-01-31", () -> { launches.incrementAndGet(); return job; });

        // Assert
        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        assertEquals(1, launches.get());
        assertTrue(registry.isInFlight("2026-01-01|2026-01-31"));
    }

    @Test
    @DisplayName("The entry is removed after the job succeeds")
    void launch_RemovedAfterSuccess() throws Exception {
        CompletableFuture<Long> job = new CompletableFuture<>();
        CompletableFuture<Long> tracked = registry.launch("k", () -> job).orElseThrow();

        job.complete(42L);

        assertEquals(42L, tracked.get());
        assertFalse(registry.isInFlight("k"));
        assertTrue(registry.launch("k", () -> CompletableFuture.completedFuture(1L)).isPresent());
    }

    @Test
    @DisplayName("The entry is removed after the job fails")
    void launch_RemovedAfterFailure() {
        CompletableFuture<Long> job = new CompletableFuture<>();
        CompletableFuture<Long> tracked = registry.launch("k", () -> job).orElseThrow();

        job.completeExceptionally(new IllegalStateException("export failed"));

        ExecutionException error = assertThrows(ExecutionException.class, tracked::get);
        assertEquals("export failed", error.getCause().getMessage());
        assertFalse(registry.isInFlight("k"));
    }

    @Test
    @DisplayName("A launcher that throws leaves the key free")
    void launch_LauncherThrows() {
        assertThrows(
                IllegalStateException.class,
                () -> registry.launch("k", () -> { throw new IllegalStateException("rejected"); }));

        assertFalse(registry.isInFlight("k"));
        assertEquals(0, registry.size());
    }
}
