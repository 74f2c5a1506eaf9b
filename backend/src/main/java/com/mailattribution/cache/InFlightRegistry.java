package com.mailattribution.cache;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Tracks background jobs by key so at most one runs per key.
 *
 * <p>The entry is removed when the job completes, whether it succeeded, failed or was cancelled.
 */
@Slf4j
public class InFlightRegistry<K> {

    private final String name;
    private final Map<K, CompletableFuture<?>> inFlight = new ConcurrentHashMap<>();

    public InFlightRegistry(String name) {
        this.name = name;
    }

    /**
     * Launches a job for the key unless one is already running.
     *
     * @param launcher starts the job and returns its future; called at most once per free key
     * @return the job's future, or empty when a job for the key was already in flight
     */
    public <T> Optional<CompletableFuture<T>> launch(K key, Supplier<CompletableFuture<T>> launcher) {
        CompletableFuture<T> tracked = new CompletableFuture<>();
        if (inFlight.putIfAbsent(key, tracked) != null) {
            log.debug("{}: job for {} already in flight", name, key);
            return Optional.empty();
        }

        CompletableFuture<T> job;
        try {
            job = launcher.get();
        } catch (RuntimeException e) {
            inFlight.remove(key, tracked);
            tracked.completeExceptionally(e);
            throw e;
        }

        job.whenComplete(
                (result, error) -> {
                    inFlight.remove(key, tracked);
                    if (error != null) {
                        tracked.completeExceptionally(error);
                    } else {
                        tracked.complete(result);
                    }
                });

        // Cancelling the returned future cancels the job itself
        tracked.whenComplete(
                (result, error) -> {
                    if (tracked.isCancelled()) {
                        job.cancel(true);
                        inFlight.remove(key, tracked);
                    }
                });

        return Optional.of(tracked);
    }

    public boolean isInFlight(K key) {
        return inFlight.containsKey(key);
    }

    public int size() {
        return inFlight.size();
    }
}
