package com.insights.precompute.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Single-flight guard: concurrent callers for the same key share one computation.
 * The first caller runs it on its own thread, later callers block on its result.
 */
@Component
public class InFlightComputations {

    private static final Logger logger = LoggerFactory.getLogger(InFlightComputations.class);

    private final Map<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    /**
     * Callers joining an in-flight computation get its result checked against {@code type}.
     */
    public <T> T execute(String key, Class<T> type, Supplier<? extends T> computation) {
        CompletableFuture<Object> created = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, created);

        if (existing != null) {
            logger.debug("Joining in-flight computation for {}", key);
            return type.cast(await(existing));
        }

        try {
            T result = computation.get();
            created.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            created.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, created);
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private static Object await(CompletableFuture<Object> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
