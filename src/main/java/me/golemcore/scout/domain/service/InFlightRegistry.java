/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.scout.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scout.domain.exception.ResearchTimeoutException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-flight execution of expensive computations keyed by cache key.
 *
 * <p>
 * The first caller for a key runs the work on the request executor, bounded
 * by a timeout; concurrent callers with the same key wait for that result
 * instead of computing it again. On timeout the work is cancelled with an
 * interrupt and every waiter receives {@link ResearchTimeoutException}. The
 * key is released as soon as the first computation ends, however it ends.
 */
@Component
@Slf4j
public class InFlightRegistry {

    private final ExecutorService executor;
    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    public InFlightRegistry(@Qualifier("researchRequestExecutor") ExecutorService executor) {
        this.executor = executor;
    }

    @SuppressWarnings("unchecked")
    public <T> T execute(String key, String operation, Duration timeout, Callable<T> work) {
        CompletableFuture<Object> leader = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, leader);
        if (existing != null) {
            log.debug("[Research] Joining in-flight {} for {}", operation, key);
            return (T) await(existing, operation, timeout);
        }

        Future<T> task = executor.submit(work);
        try {
            T result = task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            leader.complete(result);
            return result;
        } catch (TimeoutException e) {
            task.cancel(true);
            ResearchTimeoutException timeoutError = new ResearchTimeoutException(operation, timeout);
            leader.completeExceptionally(timeoutError);
            log.warn("[Research] {} timed out after {}ms, work cancelled", operation, timeout.toMillis());
            throw timeoutError;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            leader.completeExceptionally(cause);
            throw propagate(cause);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException(operation + " interrupted");
            leader.completeExceptionally(cancelled);
            throw cancelled;
        } finally {
            inFlight.remove(key, leader);
        }
    }

    public int size() {
        return inFlight.size();
    }

    private static Object await(CompletableFuture<Object> existing, String operation, Duration timeout) {
        try {
            return existing.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ResearchTimeoutException(operation, timeout);
        } catch (ExecutionException e) {
            throw propagate(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException(operation + " interrupted");
        }
    }

    private static RuntimeException propagate(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException(cause.getMessage(), cause);
    }
}
