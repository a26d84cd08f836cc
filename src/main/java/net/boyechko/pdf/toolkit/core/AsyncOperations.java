/*
 * PDF-Toolkit - Command-line PDF page assembly and extraction
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.toolkit.core;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs whole operations on a worker thread. Engine calls inside them still take {@link
 * net.boyechko.pdf.toolkit.engine.EngineLock}, so concurrent submissions never interleave.
 */
public final class AsyncOperations implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AsyncOperations.class);

    private final ExecutorService executor;
    private final boolean ownsExecutor;

    /** A synchronous operation to offload. */
    @FunctionalInterface
    public interface Operation<T> {
        T run() throws Exception;
    }

    public AsyncOperations() {
        this(
                Executors.newSingleThreadExecutor(
                        r -> {
                            Thread thread = new Thread(r, "pdf-toolkit-worker");
                            thread.setDaemon(true);
                            return thread;
                        }),
                true);
    }

    public AsyncOperations(ExecutorService executor) {
        this(executor, false);
    }

    private AsyncOperations(ExecutorService executor, boolean ownsExecutor) {
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Submits {@code operation}. Checked exceptions complete the future exceptionally, wrapped in
     * a {@link CompletionException}.
     */
    public <T> CompletableFuture<T> submit(Operation<T> operation) {
        return CompletableFuture.supplyAsync(
                () -> {
                    try {
                        return operation.run();
                    } catch (RuntimeException e) {
                        throw e;
                    } catch (Exception e) {
                        throw new CompletionException(e);
                    }
                },
                executor);
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Worker did not finish within 30 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
