/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
 */
package dev.mars.kmap.persist;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle for a background save or load.
 * <p>
 * Exposes a completion signal, an error slot that is readable only once the
 * task has finished, and a coarse progress counter that moves from {@code 0}
 * to {@code 100} when the task ends, whether it succeeded or not. There is no
 * cancellation: a started task always runs to completion or failure.
 *
 * <pre>{@code
 * PersistenceTask task = map.saveAsync(path, SaveOptions.compressed());
 * task.await();
 * task.error().ifPresent(e -> LOG.error("Snapshot failed", e));
 * }</pre>
 */
public final class PersistenceTask {

    /** Work performed by the task. */
    @FunctionalInterface
    interface IoAction {
        void run() throws IOException;
    }

    public static final int PROGRESS_DONE = 100;

    private final String operation;
    private final Path path;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();
    private final AtomicInteger progress = new AtomicInteger();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final CountDownLatch finished = new CountDownLatch(1);

    private PersistenceTask(String operation, Path path) {
        this.operation = operation;
        this.path = path;
    }

    static PersistenceTask start(String operation, Path path, IoAction action, Executor executor) {
        PersistenceTask task = new PersistenceTask(operation, path);
        executor.execute(() -> {
            Throwable error = null;
            try {
                action.run();
            } catch (Throwable e) {
                error = e;
            }
            task.finish(error);
            if (error instanceof Error) {
                throw (Error) error;
            }
        });
        return task;
    }

    /**
     * Fills the error slot and progress, releases waiters, then completes the
     * future, so dependents of {@link #completion()} already see a finished task.
     */
    private void finish(Throwable error) {
        failure.set(error);
        progress.set(PROGRESS_DONE);
        finished.countDown();
        if (error == null) {
            completion.complete(null);
        } else {
            completion.completeExceptionally(error);
        }
    }

    /** {@code "save"} or {@code "load"}. */
    public String operation() {
        return operation;
    }

    public Path path() {
        return path;
    }

    /**
     * Completion signal. Completes normally on success and exceptionally with
     * the same throwable reported by {@link #error()} on failure.
     */
    public CompletableFuture<Void> completion() {
        return completion.copy();
    }

    public boolean isDone() {
        return finished.getCount() == 0;
    }

    /** Blocks until the task finishes. Failures are not rethrown; see {@link #error()}. */
    public void await() throws InterruptedException {
        finished.await();
    }

    /**
     * Blocks until the task finishes or the timeout elapses.
     *
     * @return true if the task finished in time
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    /**
     * The failure of a finished task, or empty if it succeeded.
     *
     * @throws IllegalStateException if the task has not finished yet
     */
    public Optional<Throwable> error() {
        if (!isDone()) {
            throw new IllegalStateException("Task " + operation + " of " + path + " has not finished");
        }
        return Optional.ofNullable(failure.get());
    }

    /** {@code 0} while running, {@link #PROGRESS_DONE} once finished. */
    public int progress() {
        return progress.get();
    }

    @Override
    public String toString() {
        return "PersistenceTask{" +
                "operation=" + operation +
                ", path=" + path +
                ", progress=" + progress.get() +
                ", done=" + isDone() +
                '}';
    }
}
