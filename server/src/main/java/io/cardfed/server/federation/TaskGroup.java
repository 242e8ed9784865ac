// file: server/src/main/java/io/cardfed/server/federation/TaskGroup.java
package io.cardfed.server.federation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Tasks forked for one logical operation and joined together.
 * <p>
 *  - {@link #fork} submits a task to the shared executor.
 *  - {@link #join} waits for every forked task, even after one has failed, so no
 *    task outlives the operation; then rethrows the first failure unchanged.
 *  - {@link #joinAfter} runs one more step on the calling thread first; that step
 *    may fork work of its own onto the executor, so forked tasks never block on
 *    each other and a bounded pool cannot starve.
 *  - If the joining thread is interrupted, every task is cancelled (with interrupt)
 *    and a {@link FederationInterruptedException} is thrown.
 * <p>
 * Not thread-safe: fork and join from the thread that owns the operation.
 */
final class TaskGroup {

    private final ExecutorService executor;
    private final List<Future<?>> futures = new ArrayList<>();

    TaskGroup(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    <T> Future<T> fork(Callable<T> task) {
        Future<T> f = executor.submit(task);
        futures.add(f);
        return f;
    }

    void join() {
        Throwable firstFailure = null;
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (InterruptedException e) {
                cancelAll();
                Thread.currentThread().interrupt();
                throw new FederationInterruptedException("interrupted while waiting for " + futures.size() + " tasks", e);
            } catch (ExecutionException e) {
                if (firstFailure == null) firstFailure = e.getCause();
            } catch (CancellationException e) {
                if (firstFailure == null) firstFailure = e;
            }
        }
        if (firstFailure != null) {
            throw rethrowable(firstFailure);
        }
    }

    /**
     * Run {@code inline} on the calling thread, then {@link #join()}.
     * A failure of a forked task wins over a failure of {@code inline}, which is
     * then attached as suppressed.
     */
    <T> T joinAfter(Supplier<T> inline) {
        T result;
        try {
            result = inline.get();
        } catch (RuntimeException | Error e) {
            try {
                join();
            } catch (RuntimeException forked) {
                if (forked != e) forked.addSuppressed(e);
                throw forked;
            }
            throw e;
        }
        join();
        return result;
    }

    /** Result of a task of this group; only valid after {@link #join()} returned. */
    static <T> T resultOf(Future<T> f) {
        if (!f.isDone()) throw new IllegalStateException("task not joined yet");
        try {
            return f.get();
        } catch (InterruptedException e) {
            // unreachable for a completed future
            Thread.currentThread().interrupt();
            throw new FederationInterruptedException("interrupted reading a completed task", e);
        } catch (ExecutionException e) {
            throw rethrowable(e.getCause());
        }
    }

    private void cancelAll() {
        for (Future<?> f : futures) {
            f.cancel(true);
        }
    }

    private static RuntimeException rethrowable(Throwable t) {
        if (t instanceof RuntimeException re) return re;
        if (t instanceof Error err) throw err;
        return new CompletionException(t);
    }
}
