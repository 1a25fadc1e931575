package com.sportsdata.application.queue;

import java.util.Comparator;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * A unit of work waiting in the {@link RequestQueue}.
 *
 * @param id       caller supplied label, used for logging
 * @param priority lower runs first
 * @param sequence insertion ordinal, keeps equal priorities FIFO
 * @param executor work to run
 * @param result   settled with the executor's value or failure
 */
record QueuedTask<T>(String id, int priority, long sequence, Callable<T> executor, CompletableFuture<T> result) {

    static final Comparator<QueuedTask<?>> ORDER =
        Comparator.<QueuedTask<?>>comparingInt(QueuedTask::priority)
            .thenComparingLong(QueuedTask::sequence);

    void run() {
        try {
            result.complete(executor.call());
        } catch (Throwable t) {
            // an Error must end this task only, not the drain thread
            result.completeExceptionally(t);
        }
    }
}
