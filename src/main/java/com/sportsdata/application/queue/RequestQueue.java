package com.sportsdata.application.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Priority ordered task runner that executes one task at a time.
 *
 * <p>Tasks are kept sorted by ascending priority (FIFO among equals) and drained by a single
 * worker thread, which pauses for the configured pacing delay after every task. Only one
 * drain loop is ever active. The queue is unbounded: there is no admission control.
 */
public class RequestQueue implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RequestQueue.class);

    private final Object lock = new Object();
    private final List<QueuedTask<?>> tasks = new ArrayList<>();
    private final ExecutorService drainExecutor;
    private final Duration pacing;

    private long sequence;
    private boolean draining;
    private boolean closed;

    public RequestQueue(Duration pacing) {
        if (pacing.isNegative()) {
            throw new IllegalArgumentException("pacing must not be negative");
        }
        this.pacing = pacing;
        this.drainExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "request-queue");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Adds a task and starts draining if the queue is not already being drained.
     *
     * @param id       label of the task
     * @param priority lower values run first
     * @param executor work to run on the queue thread
     * @return future settled with the executor's result or failure
     */
    public <T> CompletableFuture<T> enqueue(String id, int priority, Callable<T> executor) {
        CompletableFuture<T> result = new CompletableFuture<>();
        boolean startDrain;

        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Request queue is closed");
            }
            tasks.add(new QueuedTask<>(id, priority, sequence++, executor, result));
            tasks.sort(QueuedTask.ORDER);
            startDrain = !draining;
            draining = true;
            logger.debug("Enqueued task {} with priority {} ({} pending)", id, priority, tasks.size());
        }

        if (startDrain) {
            drainExecutor.execute(this::drain);
        }
        return result;
    }

    /**
     * @return number of tasks waiting to run, not counting the one executing
     */
    public int size() {
        synchronized (lock) {
            return tasks.size();
        }
    }

    public boolean isIdle() {
        synchronized (lock) {
            return !draining;
        }
    }

    /**
     * Blocks until every enqueued task has settled or the timeout elapses.
     *
     * @return true if the queue became idle in time
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            while (draining) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(lock, remaining);
            }
            return true;
        }
    }

    /**
     * Stops the worker. Tasks still waiting are cancelled.
     */
    @Override
    public void close() {
        List<QueuedTask<?>> pending;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            pending = new ArrayList<>(tasks);
            tasks.clear();
            draining = false;
            lock.notifyAll();
        }
        drainExecutor.shutdownNow();
        pending.forEach(task -> task.result().completeExceptionally(
            new CancellationException("Request queue closed before task " + task.id() + " ran")));
        logger.info("Request queue closed, {} pending tasks cancelled", pending.size());
    }

    private void drain() {
        while (true) {
            QueuedTask<?> task;
            synchronized (lock) {
                if (tasks.isEmpty() || closed) {
                    draining = false;
                    lock.notifyAll();
                    return;
                }
                task = tasks.remove(0);
            }

            logger.debug("Running task {} (priority {})", task.id(), task.priority());
            task.run();

            if (!pause()) {
                synchronized (lock) {
                    draining = false;
                    lock.notifyAll();
                }
                return;
            }
        }
    }

    private boolean pause() {
        if (pacing.isZero()) {
            return true;
        }
        try {
            Thread.sleep(pacing.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
