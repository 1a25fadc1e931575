package com.sportsdata.application.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the pipeline's fixed-rate background jobs and stops them together.
 */
public class RefreshScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RefreshScheduler.class);

    private final TaskScheduler taskScheduler;
    private final Map<String, ScheduledFuture<?>> handles = new LinkedHashMap<>();
    private final Object runLock = new Object();
    private int activeRuns;
    private volatile boolean running;

    public RefreshScheduler(TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    /**
     * Schedules every job at its interval, first run one interval from now.
     * Does nothing when already running.
     */
    public synchronized void start(List<RefreshJob> jobs) {
        if (running) {
            logger.warn("Refresh scheduler already running with jobs {}", handles.keySet());
            return;
        }
        running = true;
        for (RefreshJob job : jobs) {
            Runnable guarded = () -> runJob(job);
            handles.put(job.name(), taskScheduler.scheduleAtFixedRate(
                guarded, taskScheduler.getClock().instant().plus(job.interval()), job.interval()));
            logger.info("Scheduled job {} every {}s", job.name(), job.interval().toSeconds());
        }
    }

    /**
     * Cancels all jobs. A job body that is running is interrupted.
     */
    public synchronized void stop() {
        running = false;
        for (Map.Entry<String, ScheduledFuture<?>> entry : handles.entrySet()) {
            entry.getValue().cancel(true);
            logger.info("Cancelled job {}", entry.getKey());
        }
        handles.clear();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Waits for job bodies that were already executing when {@link #stop()} was called.
     *
     * @return true if no job body is running anymore
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (runLock) {
            while (activeRuns > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(runLock, remaining);
            }
            return true;
        }
    }

    public synchronized List<String> scheduledJobs() {
        return new ArrayList<>(handles.keySet());
    }

    private void runJob(RefreshJob job) {
        synchronized (runLock) {
            if (!running) {
                return;
            }
            activeRuns++;
        }
        try {
            job.body().run();
        } catch (RuntimeException e) {
            // the trigger would stop rescheduling if this escaped
            logger.error("Job {} failed", job.name(), e);
        } finally {
            synchronized (runLock) {
                activeRuns--;
                runLock.notifyAll();
            }
        }
    }

    /**
     * @param name     job name, e.g. {@code odds}
     * @param interval fixed rate
     * @param body     work of one tick
     */
    public record RefreshJob(String name, Duration interval, Runnable body) {

        public RefreshJob {
            if (interval == null || interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("interval of job " + name + " must be positive");
            }
        }
    }
}
