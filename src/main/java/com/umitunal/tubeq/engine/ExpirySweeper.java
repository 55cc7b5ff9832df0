package com.umitunal.tubeq.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background timer that sweeps every tube at a fixed interval: delayed jobs whose delay has
 * elapsed become ready, and reservations whose time-to-run has run out go back to ready.
 *
 * <p>Each tube is swept under its own lock, one tube at a time. A failing tube is logged and
 * skipped; the rest of the pass continues.
 */
public class ExpirySweeper implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private final Iterable<? extends PriorityTube<?>> tubes;
    private final Duration interval;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong passes = new AtomicLong(0);
    private final AtomicLong movedJobs = new AtomicLong(0);

    private ScheduledExecutorService scheduler;

    /**
     * @param tubes live view of the tubes to sweep; read once per pass
     * @param interval pause between the end of one pass and the start of the next
     */
    public ExpirySweeper(Iterable<? extends PriorityTube<?>> tubes, Duration interval) {
        this.tubes = tubes;
        this.interval = interval;
    }

    /**
     * Start sweeping in the background.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "tubeq-sweeper");
                thread.setDaemon(true);
                return thread;
            });
            long millis = interval.toMillis();
            scheduler.scheduleWithFixedDelay(this::runPass, millis, millis, TimeUnit.MILLISECONDS);
            log.info("Expiry sweeper started, interval {}ms", millis);
        }
    }

    /**
     * Stop sweeping. A pass in progress finishes first.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Expiry sweeper did not stop in time.");
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scheduler.shutdownNow();
            }
            log.info("Expiry sweeper stopped after {} passes, {} jobs moved", passes.get(), movedJobs.get());
        }
    }

    /**
     * Sweep every tube once, on the calling thread.
     *
     * @return the number of jobs moved to ready
     */
    public int sweepOnce() {
        int moved = 0;
        for (PriorityTube<?> tube : tubes) {
            try {
                moved += tube.sweep();
            } catch (RuntimeException e) {
                log.error("Sweep of tube {} failed: {}", tube.getName(), e.getMessage(), e);
            }
        }
        passes.incrementAndGet();
        movedJobs.addAndGet(moved);
        return moved;
    }

    public boolean isRunning() { return running.get(); }
    public long getPasses() { return passes.get(); }
    public long getMovedJobs() { return movedJobs.get(); }

    @Override
    public void close() {
        stop();
    }

    private void runPass() {
        try {
            int moved = sweepOnce();
            if (moved > 0) {
                log.debug("Sweep moved {} jobs to ready", moved);
            }
        } catch (RuntimeException e) {
            // An escaping exception would cancel the schedule
            log.error("Sweep pass failed: {}", e.getMessage(), e);
        }
    }
}
