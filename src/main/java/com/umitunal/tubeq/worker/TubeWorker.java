package com.umitunal.tubeq.worker;

import com.umitunal.tubeq.core.Tube;
import com.umitunal.tubeq.exception.TimedOutException;
import com.umitunal.tubeq.exception.TubeException;
import com.umitunal.tubeq.model.JobSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A consumer that keeps reserving jobs from one tube and hands them to a {@link JobProcessor}.
 *
 * <p>Successful jobs are deleted. Failed jobs are released with a delay until they have been
 * reserved {@code maxAttempts} times, after which they are buried.
 *
 * @param <T> the type of job payload
 */
public class TubeWorker<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TubeWorker.class);

    private final String workerId;
    private final Tube<T> tube;
    private final JobProcessor<T> processor;
    private final Duration reserveTimeout;
    private final long retryDelaySeconds;
    private final int maxAttempts;
    private final AtomicBoolean running;
    private final AtomicLong processedCount;
    private final AtomicLong failedCount;
    private final AtomicLong buriedCount;

    private Thread workerThread;

    private TubeWorker(Builder<T> builder) {
        this.workerId = builder.workerId;
        this.tube = builder.tube;
        this.processor = builder.processor;
        this.reserveTimeout = builder.reserveTimeout;
        this.retryDelaySeconds = builder.retryDelaySeconds;
        this.maxAttempts = builder.maxAttempts;
        this.running = new AtomicBoolean(false);
        this.processedCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
        this.buriedCount = new AtomicLong(0);
    }

    /**
     * Start the worker in the background.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            workerThread = new Thread(this::run, "TubeWorker-" + workerId);
            workerThread.setDaemon(false);
            workerThread.start();
            log.info("Worker {} started on tube {}", workerId, tube.getName());
        }
    }

    /**
     * Stop the worker. A blocked reserve is interrupted; the tube puts any job it was about
     * to hand over back to ready.
     */
    public void stop() {
        running.set(false);
        if (workerThread != null) {
            workerThread.interrupt();
            try {
                workerThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("Worker {} stopped: {} processed, {} failed, {} buried",
                    workerId, processedCount.get(), failedCount.get(), buriedCount.get());
        }
    }

    /**
     * Reserve and process a single job on the calling thread.
     *
     * @return false if no job became ready within the reserve timeout
     */
    public boolean processOne() throws InterruptedException, TubeException {
        JobSnapshot<T> job;
        try {
            job = tube.reserve(workerId, reserveTimeout);
        } catch (TimedOutException e) {
            return false;
        }

        JobProcessor.ProcessingResult result;
        try {
            result = processor.process(job);
        } catch (InterruptedException e) {
            try {
                tube.release(workerId, job.getId(), job.getPriority(), 0);
            } catch (TubeException releaseFailure) {
                // The reservation already lapsed; the interrupt still wins
                log.warn("Worker {} could not release job {} after interrupt: {}",
                        workerId, job.getId(), releaseFailure.getMessage());
                e.addSuppressed(releaseFailure);
            }
            throw e;
        } catch (Exception e) {
            log.error("Worker {} failed to process job {}: {}", workerId, job.getId(), e.getMessage(), e);
            result = JobProcessor.ProcessingResult.failure(e.getMessage());
        }

        switch (result.getOutcome()) {
            case SUCCESS -> {
                tube.delete(workerId, job.getId());
                processedCount.incrementAndGet();
                log.debug("Worker {} completed job {}", workerId, job.getId());
            }
            case FAILURE -> {
                if (job.getReserves() >= maxAttempts) {
                    tube.bury(workerId, job.getId(), job.getPriority(), result.getMessage());
                    buriedCount.incrementAndGet();
                    log.warn("Worker {} buried job {} after {} attempts.", workerId, job.getId(), job.getReserves());
                } else {
                    tube.release(workerId, job.getId(), job.getPriority(), retryDelaySeconds);
                    failedCount.incrementAndGet();
                    log.info("Worker {} released job {} for retry. Attempt: {}/{}",
                            workerId, job.getId(), job.getReserves(), maxAttempts);
                }
            }
            case BURY -> {
                tube.bury(workerId, job.getId(), job.getPriority(), result.getMessage());
                buriedCount.incrementAndGet();
                log.warn("Worker {} buried job {}: {}", workerId, job.getId(), result.getMessage());
            }
        }
        return true;
    }

    private void run() {
        while (running.get()) {
            try {
                processOne();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (TubeException e) {
                // Typically the job timed out and was reserved by someone else
                log.warn("Worker {} lost job {}: {}", workerId, e.getJobId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Worker {} encountered an unexpected error: {}", workerId, e.getMessage(), e);
            }
        }
    }

    public String getWorkerId() { return workerId; }
    public long getProcessedCount() { return processedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public long getBuriedCount() { return buriedCount.get(); }
    public boolean isRunning() { return running.get(); }

    @Override
    public void close() {
        stop();
    }

    public static <T> Builder<T> builder(String workerId, Tube<T> tube, JobProcessor<T> processor) {
        return new Builder<>(workerId, tube, processor);
    }

    public static class Builder<T> {
        private final String workerId;
        private final Tube<T> tube;
        private final JobProcessor<T> processor;
        private Duration reserveTimeout = Duration.ofSeconds(1);
        private long retryDelaySeconds = 0;
        private int maxAttempts = 3;

        private Builder(String workerId, Tube<T> tube, JobProcessor<T> processor) {
            this.workerId = workerId;
            this.tube = tube;
            this.processor = processor;
        }

        /**
         * How long one reserve may block before the worker re-checks whether it should stop.
         */
        public Builder<T> withReserveTimeout(Duration timeout) {
            this.reserveTimeout = timeout;
            return this;
        }

        public Builder<T> withRetryDelay(long seconds) {
            this.retryDelaySeconds = seconds;
            return this;
        }

        public Builder<T> withMaxAttempts(int attempts) {
            this.maxAttempts = attempts;
            return this;
        }

        public TubeWorker<T> build() {
            return new TubeWorker<>(this);
        }
    }
}
