package com.umitunal.tubeq.core;

/**
 * Point-in-time counts for a single tube.
 */
public class TubeMetrics {
    private final String tube;
    private final long readyJobs;
    private final long delayedJobs;
    private final long reservedJobs;
    private final long buriedJobs;
    private final long waitingConsumers;
    private final long totalPuts;
    private final long totalDeletes;
    private final long totalTimeouts;

    public TubeMetrics(String tube, long readyJobs, long delayedJobs, long reservedJobs, long buriedJobs,
                       long waitingConsumers, long totalPuts, long totalDeletes, long totalTimeouts) {
        this.tube = tube;
        this.readyJobs = readyJobs;
        this.delayedJobs = delayedJobs;
        this.reservedJobs = reservedJobs;
        this.buriedJobs = buriedJobs;
        this.waitingConsumers = waitingConsumers;
        this.totalPuts = totalPuts;
        this.totalDeletes = totalDeletes;
        this.totalTimeouts = totalTimeouts;
    }

    public String getTube() { return tube; }
    public long getReadyJobs() { return readyJobs; }
    public long getDelayedJobs() { return delayedJobs; }
    public long getReservedJobs() { return reservedJobs; }
    public long getBuriedJobs() { return buriedJobs; }
    public long getWaitingConsumers() { return waitingConsumers; }
    public long getTotalPuts() { return totalPuts; }
    public long getTotalDeletes() { return totalDeletes; }
    public long getTotalTimeouts() { return totalTimeouts; }

    /**
     * Jobs currently held by the tube, across all states.
     */
    public long getCurrentJobs() {
        return readyJobs + delayedJobs + reservedJobs + buriedJobs;
    }

    @Override
    public String toString() {
        return String.format(
            "TubeMetrics{tube=%s, ready=%d, delayed=%d, reserved=%d, buried=%d, waiting=%d, puts=%d, deletes=%d, timeouts=%d}",
            tube, readyJobs, delayedJobs, reservedJobs, buriedJobs, waitingConsumers, totalPuts, totalDeletes, totalTimeouts
        );
    }
}
