package com.umitunal.tubeq.exception;

/**
 * Thrown when a put would take a tube past its configured job limit.
 */
public class CapacityExceededException extends TubeException {
    private final int maxJobs;

    public CapacityExceededException(String tube, int maxJobs) {
        super("Tube " + tube + " is at its limit of " + maxJobs + " jobs", null);
        this.maxJobs = maxJobs;
    }

    public int getMaxJobs() {
        return maxJobs;
    }
}
