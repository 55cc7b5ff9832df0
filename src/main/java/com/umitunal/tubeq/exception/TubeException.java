package com.umitunal.tubeq.exception;

/**
 * Base class for failures a tube reports back to its caller.
 * Each subclass maps to one client-visible response of the command layer.
 */
public abstract class TubeException extends Exception {
    private final String jobId;

    protected TubeException(String message, String jobId) {
        super(message);
        this.jobId = jobId;
    }

    /**
     * The job the failed operation targeted, or null when the operation had none.
     */
    public String getJobId() {
        return jobId;
    }
}
