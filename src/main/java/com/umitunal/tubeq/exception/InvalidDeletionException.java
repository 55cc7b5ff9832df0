package com.umitunal.tubeq.exception;

import com.umitunal.tubeq.core.Job;

/**
 * Thrown when a delete targets a job whose state forbids deletion.
 */
public class InvalidDeletionException extends TubeException {
    private final Job.State state;

    public InvalidDeletionException(String jobId, Job.State state) {
        super("Job " + jobId + " cannot be deleted while " + state, jobId);
        this.state = state;
    }

    public Job.State getState() {
        return state;
    }
}
