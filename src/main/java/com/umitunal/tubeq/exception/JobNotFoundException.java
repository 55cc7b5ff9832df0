package com.umitunal.tubeq.exception;

public class JobNotFoundException extends TubeException {

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId, jobId);
    }
}
