package com.umitunal.tubeq.worker;

import com.umitunal.tubeq.core.Job;

/**
 * Processes jobs reserved by a {@link TubeWorker}.
 *
 * @param <T> the type of job payload
 */
@FunctionalInterface
public interface JobProcessor<T> {

    /**
     * Process a reserved job and say what should happen to it.
     *
     * @param job the reserved job
     * @return processing result
     * @throws Exception if processing fails; the worker treats this as a retryable failure
     */
    ProcessingResult process(Job<T> job) throws Exception;

    /**
     * Outcome of processing one job.
     */
    class ProcessingResult {
        private final Outcome outcome;
        private final String message;

        private ProcessingResult(Outcome outcome, String message) {
            this.outcome = outcome;
            this.message = message;
        }

        public Outcome getOutcome() { return outcome; }
        public String getMessage() { return message; }

        /**
         * Done; the job is deleted.
         */
        public static ProcessingResult success() {
            return new ProcessingResult(Outcome.SUCCESS, null);
        }

        /**
         * Transient failure; the job is released for another attempt.
         */
        public static ProcessingResult failure(String message) {
            return new ProcessingResult(Outcome.FAILURE, message);
        }

        /**
         * Permanent failure; the job is buried for inspection.
         */
        public static ProcessingResult bury(String message) {
            return new ProcessingResult(Outcome.BURY, message);
        }
    }

    enum Outcome {
        SUCCESS,
        FAILURE,
        BURY
    }
}
