package com.umitunal.tubeq.exception;

import java.time.Duration;

/**
 * Thrown when a reserve deadline passes with no job delivered.
 */
public class TimedOutException extends TubeException {

    public TimedOutException(String tube, Duration timeout) {
        super("No job became ready in tube " + tube + " within " + timeout.toMillis() + "ms", null);
    }
}
