package com.umitunal.tubeq.core;

/**
 * Clock used by tubes for every deadline computation.
 */
@FunctionalInterface
public interface TimeSource {

    TimeSource SYSTEM = System::currentTimeMillis;

    /**
     * Current time in milliseconds since epoch.
     */
    long currentTimeMillis();
}
