package com.umitunal.tubeq.core;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of identifiers for jobs and waiting consumers.
 * Implementations must be safe for use from several tubes at once.
 */
@FunctionalInterface
public interface IdGenerator {

    String nextId();

    /**
     * Increasing integer ids starting at 1, the way beanstalkd numbers its jobs.
     */
    static IdGenerator sequential() {
        AtomicLong counter = new AtomicLong();
        return () -> Long.toString(counter.incrementAndGet());
    }

    static IdGenerator uuid() {
        return () -> UUID.randomUUID().toString();
    }
}
