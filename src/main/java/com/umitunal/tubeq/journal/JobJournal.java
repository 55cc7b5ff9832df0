package com.umitunal.tubeq.journal;

/**
 * Receives a copy of every committed transition, for write-ahead logging.
 *
 * <p>Tubes call {@link #append} while holding their lock, so implementations must hand the
 * event off and return without blocking on I/O. Failures stay inside the journal.
 *
 * @param <T> the type of job payload
 */
public interface JobJournal<T> extends AutoCloseable {

    void append(TransitionEvent<T> event);

    @Override
    default void close() {
    }

    @SuppressWarnings("unchecked")
    static <T> JobJournal<T> noop() {
        return (JobJournal<T>) NoopJournal.INSTANCE;
    }

    /**
     * Journal that drops everything.
     */
    final class NoopJournal implements JobJournal<Object> {
        private static final NoopJournal INSTANCE = new NoopJournal();

        private NoopJournal() {
        }

        @Override
        public void append(TransitionEvent<Object> event) {
        }
    }
}
