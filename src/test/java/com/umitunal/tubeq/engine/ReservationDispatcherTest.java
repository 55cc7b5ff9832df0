package com.umitunal.tubeq.engine;

import com.umitunal.tubeq.config.TubeConfig;
import com.umitunal.tubeq.core.IdGenerator;
import com.umitunal.tubeq.core.Job;
import com.umitunal.tubeq.core.TimeSource;
import com.umitunal.tubeq.exception.TimedOutException;
import com.umitunal.tubeq.journal.Transition;
import com.umitunal.tubeq.model.JobSnapshot;
import com.umitunal.tubeq.model.WaitingConsumer;
import com.umitunal.tubeq.support.RecordingJournal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class ReservationDispatcherTest {

    private static final Duration LONG_WAIT = Duration.ofSeconds(10);

    private RecordingJournal<String> journal;
    private PriorityTube<String> tube;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        journal = new RecordingJournal<>();
        tube = new PriorityTube<>("default", TubeConfig.defaults(), TimeSource.SYSTEM, IdGenerator.sequential(), journal);
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Future<JobSnapshot<String>> reserveAsync(String consumerId, Duration timeout) {
        return executor.submit(() -> tube.reserve(consumerId, timeout));
    }

    private void awaitWaiting(int count) {
        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> tube.getMetrics().getWaitingConsumers() == count);
    }

    @Test
    @DisplayName("Should wake a blocked reserve when a job is put")
    void testPutWakesWaitingConsumer() throws Exception {
        // Given
        Future<JobSnapshot<String>> pending = reserveAsync("c1", LONG_WAIT);
        awaitWaiting(1);

        // When
        String id = tube.put(0, 0, 60, "work");

        // Then
        JobSnapshot<String> job = pending.get(5, TimeUnit.SECONDS);
        assertThat(job.getId()).isEqualTo(id);
        assertThat(job.getReservedBy()).isEqualTo("c1");
        assertThat(tube.getMetrics().getWaitingConsumers()).isZero();
        assertThat(tube.getMetrics().getReservedJobs()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should serve waiting consumers in arrival order")
    void testFifoAmongWaitingConsumers() throws Exception {
        // Given
        Future<JobSnapshot<String>> first = reserveAsync("A", LONG_WAIT);
        awaitWaiting(1);
        Future<JobSnapshot<String>> second = reserveAsync("B", LONG_WAIT);
        awaitWaiting(2);

        // When
        String id1 = tube.put(0, 0, 60, "one");

        // Then
        assertThat(first.get(5, TimeUnit.SECONDS).getId()).isEqualTo(id1);
        assertThat(second.isDone()).isFalse();

        String id2 = tube.put(0, 0, 60, "two");
        JobSnapshot<String> job2 = second.get(5, TimeUnit.SECONDS);
        assertThat(job2.getId()).isEqualTo(id2);
        assertThat(job2.getReservedBy()).isEqualTo("B");
    }

    @Test
    @DisplayName("Should deliver a single job to exactly one of many waiting consumers")
    void testSingleDelivery() throws Exception {
        // Given
        int consumers = 5;
        List<Future<JobSnapshot<String>>> pending = new ArrayList<>();
        for (int i = 0; i < consumers; i++) {
            pending.add(reserveAsync("c" + i, Duration.ofMillis(800)));
        }
        awaitWaiting(consumers);

        // When
        String id = tube.put(0, 0, 60, "only-one");

        // Then
        int delivered = 0;
        int timedOut = 0;
        for (Future<JobSnapshot<String>> future : pending) {
            try {
                assertThat(future.get(5, TimeUnit.SECONDS).getId()).isEqualTo(id);
                delivered++;
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(TimedOutException.class);
                timedOut++;
            }
        }
        assertThat(delivered).isEqualTo(1);
        assertThat(timedOut).isEqualTo(consumers - 1);
        assertThat(tube.getMetrics().getReservedJobs()).isEqualTo(1);
        assertThat(tube.getMetrics().getWaitingConsumers()).isZero();
    }

    @Test
    @DisplayName("Should time out a blocked reserve and leave no handle behind")
    void testTimeout() {
        // When / Then
        long start = System.nanoTime();
        assertThatThrownBy(() -> tube.reserve("c1", Duration.ofMillis(200)))
                .isInstanceOf(TimedOutException.class)
                .hasMessageContaining("default");
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(150);
        assertThat(tube.getMetrics().getWaitingConsumers()).isZero();
    }

    @Test
    @DisplayName("Should wake a blocked reserve on release and on kick")
    void testReleaseAndKickWakeWaitingConsumers() throws Exception {
        // Given
        String id = tube.put(0, 0, 60, "work");
        tube.reserve("holder", Duration.ZERO);
        Future<JobSnapshot<String>> afterRelease = reserveAsync("c1", LONG_WAIT);
        awaitWaiting(1);

        // When
        tube.release("holder", id, 0, 0);

        // Then
        assertThat(afterRelease.get(5, TimeUnit.SECONDS).getReservedBy()).isEqualTo("c1");

        // Bury it, then kick it to a second waiter
        tube.bury("c1", id, 0, "retry later");
        Future<JobSnapshot<String>> afterKick = reserveAsync("c2", LONG_WAIT);
        awaitWaiting(1);
        assertThat(tube.kick(10)).isEqualTo(1);
        assertThat(afterKick.get(5, TimeUnit.SECONDS).getId()).isEqualTo(id);
    }

    @Test
    @DisplayName("Should withdraw an interrupted reserve without losing jobs")
    void testInterruptedReserve() throws Exception {
        // Given
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread consumer = new Thread(() -> {
            try {
                tube.reserve("c1");
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "interrupted-consumer");
        consumer.start();
        awaitWaiting(1);

        // When
        consumer.interrupt();
        consumer.join(5_000);

        // Then
        assertThat(failure.get()).isInstanceOf(InterruptedException.class);
        assertThat(tube.getMetrics().getWaitingConsumers()).isZero();

        String id = tube.put(0, 0, 60, "work");
        assertThat(tube.reserve("c2", Duration.ZERO).getId()).isEqualTo(id);
    }

    @Test
    @DisplayName("Should accept timeouts too long to count in nanoseconds")
    void testVeryLongTimeout() throws Exception {
        // Given
        Future<JobSnapshot<String>> pending = reserveAsync("c1", Duration.ofDays(365L * 400));
        awaitWaiting(1);

        // When
        String id = tube.put(0, 0, 60, "work");

        // Then
        assertThat(pending.get(5, TimeUnit.SECONDS).getId()).isEqualTo(id);
    }

    @Test
    @DisplayName("Should return a job delivered after the deadline but before the lock was retaken")
    void testDeliveredAfterDeadline() throws Exception {
        // Given
        StalledConsumer handle = new StalledConsumer("c1", new TimeoutException());
        tube.register(handle);
        String id = tube.put(0, 0, 60, "late");

        // When
        JobSnapshot<String> job = tube.awaitDelivery(handle, Duration.ofMillis(1));

        // Then
        assertThat(job.getId()).isEqualTo(id);
        assertThat(job.getReservedBy()).isEqualTo("c1");
        assertThat(tube.peek(id)).get().extracting(Job::getState).isEqualTo(Job.State.RESERVED);
        assertThat(tube.getMetrics().getWaitingConsumers()).isZero();
    }

    @Test
    @DisplayName("Should requeue a job delivered to a consumer interrupted before it saw the job")
    void testInterruptAfterDelivery() throws Exception {
        // Given
        StalledConsumer handle = new StalledConsumer("c1", new InterruptedException());
        tube.register(handle);
        String id = tube.put(0, 0, 60, "work");

        // When / Then
        assertThatThrownBy(() -> tube.awaitDelivery(handle, LONG_WAIT))
                .isInstanceOf(InterruptedException.class);

        JobSnapshot<String> job = tube.peek(id).orElseThrow();
        assertThat(job.getState()).isEqualTo(Job.State.READY);
        assertThat(job.getReservedBy()).isNull();
        assertThat(job.getReleases()).isZero();
        assertThat(journal.transitionsOf(id))
                .containsExactly(Transition.PUT, Transition.RESERVE, Transition.REQUEUE);
    }

    @Test
    @DisplayName("Should hand a requeued job to the next waiting consumer")
    void testRequeuedJobRedispatched() throws Exception {
        // Given
        StalledConsumer interrupted = new StalledConsumer("c1", new InterruptedException());
        tube.register(interrupted);
        String id = tube.put(0, 0, 60, "work");
        WaitingConsumer<String> next = new WaitingConsumer<>("handle-2", "c2", System.currentTimeMillis());
        tube.register(next);
        assertThat(tube.getMetrics().getWaitingConsumers()).isEqualTo(1);

        // When
        assertThatThrownBy(() -> tube.awaitDelivery(interrupted, LONG_WAIT))
                .isInstanceOf(InterruptedException.class);

        // Then
        assertThat(next.delivered()).get().extracting(Job::getId).isEqualTo(id);
        JobSnapshot<String> job = tube.peek(id).orElseThrow();
        assertThat(job.getReservedBy()).isEqualTo("c2");
        assertThat(job.getReserves()).isEqualTo(2);
        assertThat(job.getReleases()).isZero();
        assertThat(journal.transitionsOf(id))
                .containsExactly(Transition.PUT, Transition.RESERVE, Transition.REQUEUE, Transition.RESERVE);
    }

    @Test
    @DisplayName("Should withdraw the handle when waiting fails unexpectedly")
    void testUnexpectedFailureWithdrawsHandle() throws Exception {
        // Given
        StalledConsumer handle = new StalledConsumer("c1", new ArithmeticException("long overflow"));
        tube.register(handle);
        assertThat(tube.getMetrics().getWaitingConsumers()).isEqualTo(1);

        // When
        assertThatThrownBy(() -> tube.awaitDelivery(handle, LONG_WAIT))
                .isInstanceOf(ArithmeticException.class);

        // Then
        assertThat(tube.getMetrics().getWaitingConsumers()).isZero();
        String id = tube.put(0, 0, 60, "work");
        assertThat(tube.peek(id)).get().extracting(Job::getState).isEqualTo(Job.State.READY);
        assertThat(tube.reserve("c2", Duration.ZERO).getId()).isEqualTo(id);
    }

    /**
     * Handle whose wait ends with a fixed failure, whether or not a job reached it.
     */
    private static final class StalledConsumer extends WaitingConsumer<String> {
        private final Exception wakeUp;

        StalledConsumer(String consumerId, Exception wakeUp) {
            super(consumerId + "-handle", consumerId, System.currentTimeMillis());
            this.wakeUp = wakeUp;
        }

        @Override
        public JobSnapshot<String> await(Duration timeout) throws InterruptedException, TimeoutException {
            if (wakeUp instanceof InterruptedException) {
                throw (InterruptedException) wakeUp;
            }
            if (wakeUp instanceof TimeoutException) {
                throw (TimeoutException) wakeUp;
            }
            throw (RuntimeException) wakeUp;
        }
    }
}
