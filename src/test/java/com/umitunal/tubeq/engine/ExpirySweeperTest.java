package com.umitunal.tubeq.engine;

import com.umitunal.tubeq.config.TubeConfig;
import com.umitunal.tubeq.core.IdGenerator;
import com.umitunal.tubeq.core.Job;
import com.umitunal.tubeq.journal.JobJournal;
import com.umitunal.tubeq.support.ManualTimeSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class ExpirySweeperTest {

    private ManualTimeSource clock;
    private PriorityTube<String> emails;
    private PriorityTube<String> reports;
    private ExpirySweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new ManualTimeSource();
        emails = newTube("emails");
        reports = newTube("reports");
        sweeper = new ExpirySweeper(List.of(emails, reports), Duration.ofMillis(20));
    }

    @AfterEach
    void tearDown() {
        sweeper.close();
    }

    private PriorityTube<String> newTube(String name) {
        return new PriorityTube<>(name, TubeConfig.defaults(), clock, IdGenerator.sequential(), JobJournal.noop());
    }

    @Test
    @DisplayName("Should promote delayed jobs and expire reservations across tubes in one pass")
    void testSweepOnce() throws Exception {
        // Given
        String delayedId = emails.put(0, 5, 60, "later");
        String reservedId = reports.put(0, 0, 3, "slow");
        reports.reserve("c1", Duration.ZERO);

        // When
        clock.advanceSeconds(5);
        int moved = sweeper.sweepOnce();

        // Then
        assertThat(moved).isEqualTo(2);
        assertThat(emails.peek(delayedId)).get().extracting(Job::getState).isEqualTo(Job.State.READY);
        assertThat(reports.peek(reservedId)).get().extracting(Job::getState).isEqualTo(Job.State.READY);
        assertThat(sweeper.getPasses()).isEqualTo(1);
        assertThat(sweeper.getMovedJobs()).isEqualTo(2);

        assertThat(sweeper.sweepOnce()).isZero();
        assertThat(sweeper.getPasses()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should sweep on its own schedule until stopped")
    void testScheduledSweeps() throws Exception {
        // Given
        String id = emails.put(0, 1, 60, "later");
        sweeper.start();
        assertThat(sweeper.isRunning()).isTrue();

        // When
        clock.advanceSeconds(1);

        // Then
        await().atMost(5, TimeUnit.SECONDS)
                .untilAsserted(() -> assertThat(emails.peek(id)).get()
                        .extracting(Job::getState).isEqualTo(Job.State.READY));

        sweeper.stop();
        assertThat(sweeper.isRunning()).isFalse();
        long passes = sweeper.getPasses();
        Thread.sleep(100);
        assertThat(sweeper.getPasses()).isEqualTo(passes);
    }

    @Test
    @DisplayName("Should keep sweeping the other tubes when one fails")
    void testFailingTubeIsSkipped() throws Exception {
        // Given
        PriorityTube<String> broken = new PriorityTube<>("broken") {
            @Override
            public int sweep() {
                throw new IllegalStateException("boom");
            }
        };
        String id = emails.put(0, 2, 60, "later");
        ExpirySweeper mixed = new ExpirySweeper(List.of(broken, emails), Duration.ofSeconds(1));

        // When
        clock.advanceSeconds(2);
        int moved = mixed.sweepOnce();

        // Then
        assertThat(moved).isEqualTo(1);
        assertThat(emails.peek(id)).get().extracting(Job::getState).isEqualTo(Job.State.READY);
    }
}
