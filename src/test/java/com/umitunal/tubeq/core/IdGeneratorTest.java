package com.umitunal.tubeq.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class IdGeneratorTest {

    @Test
    @DisplayName("Should count up from 1 and keep separate generators independent")
    void testSequential() {
        IdGenerator first = IdGenerator.sequential();
        IdGenerator second = IdGenerator.sequential();

        assertThat(first.nextId()).isEqualTo("1");
        assertThat(first.nextId()).isEqualTo("2");
        assertThat(second.nextId()).isEqualTo("1");
    }

    @Test
    @DisplayName("Should never repeat an id under concurrent use")
    void testConcurrentUniqueness() throws Exception {
        // Given
        IdGenerator generator = IdGenerator.sequential();
        Set<String> ids = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(4);

        // When
        for (int t = 0; t < 4; t++) {
            executor.execute(() -> {
                for (int i = 0; i < 1_000; i++) {
                    ids.add(generator.nextId());
                }
            });
        }
        executor.shutdown();

        // Then
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(ids).hasSize(4_000);
    }

    @Test
    @DisplayName("Should produce random UUID ids")
    void testUuid() {
        IdGenerator generator = IdGenerator.uuid();

        assertThat(generator.nextId()).hasSize(36).isNotEqualTo(generator.nextId());
    }
}
