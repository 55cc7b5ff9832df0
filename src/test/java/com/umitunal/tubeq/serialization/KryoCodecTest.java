package com.umitunal.tubeq.serialization;

import com.esotericsoftware.kryo.Kryo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class KryoCodecTest {

    @Test
    @DisplayName("Should encode and decode a task payload")
    void testTaskPayload() {
        // Given
        KryoCodec<ResizeTask> codec = new KryoCodec<>(ResizeTask.class);
        ResizeTask original = new ResizeTask("s3://images/cat.png", 640,
                new ArrayList<>(List.of("thumb", "webp")),
                new HashMap<>(Map.of("owner", "user-42")));

        // When
        ResizeTask decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(decoded.source).isEqualTo(original.source);
        assertThat(decoded.width).isEqualTo(640);
        assertThat(decoded.variants).containsExactly("thumb", "webp");
        assertThat(decoded.labels).containsEntry("owner", "user-42");
    }

    @Test
    @DisplayName("Should handle null fields")
    void testNullFields() {
        // Given
        KryoCodec<ResizeTask> codec = new KryoCodec<>(ResizeTask.class);

        // When
        ResizeTask decoded = codec.decode(codec.encode(new ResizeTask(null, 0, null, null)));

        // Then
        assertThat(decoded.source).isNull();
        assertThat(decoded.variants).isNull();
        assertThat(decoded.labels).isNull();
    }

    @Test
    @DisplayName("Should work with a custom Kryo factory")
    void testCustomFactory() {
        // Given
        KryoCodec<ResizeTask> codec = new KryoCodec<>(ResizeTask.class, () -> {
            Kryo kryo = new Kryo();
            kryo.register(ResizeTask.class);
            kryo.register(ArrayList.class);
            kryo.register(HashMap.class);
            return kryo;
        });
        ResizeTask original = new ResizeTask("file.png", 99, new ArrayList<>(), new HashMap<>());

        // When
        ResizeTask decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(decoded.source).isEqualTo("file.png");
        assertThat(decoded.width).isEqualTo(99);
    }

    @Test
    @DisplayName("Should be safe to share between threads")
    void testThreadSafety() throws InterruptedException {
        // Given
        KryoCodec<String> codec = new KryoCodec<>(String.class);
        List<Throwable> failures = new ArrayList<>();
        Thread[] threads = new Thread[8];

        // When
        for (int i = 0; i < threads.length; i++) {
            final int threadNum = i;
            threads[i] = new Thread(() -> {
                try {
                    for (int j = 0; j < 200; j++) {
                        String original = "thread-" + threadNum + "-job-" + j;
                        assertThat(codec.decode(codec.encode(original))).isEqualTo(original);
                    }
                } catch (Throwable t) {
                    synchronized (failures) {
                        failures.add(t);
                    }
                }
            });
            threads[i].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        // Then
        assertThat(failures).isEmpty();
    }

    @Test
    @DisplayName("Should wrap Kryo failures in CodecException")
    void testTruncatedInput() {
        KryoCodec<ResizeTask> codec = new KryoCodec<>(ResizeTask.class);

        assertThatThrownBy(() -> codec.decode(new byte[0]))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining("ResizeTask");
    }

    static class ResizeTask {
        String source;
        int width;
        List<String> variants;
        Map<String, String> labels;

        ResizeTask() {
        }

        ResizeTask(String source, int width, List<String> variants, Map<String, String> labels) {
            this.source = source;
            this.width = width;
            this.variants = variants;
            this.labels = labels;
        }
    }
}
