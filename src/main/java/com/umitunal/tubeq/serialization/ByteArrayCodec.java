package com.umitunal.tubeq.serialization;

import java.util.Arrays;

/**
 * Codec for opaque binary job bodies. Copies in both directions so the journal never
 * shares an array with a live job.
 */
public class ByteArrayCodec implements PayloadCodec<byte[]> {

    @Override
    public byte[] encode(byte[] value) {
        return Arrays.copyOf(value, value.length);
    }

    @Override
    public byte[] decode(byte[] bytes) {
        return Arrays.copyOf(bytes, bytes.length);
    }
}
