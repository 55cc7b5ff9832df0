package com.umitunal.tubeq.serialization;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Codec for text payloads, UTF-8 unless told otherwise.
 */
public class StringCodec implements PayloadCodec<String> {
    private final Charset charset;

    public StringCodec() {
        this(StandardCharsets.UTF_8);
    }

    public StringCodec(Charset charset) {
        this.charset = charset;
    }

    @Override
    public byte[] encode(String value) {
        return value.getBytes(charset);
    }

    @Override
    public String decode(byte[] bytes) {
        return new String(bytes, charset);
    }
}
