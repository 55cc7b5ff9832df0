package com.umitunal.tubeq.serialization;

/**
 * Converts values to and from the bytes the journal stores.
 *
 * @param <T> the type of value
 */
public interface PayloadCodec<T> {

    /**
     * Encode a value to bytes.
     *
     * @throws CodecException if the value cannot be encoded
     */
    byte[] encode(T value);

    /**
     * Decode bytes to a value.
     *
     * @throws CodecException if the bytes are not a valid encoding
     */
    T decode(byte[] bytes);
}
