package com.umitunal.tubeq.serialization;

/**
 * Raised by codecs when a value cannot be encoded or decoded.
 */
public class CodecException extends RuntimeException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
