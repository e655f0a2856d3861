package com.example.minibroker.network;

import io.netty.handler.codec.EncoderException;

/**
 * The connection rejected a response write or flush.
 */
public class WriteFailureException extends EncoderException {

    public WriteFailureException(int correlationId, Throwable cause) {
        super("Failed to write response for correlation ID " + correlationId, cause);
    }
}
