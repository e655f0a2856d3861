package com.example.minibroker.network;

import io.netty.handler.codec.DecoderException;

/**
 * The connection could not supply a complete request header, either because the peer
 * closed mid-header or because reading from the socket failed.
 * Terminal for the connection it happened on.
 */
public class ReadFailureException extends DecoderException {
    private final int availableBytes;

    public ReadFailureException(int availableBytes, int requiredBytes) {
        super("Failed to read request header: needed " + requiredBytes
                + " bytes but the stream supplied " + availableBytes);
        this.availableBytes = availableBytes;
    }

    public ReadFailureException(Throwable cause) {
        super("Failed to read from stream: " + cause.getMessage(), cause);
        this.availableBytes = -1;
    }

    /**
     * Bytes that were buffered when the header could not be completed, or -1 for an I/O fault.
     */
    public int getAvailableBytes() {
        return availableBytes;
    }
}
