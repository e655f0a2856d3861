package com.example.minibroker.network;

import io.netty.buffer.ByteBuf;

/**
 * Encodes and decodes the fixed-size header prefixes of the wire protocol.
 * All integers are big-endian, which is also Netty's default byte order for ByteBuf.
 * Stateless, so safe to share across connections.
 */
public final class HeaderCodec {
    // message_size(4) + api_key(2) + api_version(2) + correlation_id(4)
    public static final int REQUEST_HEADER_LENGTH = 12;
    // message_size(4) + correlation_id(4)
    public static final int RESPONSE_HEADER_LENGTH = 8;

    private HeaderCodec() {
    }

    /**
     * Decode one request header from the buffer.
     * Only the 12 byte prefix is consumed, anything after it stays in the buffer.
     *
     * @throws ReadFailureException if fewer than 12 bytes are readable; the reader index is left untouched
     */
    public static RequestHeader decode(ByteBuf in) {
        int available = in.readableBytes();
        if (available < REQUEST_HEADER_LENGTH) {
            throw new ReadFailureException(available, REQUEST_HEADER_LENGTH);
        }

        int messageSize = in.readInt();
        int apiKey = in.readUnsignedShort();
        int apiVersion = in.readUnsignedShort();
        int correlationId = in.readInt();

        return RequestHeader.builder()
                .messageSize(messageSize)
                .requestApiKey(apiKey)
                .requestApiVersion(apiVersion)
                .correlationId(correlationId)
                .build();
    }

    /**
     * Write the 8 byte response header.
     */
    public static void encode(ResponseHeader header, ByteBuf out) {
        out.ensureWritable(RESPONSE_HEADER_LENGTH);
        out.writeInt(header.getMessageSize());
        out.writeInt(header.getCorrelationId());
    }
}
