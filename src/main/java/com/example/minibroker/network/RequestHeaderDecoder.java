package com.example.minibroker.network;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Splits the inbound byte stream into fixed 12 byte request headers.
 * ByteToMessageDecoder keeps the leftover bytes between reads, so a header split over
 * several TCP segments is only emitted once it is complete.
 * message_size is not used to skip the body: whatever follows a header is read as the next header.
 */
@Slf4j
public class RequestHeaderDecoder extends ByteToMessageDecoder {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (in.readableBytes() < HeaderCodec.REQUEST_HEADER_LENGTH) {
            return; // wait for more data
        }

        RequestHeader header = HeaderCodec.decode(in);
        log.trace("Decoded request header {}", header);
        out.add(header);
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        // complete headers were already drained by decode, so anything left is a truncated one
        if (in.isReadable()) {
            int remaining = in.readableBytes();
            in.skipBytes(remaining);
            throw new ReadFailureException(remaining, HeaderCodec.REQUEST_HEADER_LENGTH);
        }
    }
}
