package com.example.minibroker.network;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;

/**
 * Encodes response headers into their 8 byte wire form.
 */
@Slf4j
public class ResponseHeaderEncoder extends MessageToByteEncoder<ResponseHeader> {

    @Override
    protected void encode(ChannelHandlerContext ctx, ResponseHeader response, ByteBuf out) {
        HeaderCodec.encode(response, out);
        log.debug("Encoded response with correlation ID: {}", response.getCorrelationId());
    }
}
