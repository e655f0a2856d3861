package com.example.minibroker.network;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class HeaderCodecTest {

    private static ByteBuf hex(String hex) {
        return Unpooled.wrappedBuffer(ByteBufUtil.decodeHexDump(hex));
    }

    @Test
    void decodesFieldsInWireOrder() {
        ByteBuf in = hex("000000080012000400000007");

        RequestHeader header = HeaderCodec.decode(in);

        assertEquals(8, header.getMessageSize());
        assertEquals(18, header.getRequestApiKey());
        assertEquals(4, header.getRequestApiVersion());
        assertEquals(7, header.getCorrelationId());
        assertTrue(header.getClientId().isEmpty());
        assertTrue(header.getTagBuffer().isEmpty());
        assertFalse(in.isReadable());
    }

    @Test
    void decodesCorrelationIdBigEndian() {
        RequestHeader header = HeaderCodec.decode(hex("00000000000000000000000a"));

        assertEquals(10, header.getCorrelationId());
    }

    @Test
    void decodesApiKeyAndVersionAsUnsigned() {
        RequestHeader header = HeaderCodec.decode(hex("00000000ffff800000000001"));

        assertEquals(65535, header.getRequestApiKey());
        assertEquals(32768, header.getRequestApiVersion());
    }

    @Test
    void leavesBodyBytesInBuffer() {
        ByteBuf in = hex("000000080012000400000007" + "cafebabe");

        HeaderCodec.decode(in);

        assertEquals(4, in.readableBytes());
        assertEquals(0xcafebabe, in.readInt());
    }

    @Test
    void shortReadFailsWithoutConsumingBytes() {
        ByteBuf in = hex("000000080012");

        ReadFailureException e = assertThrows(ReadFailureException.class, () -> HeaderCodec.decode(in));

        assertEquals(6, e.getAvailableBytes());
        assertEquals(0, in.readerIndex());
        assertEquals(6, in.readableBytes());
    }

    @Test
    void emptyBufferIsAShortRead() {
        ReadFailureException e = assertThrows(ReadFailureException.class,
                () -> HeaderCodec.decode(Unpooled.EMPTY_BUFFER));

        assertEquals(0, e.getAvailableBytes());
    }

    @Test
    void encodesSizeThenCorrelationId() {
        ByteBuf out = Unpooled.buffer();

        HeaderCodec.encode(new ResponseHeader(0, 10), out);

        assertEquals("000000000000000a", ByteBufUtil.hexDump(out));
    }

    @ParameterizedTest
    @ValueSource(ints = {Integer.MIN_VALUE, -1, 0, 7, Integer.MAX_VALUE})
    void responseEchoesCorrelationId(int correlationId) {
        ByteBuf in = Unpooled.buffer();
        in.writeInt(8).writeShort(18).writeShort(4).writeInt(correlationId);

        ResponseHeader response = ResponseHeader.forRequest(HeaderCodec.decode(in));
        ByteBuf out = Unpooled.buffer();
        HeaderCodec.encode(response, out);

        assertEquals(HeaderCodec.RESPONSE_HEADER_LENGTH, out.readableBytes());
        assertEquals(0, out.readInt());
        assertEquals(correlationId, out.readInt());
    }

    @Test
    void successiveDecodesAreIndependent() {
        RequestHeader first = HeaderCodec.decode(hex("000000080012000400000001"));
        RequestHeader second = HeaderCodec.decode(hex("000000080012000400000001"));

        assertEquals(first, second);
        assertNotSame(first, second);
    }
}
