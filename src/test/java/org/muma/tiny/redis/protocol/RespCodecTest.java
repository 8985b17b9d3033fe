package org.muma.tiny.redis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RespCodecTest {

    private static String encode(RedisMessage msg) {
        return new String(RespCodec.encodeToBytes(msg), StandardCharsets.UTF_8);
    }

    private static RedisMessage decode(String wire) {
        ByteBuf buf = Unpooled.copiedBuffer(wire, StandardCharsets.UTF_8);
        try {
            RedisMessage msg = RespCodec.decode(buf);
            assertFalse(buf.isReadable(), "decoder should consume the whole frame");
            return msg;
        } finally {
            buf.release();
        }
    }

    @Test
    void testEncodeEachType() {
        assertEquals("+OK\r\n", encode(new SimpleString("OK")));
        assertEquals("-ERR boom\r\n", encode(new ErrorMessage("ERR boom")));
        assertEquals(":-42\r\n", encode(new RedisInteger(-42)));
        assertEquals("$5\r\nhello\r\n", encode(new BulkString("hello")));
        assertEquals("$0\r\n\r\n", encode(new BulkString("")));
        assertEquals("$-1\r\n", encode(RedisNull.INSTANCE));
        assertEquals("*0\r\n", encode(new RedisArray(List.of())));
        assertEquals("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n", encode(RedisArray.command("SET", "k", "v")));
    }

    @Test
    void testBulkLengthCountsBytesNotChars() {
        // "你好" 在 UTF-8 下是 6 个字节
        assertEquals("$6\r\n你好\r\n", encode(new BulkString("你好")));
    }

    @Test
    void testDecodeEachType() {
        assertEquals(new SimpleString("PONG"), decode("+PONG\r\n"));
        assertEquals(new ErrorMessage("ERR x"), decode("-ERR x\r\n"));
        assertEquals(new RedisInteger(1000), decode(":1000\r\n"));
        assertEquals(new BulkString("foo"), decode("$3\r\nfoo\r\n"));
        assertEquals(RedisNull.INSTANCE, decode("$-1\r\n"));
        assertEquals(RedisNull.INSTANCE, decode("*-1\r\n"));
    }

    @Test
    void testBulkStringIsBinarySafe() {
        // payload 中包含 CRLF 也能按长度正确读取
        assertEquals(new BulkString("a\r\nb"), decode("$4\r\na\r\nb\r\n"));
    }

    @Test
    void testNestedArrayPreservesOrder() {
        RedisArray nested = RedisArray.of(
                new BulkString("a"),
                RedisArray.of(new RedisInteger(1), RedisNull.INSTANCE),
                new SimpleString("b"));

        String wire = "*3\r\n$1\r\na\r\n*2\r\n:1\r\n$-1\r\n+b\r\n";
        assertEquals(wire, encode(nested));
        assertEquals(nested, decode(wire));
    }

    @Test
    void testRoundTripOfWellFormedInput() {
        String wire = "*4\r\n$5\r\nHSET\r\n$1\r\nh\r\n$1\r\nf\r\n$0\r\n\r\n";
        assertEquals(wire, encode(decode(wire)));
    }

    @Test
    void testUnknownTypeByteFails() {
        RespDecodeException e = assertThrows(RespDecodeException.class, () -> decode("?oops\r\n"));
        assertTrue(e.getMessage().contains("Unknown RESP type byte"));
    }

    @Test
    void testMalformedLengthFails() {
        assertThrows(RespDecodeException.class, () -> decode("$abc\r\nfoo\r\n"));
        assertThrows(RespDecodeException.class, () -> decode("*x\r\n"));
        assertThrows(RespDecodeException.class, () -> decode("$-2\r\n"));
    }

    @Test
    void testMissingTerminatorAfterPayloadFails() {
        assertThrows(RespDecodeException.class, () -> decode("$3\r\nfooXY"));
    }

    @Test
    void testLineWithoutCarriageReturnFails() {
        assertThrows(RespDecodeException.class, () -> decode("+OK\n"));
    }

    @Test
    void testTruncatedInputUnderflows() {
        ByteBuf buf = Unpooled.copiedBuffer("$10\r\nabc", StandardCharsets.UTF_8);
        try {
            assertThrows(IndexOutOfBoundsException.class, () -> RespCodec.decode(buf));
        } finally {
            buf.release();
        }
    }

    @Test
    void testHugeDeclaredBulkUnderflowsWithoutAllocating() {
        ByteBuf buf = Unpooled.copiedBuffer("$500000000\r\nx", StandardCharsets.UTF_8);
        try {
            assertThrows(IndexOutOfBoundsException.class, () -> RespCodec.decode(buf));
        } finally {
            buf.release();
        }
    }

    @Test
    void testLineTypesNeverCarryCrlf() {
        SimpleString simple = new SimpleString("a\r\n+OK");
        ErrorMessage error = new ErrorMessage("ERR bad\nthing");

        assertEquals("a  +OK", simple.content());
        assertEquals("+a  +OK\r\n", encode(simple));
        assertEquals("-ERR bad thing\r\n", encode(error));
        // 替换后仍满足 decode(encode(v)) == v
        assertEquals(simple, decode(encode(simple)));
        assertEquals(error, decode(encode(error)));
    }

    @Test
    void testReadLongRejectsNonDecimal() {
        ByteBuf buf = Unpooled.copiedBuffer("12a\r\n", StandardCharsets.UTF_8);
        try {
            assertThrows(RespDecodeException.class, () -> RespCodec.readLong(buf));
        } finally {
            buf.release();
        }
    }

    @Test
    void testBulkStringEqualityUsesContent() {
        assertEquals(new BulkString("abc"), new BulkString("abc".getBytes(StandardCharsets.UTF_8)));
        assertEquals(new BulkString("abc").hashCode(), new BulkString("abc").hashCode());
        assertNotEquals(new BulkString("abc"), new BulkString("abd"));
    }
}
