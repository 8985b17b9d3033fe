package org.muma.tiny.redis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespDecoderTest {

    private static ByteBuf bytes(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    @Test
    void testDecodesFrameSplitAcrossReads() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        // 模拟 TCP 拆包：一个命令分三次到达
        assertFalse(channel.writeInbound(bytes("*2\r\n$3\r\nGE")));
        assertFalse(channel.writeInbound(bytes("T\r\n$3\r\nke")));
        assertTrue(channel.writeInbound(bytes("y\r\n")));

        RedisMessage msg = channel.readInbound();
        assertEquals(RedisArray.command("GET", "key"), msg);
        assertNull(channel.readInbound());
        channel.finishAndReleaseAll();
    }

    @Test
    void testDecodesPipelinedFrames() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        // 模拟 TCP 粘包：两个命令一次到达
        channel.writeInbound(bytes("*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$1\r\na\r\n"));

        assertEquals(RedisArray.command("PING"), channel.readInbound());
        assertEquals(RedisArray.command("GET", "a"), channel.readInbound());
        channel.finishAndReleaseAll();
    }

    @Test
    void testHugeDeclaredBulkWaitsForPayload() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        // 长度头声明了约 500MB，但数据一个字节一个字节地到达：每次重试都只能等待
        assertFalse(channel.writeInbound(bytes("*1\r\n$500000000\r\n")));
        for (int i = 0; i < 8; i++) {
            assertFalse(channel.writeInbound(bytes("x")));
        }

        assertNull(channel.readInbound());
        assertTrue(channel.isActive());
        channel.finishAndReleaseAll();
    }

    @Test
    void testUnknownTypeRaisesDecoderException() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        // 只发一个未知类型字节，出错后缓冲区为空，关闭时不会再次解码
        DecoderException e = assertThrows(DecoderException.class, () -> channel.writeInbound(bytes("?")));
        assertInstanceOf(RespDecodeException.class, e.getCause());
        channel.finishAndReleaseAll();
    }

    @Test
    void testEncoderWritesWireFormat() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());

        channel.writeOutbound(RedisArray.of(new BulkString("v"), RedisNull.INSTANCE));
        ByteBuf out = channel.readOutbound();
        try {
            assertEquals("*2\r\n$1\r\nv\r\n$-1\r\n", out.toString(StandardCharsets.UTF_8));
        } finally {
            out.release();
        }
        channel.finishAndReleaseAll();
    }
}
