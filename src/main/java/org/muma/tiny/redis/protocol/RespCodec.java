package org.muma.tiny.redis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;

/**
 * RESP 编解码核心逻辑。
 * <p>
 * 网络层 ({@link RespDecoder} / {@link RespEncoder}) 与 AOF 重放 ({@link RespReader}) 共用这一份实现，
 * Array 的递归编解码只在这里出现。
 * <p>
 * 数据不足时：
 * <ul>
 *   <li>在 ReplayingDecoder 中，读取会抛出 Signal，由 Netty 回滚索引等待更多数据；</li>
 *   <li>在普通 ByteBuf 上，读取会抛出 {@link IndexOutOfBoundsException}，由调用方转换为截断错误。</li>
 * </ul>
 */
public final class RespCodec {

    // RESP 协议常量
    public static final byte PLUS_BYTE = '+';
    public static final byte MINUS_BYTE = '-';
    public static final byte COLON_BYTE = ':';
    public static final byte DOLLAR_BYTE = '$';
    public static final byte ASTERISK_BYTE = '*';

    // 回车换行
    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};

    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    // 与 Redis proto-max-bulk-len 默认值一致
    static final long MAX_BULK_LENGTH = 512L * 1024 * 1024;
    static final long MAX_ARRAY_LENGTH = 1024L * 1024;

    private RespCodec() {
    }

    // ------------------------------------------------------------------
    // Decode
    // ------------------------------------------------------------------

    /**
     * 从 in 中读取一个完整帧 (Array 会递归读取全部子元素)。
     */
    public static RedisMessage decode(ByteBuf in) {
        // 1. 读取类型标识字节
        byte typeByte = in.readByte();

        // 2. 根据类型分发处理
        return switch (typeByte) {
            case PLUS_BYTE -> new SimpleString(readLine(in));
            case MINUS_BYTE -> new ErrorMessage(readLine(in));
            case COLON_BYTE -> new RedisInteger(readLong(in));
            case DOLLAR_BYTE -> decodeBulkString(in);
            case ASTERISK_BYTE -> decodeArray(in);
            default -> throw new RespDecodeException("Unknown RESP type byte: 0x"
                    + Integer.toHexString(typeByte & 0xFF));
        };
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private static RedisMessage decodeBulkString(ByteBuf in) {
        long length = readLong(in);
        if (length == -1) {
            return RedisNull.INSTANCE;
        }
        if (length < 0 || length > MAX_BULK_LENGTH) {
            throw new RespDecodeException("Invalid bulk length: " + length);
        }

        // 【注意】readSlice 先确认 length 字节已到齐，之后才分配 content
        byte[] content = ByteBufUtil.getBytes(in.readSlice((int) length));

        // 读取末尾的 CRLF
        readCRLF(in);

        return new BulkString(content);
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private static RedisMessage decodeArray(ByteBuf in) {
        long count = readLong(in);
        if (count == -1) {
            return RedisNull.INSTANCE;
        }
        if (count < 0 || count > MAX_ARRAY_LENGTH) {
            throw new RespDecodeException("Invalid multibulk length: " + count);
        }

        RedisMessage[] elements = new RedisMessage[(int) count];
        for (int i = 0; i < count; i++) {
            elements[i] = decode(in);
        }
        return RedisArray.of(elements);
    }

    /**
     * 读取一行（不含 \r\n）。
     */
    static String readLine(ByteBuf in) {
        int length = in.bytesBefore(LF);
        if (length < 0) {
            // 只有普通 ByteBuf 会走到这里，ReplayingDecoder 会直接抛 Signal
            throw new IndexOutOfBoundsException("CRLF not found");
        }
        if (length == 0 || in.getByte(in.readerIndex() + length - 1) != CR) {
            throw new RespDecodeException("Expected CRLF line terminator");
        }

        String line = in.toString(in.readerIndex(), length - 1, StandardCharsets.UTF_8);
        in.skipBytes(length + 1);
        return line;
    }

    /**
     * 读取一行并解析为有符号十进制整数。
     */
    static long readLong(ByteBuf in) {
        String s = readLine(in);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new RespDecodeException("Invalid integer: '" + s + "'", e);
        }
    }

    /**
     * 单行类型 (+ / -) 的内容里不能出现 CR/LF，否则会被对端解析成多个帧。
     * 与 Redis 处理错误信息的方式一致，替换成空格。
     */
    static String toSingleLine(String s) {
        if (s.indexOf(CR) < 0 && s.indexOf(LF) < 0) {
            return s;
        }
        return s.replace((char) CR, ' ').replace((char) LF, ' ');
    }

    private static void readCRLF(ByteBuf in) {
        byte b1 = in.readByte();
        byte b2 = in.readByte();
        if (b1 != CR || b2 != LF) {
            throw new RespDecodeException("Expected CRLF after bulk payload");
        }
    }

    // ------------------------------------------------------------------
    // Encode
    // ------------------------------------------------------------------

    public static void encode(RedisMessage msg, ByteBuf out) {
        if (msg instanceof SimpleString s) {
            out.writeByte(PLUS_BYTE);
            out.writeCharSequence(s.content(), StandardCharsets.UTF_8);
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte(MINUS_BYTE);
            out.writeCharSequence(e.content(), StandardCharsets.UTF_8);
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisInteger i) {
            out.writeByte(COLON_BYTE);
            writeDecimal(out, i.value());
        } else if (msg instanceof BulkString b) {
            out.writeByte(DOLLAR_BYTE);
            writeDecimal(out, b.content().length);
            out.writeBytes(b.content());
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisArray a) {
            out.writeByte(ASTERISK_BYTE);
            writeDecimal(out, a.size());
            for (RedisMessage element : a.elements()) {
                encode(element, out);
            }
        } else if (msg instanceof RedisNull) {
            out.writeBytes(NULL_BULK);
        }
    }

    /**
     * 编码为独立的字节数组 (用于 AOF 落盘)
     */
    public static byte[] encodeToBytes(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer(64);
        try {
            encode(msg, buf);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    // 写入十进制数字 + CRLF
    private static void writeDecimal(ByteBuf out, long value) {
        out.writeCharSequence(Long.toString(value), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
    }
}
