package org.muma.tiny.redis.protocol;

import io.netty.buffer.ByteBuf;

/**
 * 从一段完整的字节流中顺序读取 RESP 帧 (AOF 重放使用)。
 * <p>
 * 与网络解码不同，这里没有"等待更多数据"的概念：
 * 恰好在帧边界遇到流结束 → {@link #read()} 返回 null；
 * 在帧中间遇到流结束 → 抛出 {@link RespDecodeException}。
 */
public class RespReader {

    private final ByteBuf in;

    public RespReader(ByteBuf in) {
        this.in = in;
    }

    /**
     * @return 下一个帧；流已正常结束时返回 null
     */
    public RedisMessage read() {
        if (!in.isReadable()) {
            return null;
        }

        int start = in.readerIndex();
        try {
            return RespCodec.decode(in);
        } catch (IndexOutOfBoundsException e) {
            in.readerIndex(start);
            throw new RespDecodeException("Truncated frame at offset " + start, e);
        }
    }

    /**
     * 已成功消费的字节数
     */
    public int position() {
        return in.readerIndex();
    }
}
