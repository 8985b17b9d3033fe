package org.muma.tiny.redis.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * 批量字符串 ($)，二进制安全。
 * <p>
 * content 永远非空；$-1 由 {@link RedisNull} 表达。
 */
public record BulkString(byte[] content) implements RedisMessage {

    public BulkString {
        Objects.requireNonNull(content, "content");
    }

    public BulkString(String s) {
        this(s.getBytes(StandardCharsets.UTF_8));
    }

    public String asString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    // record 默认按数组引用比较，这里改为按内容比较
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BulkString other)) return false;
        return Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "BulkString[" + asString() + "]";
    }
}
