package org.muma.tiny.redis.protocol;

import java.util.Objects;

// 1. 简单字符串 (+)，内容中的 CR/LF 会被替换为空格
public record SimpleString(String content) implements RedisMessage {
    public SimpleString {
        Objects.requireNonNull(content, "content");
        content = RespCodec.toSingleLine(content);
    }
}
