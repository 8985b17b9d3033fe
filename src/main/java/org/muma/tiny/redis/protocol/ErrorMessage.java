package org.muma.tiny.redis.protocol;

import java.util.Objects;

// 2. 错误 (-)，内容中的 CR/LF 会被替换为空格
public record ErrorMessage(String content) implements RedisMessage {
    public ErrorMessage {
        Objects.requireNonNull(content, "content");
        content = RespCodec.toSingleLine(content);
    }
}
