package org.muma.tiny.redis.protocol;

import java.util.Arrays;
import java.util.List;

// 5. 数组 (*)
public record RedisArray(List<RedisMessage> elements) implements RedisMessage {

    public RedisArray {
        elements = List.copyOf(elements);
    }

    public static RedisArray of(RedisMessage... elements) {
        return new RedisArray(Arrays.asList(elements));
    }

    /**
     * 构造由 BulkString 组成的命令数组，例如 {@code RedisArray.command("SET", "k", "v")}
     */
    public static RedisArray command(String... parts) {
        RedisMessage[] msgs = new RedisMessage[parts.length];
        for (int i = 0; i < parts.length; i++) {
            msgs[i] = new BulkString(parts[i]);
        }
        return of(msgs);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }
}
