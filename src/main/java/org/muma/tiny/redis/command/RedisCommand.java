package org.muma.tiny.redis.command;

import org.muma.tiny.redis.protocol.BulkString;
import org.muma.tiny.redis.protocol.ErrorMessage;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.protocol.SimpleString;
import org.muma.tiny.redis.store.StorageEngine;

import java.nio.charset.StandardCharsets;
import java.util.List;

public interface RedisCommand {

    SimpleString OK = new SimpleString("OK");

    // 执行命令，传入存储引擎和参数 (args 不包含命令名本身)
    RedisMessage execute(StorageEngine storage, List<RedisMessage> args);

    /**
     * 辅助工具：快速构建参数错误
     */
    default ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }

    /**
     * 辅助工具：取出字符串类参数的内容
     *
     * @throws IllegalArgumentException 参数不是字符串帧
     */
    default String text(RedisMessage arg) {
        if (arg instanceof BulkString b) return b.asString();
        if (arg instanceof SimpleString s) return s.content();
        throw new IllegalArgumentException("Protocol error: expected string argument, got "
                + arg.getClass().getSimpleName());
    }

    /**
     * 辅助工具：取出参数的原始字节，BulkString 原样透传，不经过字符集转换
     *
     * @throws IllegalArgumentException 参数不是字符串帧
     */
    default byte[] bytes(RedisMessage arg) {
        if (arg instanceof BulkString b) return b.content();
        if (arg instanceof SimpleString s) return s.content().getBytes(StandardCharsets.UTF_8);
        throw new IllegalArgumentException("Protocol error: expected string argument, got "
                + arg.getClass().getSimpleName());
    }

    // 默认不是写命令，所有 SET/HSET 等需要覆盖返回 true
    default boolean isWrite() {
        return false;
    }
}
