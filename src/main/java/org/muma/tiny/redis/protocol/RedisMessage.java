package org.muma.tiny.redis.protocol;

// 密封接口，限制实现类: 每种 RESP 帧一个变体
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisNull, RedisArray {
}
