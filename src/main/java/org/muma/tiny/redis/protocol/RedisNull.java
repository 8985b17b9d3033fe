package org.muma.tiny.redis.protocol;

/**
 * Null 帧，编码固定为 {@code $-1\r\n}。
 */
public enum RedisNull implements RedisMessage {
    INSTANCE
}
