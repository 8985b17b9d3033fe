package org.muma.tiny.redis.protocol;

/**
 * RESP 帧格式错误：未知类型字节、非法长度、缺失 CRLF 或帧被截断。
 */
public class RespDecodeException extends RuntimeException {

    public RespDecodeException(String message) {
        super(message);
    }

    public RespDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
