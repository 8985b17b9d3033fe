package org.muma.tiny.redis.store;

import java.util.Map;

/**
 * 存储引擎：一张普通 KV 表 (key -> value) 和一张哈希表 (hash -> field -> value)。
 * <p>
 * Value 以原始字节保存，二进制安全；Key 与 field 为字符串。
 * 所有操作都不会失败，Key 不存在时返回 null。
 */
public interface StorageEngine {

    // 基础 KV 操作
    byte[] get(String key);

    void set(String key, byte[] value);

    // Hash 操作
    byte[] hget(String hash, String field);

    /**
     * 哈希不存在时自动创建 (懒创建)，且永不隐式删除。
     */
    void hset(String hash, String field, byte[] value);

    /**
     * @return 该哈希的只读快照；哈希不存在时返回 null
     */
    Map<String, byte[]> hgetAll(String hash);

    // 统计
    int size();

    int hashCount();
}
