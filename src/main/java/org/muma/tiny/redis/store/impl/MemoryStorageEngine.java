package org.muma.tiny.redis.store.impl;

import org.muma.tiny.redis.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存存储引擎
 * <p>
 * 两张表各自持有一把读写锁，String 类 Key 与 Hash 类 Key 的访问互不竞争。
 * 锁只包住查找/修改本身，持锁期间不做任何 IO。
 */
public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    // 1. 普通 KV 表
    private final Map<String, byte[]> strings = new HashMap<>();
    private final ReadWriteLock stringsLock = new ReentrantReadWriteLock();

    // 2. 哈希表 (hash -> field -> value)
    private final Map<String, Map<String, byte[]>> hashes = new HashMap<>();
    private final ReadWriteLock hashesLock = new ReentrantReadWriteLock();

    public MemoryStorageEngine() {
        log.debug("MemoryStorageEngine created");
    }

    @Override
    public byte[] get(String key) {
        stringsLock.readLock().lock();
        try {
            return strings.get(key);
        } finally {
            stringsLock.readLock().unlock();
        }
    }

    @Override
    public void set(String key, byte[] value) {
        stringsLock.writeLock().lock();
        try {
            strings.put(key, value);
        } finally {
            stringsLock.writeLock().unlock();
        }
    }

    @Override
    public byte[] hget(String hash, String field) {
        hashesLock.readLock().lock();
        try {
            Map<String, byte[]> fields = hashes.get(hash);
            return fields == null ? null : fields.get(field);
        } finally {
            hashesLock.readLock().unlock();
        }
    }

    @Override
    public void hset(String hash, String field, byte[] value) {
        hashesLock.writeLock().lock();
        try {
            hashes.computeIfAbsent(hash, k -> new HashMap<>()).put(field, value);
        } finally {
            hashesLock.writeLock().unlock();
        }
    }

    @Override
    public Map<String, byte[]> hgetAll(String hash) {
        hashesLock.readLock().lock();
        try {
            Map<String, byte[]> fields = hashes.get(hash);
            // 拷贝一份，调用方遍历时不需要持锁
            return fields == null ? null : Map.copyOf(fields);
        } finally {
            hashesLock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        stringsLock.readLock().lock();
        try {
            return strings.size();
        } finally {
            stringsLock.readLock().unlock();
        }
    }

    @Override
    public int hashCount() {
        hashesLock.readLock().lock();
        try {
            return hashes.size();
        } finally {
            hashesLock.readLock().unlock();
        }
    }
}
