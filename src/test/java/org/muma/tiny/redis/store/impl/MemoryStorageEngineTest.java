package org.muma.tiny.redis.store.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStorageEngineTest {

    private MemoryStorageEngine storage;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
    }

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String s(byte[] bytes) {
        return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
    }

    @Test
    void testSetOverwritesAndGetMissingIsNull() {
        assertNull(storage.get("a"));

        storage.set("a", b("1"));
        storage.set("a", b("2"));

        assertEquals("2", s(storage.get("a")));
        assertEquals(1, storage.size());
    }

    @Test
    void testHashCreatedLazily() {
        assertNull(storage.hgetAll("h"));
        assertNull(storage.hget("h", "f"));

        storage.hset("h", "f", b("v"));

        assertEquals("v", s(storage.hget("h", "f")));
        assertNull(storage.hget("h", "other"));
        Map<String, byte[]> all = storage.hgetAll("h");
        assertEquals(1, all.size());
        assertArrayEquals(b("v"), all.get("f"));
        assertEquals(1, storage.hashCount());
    }

    @Test
    void testTablesAreIndependent() {
        storage.set("k", b("flat"));
        storage.hset("k", "f", b("nested"));

        // 同名 Key 在两张表中互不影响
        assertEquals("flat", s(storage.get("k")));
        assertEquals("nested", s(storage.hget("k", "f")));
    }

    @Test
    void testValuesKeepRawBytes() {
        byte[] raw = {(byte) 0xFF, (byte) 0xFE, 0x00, (byte) 0x80};

        storage.set("bin", raw);
        storage.hset("h", "bin", raw);

        assertArrayEquals(raw, storage.get("bin"));
        assertArrayEquals(raw, storage.hget("h", "bin"));
        assertArrayEquals(raw, storage.hgetAll("h").get("bin"));
    }

    @Test
    void testHGetAllReturnsSnapshot() {
        storage.hset("h", "a", b("1"));
        Map<String, byte[]> snapshot = storage.hgetAll("h");

        storage.hset("h", "b", b("2"));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("x", b("y")));
        assertEquals(2, storage.hgetAll("h").size());
    }

    /**
     * 并发写入不同的 Key：不丢更新、不死锁
     */
    @Test
    void testConcurrentSetsOnDistinctKeys() throws Exception {
        int writers = 16;
        int keysPerWriter = 500;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int id = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < keysPerWriter; i++) {
                        storage.set("key:" + id + ":" + i, b("v" + id + "-" + i));
                        // 混入哈希写入，验证两把锁之间没有死锁
                        storage.hset("hash:" + id, "f" + i, b("v" + i));
                    }
                    return null;
                }));
            }

            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(writers * keysPerWriter, storage.size());
        for (int w = 0; w < writers; w++) {
            for (int i = 0; i < keysPerWriter; i++) {
                assertEquals("v" + w + "-" + i, s(storage.get("key:" + w + ":" + i)));
            }
            assertEquals(keysPerWriter, storage.hgetAll("hash:" + w).size());
        }
    }
}
