package org.muma.tiny.redis.aof;

import io.netty.buffer.Unpooled;
import org.muma.tiny.redis.config.TinyRedisConfig;
import org.muma.tiny.redis.protocol.RedisArray;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.protocol.RespDecodeException;
import org.muma.tiny.redis.protocol.RespReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * AOF 物理读写器
 * <p>
 * 1. 调用线程 -> write() 同步追加到 FileChannel -> OS Cache (返回即代表已写入，但不保证已落盘)
 * 2. Fsync线程 (aof-fsync-&lt;文件名&gt;) -> 定时调用 force() -> Disk
 * <p>
 * 追加、刷盘、重放读取、关闭共用同一把锁：刷盘不会和追加交错，也不会看到写了一半的命令。
 */
public class AofDiskWriter {

    private static final Logger log = LoggerFactory.getLogger(AofDiskWriter.class);

    private final TinyRedisConfig config;
    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    private FileChannel fileChannel;

    // 定时刷盘线程 (仅 EVERYSEC 策略)
    private ScheduledExecutorService fsyncExecutor;

    public AofDiskWriter(TinyRedisConfig config) {
        this.config = config;
        this.file = Paths.get(config.getAppendDir(), config.getAppendFilename());
    }

    /**
     * 打开 (不存在则创建) AOF 文件，并启动定时刷盘任务
     */
    public void open() throws IOException {
        lock.lock();
        try {
            if (fileChannel != null) {
                log.warn("AOF file already open: {}", file.toAbsolutePath());
                return;
            }

            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            // READ 与 APPEND 不能同时使用，这里手动把 position 移到末尾
            this.fileChannel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
            fileChannel.position(fileChannel.size());

            log.info("Opened AOF file: {} (size: {} bytes)", file.toAbsolutePath(), fileChannel.size());

            if (config.getAppendFsync() == TinyRedisConfig.AppendFsync.EVERYSEC) {
                long interval = config.getAppendFsyncIntervalMillis();
                this.fsyncExecutor = Executors.newSingleThreadScheduledExecutor(this::newFsyncThread);
                this.fsyncExecutor.scheduleWithFixedDelay(this::performFsync, interval, interval, TimeUnit.MILLISECONDS);
            }
        } finally {
            lock.unlock();
        }
    }

    // 每个 AOF 文件只有一个刷盘线程，用文件名区分；后台线程，不阻塞 JVM 退出
    private Thread newFsyncThread(Runnable task) {
        Thread t = new Thread(task, fsyncThreadName());
        t.setDaemon(true);
        t.setUncaughtExceptionHandler((thread, e) -> log.error("Uncaught error in {}", thread.getName(), e));
        return t;
    }

    String fsyncThreadName() {
        return "aof-fsync-" + file.getFileName();
    }

    /**
     * 追加一条已编码的命令
     */
    public void write(byte[] content) throws IOException {
        lock.lock();
        try {
            ensureOpen();
            ByteBuffer buf = ByteBuffer.wrap(content);
            while (buf.hasRemaining()) {
                fileChannel.write(buf);
            }

            // ALWAYS 策略：同步刷盘
            if (config.getAppendFsync() == TinyRedisConfig.AppendFsync.ALWAYS) {
                fileChannel.force(false);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 刷盘，失败只记录日志，下一个周期会再试
     */
    void performFsync() {
        lock.lock();
        try {
            if (fileChannel == null || !fileChannel.isOpen()) return;
            fileChannel.force(false);
        } catch (IOException e) {
            log.warn("AOF fsync failed", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 从文件头开始依次解码命令并回调
     *
     * @return 回调的命令条数
     * @throws RespDecodeException 文件内容损坏 (非法帧、截断的尾部、非数组帧)
     */
    public int read(Consumer<RedisArray> consumer) throws IOException {
        lock.lock();
        try {
            ensureOpen();
            long size = fileChannel.size();
            if (size > Integer.MAX_VALUE) {
                throw new IOException("AOF file too large to load: " + size + " bytes");
            }

            // 一次性读入内存 (文件巨大时会占用较多内存，这里不做分块)
            ByteBuffer data = ByteBuffer.allocate((int) size);
            long pos = 0;
            while (data.hasRemaining()) {
                int n = fileChannel.read(data, pos);
                if (n < 0) break;
                pos += n;
            }
            data.flip();

            RespReader reader = new RespReader(Unpooled.wrappedBuffer(data));
            int count = 0;
            while (true) {
                int offset = reader.position();
                RedisMessage msg = reader.read();
                if (msg == null) break; // EOF

                if (!(msg instanceof RedisArray command)) {
                    throw new RespDecodeException("Unexpected " + msg.getClass().getSimpleName()
                            + " in AOF at offset " + offset);
                }
                consumer.accept(command);
                count++;
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    public long size() throws IOException {
        lock.lock();
        try {
            ensureOpen();
            return fileChannel.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isOpen() {
        lock.lock();
        try {
            return fileChannel != null && fileChannel.isOpen();
        } finally {
            lock.unlock();
        }
    }

    public Path getFile() {
        return file;
    }

    /**
     * 关闭前强制刷盘一次，保证最后一个周期内的写入不会丢失
     */
    public void close() throws IOException {
        lock.lock();
        try {
            // 先停掉定时任务；用 shutdown 而不是 shutdownNow，中断正在 force 的线程会导致 channel 被关闭
            if (fsyncExecutor != null) {
                fsyncExecutor.shutdown();
                fsyncExecutor = null;
            }
            if (fileChannel == null) return;
            try {
                fileChannel.force(true);
            } finally {
                fileChannel.close();
                fileChannel = null;
                log.info("Closed AOF file: {}", file.toAbsolutePath());
            }
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() throws IOException {
        if (fileChannel == null || !fileChannel.isOpen()) {
            throw new IOException("AOF file is not open: " + file);
        }
    }
}
