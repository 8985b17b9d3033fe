package org.muma.tiny.redis.aof;

import org.muma.tiny.redis.config.TinyRedisConfig;
import org.muma.tiny.redis.protocol.RedisArray;
import org.muma.tiny.redis.protocol.RespCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * AOF 管理器
 * 负责开关判断与命令编码，物理读写交给 {@link AofDiskWriter}。
 * <p>
 * 日志只追加，不做 Rewrite / 截断。
 */
public class AofManager {

    private static final Logger log = LoggerFactory.getLogger(AofManager.class);

    private final TinyRedisConfig config;
    private final AofDiskWriter diskWriter;

    public AofManager(TinyRedisConfig config) {
        this(config, new AofDiskWriter(config));
    }

    AofManager(TinyRedisConfig config, AofDiskWriter diskWriter) {
        this.config = config;
        this.diskWriter = diskWriter;
    }

    /**
     * 初始化：打开 AOF 文件
     * 必须在 AofLoader.load() 之前调用
     */
    public void init() {
        if (!config.isAppendOnly()) {
            log.info("AOF disabled (appendonly=no)");
            return;
        }

        try {
            diskWriter.open();
        } catch (IOException e) {
            throw new IllegalStateException("AOF init failed", e);
        }
    }

    /**
     * 追加命令。返回时命令已写入文件 (OS Cache)，落盘由 fsync 策略决定。
     */
    public void append(RedisArray command) throws IOException {
        if (!config.isAppendOnly()) return;

        diskWriter.write(RespCodec.encodeToBytes(command));
    }

    /**
     * 重放全部命令
     *
     * @return 重放的命令条数
     */
    public int load(Consumer<RedisArray> consumer) throws IOException {
        if (!config.isAppendOnly()) return 0;

        return diskWriter.read(consumer);
    }

    public boolean isEnabled() {
        return config.isAppendOnly();
    }

    public void shutdown() {
        if (!config.isAppendOnly()) return;

        try {
            diskWriter.close();
        } catch (IOException e) {
            log.error("Error closing AOF file", e);
        }
    }
}
