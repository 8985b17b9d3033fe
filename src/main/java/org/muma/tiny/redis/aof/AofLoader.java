package org.muma.tiny.redis.aof;

import org.muma.tiny.redis.command.CommandDispatcher;
import org.muma.tiny.redis.protocol.ErrorMessage;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.protocol.RespDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * AOF 加载器 (Recovery)
 * 负责在启动时重放 AOF 文件，必须在 Netty 开始接收连接之前完成。
 */
public class AofLoader {

    private static final Logger log = LoggerFactory.getLogger(AofLoader.class);

    private static final int PROGRESS_INTERVAL = 100_000;

    private final AofManager aofManager;
    private final CommandDispatcher dispatcher;

    public AofLoader(AofManager aofManager, CommandDispatcher dispatcher) {
        this.aofManager = aofManager;
        this.dispatcher = dispatcher;
    }

    /**
     * @return 重放的命令条数
     * @throws IllegalStateException 文件读取失败或内容损坏，启动应当终止
     */
    public int load() {
        if (!aofManager.isEnabled()) return 0;

        long startTime = System.currentTimeMillis();
        int[] replayed = {0};

        try {
            int count = aofManager.load(command -> {
                // AOF 中只有写命令，这里不会再次写回 AOF
                RedisMessage response = dispatcher.dispatch(command);
                if (response instanceof ErrorMessage error) {
                    log.warn("AOF replay command returned error: {}", error.content());
                }

                // 【进度监控】避免大文件加载时控制台"假死"
                if (++replayed[0] % PROGRESS_INTERVAL == 0) {
                    log.info("AOF loading progress: {} commands processed...", replayed[0]);
                }
            });

            long duration = System.currentTimeMillis() - startTime;
            log.info("AOF loaded successfully. Total commands: {}. Duration: {} ms", count, duration);
            return count;

        } catch (IOException | RespDecodeException e) {
            log.error("Failed to load AOF after {} commands", replayed[0], e);
            throw new IllegalStateException("AOF load failed", e);
        }
    }
}
