package org.muma.tiny.redis;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.tiny.redis.aof.AofLoader;
import org.muma.tiny.redis.aof.AofManager;
import org.muma.tiny.redis.command.CommandDispatcher;
import org.muma.tiny.redis.config.TinyRedisConfig;
import org.muma.tiny.redis.protocol.RespDecoder;
import org.muma.tiny.redis.protocol.RespEncoder;
import org.muma.tiny.redis.server.RedisCommandHandler;
import org.muma.tiny.redis.store.StorageEngine;
import org.muma.tiny.redis.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

public class TinyRedisServer {

    private static final Logger log = LoggerFactory.getLogger(TinyRedisServer.class);

    private final TinyRedisConfig config;
    private final StorageEngine storage;
    private final AofManager aofManager;
    private final CommandDispatcher dispatcher;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public TinyRedisServer(TinyRedisConfig config) {
        this.config = config;
        // 1. 初始化存储 (每个 Server 实例独立一份，不再使用全局表)
        this.storage = new MemoryStorageEngine();
        // 2. 初始化命令分发器
        this.dispatcher = new CommandDispatcher(storage);
        // 3. 初始化 AOF Manager
        this.aofManager = new AofManager(config);
    }

    /**
     * 打开 AOF 并重放，然后开始监听。
     *
     * @return 实际监听的端口 (配置为 0 时由系统分配)
     */
    public int start() throws InterruptedException {
        // 4. 【关键】AOF 恢复数据 (Replay)，必须在 Netty 启动前完成
        aofManager.init();
        try {
            new AofLoader(aofManager, dispatcher).load();
        } catch (RuntimeException e) {
            aofManager.shutdown();
            throw e;
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        var bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                .handler(new LoggingHandler(LogLevel.DEBUG))
                // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new RespDecoder())
                                .addLast(new RespEncoder())
                                .addLast(new RedisCommandHandler(dispatcher, aofManager));
                    }
                });

        try {
            serverChannel = bootstrap.bind(config.getPort()).sync().channel();
        } catch (Exception e) {
            stop();
            throw e;
        }

        int boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("Tiny-Redis started on port {}", boundPort);
        return boundPort;
    }

    public void awaitTermination() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    /**
     * 停止监听并关闭 AOF (关闭前会强制刷盘)
     */
    public synchronized void stop() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully().syncUninterruptibly();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully().syncUninterruptibly();
            workerGroup = null;
        }
        aofManager.shutdown();
        log.info("Tiny-Redis stopped.");
    }

    public StorageEngine getStorage() {
        return storage;
    }

    public static void main(String[] args) throws InterruptedException {
        TinyRedisConfig config = TinyRedisConfig.load(args, System.getenv());
        TinyRedisServer server = new TinyRedisServer(config);

        try {
            server.start();
        } catch (Exception e) {
            log.error("Failed to start server", e);
            System.exit(1);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "shutdown-hook"));
        server.awaitTermination();
    }
}
