package org.muma.tiny.redis.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.muma.tiny.redis.aof.AofManager;
import org.muma.tiny.redis.command.CommandDispatcher;
import org.muma.tiny.redis.protocol.BulkString;
import org.muma.tiny.redis.protocol.ErrorMessage;
import org.muma.tiny.redis.protocol.RedisArray;
import org.muma.tiny.redis.protocol.RedisInteger;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.protocol.RespDecodeException;
import org.muma.tiny.redis.protocol.SimpleString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 每个连接一个实例。Netty 保证同一连接上的请求按顺序处理：解码 → 分发 → 持久化 → 响应。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    // 记录连接的客户端数量
    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;
    private final AofManager aofManager;

    public RedisCommandHandler(CommandDispatcher dispatcher, AofManager aofManager) {
        this.dispatcher = dispatcher;
        this.aofManager = aofManager;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.incrementAndGet();
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.decrementAndGet();
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        if (msg instanceof RedisArray array) {
            handleCommand(ctx, array);
        } else {
            log.warn("Received non-array message: {}", msg);
            ctx.writeAndFlush(new ErrorMessage("ERR protocol error: expected array"));
        }
    }

    private void handleCommand(ChannelHandlerContext ctx, RedisArray array) {
        List<RedisMessage> elements = array.elements();
        if (elements.isEmpty()) {
            ctx.writeAndFlush(new ErrorMessage("ERR protocol error: empty command"));
            return;
        }

        String commandName;
        if (elements.get(0) instanceof BulkString cmdNameBulk) {
            commandName = cmdNameBulk.asString();
        } else if (elements.get(0) instanceof SimpleString cmdNameSimple) {
            commandName = cmdNameSimple.content();
        } else {
            ctx.writeAndFlush(new ErrorMessage("ERR protocol error: command name must be string"));
            return;
        }

        if (log.isDebugEnabled()) {
            String argsLog = elements.stream().skip(1).map(this::convertToString).collect(Collectors.joining(", "));
            log.debug("Execute Command: {} args=[{}]", commandName, argsLog);
        }

        RedisMessage response = dispatcher.dispatch(commandName, elements.subList(1, elements.size()));

        // 写命令执行成功后先落 AOF，再回复客户端 (write-before-acknowledge)
        if (!(response instanceof ErrorMessage) && dispatcher.isWrite(commandName)) {
            try {
                aofManager.append(array);
            } catch (IOException e) {
                log.error("Failed to append AOF for command {}", commandName, e);
                response = new ErrorMessage("ERR failed to persist command");
            }
        }

        ctx.writeAndFlush(response);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            // 协议错误：回复错误后关闭连接，结束本连接的读取循环
            String reason = cause.getCause() instanceof RespDecodeException rde ? rde.getMessage() : cause.getMessage();
            log.warn("Protocol error from {}: {}", ctx.channel().remoteAddress(), reason);
            ctx.writeAndFlush(new ErrorMessage("ERR protocol error: " + reason))
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            log.error("Unexpected error on connection {}", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }

    public static int connectedClients() {
        return connectedClients.get();
    }

    private String convertToString(RedisMessage msg) {
        if (msg instanceof BulkString b) return b.asString();
        if (msg instanceof SimpleString s) return s.content();
        if (msg instanceof RedisInteger i) return String.valueOf(i.value());
        return "<?>";
    }
}
