package org.muma.tiny.redis.command;

import org.muma.tiny.redis.command.impl.hash.HGetAllCommand;
import org.muma.tiny.redis.command.impl.hash.HGetCommand;
import org.muma.tiny.redis.command.impl.hash.HSetCommand;
import org.muma.tiny.redis.command.impl.server.PingCommand;
import org.muma.tiny.redis.command.impl.string.GetCommand;
import org.muma.tiny.redis.command.impl.string.SetCommand;
import org.muma.tiny.redis.protocol.BulkString;
import org.muma.tiny.redis.protocol.ErrorMessage;
import org.muma.tiny.redis.protocol.RedisArray;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.protocol.SimpleString;
import org.muma.tiny.redis.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 命令注册表 + 分发器
 * <p>
 * 网络连接和 AOF 重放共用同一个实例，操作同一个 {@link StorageEngine}。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final long SLOW_COMMAND_MILLIS = 10;

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final StorageEngine storage;

    public CommandDispatcher(StorageEngine storage) {
        this.storage = storage;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按数据结构分类注册
     */
    private void initCommandRegistry() {
        registerServerCommands();
        registerStringCommands();
        registerHashCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerServerCommands() {
        commandMap.put("PING", new PingCommand());
    }

    private void registerStringCommands() {
        commandMap.put("SET", new SetCommand());
        commandMap.put("GET", new GetCommand());
    }

    private void registerHashCommands() {
        commandMap.put("HSET", new HSetCommand());
        commandMap.put("HGET", new HGetCommand());
        commandMap.put("HGETALL", new HGetAllCommand());
    }

    /**
     * 分发一条完整的请求数组 [name, arg1, arg2, ...] (AOF 重放入口)
     */
    public RedisMessage dispatch(RedisArray command) {
        if (command.isEmpty()) {
            return new ErrorMessage("ERR protocol error: empty command");
        }
        RedisMessage first = command.elements().get(0);
        String name;
        if (first instanceof BulkString b) {
            name = b.asString();
        } else if (first instanceof SimpleString s) {
            name = s.content();
        } else {
            return new ErrorMessage("ERR protocol error: command name must be string");
        }
        List<RedisMessage> elements = command.elements();
        return dispatch(name, elements.subList(1, elements.size()));
    }

    /**
     * 核心分发逻辑
     */
    public RedisMessage dispatch(String commandName, List<RedisMessage> args) {
        // 1. 查找命令
        String cmdUpper = commandName.toUpperCase(Locale.ROOT);
        RedisCommand command = commandMap.get(cmdUpper);

        if (command == null) {
            log.warn("Command not found: {}", commandName);
            return new ErrorMessage("ERR unknown command '" + commandName + "'");
        }

        // 2. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response = command.execute(storage, args);

            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > SLOW_COMMAND_MILLIS) {
                log.warn("Slow command detected: {} cost {}ms", cmdUpper, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", cmdUpper, duration);
            }

            return response;

        } catch (IllegalArgumentException | IllegalStateException e) {
            // 预期内的业务错误 (如参数类型错误)
            log.warn("Command execution failed (Client Error): {} - {}", cmdUpper, e.getMessage());
            return new ErrorMessage("ERR " + e.getMessage());

        } catch (Exception e) {
            // 意料之外的系统错误
            log.error("Internal Server Error processing command: {}", cmdUpper, e);
            return new ErrorMessage("ERR internal server error");
        }
    }

    /**
     * 是否为写命令 (需要写入 AOF)
     */
    public boolean isWrite(String commandName) {
        RedisCommand command = commandMap.get(commandName.toUpperCase(Locale.ROOT));
        return command != null && command.isWrite();
    }

    public int commandCount() {
        return commandMap.size();
    }
}
