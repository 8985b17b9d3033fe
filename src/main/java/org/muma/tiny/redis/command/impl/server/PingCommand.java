package org.muma.tiny.redis.command.impl.server;

import org.muma.tiny.redis.command.RedisCommand;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.protocol.SimpleString;
import org.muma.tiny.redis.store.StorageEngine;

import java.util.List;

public class PingCommand implements RedisCommand {

    private static final SimpleString PONG = new SimpleString("PONG");

    @Override
    public RedisMessage execute(StorageEngine storage, List<RedisMessage> args) {
        // PING [message]
        if (args.isEmpty()) {
            return PONG;
        }
        if (args.size() > 1) {
            return errorArgs("ping");
        }
        return new SimpleString(text(args.get(0)));
    }
}
