package org.muma.tiny.redis.command.impl.hash;

import org.muma.tiny.redis.command.RedisCommand;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.store.StorageEngine;

import java.util.List;

public class HSetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, List<RedisMessage> args) {
        // HSET key field value
        if (args.size() != 3) {
            return errorArgs("hset");
        }

        storage.hset(text(args.get(0)), text(args.get(1)), bytes(args.get(2)));
        return OK;
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
