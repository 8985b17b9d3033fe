package org.muma.tiny.redis.command.impl.string;

import org.muma.tiny.redis.command.RedisCommand;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.store.StorageEngine;

import java.util.List;

public class SetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, List<RedisMessage> args) {
        // SET key value (无条件覆盖)
        if (args.size() != 2) {
            return errorArgs("set");
        }

        storage.set(text(args.get(0)), bytes(args.get(1)));
        return OK;
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
