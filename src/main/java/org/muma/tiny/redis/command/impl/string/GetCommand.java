package org.muma.tiny.redis.command.impl.string;

import org.muma.tiny.redis.command.RedisCommand;
import org.muma.tiny.redis.protocol.BulkString;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.protocol.RedisNull;
import org.muma.tiny.redis.store.StorageEngine;

import java.util.List;

public class GetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, List<RedisMessage> args) {
        if (args.size() != 1) {
            return errorArgs("get");
        }

        byte[] value = storage.get(text(args.get(0)));
        if (value == null) {
            return RedisNull.INSTANCE; // Nil
        }
        return new BulkString(value);
    }
}
