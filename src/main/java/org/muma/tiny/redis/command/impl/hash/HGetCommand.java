package org.muma.tiny.redis.command.impl.hash;

import org.muma.tiny.redis.command.RedisCommand;
import org.muma.tiny.redis.protocol.BulkString;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.protocol.RedisNull;
import org.muma.tiny.redis.store.StorageEngine;

import java.util.List;

public class HGetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, List<RedisMessage> args) {
        if (args.size() != 2) {
            return errorArgs("hget");
        }

        byte[] value = storage.hget(text(args.get(0)), text(args.get(1)));
        // 哈希不存在或字段不存在都返回 Nil
        return value == null ? RedisNull.INSTANCE : new BulkString(value);
    }
}
