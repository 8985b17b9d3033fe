package org.muma.tiny.redis.command.impl.hash;

import org.muma.tiny.redis.command.RedisCommand;
import org.muma.tiny.redis.protocol.BulkString;
import org.muma.tiny.redis.protocol.RedisArray;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.protocol.RedisNull;
import org.muma.tiny.redis.store.StorageEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class HGetAllCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, List<RedisMessage> args) {
        // HGETALL key
        if (args.size() != 1) {
            return errorArgs("hgetall");
        }

        Map<String, byte[]> all = storage.hgetAll(text(args.get(0)));
        if (all == null) {
            return RedisNull.INSTANCE;
        }

        // 构造 RESP 数组: [field1, val1, field2, val2, ...]，顺序不保证
        List<RedisMessage> result = new ArrayList<>(all.size() * 2);
        for (Map.Entry<String, byte[]> entry : all.entrySet()) {
            result.add(new BulkString(entry.getKey()));
            result.add(new BulkString(entry.getValue()));
        }
        return new RedisArray(result);
    }
}
