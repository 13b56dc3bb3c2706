package com.warden.engine.infrastructure.redis;

import com.warden.engine.domain.recovery.SharedCache;
import java.util.ArrayList;
import java.util.List;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * {@link SharedCache} holding every key under a prefix. Clearing scans for the prefix and deletes
 * in batches, so keys outside it (including the health history) survive.
 */
public class RedisSharedCache implements SharedCache {

    static final int BATCH_SIZE = 500;

    private final StringRedisTemplate redis;
    private final String prefix;

    public RedisSharedCache(StringRedisTemplate redis, String prefix) {
        this.redis = redis;
        this.prefix = prefix;
    }

    @Override
    public long clear() {
        long removed = 0;
        List<String> batch = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(BATCH_SIZE).build();
        try (Cursor<String> keys = redis.scan(options)) {
            while (keys.hasNext()) {
                batch.add(keys.next());
                if (batch.size() == BATCH_SIZE) {
                    removed += delete(batch);
                }
            }
        }
        return removed + delete(batch);
    }

    private long delete(List<String> batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        Long deleted = redis.delete(batch);
        batch.clear();
        return deleted == null ? 0 : deleted;
    }
}
