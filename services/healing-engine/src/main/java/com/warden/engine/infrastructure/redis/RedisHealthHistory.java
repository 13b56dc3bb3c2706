package com.warden.engine.infrastructure.redis;

import com.warden.engine.domain.health.HealthHistory;
import com.warden.engine.infrastructure.json.JsonCodec;
import com.warden.observability.HealthReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * {@link HealthHistory} in a Redis sorted set scored by report epoch millis. Each append trims the
 * set to the newest {@code capacity} members.
 */
public class RedisHealthHistory implements HealthHistory {

    private static final Logger log = LoggerFactory.getLogger(RedisHealthHistory.class);

    public static final String KEY = "warden:health:checks";

    private final StringRedisTemplate redis;
    private final int capacity;

    public RedisHealthHistory(StringRedisTemplate redis, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.redis = redis;
        this.capacity = capacity;
    }

    @Override
    public void append(HealthReport report) {
        redis.opsForZSet().add(KEY, JsonCodec.write(report), report.timestamp().toEpochMilli());
        redis.opsForZSet().removeRange(KEY, 0, -(capacity + 1L));
    }

    @Override
    public List<HealthReport> recent(int limit) {
        Set<String> members = redis.opsForZSet().reverseRange(KEY, 0, limit - 1L);
        List<HealthReport> reports = new ArrayList<>();
        if (members == null) {
            return reports;
        }
        for (String member : members) {
            try {
                reports.add(JsonCodec.read(member, HealthReport.class));
            } catch (JsonCodec.JsonCodecException e) {
                log.warn("Skipping unreadable health history entry: {}", e.getMessage());
            }
        }
        return reports;
    }

    @Override
    public int capacity() {
        return capacity;
    }
}
