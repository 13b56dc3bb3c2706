package com.warden.engine.infrastructure.redis;

import com.warden.observability.ComponentHealth;
import com.warden.observability.TimedHealthCheck;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.Executor;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Cache probe: {@code PING}, then a SET/GET/DEL round-trip on a throwaway key.
 */
public class CacheHealthCheck extends TimedHealthCheck {

    public static final String NAME = "cache";

    static final String PROBE_KEY_PREFIX = "warden:health:probe:";
    static final Duration PROBE_TTL = Duration.ofSeconds(10);

    private final StringRedisTemplate redis;

    public CacheHealthCheck(StringRedisTemplate redis, Executor executor) {
        super(NAME, executor);
        this.redis = redis;
    }

    @Override
    protected ComponentHealth probe(long startNanos) {
        String pong = redis.execute(RedisConnection::ping, true);
        if (!"PONG".equalsIgnoreCase(pong)) {
            return ComponentHealth.unhealthy(NAME, "Unexpected PING reply: " + pong, elapsedMs(startNanos));
        }

        String key = PROBE_KEY_PREFIX + UUID.randomUUID();
        String value = Long.toString(System.currentTimeMillis());
        redis.opsForValue().set(key, value, PROBE_TTL);
        String read = redis.opsForValue().get(key);
        redis.delete(key);
        if (!value.equals(read)) {
            return ComponentHealth.unhealthy(NAME, "Cache read-back mismatch", elapsedMs(startNanos));
        }
        return ComponentHealth.healthy(NAME, elapsedMs(startNanos));
    }
}
