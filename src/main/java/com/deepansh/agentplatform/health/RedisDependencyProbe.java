package com.deepansh.agentplatform.health;

import com.deepansh.agentplatform.resilience.DependencyNames;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * PING against the cache.
 */
@Component
@RequiredArgsConstructor
public class RedisDependencyProbe implements DependencyProbe {

    private final StringRedisTemplate redisTemplate;

    @Override
    public String dependencyName() {
        return DependencyNames.CACHE;
    }

    @Override
    public void probe() {
        String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
        if (!"PONG".equalsIgnoreCase(reply)) {
            throw new IllegalStateException("Unexpected PING reply from Redis: " + reply);
        }
    }
}
