package com.nftgateway.nftdata.cache;

import com.nftgateway.common.cache.CacheStoreAdapter;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis-backed {@link CacheStoreAdapter}. Writes use {@code SET key value EX ttl}, so expiry
 * is owned by Redis and entries are never invalidated explicitly.
 *
 * <p>Both commands are cold: nothing is sent until subscription, and a cancelled
 * subscription releases the command.
 */
public class RedisCacheStoreAdapter implements CacheStoreAdapter {

    private final ReactiveStringRedisTemplate template;

    public RedisCacheStoreAdapter(ReactiveStringRedisTemplate template) {
        this.template = template;
    }

    @Override
    public Mono<String> get(String key) {
        return template.opsForValue().get(key);
    }

    @Override
    public Mono<Boolean> setWithExpiry(String key, String value, Duration ttl) {
        return template.opsForValue().set(key, value, ttl);
    }
}
