package com.nftgateway.nftdata.config;

import com.nftgateway.common.cache.CacheAccessGuard;
import com.nftgateway.common.cache.CacheStoreAdapter;
import com.nftgateway.nftdata.cache.RedisCacheStoreAdapter;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import java.time.Duration;

/**
 * Cache store wiring.
 *
 * <p>When {@code cache.redis-url} is blank no connection factory or adapter is created and
 * the {@link CacheAccessGuard} runs disabled: every lookup is a miss, every write a no-op.
 * The connection is lazy, so an unreachable Redis never blocks startup.
 */
@Configuration
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    private static final String REDIS_CONFIGURED = "!'${cache.redis-url:}'.trim().isEmpty()";

    @Value("${cache.operation-timeout:3000ms}")
    private Duration operationTimeout;

    @Bean
    @ConditionalOnExpression(REDIS_CONFIGURED)
    public LettuceConnectionFactory cacheConnectionFactory(@Value("${cache.redis-url}") String redisUrl) {
        RedisURI uri = RedisURI.create(redisUrl.trim());

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
        server.setDatabase(uri.getDatabase());
        if (uri.getUsername() != null) {
            server.setUsername(uri.getUsername());
        }
        if (uri.getPassword() != null && uri.getPassword().length > 0) {
            server.setPassword(RedisPassword.of(uri.getPassword()));
        }

        ClientOptions clientOptions = ClientOptions.builder()
            .autoReconnect(true)
            .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
            .socketOptions(SocketOptions.builder()
                .keepAlive(true)
                .connectTimeout(operationTimeout)
                .build())
            .build();

        LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
            .commandTimeout(operationTimeout)
            .clientOptions(clientOptions);
        if (uri.isSsl()) {
            client.useSsl();
        }

        log.info("Cache store configured. host={} port={} db={} ssl={}",
                 uri.getHost(), uri.getPort(), uri.getDatabase(), uri.isSsl());
        return new LettuceConnectionFactory(server, client.build());
    }

    @Bean
    @ConditionalOnExpression(REDIS_CONFIGURED)
    public CacheStoreAdapter redisCacheStoreAdapter(LettuceConnectionFactory cacheConnectionFactory) {
        return new RedisCacheStoreAdapter(new ReactiveStringRedisTemplate(cacheConnectionFactory));
    }

    @Bean
    public CacheAccessGuard cacheAccessGuard(ObjectProvider<CacheStoreAdapter> adapter) {
        CacheStoreAdapter store = adapter.getIfAvailable();
        if (store == null) {
            log.info("No cache.redis-url configured; caching disabled");
            return CacheAccessGuard.disabled();
        }
        return new CacheAccessGuard(store, operationTimeout);
    }
}
