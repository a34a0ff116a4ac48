package com.nftgateway.nftdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;

/**
 * Redis wiring is owned by {@link com.nftgateway.nftdata.config.CacheConfig}: the connection
 * only exists when {@code cache.redis-url} is set, so Boot's localhost defaults stay off.
 */
@SpringBootApplication(exclude = {
    RedisAutoConfiguration.class,
    RedisReactiveAutoConfiguration.class,
    RedisRepositoriesAutoConfiguration.class
})
public class NftDataApplication {

    public static void main(String[] args) {
        SpringApplication.run(NftDataApplication.class, args);
    }
}
