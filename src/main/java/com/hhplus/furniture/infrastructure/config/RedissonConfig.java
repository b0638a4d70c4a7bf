package com.hhplus.furniture.infrastructure.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 설정 (재고 조정/크레딧 충전 분산락)
 *
 * Redisson은 spring.data.redis 설정을 자동으로 사용하지 않으므로 직접 구성한다.
 */
@Configuration
public class RedissonConfig {

    @Value("${spring.data.redis.host}")
    private String host;

    @Value("${spring.data.redis.port}")
    private int port;

    @Value("${spring.data.redis.database:0}")
    private int database;

    @Value("${spring.data.redis.timeout:2000ms}")
    private String timeout;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();
        config.useSingleServer()
                .setAddress("redis://" + host + ":" + port)
                .setDatabase(database)
                .setTimeout(parseTimeout(timeout))
                .setConnectionPoolSize(16)
                .setConnectionMinimumIdleSize(4);

        return Redisson.create(config);
    }

    /**
     * timeout 문자열 파싱 (2000ms → 2000)
     */
    private int parseTimeout(String timeout) {
        return Integer.parseInt(timeout.replace("ms", "").trim());
    }
}
