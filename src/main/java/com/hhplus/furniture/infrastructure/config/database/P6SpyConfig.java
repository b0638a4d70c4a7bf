package com.hhplus.furniture.infrastructure.config.database;

import com.hhplus.furniture.infrastructure.config.P6SpyPrettySqlFormatter;
import com.p6spy.engine.spy.appender.MessageFormattingStrategy;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * P6Spy 설정. test 프로필에서만 바인딩된 인자가 포함된 SQL을 보기 좋게 출력한다.
 */
@Configuration
@ConditionalOnProperty(name = "spring.profiles.active", havingValue = "test")
public class P6SpyConfig {

    @Bean
    public MessageFormattingStrategy p6SpyMessageFormattingStrategy() {
        return new P6SpyPrettySqlFormatter();
    }
}
