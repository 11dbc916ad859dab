package com.spiderhub.crawler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis 설정
 *
 * 결과 저장소와 요청 제한 카운터 모두 문자열 값만 사용하므로
 * StringRedisTemplate 하나를 공유합니다. (JSON 직렬화는 ResultStore 에서 처리)
 */
@Configuration
@Slf4j
public class RedisConfig {

    @Value("${spring.data.redis.url:redis://localhost:6379/1}")
    private String redisUrl;

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        log.info("Configuring Redis template: url={}", maskPassword(redisUrl));
        return new StringRedisTemplate(connectionFactory);
    }

    static String maskPassword(String url) {
        int at = url.indexOf('@');
        int scheme = url.indexOf("://");
        if (at < 0 || scheme < 0 || at < scheme) {
            return url;
        }
        return url.substring(0, scheme + 3) + "****" + url.substring(at);
    }
}
