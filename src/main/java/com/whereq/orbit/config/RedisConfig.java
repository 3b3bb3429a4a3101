package com.whereq.orbit.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;

/**
 * Redis wiring for the resource store and the stream-backed pressure feed.
 * <p>
 * Everything Orbit keeps in Redis is text. Resource documents and status events are JSON
 * written by the application's ObjectMapper; the id set and the name hash hold plain ids;
 * stream reads only look at consumer-group pending counts. A single string template
 * serves all of them, so the store controls its JSON instead of a Redis serializer.
 * </p>
 */
@Configuration
@ConditionalOnExpression("'${orbit.store.type:memory}' == 'redis' "
    + "or '${orbit.metrics.pressure-source:reported}' == 'redis-stream'")
public class RedisConfig {

    /**
     * Primary over Boot's {@code reactiveStringRedisTemplate}, which has the same generic type
     */
    @Bean
    @Primary
    public ReactiveRedisTemplate<String, String> reactiveRedisTemplate(
            ReactiveRedisConnectionFactory connectionFactory) {
        return new ReactiveRedisTemplate<>(connectionFactory, RedisSerializationContext.string());
    }
}
