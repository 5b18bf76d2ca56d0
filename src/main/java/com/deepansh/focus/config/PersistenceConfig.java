package com.deepansh.focus.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis holds conversation logs and the scratchpad; MongoDB holds tasks,
 * health snapshots and turn traces. Auditing fills the @CreatedDate fields.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = "com.deepansh.focus")
public class PersistenceConfig {

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }
}
