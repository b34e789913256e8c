package com.whereq.tally.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tally.model.EncryptedCredential;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis wiring for the durable credential store. Vault entries live in one hash,
 * field = credential id, value = the encrypted entry as JSON.
 */
@Configuration
@ConditionalOnProperty(prefix = "tally.vault", name = "store", havingValue = "redis")
public class RedisConfig {

    @Bean
    public ReactiveRedisTemplate<String, EncryptedCredential> vaultRedisTemplate(
            ReactiveRedisConnectionFactory connectionFactory,
            ObjectMapper objectMapper) {

        StringRedisSerializer keys = new StringRedisSerializer();
        Jackson2JsonRedisSerializer<EncryptedCredential> entries =
            new Jackson2JsonRedisSerializer<>(objectMapper, EncryptedCredential.class);

        RedisSerializationContext<String, EncryptedCredential> serializationContext =
            RedisSerializationContext.<String, EncryptedCredential>newSerializationContext(keys)
                .value(entries)
                .hashKey(keys)
                .hashValue(entries)
                .build();

        return new ReactiveRedisTemplate<>(connectionFactory, serializationContext);
    }
}
