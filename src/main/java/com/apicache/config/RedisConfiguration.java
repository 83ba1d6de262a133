package com.apicache.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.RedisSerializer;

/**
 * Redis (Valkey) configuration for the response cache store.
 */
@Slf4j
@Configuration
public class RedisConfiguration {

    private final ApiCacheProperties properties;

    public RedisConfiguration(ApiCacheProperties properties) {
        this.properties = properties;
    }

    /**
     * Configure Lettuce connection factory with timeouts and resilience.
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory() {
        ApiCacheProperties.ValkeyConfig valkey = properties.getValkey();

        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(valkey.getHost(), valkey.getPort());
        standalone.setDatabase(valkey.getDatabase());
        if (valkey.getPassword() != null && !valkey.getPassword().isEmpty()) {
            standalone.setPassword(RedisPassword.of(valkey.getPassword()));
        }

        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(valkey.getConnectTimeout())
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .timeoutOptions(TimeoutOptions.enabled(valkey.getCommandTimeout()))
                .build();

        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .commandTimeout(valkey.getCommandTimeout())
                .build();

        LettuceConnectionFactory factory = new LettuceConnectionFactory(standalone, clientConfig);

        log.info("Configured Valkey connection factory: host={}, port={}, db={}",
                valkey.getHost(), valkey.getPort(), valkey.getDatabase());
        return factory;
    }

    /**
     * Reactive template with string keys and raw byte values (entries are encoded by CachedEntryCodec).
     */
    @Bean
    public ReactiveRedisTemplate<String, byte[]> reactiveRedisTemplate(ReactiveRedisConnectionFactory connectionFactory) {
        RedisSerializationContext<String, byte[]> context = RedisSerializationContext
                .<String, byte[]>newSerializationContext(RedisSerializer.string())
                .key(RedisSerializer.string())
                .value(RedisSerializer.byteArray())
                .hashKey(RedisSerializer.string())
                .hashValue(RedisSerializer.byteArray())
                .build();

        log.info("Configured ReactiveRedisTemplate for byte array storage");
        return new ReactiveRedisTemplate<>(connectionFactory, context);
    }
}
