package com.tarterware.pedalpath.configs;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import com.tarterware.pedalpath.utilities.StringUtilities;

/**
 * Redis connection shared by the directions cache and saved routes.
 */
@Configuration
public class RedisConfig
{
    public static final String REDIS_CLIENT_NAME = "pedalpath";

    private static final Logger logger = LoggerFactory.getLogger(RedisConfig.class);

    @Value("${com.tarterware.pedalpath.redis.host:localhost}")
    private String redisHost;

    @Value("${com.tarterware.pedalpath.redis.port:6379}")
    private int redisPort;

    @Value("${com.tarterware.pedalpath.redis.database:0}")
    private int redisDatabase;

    @Value("${com.tarterware.pedalpath.redis.password:}")
    private String redisPassword;

    // Routing stays usable when the cache is slow, so keep this short.
    @Value("${com.tarterware.pedalpath.redis.command-timeout:2s}")
    private Duration commandTimeout;

    @Bean
    LettuceConnectionFactory redisStandAloneConnectionFactory()
    {
        RedisStandaloneConfiguration configuration = new RedisStandaloneConfiguration(redisHost, redisPort);
        configuration.setDatabase(redisDatabase);

        if (!StringUtilities.isNullEmptyOrBlank(redisPassword))
        {
            configuration.setPassword(redisPassword);
        }

        LettuceClientConfiguration clientConfiguration = LettuceClientConfiguration.builder()
                .clientName(REDIS_CLIENT_NAME)
                .commandTimeout(commandTimeout)
                .build();

        logger.info("Using redis at {}:{} database {}.", redisHost, redisPort, redisDatabase);

        return new LettuceConnectionFactory(configuration, clientConfiguration);
    }

    @Bean
    RedisTemplate<String, Object> redisTemplate(
            @Qualifier("redisStandAloneConnectionFactory") LettuceConnectionFactory redisConnectionFactory)
    {
        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(redisConnectionFactory);

        // Keys are plain strings; cached directions and saved routes carry their type for reading back.
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new GenericJackson2JsonRedisSerializer());

        template.afterPropertiesSet();
        return template;
    }
}
