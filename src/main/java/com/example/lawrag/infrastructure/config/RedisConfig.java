package com.example.lawrag.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisPooled;

@Configuration
public class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

    @Bean(destroyMethod = "close")
    public JedisPooled jedisPooled(
            @Value("${lawrag.redis.host:localhost}") String host,
            @Value("${lawrag.redis.port:6379}") int port,
            @Value("${lawrag.redis.password:}") String password,
            @Value("${lawrag.redis.database:0}") int database,
            @Value("${lawrag.redis.timeout-ms:2000}") int timeoutMs
    ) {
        log.info("event=redis_client_config host={} port={} db={} timeoutMs={}", host, port, database, timeoutMs);
        DefaultJedisClientConfig config = DefaultJedisClientConfig.builder()
                .password(password == null || password.isBlank() ? null : password)
                .database(database)
                .timeoutMillis(timeoutMs)
                .build();
        return new JedisPooled(new HostAndPort(host, port), config);
    }
}
