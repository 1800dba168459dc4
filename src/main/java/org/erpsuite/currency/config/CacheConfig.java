package org.erpsuite.currency.config;

import java.time.Duration;

import org.springframework.boot.autoconfigure.cache.RedisCacheManagerBuilderCustomizer;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;

/**
 * Redis cache configuration for the Currency Service.
 *
 * <p>Caches currency lookups by code, which sit on the hot path of every conversion.
 */
@Configuration
@EnableCaching
public class CacheConfig {

  /** Cache name for currency lookups by tenant and code. */
  public static final String CURRENCY_BY_CODE_CACHE = "currencyByCode";

  /**
   * Creates a GenericJackson2JsonRedisSerializer with polymorphic type handling restricted to our
   * own types and standard Java types.
   *
   * @param objectMapper application-wide ObjectMapper with JavaTimeModule registered
   * @return configured serializer with type information
   */
  @Bean
  public GenericJackson2JsonRedisSerializer redisSerializer(ObjectMapper objectMapper) {
    // Copy so the application-wide mapper keeps its settings
    var mapper = objectMapper.copy();

    var typeValidator =
        BasicPolymorphicTypeValidator.builder()
            .allowIfBaseType(Object.class)
            .allowIfSubType("org.erpsuite")
            .allowIfSubType("java.util")
            .allowIfSubType("java.time")
            .allowIfSubType("java.math")
            .build();

    mapper.activateDefaultTyping(typeValidator, ObjectMapper.DefaultTyping.NON_FINAL);

    return new GenericJackson2JsonRedisSerializer(mapper);
  }

  /**
   * Configures the Redis cache manager.
   *
   * <p><b>Currency By Code Cache:</b>
   *
   * <ul>
   *   <li><b>TTL:</b> 1 hour. Entries are evicted on every registry mutation, the TTL only bounds
   *       staleness if an eviction is lost.
   *   <li><b>Eviction:</b> {@code @CacheEvict(allEntries = true)} on register, update and retire.
   *   <li><b>Transaction Awareness:</b> evictions are deferred until the surrounding transaction
   *       commits, so a rolled back mutation leaves the cache untouched.
   *   <li><b>Key Structure:</b> {@code currency-service:currencyByCode::{tenantId}:{CODE}}
   * </ul>
   *
   * @param redisSerializer configured serializer with type information
   * @return customizer for RedisCacheManager
   */
  @Bean
  public RedisCacheManagerBuilderCustomizer redisCacheManagerBuilderCustomizer(
      GenericJackson2JsonRedisSerializer redisSerializer) {
    return builder ->
        builder
            .transactionAware()
            .withCacheConfiguration(
                CURRENCY_BY_CODE_CACHE,
                RedisCacheConfiguration.defaultCacheConfig()
                    .entryTtl(Duration.ofHours(1))
                    .disableCachingNullValues()
                    .serializeKeysWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                            new StringRedisSerializer()))
                    .serializeValuesWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(redisSerializer))
                    .prefixCacheNameWith("currency-service:"));
  }
}
