package com.flamingo.ai.recall.config;

import com.flamingo.ai.recall.domain.entity.Memory;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the hot aggregate cache. */
@Configuration
public class CacheConfig {

  /** User id to that user's CRITICAL/HIGH active memories. */
  @Bean
  public Cache<String, List<Memory>> profileCache(MemoryConfig memoryConfig) {
    return Caffeine.newBuilder()
        .expireAfterWrite(memoryConfig.getCache().getProfileTtl())
        .maximumSize(memoryConfig.getCache().getMaximumSize())
        .recordStats()
        .build();
  }
}
