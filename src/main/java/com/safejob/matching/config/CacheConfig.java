package com.safejob.matching.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.safejob.matching.cache.MatchCacheKey;
import com.safejob.matching.dto.CoupleMatchResult;
import com.safejob.matching.dto.MatchResult;
import com.safejob.matching.dto.SkillTaxonomy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class CacheConfig {

    @Value("${matching.cache.max-size:200000}")
    private long maxSize;

    @Value("${matching.cache.expire-after-access-minutes:60}")
    private long expireAfterAccessMinutes;

    @Value("${matching.taxonomy.refresh-minutes:10}")
    private long taxonomyRefreshMinutes;

    @Bean
    public Cache<MatchCacheKey, MatchResult> matchResultCache() {
        return Caffeine.newBuilder()
                .expireAfterAccess(expireAfterAccessMinutes, TimeUnit.MINUTES)
                .maximumSize(maxSize)
                .recordStats()
                .build();
    }

    @Bean
    public Cache<MatchCacheKey, CoupleMatchResult> coupleMatchResultCache() {
        return Caffeine.newBuilder()
                .expireAfterAccess(expireAfterAccessMinutes, TimeUnit.MINUTES)
                .maximumSize(maxSize)
                .recordStats()
                .build();
    }

    @Bean
    public Cache<String, SkillTaxonomy> taxonomyCache() {
        return Caffeine.newBuilder()
                .expireAfterWrite(taxonomyRefreshMinutes, TimeUnit.MINUTES)
                .maximumSize(1)
                .build();
    }
}
