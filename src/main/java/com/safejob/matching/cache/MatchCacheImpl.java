package com.safejob.matching.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.safejob.matching.dto.CoupleMatchResult;
import com.safejob.matching.dto.MatchResult;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;


@Slf4j
@Component
public class MatchCacheImpl implements MatchCache {
    private final Cache<MatchCacheKey, MatchResult> cache;
    private final Cache<MatchCacheKey, CoupleMatchResult> coupleCache;
    private final MeterRegistry meterRegistry;

    public MatchCacheImpl(Cache<MatchCacheKey, MatchResult> matchResultCache,
                          Cache<MatchCacheKey, CoupleMatchResult> coupleMatchResultCache,
                          MeterRegistry meterRegistry) {
        this.cache = matchResultCache;
        this.coupleCache = coupleMatchResultCache;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public MatchResult getOrCompute(MatchCacheKey key, Supplier<MatchResult> scorer) {
        return lookup(cache, key, scorer, "candidate");
    }

    @Override
    public CoupleMatchResult getOrComputeCouple(MatchCacheKey key, Supplier<CoupleMatchResult> scorer) {
        return lookup(coupleCache, key, scorer, "couple");
    }

    private <V> V lookup(Cache<MatchCacheKey, V> target, MatchCacheKey key, Supplier<V> scorer, String subject) {
        V cached = target.getIfPresent(key);
        if (cached != null) {
            meterRegistry.counter("match_cache_hits", "subject", subject).increment();
            return cached;
        }
        meterRegistry.counter("match_cache_misses", "subject", subject).increment();
        return target.get(key, k -> scorer.get());
    }

    @Override
    public long size() {
        return cache.estimatedSize() + coupleCache.estimatedSize();
    }

    @Override
    public void clear() {
        log.info("Invalidating {} cached match results", size());
        cache.invalidateAll();
        coupleCache.invalidateAll();
    }
}
