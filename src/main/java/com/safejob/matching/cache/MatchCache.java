package com.safejob.matching.cache;

import com.safejob.matching.dto.CoupleMatchResult;
import com.safejob.matching.dto.MatchResult;

import java.util.function.Supplier;

public interface MatchCache {

    MatchResult getOrCompute(MatchCacheKey key, Supplier<MatchResult> scorer);

    CoupleMatchResult getOrComputeCouple(MatchCacheKey key, Supplier<CoupleMatchResult> scorer);

    long size();

    void clear();
}
