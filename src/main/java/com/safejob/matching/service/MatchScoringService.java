package com.safejob.matching.service;

import com.safejob.matching.cache.MatchCache;
import com.safejob.matching.cache.MatchCacheKey;
import com.safejob.matching.dto.CandidateProfile;
import com.safejob.matching.dto.CoupleMatchResult;
import com.safejob.matching.dto.JobPosting;
import com.safejob.matching.dto.MatchResult;
import com.safejob.matching.dto.SkillTaxonomy;
import com.safejob.matching.processors.MatchScorer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Scores snapshots against the current weight vector and taxonomy, reusing cached results for
 * unchanged input versions.
 */
@Service
@RequiredArgsConstructor
public class MatchScoringService {
    private final MatchScorer scorer;
    private final MatchCache matchCache;
    private final SnapshotService snapshotService;
    private final MeterRegistry meterRegistry;

    public MatchResult score(CandidateProfile candidate, JobPosting job) {
        SkillTaxonomy taxonomy = snapshotService.taxonomy();
        MatchCacheKey key = MatchCacheKey.candidate(
                candidate.getId(), candidate.getVersion(),
                job.getId(), job.getVersion(),
                scorer.getWeights().version(), taxonomy.version());

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return matchCache.getOrCompute(key, () -> scorer.score(candidate, job, taxonomy));
        } finally {
            sample.stop(meterRegistry.timer("match_score_duration", "subject", "candidate"));
        }
    }

    public CoupleMatchResult scoreCouple(CandidateProfile a, CandidateProfile b, JobPosting job) {
        SkillTaxonomy taxonomy = snapshotService.taxonomy();
        MatchCacheKey key = MatchCacheKey.couple(
                a.getId(), a.getVersion(), b.getId(), b.getVersion(),
                job.getId(), job.getVersion(),
                scorer.getWeights().version(), taxonomy.version());

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return matchCache.getOrComputeCouple(key, () -> scorer.scoreCouple(a, b, job, taxonomy));
        } finally {
            sample.stop(meterRegistry.timer("match_score_duration", "subject", "couple"));
        }
    }
}
