package com.safejob.matching.service;

import com.safejob.matching.dto.CoupleMatchResult;
import com.safejob.matching.dto.RankedMatches;

import java.util.Collection;
import java.util.UUID;

public interface RecommendationService {
    RankedMatches rankJobsForCandidate(UUID candidateId, Collection<UUID> jobIds, int limit);

    RankedMatches rankCandidatesForJob(UUID jobId, Collection<UUID> candidateIds, int limit);

    CoupleMatchResult scoreCoupleForJob(UUID candidateAId, UUID candidateBId, UUID jobId);
}
