package com.safejob.matching.cache;

import com.safejob.matching.dto.enums.SubjectType;

import java.util.UUID;

/**
 * Identifies one scoring input set. Any new snapshot version, weight vector or taxonomy version
 * yields a different key, so cached results never go stale in place. Couple keys carry both
 * partners in initiator order, since the cached result is oriented that way.
 */
public record MatchCacheKey(
        SubjectType subjectType,
        UUID candidateId,
        long candidateVersion,
        UUID partnerId,
        long partnerVersion,
        UUID jobId,
        long jobVersion,
        String configVersion,
        String taxonomyVersion
) {

    public static MatchCacheKey candidate(UUID candidateId, long candidateVersion, UUID jobId, long jobVersion,
                                          String configVersion, String taxonomyVersion) {
        return new MatchCacheKey(SubjectType.CANDIDATE, candidateId, candidateVersion, null, 0L,
                jobId, jobVersion, configVersion, taxonomyVersion);
    }

    public static MatchCacheKey couple(UUID candidateAId, long candidateAVersion, UUID candidateBId, long candidateBVersion,
                                       UUID jobId, long jobVersion, String configVersion, String taxonomyVersion) {
        return new MatchCacheKey(SubjectType.COUPLE, candidateAId, candidateAVersion, candidateBId, candidateBVersion,
                jobId, jobVersion, configVersion, taxonomyVersion);
    }
}
