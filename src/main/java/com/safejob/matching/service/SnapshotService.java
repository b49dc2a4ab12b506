package com.safejob.matching.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.safejob.matching.client.CandidateSnapshotClient;
import com.safejob.matching.client.JobSnapshotClient;
import com.safejob.matching.client.SkillTaxonomyClient;
import com.safejob.matching.dto.CandidateProfile;
import com.safejob.matching.dto.JobPosting;
import com.safejob.matching.dto.SkillTaxonomy;
import com.safejob.matching.exceptions.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Loads the read-only snapshots scoring runs on. A missing candidate or job is a
 * {@link NotFoundException}; an unreachable taxonomy degrades to a permissive one.
 */
@Slf4j
@Service
public class SnapshotService {
    private static final String TAXONOMY_KEY = "taxonomy";

    private final CandidateSnapshotClient candidateClient;
    private final JobSnapshotClient jobClient;
    private final SkillTaxonomyClient taxonomyClient;
    private final Cache<String, SkillTaxonomy> taxonomyCache;

    public SnapshotService(CandidateSnapshotClient candidateClient,
                           JobSnapshotClient jobClient,
                           SkillTaxonomyClient taxonomyClient,
                           Cache<String, SkillTaxonomy> taxonomyCache) {
        this.candidateClient = candidateClient;
        this.jobClient = jobClient;
        this.taxonomyClient = taxonomyClient;
        this.taxonomyCache = taxonomyCache;
    }

    public CandidateProfile candidate(UUID candidateId) {
        return candidateClient.fetch(candidateId)
                .orElseThrow(() -> new NotFoundException("Candidate not found: " + candidateId));
    }

    /**
     * Job snapshot that is open for matching; postings in any other status count as not found.
     */
    public JobPosting publishedJob(UUID jobId) {
        JobPosting job = jobClient.fetch(jobId)
                .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
        if (!job.isPublished()) {
            throw new NotFoundException("Job " + jobId + " is not published (status=" + job.getStatus() + ")");
        }
        return job;
    }

    public SkillTaxonomy taxonomy() {
        try {
            return taxonomyCache.get(TAXONOMY_KEY, k -> taxonomyClient.fetch());
        } catch (RuntimeException e) {
            log.warn("Skill taxonomy unavailable, treating all skill ids as known: {}", e.getMessage());
            return SkillTaxonomy.permissive();
        }
    }
}
