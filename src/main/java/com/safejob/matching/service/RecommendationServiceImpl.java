package com.safejob.matching.service;

import com.safejob.matching.async.MatchingEventProducer;
import com.safejob.matching.dto.CandidateProfile;
import com.safejob.matching.dto.CoupleMatchResult;
import com.safejob.matching.dto.JobPosting;
import com.safejob.matching.dto.MatchResult;
import com.safejob.matching.dto.RankedMatches;
import com.safejob.matching.dto.enums.SubjectType;
import com.safejob.matching.dto.events.MatchComputed;
import com.safejob.matching.exceptions.InternalServerErrorException;
import com.safejob.matching.exceptions.NotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class RecommendationServiceImpl implements RecommendationService {
    private final SnapshotService snapshotService;
    private final MatchScoringService scoringService;
    private final MatchingEventProducer eventProducer;
    private final MeterRegistry meterRegistry;
    private final ExecutorService scoringExecutor;
    private final Clock clock;
    private final long timeoutMs;
    private final double minScore;

    public RecommendationServiceImpl(
            SnapshotService snapshotService,
            MatchScoringService scoringService,
            MatchingEventProducer eventProducer,
            MeterRegistry meterRegistry,
            @Qualifier("scoringExecutor") ExecutorService scoringExecutor,
            Clock clock,
            @Value("${matching.recommendation.timeout-ms:30000}") long timeoutMs,
            @Value("${matching.recommendation.min-score:0}") double minScore) {
        this.snapshotService = snapshotService;
        this.scoringService = scoringService;
        this.eventProducer = eventProducer;
        this.meterRegistry = meterRegistry;
        this.scoringExecutor = scoringExecutor;
        this.clock = clock;
        this.timeoutMs = timeoutMs;
        this.minScore = minScore;
    }

    @Override
    public RankedMatches rankJobsForCandidate(UUID candidateId, Collection<UUID> jobIds, int limit) {
        CandidateProfile candidate = snapshotService.candidate(candidateId);
        RankedMatches ranked = rank(jobIds,
                jobId -> scoringService.score(candidate, snapshotService.publishedJob(jobId)),
                MatchResult::getJobId, limit);
        log.info("Ranked {} jobs for candidateId={}: returned={}, excluded={}",
                jobIds.size(), candidateId, ranked.results().size(), ranked.excludedPairs());
        return ranked;
    }

    @Override
    public RankedMatches rankCandidatesForJob(UUID jobId, Collection<UUID> candidateIds, int limit) {
        JobPosting job = snapshotService.publishedJob(jobId);
        RankedMatches ranked = rank(candidateIds,
                candidateId -> scoringService.score(snapshotService.candidate(candidateId), job),
                MatchResult::getSubjectId, limit);
        log.info("Ranked {} candidates for jobId={}: returned={}, excluded={}",
                candidateIds.size(), jobId, ranked.results().size(), ranked.excludedPairs());
        return ranked;
    }

    @Override
    public CoupleMatchResult scoreCoupleForJob(UUID candidateAId, UUID candidateBId, UUID jobId) {
        CandidateProfile a = snapshotService.candidate(candidateAId);
        CandidateProfile b = snapshotService.candidate(candidateBId);
        JobPosting job = snapshotService.publishedJob(jobId);
        CoupleMatchResult result = scoringService.scoreCouple(a, b, job);
        eventProducer.publish(new MatchComputed(result.getCoupleId(), SubjectType.COUPLE, jobId,
                result.getCombinedScore(), result.getSharedComponentScores(), Instant.now(clock)));
        return result;
    }

    private RankedMatches rank(Collection<UUID> ids, Function<UUID, MatchResult> scoreOne,
                               Function<MatchResult, UUID> tieBreak, int limit) {
        List<UUID> distinct = new ArrayList<>(new LinkedHashSet<>(ids));
        List<CompletableFuture<MatchResult>> futures = new ArrayList<>(distinct.size());
        for (UUID id : distinct) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> scoreOne.apply(id), scoringExecutor)
                    .handle((result, ex) -> {
                        if (ex == null) return result;
                        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                        if (cause instanceof NotFoundException) {
                            log.debug("Excluding id={}: {}", id, cause.getMessage());
                        } else {
                            log.warn("Scoring failed for id={}, excluding: {}", id, cause.getMessage(), cause);
                        }
                        return null;
                    }));
        }

        awaitAll(futures);

        List<MatchResult> scored = new ArrayList<>();
        int excluded = 0;
        Instant now = Instant.now(clock);
        for (CompletableFuture<MatchResult> future : futures) {
            MatchResult result = future.isDone() ? future.join() : null;
            if (result == null) {
                future.cancel(true);
                excluded++;
            } else {
                scored.add(result);
                eventProducer.publish(new MatchComputed(result.getSubjectId(), SubjectType.CANDIDATE, result.getJobId(),
                        result.getOverallScore(), result.getComponentScores(), now));
            }
        }
        if (excluded > 0) {
            meterRegistry.counter("recommendation_excluded_pairs").increment(excluded);
        }

        List<MatchResult> ranked = scored.stream()
                .filter(r -> r.getOverallScore() >= minScore)
                .sorted(Comparator.comparingDouble(MatchResult::getOverallScore).reversed()
                        .thenComparing(tieBreak))
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .collect(Collectors.toList());
        return new RankedMatches(ranked, excluded);
    }

    private void awaitAll(List<CompletableFuture<MatchResult>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Scoring timed out after {} ms; unfinished pairs are excluded", timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InternalServerErrorException("Interrupted while scoring", e);
        } catch (ExecutionException e) {
            throw new InternalServerErrorException("Scoring failed: " + e.getMessage(), e);
        }
    }
}
