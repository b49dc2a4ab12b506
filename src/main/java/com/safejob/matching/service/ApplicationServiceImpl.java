package com.safejob.matching.service;

import com.safejob.matching.async.MatchingEventProducer;
import com.safejob.matching.dto.CandidateProfile;
import com.safejob.matching.dto.JobPosting;
import com.safejob.matching.dto.MatchResult;
import com.safejob.matching.dto.enums.ActorType;
import com.safejob.matching.dto.enums.ApplicationStatus;
import com.safejob.matching.dto.events.ApplicationSubmitted;
import com.safejob.matching.exceptions.BadRequestException;
import com.safejob.matching.exceptions.InvalidTransitionException;
import com.safejob.matching.exceptions.NotFoundException;
import com.safejob.matching.models.Application;
import com.safejob.matching.models.ApplicationStatusHistory;
import com.safejob.matching.processors.ApplicationTransitionProcessor;
import com.safejob.matching.repo.ApplicationRepository;
import com.safejob.matching.repo.ApplicationStatusHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicationServiceImpl implements ApplicationService {
    private static final Set<ApplicationStatus> INACTIVE =
            EnumSet.of(ApplicationStatus.REJECTED, ApplicationStatus.WITHDRAWN);
    // reached only through submit() or partner confirmation, which freeze the score
    private static final Set<ApplicationStatus> SUBMISSION_TARGETS =
            EnumSet.of(ApplicationStatus.SUBMITTED, ApplicationStatus.AWAITING_PARTNER);

    private final ApplicationRepository applicationRepository;
    private final ApplicationStatusHistoryRepository historyRepository;
    private final ApplicationTransitionProcessor transitionProcessor;
    private final SnapshotService snapshotService;
    private final MatchScoringService scoringService;
    private final CoupleCoordinator coupleCoordinator;
    private final MatchingEventProducer eventProducer;
    private final Clock clock;

    @Override
    @Transactional
    public Application createDraft(UUID candidateId, UUID jobId) {
        snapshotService.candidate(candidateId);
        JobPosting job = snapshotService.publishedJob(jobId);
        if (job.isMustBeCouple()) {
            throw new BadRequestException("Job " + jobId + " only accepts couple applications");
        }
        if (applicationRepository.existsActive(candidateId, jobId, INACTIVE)) {
            throw new BadRequestException("Candidate " + candidateId + " already has an open application for job " + jobId);
        }

        Application draft = Application.builder()
                .candidateId(candidateId)
                .jobId(jobId)
                .build();
        Application saved = transitionProcessor.create(draft, List.of(ApplicationStatus.DRAFT),
                candidateId.toString(), ActorType.CANDIDATE, null);
        log.info("Draft application created: applicationId={}, candidateId={}, jobId={}", saved.getId(), candidateId, jobId);
        return saved;
    }

    /**
     * Scores the candidate against the job as it stands now and freezes that score on the
     * application.
     */
    @Override
    @Transactional
    public Application submit(UUID applicationId, UUID candidateId) {
        Application application = get(applicationId);
        if (!application.getCandidateId().equals(candidateId)) {
            throw new BadRequestException("Application " + applicationId + " does not belong to candidate " + candidateId);
        }
        if (application.getCoupleApplicationId() != null) {
            throw new BadRequestException("Couple applications are submitted by partner confirmation");
        }

        CandidateProfile candidate = snapshotService.candidate(candidateId);
        JobPosting job = snapshotService.publishedJob(application.getJobId());
        if (job.isMustBeCouple()) {
            throw new BadRequestException("Job " + job.getId() + " only accepts couple applications");
        }
        MatchResult match = scoringService.score(candidate, job);

        application.setComponentScores(match.getComponentScores());
        application.setOverallScore(match.getOverallScore());
        Application submitted = transitionProcessor.apply(application, ApplicationStatus.SUBMITTED,
                candidateId.toString(), ActorType.CANDIDATE, null);

        eventProducer.publishAfterCommit(new ApplicationSubmitted(submitted.getId(), candidateId,
                submitted.getJobId(), match.getOverallScore(), Instant.now(clock)));
        log.info("Application submitted: applicationId={}, candidateId={}, jobId={}, score={}",
                submitted.getId(), candidateId, submitted.getJobId(), match.getOverallScore());
        return submitted;
    }

    @Override
    @Transactional
    public Application apply(UUID candidateId, UUID jobId) {
        Application draft = createDraft(candidateId, jobId);
        return submit(draft.getId(), candidateId);
    }

    @Override
    @Transactional
    public Application transition(UUID applicationId, ApplicationStatus target, String actor,
                                  ActorType actorType, String reason) {
        Application application = get(applicationId);
        if (SUBMISSION_TARGETS.contains(target)) {
            throw new InvalidTransitionException(application.getStatus(), target, actorType);
        }
        Application updated = transitionProcessor.apply(application, target, actor, actorType, reason);
        if (updated.getCoupleApplicationId() != null) {
            coupleCoordinator.refreshProjection(updated.getCoupleApplicationId());
        }
        return updated;
    }

    @Override
    @Transactional
    public Application withdraw(UUID applicationId, UUID candidateId, String reason) {
        Application application = get(applicationId);
        if (!application.getCandidateId().equals(candidateId)) {
            throw new BadRequestException("Application " + applicationId + " does not belong to candidate " + candidateId);
        }
        return transition(applicationId, ApplicationStatus.WITHDRAWN, candidateId.toString(), ActorType.CANDIDATE, reason);
    }

    @Override
    @Transactional(readOnly = true)
    public Application get(UUID applicationId) {
        return applicationRepository.findById(applicationId)
                .orElseThrow(() -> new NotFoundException("Application not found: " + applicationId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Application> findByCandidate(UUID candidateId) {
        return applicationRepository.findByCandidateIdOrderByCreatedAtDesc(candidateId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Application> findByJob(UUID jobId) {
        return applicationRepository.findByJobIdOrderByCreatedAtDesc(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ApplicationStatusHistory> history(UUID applicationId) {
        return historyRepository.findByApplicationIdOrderByChangedAtAsc(applicationId);
    }
}
