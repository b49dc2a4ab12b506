package com.safejob.matching.service;

import com.safejob.matching.async.MatchingEventProducer;
import com.safejob.matching.dto.CandidateProfile;
import com.safejob.matching.dto.CoupleMatchResult;
import com.safejob.matching.dto.JobPosting;
import com.safejob.matching.dto.MatchResult;
import com.safejob.matching.dto.enums.ActorType;
import com.safejob.matching.dto.enums.ApplicationStatus;
import com.safejob.matching.dto.enums.ConfirmationOutcome;
import com.safejob.matching.dto.enums.CoupleApplicationStatus;
import com.safejob.matching.dto.events.ApplicationSubmitted;
import com.safejob.matching.dto.events.CoupleApplicationResolved;
import com.safejob.matching.dto.events.CoupleAwaitingPartner;
import com.safejob.matching.exceptions.BadRequestException;
import com.safejob.matching.exceptions.InvalidTransitionException;
import com.safejob.matching.exceptions.NotFoundException;
import com.safejob.matching.models.Application;
import com.safejob.matching.models.CoupleApplication;
import com.safejob.matching.processors.ApplicationStateMachine;
import com.safejob.matching.processors.ApplicationTransitionProcessor;
import com.safejob.matching.repo.ApplicationRepository;
import com.safejob.matching.repo.CoupleApplicationRepository;
import com.safejob.matching.utils.basic.Constant;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
public class CoupleCoordinatorImpl implements CoupleCoordinator {
    private static final Set<CoupleApplicationStatus> CANCELLABLE =
            EnumSet.of(CoupleApplicationStatus.DRAFT, CoupleApplicationStatus.AWAITING_PARTNER);
    private static final List<ApplicationStatus> CONFIRMED_PATH =
            List.of(ApplicationStatus.DRAFT, ApplicationStatus.AWAITING_PARTNER, ApplicationStatus.SUBMITTED);

    private final CoupleApplicationRepository coupleRepository;
    private final ApplicationRepository applicationRepository;
    private final ApplicationStateMachine stateMachine;
    private final ApplicationTransitionProcessor transitionProcessor;
    private final SnapshotService snapshotService;
    private final MatchScoringService scoringService;
    private final MatchingEventProducer eventProducer;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration confirmationTimeout;
    private final int sweepBatchSize;

    public CoupleCoordinatorImpl(
            CoupleApplicationRepository coupleRepository,
            ApplicationRepository applicationRepository,
            ApplicationStateMachine stateMachine,
            ApplicationTransitionProcessor transitionProcessor,
            SnapshotService snapshotService,
            MatchScoringService scoringService,
            MatchingEventProducer eventProducer,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${couple.confirmation.timeout:PT24H}") Duration confirmationTimeout,
            @Value("${couple.timeout.batch-size:500}") int sweepBatchSize) {
        this.coupleRepository = coupleRepository;
        this.applicationRepository = applicationRepository;
        this.stateMachine = stateMachine;
        this.transitionProcessor = transitionProcessor;
        this.snapshotService = snapshotService;
        this.scoringService = scoringService;
        this.eventProducer = eventProducer;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.confirmationTimeout = confirmationTimeout;
        this.sweepBatchSize = sweepBatchSize;
    }

    @Override
    @Transactional
    public CoupleApplication initiate(UUID jobId, UUID initiatorId, UUID partnerId) {
        if (initiatorId.equals(partnerId)) {
            throw new BadRequestException("A couple application needs two different candidates");
        }
        CandidateProfile initiator = snapshotService.candidate(initiatorId);
        CandidateProfile partner = snapshotService.candidate(partnerId);
        if (!initiator.hasLinkedPartner() || !partner.hasLinkedPartner()
                || !partnerId.equals(initiator.getPartnerId()) || !initiatorId.equals(partner.getPartnerId())) {
            throw new BadRequestException("Candidates " + initiatorId + " and " + partnerId + " are not linked partners");
        }

        JobPosting job = snapshotService.publishedJob(jobId);
        if (!job.acceptsCouples()) {
            throw new BadRequestException("Job " + jobId + " is not open to couples");
        }
        Integer maxPositions = job.getMaxCouplePositions();
        if (maxPositions != null && maxPositions > 0
                && coupleRepository.countByJobIdAndStatus(jobId, CoupleApplicationStatus.BOTH_ACCEPTED) >= maxPositions) {
            throw new BadRequestException("Job " + jobId + " has no couple positions left");
        }

        boolean ordered = initiatorId.compareTo(partnerId) <= 0;
        UUID low = ordered ? initiatorId : partnerId;
        UUID high = ordered ? partnerId : initiatorId;
        if (coupleRepository.findByJobIdAndPairLowIdAndPairHighId(jobId, low, high).isPresent()) {
            throw new BadRequestException("Couple application already exists for job " + jobId);
        }

        CoupleApplication couple = coupleRepository.save(CoupleApplication.builder()
                .jobId(jobId)
                .candidateAId(initiatorId)
                .candidateBId(partnerId)
                .pairLowId(low)
                .pairHighId(high)
                .status(CoupleApplicationStatus.DRAFT)
                .createdAt(Instant.now(clock))
                .build());
        log.info("Couple application created: coupleApplicationId={}, jobId={}, initiator={}, partner={}",
                couple.getId(), jobId, initiatorId, partnerId);
        return couple;
    }

    @Override
    @Transactional
    public ConfirmationOutcome confirm(UUID coupleApplicationId, UUID candidateId) {
        CoupleApplication couple = get(coupleApplicationId);
        if (!couple.involves(candidateId)) {
            throw new BadRequestException("Candidate " + candidateId + " is not part of couple application " + coupleApplicationId);
        }
        Instant now = Instant.now(clock);

        if (couple.getStatus() == CoupleApplicationStatus.DRAFT) {
            Instant deadline = now.plus(confirmationTimeout);
            int updated = couple.isPartnerA(candidateId)
                    ? coupleRepository.markAwaitingConfirmedByA(coupleApplicationId, deadline)
                    : coupleRepository.markAwaitingConfirmedByB(coupleApplicationId, deadline);
            if (updated == 1) {
                eventProducer.publishAfterCommit(new CoupleAwaitingPartner(
                        coupleApplicationId, couple.partnerOf(candidateId), deadline, now));
                count(ConfirmationOutcome.AWAITING_PARTNER);
                log.info("Couple application awaiting partner: coupleApplicationId={}, confirmedBy={}, deadline={}",
                        coupleApplicationId, candidateId, deadline);
                return ConfirmationOutcome.AWAITING_PARTNER;
            }
            // the partner confirmed first in the meantime
            couple = get(coupleApplicationId);
        }

        if (couple.getStatus() != CoupleApplicationStatus.AWAITING_PARTNER) {
            log.debug("Confirmation ignored, already resolved: coupleApplicationId={}, status={}",
                    coupleApplicationId, couple.getStatus());
            return count(ConfirmationOutcome.ALREADY_RESOLVED);
        }
        boolean alreadyConfirmed = couple.isPartnerA(candidateId) ? couple.isConfirmedByA() : couple.isConfirmedByB();
        if (alreadyConfirmed) {
            return ConfirmationOutcome.AWAITING_PARTNER;
        }
        if (!now.isBefore(couple.getDeadline())) {
            return count(expire(coupleApplicationId, now) ? ConfirmationOutcome.EXPIRED : ConfirmationOutcome.ALREADY_RESOLVED);
        }
        return completeConfirmation(couple, now);
    }

    private ConfirmationOutcome completeConfirmation(CoupleApplication couple, Instant now) {
        UUID coupleApplicationId = couple.getId();
        CandidateProfile a = snapshotService.candidate(couple.getCandidateAId());
        CandidateProfile b = snapshotService.candidate(couple.getCandidateBId());
        JobPosting job = snapshotService.publishedJob(couple.getJobId());
        CoupleMatchResult match = scoringService.scoreCouple(a, b, job);

        int updated = coupleRepository.confirmBeforeDeadline(
                coupleApplicationId, now, match.getCombinedScore(), match.getOverlapMode());
        if (updated == 0) {
            log.debug("Second confirmation lost the race: coupleApplicationId={}", coupleApplicationId);
            return count(expire(coupleApplicationId, now) ? ConfirmationOutcome.EXPIRED : ConfirmationOutcome.ALREADY_RESOLVED);
        }

        Application applicationA = materialize(couple, match.getPartnerA());
        Application applicationB = materialize(couple, match.getPartnerB());

        CoupleApplication submitted = get(coupleApplicationId);
        submitted.setStatus(CoupleApplicationStatus.SUBMITTED);
        submitted.setConfirmedByA(true);
        submitted.setConfirmedByB(true);
        submitted.setCombinedScore(match.getCombinedScore());
        submitted.setOverlapMode(match.getOverlapMode());
        submitted.setApplicationAId(applicationA.getId());
        submitted.setApplicationBId(applicationB.getId());
        coupleRepository.save(submitted);

        log.info("Couple application submitted: coupleApplicationId={}, jobId={}, combinedScore={}",
                coupleApplicationId, couple.getJobId(), match.getCombinedScore());
        return count(ConfirmationOutcome.SUBMITTED);
    }

    private Application materialize(CoupleApplication couple, MatchResult partnerMatch) {
        UUID candidateId = partnerMatch.getSubjectId();
        Application application = transitionProcessor.create(Application.builder()
                        .candidateId(candidateId)
                        .jobId(couple.getJobId())
                        .coupleApplicationId(couple.getId())
                        .componentScores(partnerMatch.getComponentScores())
                        .overallScore(partnerMatch.getOverallScore())
                        .build(),
                CONFIRMED_PATH, candidateId.toString(), ActorType.CANDIDATE, null);
        eventProducer.publishAfterCommit(new ApplicationSubmitted(application.getId(), candidateId,
                couple.getJobId(), partnerMatch.getOverallScore(), application.getSubmittedAt()));
        return application;
    }

    @Override
    @Transactional
    public CoupleApplication cancel(UUID coupleApplicationId, UUID candidateId) {
        CoupleApplication couple = get(coupleApplicationId);
        if (!couple.involves(candidateId)) {
            throw new BadRequestException("Candidate " + candidateId + " is not part of couple application " + coupleApplicationId);
        }
        if (!CANCELLABLE.contains(couple.getStatus())) {
            throw new InvalidTransitionException(couple.getStatus(), CoupleApplicationStatus.WITHDRAWN, ActorType.CANDIDATE);
        }

        Instant now = Instant.now(clock);
        if (coupleRepository.cancelIfOpen(coupleApplicationId, now, CANCELLABLE) == 1) {
            eventProducer.publishAfterCommit(
                    new CoupleApplicationResolved(coupleApplicationId, CoupleApplicationStatus.WITHDRAWN, now));
            log.info("Couple application cancelled: coupleApplicationId={}, by={}", coupleApplicationId, candidateId);
        } else {
            log.debug("Cancellation found couple application already resolved: coupleApplicationId={}", coupleApplicationId);
        }
        return get(coupleApplicationId);
    }

    @Override
    @Transactional
    public CoupleApplication withdraw(UUID coupleApplicationId, UUID candidateId, String reason) {
        CoupleApplication couple = get(coupleApplicationId);
        if (!couple.involves(candidateId)) {
            throw new BadRequestException("Candidate " + candidateId + " is not part of couple application " + coupleApplicationId);
        }
        if (CANCELLABLE.contains(couple.getStatus())) {
            return cancel(coupleApplicationId, candidateId);
        }
        stateMachine.assertTransition(couple.getStatus(), CoupleApplicationStatus.WITHDRAWN, ActorType.CANDIDATE);
        lockForUpdate(coupleApplicationId);

        for (Application child : applicationRepository.findByCoupleApplicationId(coupleApplicationId)) {
            if (!child.getStatus().isTerminal()) {
                transitionProcessor.apply(child, ApplicationStatus.WITHDRAWN, candidateId.toString(),
                        ActorType.CANDIDATE, reason);
            }
        }
        refreshProjection(coupleApplicationId);
        return get(coupleApplicationId);
    }

    @Override
    @Transactional
    public CoupleApplication applyEmployerDecision(UUID coupleApplicationId, ApplicationStatus target, String employerId) {
        CoupleApplication couple = lockForUpdate(coupleApplicationId);
        if (couple.getStatus() != CoupleApplicationStatus.SUBMITTED) {
            throw new BadRequestException("Couple application " + coupleApplicationId + " is not under review (status="
                    + couple.getStatus() + ")");
        }
        for (Application child : applicationRepository.findByCoupleApplicationId(coupleApplicationId)) {
            if (!child.getStatus().isTerminal()) {
                transitionProcessor.apply(child, target, employerId, ActorType.EMPLOYER, null);
            }
        }
        refreshProjection(coupleApplicationId);
        return get(coupleApplicationId);
    }

    @Override
    @Transactional
    public CoupleApplicationStatus refreshProjection(UUID coupleApplicationId) {
        // children are read only after the lock, so a concurrent decision on the partner is visible
        CoupleApplication couple = lockForUpdate(coupleApplicationId);
        if (couple.getStatus() != CoupleApplicationStatus.SUBMITTED) {
            return couple.getStatus();
        }
        List<Application> children = applicationRepository.findByCoupleApplicationId(coupleApplicationId);
        if (children.size() != 2) {
            log.warn("Couple application has {} child applications, expected 2: coupleApplicationId={}",
                    children.size(), coupleApplicationId);
            return couple.getStatus();
        }

        Application first = children.get(0);
        Application second = children.get(1);
        CoupleApplicationStatus projected = stateMachine.project(first.getStatus(), second.getStatus());
        if (projected == CoupleApplicationStatus.SUBMITTED) {
            return projected;
        }

        stateMachine.assertTransition(couple.getStatus(), projected, ActorType.SYSTEM);
        Instant now = Instant.now(clock);
        couple.setStatus(projected);
        couple.setResolvedAt(now);
        coupleRepository.save(couple);
        eventProducer.publishAfterCommit(new CoupleApplicationResolved(coupleApplicationId, projected, now));
        meterRegistry.counter("couple_resolutions", Constant.OUTCOME, projected.name()).increment();
        log.info("Couple application resolved: coupleApplicationId={}, outcome={}", coupleApplicationId, projected);
        return projected;
    }

    /**
     * Expires every couple application still waiting on a partner at {@code now}. Safe to run
     * concurrently with confirmations and with itself.
     */
    @Override
    @Transactional
    public int expireOverdue(Instant now) {
        List<UUID> overdue = coupleRepository.findIdsByStatusAndDeadlineAtOrBefore(
                CoupleApplicationStatus.AWAITING_PARTNER, now, PageRequest.of(0, sweepBatchSize));
        int expired = 0;
        for (UUID id : overdue) {
            if (expire(id, now)) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Expired {} couple applications awaiting partner confirmation", expired);
        }
        return expired;
    }

    @Override
    @Transactional(readOnly = true)
    public CoupleApplication get(UUID coupleApplicationId) {
        return coupleRepository.findById(coupleApplicationId)
                .orElseThrow(() -> new NotFoundException("Couple application not found: " + coupleApplicationId));
    }

    private CoupleApplication lockForUpdate(UUID coupleApplicationId) {
        return coupleRepository.findByIdForUpdate(coupleApplicationId)
                .orElseThrow(() -> new NotFoundException("Couple application not found: " + coupleApplicationId));
    }

    private boolean expire(UUID coupleApplicationId, Instant now) {
        if (coupleRepository.expireIfOverdue(coupleApplicationId, now) == 0) {
            return false;
        }
        eventProducer.publishAfterCommit(
                new CoupleApplicationResolved(coupleApplicationId, CoupleApplicationStatus.WITHDRAWN, now));
        meterRegistry.counter("couple_timeouts").increment();
        log.info("Couple application expired: coupleApplicationId={}", coupleApplicationId);
        return true;
    }

    private ConfirmationOutcome count(ConfirmationOutcome outcome) {
        meterRegistry.counter("couple_confirmations", Constant.OUTCOME, outcome.name()).increment();
        return outcome;
    }
}
