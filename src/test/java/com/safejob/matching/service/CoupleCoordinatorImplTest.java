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
import com.safejob.matching.dto.enums.CoupleLinkStatus;
import com.safejob.matching.dto.enums.JobStatus;
import com.safejob.matching.dto.enums.OverlapMode;
import com.safejob.matching.dto.enums.ScoreComponent;
import com.safejob.matching.dto.enums.SubjectType;
import com.safejob.matching.dto.events.CoupleApplicationResolved;
import com.safejob.matching.dto.events.CoupleAwaitingPartner;
import com.safejob.matching.exceptions.BadRequestException;
import com.safejob.matching.exceptions.InvalidTransitionException;
import com.safejob.matching.models.Application;
import com.safejob.matching.models.CoupleApplication;
import com.safejob.matching.processors.ApplicationStateMachine;
import com.safejob.matching.processors.ApplicationTransitionProcessor;
import com.safejob.matching.repo.ApplicationRepository;
import com.safejob.matching.repo.ApplicationStatusHistoryRepository;
import com.safejob.matching.repo.CoupleApplicationRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CoupleCoordinatorImplTest {

    private static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    private final Map<UUID, CoupleApplication> couples = new HashMap<>();
    private final Map<UUID, Application> applications = new HashMap<>();

    private CoupleApplicationRepository coupleRepository;
    private ApplicationRepository applicationRepository;
    private ApplicationStatusHistoryRepository historyRepository;
    private SnapshotService snapshotService;
    private MatchScoringService scoringService;
    private MatchingEventProducer eventProducer;
    private SimpleMeterRegistry meterRegistry;
    private final ApplicationStateMachine stateMachine = new ApplicationStateMachine();

    private UUID jobId;
    private UUID aId;
    private UUID bId;
    private CandidateProfile a;
    private CandidateProfile b;
    private JobPosting job;

    @BeforeEach
    void setUp() {
        coupleRepository = mock(CoupleApplicationRepository.class);
        applicationRepository = mock(ApplicationRepository.class);
        historyRepository = mock(ApplicationStatusHistoryRepository.class);
        snapshotService = mock(SnapshotService.class);
        scoringService = mock(MatchScoringService.class);
        eventProducer = mock(MatchingEventProducer.class);
        meterRegistry = new SimpleMeterRegistry();

        jobId = UUID.randomUUID();
        aId = UUID.randomUUID();
        bId = UUID.randomUUID();
        a = CandidateProfile.builder().id(aId).partnerId(bId).coupleStatus(CoupleLinkStatus.LINKED).build();
        b = CandidateProfile.builder().id(bId).partnerId(aId).coupleStatus(CoupleLinkStatus.LINKED).build();
        job = JobPosting.builder().id(jobId).status(JobStatus.PUBLISHED).coupleFriendly(true).build();
        when(snapshotService.candidate(aId)).thenReturn(a);
        when(snapshotService.candidate(bId)).thenReturn(b);
        when(snapshotService.publishedJob(jobId)).thenReturn(job);
        when(scoringService.scoreCouple(a, b, job)).thenReturn(coupleMatch());

        stubApplicationStore();
        stubCoupleStore();
    }

    private CoupleCoordinatorImpl coordinatorAt(Instant now) {
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        ApplicationTransitionProcessor processor = new ApplicationTransitionProcessor(
                stateMachine, applicationRepository, historyRepository, eventProducer, clock);
        return new CoupleCoordinatorImpl(coupleRepository, applicationRepository, stateMachine, processor,
                snapshotService, scoringService, eventProducer, meterRegistry, clock, Duration.ofHours(24), 500);
    }

    private CoupleMatchResult coupleMatch() {
        return CoupleMatchResult.builder()
                .coupleId(UUID.randomUUID())
                .jobId(jobId)
                .candidateAId(aId)
                .candidateBId(bId)
                .overlapMode(OverlapMode.EITHER)
                .partnerA(partnerMatch(aId, 71.0))
                .partnerB(partnerMatch(bId, 65.0))
                .combinedScore(73.0)
                .computedAt(T0)
                .build();
    }

    private MatchResult partnerMatch(UUID candidateId, double overall) {
        return MatchResult.builder()
                .subjectId(candidateId)
                .subjectType(SubjectType.CANDIDATE)
                .jobId(jobId)
                .componentScores(Map.of(ScoreComponent.SKILLS, 80.0))
                .overallScore(overall)
                .configVersion("v")
                .computedAt(T0)
                .build();
    }

    private void stubApplicationStore() {
        when(applicationRepository.save(any(Application.class))).thenAnswer(inv -> {
            Application app = inv.getArgument(0);
            if (app.getId() == null) app.setId(UUID.randomUUID());
            applications.put(app.getId(), app);
            return app;
        });
        when(applicationRepository.findById(any(UUID.class)))
                .thenAnswer(inv -> Optional.ofNullable(applications.get(inv.<UUID>getArgument(0))));
        when(applicationRepository.findByCoupleApplicationId(any(UUID.class))).thenAnswer(inv -> {
            UUID coupleId = inv.getArgument(0);
            return applications.values().stream()
                    .filter(app -> coupleId.equals(app.getCoupleApplicationId()))
                    .collect(Collectors.toList());
        });
    }

    // Conditional updates behave like their WHERE clauses against the in-memory rows.
    private void stubCoupleStore() {
        when(coupleRepository.save(any(CoupleApplication.class))).thenAnswer(inv -> {
            CoupleApplication c = inv.getArgument(0);
            if (c.getId() == null) c.setId(UUID.randomUUID());
            couples.put(c.getId(), c);
            return c;
        });
        when(coupleRepository.findById(any(UUID.class)))
                .thenAnswer(inv -> Optional.ofNullable(couples.get(inv.<UUID>getArgument(0))));
        when(coupleRepository.findByIdForUpdate(any(UUID.class)))
                .thenAnswer(inv -> Optional.ofNullable(couples.get(inv.<UUID>getArgument(0))));
        when(coupleRepository.markAwaitingConfirmedByA(any(UUID.class), any(Instant.class)))
                .thenAnswer(inv -> markAwaiting(inv.getArgument(0), inv.getArgument(1), true));
        when(coupleRepository.markAwaitingConfirmedByB(any(UUID.class), any(Instant.class)))
                .thenAnswer(inv -> markAwaiting(inv.getArgument(0), inv.getArgument(1), false));
        when(coupleRepository.confirmBeforeDeadline(any(UUID.class), any(Instant.class), any(), any()))
                .thenAnswer(inv -> {
                    CoupleApplication c = couples.get(inv.<UUID>getArgument(0));
                    Instant now = inv.getArgument(1);
                    if (c.getStatus() != CoupleApplicationStatus.AWAITING_PARTNER || !c.getDeadline().isAfter(now)) {
                        return 0;
                    }
                    c.setStatus(CoupleApplicationStatus.SUBMITTED);
                    c.setConfirmedByA(true);
                    c.setConfirmedByB(true);
                    c.setCombinedScore(inv.getArgument(2));
                    c.setOverlapMode(inv.getArgument(3));
                    return 1;
                });
        when(coupleRepository.expireIfOverdue(any(UUID.class), any(Instant.class))).thenAnswer(inv -> {
            CoupleApplication c = couples.get(inv.<UUID>getArgument(0));
            Instant now = inv.getArgument(1);
            if (c.getStatus() != CoupleApplicationStatus.AWAITING_PARTNER || c.getDeadline().isAfter(now)) {
                return 0;
            }
            c.setStatus(CoupleApplicationStatus.WITHDRAWN);
            c.setResolvedAt(now);
            return 1;
        });
        when(coupleRepository.cancelIfOpen(any(UUID.class), any(Instant.class), anyCollection())).thenAnswer(inv -> {
            CoupleApplication c = couples.get(inv.<UUID>getArgument(0));
            Collection<CoupleApplicationStatus> open = inv.getArgument(2);
            if (!open.contains(c.getStatus())) {
                return 0;
            }
            c.setStatus(CoupleApplicationStatus.WITHDRAWN);
            c.setResolvedAt(inv.getArgument(1));
            return 1;
        });
        when(coupleRepository.findIdsByStatusAndDeadlineAtOrBefore(eq(CoupleApplicationStatus.AWAITING_PARTNER),
                any(Instant.class), any(Pageable.class))).thenAnswer(inv -> {
            Instant now = inv.getArgument(1);
            return couples.values().stream()
                    .filter(c -> c.getStatus() == CoupleApplicationStatus.AWAITING_PARTNER && !c.getDeadline().isAfter(now))
                    .map(CoupleApplication::getId)
                    .collect(Collectors.toList());
        });
    }

    private int markAwaiting(UUID id, Instant deadline, boolean partnerA) {
        CoupleApplication c = couples.get(id);
        if (c.getStatus() != CoupleApplicationStatus.DRAFT) return 0;
        c.setStatus(CoupleApplicationStatus.AWAITING_PARTNER);
        c.setDeadline(deadline);
        if (partnerA) c.setConfirmedByA(true);
        else c.setConfirmedByB(true);
        return 1;
    }

    private double counter(String name, String outcome) {
        return meterRegistry.counter(name, "outcome", outcome).count();
    }

    // ===== Initiate =====

    @Test
    void shouldCreateDraftForLinkedPartners() {
        CoupleApplication couple = coordinatorAt(T0).initiate(jobId, aId, bId);

        assertEquals(CoupleApplicationStatus.DRAFT, couple.getStatus());
        assertEquals(aId, couple.getCandidateAId());
        assertEquals(bId, couple.getCandidateBId());
        assertTrue(couple.getPairLowId().compareTo(couple.getPairHighId()) <= 0);
        assertFalse(couple.isConfirmedByA());
        assertNull(couple.getDeadline());
    }

    @Test
    void shouldRejectCandidatesWhoAreNotMutuallyLinked() {
        b.setPartnerId(UUID.randomUUID());

        assertThrows(BadRequestException.class, () -> coordinatorAt(T0).initiate(jobId, aId, bId));
    }

    @Test
    void shouldRejectJobsClosedToCouples() {
        job.setCoupleFriendly(false);
        job.setMustBeCouple(false);

        assertThrows(BadRequestException.class, () -> coordinatorAt(T0).initiate(jobId, aId, bId));
    }

    @Test
    void shouldRejectWhenCouplePositionsAreFilled() {
        job.setMaxCouplePositions(2);
        when(coupleRepository.countByJobIdAndStatus(jobId, CoupleApplicationStatus.BOTH_ACCEPTED)).thenReturn(2L);

        assertThrows(BadRequestException.class, () -> coordinatorAt(T0).initiate(jobId, aId, bId));
    }

    @Test
    void shouldRejectSecondApplicationForSamePair() {
        CoupleApplication existing = coordinatorAt(T0).initiate(jobId, aId, bId);
        when(coupleRepository.findByJobIdAndPairLowIdAndPairHighId(jobId, existing.getPairLowId(), existing.getPairHighId()))
                .thenReturn(Optional.of(existing));

        assertThrows(BadRequestException.class, () -> coordinatorAt(T0).initiate(jobId, bId, aId));
    }

    // ===== Confirmation =====

    @Test
    void shouldAwaitPartnerAfterFirstConfirmation() {
        UUID id = coordinatorAt(T0).initiate(jobId, aId, bId).getId();

        ConfirmationOutcome outcome = coordinatorAt(T0).confirm(id, aId);

        assertEquals(ConfirmationOutcome.AWAITING_PARTNER, outcome);
        assertEquals(T0.plus(Duration.ofHours(24)), couples.get(id).getDeadline());
        verify(eventProducer).publishAfterCommit(new CoupleAwaitingPartner(id, bId, T0.plus(Duration.ofHours(24)), T0));
        assertTrue(applications.isEmpty());
    }

    @Test
    void shouldSubmitWhenPartnerConfirmsOneMinuteBeforeDeadline() {
        UUID id = coordinatorAt(T0).initiate(jobId, aId, bId).getId();
        coordinatorAt(T0).confirm(id, aId);

        ConfirmationOutcome outcome = coordinatorAt(T0.plus(Duration.ofHours(23).plusMinutes(59))).confirm(id, bId);

        assertEquals(ConfirmationOutcome.SUBMITTED, outcome);
        CoupleApplication couple = couples.get(id);
        assertEquals(CoupleApplicationStatus.SUBMITTED, couple.getStatus());
        assertEquals(73.0, couple.getCombinedScore());
        assertNotNull(couple.getApplicationAId());
        assertNotNull(couple.getApplicationBId());

        Application childA = applications.get(couple.getApplicationAId());
        Application childB = applications.get(couple.getApplicationBId());
        assertEquals(ApplicationStatus.SUBMITTED, childA.getStatus());
        assertEquals(ApplicationStatus.SUBMITTED, childB.getStatus());
        assertEquals(aId, childA.getCandidateId());
        assertEquals(71.0, childA.getOverallScore());
        assertEquals(65.0, childB.getOverallScore());
        assertEquals(1.0, counter("couple_confirmations", "SUBMITTED"));
    }

    @Test
    void shouldWithdrawOnSweepAfterDeadlinePasses() {
        UUID id = coordinatorAt(T0).initiate(jobId, aId, bId).getId();
        coordinatorAt(T0).confirm(id, aId);
        Instant sweepAt = T0.plus(Duration.ofHours(24).plusMinutes(1));

        int expired = coordinatorAt(sweepAt).expireOverdue(sweepAt);

        assertEquals(1, expired);
        assertEquals(CoupleApplicationStatus.WITHDRAWN, couples.get(id).getStatus());
        assertTrue(applications.isEmpty());
        verify(eventProducer).publishAfterCommit(
                new CoupleApplicationResolved(id, CoupleApplicationStatus.WITHDRAWN, sweepAt));
        assertEquals(1.0, meterRegistry.counter("couple_timeouts").count());
    }

    @Test
    void shouldBeIdempotentWhenSweepRunsTwice() {
        UUID id = coordinatorAt(T0).initiate(jobId, aId, bId).getId();
        coordinatorAt(T0).confirm(id, aId);
        Instant sweepAt = T0.plus(Duration.ofHours(25));

        coordinatorAt(sweepAt).expireOverdue(sweepAt);
        int second = coordinatorAt(sweepAt).expireOverdue(sweepAt);

        assertEquals(0, second);
        assertEquals(1.0, meterRegistry.counter("couple_timeouts").count());
    }

    @Test
    void shouldNotExpireBeforeDeadline() {
        UUID id = coordinatorAt(T0).initiate(jobId, aId, bId).getId();
        coordinatorAt(T0).confirm(id, aId);
        Instant early = T0.plus(Duration.ofHours(23));

        assertEquals(0, coordinatorAt(early).expireOverdue(early));
        assertEquals(CoupleApplicationStatus.AWAITING_PARTNER, couples.get(id).getStatus());
    }

    @Test
    void shouldExpireInsteadOfSubmittingLateConfirmation() {
        UUID id = coordinatorAt(T0).initiate(jobId, aId, bId).getId();
        coordinatorAt(T0).confirm(id, aId);

        ConfirmationOutcome outcome = coordinatorAt(T0.plus(Duration.ofHours(24))).confirm(id, bId);

        assertEquals(ConfirmationOutcome.EXPIRED, outcome);
        assertEquals(CoupleApplicationStatus.WITHDRAWN, couples.get(id).getStatus());
        verify(coupleRepository, never()).confirmBeforeDeadline(any(UUID.class), any(Instant.class), any(), any());
        assertTrue(applications.isEmpty());
    }

    @Test
    void shouldReportAlreadyResolvedWhenConfirmationLosesRace() {
        UUID id = coordinatorAt(T0).initiate(jobId, aId, bId).getId();
        coordinatorAt(T0).confirm(id, aId);
        doAnswer(inv -> {
            // partner A cancelled between the read and the conditional write
            couples.get(id).setStatus(CoupleApplicationStatus.WITHDRAWN);
            return 0;
        }).when(coupleRepository).confirmBeforeDeadline(any(UUID.class), any(Instant.class), any(), any());

        ConfirmationOutcome outcome = coordinatorAt(T0.plus(Duration.ofHours(1))).confirm(id, bId);

        assertEquals(ConfirmationOutcome.ALREADY_RESOLVED, outcome);
        assertTrue(applications.isEmpty());
        assertEquals(1.0, counter("couple_confirmations", "ALREADY_RESOLVED"));
    }

    @Test
    void shouldTreatRepeatedConfirmationBySamePartnerAsNoOp() {
        UUID id = coordinatorAt(T0).initiate(jobId, aId, bId).getId();
        coordinatorAt(T0).confirm(id, aId);

        ConfirmationOutcome outcome = coordinatorAt(T0.plus(Duration.ofHours(2))).confirm(id, aId);

        assertEquals(ConfirmationOutcome.AWAITING_PARTNER, outcome);
        assertEquals(T0.plus(Duration.ofHours(24)), couples.get(id).getDeadline());
    }

    @Test
    void shouldRejectConfirmationFromOutsider() {
        UUID id = coordinatorAt(T0).initiate(jobId, aId, bId).getId();

        assertThrows(BadRequestException.class, () -> coordinatorAt(T0).confirm(id, UUID.randomUUID()));
    }

    // ===== Cancel / withdraw =====

    @Test
    void shouldCancelWhileAwaitingPartner() {
        UUID id = coordinatorAt(T0).initiate(jobId, aId, bId).getId();
        coordinatorAt(T0).confirm(id, aId);

        CoupleApplication cancelled = coordinatorAt(T0.plusSeconds(60)).cancel(id, bId);

        assertEquals(CoupleApplicationStatus.WITHDRAWN, cancelled.getStatus());
        assertTrue(applications.isEmpty());
        verify(eventProducer).publishAfterCommit(
                new CoupleApplicationResolved(id, CoupleApplicationStatus.WITHDRAWN, T0.plusSeconds(60)));
    }

    @Test
    void shouldRefuseToCancelSubmittedApplication() {
        UUID id = submittedCouple();

        assertThrows(InvalidTransitionException.class, () -> coordinatorAt(T0.plusSeconds(120)).cancel(id, aId));
    }

    @Test
    void shouldWithdrawBothChildrenAfterSubmission() {
        UUID id = submittedCouple();

        CoupleApplication result = coordinatorAt(T0.plusSeconds(300)).withdraw(id, aId, "moving abroad");

        assertEquals(CoupleApplicationStatus.WITHDRAWN, result.getStatus());
        applications.values().forEach(app -> assertEquals(ApplicationStatus.WITHDRAWN, app.getStatus()));
    }

    // ===== Projection =====

    @Test
    void shouldProjectSplitDecisionWhenEmployerAcceptsOnlyOnePartner() {
        UUID id = submittedCouple();
        CoupleApplication couple = couples.get(id);
        Application childA = applications.get(couple.getApplicationAId());
        Application childB = applications.get(couple.getApplicationBId());
        childA.setStatus(ApplicationStatus.OFFERED);
        childB.setStatus(ApplicationStatus.INTERVIEW_SCHEDULED);

        CoupleCoordinatorImpl coordinator = coordinatorAt(T0.plusSeconds(600));
        ApplicationTransitionProcessor processor = new ApplicationTransitionProcessor(stateMachine,
                applicationRepository, historyRepository, eventProducer, Clock.fixed(T0.plusSeconds(600), ZoneOffset.UTC));
        ApplicationServiceImpl applicationService = new ApplicationServiceImpl(applicationRepository, historyRepository,
                processor, snapshotService, scoringService, coordinator, eventProducer,
                Clock.fixed(T0.plusSeconds(600), ZoneOffset.UTC));

        applicationService.transition(childA.getId(), ApplicationStatus.ACCEPTED, "employer-1", ActorType.EMPLOYER, null);
        assertEquals(CoupleApplicationStatus.SUBMITTED, couples.get(id).getStatus());

        applicationService.transition(childB.getId(), ApplicationStatus.REJECTED, "employer-1", ActorType.EMPLOYER, null);

        assertEquals(CoupleApplicationStatus.SPLIT_DECISION, couples.get(id).getStatus());
        assertTrue(childA.getStatus().isTerminal());
        assertTrue(childB.getStatus().isTerminal());
        verify(eventProducer).publishAfterCommit(
                new CoupleApplicationResolved(id, CoupleApplicationStatus.SPLIT_DECISION, T0.plusSeconds(600)));
    }

    @Test
    void shouldResolveWhenPartnerDecisionCommitsWhileWaitingForCoupleLock() {
        UUID id = submittedCouple();
        CoupleApplication couple = couples.get(id);
        Application childA = applications.get(couple.getApplicationAId());
        Application childB = applications.get(couple.getApplicationBId());
        childA.setStatus(ApplicationStatus.OFFERED);
        childB.setStatus(ApplicationStatus.OFFERED);
        doAnswer(inv -> {
            // the employer's rejection of partner B commits while this transaction waits for the row lock
            childB.setStatus(ApplicationStatus.REJECTED);
            return Optional.ofNullable(couples.get(inv.<UUID>getArgument(0)));
        }).when(coupleRepository).findByIdForUpdate(id);

        Instant decidedAt = T0.plusSeconds(900);
        Clock clock = Clock.fixed(decidedAt, ZoneOffset.UTC);
        ApplicationTransitionProcessor processor = new ApplicationTransitionProcessor(stateMachine,
                applicationRepository, historyRepository, eventProducer, clock);
        ApplicationServiceImpl applicationService = new ApplicationServiceImpl(applicationRepository, historyRepository,
                processor, snapshotService, scoringService, coordinatorAt(decidedAt), eventProducer, clock);

        applicationService.transition(childA.getId(), ApplicationStatus.ACCEPTED, "employer-1", ActorType.EMPLOYER, null);

        assertEquals(CoupleApplicationStatus.SPLIT_DECISION, couples.get(id).getStatus());
        verify(eventProducer).publishAfterCommit(
                new CoupleApplicationResolved(id, CoupleApplicationStatus.SPLIT_DECISION, decidedAt));
        InOrder order = inOrder(coupleRepository, applicationRepository);
        order.verify(coupleRepository).findByIdForUpdate(id);
        order.verify(applicationRepository).findByCoupleApplicationId(id);
    }

    @Test
    void shouldLockCoupleBeforeApplyingEmployerDecision() {
        UUID id = submittedCouple();

        coordinatorAt(T0.plusSeconds(60)).applyEmployerDecision(id, ApplicationStatus.VIEWED, "employer-1");

        InOrder order = inOrder(coupleRepository, applicationRepository);
        order.verify(coupleRepository).findByIdForUpdate(id);
        order.verify(applicationRepository).findByCoupleApplicationId(id);
    }

    @Test
    void shouldApplyEmployerDecisionToEachChild() {
        UUID id = submittedCouple();

        coordinatorAt(T0.plusSeconds(60)).applyEmployerDecision(id, ApplicationStatus.VIEWED, "employer-1");

        applications.values().forEach(app -> assertEquals(ApplicationStatus.VIEWED, app.getStatus()));
        assertEquals(CoupleApplicationStatus.SUBMITTED, couples.get(id).getStatus());
    }

    private UUID submittedCouple() {
        UUID id = coordinatorAt(T0).initiate(jobId, aId, bId).getId();
        coordinatorAt(T0).confirm(id, aId);
        assertEquals(ConfirmationOutcome.SUBMITTED, coordinatorAt(T0.plusSeconds(30)).confirm(id, bId));
        return id;
    }
}
