package com.safejob.matching.processors;

import com.safejob.matching.async.MatchingEventProducer;
import com.safejob.matching.dto.enums.ActorType;
import com.safejob.matching.dto.enums.ApplicationStatus;
import com.safejob.matching.dto.events.ApplicationStatusChanged;
import com.safejob.matching.models.Application;
import com.safejob.matching.models.ApplicationStatusHistory;
import com.safejob.matching.repo.ApplicationRepository;
import com.safejob.matching.repo.ApplicationStatusHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Applies status changes to individual applications: validates against the state machine, writes
 * the new status and its audit row, and queues the change event for after commit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationTransitionProcessor {
    private final ApplicationStateMachine stateMachine;
    private final ApplicationRepository applicationRepository;
    private final ApplicationStatusHistoryRepository historyRepository;
    private final MatchingEventProducer eventProducer;
    private final Clock clock;

    public Application apply(Application application, ApplicationStatus target, String actor,
                             ActorType actorType, String reason) {
        ApplicationStatus from = application.getStatus();
        stateMachine.assertTransition(from, target, actorType);

        Instant now = Instant.now(clock);
        application.setStatus(target);
        application.setUpdatedAt(now);
        if (target == ApplicationStatus.SUBMITTED) {
            application.setSubmittedAt(now);
        }
        Application saved = applicationRepository.save(application);
        record(saved, from, target, actor, actorType, reason, now);

        log.info("Application transitioned: applicationId={}, {} -> {}, actorType={}",
                saved.getId(), from, target, actorType);
        return saved;
    }

    /**
     * Persists a new application that walks {@code path} in one write, auditing every step.
     * The first element is the status the record is created in.
     */
    public Application create(Application application, List<ApplicationStatus> path, String actor,
                              ActorType actorType, String reason) {
        for (int i = 1; i < path.size(); i++) {
            stateMachine.assertTransition(path.get(i - 1), path.get(i), actorType);
        }

        Instant now = Instant.now(clock);
        ApplicationStatus finalStatus = path.get(path.size() - 1);
        application.setStatus(finalStatus);
        application.setCreatedAt(now);
        application.setUpdatedAt(now);
        if (path.contains(ApplicationStatus.SUBMITTED)) {
            application.setSubmittedAt(now);
        }
        Application saved = applicationRepository.save(application);

        record(saved, null, path.get(0), actor, actorType, reason, now);
        for (int i = 1; i < path.size(); i++) {
            record(saved, path.get(i - 1), path.get(i), actor, actorType, reason, now);
        }
        return saved;
    }

    private void record(Application application, ApplicationStatus from, ApplicationStatus to, String actor,
                        ActorType actorType, String reason, Instant at) {
        historyRepository.save(ApplicationStatusHistory.builder()
                .applicationId(application.getId())
                .fromState(from)
                .toState(to)
                .actor(actor)
                .actorType(actorType)
                .reason(reason)
                .changedAt(at)
                .build());
        if (from != null) {
            eventProducer.publishAfterCommit(
                    new ApplicationStatusChanged(application.getId(), from, to, actor, actorType, at));
        }
    }
}
