package com.safejob.matching.service;

import com.safejob.matching.dto.enums.ActorType;
import com.safejob.matching.dto.enums.ApplicationStatus;
import com.safejob.matching.models.Application;
import com.safejob.matching.models.ApplicationStatusHistory;

import java.util.List;
import java.util.UUID;

public interface ApplicationService {
    Application createDraft(UUID candidateId, UUID jobId);

    Application submit(UUID applicationId, UUID candidateId);

    Application apply(UUID candidateId, UUID jobId);

    /**
     * Applies a review or withdrawal step. {@code SUBMITTED} and {@code AWAITING_PARTNER} are not
     * valid targets here; use {@link #submit} or the couple confirmation flow.
     */
    Application transition(UUID applicationId, ApplicationStatus target, String actor, ActorType actorType, String reason);

    Application withdraw(UUID applicationId, UUID candidateId, String reason);

    Application get(UUID applicationId);

    List<Application> findByCandidate(UUID candidateId);

    List<Application> findByJob(UUID jobId);

    List<ApplicationStatusHistory> history(UUID applicationId);
}
