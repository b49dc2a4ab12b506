package com.safejob.matching.service;

import com.safejob.matching.dto.enums.ApplicationStatus;
import com.safejob.matching.dto.enums.ConfirmationOutcome;
import com.safejob.matching.dto.enums.CoupleApplicationStatus;
import com.safejob.matching.models.CoupleApplication;

import java.time.Instant;
import java.util.UUID;

/**
 * Lifecycle of joint applications: partner confirmation, cancellation, deadline expiry and
 * projection of the two partners' outcomes onto the couple record.
 */
public interface CoupleCoordinator {
    CoupleApplication initiate(UUID jobId, UUID initiatorId, UUID partnerId);

    ConfirmationOutcome confirm(UUID coupleApplicationId, UUID candidateId);

    CoupleApplication cancel(UUID coupleApplicationId, UUID candidateId);

    CoupleApplication withdraw(UUID coupleApplicationId, UUID candidateId, String reason);

    CoupleApplication applyEmployerDecision(UUID coupleApplicationId, ApplicationStatus target, String employerId);

    CoupleApplicationStatus refreshProjection(UUID coupleApplicationId);

    int expireOverdue(Instant now);

    CoupleApplication get(UUID coupleApplicationId);
}
