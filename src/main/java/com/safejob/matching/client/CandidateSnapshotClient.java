package com.safejob.matching.client;

import com.safejob.matching.dto.CandidateProfile;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to candidate snapshots owned by the profile service.
 */
public interface CandidateSnapshotClient {

    Optional<CandidateProfile> fetch(UUID candidateId);
}
