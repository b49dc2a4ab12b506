package com.safejob.matching.client;

import com.safejob.matching.dto.JobPosting;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to job snapshots owned by the job service. Returns the posting whatever its
 * status; callers decide whether it is matchable.
 */
public interface JobSnapshotClient {

    Optional<JobPosting> fetch(UUID jobId);
}
