package com.safejob.matching.repo;

import com.safejob.matching.dto.enums.CoupleApplicationStatus;
import com.safejob.matching.dto.enums.OverlapMode;
import com.safejob.matching.models.CoupleApplication;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes that decide a couple application's outcome are single conditional statements, so a
 * late confirmation and the timeout sweep can never both succeed on the same row.
 */
@Repository
public interface CoupleApplicationRepository extends JpaRepository<CoupleApplication, UUID> {

    Optional<CoupleApplication> findByJobIdAndPairLowIdAndPairHighId(UUID jobId, UUID pairLowId, UUID pairHighId);

    /**
     * Row lock held until the surrounding transaction ends. Child decisions that re-project the
     * couple serialize here, so the last one always sees both children's committed states.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CoupleApplication c WHERE c.id = :id")
    Optional<CoupleApplication> findByIdForUpdate(@Param("id") UUID id);

    long countByJobIdAndStatus(UUID jobId, CoupleApplicationStatus status);

    @Query("SELECT c.id FROM CoupleApplication c WHERE c.status = :status AND c.deadline <= :now ORDER BY c.deadline")
    List<UUID> findIdsByStatusAndDeadlineAtOrBefore(@Param("status") CoupleApplicationStatus status,
                                                     @Param("now") Instant now,
                                                     Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CoupleApplication c SET c.status = com.safejob.matching.dto.enums.CoupleApplicationStatus.SUBMITTED, " +
            "c.confirmedByA = true, c.confirmedByB = true, c.combinedScore = :combinedScore, " +
            "c.overlapMode = :overlapMode, c.version = c.version + 1 " +
            "WHERE c.id = :id AND c.status = com.safejob.matching.dto.enums.CoupleApplicationStatus.AWAITING_PARTNER " +
            "AND c.deadline > :now")
    int confirmBeforeDeadline(@Param("id") UUID id,
                              @Param("now") Instant now,
                              @Param("combinedScore") Double combinedScore,
                              @Param("overlapMode") OverlapMode overlapMode);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CoupleApplication c SET c.status = com.safejob.matching.dto.enums.CoupleApplicationStatus.WITHDRAWN, " +
            "c.resolvedAt = :now, c.version = c.version + 1 " +
            "WHERE c.id = :id AND c.status = com.safejob.matching.dto.enums.CoupleApplicationStatus.AWAITING_PARTNER " +
            "AND c.deadline <= :now")
    int expireIfOverdue(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CoupleApplication c SET c.status = com.safejob.matching.dto.enums.CoupleApplicationStatus.WITHDRAWN, " +
            "c.resolvedAt = :now, c.version = c.version + 1 " +
            "WHERE c.id = :id AND c.status IN :cancellable")
    int cancelIfOpen(@Param("id") UUID id,
                     @Param("now") Instant now,
                     @Param("cancellable") Collection<CoupleApplicationStatus> cancellable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CoupleApplication c SET c.status = com.safejob.matching.dto.enums.CoupleApplicationStatus.AWAITING_PARTNER, " +
            "c.confirmedByA = true, c.deadline = :deadline, c.version = c.version + 1 " +
            "WHERE c.id = :id AND c.status = com.safejob.matching.dto.enums.CoupleApplicationStatus.DRAFT")
    int markAwaitingConfirmedByA(@Param("id") UUID id, @Param("deadline") Instant deadline);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CoupleApplication c SET c.status = com.safejob.matching.dto.enums.CoupleApplicationStatus.AWAITING_PARTNER, " +
            "c.confirmedByB = true, c.deadline = :deadline, c.version = c.version + 1 " +
            "WHERE c.id = :id AND c.status = com.safejob.matching.dto.enums.CoupleApplicationStatus.DRAFT")
    int markAwaitingConfirmedByB(@Param("id") UUID id, @Param("deadline") Instant deadline);
}
