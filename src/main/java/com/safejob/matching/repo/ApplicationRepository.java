package com.safejob.matching.repo;

import com.safejob.matching.dto.enums.ApplicationStatus;
import com.safejob.matching.models.Application;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ApplicationRepository extends JpaRepository<Application, UUID> {

    List<Application> findByCandidateIdOrderByCreatedAtDesc(UUID candidateId);

    List<Application> findByJobIdOrderByCreatedAtDesc(UUID jobId);

    List<Application> findByCoupleApplicationId(UUID coupleApplicationId);

    @Query("SELECT CASE WHEN COUNT(a) > 0 THEN true ELSE false END FROM Application a " +
            "WHERE a.candidateId = :candidateId AND a.jobId = :jobId AND a.status NOT IN :excluded")
    boolean existsActive(@Param("candidateId") UUID candidateId,
                         @Param("jobId") UUID jobId,
                         @Param("excluded") Collection<ApplicationStatus> excluded);
}
