package com.elis.analysis.repository;

import com.elis.analysis.model.Job;
import com.elis.analysis.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface JobRepository extends JpaRepository<Job, UUID> {

    List<Job> findByUser_IdOrderByCreatedAtDesc(UUID userId);

    List<Job> findByStatusAndLeaseExpiresAtBefore(JobStatus status, Instant cutoff);

    List<Job> findByStatusAndDispatchedAtIsNullAndNextAttemptAtBefore(JobStatus status, Instant cutoff);

    @Modifying
    @Query("update Job j set j.dispatchedAt = :at "
            + "where j.id = :id and j.status = :status and j.retryCount = :retryCount")
    int markDispatched(@Param("id") UUID id, @Param("status") JobStatus status,
                       @Param("retryCount") int retryCount, @Param("at") Instant at);

    List<Job> findBySubjectIdIn(Collection<UUID> subjectIds);

    @Modifying
    @Query("delete from Job j where j.subjectId in :subjectIds")
    int deleteBySubjectIdIn(@Param("subjectIds") Collection<UUID> subjectIds);
}
