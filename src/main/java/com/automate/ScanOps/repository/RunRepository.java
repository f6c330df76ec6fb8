package com.automate.ScanOps.repository;

import com.automate.ScanOps.Models.RunStatus;
import com.automate.ScanOps.entity.RunEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface RunRepository extends JpaRepository<RunEntity, UUID> {
    Page<RunEntity> findByUserId(UUID userId, Pageable pageable);
    Page<RunEntity> findByUserIdAndStatus(UUID userId, RunStatus status, Pageable pageable);
    Page<RunEntity> findByStatus(RunStatus status, Pageable pageable);
    List<RunEntity> findByStatusIn(Collection<RunStatus> statuses);
    List<RunEntity> findBySmartScanIdOrderByCreatedAtAsc(UUID smartScanId);

    /** Conditional status change; returns 0 when the run was no longer in {@code from}. */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE RunEntity r SET r.status = :to, r.startedAt = :now WHERE r.runId = :id AND r.status = :from")
    int markStarted(@Param("id") UUID id,
                    @Param("from") RunStatus from,
                    @Param("to") RunStatus to,
                    @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE RunEntity r SET r.status = :to, r.completedAt = :now, r.errorMessage = :message, r.durationSeconds = 0 " +
            "WHERE r.runId = :id AND r.status = :from")
    int finishEarly(@Param("id") UUID id,
                    @Param("from") RunStatus from,
                    @Param("to") RunStatus to,
                    @Param("message") String message,
                    @Param("now") LocalDateTime now);
}
