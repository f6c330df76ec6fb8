package com.automate.ScanOps.repository;

import com.automate.ScanOps.Models.SmartScanStatus;
import com.automate.ScanOps.entity.SmartScanSessionEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SmartScanSessionRepository extends JpaRepository<SmartScanSessionEntity, UUID> {

    @EntityGraph(attributePaths = {"steps", "scope"})
    @Query("SELECT s FROM SmartScanSessionEntity s WHERE s.sessionId = :id")
    Optional<SmartScanSessionEntity> findWithSteps(@Param("id") UUID id);

    Page<SmartScanSessionEntity> findByUserId(UUID userId, Pageable pageable);
    Page<SmartScanSessionEntity> findByUserIdAndStatus(UUID userId, SmartScanStatus status, Pageable pageable);
    Page<SmartScanSessionEntity> findByStatus(SmartScanStatus status, Pageable pageable);
    List<SmartScanSessionEntity> findByStatus(SmartScanStatus status);
}
