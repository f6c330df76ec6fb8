package com.automate.ScanOps.repository;

import com.automate.ScanOps.entity.SmartScanFindingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SmartScanFindingRepository extends JpaRepository<SmartScanFindingEntity, UUID> {
    List<SmartScanFindingEntity> findBySession_SessionIdOrderByCreatedAtAsc(UUID sessionId);
}
