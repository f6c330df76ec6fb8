package com.automate.ScanOps.repository;

import com.automate.ScanOps.entity.SmartScanStepEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SmartScanStepRepository extends JpaRepository<SmartScanStepEntity, UUID> {
    List<SmartScanStepEntity> findBySession_SessionIdOrderByStepNumberAsc(UUID sessionId);
}
