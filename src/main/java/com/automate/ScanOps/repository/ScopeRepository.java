package com.automate.ScanOps.repository;

import com.automate.ScanOps.entity.ScopeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ScopeRepository extends JpaRepository<ScopeEntity, UUID> {
    List<ScopeEntity> findByActiveTrueOrderByNameAsc();
}
