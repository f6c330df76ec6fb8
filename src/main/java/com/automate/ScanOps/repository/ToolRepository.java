package com.automate.ScanOps.repository;

import com.automate.ScanOps.entity.ToolEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ToolRepository extends JpaRepository<ToolEntity, UUID> {
    Optional<ToolEntity> findBySlug(String slug);
    boolean existsBySlug(String slug);
    List<ToolEntity> findAllByOrderByCategoryAscSlugAsc();
}
