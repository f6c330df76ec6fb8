package com.automate.ScanOps.repository;

import com.automate.ScanOps.entity.ToolManifestEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ToolManifestRepository extends JpaRepository<ToolManifestEntity, UUID> {
    Optional<ToolManifestEntity> findByTool_ToolIdAndActiveTrue(UUID toolId);
    List<ToolManifestEntity> findByTool_ToolIdOrderByVersionDesc(UUID toolId);

    @Query("SELECT COALESCE(MAX(m.version), 0) FROM ToolManifestEntity m WHERE m.tool.toolId = :toolId")
    int findMaxVersion(@Param("toolId") UUID toolId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ToolManifestEntity m SET m.active = false WHERE m.tool.toolId = :toolId AND m.active = true")
    int deactivateAll(@Param("toolId") UUID toolId);
}
