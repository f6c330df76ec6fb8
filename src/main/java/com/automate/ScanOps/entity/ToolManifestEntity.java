package com.automate.ScanOps.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One published version of a tool manifest. Rows are never updated except for the active flag.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Table(name = "tool_manifests",
        uniqueConstraints = @UniqueConstraint(name = "uk_tool_manifest_version", columnNames = {"tool_id", "version"}))
public class ToolManifestEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "manifest_id")
    private UUID manifestId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "tool_id", nullable = false)
    private ToolEntity tool;

    @Column(name = "version", nullable = false, updatable = false)
    private int version;

    @Column(name = "binary_name", nullable = false, updatable = false)
    private String binary;

    // name -> {type, required, enum, pattern, default}
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "args_schema", updatable = false)
    private Map<String, Object> argsSchema;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "command_template", nullable = false, updatable = false)
    private List<String> commandTemplate;

    @Column(name = "timeout_seconds", nullable = false, updatable = false)
    private int timeoutSeconds;

    @Column(name = "memory_limit", nullable = false, updatable = false)
    private int memoryLimit;

    @Column(name = "cpu_limit", nullable = false, updatable = false)
    private double cpuLimit;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_by")
    private UUID createdBy;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
