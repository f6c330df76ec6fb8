package com.automate.ScanOps.entity;

import com.automate.ScanOps.Models.RunStatus;
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

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Table(name = "runs", indexes = {
        @Index(name = "idx_runs_user", columnList = "user_id"),
        @Index(name = "idx_runs_status", columnList = "status")
})
public class RunEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "run_id")
    private UUID runId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "tool_id", nullable = false)
    private ToolEntity tool;

    @Column(name = "manifest_version", nullable = false)
    private int manifestVersion;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "scope_id", nullable = false)
    private ScopeEntity scope;

    @Column(name = "target", nullable = false)
    private String target;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "params")
    private Map<String, Object> params;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "argv", nullable = false)
    private List<String> argv;

    @Column(name = "timeout_seconds", nullable = false)
    private int timeoutSeconds;

    @Column(name = "memory_limit", nullable = false)
    private int memoryLimit;

    @Column(name = "cpu_limit", nullable = false)
    private double cpuLimit;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RunStatus status;

    @Column(name = "exit_code")
    private Integer exitCode;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "stdout")
    private String stdout;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "stderr")
    private String stderr;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "smart_scan_id")
    private UUID smartScanId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;
}
