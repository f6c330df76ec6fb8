package com.automate.ScanOps.entity;

import com.automate.ScanOps.Models.ScanObjective;
import com.automate.ScanOps.Models.SmartScanPhase;
import com.automate.ScanOps.Models.SmartScanStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Table(name = "smart_scan_sessions", indexes = {
        @Index(name = "idx_smart_scan_user", columnList = "user_id"),
        @Index(name = "idx_smart_scan_status", columnList = "status")
})
public class SmartScanSessionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "session_id")
    private UUID sessionId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "name")
    private String name;

    @Column(name = "target", nullable = false)
    private String target;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "scope_id", nullable = false)
    private ScopeEntity scope;

    @Enumerated(EnumType.STRING)
    @Column(name = "objective", nullable = false, length = 16)
    private ScanObjective objective;

    @Column(name = "max_tools", nullable = false)
    private int maxTools;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private SmartScanStatus status;

    @Column(name = "progress", nullable = false)
    private int progress;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_phase", length = 32)
    private SmartScanPhase currentPhase;

    @Column(name = "total_findings", nullable = false)
    private int totalFindings;

    @Column(name = "critical_findings", nullable = false)
    private int criticalFindings;

    @Column(name = "high_findings", nullable = false)
    private int highFindings;

    @Column(name = "risk_score", nullable = false)
    private int riskScore;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @OneToMany(mappedBy = "session", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("stepNumber ASC")
    private List<SmartScanStepEntity> steps = new ArrayList<>();

    @OneToMany(mappedBy = "session", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt ASC")
    private List<SmartScanFindingEntity> findings = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public void addStep(SmartScanStepEntity step) {
        step.setSession(this);
        steps.add(step);
    }

    public void addFinding(SmartScanFindingEntity finding) {
        finding.setSession(this);
        findings.add(finding);
    }
}
