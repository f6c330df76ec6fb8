package com.automate.ScanOps.entity;

import com.automate.ScanOps.Models.Severity;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Table(name = "smart_scan_findings")
public class SmartScanFindingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "finding_id")
    private UUID findingId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", nullable = false)
    private SmartScanSessionEntity session;

    @Column(name = "title", nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 16)
    private Severity severity;

    @Column(name = "category")
    private String category;

    @Column(name = "tool", length = 64)
    private String tool;

    @Column(name = "description", length = 4000)
    private String description;

    @Column(name = "run_id")
    private UUID runId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
