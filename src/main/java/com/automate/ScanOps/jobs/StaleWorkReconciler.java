package com.automate.ScanOps.jobs;

import com.automate.ScanOps.Models.RunStatus;
import com.automate.ScanOps.Models.SmartScanStatus;
import com.automate.ScanOps.Models.SmartScanStepStatus;
import com.automate.ScanOps.entity.RunEntity;
import com.automate.ScanOps.entity.SmartScanSessionEntity;
import com.automate.ScanOps.repository.RunRepository;
import com.automate.ScanOps.repository.SmartScanSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Work that was in flight when the service stopped can never finish: its worker thread and its
 * backend call are gone. On startup such runs and sessions are closed out as FAILED.
 */
@Component
public class StaleWorkReconciler {
    private static final Logger log = LoggerFactory.getLogger(StaleWorkReconciler.class);
    static final String INTERRUPTED = "Interrupted by service restart";

    private final RunRepository runRepository;
    private final SmartScanSessionRepository sessionRepository;
    private final TransactionTemplate tx;

    public StaleWorkReconciler(RunRepository runRepository,
                               SmartScanSessionRepository sessionRepository,
                               TransactionTemplate tx) {
        this.runRepository = runRepository;
        this.sessionRepository = sessionRepository;
        this.tx = tx;
    }

    @jakarta.annotation.PostConstruct
    public void reconcileOnStartup() {
        Integer runs = tx.execute(status -> failInterruptedRuns());
        Integer sessions = tx.execute(status -> failInterruptedSessions());
        log.info("Reconciled {} interrupted runs and {} interrupted smart scans (on startup)", runs, sessions);
    }

    int failInterruptedRuns() {
        List<RunEntity> stale = runRepository.findByStatusIn(List.of(RunStatus.PENDING, RunStatus.RUNNING));
        LocalDateTime now = LocalDateTime.now();
        for (RunEntity run : stale) {
            run.setStatus(RunStatus.FAILED);
            run.setErrorMessage(INTERRUPTED);
            run.setCompletedAt(now);
        }
        runRepository.saveAll(stale);
        return stale.size();
    }

    int failInterruptedSessions() {
        List<SmartScanSessionEntity> stale = sessionRepository.findByStatus(SmartScanStatus.RUNNING);
        LocalDateTime now = LocalDateTime.now();
        for (SmartScanSessionEntity session : stale) {
            session.getSteps().forEach(step -> {
                if (step.getStatus() == SmartScanStepStatus.RUNNING) {
                    step.setStatus(SmartScanStepStatus.FAILED);
                    step.setErrorMessage(INTERRUPTED);
                    step.setCompletedAt(now);
                } else if (step.getStatus() == SmartScanStepStatus.PENDING) {
                    step.setStatus(SmartScanStepStatus.SKIPPED);
                }
            });
            session.setStatus(SmartScanStatus.FAILED);
            session.setErrorMessage(INTERRUPTED);
            session.setCompletedAt(now);
            session.setProgress(100);
        }
        sessionRepository.saveAll(stale);
        return stale.size();
    }
}
