package com.automate.ScanOps.jobs;

import com.automate.ScanOps.Models.RunStatus;
import com.automate.ScanOps.Models.ScanObjective;
import com.automate.ScanOps.Models.SmartScanPhase;
import com.automate.ScanOps.Models.SmartScanStatus;
import com.automate.ScanOps.Models.SmartScanStepStatus;
import com.automate.ScanOps.entity.RunEntity;
import com.automate.ScanOps.entity.ScopeEntity;
import com.automate.ScanOps.entity.SmartScanSessionEntity;
import com.automate.ScanOps.entity.SmartScanStepEntity;
import com.automate.ScanOps.entity.ToolEntity;
import com.automate.ScanOps.repository.RunRepository;
import com.automate.ScanOps.repository.ScopeRepository;
import com.automate.ScanOps.repository.SmartScanSessionRepository;
import com.automate.ScanOps.repository.ToolRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class StaleWorkReconcilerTest {

    @Autowired
    private StaleWorkReconciler reconciler;
    @Autowired
    private RunRepository runRepository;
    @Autowired
    private SmartScanSessionRepository sessionRepository;
    @Autowired
    private ToolRepository toolRepository;
    @Autowired
    private ScopeRepository scopeRepository;
    @Autowired
    private TransactionTemplate tx;

    private final UUID userId = UUID.randomUUID();
    private ToolEntity tool;
    private ScopeEntity scope;

    @BeforeEach
    void seedCatalog() {
        tool = new ToolEntity();
        tool.setSlug("probe-" + UUID.randomUUID().toString().substring(0, 8));
        tool.setName("Probe");
        tool = toolRepository.save(tool);

        scope = new ScopeEntity();
        scope.setName("reconcile");
        scope.setAllowedHosts(List.of("scanme.example.com"));
        scope.setCreatedBy(userId);
        scope = scopeRepository.save(scope);
    }

    @Test
    void inFlightRunsAreFailed() {
        UUID running = runRepository.save(run(RunStatus.RUNNING)).getRunId();
        UUID pending = runRepository.save(run(RunStatus.PENDING)).getRunId();
        UUID finished = runRepository.save(run(RunStatus.COMPLETED)).getRunId();

        Integer count = tx.execute(status -> reconciler.failInterruptedRuns());

        assertNotNull(count);
        assertTrue(count >= 2);
        for (UUID id : List.of(running, pending)) {
            RunEntity stored = runRepository.findById(id).orElseThrow();
            assertEquals(RunStatus.FAILED, stored.getStatus());
            assertEquals(StaleWorkReconciler.INTERRUPTED, stored.getErrorMessage());
            assertNotNull(stored.getCompletedAt());
        }
        assertEquals(RunStatus.COMPLETED, runRepository.findById(finished).orElseThrow().getStatus());
    }

    @Test
    void runningSessionIsFailedAndPendingStepsSkipped() {
        SmartScanSessionEntity session = new SmartScanSessionEntity();
        session.setUserId(userId);
        session.setTarget("scanme.example.com");
        session.setScope(scope);
        session.setObjective(ScanObjective.QUICK);
        session.setMaxTools(3);
        session.setStatus(SmartScanStatus.RUNNING);
        session.setProgress(40);
        session.addStep(step(1, SmartScanStepStatus.COMPLETED));
        session.addStep(step(2, SmartScanStepStatus.RUNNING));
        session.addStep(step(3, SmartScanStepStatus.PENDING));
        UUID sessionId = sessionRepository.save(session).getSessionId();

        tx.executeWithoutResult(status -> reconciler.failInterruptedSessions());

        tx.executeWithoutResult(status -> {
            SmartScanSessionEntity stored = sessionRepository.findById(sessionId).orElseThrow();
            assertEquals(SmartScanStatus.FAILED, stored.getStatus());
            assertEquals(StaleWorkReconciler.INTERRUPTED, stored.getErrorMessage());
            assertEquals(100, stored.getProgress());
            assertNotNull(stored.getCompletedAt());

            List<SmartScanStepStatus> steps = stored.getSteps().stream()
                    .sorted((a, b) -> Integer.compare(a.getStepNumber(), b.getStepNumber()))
                    .map(SmartScanStepEntity::getStatus)
                    .toList();
            assertEquals(List.of(SmartScanStepStatus.COMPLETED, SmartScanStepStatus.FAILED, SmartScanStepStatus.SKIPPED), steps);
        });
    }

    private RunEntity run(RunStatus status) {
        RunEntity run = new RunEntity();
        run.setUserId(userId);
        run.setTool(tool);
        run.setManifestVersion(1);
        run.setScope(scope);
        run.setTarget("scanme.example.com");
        run.setParams(Map.of());
        run.setArgv(List.of("probe", "scanme.example.com"));
        run.setTimeoutSeconds(60);
        run.setMemoryLimit(256);
        run.setCpuLimit(0.5);
        run.setStatus(status);
        return run;
    }

    private static SmartScanStepEntity step(int number, SmartScanStepStatus status) {
        SmartScanStepEntity step = new SmartScanStepEntity();
        step.setStepNumber(number);
        step.setPhase(SmartScanPhase.values()[Math.min(number, SmartScanPhase.values().length - 1)]);
        step.setName("Step " + number);
        step.setStatus(status);
        return step;
    }
}
