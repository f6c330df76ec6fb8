package com.automate.ScanOps.Service;

import com.automate.ScanOps.Models.ResourceLimits;
import com.automate.ScanOps.Models.RunResult;
import com.automate.ScanOps.Models.RunStatus;
import com.automate.ScanOps.Models.ScanObjective;
import com.automate.ScanOps.Models.SmartScanStatus;
import com.automate.ScanOps.Models.SmartScanStepStatus;
import com.automate.ScanOps.client.CancellationToken;
import com.automate.ScanOps.client.ExecutionBackendClient;
import com.automate.ScanOps.dto.request.CreateSmartScanRequest;
import com.automate.ScanOps.dto.response.SmartScanResponse;
import com.automate.ScanOps.dto.response.SmartScanStepResponse;
import com.automate.ScanOps.repository.ToolRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.List;
import java.util.UUID;

import static com.automate.ScanOps.Service.CatalogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Session budgets: a two second wall clock and no tolerance for failed steps.
 */
@SpringBootTest(properties = {
        "smart-scan.wall-clock-budget=2s",
        "smart-scan.max-failed-steps=0"
})
class SmartScanBudgetTest {

    @MockBean
    private ExecutionBackendClient backend;

    @Autowired
    private SmartScanService smartScanService;
    @Autowired
    private ToolCatalogService catalog;
    @Autowired
    private ScopeService scopeService;
    @Autowired
    private ScanAdmissionGate gate;
    @Autowired
    private ToolRepository toolRepository;

    private UUID scopeId;

    @BeforeEach
    void setUp() {
        ensureDefaultTools(toolRepository, catalog);
        scopeId = createScope(scopeService);
    }

    @AfterEach
    void drain() throws InterruptedException {
        await(() -> gate.holder().isEmpty(), "admission token to be released");
    }

    private SmartScanResponse startAndAwait(String target) throws InterruptedException {
        SmartScanResponse created = smartScanService.create(ENGINEER,
                new CreateSmartScanRequest(null, target, scopeId, ScanObjective.QUICK, 10));
        smartScanService.start(ENGINEER, created.sessionId());
        await(() -> smartScanService.getStatus(ENGINEER, created.sessionId()).status().isTerminal(),
                "session " + created.sessionId());
        return smartScanService.get(ENGINEER, created.sessionId());
    }

    private static List<SmartScanStepStatus> statuses(SmartScanResponse scan) {
        return scan.steps().stream().map(SmartScanStepResponse::status).toList();
    }

    @Test
    void stepTimingOutOnTheRemainingBudgetEndsSessionAsTimeout() throws Exception {
        when(backend.execute(anyList(), anyInt(), any(ResourceLimits.class), any(CancellationToken.class)))
                .thenAnswer(inv -> {
                    int timeout = inv.getArgument(1);
                    Thread.sleep(timeout * 1000L);
                    return new RunResult(RunStatus.TIMEOUT, null, "",
                            "Tool execution timed out after " + timeout + " seconds", timeout);
                });

        SmartScanResponse done = startAndAwait("scanme.example.com");

        assertEquals(SmartScanStatus.TIMEOUT, done.status());
        assertTrue(done.errorMessage().startsWith("Wall-clock budget"), done.errorMessage());
        assertEquals(List.of(SmartScanStepStatus.COMPLETED, SmartScanStepStatus.TIMEOUT, SmartScanStepStatus.SKIPPED,
                SmartScanStepStatus.SKIPPED, SmartScanStepStatus.SKIPPED), statuses(done));
        assertEquals(100, done.progress());
        // the manifest allows 60 seconds; the step only got what was left of the budget
        verify(backend).execute(anyList(), intThat(t -> t <= 2), any(ResourceLimits.class), any(CancellationToken.class));
    }

    @Test
    void budgetSpentBetweenStepsSkipsTheRest() throws Exception {
        when(backend.execute(anyList(), anyInt(), any(ResourceLimits.class), any(CancellationToken.class)))
                .thenAnswer(inv -> {
                    Thread.sleep(2300);
                    return new RunResult(RunStatus.COMPLETED, 0, "22/tcp open ssh", "", 2);
                });

        SmartScanResponse done = startAndAwait("scanme.example.com");

        assertEquals(SmartScanStatus.TIMEOUT, done.status());
        assertTrue(done.errorMessage().startsWith("Wall-clock budget"), done.errorMessage());
        assertEquals(List.of(SmartScanStepStatus.COMPLETED, SmartScanStepStatus.COMPLETED, SmartScanStepStatus.SKIPPED,
                SmartScanStepStatus.SKIPPED, SmartScanStepStatus.SKIPPED), statuses(done));
        verify(backend, times(1)).execute(anyList(), anyInt(), any(ResourceLimits.class), any(CancellationToken.class));
    }

    @Test
    void exceedingFailedStepAllowanceFailsSession() throws Exception {
        when(backend.execute(anyList(), anyInt(), any(ResourceLimits.class), any(CancellationToken.class)))
                .thenReturn(new RunResult(RunStatus.COMPLETED, 0, "22/tcp open ssh", "", 0))
                .thenReturn(new RunResult(RunStatus.FAILED, 3, "", "connection refused", 0));

        SmartScanResponse done = startAndAwait("10.20.0.7");

        assertEquals(SmartScanStatus.FAILED, done.status());
        assertEquals("Too many failed steps (1)", done.errorMessage());
        assertEquals(List.of(SmartScanStepStatus.COMPLETED, SmartScanStepStatus.COMPLETED, SmartScanStepStatus.FAILED,
                SmartScanStepStatus.SKIPPED, SmartScanStepStatus.SKIPPED), statuses(done));
        assertEquals("Tool exited with code 3", done.steps().get(2).errorMessage());
        verify(backend, times(2)).execute(anyList(), anyInt(), any(ResourceLimits.class), any(CancellationToken.class));
    }
}
