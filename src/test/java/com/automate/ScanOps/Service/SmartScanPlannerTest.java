package com.automate.ScanOps.Service;

import com.automate.ScanOps.Models.ScanObjective;
import com.automate.ScanOps.Models.SmartScanPhase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SmartScanPlannerTest {

    private final SmartScanPlanner planner = new SmartScanPlanner();

    @Test
    void wrapsToolStepsWithPlanningAndReport() {
        List<SmartScanPlanner.PlannedStep> steps = planner.plan(ScanObjective.QUICK, 10, slug -> true);

        SmartScanPlanner.PlannedStep first = steps.get(0);
        SmartScanPlanner.PlannedStep last = steps.get(steps.size() - 1);
        assertTrue(first.internal());
        assertEquals(SmartScanPhase.INTELLIGENCE_PLANNING, first.phase());
        assertTrue(last.internal());
        assertEquals(SmartScanPhase.FINAL_REPORT, last.phase());
        assertEquals(List.of("nmap", "httpx", "nuclei"),
                steps.subList(1, steps.size() - 1).stream().map(SmartScanPlanner.PlannedStep::toolSlug).toList());
    }

    @Test
    void capsToolStepsAtMaxTools() {
        List<SmartScanPlanner.PlannedStep> steps = planner.plan(ScanObjective.AGGRESSIVE, 2, slug -> true);
        assertEquals(4, steps.size());
        assertEquals("nmap", steps.get(1).toolSlug());
        assertEquals("masscan", steps.get(2).toolSlug());
    }

    @Test
    void leavesOutUnavailableTools() {
        Set<String> installed = Set.of("httpx", "nuclei");
        List<SmartScanPlanner.PlannedStep> steps = planner.plan(ScanObjective.COMPREHENSIVE, 10, installed::contains);
        assertEquals(List.of("httpx", "nuclei"),
                steps.subList(1, steps.size() - 1).stream().map(SmartScanPlanner.PlannedStep::toolSlug).toList());
    }

    @Test
    void onlyFirstToolStepIsCritical() {
        List<SmartScanPlanner.PlannedStep> steps = planner.plan(ScanObjective.STEALTH, 10, slug -> true);
        assertFalse(steps.get(0).critical());
        assertTrue(steps.get(1).critical());
        assertTrue(steps.subList(2, steps.size()).stream().noneMatch(SmartScanPlanner.PlannedStep::critical));
    }

    @Test
    void noToolsStillPlansInternalSteps() {
        List<SmartScanPlanner.PlannedStep> steps = planner.plan(ScanObjective.COMPREHENSIVE, 10, slug -> false);
        assertEquals(2, steps.size());
        assertTrue(steps.stream().allMatch(SmartScanPlanner.PlannedStep::internal));
    }

    @Test
    void phasesNeverGoBackwards() {
        List<SmartScanPlanner.PlannedStep> steps = planner.plan(ScanObjective.AGGRESSIVE, 20, slug -> true);
        for (int i = 1; i < steps.size(); i++) {
            assertTrue(steps.get(i).phase().ordinal() >= steps.get(i - 1).phase().ordinal());
        }
    }
}
