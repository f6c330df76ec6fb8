package com.automate.ScanOps.Service;

import com.automate.ScanOps.Models.RunStatus;
import com.automate.ScanOps.Models.SmartScanStatus;
import com.automate.ScanOps.Models.SmartScanStepStatus;
import com.automate.ScanOps.Models.StatusEvent;
import com.automate.ScanOps.dto.response.RunStatusSnapshot;
import com.automate.ScanOps.dto.response.SmartScanStatusSnapshot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the live event vocabulary from two consecutive status snapshots, for consumers that
 * poll instead of holding a push connection. {@code previous} is null for the first poll.
 */
public final class StatusEventSynthesizer {

    private StatusEventSynthesizer() {
    }

    public static List<StatusEvent> diff(RunStatusSnapshot previous, RunStatusSnapshot current) {
        List<StatusEvent> events = new ArrayList<>();
        boolean wasIdle = previous == null || previous.status() == RunStatus.PENDING;
        if (wasIdle && current.status() != RunStatus.PENDING) {
            events.add(StatusEvent.init(current.status().name(), current.target()));
        }

        String newOut = suffix(previous == null ? "" : previous.stdout(), current.stdout());
        if (!newOut.isEmpty()) {
            events.add(StatusEvent.outputChunk("stdout", newOut));
        }
        String newErr = suffix(previous == null ? "" : previous.stderr(), current.stderr());
        if (!newErr.isEmpty()) {
            events.add(StatusEvent.outputChunk("stderr", newErr));
        }

        boolean wasTerminal = previous != null && previous.status().isTerminal();
        if (current.status().isTerminal() && !wasTerminal) {
            events.add(terminalEvent(current));
        }
        return events;
    }

    public static List<StatusEvent> diff(SmartScanStatusSnapshot previous, SmartScanStatusSnapshot current) {
        List<StatusEvent> events = new ArrayList<>();
        boolean wasIdle = previous == null || previous.status() == SmartScanStatus.CREATED;
        if (wasIdle && current.status() != SmartScanStatus.CREATED) {
            events.add(StatusEvent.init(current.status().name(), current.target()));
        }

        Map<Integer, SmartScanStatusSnapshot.StepState> before = new HashMap<>();
        if (previous != null && previous.steps() != null) {
            previous.steps().forEach(s -> before.put(s.stepNumber(), s));
        }
        boolean stepsChanged = false;
        for (SmartScanStatusSnapshot.StepState step : current.steps()) {
            if (step.status() == SmartScanStepStatus.SKIPPED) {
                continue;
            }
            SmartScanStatusSnapshot.StepState old = before.get(step.stepNumber());
            SmartScanStepStatus oldStatus = old == null ? SmartScanStepStatus.PENDING : old.status();
            if (oldStatus == SmartScanStepStatus.PENDING && step.status() != SmartScanStepStatus.PENDING) {
                events.add(StatusEvent.toolStart(step.stepNumber(), step.name(), step.tool(), step.phase().name()));
            }
            if (step.status().isTerminal() && !oldStatus.isTerminal()) {
                events.add(StatusEvent.toolComplete(step.stepNumber(), step.tool(), step.status().name(),
                        step.durationSeconds(), step.runId()));
                stepsChanged = true;
            }
        }

        boolean progressMoved = previous == null
                ? current.status() != SmartScanStatus.CREATED
                : previous.progress() != current.progress() || previous.currentPhase() != current.currentPhase();
        if (progressMoved || stepsChanged) {
            events.add(StatusEvent.progress(current.progress(),
                    current.currentPhase() == null ? null : current.currentPhase().name()));
        }

        boolean wasTerminal = previous != null && previous.status().isTerminal();
        if (current.status().isTerminal() && !wasTerminal) {
            events.add(terminalEvent(current));
        }
        return events;
    }

    public static StatusEvent terminalEvent(RunStatusSnapshot run) {
        if (run.status() == RunStatus.COMPLETED) {
            return StatusEvent.completed(run.status().name(), run.exitCode(), run.durationSeconds());
        }
        String error = run.errorMessage() != null ? run.errorMessage() : run.stderr();
        return StatusEvent.failed(run.status().name(), error);
    }

    public static StatusEvent terminalEvent(SmartScanStatusSnapshot scan) {
        if (scan.status() == SmartScanStatus.COMPLETED) {
            return StatusEvent.completed(scan.status().name(), null, null);
        }
        return StatusEvent.failed(scan.status().name(), scan.errorMessage());
    }

    // output only ever grows; anything else is re-sent whole
    private static String suffix(String before, String after) {
        if (after == null || after.isEmpty()) {
            return "";
        }
        if (before == null || !after.startsWith(before)) {
            return after;
        }
        return after.substring(before.length());
    }
}
