package com.automate.ScanOps.Service;

import com.automate.ScanOps.Config.SmartScanProperties;
import com.automate.ScanOps.Models.RunResult;
import com.automate.ScanOps.Models.RunStatus;
import com.automate.ScanOps.Models.Severity;
import com.automate.ScanOps.Models.SmartScanPhase;
import com.automate.ScanOps.Models.SmartScanStatus;
import com.automate.ScanOps.Models.SmartScanStepStatus;
import com.automate.ScanOps.Models.StatusEvent;
import com.automate.ScanOps.Models.ValidationResult;
import com.automate.ScanOps.client.CancellationToken;
import com.automate.ScanOps.entity.RunEntity;
import com.automate.ScanOps.entity.ScopeEntity;
import com.automate.ScanOps.entity.SmartScanFindingEntity;
import com.automate.ScanOps.entity.SmartScanSessionEntity;
import com.automate.ScanOps.entity.SmartScanStepEntity;
import com.automate.ScanOps.exception.ApiException;
import com.automate.ScanOps.exception.ScanNotFoundException;
import com.automate.ScanOps.exception.TargetRejectedException;
import com.automate.ScanOps.repository.RunRepository;
import com.automate.ScanOps.repository.SmartScanSessionRepository;
import com.automate.ScanOps.validation.TargetValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executes smart-scan sessions on the single orchestrator thread.
 * <p>
 * Each state change is a short transaction taken under the session's lock, so the worker and a
 * cancelling request never interleave. Blocking tool execution happens outside the lock.
 * Events are published only after the change they describe has committed.
 */
@Slf4j
@Component
public class SmartScanRunner {

    static final String CANCELLED_BY_USER = "Cancelled by user";

    private final SmartScanSessionRepository sessionRepository;
    private final RunRepository runRepository;
    private final RunService runService;
    private final RunExecutionService runExecutionService;
    private final FindingSummarizer summarizer;
    private final TargetValidator targetValidator;
    private final StatusStreamService streamService;
    private final ScanAdmissionGate gate;
    private final SmartScanProperties props;
    private final TransactionTemplate tx;
    private final TaskExecutor smartScanExecutor;
    private final Map<UUID, ActiveScan> active = new ConcurrentHashMap<>();

    public SmartScanRunner(SmartScanSessionRepository sessionRepository,
                           RunRepository runRepository,
                           RunService runService,
                           RunExecutionService runExecutionService,
                           FindingSummarizer summarizer,
                           TargetValidator targetValidator,
                           StatusStreamService streamService,
                           ScanAdmissionGate gate,
                           SmartScanProperties props,
                           TransactionTemplate tx,
                           @Qualifier("smartScanExecutor") TaskExecutor smartScanExecutor) {
        this.sessionRepository = sessionRepository;
        this.runRepository = runRepository;
        this.runService = runService;
        this.runExecutionService = runExecutionService;
        this.summarizer = summarizer;
        this.targetValidator = targetValidator;
        this.streamService = streamService;
        this.gate = gate;
        this.props = props;
        this.tx = tx;
        this.smartScanExecutor = smartScanExecutor;
    }

    static final class ActiveScan {
        final UUID sessionId;
        final Instant deadline;
        final Object lock = new Object();
        volatile boolean cancelled;
        volatile CancellationToken stepToken;

        ActiveScan(UUID sessionId, Instant deadline) {
            this.sessionId = sessionId;
            this.deadline = deadline;
        }
    }

    /** What the worker needs to run one step, copied out of the persistence context. */
    record StepTask(UUID sessionId, UUID ownerId, ScopeEntity scope, int stepNumber, String name,
                    SmartScanPhase phase, String toolSlug, Map<String, Object> params, String target,
                    boolean critical) {}

    /** {@code budgetSpent}: the step timed out on the session's remaining wall-clock budget, not its own limit. */
    record StepOutcome(SmartScanStepStatus status, String error, UUID runId, long durationSeconds,
                       boolean fatal, boolean budgetSpent, List<FindingSummarizer.Finding> findings) {

        static StepOutcome completed(UUID runId, long duration, List<FindingSummarizer.Finding> findings) {
            return new StepOutcome(SmartScanStepStatus.COMPLETED, null, runId, duration, false, false, findings);
        }

        static StepOutcome failed(SmartScanStepStatus status, String error, UUID runId, long duration, boolean fatal) {
            return new StepOutcome(status, error, runId, duration, fatal, false, List.of());
        }

        static StepOutcome outOfBudget(String error, UUID runId, long duration) {
            return new StepOutcome(SmartScanStepStatus.TIMEOUT, error, runId, duration, false, true, List.of());
        }
    }

    /** Hands a session that was just moved to RUNNING to the orchestrator thread. */
    public void launch(UUID sessionId) {
        ActiveScan scan = new ActiveScan(sessionId, Instant.now().plus(props.getWallClockBudget()));
        active.put(sessionId, scan);
        try {
            smartScanExecutor.execute(() -> runSession(scan));
        } catch (RuntimeException e) {
            active.remove(sessionId, scan);
            throw e;
        }
    }

    void runSession(ActiveScan scan) {
        log.info("Smart scan {} worker started", scan.sessionId);
        try {
            while (true) {
                StepTask task = nextStep(scan);
                if (task == null) {
                    break;
                }
                StepOutcome outcome = execute(scan, task);
                if (!complete(scan, task, outcome)) {
                    break;
                }
            }
        } catch (RuntimeException e) {
            log.error("Smart scan {} crashed: {}", scan.sessionId, e.toString(), e);
            failSession(scan, "Internal error while executing smart scan");
        } finally {
            active.remove(scan.sessionId, scan);
            gate.release(scan.sessionId);
            log.info("Smart scan {} worker finished", scan.sessionId);
        }
    }

    /**
     * Picks the next PENDING step and marks it RUNNING, or finishes the session when nothing is
     * left or the wall-clock budget is spent.
     *
     * @return null when the worker should stop
     */
    private StepTask nextStep(ActiveScan scan) {
        synchronized (scan.lock) {
            if (scan.cancelled) {
                return null;
            }
            List<StatusEvent> events = new ArrayList<>();
            StepTask task = tx.execute(status -> {
                SmartScanSessionEntity session = load(scan.sessionId);
                if (session.getStatus() != SmartScanStatus.RUNNING) {
                    return null;
                }
                SmartScanStepEntity next = session.getSteps().stream()
                        .filter(s -> s.getStatus() == SmartScanStepStatus.PENDING)
                        .findFirst()
                        .orElse(null);

                if (next == null) {
                    finishSession(session, SmartScanStatus.COMPLETED, null);
                    events.add(progressEvent(session));
                    events.add(StatusEvent.completed(SmartScanStatus.COMPLETED.name(), null, null));
                    log.info("Smart scan {} completed with {} findings, risk score {}",
                            session.getSessionId(), session.getTotalFindings(), session.getRiskScore());
                    return null;
                }
                if (Instant.now().isAfter(scan.deadline)) {
                    String message = budgetMessage();
                    skipRemaining(session);
                    finishSession(session, SmartScanStatus.TIMEOUT, message);
                    events.add(progressEvent(session));
                    events.add(StatusEvent.failed(SmartScanStatus.TIMEOUT.name(), message));
                    log.warn("Smart scan {} timed out before step {}", session.getSessionId(), next.getStepNumber());
                    return null;
                }

                next.setStatus(SmartScanStepStatus.RUNNING);
                next.setStartedAt(LocalDateTime.now());
                session.setCurrentPhase(next.getPhase());
                events.add(StatusEvent.toolStart(next.getStepNumber(), next.getName(), next.getToolSlug(),
                        next.getPhase().name()));
                return new StepTask(session.getSessionId(), session.getUserId(), session.getScope(),
                        next.getStepNumber(), next.getName(), next.getPhase(), next.getToolSlug(),
                        next.getParams(), next.getTarget(), next.isCritical());
            });
            publish(scan.sessionId, events);
            if (task == null) {
                gate.release(scan.sessionId);
            }
            return task;
        }
    }

    private StepOutcome execute(ActiveScan scan, StepTask task) {
        log.info("Smart scan {} step {} ({}) starting", task.sessionId(), task.stepNumber(), task.name());
        if (task.toolSlug() == null) {
            return executeInternal(task);
        }

        RunEntity run;
        try {
            run = runService.prepareRun(task.ownerId(), task.toolSlug(), task.scope(), task.target(),
                    task.params(), task.sessionId());
            run = runRepository.save(run);
        } catch (TargetRejectedException e) {
            return StepOutcome.failed(SmartScanStepStatus.FAILED, e.getReason(), null, 0, true);
        } catch (ApiException e) {
            log.warn("Smart scan {} step {} rejected: {}", task.sessionId(), task.stepNumber(), e.getReason());
            return StepOutcome.failed(SmartScanStepStatus.FAILED, e.getReason(), null, 0, task.critical());
        }

        CancellationToken token = runExecutionService.register(run.getRunId());
        scan.stepToken = token;
        if (scan.cancelled) {
            token.cancel();
        }

        // round up so a step is never cut short of the budget it actually has left
        long remainingMs = Duration.between(Instant.now(), scan.deadline).toMillis();
        long remaining = (Math.max(0, remainingMs) + 999) / 1000;
        int cap = (int) Math.max(1, Math.min(Integer.MAX_VALUE, remaining));
        boolean budgetCapped = cap < run.getTimeoutSeconds();
        RunResult result = runExecutionService.executeNow(run.getRunId(), token, cap);
        scan.stepToken = null;

        if (result == null) {
            return StepOutcome.failed(SmartScanStepStatus.FAILED, CANCELLED_BY_USER, run.getRunId(), 0, task.critical());
        }
        if (result.status() == RunStatus.TIMEOUT && (budgetCapped || !Instant.now().isBefore(scan.deadline))) {
            return StepOutcome.outOfBudget(RunExecutionService.errorMessageFor(result), run.getRunId(), result.durationSeconds());
        }
        return switch (result.status()) {
            case COMPLETED -> StepOutcome.completed(run.getRunId(), result.durationSeconds(), summarize(run.getRunId()));
            case TIMEOUT -> StepOutcome.failed(SmartScanStepStatus.TIMEOUT, RunExecutionService.errorMessageFor(result),
                    run.getRunId(), result.durationSeconds(), task.critical());
            default -> StepOutcome.failed(SmartScanStepStatus.FAILED, RunExecutionService.errorMessageFor(result),
                    run.getRunId(), result.durationSeconds(), task.critical());
        };
    }

    // planning re-checks the target against the scope as it is now; the report step only closes out
    private StepOutcome executeInternal(StepTask task) {
        if (task.phase() == SmartScanPhase.INTELLIGENCE_PLANNING) {
            ValidationResult result = targetValidator.validate(task.target(),
                    task.scope().getAllowedHosts(), task.scope().getAllowedCidrs());
            if (result.rejected()) {
                return StepOutcome.failed(SmartScanStepStatus.FAILED, result.reason(), null, 0, true);
            }
        }
        return StepOutcome.completed(null, 0, List.of());
    }

    private List<FindingSummarizer.Finding> summarize(UUID runId) {
        try {
            return runRepository.findById(runId)
                    .map(summarizer::summarize)
                    .orElse(List.of());
        } catch (RuntimeException e) {
            log.warn("Summarizer failed for run {}: {}", runId, e.toString());
            return List.of();
        }
    }

    /**
     * Stores the step outcome and decides whether the session goes on.
     *
     * @return false when the worker should stop
     */
    private boolean complete(ActiveScan scan, StepTask task, StepOutcome outcome) {
        synchronized (scan.lock) {
            if (scan.cancelled) {
                return false;
            }
            List<StatusEvent> events = new ArrayList<>();
            Boolean goOn = tx.execute(status -> {
                SmartScanSessionEntity session = load(scan.sessionId);
                if (session.getStatus() != SmartScanStatus.RUNNING) {
                    return false;
                }
                SmartScanStepEntity step = stepOf(session, task.stepNumber());
                step.setStatus(outcome.status());
                step.setCompletedAt(LocalDateTime.now());
                step.setDurationSeconds(outcome.durationSeconds());
                step.setErrorMessage(RunExecutionService.abbreviate(outcome.error(), 2000));
                step.setRunId(outcome.runId());

                if (outcome.status() != SmartScanStepStatus.COMPLETED) {
                    session.addFinding(finding(step.getName() + " Error", Severity.LOW, "execution-error",
                            step.getToolSlug(), outcome.error(), outcome.runId()));
                }
                for (FindingSummarizer.Finding f : outcome.findings()) {
                    session.addFinding(finding(f.title(), f.severity(), f.category(), step.getToolSlug(),
                            f.description(), outcome.runId()));
                }
                recomputeStats(session);

                events.add(StatusEvent.toolComplete(step.getStepNumber(), step.getToolSlug(), step.getStatus().name(),
                        step.getDurationSeconds(), step.getRunId()));
                log.info("Smart scan {} step {} finished: {}", session.getSessionId(), step.getStepNumber(), step.getStatus());

                long failures = session.getSteps().stream()
                        .filter(s -> s.getStatus() == SmartScanStepStatus.FAILED || s.getStatus() == SmartScanStepStatus.TIMEOUT)
                        .count();
                if (outcome.budgetSpent()) {
                    String message = budgetMessage();
                    skipRemaining(session);
                    finishSession(session, SmartScanStatus.TIMEOUT, message);
                    events.add(progressEvent(session));
                    events.add(StatusEvent.failed(SmartScanStatus.TIMEOUT.name(), message));
                    log.warn("Smart scan {} ran out of its wall-clock budget in step {}", session.getSessionId(), step.getStepNumber());
                    return false;
                }

                String failure = null;
                if (outcome.fatal()) {
                    failure = RunExecutionService.abbreviate(
                            "Step " + step.getStepNumber() + " (" + step.getName() + ") failed: " + outcome.error(), 2000);
                } else if (failures > props.getMaxFailedSteps()) {
                    failure = "Too many failed steps (" + failures + ")";
                }

                if (failure != null) {
                    skipRemaining(session);
                    finishSession(session, SmartScanStatus.FAILED, failure);
                    events.add(progressEvent(session));
                    events.add(StatusEvent.failed(SmartScanStatus.FAILED.name(), failure));
                    log.warn("Smart scan {} failed: {}", session.getSessionId(), failure);
                    return false;
                }
                updateProgress(session);
                events.add(progressEvent(session));
                return true;
            });
            publish(scan.sessionId, events);
            if (!Boolean.TRUE.equals(goOn)) {
                gate.release(scan.sessionId);
                return false;
            }
            return true;
        }
    }

    /**
     * Cancels a RUNNING session: the running step fails, pending steps are skipped and the
     * in-flight run is told to stop.
     *
     * @return false if the session had already left RUNNING
     */
    public boolean cancel(UUID sessionId) {
        ActiveScan scan = active.get(sessionId);
        if (scan == null) {
            // no worker holds the session, e.g. it was queued behind a crash
            return applyCancel(sessionId);
        }
        synchronized (scan.lock) {
            if (scan.cancelled) {
                return false;
            }
            scan.cancelled = true;
            CancellationToken token = scan.stepToken;
            if (token != null) {
                token.cancel();
            }
            return applyCancel(sessionId);
        }
    }

    private boolean applyCancel(UUID sessionId) {
        List<StatusEvent> events = new ArrayList<>();
        Boolean applied = tx.execute(status -> {
            SmartScanSessionEntity session = load(sessionId);
            if (session.getStatus() != SmartScanStatus.RUNNING) {
                return false;
            }
            LocalDateTime now = LocalDateTime.now();
            for (SmartScanStepEntity step : session.getSteps()) {
                if (step.getStatus() == SmartScanStepStatus.RUNNING) {
                    step.setStatus(SmartScanStepStatus.FAILED);
                    step.setErrorMessage(CANCELLED_BY_USER);
                    step.setCompletedAt(now);
                    if (step.getStartedAt() != null) {
                        step.setDurationSeconds(Duration.between(step.getStartedAt(), now).getSeconds());
                    }
                    events.add(StatusEvent.toolComplete(step.getStepNumber(), step.getToolSlug(),
                            step.getStatus().name(), step.getDurationSeconds(), step.getRunId()));
                }
            }
            skipRemaining(session);
            finishSession(session, SmartScanStatus.CANCELLED, CANCELLED_BY_USER);
            events.add(progressEvent(session));
            events.add(StatusEvent.failed(SmartScanStatus.CANCELLED.name(), CANCELLED_BY_USER));
            return true;
        });
        publish(sessionId, events);
        if (Boolean.TRUE.equals(applied)) {
            gate.release(sessionId);
            log.info("Smart scan {} cancelled", sessionId);
            return true;
        }
        return false;
    }

    private void failSession(ActiveScan scan, String message) {
        synchronized (scan.lock) {
            if (scan.cancelled) {
                return;
            }
            List<StatusEvent> events = new ArrayList<>();
            tx.executeWithoutResult(status -> {
                SmartScanSessionEntity session = load(scan.sessionId);
                if (session.getStatus().isTerminal()) {
                    return;
                }
                LocalDateTime now = LocalDateTime.now();
                session.getSteps().stream()
                        .filter(s -> s.getStatus() == SmartScanStepStatus.RUNNING)
                        .forEach(s -> {
                            s.setStatus(SmartScanStepStatus.FAILED);
                            s.setErrorMessage(message);
                            s.setCompletedAt(now);
                        });
                skipRemaining(session);
                finishSession(session, SmartScanStatus.FAILED, message);
                events.add(progressEvent(session));
                events.add(StatusEvent.failed(SmartScanStatus.FAILED.name(), message));
            });
            publish(scan.sessionId, events);
        }
    }

    private String budgetMessage() {
        return "Wall-clock budget of " + props.getWallClockBudget() + " exceeded";
    }

    private SmartScanSessionEntity load(UUID sessionId) {
        return sessionRepository.findWithSteps(sessionId)
                .orElseThrow(() -> new ScanNotFoundException(sessionId));
    }

    private void publish(UUID sessionId, List<StatusEvent> events) {
        String key = StatusStreamService.scanKey(sessionId);
        for (StatusEvent e : events) {
            streamService.publish(key, e);
        }
    }

    private static SmartScanStepEntity stepOf(SmartScanSessionEntity session, int stepNumber) {
        return session.getSteps().stream()
                .filter(s -> s.getStepNumber() == stepNumber)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Step " + stepNumber + " missing from session " + session.getSessionId()));
    }

    static void skipRemaining(SmartScanSessionEntity session) {
        session.getSteps().stream()
                .filter(s -> s.getStatus() == SmartScanStepStatus.PENDING)
                .forEach(s -> s.setStatus(SmartScanStepStatus.SKIPPED));
    }

    static void finishSession(SmartScanSessionEntity session, SmartScanStatus status, String message) {
        session.setStatus(status);
        session.setErrorMessage(message);
        session.setCompletedAt(LocalDateTime.now());
        updateProgress(session);
    }

    /** progress = floor(100 * terminal / total); phase follows the running step, else the next pending one. */
    static void updateProgress(SmartScanSessionEntity session) {
        List<SmartScanStepEntity> steps = session.getSteps();
        if (steps.isEmpty()) {
            session.setProgress(100);
            return;
        }
        long terminal = steps.stream().filter(s -> s.getStatus().isTerminal()).count();
        int progress = (int) (terminal * 100 / steps.size());
        session.setProgress(Math.max(session.getProgress(), progress));

        SmartScanPhase phase = steps.stream()
                .filter(s -> s.getStatus() == SmartScanStepStatus.RUNNING)
                .map(SmartScanStepEntity::getPhase)
                .findFirst()
                .orElseGet(() -> steps.stream()
                        .filter(s -> s.getStatus() == SmartScanStepStatus.PENDING)
                        .map(SmartScanStepEntity::getPhase)
                        .findFirst()
                        .orElse(steps.get(steps.size() - 1).getPhase()));
        session.setCurrentPhase(phase);
    }

    static void recomputeStats(SmartScanSessionEntity session) {
        List<SmartScanFindingEntity> findings = session.getFindings();
        session.setTotalFindings(findings.size());
        session.setCriticalFindings((int) findings.stream().filter(f -> f.getSeverity() == Severity.CRITICAL).count());
        session.setHighFindings((int) findings.stream().filter(f -> f.getSeverity() == Severity.HIGH).count());
        int risk = findings.stream().mapToInt(f -> f.getSeverity().riskWeight()).sum();
        session.setRiskScore(Math.min(100, risk));
    }

    private static SmartScanFindingEntity finding(String title, Severity severity, String category, String tool,
                                                  String description, UUID runId) {
        SmartScanFindingEntity f = new SmartScanFindingEntity();
        f.setTitle(title);
        f.setSeverity(severity == null ? Severity.INFO : severity);
        f.setCategory(category);
        f.setTool(tool);
        f.setDescription(description);
        f.setRunId(runId);
        return f;
    }

    private static StatusEvent progressEvent(SmartScanSessionEntity session) {
        return StatusEvent.progress(session.getProgress(),
                session.getCurrentPhase() == null ? null : session.getCurrentPhase().name());
    }
}
