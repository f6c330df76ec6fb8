package com.automate.ScanOps.Service;

import com.automate.ScanOps.Config.ExecutorProperties;
import com.automate.ScanOps.Models.ResourceLimits;
import com.automate.ScanOps.Models.RunResult;
import com.automate.ScanOps.Models.RunStatus;
import com.automate.ScanOps.Models.StatusEvent;
import com.automate.ScanOps.client.CancellationToken;
import com.automate.ScanOps.client.ExecutionBackendClient;
import com.automate.ScanOps.entity.RunEntity;
import com.automate.ScanOps.repository.RunRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives stored runs through {@code PENDING -> RUNNING -> terminal} and publishes their events.
 * <p>
 * Standalone runs are dispatched to the run worker pool; smart-scan steps call
 * {@link #executeNow} on the orchestrator thread. Every dispatched run has a
 * {@link CancellationToken} registered until it reaches a terminal state.
 */
@Slf4j
@Service
public class RunExecutionService {

    private final RunRepository runRepository;
    private final ExecutionBackendClient backendClient;
    private final StatusStreamService streamService;
    private final ExecutorProperties props;
    private final TaskExecutor runExecutor;
    private final Map<UUID, CancellationToken> tokens = new ConcurrentHashMap<>();

    public RunExecutionService(RunRepository runRepository,
                               ExecutionBackendClient backendClient,
                               StatusStreamService streamService,
                               ExecutorProperties props,
                               @Qualifier("runExecutor") TaskExecutor runExecutor) {
        this.runRepository = runRepository;
        this.backendClient = backendClient;
        this.streamService = streamService;
        this.props = props;
        this.runExecutor = runExecutor;
    }

    /** Dispatches once the surrounding transaction commits, so workers always see the stored row. */
    public void dispatchAfterCommit(UUID runId) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(runId);
                }
            });
        } else {
            dispatch(runId);
        }
    }

    public void dispatch(UUID runId) {
        CancellationToken token = register(runId);
        try {
            runExecutor.execute(() -> {
                try {
                    executeNow(runId, token, null);
                } catch (RuntimeException e) {
                    log.error("Run {} crashed in worker: {}", runId, e.toString(), e);
                    failUnexpectedly(runId, "Internal error while executing run");
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Run queue full, failing run {}", runId);
            tokens.remove(runId);
            if (runRepository.finishEarly(runId, RunStatus.PENDING, RunStatus.FAILED,
                    "Run queue is full, try again later", LocalDateTime.now()) > 0) {
                streamService.publish(StatusStreamService.runKey(runId),
                        StatusEvent.failed(RunStatus.FAILED.name(), "Run queue is full, try again later"));
            }
        }
    }

    public CancellationToken register(UUID runId) {
        return tokens.computeIfAbsent(runId, id -> new CancellationToken());
    }

    /**
     * Runs a PENDING run to completion on the calling thread.
     *
     * @param timeoutCapSeconds upper bound for the run timeout, or null for the manifest value
     * @return the classified result, or null if the run had already left PENDING
     */
    public RunResult executeNow(UUID runId, CancellationToken token, Integer timeoutCapSeconds) {
        String key = StatusStreamService.runKey(runId);
        tokens.putIfAbsent(runId, token);
        try {
            if (runRepository.markStarted(runId, RunStatus.PENDING, RunStatus.RUNNING, LocalDateTime.now()) == 0) {
                log.info("Run {} left PENDING before it started, skipping", runId);
                return null;
            }
            RunEntity run = runRepository.findById(runId).orElseThrow();
            streamService.publish(key, StatusEvent.init(RunStatus.RUNNING.name(), run.getTarget()));
            log.info("Run {} started: {}", runId, String.join(" ", run.getArgv()));

            int timeout = run.getTimeoutSeconds();
            if (timeoutCapSeconds != null && timeoutCapSeconds < timeout) {
                timeout = Math.max(1, timeoutCapSeconds);
            }

            RunResult result = backendClient.execute(run.getArgv(), timeout,
                    new ResourceLimits(run.getMemoryLimit(), run.getCpuLimit()), token);

            finish(run, result);
            return result;
        } finally {
            tokens.remove(runId);
        }
    }

    /**
     * PENDING runs are cancelled directly; RUNNING runs get their token fired and end CANCELLED
     * once the backend call is abandoned.
     *
     * @return true if a cancellation was applied or requested
     */
    public boolean cancel(UUID runId) {
        if (runRepository.finishEarly(runId, RunStatus.PENDING, RunStatus.CANCELLED,
                "Cancelled by user", LocalDateTime.now()) > 0) {
            CancellationToken queued = tokens.remove(runId);
            if (queued != null) {
                queued.cancel();
            }
            streamService.publish(StatusStreamService.runKey(runId),
                    StatusEvent.failed(RunStatus.CANCELLED.name(), "Cancelled by user"));
            log.info("Run {} cancelled before start", runId);
            return true;
        }
        CancellationToken token = tokens.get(runId);
        if (token != null) {
            token.cancel();
            log.info("Cancellation requested for running run {}", runId);
            return true;
        }
        return false;
    }

    private void finish(RunEntity run, RunResult result) {
        run.setStatus(result.status());
        run.setExitCode(result.exitCode());
        run.setStdout(truncate(result.stdout()));
        run.setStderr(truncate(result.stderr()));
        run.setDurationSeconds(result.durationSeconds());
        run.setCompletedAt(LocalDateTime.now());
        run.setErrorMessage(abbreviate(errorMessageFor(result), ERROR_MESSAGE_MAX));
        runRepository.save(run);

        log.info("Run {} finished: status={}, exitCode={}, duration={}s",
                run.getRunId(), result.status(), result.exitCode(), result.durationSeconds());

        String key = StatusStreamService.runKey(run.getRunId());
        if (!run.getStdout().isEmpty()) {
            streamService.publish(key, StatusEvent.outputChunk("stdout", run.getStdout()));
        }
        if (!run.getStderr().isEmpty()) {
            streamService.publish(key, StatusEvent.outputChunk("stderr", run.getStderr()));
        }
        if (result.status() == RunStatus.COMPLETED) {
            streamService.publish(key, StatusEvent.completed(result.status().name(), result.exitCode(), result.durationSeconds()));
        } else {
            streamService.publish(key, StatusEvent.failed(result.status().name(), run.getErrorMessage()));
        }
    }

    private void failUnexpectedly(UUID runId, String message) {
        runRepository.findById(runId).ifPresent(run -> {
            if (!run.getStatus().isTerminal()) {
                run.setStatus(RunStatus.FAILED);
                run.setErrorMessage(message);
                run.setCompletedAt(LocalDateTime.now());
                runRepository.save(run);
                streamService.publish(StatusStreamService.runKey(runId), StatusEvent.failed(RunStatus.FAILED.name(), message));
            }
        });
    }

    static String errorMessageFor(RunResult result) {
        return switch (result.status()) {
            case COMPLETED -> null;
            case FAILED -> result.exitCode() != null
                    ? "Tool exited with code " + result.exitCode()
                    : result.stderr();
            case TIMEOUT, CANCELLED -> result.stderr();
            default -> null;
        };
    }

    // error_message column width
    private static final int ERROR_MESSAGE_MAX = 2000;

    static String abbreviate(String s, int max) {
        if (s == null || s.length() <= max) {
            return s;
        }
        return s.substring(0, max - 3) + "...";
    }

    private String truncate(String s) {
        if (s == null) {
            return "";
        }
        int max = props.getMaxOutputChars();
        return s.length() <= max ? s : s.substring(0, max) + "\n...(truncated)";
    }
}
