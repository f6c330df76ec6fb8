package com.automate.ScanOps.Service;

import com.automate.ScanOps.Models.AuthenticatedUser;
import com.automate.ScanOps.Models.RunStatus;
import com.automate.ScanOps.dto.request.CreateRunRequest;
import com.automate.ScanOps.dto.response.PageResponse;
import com.automate.ScanOps.dto.response.RunResponse;
import com.automate.ScanOps.dto.response.RunStatusSnapshot;
import com.automate.ScanOps.entity.RunEntity;
import com.automate.ScanOps.entity.ScopeEntity;
import com.automate.ScanOps.exception.InvalidStateTransitionException;
import com.automate.ScanOps.exception.NothingToDoException;
import com.automate.ScanOps.exception.RunNotFoundException;
import com.automate.ScanOps.repository.RunRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
public class RunService {

    private final RunRepository runRepository;
    private final ToolCatalogService toolCatalogService;
    private final ScopeService scopeService;
    private final CommandPipeline commandPipeline;
    private final RunExecutionService runExecutionService;
    private final StatusStreamService streamService;

    public RunService(RunRepository runRepository,
                      ToolCatalogService toolCatalogService,
                      ScopeService scopeService,
                      CommandPipeline commandPipeline,
                      RunExecutionService runExecutionService,
                      StatusStreamService streamService) {
        this.runRepository = runRepository;
        this.toolCatalogService = toolCatalogService;
        this.scopeService = scopeService;
        this.commandPipeline = commandPipeline;
        this.runExecutionService = runExecutionService;
        this.streamService = streamService;
    }

    /**
     * Validates and stores a PENDING run, then hands it to the worker pool.
     * Nothing is stored when the tool, scope, target or parameters are rejected.
     */
    @Transactional
    public RunResponse create(AuthenticatedUser user, CreateRunRequest req) {
        RunEntity run = prepareRun(user.userId(), req.tool(), scopeService.requireActive(req.scopeId()),
                req.target(), req.params(), null);
        run = runRepository.save(run);
        log.info("Run {} created by {} for tool {} against {}", run.getRunId(), user.userId(), req.tool(), run.getTarget());

        runExecutionService.dispatchAfterCommit(run.getRunId());
        return toResponse(run);
    }

    /**
     * Builds an unsaved PENDING run. Shared with the smart-scan orchestrator so that both paths
     * go through the same tool, target and parameter checks.
     */
    @Transactional(readOnly = true)
    public RunEntity prepareRun(UUID ownerId, String toolSlug, ScopeEntity scope, String target,
                                Map<String, Object> params, UUID smartScanId) {
        ToolCatalogService.LaunchableTool launchable = toolCatalogService.resolveLaunchable(toolSlug);
        CommandPipeline.PreparedCommand prepared = commandPipeline.prepare(launchable.definition(), scope, target, params);

        RunEntity run = new RunEntity();
        run.setUserId(ownerId);
        run.setTool(launchable.tool());
        run.setManifestVersion(launchable.manifest().getVersion());
        run.setScope(scope);
        run.setTarget(prepared.target());
        run.setParams(prepared.params());
        run.setArgv(prepared.argv());
        run.setTimeoutSeconds(prepared.timeoutSeconds());
        run.setMemoryLimit(prepared.limits().memoryLimitMb());
        run.setCpuLimit(prepared.limits().cpuLimit());
        run.setStatus(RunStatus.PENDING);
        run.setSmartScanId(smartScanId);
        return run;
    }

    @Transactional(readOnly = true)
    public RunResponse get(AuthenticatedUser user, UUID runId) {
        return toResponse(load(user, runId));
    }

    @Transactional(readOnly = true)
    public RunStatusSnapshot getStatus(AuthenticatedUser user, UUID runId) {
        return toSnapshot(load(user, runId));
    }

    @Transactional(readOnly = true)
    public PageResponse<RunResponse> list(AuthenticatedUser user, RunStatus status, Pageable pageable) {
        Page<RunEntity> page;
        if (user.isAdmin()) {
            page = status == null ? runRepository.findAll(pageable) : runRepository.findByStatus(status, pageable);
        } else {
            page = status == null
                    ? runRepository.findByUserId(user.userId(), pageable)
                    : runRepository.findByUserIdAndStatus(user.userId(), status, pageable);
        }
        return PageResponse.of(page, this::toResponse);
    }

    @Transactional
    public RunResponse cancel(AuthenticatedUser user, UUID runId) {
        RunEntity run = load(user, runId);
        if (run.getStatus() == RunStatus.CANCELLED) {
            throw NothingToDoException.alreadyCancelled("Run", runId);
        }
        if (run.getStatus().isTerminal()) {
            throw NothingToDoException.alreadyFinished("Run", runId, run.getStatus());
        }
        if (!runExecutionService.cancel(runId)) {
            // finished between the read and the cancel
            RunEntity now = runRepository.findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
            throw NothingToDoException.alreadyFinished("Run", runId, now.getStatus());
        }
        log.info("Run {} cancel requested by {}", runId, user.userId());
        return get(user, runId);
    }

    /** Only terminal runs may be deleted; active ones must be cancelled first. */
    @Transactional
    public void delete(AuthenticatedUser user, UUID runId) {
        RunEntity run = load(user, runId);
        if (!run.getStatus().isTerminal()) {
            throw new InvalidStateTransitionException(
                    "Cannot delete run " + runId + " while it is " + run.getStatus() + "; cancel it first");
        }
        runRepository.delete(run);
        streamService.close(StatusStreamService.runKey(runId));
        log.info("Run {} deleted by {}", runId, user.userId());
    }

    private RunEntity load(AuthenticatedUser user, UUID runId) {
        RunEntity run = runRepository.findById(runId)
                .orElseThrow(() -> new RunNotFoundException(runId));
        if (!user.canView(run.getUserId())) {
            throw new RunNotFoundException(runId);
        }
        return run;
    }

    RunResponse toResponse(RunEntity r) {
        return new RunResponse(
                r.getRunId(),
                r.getUserId(),
                r.getTool().getSlug(),
                r.getManifestVersion(),
                r.getScope().getScopeId(),
                r.getTarget(),
                r.getParams(),
                r.getArgv(),
                r.getTimeoutSeconds(),
                r.getStatus(),
                r.getExitCode(),
                r.getStdout(),
                r.getStderr(),
                r.getDurationSeconds(),
                r.getErrorMessage(),
                r.getSmartScanId(),
                r.getCreatedAt(),
                r.getStartedAt(),
                r.getCompletedAt()
        );
    }

    static RunStatusSnapshot toSnapshot(RunEntity r) {
        return new RunStatusSnapshot(
                r.getRunId(),
                r.getTarget(),
                r.getStatus(),
                r.getExitCode(),
                r.getStdout() == null ? "" : r.getStdout(),
                r.getStderr() == null ? "" : r.getStderr(),
                r.getDurationSeconds(),
                r.getErrorMessage()
        );
    }
}
