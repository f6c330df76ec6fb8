package com.automate.ScanOps.Service;

import com.automate.ScanOps.Config.SmartScanProperties;
import com.automate.ScanOps.Models.AuthenticatedUser;
import com.automate.ScanOps.Models.ScanObjective;
import com.automate.ScanOps.Models.SmartScanStatus;
import com.automate.ScanOps.Models.SmartScanStepStatus;
import com.automate.ScanOps.Models.StatusEvent;
import com.automate.ScanOps.Models.ValidationResult;
import com.automate.ScanOps.dto.request.CreateSmartScanRequest;
import com.automate.ScanOps.dto.response.FindingResponse;
import com.automate.ScanOps.dto.response.PageResponse;
import com.automate.ScanOps.dto.response.SmartScanResponse;
import com.automate.ScanOps.dto.response.SmartScanStatusSnapshot;
import com.automate.ScanOps.dto.response.SmartScanStepResponse;
import com.automate.ScanOps.entity.ScopeEntity;
import com.automate.ScanOps.entity.SmartScanSessionEntity;
import com.automate.ScanOps.entity.SmartScanStepEntity;
import com.automate.ScanOps.exception.InvalidStateTransitionException;
import com.automate.ScanOps.exception.NothingToDoException;
import com.automate.ScanOps.exception.ScanAdmissionConflictException;
import com.automate.ScanOps.exception.ScanCancelConflictException;
import com.automate.ScanOps.exception.ScanNotFoundException;
import com.automate.ScanOps.exception.TargetRejectedException;
import com.automate.ScanOps.repository.SmartScanSessionRepository;
import com.automate.ScanOps.validation.TargetValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Smart-scan sessions: planning, admission, cancellation and read models.
 * Step execution lives in {@link SmartScanRunner}.
 */
@Slf4j
@Service
public class SmartScanService {

    private final SmartScanSessionRepository sessionRepository;
    private final ScopeService scopeService;
    private final ToolCatalogService toolCatalogService;
    private final SmartScanPlanner planner;
    private final TargetValidator targetValidator;
    private final ScanAdmissionGate gate;
    private final SmartScanRunner runner;
    private final StatusStreamService streamService;
    private final SmartScanProperties props;
    private final TransactionTemplate tx;

    public SmartScanService(SmartScanSessionRepository sessionRepository,
                            ScopeService scopeService,
                            ToolCatalogService toolCatalogService,
                            SmartScanPlanner planner,
                            TargetValidator targetValidator,
                            ScanAdmissionGate gate,
                            SmartScanRunner runner,
                            StatusStreamService streamService,
                            SmartScanProperties props,
                            TransactionTemplate tx) {
        this.sessionRepository = sessionRepository;
        this.scopeService = scopeService;
        this.toolCatalogService = toolCatalogService;
        this.planner = planner;
        this.targetValidator = targetValidator;
        this.gate = gate;
        this.runner = runner;
        this.streamService = streamService;
        this.props = props;
        this.tx = tx;
    }

    /** Validates the target against the scope and stores the session CREATED with its planned steps. */
    @Transactional
    public SmartScanResponse create(AuthenticatedUser user, CreateSmartScanRequest req) {
        ScopeEntity scope = scopeService.requireActive(req.scopeId());

        ValidationResult safe = targetValidator.sanitize(req.target());
        if (safe.rejected()) {
            throw TargetRejectedException.unsafe(safe.reason());
        }
        String target = req.target().trim();
        ValidationResult inScope = targetValidator.authorize(target, scope.getAllowedHosts(), scope.getAllowedCidrs());
        if (inScope.rejected()) {
            throw TargetRejectedException.outOfScope(inScope.reason());
        }

        ScanObjective objective = req.objective() != null ? req.objective() : ScanObjective.COMPREHENSIVE;
        int maxTools = req.maxTools() != null ? req.maxTools() : props.getDefaultMaxTools();

        SmartScanSessionEntity session = new SmartScanSessionEntity();
        session.setUserId(user.userId());
        session.setName(req.name() == null || req.name().isBlank() ? "Smart Scan - " + target : req.name().trim());
        session.setTarget(target);
        session.setScope(scope);
        session.setObjective(objective);
        session.setMaxTools(maxTools);
        session.setStatus(SmartScanStatus.CREATED);
        session.setProgress(0);

        int number = 1;
        for (SmartScanPlanner.PlannedStep planned : planner.plan(objective, maxTools, toolCatalogService::isLaunchable)) {
            SmartScanStepEntity step = new SmartScanStepEntity();
            step.setStepNumber(number++);
            step.setPhase(planned.phase());
            step.setName(planned.name());
            step.setDescription(planned.description());
            step.setToolSlug(planned.toolSlug());
            step.setParams(planned.params());
            step.setTarget(target);
            step.setCritical(planned.critical());
            step.setStatus(SmartScanStepStatus.PENDING);
            session.addStep(step);
        }
        session.setCurrentPhase(session.getSteps().get(0).getPhase());

        session = sessionRepository.save(session);
        log.info("Smart scan {} created by {} against {} ({} steps, objective {})",
                session.getSessionId(), user.userId(), target, session.getSteps().size(), objective.wireName());
        return toResponse(session, true);
    }

    /**
     * Moves a CREATED session to RUNNING if the admission token is free. When another session
     * holds the token the call is rejected and neither session changes.
     */
    public SmartScanResponse start(AuthenticatedUser user, UUID sessionId) {
        SmartScanSessionEntity session = tx.execute(status -> load(user, sessionId));
        checkStartable(session);

        if (!gate.tryAcquire(sessionId)) {
            UUID holder = gate.holder().orElse(null);
            if (sessionId.equals(holder)) {
                throw NothingToDoException.alreadyStarted("Scan", sessionId);
            }
            log.warn("Smart scan {} start rejected, scan {} is running", sessionId, holder);
            throw new ScanAdmissionConflictException(sessionId, holder);
        }

        String target;
        try {
            target = tx.execute(status -> {
                SmartScanSessionEntity s = load(user, sessionId);
                checkStartable(s);
                s.setStatus(SmartScanStatus.RUNNING);
                s.setStartedAt(LocalDateTime.now());
                return s.getTarget();
            });
            streamService.publish(StatusStreamService.scanKey(sessionId),
                    StatusEvent.init(SmartScanStatus.RUNNING.name(), target));
            runner.launch(sessionId);
        } catch (RuntimeException e) {
            gate.release(sessionId);
            throw e;
        }
        log.info("Smart scan {} started by {}", sessionId, user.userId());
        return reload(user, sessionId);
    }

    private static void checkStartable(SmartScanSessionEntity session) {
        if (session.getStatus() == SmartScanStatus.RUNNING) {
            throw NothingToDoException.alreadyStarted("Scan", session.getSessionId());
        }
        if (session.getStatus() != SmartScanStatus.CREATED) {
            throw new InvalidStateTransitionException(
                    "Cannot start scan " + session.getSessionId() + " because status = " + session.getStatus());
        }
    }

    public SmartScanResponse cancel(AuthenticatedUser user, UUID sessionId) {
        SmartScanSessionEntity session = tx.execute(status -> load(user, sessionId));
        switch (session.getStatus()) {
            case CREATED -> cancelCreated(sessionId);
            case RUNNING -> {
                if (!runner.cancel(sessionId)) {
                    // finished or cancelled between the read and the cancel
                    SmartScanStatus now = tx.execute(status -> load(user, sessionId).getStatus());
                    throw conflictFor(sessionId, now);
                }
            }
            default -> throw conflictFor(sessionId, session.getStatus());
        }
        log.info("Smart scan {} cancelled by {}", sessionId, user.userId());
        return reload(user, sessionId);
    }

    private void cancelCreated(UUID sessionId) {
        Boolean applied = tx.execute(status -> {
            SmartScanSessionEntity s = sessionRepository.findWithSteps(sessionId)
                    .orElseThrow(() -> new ScanNotFoundException(sessionId));
            if (s.getStatus() != SmartScanStatus.CREATED) {
                return false;
            }
            SmartScanRunner.skipRemaining(s);
            SmartScanRunner.finishSession(s, SmartScanStatus.CANCELLED, SmartScanRunner.CANCELLED_BY_USER);
            return true;
        });
        if (!Boolean.TRUE.equals(applied)) {
            // started concurrently; cancel it as a running session
            if (!runner.cancel(sessionId)) {
                throw conflictFor(sessionId, tx.execute(status -> sessionRepository.findById(sessionId)
                        .map(SmartScanSessionEntity::getStatus)
                        .orElseThrow(() -> new ScanNotFoundException(sessionId))));
            }
            return;
        }
        streamService.publish(StatusStreamService.scanKey(sessionId),
                StatusEvent.failed(SmartScanStatus.CANCELLED.name(), SmartScanRunner.CANCELLED_BY_USER));
    }

    private static RuntimeException conflictFor(UUID sessionId, SmartScanStatus status) {
        if (status == SmartScanStatus.CANCELLED) {
            return NothingToDoException.alreadyCancelled("Scan", sessionId);
        }
        return new ScanCancelConflictException(sessionId, status.name());
    }

    /** Sessions can be deleted before they start or once they are finished. */
    @Transactional
    public void delete(AuthenticatedUser user, UUID sessionId) {
        SmartScanSessionEntity session = load(user, sessionId);
        if (session.getStatus() != SmartScanStatus.CREATED && !session.getStatus().isTerminal()) {
            throw new InvalidStateTransitionException(
                    "Cannot delete scan " + sessionId + " while it is " + session.getStatus() + "; cancel it first");
        }
        sessionRepository.delete(session);
        streamService.close(StatusStreamService.scanKey(sessionId));
        log.info("Smart scan {} deleted by {}", sessionId, user.userId());
    }

    @Transactional(readOnly = true)
    public SmartScanResponse get(AuthenticatedUser user, UUID sessionId) {
        return toResponse(load(user, sessionId), true);
    }

    @Transactional(readOnly = true)
    public SmartScanStatusSnapshot getStatus(AuthenticatedUser user, UUID sessionId) {
        return toSnapshot(load(user, sessionId));
    }

    /** Summaries only; steps and findings come with {@link #get}. */
    @Transactional(readOnly = true)
    public PageResponse<SmartScanResponse> list(AuthenticatedUser user, SmartScanStatus status, Pageable pageable) {
        Page<SmartScanSessionEntity> page;
        if (user.isAdmin()) {
            page = status == null ? sessionRepository.findAll(pageable) : sessionRepository.findByStatus(status, pageable);
        } else {
            page = status == null
                    ? sessionRepository.findByUserId(user.userId(), pageable)
                    : sessionRepository.findByUserIdAndStatus(user.userId(), status, pageable);
        }
        return PageResponse.of(page, s -> toResponse(s, false));
    }

    private SmartScanResponse reload(AuthenticatedUser user, UUID sessionId) {
        return tx.execute(status -> toResponse(load(user, sessionId), true));
    }

    private SmartScanSessionEntity load(AuthenticatedUser user, UUID sessionId) {
        SmartScanSessionEntity session = sessionRepository.findWithSteps(sessionId)
                .orElseThrow(() -> new ScanNotFoundException(sessionId));
        if (!user.canView(session.getUserId())) {
            throw new ScanNotFoundException(sessionId);
        }
        return session;
    }

    SmartScanResponse toResponse(SmartScanSessionEntity s, boolean detailed) {
        List<SmartScanStepResponse> steps = !detailed ? List.of() : s.getSteps().stream()
                .map(st -> new SmartScanStepResponse(
                        st.getStepNumber(),
                        st.getPhase(),
                        st.getName(),
                        st.getDescription(),
                        st.getToolSlug(),
                        st.isCritical(),
                        st.getStatus(),
                        st.getStartedAt(),
                        st.getCompletedAt(),
                        st.getDurationSeconds(),
                        st.getErrorMessage(),
                        st.getRunId()))
                .toList();
        List<FindingResponse> findings = !detailed ? List.of() : s.getFindings().stream()
                .map(f -> new FindingResponse(
                        f.getFindingId(),
                        f.getTitle(),
                        f.getSeverity(),
                        f.getCategory(),
                        f.getTool(),
                        f.getDescription(),
                        f.getRunId(),
                        f.getCreatedAt()))
                .toList();
        return new SmartScanResponse(
                s.getSessionId(),
                s.getUserId(),
                s.getName(),
                s.getTarget(),
                s.getScope().getScopeId(),
                s.getObjective(),
                s.getMaxTools(),
                s.getStatus(),
                s.getProgress(),
                s.getCurrentPhase(),
                s.getTotalFindings(),
                s.getCriticalFindings(),
                s.getHighFindings(),
                s.getRiskScore(),
                s.getErrorMessage(),
                steps,
                findings,
                s.getCreatedAt(),
                s.getStartedAt(),
                s.getCompletedAt()
        );
    }

    static SmartScanStatusSnapshot toSnapshot(SmartScanSessionEntity s) {
        List<SmartScanStatusSnapshot.StepState> steps = s.getSteps().stream()
                .map(st -> new SmartScanStatusSnapshot.StepState(
                        st.getStepNumber(),
                        st.getName(),
                        st.getPhase(),
                        st.getToolSlug(),
                        st.getStatus(),
                        st.getDurationSeconds(),
                        st.getErrorMessage(),
                        st.getRunId()))
                .toList();
        return new SmartScanStatusSnapshot(
                s.getSessionId(),
                s.getTarget(),
                s.getStatus(),
                s.getProgress(),
                s.getCurrentPhase(),
                steps,
                s.getTotalFindings(),
                s.getRiskScore(),
                s.getErrorMessage()
        );
    }
}
