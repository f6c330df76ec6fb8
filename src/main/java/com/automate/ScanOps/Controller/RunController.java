package com.automate.ScanOps.Controller;

import com.automate.ScanOps.Models.AuthenticatedUser;
import com.automate.ScanOps.Models.RunStatus;
import com.automate.ScanOps.Service.RunService;
import com.automate.ScanOps.dto.request.CreateRunRequest;
import com.automate.ScanOps.dto.response.PageResponse;
import com.automate.ScanOps.dto.response.RunResponse;
import com.automate.ScanOps.dto.response.RunStatusSnapshot;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@CrossOrigin(origins = "${app.cors.allowed-origins:http://localhost:4200}")
@RequestMapping("/api/runs")
@Slf4j
public class RunController {

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    @PostMapping
    public ResponseEntity<RunResponse> create(@AuthenticationPrincipal AuthenticatedUser user,
                                              @Valid @RequestBody CreateRunRequest request) {
        log.info("Run requested by {}: tool={}, scope={}", user.userId(), request.tool(), request.scopeId());
        return ResponseEntity.status(HttpStatus.CREATED).body(runService.create(user, request));
    }

    @GetMapping
    public ResponseEntity<PageResponse<RunResponse>> list(@AuthenticationPrincipal AuthenticatedUser user,
                                                          @RequestParam(required = false) RunStatus status,
                                                          @RequestParam(defaultValue = "0") int page,
                                                          @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 100),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        return ResponseEntity.ok(runService.list(user, status, pageable));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<RunResponse> get(@AuthenticationPrincipal AuthenticatedUser user,
                                           @PathVariable UUID runId) {
        return ResponseEntity.ok(runService.get(user, runId));
    }

    @GetMapping("/{runId}/status")
    public ResponseEntity<RunStatusSnapshot> status(@AuthenticationPrincipal AuthenticatedUser user,
                                                    @PathVariable UUID runId) {
        return ResponseEntity.ok(runService.getStatus(user, runId));
    }

    @PostMapping("/{runId}/cancel")
    public ResponseEntity<RunResponse> cancel(@AuthenticationPrincipal AuthenticatedUser user,
                                              @PathVariable UUID runId) {
        return ResponseEntity.ok(runService.cancel(user, runId));
    }

    @DeleteMapping("/{runId}")
    public ResponseEntity<Void> delete(@AuthenticationPrincipal AuthenticatedUser user,
                                       @PathVariable UUID runId) {
        runService.delete(user, runId);
        return ResponseEntity.noContent().build();
    }
}
