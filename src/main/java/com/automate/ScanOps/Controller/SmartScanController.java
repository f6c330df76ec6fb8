package com.automate.ScanOps.Controller;

import com.automate.ScanOps.Models.AuthenticatedUser;
import com.automate.ScanOps.Models.SmartScanStatus;
import com.automate.ScanOps.Service.SmartScanService;
import com.automate.ScanOps.dto.request.CreateSmartScanRequest;
import com.automate.ScanOps.dto.response.PageResponse;
import com.automate.ScanOps.dto.response.SmartScanResponse;
import com.automate.ScanOps.dto.response.SmartScanStatusSnapshot;
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
@RequestMapping("/api/smart-scans")
@Slf4j
public class SmartScanController {

    private final SmartScanService smartScanService;

    public SmartScanController(SmartScanService smartScanService) {
        this.smartScanService = smartScanService;
    }

    @PostMapping
    public ResponseEntity<SmartScanResponse> create(@AuthenticationPrincipal AuthenticatedUser user,
                                                    @Valid @RequestBody CreateSmartScanRequest request) {
        log.info("Smart scan requested by {} against {}", user.userId(), request.target());
        return ResponseEntity.status(HttpStatus.CREATED).body(smartScanService.create(user, request));
    }

    @GetMapping
    public ResponseEntity<PageResponse<SmartScanResponse>> list(@AuthenticationPrincipal AuthenticatedUser user,
                                                                @RequestParam(required = false) SmartScanStatus status,
                                                                @RequestParam(defaultValue = "0") int page,
                                                                @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 100),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        return ResponseEntity.ok(smartScanService.list(user, status, pageable));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SmartScanResponse> get(@AuthenticationPrincipal AuthenticatedUser user,
                                                 @PathVariable UUID sessionId) {
        return ResponseEntity.ok(smartScanService.get(user, sessionId));
    }

    @GetMapping("/{sessionId}/status")
    public ResponseEntity<SmartScanStatusSnapshot> status(@AuthenticationPrincipal AuthenticatedUser user,
                                                          @PathVariable UUID sessionId) {
        return ResponseEntity.ok(smartScanService.getStatus(user, sessionId));
    }

    @PostMapping("/{sessionId}/start")
    public ResponseEntity<SmartScanResponse> start(@AuthenticationPrincipal AuthenticatedUser user,
                                                   @PathVariable UUID sessionId) {
        return ResponseEntity.ok(smartScanService.start(user, sessionId));
    }

    @PostMapping("/{sessionId}/cancel")
    public ResponseEntity<SmartScanResponse> cancel(@AuthenticationPrincipal AuthenticatedUser user,
                                                    @PathVariable UUID sessionId) {
        return ResponseEntity.ok(smartScanService.cancel(user, sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> delete(@AuthenticationPrincipal AuthenticatedUser user,
                                       @PathVariable UUID sessionId) {
        smartScanService.delete(user, sessionId);
        return ResponseEntity.noContent().build();
    }
}
