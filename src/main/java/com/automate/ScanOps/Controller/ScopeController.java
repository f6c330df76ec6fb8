package com.automate.ScanOps.Controller;

import com.automate.ScanOps.Models.AuthenticatedUser;
import com.automate.ScanOps.Service.ScopeService;
import com.automate.ScanOps.dto.request.ScopeRequest;
import com.automate.ScanOps.dto.response.ScopeResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@CrossOrigin(origins = "${app.cors.allowed-origins:http://localhost:4200}")
@RequestMapping("/api/scopes")
public class ScopeController {

    private final ScopeService scopeService;

    public ScopeController(ScopeService scopeService) {
        this.scopeService = scopeService;
    }

    @GetMapping
    public List<ScopeResponse> listActive() {
        return scopeService.listActive();
    }

    @GetMapping("/{scopeId}")
    public ResponseEntity<ScopeResponse> get(@PathVariable UUID scopeId) {
        return ResponseEntity.ok(scopeService.get(scopeId));
    }

    @PostMapping
    public ResponseEntity<ScopeResponse> create(@AuthenticationPrincipal AuthenticatedUser user,
                                                @Valid @RequestBody ScopeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scopeService.create(user, request));
    }

    @PutMapping("/{scopeId}")
    public ResponseEntity<ScopeResponse> update(@PathVariable UUID scopeId,
                                                @Valid @RequestBody ScopeRequest request) {
        return ResponseEntity.ok(scopeService.update(scopeId, request));
    }

    // soft delete; existing runs keep their scope
    @DeleteMapping("/{scopeId}")
    public ResponseEntity<Void> deactivate(@PathVariable UUID scopeId) {
        scopeService.deactivate(scopeId);
        return ResponseEntity.noContent().build();
    }
}
