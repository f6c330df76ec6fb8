package com.automate.ScanOps.Service;

import com.automate.ScanOps.Models.AuthenticatedUser;
import com.automate.ScanOps.dto.request.ScopeRequest;
import com.automate.ScanOps.dto.response.ScopeResponse;
import com.automate.ScanOps.entity.ScopeEntity;
import com.automate.ScanOps.exception.InvalidScopeException;
import com.automate.ScanOps.exception.ScopeInactiveException;
import com.automate.ScanOps.exception.ScopeNotFoundException;
import com.automate.ScanOps.repository.ScopeRepository;
import com.automate.ScanOps.validation.TargetValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

@Slf4j
@Service
public class ScopeService {

    // hostname, *.suffix wildcard or IPv4 literal
    private static final Pattern HOST_PATTERN =
            Pattern.compile("^(\\*\\.)?[a-z0-9]([a-z0-9-]{0,62})?(\\.[a-z0-9]([a-z0-9-]{0,62})?)*$");

    private final ScopeRepository scopeRepository;

    public ScopeService(ScopeRepository scopeRepository) {
        this.scopeRepository = scopeRepository;
    }

    @Transactional
    public ScopeResponse create(AuthenticatedUser user, ScopeRequest req) {
        ScopeEntity scope = new ScopeEntity();
        scope.setCreatedBy(user.userId());
        apply(scope, req);
        scope = scopeRepository.save(scope);
        log.info("Scope {} '{}' created by {}", scope.getScopeId(), scope.getName(), user.userId());
        return toResponse(scope);
    }

    @Transactional
    public ScopeResponse update(UUID scopeId, ScopeRequest req) {
        ScopeEntity scope = scopeRepository.findById(scopeId)
                .orElseThrow(() -> new ScopeNotFoundException(scopeId));
        apply(scope, req);
        log.info("Scope {} updated", scopeId);
        return toResponse(scopeRepository.save(scope));
    }

    /** Scopes are never deleted; runs keep pointing at the one they were validated against. */
    @Transactional
    public void deactivate(UUID scopeId) {
        ScopeEntity scope = scopeRepository.findById(scopeId)
                .orElseThrow(() -> new ScopeNotFoundException(scopeId));
        if (scope.isActive()) {
            scope.setActive(false);
            scopeRepository.save(scope);
            log.info("Scope {} deactivated", scopeId);
        }
    }

    @Transactional(readOnly = true)
    public List<ScopeResponse> listActive() {
        return scopeRepository.findByActiveTrueOrderByNameAsc().stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public ScopeResponse get(UUID scopeId) {
        return scopeRepository.findById(scopeId)
                .map(this::toResponse)
                .orElseThrow(() -> new ScopeNotFoundException(scopeId));
    }

    /** Loads a scope that may be used to authorize new work. */
    @Transactional(readOnly = true)
    public ScopeEntity requireActive(UUID scopeId) {
        ScopeEntity scope = scopeRepository.findById(scopeId)
                .orElseThrow(() -> new ScopeNotFoundException(scopeId));
        if (!scope.isActive()) {
            throw new ScopeInactiveException(scopeId);
        }
        return scope;
    }

    private void apply(ScopeEntity scope, ScopeRequest req) {
        List<String> hosts = normalizeHosts(req.allowedHosts());
        List<String> cidrs = normalizeCidrs(req.allowedCidrs());
        scope.setName(req.name().trim());
        scope.setDescription(req.description());
        scope.setAllowedHosts(hosts);
        scope.setAllowedCidrs(cidrs);
    }

    private static List<String> normalizeHosts(List<String> hosts) {
        List<String> out = new ArrayList<>();
        if (hosts == null) {
            return out;
        }
        for (String h : hosts) {
            if (h == null || h.isBlank()) {
                continue;
            }
            String normalized = h.trim().toLowerCase(Locale.ROOT);
            if (!HOST_PATTERN.matcher(normalized).matches()) {
                throw new InvalidScopeException("Invalid host pattern: " + h);
            }
            if (!out.contains(normalized)) {
                out.add(normalized);
            }
        }
        return out;
    }

    private static List<String> normalizeCidrs(List<String> cidrs) {
        List<String> out = new ArrayList<>();
        if (cidrs == null) {
            return out;
        }
        for (String c : cidrs) {
            if (c == null || c.isBlank()) {
                continue;
            }
            String trimmed = c.trim();
            if (!TargetValidator.isValidCidr(trimmed)) {
                throw new InvalidScopeException("Invalid CIDR: " + c);
            }
            if (!out.contains(trimmed)) {
                out.add(trimmed);
            }
        }
        return out;
    }

    ScopeResponse toResponse(ScopeEntity s) {
        return new ScopeResponse(
                s.getScopeId(),
                s.getName(),
                s.getDescription(),
                List.copyOf(s.getAllowedHosts() == null ? List.of() : s.getAllowedHosts()),
                List.copyOf(s.getAllowedCidrs() == null ? List.of() : s.getAllowedCidrs()),
                s.isActive(),
                s.getCreatedAt(),
                s.getUpdatedAt()
        );
    }
}
