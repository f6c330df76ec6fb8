package com.automate.ScanOps.Controller;

import com.automate.ScanOps.Models.AuthenticatedUser;
import com.automate.ScanOps.Service.ToolCatalogService;
import com.automate.ScanOps.dto.request.PublishManifestRequest;
import com.automate.ScanOps.dto.request.RegisterToolRequest;
import com.automate.ScanOps.dto.request.ToolEnabledRequest;
import com.automate.ScanOps.dto.response.ManifestResponse;
import com.automate.ScanOps.dto.response.ToolResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@CrossOrigin(origins = "${app.cors.allowed-origins:http://localhost:4200}")
@RequestMapping("/api/tools")
public class ToolController {

    private final ToolCatalogService toolCatalogService;

    public ToolController(ToolCatalogService toolCatalogService) {
        this.toolCatalogService = toolCatalogService;
    }

    @GetMapping
    public List<ToolResponse> list() {
        return toolCatalogService.listTools();
    }

    @GetMapping("/{slug}")
    public ResponseEntity<ToolResponse> get(@PathVariable String slug) {
        return ResponseEntity.ok(toolCatalogService.getTool(slug));
    }

    @GetMapping("/{slug}/manifests")
    public List<ManifestResponse> manifests(@PathVariable String slug) {
        return toolCatalogService.listManifests(slug);
    }

    @PostMapping
    public ResponseEntity<ToolResponse> register(@Valid @RequestBody RegisterToolRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(toolCatalogService.registerTool(request));
    }

    @PostMapping("/{slug}/manifests")
    public ResponseEntity<ManifestResponse> publish(@AuthenticationPrincipal AuthenticatedUser user,
                                                    @PathVariable String slug,
                                                    @Valid @RequestBody PublishManifestRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(toolCatalogService.publishManifest(user, slug, request));
    }

    @PatchMapping("/{slug}/enabled")
    public ResponseEntity<ToolResponse> setEnabled(@PathVariable String slug,
                                                   @Valid @RequestBody ToolEnabledRequest request) {
        return ResponseEntity.ok(toolCatalogService.setEnabled(slug, request.enabled()));
    }
}
