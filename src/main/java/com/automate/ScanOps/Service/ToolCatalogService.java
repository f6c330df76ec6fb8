package com.automate.ScanOps.Service;

import com.automate.ScanOps.Config.ExecutorProperties;
import com.automate.ScanOps.Models.AuthenticatedUser;
import com.automate.ScanOps.Models.ManifestDefinition;
import com.automate.ScanOps.Models.ParameterSchema;
import com.automate.ScanOps.Models.ValidationResult;
import com.automate.ScanOps.dto.request.PublishManifestRequest;
import com.automate.ScanOps.dto.request.RegisterToolRequest;
import com.automate.ScanOps.dto.response.ManifestResponse;
import com.automate.ScanOps.dto.response.ToolResponse;
import com.automate.ScanOps.entity.ToolEntity;
import com.automate.ScanOps.entity.ToolManifestEntity;
import com.automate.ScanOps.exception.InvalidManifestException;
import com.automate.ScanOps.exception.ToolAlreadyExistsException;
import com.automate.ScanOps.exception.ToolNotFoundException;
import com.automate.ScanOps.exception.ToolUnavailableException;
import com.automate.ScanOps.repository.ToolManifestRepository;
import com.automate.ScanOps.repository.ToolRepository;
import com.automate.ScanOps.validation.ManifestValidator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tools and their versioned manifests. A published manifest is never edited: publishing
 * stores version n+1 and moves the active flag to it in the same transaction.
 */
@Slf4j
@Service
public class ToolCatalogService {

    private static final TypeReference<LinkedHashMap<String, ParameterSchema>> SCHEMA_TYPE = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /** A tool that passed the launch checks, with the manifest version to run. */
    public record LaunchableTool(ToolEntity tool, ToolManifestEntity manifest, ManifestDefinition definition) {}

    private final ToolRepository toolRepository;
    private final ToolManifestRepository manifestRepository;
    private final ManifestValidator manifestValidator;
    private final ExecutorProperties executorProperties;
    private final ObjectMapper objectMapper;

    public ToolCatalogService(ToolRepository toolRepository,
                              ToolManifestRepository manifestRepository,
                              ManifestValidator manifestValidator,
                              ExecutorProperties executorProperties,
                              ObjectMapper objectMapper) {
        this.toolRepository = toolRepository;
        this.manifestRepository = manifestRepository;
        this.manifestValidator = manifestValidator;
        this.executorProperties = executorProperties;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public ToolResponse registerTool(RegisterToolRequest req) {
        if (toolRepository.existsBySlug(req.slug())) {
            throw new ToolAlreadyExistsException(req.slug());
        }
        ToolEntity tool = new ToolEntity();
        tool.setSlug(req.slug());
        tool.setName(req.name());
        tool.setCategory(req.category());
        tool.setDescription(req.description());
        tool.setEnabled(true);
        tool = toolRepository.save(tool);
        log.info("Registered tool {}", tool.getSlug());
        return toResponse(tool, null);
    }

    @Transactional
    public ManifestResponse publishManifest(AuthenticatedUser user, String slug, PublishManifestRequest req) {
        ToolEntity tool = toolRepository.findBySlug(slug)
                .orElseThrow(() -> new ToolNotFoundException(slug));

        ManifestDefinition definition = new ManifestDefinition(
                req.binary(),
                normalizeSchema(req.argsSchema()),
                req.commandTemplate(),
                req.timeout() != null ? req.timeout() : executorProperties.getDefaultTimeoutSeconds(),
                req.memoryLimit() != null ? req.memoryLimit() : executorProperties.getDefaultMemoryLimit(),
                req.cpuLimit() != null ? req.cpuLimit() : executorProperties.getDefaultCpuLimit()
        );
        ValidationResult result = manifestValidator.validate(definition);
        if (result.rejected()) {
            throw new InvalidManifestException(result.reason());
        }

        int nextVersion = manifestRepository.findMaxVersion(tool.getToolId()) + 1;
        manifestRepository.deactivateAll(tool.getToolId());

        ToolManifestEntity manifest = new ToolManifestEntity();
        manifest.setTool(tool);
        manifest.setVersion(nextVersion);
        manifest.setBinary(definition.binary());
        manifest.setArgsSchema(objectMapper.convertValue(definition.argsSchema(), MAP_TYPE));
        manifest.setCommandTemplate(List.copyOf(definition.commandTemplate()));
        manifest.setTimeoutSeconds(definition.timeoutSeconds());
        manifest.setMemoryLimit(definition.memoryLimit());
        manifest.setCpuLimit(definition.cpuLimit());
        manifest.setActive(true);
        manifest.setCreatedBy(user.userId());
        manifest = manifestRepository.save(manifest);

        log.info("Published manifest v{} for tool {} by {}", nextVersion, slug, user.userId());
        return toManifestResponse(manifest);
    }

    @Transactional
    public ToolResponse setEnabled(String slug, boolean enabled) {
        ToolEntity tool = toolRepository.findBySlug(slug)
                .orElseThrow(() -> new ToolNotFoundException(slug));
        tool.setEnabled(enabled);
        toolRepository.save(tool);
        log.info("Tool {} {}", slug, enabled ? "enabled" : "disabled");
        return toResponse(tool, manifestRepository.findByTool_ToolIdAndActiveTrue(tool.getToolId()).orElse(null));
    }

    @Transactional(readOnly = true)
    public List<ToolResponse> listTools() {
        return toolRepository.findAllByOrderByCategoryAscSlugAsc().stream()
                .map(t -> toResponse(t, manifestRepository.findByTool_ToolIdAndActiveTrue(t.getToolId()).orElse(null)))
                .toList();
    }

    @Transactional(readOnly = true)
    public ToolResponse getTool(String slug) {
        ToolEntity tool = toolRepository.findBySlug(slug)
                .orElseThrow(() -> new ToolNotFoundException(slug));
        return toResponse(tool, manifestRepository.findByTool_ToolIdAndActiveTrue(tool.getToolId()).orElse(null));
    }

    @Transactional(readOnly = true)
    public List<ManifestResponse> listManifests(String slug) {
        ToolEntity tool = toolRepository.findBySlug(slug)
                .orElseThrow(() -> new ToolNotFoundException(slug));
        return manifestRepository.findByTool_ToolIdOrderByVersionDesc(tool.getToolId()).stream()
                .map(this::toManifestResponse)
                .toList();
    }

    /** Tool exists, is enabled and has an active manifest. */
    @Transactional(readOnly = true)
    public LaunchableTool resolveLaunchable(String slug) {
        ToolEntity tool = toolRepository.findBySlug(slug)
                .orElseThrow(() -> new ToolNotFoundException(slug));
        if (!tool.isEnabled()) {
            throw ToolUnavailableException.disabled(slug);
        }
        ToolManifestEntity manifest = manifestRepository.findByTool_ToolIdAndActiveTrue(tool.getToolId())
                .orElseThrow(() -> ToolUnavailableException.noActiveManifest(slug));
        return new LaunchableTool(tool, manifest, toDefinition(manifest));
    }

    @Transactional(readOnly = true)
    public boolean isLaunchable(String slug) {
        return toolRepository.findBySlug(slug)
                .filter(ToolEntity::isEnabled)
                .flatMap(t -> manifestRepository.findByTool_ToolIdAndActiveTrue(t.getToolId()))
                .isPresent();
    }

    public ManifestDefinition toDefinition(ToolManifestEntity m) {
        return new ManifestDefinition(
                m.getBinary(),
                readSchema(m.getArgsSchema()),
                m.getCommandTemplate(),
                m.getTimeoutSeconds(),
                m.getMemoryLimit(),
                m.getCpuLimit()
        );
    }

    /**
     * Accepts either {@code {name: def}} or {@code {type: object, properties: {...}, required: [...]}}.
     */
    Map<String, ParameterSchema> normalizeSchema(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return new LinkedHashMap<>();
        }
        Object properties = raw.get("properties");
        if (!(properties instanceof Map<?, ?>)) {
            return readSchema(raw);
        }
        Map<String, ParameterSchema> schema = readSchema(objectMapper.convertValue(properties, MAP_TYPE));
        if (raw.get("required") instanceof List<?> required) {
            for (Object key : required) {
                ParameterSchema def = schema.get(String.valueOf(key));
                if (def != null) {
                    schema.put(String.valueOf(key), def.asRequired());
                }
            }
        }
        return schema;
    }

    private Map<String, ParameterSchema> readSchema(Map<String, Object> raw) {
        if (raw == null) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.convertValue(raw, SCHEMA_TYPE);
        } catch (IllegalArgumentException e) {
            throw new InvalidManifestException("Manifest argsSchema is malformed");
        }
    }

    ToolResponse toResponse(ToolEntity t, ToolManifestEntity active) {
        return new ToolResponse(
                t.getToolId(),
                t.getSlug(),
                t.getName(),
                t.getCategory(),
                t.getDescription(),
                t.isEnabled(),
                active == null ? null : toManifestResponse(active),
                t.getCreatedAt()
        );
    }

    ManifestResponse toManifestResponse(ToolManifestEntity m) {
        return new ManifestResponse(
                m.getManifestId(),
                m.getVersion(),
                m.getBinary(),
                readSchema(m.getArgsSchema()),
                m.getCommandTemplate(),
                m.getTimeoutSeconds(),
                m.getMemoryLimit(),
                m.getCpuLimit(),
                m.isActive(),
                m.getCreatedAt()
        );
    }
}
