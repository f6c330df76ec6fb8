package com.automate.ScanOps.Service;

import com.automate.ScanOps.Models.ManifestDefinition;
import com.automate.ScanOps.Models.ResourceLimits;
import com.automate.ScanOps.Models.ValidationResult;
import com.automate.ScanOps.command.CommandBuilder;
import com.automate.ScanOps.entity.ScopeEntity;
import com.automate.ScanOps.exception.ParameterRejectedException;
import com.automate.ScanOps.exception.TargetRejectedException;
import com.automate.ScanOps.validation.ParameterValidator;
import com.automate.ScanOps.validation.TargetValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Target check, parameter check and argv expansion, in that order. Any rejection stops the
 * pipeline before a command exists, so nothing partial can ever be executed.
 */
@Slf4j
@Component
public class CommandPipeline {

    /** Everything needed to store and execute a run. */
    public record PreparedCommand(
            String target,
            Map<String, Object> params,
            List<String> argv,
            int timeoutSeconds,
            ResourceLimits limits
    ) {}

    private final TargetValidator targetValidator;
    private final ParameterValidator parameterValidator;
    private final CommandBuilder commandBuilder;

    public CommandPipeline(TargetValidator targetValidator,
                           ParameterValidator parameterValidator,
                           CommandBuilder commandBuilder) {
        this.targetValidator = targetValidator;
        this.parameterValidator = parameterValidator;
        this.commandBuilder = commandBuilder;
    }

    public PreparedCommand prepare(ManifestDefinition manifest, ScopeEntity scope, String target,
                                   Map<String, Object> params) {
        ValidationResult safe = targetValidator.sanitize(target);
        if (safe.rejected()) {
            log.warn("Unsafe target rejected: {}", safe.reason());
            throw TargetRejectedException.unsafe(safe.reason());
        }
        String trimmed = target.trim();

        ValidationResult inScope = targetValidator.authorize(trimmed, scope.getAllowedHosts(), scope.getAllowedCidrs());
        if (inScope.rejected()) {
            log.warn("Target {} rejected against scope {}", trimmed, scope.getScopeId());
            throw TargetRejectedException.outOfScope(inScope.reason());
        }

        ValidationResult paramsOk = parameterValidator.validate(params, manifest.argsSchema());
        if (paramsOk.rejected()) {
            throw new ParameterRejectedException(paramsOk.reason());
        }

        Map<String, Object> effective = parameterValidator.withDefaults(params, manifest.argsSchema());
        List<String> argv = commandBuilder.build(manifest.commandTemplate(), effective, trimmed);

        return new PreparedCommand(
                trimmed,
                effective,
                argv,
                manifest.timeoutSeconds(),
                new ResourceLimits(manifest.memoryLimit(), manifest.cpuLimit())
        );
    }
}
