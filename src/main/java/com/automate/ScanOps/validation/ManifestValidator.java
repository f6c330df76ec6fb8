package com.automate.ScanOps.validation;

import com.automate.ScanOps.Models.ManifestDefinition;
import com.automate.ScanOps.Models.ParameterSchema;
import com.automate.ScanOps.Models.ParameterType;
import com.automate.ScanOps.Models.ValidationResult;
import com.automate.ScanOps.command.CommandBuilder;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Structural checks on a manifest before it is published as a new version.
 */
@Component
public class ManifestValidator {

    private static final Pattern NAME = Pattern.compile("^\\w+$");

    public ValidationResult validate(ManifestDefinition manifest) {
        if (manifest == null) {
            return ValidationResult.reject("Manifest is required");
        }
        if (manifest.binary() == null || manifest.binary().isBlank()) {
            return ValidationResult.reject("Manifest binary is required");
        }
        if (manifest.commandTemplate() == null || manifest.commandTemplate().isEmpty()) {
            return ValidationResult.reject("Manifest commandTemplate must not be empty");
        }
        if (manifest.timeoutSeconds() <= 0) {
            return ValidationResult.reject("Manifest timeout must be positive");
        }
        if (manifest.memoryLimit() <= 0) {
            return ValidationResult.reject("Manifest memoryLimit must be positive");
        }
        if (manifest.cpuLimit() <= 0) {
            return ValidationResult.reject("Manifest cpuLimit must be positive");
        }

        Map<String, ParameterSchema> schema = manifest.argsSchema() == null ? Map.of() : manifest.argsSchema();
        for (Map.Entry<String, ParameterSchema> e : schema.entrySet()) {
            ValidationResult r = validateEntry(e.getKey(), e.getValue());
            if (r.rejected()) {
                return r;
            }
        }

        for (String token : manifest.commandTemplate()) {
            if (token == null) {
                return ValidationResult.reject("Manifest commandTemplate contains a null token");
            }
            Matcher m = CommandBuilder.PLACEHOLDER.matcher(token);
            while (m.find()) {
                String name = m.group(1);
                if (!"target".equals(name) && !schema.containsKey(name)) {
                    return ValidationResult.reject("Template placeholder {{" + name + "}} is not declared in argsSchema");
                }
            }
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateEntry(String key, ParameterSchema def) {
        if (key == null || !NAME.matcher(key).matches()) {
            return ValidationResult.reject("Invalid parameter name: " + key);
        }
        if ("target".equals(key)) {
            return ValidationResult.reject("Parameter name 'target' is reserved");
        }
        if (def == null || def.type() == null) {
            return ValidationResult.reject("Parameter " + key + " must declare a type");
        }
        if (def.pattern() != null) {
            try {
                Pattern.compile(def.pattern());
            } catch (PatternSyntaxException ex) {
                return ValidationResult.reject("Parameter " + key + " has an invalid pattern");
            }
        }
        if (def.enumValues() != null && def.type() == ParameterType.BOOLEAN) {
            return ValidationResult.reject("Parameter " + key + " is boolean and cannot declare enum values");
        }
        if (def.defaultValue() != null && !def.type().accepts(def.defaultValue())) {
            return ValidationResult.reject("Default of parameter " + key + " must be a " + def.type().wireName());
        }
        return ValidationResult.ok();
    }
}
