package com.automate.ScanOps.validation;

import com.automate.ScanOps.Models.ParameterSchema;
import com.automate.ScanOps.Models.ParameterType;
import com.automate.ScanOps.Models.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Checks user supplied tool arguments against a manifest's parameter schema.
 * <p>
 * Order: unknown keys (in the order supplied), then type/enum/pattern of supplied values
 * (in schema order), then required keys (in schema order). The first failure is returned.
 */
@Component
public class ParameterValidator {

    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    public ValidationResult validate(Map<String, Object> params, Map<String, ParameterSchema> schema) {
        Map<String, Object> supplied = params == null ? Map.of() : params;
        Map<String, ParameterSchema> declared = schema == null ? Map.of() : schema;

        for (String key : supplied.keySet()) {
            if (!declared.containsKey(key)) {
                return ValidationResult.reject("Unknown parameter: " + key);
            }
        }

        for (Map.Entry<String, ParameterSchema> entry : declared.entrySet()) {
            String key = entry.getKey();
            ParameterSchema def = entry.getValue();
            Object value = supplied.get(key);
            if (value == null || def == null) {
                continue;
            }

            ParameterType type = def.type() == null ? ParameterType.STRING : def.type();
            if (!type.accepts(value)) {
                return ValidationResult.reject("Parameter " + key + " must be a " + type.wireName());
            }

            if (def.enumValues() != null && !def.enumValues().isEmpty()) {
                String text = ParameterType.stringify(value);
                boolean allowed = def.enumValues().stream()
                        .filter(Objects::nonNull)
                        .map(ParameterType::stringify)
                        .anyMatch(text::equals);
                if (!allowed) {
                    String options = def.enumValues().stream()
                            .map(ParameterType::stringify)
                            .collect(Collectors.joining(", "));
                    return ValidationResult.reject("Parameter " + key + " must be one of: " + options);
                }
            }

            if (def.pattern() != null && value instanceof String s) {
                Pattern p = compile(def.pattern());
                if (p == null || !p.matcher(s).find()) {
                    return ValidationResult.reject("Parameter " + key + " does not match required pattern");
                }
            }
        }

        for (Map.Entry<String, ParameterSchema> entry : declared.entrySet()) {
            ParameterSchema def = entry.getValue();
            if (def != null && def.required() && supplied.get(entry.getKey()) == null) {
                return ValidationResult.reject("Required parameter missing: " + entry.getKey());
            }
        }

        return ValidationResult.ok();
    }

    /**
     * Supplied parameters plus schema defaults for the keys the caller left out.
     * Keeps schema order so the stored copy is stable.
     */
    public Map<String, Object> withDefaults(Map<String, Object> params, Map<String, ParameterSchema> schema) {
        Map<String, Object> supplied = params == null ? Map.of() : params;
        Map<String, Object> merged = new LinkedHashMap<>();
        if (schema != null) {
            schema.forEach((key, def) -> {
                Object value = supplied.get(key);
                if (value == null && def != null && def.defaultValue() != null) {
                    value = def.defaultValue();
                }
                if (value != null) {
                    merged.put(key, value);
                }
            });
        }
        supplied.forEach((key, value) -> {
            if (value != null) {
                merged.putIfAbsent(key, value);
            }
        });
        return merged;
    }

    // an uncompilable pattern fails closed
    private Pattern compile(String regex) {
        try {
            return patternCache.computeIfAbsent(regex, Pattern::compile);
        } catch (PatternSyntaxException e) {
            return null;
        }
    }
}
