package com.automate.ScanOps.validation;

import com.automate.ScanOps.Models.ManifestDefinition;
import com.automate.ScanOps.Models.ParameterSchema;
import com.automate.ScanOps.Models.ParameterType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ManifestValidatorTest {

    private final ManifestValidator validator = new ManifestValidator();

    private static ManifestDefinition manifest(Map<String, ParameterSchema> schema, List<String> template) {
        return new ManifestDefinition("nmap", schema, template, 600, 512, 1.0);
    }

    @Test
    void acceptsWellFormedManifest() {
        Map<String, ParameterSchema> schema = new LinkedHashMap<>();
        schema.put("ports", ParameterSchema.of(ParameterType.STRING).withDefault("1-1000"));
        schema.put("osDetection", ParameterSchema.of(ParameterType.BOOLEAN));
        ManifestDefinition m = manifest(schema, List.of("nmap", "-p", "{{ports}}", "-O{{osDetection}}", "{{target}}"));
        assertTrue(validator.validate(m).valid());
    }

    @Test
    void undeclaredPlaceholderIsRejected() {
        ManifestDefinition m = manifest(Map.of(), List.of("nmap", "{{timing}}", "{{target}}"));
        assertEquals("Template placeholder {{timing}} is not declared in argsSchema", validator.validate(m).reason());
    }

    @Test
    void blankBinaryAndEmptyTemplate() {
        assertEquals("Manifest binary is required",
                validator.validate(new ManifestDefinition(" ", Map.of(), List.of("x"), 1, 1, 1)).reason());
        assertEquals("Manifest commandTemplate must not be empty",
                validator.validate(manifest(Map.of(), List.of())).reason());
    }

    @Test
    void limitsMustBePositive() {
        assertTrue(validator.validate(new ManifestDefinition("nmap", Map.of(), List.of("nmap"), 0, 512, 1)).rejected());
        assertTrue(validator.validate(new ManifestDefinition("nmap", Map.of(), List.of("nmap"), 10, 0, 1)).rejected());
    }

    @Test
    void targetIsReservedAsParameterName() {
        ManifestDefinition m = manifest(Map.of("target", ParameterSchema.of(ParameterType.STRING)), List.of("x"));
        assertEquals("Parameter name 'target' is reserved", validator.validate(m).reason());
    }

    @Test
    void badPatternAndBooleanEnum() {
        assertTrue(validator.validate(manifest(
                Map.of("p", ParameterSchema.of(ParameterType.STRING).withPattern("[a-")), List.of("x"))).rejected());
        assertTrue(validator.validate(manifest(
                Map.of("b", ParameterSchema.of(ParameterType.BOOLEAN).withEnum(List.of(true))), List.of("x"))).rejected());
    }

    @Test
    void defaultMustMatchType() {
        ManifestDefinition m = manifest(Map.of("threads", ParameterSchema.of(ParameterType.NUMBER).withDefault("ten")),
                List.of("x"));
        assertEquals("Default of parameter threads must be a number", validator.validate(m).reason());
    }
}
