package com.automate.ScanOps.validation;

import com.automate.ScanOps.Models.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TargetValidatorTest {

    private final TargetValidator validator = new TargetValidator();

    @Test
    void rejectsBlankTarget() {
        ValidationResult result = validator.sanitize("   ");
        assertFalse(result.valid());
        assertEquals("Target is required", result.reason());
        assertEquals("Target is required", validator.sanitize(null).reason());
    }

    @Test
    void rejectsShellMetacharacters() {
        for (String target : List.of("example.com; rm -rf /", "a|b", "$(id)", "`id`", "a&&b", "x>y", "q'uote", "back\\slash")) {
            ValidationResult result = validator.sanitize(target);
            assertTrue(result.rejected(), target);
            assertEquals("Target contains potentially dangerous characters", result.reason());
        }
    }

    @Test
    void rejectsNewlines() {
        assertEquals("Target contains newline characters", validator.sanitize("example.com\nevil").reason());
        assertEquals("Target contains newline characters", validator.sanitize("example.com\r").reason());
    }

    @Test
    void dangerousCharactersAreReportedBeforeLength() {
        String longAndDangerous = "a".repeat(300) + ";";
        assertEquals("Target contains potentially dangerous characters", validator.sanitize(longAndDangerous).reason());
        assertEquals("Target exceeds maximum length", validator.sanitize("a".repeat(256)).reason());
        assertTrue(validator.sanitize("a".repeat(255)).valid());
    }

    @Test
    void acceptsUrlsAndHosts() {
        assertTrue(validator.sanitize("https://app.example.com:8443/login?x=1").valid());
        assertTrue(validator.sanitize("10.0.0.5").valid());
    }

    @Test
    void exactHostMatchIsCaseInsensitive() {
        assertTrue(validator.authorize("App.Example.com", List.of("app.example.com"), List.of()).valid());
        assertTrue(validator.authorize("other.example.com", List.of("app.example.com"), List.of()).rejected());
    }

    @Test
    void wildcardMatchesSubdomainsAndApex() {
        List<String> hosts = List.of("*.example.com");
        assertTrue(validator.authorize("api.example.com", hosts, List.of()).valid());
        assertTrue(validator.authorize("deep.api.example.com", hosts, List.of()).valid());
        assertTrue(validator.authorize("example.com", hosts, List.of()).valid());
        assertTrue(validator.authorize("badexample.com", hosts, List.of()).rejected());
        assertTrue(validator.authorize("example.com.evil.org", hosts, List.of()).rejected());
    }

    @Test
    void cidrMatching() {
        List<String> cidrs = List.of("192.168.1.0/24");
        assertTrue(validator.authorize("192.168.1.77", List.of(), cidrs).valid());
        assertTrue(validator.authorize("192.168.2.1", List.of(), cidrs).rejected());
        assertTrue(validator.authorize("10.1.2.3", List.of(), List.of("0.0.0.0/0")).valid());
        assertTrue(validator.authorize("10.1.2.3", List.of(), List.of("10.1.2.3/32")).valid());
        assertTrue(validator.authorize("10.1.2.4", List.of(), List.of("10.1.2.3/32")).rejected());
    }

    @Test
    void malformedCidrsNeverMatch() {
        assertTrue(validator.authorize("10.0.0.1", List.of(), List.of("10.0.0.0/33", "10.0.0/8", "garbage")).rejected());
    }

    @Test
    void hostnamesAreNotMatchedAgainstCidrs() {
        assertTrue(validator.authorize("intranet.local", List.of(), List.of("0.0.0.0/0")).rejected());
    }

    @Test
    void rejectionNamesTheTarget() {
        ValidationResult result = validator.authorize("evil.org", List.of("example.com"), List.of());
        assertEquals("Target \"evil.org\" is not in the allowed scope", result.reason());
    }

    @Test
    void emptyScopeRejectsEverything() {
        assertTrue(validator.authorize("example.com", null, null).rejected());
    }

    @Test
    void validateRunsSafetyBeforeScope() {
        ValidationResult result = validator.validate("example.com;id", List.of("*.example.com"), List.of());
        assertEquals("Target contains potentially dangerous characters", result.reason());
        assertTrue(validator.validate("www.example.com", List.of("*.example.com"), List.of()).valid());
    }

    @Test
    void cidrSyntax() {
        assertTrue(TargetValidator.isValidCidr("10.0.0.0/8"));
        assertTrue(TargetValidator.isValidCidr("0.0.0.0/0"));
        assertFalse(TargetValidator.isValidCidr("10.0.0.0"));
        assertFalse(TargetValidator.isValidCidr("10.0.0.256/8"));
        assertFalse(TargetValidator.isValidCidr("10.0.0.0/-1"));
        assertFalse(TargetValidator.isValidCidr("10.0.0.0/"));
    }
}
