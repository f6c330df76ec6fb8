package com.automate.ScanOps.validation;

import com.automate.ScanOps.Models.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Syntactic safety check and scope authorization for scan targets.
 * No DNS lookups; IPv4 literals only for CIDR matching.
 */
@Component
public class TargetValidator {

    public static final int MAX_TARGET_LENGTH = 255;

    private static final Pattern DANGEROUS_CHARS = Pattern.compile("[;&|`$(){}\\[\\]<>\\\\'\"]");
    private static final Pattern NEWLINES = Pattern.compile("[\\r\\n]");

    public ValidationResult sanitize(String target) {
        if (target == null || target.isBlank()) {
            return ValidationResult.reject("Target is required");
        }
        if (DANGEROUS_CHARS.matcher(target).find()) {
            return ValidationResult.reject("Target contains potentially dangerous characters");
        }
        if (NEWLINES.matcher(target).find()) {
            return ValidationResult.reject("Target contains newline characters");
        }
        if (target.length() > MAX_TARGET_LENGTH) {
            return ValidationResult.reject("Target exceeds maximum length");
        }
        return ValidationResult.ok();
    }

    public ValidationResult authorize(String target, Collection<String> allowedHosts, Collection<String> allowedCidrs) {
        String normalized = normalize(target);
        List<String> hosts = allowedHosts == null ? List.of() : List.copyOf(allowedHosts);
        List<String> cidrs = allowedCidrs == null ? List.of() : List.copyOf(allowedCidrs);

        for (String pattern : hosts) {
            if (matchesHost(normalized, pattern)) {
                return ValidationResult.ok();
            }
        }

        Long ip = parseIpv4(normalized);
        if (ip != null) {
            for (String cidr : cidrs) {
                if (ipInCidr(ip, cidr)) {
                    return ValidationResult.ok();
                }
            }
        }
        return ValidationResult.reject("Target \"" + target + "\" is not in the allowed scope");
    }

    /** Both checks in order; the first rejection wins. */
    public ValidationResult validate(String target, Collection<String> allowedHosts, Collection<String> allowedCidrs) {
        ValidationResult safe = sanitize(target);
        if (safe.rejected()) {
            return safe;
        }
        return authorize(target, allowedHosts, allowedCidrs);
    }

    static boolean matchesHost(String normalizedTarget, String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return false;
        }
        String p = normalize(pattern);
        if (p.startsWith("*.")) {
            String suffix = p.substring(2);
            return !suffix.isEmpty()
                    && (normalizedTarget.equals(suffix) || normalizedTarget.endsWith("." + suffix));
        }
        return normalizedTarget.equals(p);
    }

    /** @return the address as an unsigned 32-bit value, or null when not a dotted quad */
    static Long parseIpv4(String value) {
        if (value == null) {
            return null;
        }
        String[] parts = value.split("\\.", -1);
        if (parts.length != 4) {
            return null;
        }
        long result = 0;
        for (String part : parts) {
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
                return null;
            }
            int octet = Integer.parseInt(part);
            if (octet > 255) {
                return null;
            }
            result = (result << 8) | octet;
        }
        return result;
    }

    static boolean ipInCidr(long ip, String cidr) {
        // malformed ranges never match
        if (!isValidCidr(cidr)) {
            return false;
        }
        String[] parts = cidr.trim().split("/", -1);
        long network = parseIpv4(parts[0]);
        int prefix = Integer.parseInt(parts[1]);
        long mask = prefix == 0 ? 0L : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
        return (ip & mask) == (network & mask);
    }

    /** Syntax check used when scopes are written. */
    public static boolean isValidCidr(String cidr) {
        if (cidr == null) {
            return false;
        }
        String[] parts = cidr.trim().split("/", -1);
        if (parts.length != 2 || parseIpv4(parts[0]) == null) {
            return false;
        }
        if (parts[1].isEmpty() || parts[1].length() > 2 || !parts[1].chars().allMatch(Character::isDigit)) {
            return false;
        }
        int prefix = Integer.parseInt(parts[1]);
        return prefix >= 0 && prefix <= 32;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
