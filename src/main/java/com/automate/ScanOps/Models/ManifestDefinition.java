package com.automate.ScanOps.Models;

import java.util.List;
import java.util.Map;

/**
 * Normalized manifest document, independent of how it was stored or posted.
 */
public record ManifestDefinition(
        String binary,
        Map<String, ParameterSchema> argsSchema,
        List<String> commandTemplate,
        int timeoutSeconds,
        int memoryLimit,
        double cpuLimit
) {
}
