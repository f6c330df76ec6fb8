package com.automate.ScanOps.Models;

/**
 * Sandbox limits sent with every execution request.
 *
 * @param memoryLimitMb memory ceiling in MiB
 * @param cpuLimit      CPU share, 1.0 being one full core
 */
public record ResourceLimits(int memoryLimitMb, double cpuLimit) {
}
