package com.automate.ScanOps.Service;

import com.automate.ScanOps.Models.ScanObjective;
import com.automate.ScanOps.Models.SmartScanPhase;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Lays out the steps of a smart scan. Step 1 and the last step are internal (no tool);
 * everything in between runs a catalog tool through the normal run pipeline.
 */
@Component
public class SmartScanPlanner {

    public record PlannedStep(
            SmartScanPhase phase,
            String name,
            String description,
            String toolSlug,
            Map<String, Object> params,
            boolean critical
    ) {
        public boolean internal() {
            return toolSlug == null;
        }
    }

    private record Candidate(SmartScanPhase phase, String slug, String name, String description,
                             Set<ScanObjective> objectives) {}

    private static final Set<ScanObjective> ALL = EnumSet.allOf(ScanObjective.class);
    private static final Set<ScanObjective> NOT_QUICK =
            EnumSet.of(ScanObjective.COMPREHENSIVE, ScanObjective.STEALTH, ScanObjective.AGGRESSIVE);
    private static final Set<ScanObjective> LOUD = EnumSet.of(ScanObjective.COMPREHENSIVE, ScanObjective.AGGRESSIVE);
    private static final Set<ScanObjective> AGGRESSIVE_ONLY = EnumSet.of(ScanObjective.AGGRESSIVE);

    // order here is execution order
    private static final List<Candidate> CANDIDATES = List.of(
            new Candidate(SmartScanPhase.AUTOMATED_SCAN, "nmap", "Port and Service Scan",
                    "Discover open ports and identify running services", ALL),
            new Candidate(SmartScanPhase.AUTOMATED_SCAN, "masscan", "Full Port Sweep",
                    "Fast sweep across the whole port range", AGGRESSIVE_ONLY),
            new Candidate(SmartScanPhase.AUTOMATED_SCAN, "whatweb", "Web Technology Fingerprint",
                    "Identify web frameworks, servers and CMS", LOUD),
            new Candidate(SmartScanPhase.AUTOMATED_SCAN, "wafw00f", "WAF Detection",
                    "Detect web application firewalls in front of the target", NOT_QUICK),
            new Candidate(SmartScanPhase.DEEP_RECONNAISSANCE, "subfinder", "Subdomain Discovery",
                    "Passive subdomain enumeration", NOT_QUICK),
            new Candidate(SmartScanPhase.DEEP_RECONNAISSANCE, "amass", "Attack Surface Mapping",
                    "In-depth DNS enumeration and asset mapping", LOUD),
            new Candidate(SmartScanPhase.DEEP_RECONNAISSANCE, "httpx", "HTTP Probe",
                    "Probe live HTTP services and collect response metadata", ALL),
            new Candidate(SmartScanPhase.DEEP_RECONNAISSANCE, "katana", "Web Crawl",
                    "Crawl the application to discover endpoints", LOUD),
            new Candidate(SmartScanPhase.DEEP_RECONNAISSANCE, "gobuster", "Content Discovery",
                    "Brute-force hidden directories and files", AGGRESSIVE_ONLY),
            new Candidate(SmartScanPhase.VULNERABILITY_SCANNING, "nuclei", "Template Vulnerability Scan",
                    "Run vulnerability templates against discovered services", ALL),
            new Candidate(SmartScanPhase.VULNERABILITY_SCANNING, "nikto", "Web Server Scan",
                    "Check the web server for dangerous files and misconfigurations", LOUD),
            new Candidate(SmartScanPhase.VULNERABILITY_SCANNING, "testssl", "TLS Configuration Check",
                    "Inspect TLS protocols, ciphers and certificate", NOT_QUICK),
            new Candidate(SmartScanPhase.EXPLOITATION_CHAIN, "sqlmap", "SQL Injection Probe",
                    "Confirm SQL injection on discovered parameters", AGGRESSIVE_ONLY),
            new Candidate(SmartScanPhase.EXPLOITATION_CHAIN, "dalfox", "XSS Probe",
                    "Confirm reflected and stored XSS", AGGRESSIVE_ONLY)
    );

    /**
     * @param available tells whether a tool slug can currently be launched; unavailable tools are left out
     */
    public List<PlannedStep> plan(ScanObjective objective, int maxTools, Predicate<String> available) {
        List<PlannedStep> steps = new ArrayList<>();
        steps.add(new PlannedStep(SmartScanPhase.INTELLIGENCE_PLANNING, "Target Intelligence Analysis",
                "Resolve the target against its scope and select tools for the " + objective.wireName() + " objective",
                null, Map.of(), false));

        int tools = 0;
        for (Candidate c : CANDIDATES) {
            if (tools >= maxTools) {
                break;
            }
            if (!c.objectives().contains(objective) || !available.test(c.slug())) {
                continue;
            }
            // the first recon scan gates everything after it
            boolean critical = tools == 0;
            steps.add(new PlannedStep(c.phase(), c.name(), c.description(), c.slug(), Map.of(), critical));
            tools++;
        }

        steps.add(new PlannedStep(SmartScanPhase.FINAL_REPORT, "Generate Security Report",
                "Aggregate findings and compute the session risk score", null, Map.of(), false));
        return steps;
    }
}
