package me.golemcore.guard.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.guard.domain.model.ScanFinding;
import me.golemcore.guard.domain.model.ScanFinding.FindingType;
import me.golemcore.guard.domain.model.ScanFinding.Severity;
import me.golemcore.guard.domain.model.ScanResult;
import me.golemcore.guard.domain.model.ScanResult.Recommendation;
import me.golemcore.guard.domain.model.ScanResult.ScanLevel;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Static scanner flagging potentially malicious patterns in skill and tool
 * sources before they are installed.
 *
 * <p>
 * Each source line is matched against a fixed catalogue of detection patterns
 * (data exfiltration, credential access, shell execution, obfuscation, ...).
 * Every match becomes a {@link ScanFinding}; the summed pattern scores, capped at
 * 100, give the risk score, from which the level and the recommendation are
 * derived. A critical finding always yields {@link Recommendation#BLOCK}.
 *
 * <p>
 * File scans are cached per path for {@code guard.scanner.cache-ttl-seconds}.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class SkillScanner {

    private static final int MAX_SCORE = 100;
    private static final int REPORT_CODE_LENGTH = 50;

    private static final List<DetectionPattern> DETECTION_PATTERNS = List.of(
            // Data exfiltration
            pattern(FindingType.DATA_EXFILTRATION, "curl\\s+.*(-d|--data)\\s.*\\$|fetch\\(.*\\+.*\\)",
                    Severity.CRITICAL, 40,
                    "Potential data exfiltration via HTTP request with dynamic data",
                    "Review what data is being sent to external servers"),
            pattern(FindingType.DATA_EXFILTRATION, "webhook\\.site|requestbin|pipedream|ngrok|burpcollaborator",
                    Severity.CRITICAL, 50,
                    "Known data exfiltration endpoints detected",
                    "Block this skill immediately"),
            pattern(FindingType.DATA_EXFILTRATION, "base64.*encode.*fetch|btoa.*XMLHttpRequest",
                    Severity.DANGER, 35,
                    "Base64 encoding combined with HTTP request (obfuscated exfiltration)",
                    "Investigate what data is being encoded and sent"),

            // Credential access
            pattern(FindingType.CREDENTIAL_ACCESS, "\\.ssh|\\.aws|\\.gnupg|\\.config|keychain|credentials",
                    Severity.CRITICAL, 45,
                    "Access to sensitive credential directories",
                    "Block access to credential paths"),
            new DetectionPattern(FindingType.CREDENTIAL_ACCESS,
                    Pattern.compile("API_KEY|SECRET_KEY|PRIVATE_KEY|PASSWORD|TOKEN"),
                    Severity.WARNING, 20,
                    "References to credential-like environment variables",
                    "Ensure credentials are not being exfiltrated"),
            pattern(FindingType.ENVIRONMENT_ACCESS, "os\\.environ|process\\.env\\[|getenv\\(",
                    Severity.WARNING, 15,
                    "Environment variable access",
                    "Verify only necessary env vars are accessed"),

            // Shell execution
            pattern(FindingType.SHELL_EXECUTION,
                    "exec\\(|execSync|spawn\\(|child_process|subprocess|os\\.system|popen|ProcessBuilder",
                    Severity.DANGER, 25,
                    "Shell command execution capability",
                    "Ensure commands are validated and sanitized"),
            pattern(FindingType.SHELL_EXECUTION, "eval\\(|new Function\\(|setTimeout\\(.*\\+|setInterval\\(.*\\+",
                    Severity.CRITICAL, 40,
                    "Dynamic code execution (potential code injection)",
                    "Never allow eval with user-controlled input"),
            pattern(FindingType.SHELL_EXECUTION, "rm\\s+-rf|rmdir.*/s|del\\s+/f\\s+/q",
                    Severity.CRITICAL, 45,
                    "Recursive delete commands",
                    "Block destructive file operations"),

            // Network requests
            pattern(FindingType.NETWORK_REQUEST,
                    "fetch\\(|axios|XMLHttpRequest|http\\.request|requests\\.(get|post)|HttpClient",
                    Severity.INFO, 10,
                    "Network request capability",
                    "Ensure requests go to expected domains only"),
            pattern(FindingType.NETWORK_REQUEST, "\\$\\(curl|`curl|`wget|\\$\\(wget",
                    Severity.DANGER, 30,
                    "Shell-based network requests with command substitution",
                    "Review for data exfiltration"),

            // File deletion
            pattern(FindingType.FILE_DELETION,
                    "fs\\.unlink|fs\\.rmdir|os\\.remove|shutil\\.rmtree|unlink\\(|Files\\.delete",
                    Severity.WARNING, 20,
                    "File deletion capability",
                    "Ensure deletions are scoped to safe directories"),

            // Code injection
            pattern(FindingType.CODE_INJECTION, "innerHTML\\s*=|outerHTML\\s*=|document\\.write",
                    Severity.WARNING, 15,
                    "DOM manipulation (potential XSS vector)",
                    "Use safe DOM methods instead"),

            // Obfuscation
            pattern(FindingType.OBFUSCATION, "\\\\x[0-9a-f]{2}|\\\\u[0-9a-f]{4}|atob\\(|Buffer\\.from\\(.*base64",
                    Severity.WARNING, 20,
                    "Encoded/obfuscated strings detected",
                    "Decode and review obfuscated content"),
            pattern(FindingType.OBFUSCATION, "\\['.*'\\]\\s*\\(",
                    Severity.WARNING, 15,
                    "Bracket notation function calls (obfuscation technique)",
                    "Review for hidden functionality"),

            // Privilege escalation
            pattern(FindingType.PRIVILEGE_ESCALATION, "sudo|chmod\\s+[0-7]{3,4}|chown|setuid|setgid",
                    Severity.DANGER, 35,
                    "Privilege escalation commands",
                    "Block elevated permission operations"),

            // Suspicious imports
            pattern(FindingType.SUSPICIOUS_IMPORT, "require\\(['\"]crypto['\"]|import\\s+.*from\\s+['\"]node:crypto",
                    Severity.INFO, 5,
                    "Crypto module import",
                    "Verify crypto is used for legitimate purposes"),
            pattern(FindingType.SUSPICIOUS_IMPORT, "require\\(['\"]net['\"]|import\\s+.*from\\s+['\"]node:net",
                    Severity.WARNING, 15,
                    "Low-level network module import",
                    "Review for backdoor connections"));

    private final Clock clock;
    private final List<String> extensions;
    private final Duration cacheTtl;
    private final Map<String, ScanResult> scanCache = new ConcurrentHashMap<>();

    public SkillScanner(GuardProperties properties, Clock clock) {
        this.clock = clock;
        this.extensions = properties.getScanner().getExtensions();
        this.cacheTtl = Duration.ofSeconds(properties.getScanner().getCacheTtlSeconds());
    }

    /**
     * Scan a skill file, reusing a cached result younger than the cache TTL.
     */
    public ScanResult scanFile(Path file) throws IOException {
        String key = file.toAbsolutePath().normalize().toString();
        ScanResult cached = scanCache.get(key);
        Instant now = Instant.now(clock);
        if (cached != null && cached.getScannedAt().plus(cacheTtl).isAfter(now)) {
            return cached;
        }

        String content = Files.readString(file, StandardCharsets.UTF_8);
        ScanResult result = scanContent(content, key);
        scanCache.put(key, result);
        return result;
    }

    /**
     * Scan skill source text directly.
     */
    public ScanResult scanContent(String content, String skillPath) {
        List<ScanFinding> findings = new ArrayList<>();
        String[] lines = content != null ? content.split("\n", -1) : new String[0];

        for (DetectionPattern detection : DETECTION_PATTERNS) {
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i];
                if (line.isEmpty()) {
                    continue;
                }
                Matcher matcher = detection.pattern().matcher(line);
                while (matcher.find()) {
                    findings.add(ScanFinding.builder()
                            .type(detection.type())
                            .severity(detection.severity())
                            .line(i + 1)
                            .code(matcher.group())
                            .description(detection.description())
                            .mitigation(detection.mitigation())
                            .score(detection.score())
                            .build());
                }
            }
        }

        int riskScore = calculateRiskScore(findings);
        ScanLevel riskLevel = toScanLevel(riskScore);
        ScanResult result = ScanResult.builder()
                .skillPath(skillPath)
                .skillName(skillName(skillPath))
                .riskScore(riskScore)
                .riskLevel(riskLevel)
                .findings(findings)
                .scannedAt(Instant.now(clock))
                .recommendation(recommend(riskLevel, findings))
                .build();

        log.debug("[Security] Skill scan complete: skill={}, score={}, level={}, findings={}",
                result.getSkillName(), riskScore, riskLevel, findings.size());
        return result;
    }

    /**
     * Scan every file with a configured extension directly inside a directory.
     * Files that cannot be read are logged and skipped.
     */
    public List<ScanResult> scanDirectory(Path directory) {
        List<ScanResult> results = new ArrayList<>();
        try (Stream<Path> entries = Files.list(directory)) {
            List<Path> files = entries
                    .filter(Files::isRegularFile)
                    .filter(this::hasScannableExtension)
                    .sorted()
                    .toList();
            for (Path file : files) {
                try {
                    results.add(scanFile(file));
                } catch (IOException e) {
                    log.error("[Security] Failed to scan skill file: {}", file, e);
                }
            }
        } catch (IOException e) {
            log.error("[Security] Failed to scan directory: {}", directory, e);
        }
        return results;
    }

    /**
     * Build a human-readable markdown report.
     */
    public String generateReport(ScanResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Security Scan Report: ").append(result.getSkillName()).append("\n\n");
        sb.append("**Risk Score:** ").append(result.getRiskScore()).append("/100\n");
        sb.append("**Risk Level:** ").append(result.getRiskLevel()).append('\n');
        sb.append("**Recommendation:** ").append(result.getRecommendation()).append('\n');
        sb.append("**Scanned:** ").append(result.getScannedAt()).append("\n\n");

        if (result.getFindings().isEmpty()) {
            sb.append("No security issues detected.\n");
            return sb.toString();
        }

        sb.append("## Findings (").append(result.getFindings().size()).append(")\n\n");

        Map<Severity, List<ScanFinding>> bySeverity = new EnumMap<>(Severity.class);
        for (ScanFinding finding : result.getFindings()) {
            bySeverity.computeIfAbsent(finding.getSeverity(), s -> new ArrayList<>()).add(finding);
        }

        for (Map.Entry<Severity, List<ScanFinding>> group : bySeverity.entrySet()) {
            sb.append("### ").append(group.getKey()).append(" (").append(group.getValue().size()).append(")\n\n");
            for (ScanFinding finding : group.getValue()) {
                String location = finding.getLine() != null ? "line " + finding.getLine() : "unknown location";
                sb.append("- **").append(finding.getType().name().toLowerCase(Locale.ROOT))
                        .append("** (").append(location).append(")\n");
                sb.append("  - ").append(finding.getDescription()).append('\n');
                if (finding.getCode() != null) {
                    String code = finding.getCode();
                    if (code.length() > REPORT_CODE_LENGTH) {
                        code = code.substring(0, REPORT_CODE_LENGTH);
                    }
                    sb.append("  - Code: `").append(code).append("`\n");
                }
                if (finding.getMitigation() != null) {
                    sb.append("  - Mitigation: ").append(finding.getMitigation()).append('\n');
                }
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    public void clearCache() {
        scanCache.clear();
    }

    public int getCacheSize() {
        return scanCache.size();
    }

    /**
     * Size of the file scan cache and the time of its oldest scan, {@code null}
     * when empty.
     */
    public CacheStats getCacheStats() {
        Instant oldest = scanCache.values().stream()
                .map(ScanResult::getScannedAt)
                .min(Instant::compareTo)
                .orElse(null);
        return new CacheStats(scanCache.size(), oldest);
    }

    public record CacheStats(int size, Instant oldestEntry) {
    }

    private int calculateRiskScore(List<ScanFinding> findings) {
        int score = findings.stream().mapToInt(ScanFinding::getScore).sum();
        return Math.min(MAX_SCORE, score);
    }

    private ScanLevel toScanLevel(int score) {
        if (score == 0) {
            return ScanLevel.SAFE;
        }
        if (score <= 20) {
            return ScanLevel.LOW;
        }
        if (score <= 50) {
            return ScanLevel.MEDIUM;
        }
        if (score <= 80) {
            return ScanLevel.HIGH;
        }
        return ScanLevel.CRITICAL;
    }

    private Recommendation recommend(ScanLevel level, List<ScanFinding> findings) {
        if (findings.stream().anyMatch(f -> f.getSeverity() == Severity.CRITICAL)) {
            return Recommendation.BLOCK;
        }
        return switch (level) {
        case SAFE, LOW -> Recommendation.ALLOW;
        case MEDIUM -> Recommendation.REVIEW;
        case HIGH -> Recommendation.SANDBOX;
        case CRITICAL -> Recommendation.BLOCK;
        };
    }

    private boolean hasScannableExtension(Path file) {
        String name = file.getFileName().toString();
        return extensions.stream().anyMatch(name::endsWith);
    }

    private static String skillName(String skillPath) {
        if (skillPath == null) {
            return "unknown";
        }
        String name = Path.of(skillPath).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static DetectionPattern pattern(FindingType type, String regex, Severity severity, int score,
            String description, String mitigation) {
        return new DetectionPattern(type, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), severity, score,
                description, mitigation);
    }

    private record DetectionPattern(FindingType type, Pattern pattern, Severity severity, int score,
            String description, String mitigation) {
    }
}
