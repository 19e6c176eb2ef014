package me.golemcore.guard.domain.service;

import me.golemcore.guard.domain.model.SecurityPolicy;
import me.golemcore.guard.domain.model.SecurityPolicyUpdate;
import me.golemcore.guard.domain.model.SecurityPreset;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SecurityPolicyServiceTest {

    private GuardProperties properties;
    private SecurityPolicyService service;

    @BeforeEach
    void setUp() {
        properties = new GuardProperties();
        service = new SecurityPolicyService(properties);
    }

    @Test
    void shouldStartWithBalancedDefaults() {
        SecurityPolicy policy = service.getPolicy();

        assertTrue(policy.isAutoApproveSafe());
        assertFalse(policy.isAutoApproveModerate());
        assertTrue(policy.isNeverAutoApproveDangerous());
        assertTrue(policy.getBlockedPaths().contains("/etc/*"));
        assertTrue(policy.getBlockedPaths().contains("~/.ssh/*"));
        assertTrue(policy.getBlockedCommands().contains("sudo\\s+rm"));
        assertTrue(policy.getAllowedPaths().contains("./data/*"));
    }

    @Test
    void shouldApplyConfiguredPresetThenExplicitFlags() {
        properties.getPolicy().setPreset("strict");
        properties.getPolicy().setAutoApproveSafe(true);

        SecurityPolicy policy = new SecurityPolicyService(properties).getPolicy();

        assertTrue(policy.isAutoApproveSafe());
        assertFalse(policy.isAutoApproveModerate());
        assertTrue(policy.isNeverAutoApproveDangerous());
    }

    @Test
    void shouldIgnoreBlankPreset() {
        properties.getPolicy().setPreset("  ");

        assertTrue(new SecurityPolicyService(properties).getPolicy().isAutoApproveSafe());
    }

    @Test
    void shouldAppendConfiguredPatterns() {
        properties.getPolicy().setBlockedPaths(List.of("/srv/secrets/*", "/etc/*"));
        properties.getPolicy().setBlockedCommands(List.of("shutdown\\s+"));

        SecurityPolicy policy = new SecurityPolicyService(properties).getPolicy();

        assertTrue(policy.getBlockedPaths().contains("/srv/secrets/*"));
        assertEquals(1, policy.getBlockedPaths().stream().filter("/etc/*"::equals).count());
        assertTrue(policy.getBlockedCommands().contains("shutdown\\s+"));
    }

    @Test
    void shouldFailFastOnInvalidConfiguration() {
        properties.getPolicy().setBlockedCommands(List.of("rm\\s+("));
        assertThrows(IllegalArgumentException.class, () -> new SecurityPolicyService(properties));

        GuardProperties unknownPreset = new GuardProperties();
        unknownPreset.getPolicy().setPreset("reckless");
        assertThrows(IllegalArgumentException.class, () -> new SecurityPolicyService(unknownPreset));
    }

    @Test
    void shouldReturnDefensiveCopies() {
        SecurityPolicy copy = service.getPolicy();
        copy.getBlockedPaths().clear();
        copy.setAutoApproveModerate(true);

        SecurityPolicy current = service.getPolicy();
        assertFalse(current.getBlockedPaths().isEmpty());
        assertFalse(current.isAutoApproveModerate());
    }

    @Test
    void shouldApplyOnlyNonNullFieldsOfUpdate() {
        service.updatePolicy(SecurityPolicyUpdate.builder()
                .autoApproveModerate(true)
                .blockedPaths(List.of("/only/*"))
                .build());

        SecurityPolicy policy = service.getPolicy();
        assertTrue(policy.isAutoApproveSafe());
        assertTrue(policy.isAutoApproveModerate());
        assertEquals(List.of("/only/*"), policy.getBlockedPaths());
        assertFalse(policy.getBlockedCommands().isEmpty());
    }

    @Test
    void shouldRejectUpdateWithInvalidCommandPattern() {
        SecurityPolicyUpdate update = SecurityPolicyUpdate.builder()
                .autoApproveModerate(true)
                .blockedCommands(List.of("[unclosed"))
                .build();

        assertThrows(IllegalArgumentException.class, () -> service.updatePolicy(update));
        assertFalse(service.getPolicy().isAutoApproveModerate());
    }

    @Test
    void shouldRejectUpdateWithMissingPathPattern() {
        SecurityPolicyUpdate nullBlocked = SecurityPolicyUpdate.builder()
                .autoApproveModerate(true)
                .blockedPaths(Arrays.asList("/srv/*", null))
                .build();
        SecurityPolicyUpdate blankAllowed = SecurityPolicyUpdate.builder()
                .allowedPaths(List.of(" "))
                .build();

        assertThrows(IllegalArgumentException.class, () -> service.updatePolicy(nullBlocked));
        assertThrows(IllegalArgumentException.class, () -> service.updatePolicy(blankAllowed));
        SecurityPolicy policy = service.getPolicy();
        assertFalse(policy.isAutoApproveModerate());
        assertFalse(policy.getBlockedPaths().contains(null));
        assertTrue(policy.getAllowedPaths().contains("./data/*"));
    }

    @Test
    void shouldApplyPreset() {
        service.applyPreset(SecurityPreset.TRUST);

        SecurityPolicy policy = service.getPolicy();
        assertTrue(policy.isAutoApproveSafe());
        assertTrue(policy.isAutoApproveModerate());
        assertFalse(policy.isNeverAutoApproveDangerous());
    }

    @Test
    void shouldAddPatternsOnlyOnce() {
        assertTrue(service.addBlockedPath("/srv/*"));
        assertFalse(service.addBlockedPath("/srv/*"));
        assertTrue(service.addAllowedPath("/workspace/*"));
        assertTrue(service.addBlockedCommand("shutdown\\s+-h"));
        assertFalse(service.addBlockedCommand("shutdown\\s+-h"));

        SecurityPolicy policy = service.getPolicy();
        assertTrue(policy.getBlockedPaths().contains("/srv/*"));
        assertTrue(policy.getAllowedPaths().contains("/workspace/*"));
    }

    @Test
    void shouldRejectInvalidPatterns() {
        assertThrows(IllegalArgumentException.class, () -> service.addBlockedCommand("(oops"));
        assertThrows(IllegalArgumentException.class, () -> service.addBlockedPath(""));
    }
}
