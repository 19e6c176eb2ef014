package me.golemcore.guard.domain.service;

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

import me.golemcore.guard.domain.model.ApprovalSource;
import me.golemcore.guard.domain.model.AuditLogEntry;
import me.golemcore.guard.domain.model.AuditResult;
import me.golemcore.guard.domain.model.AuthorizationOutcome;
import me.golemcore.guard.domain.model.CapabilityCategory;
import me.golemcore.guard.domain.model.DecisionState;
import me.golemcore.guard.domain.model.PermissionCheckResult;
import me.golemcore.guard.domain.model.PermissionGrant;
import me.golemcore.guard.domain.model.RiskLevel;
import me.golemcore.guard.domain.model.SecurityPolicy;
import me.golemcore.guard.domain.model.SecurityPolicyUpdate;
import me.golemcore.guard.domain.model.SecurityPreset;
import me.golemcore.guard.domain.model.ToolPermission;
import me.golemcore.guard.port.outbound.ApprovalPort;
import me.golemcore.guard.port.outbound.SecurityEventListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Single entry point for the agent runtime: tool registration, permission
 * checks, approvals, grants, policy and the audit trail.
 *
 * <p>
 * {@link #authorize(String, Map, String)} runs the whole decision for one tool
 * call: check, ask a human when required, and record exactly one audit entry
 * for the terminal state. The other operations expose the individual steps
 * for callers that drive the flow themselves.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CapabilityManager {

    private static final int DEFAULT_AUDIT_LIMIT = 50;

    private final PermissionRegistry permissionRegistry;
    private final GrantStore grantStore;
    private final AuditLogService auditLogService;
    private final SecurityPolicyService policyService;
    private final PolicyEngine policyEngine;
    private final ApprovalCoordinator approvalCoordinator;
    private final SecurityEventDispatcher eventDispatcher;

    /**
     * Load persisted state. Never completes exceptionally.
     */
    public CompletableFuture<Void> initialize() {
        return auditLogService.initialize()
                .thenRun(() -> log.info("[Security] Capability manager initialized: tools={}, auditEntries={}",
                        permissionRegistry.size(), auditLogService.size()));
    }

    // ==================== Tools ====================

    public void registerTool(ToolPermission permission) {
        permissionRegistry.register(permission);
    }

    public Optional<ToolPermission> getToolPermission(String toolName) {
        return permissionRegistry.lookup(toolName);
    }

    // ==================== Decisions ====================

    public PermissionCheckResult checkPermission(String toolName, Map<String, Object> args) {
        return policyEngine.checkPermission(toolName, args);
    }

    public PermissionCheckResult checkPermission(String toolName, Map<String, Object> args, String principal) {
        return policyEngine.checkPermission(toolName, args, principal);
    }

    public void setApprovalHandler(ApprovalPort handler) {
        approvalCoordinator.setApprovalHandler(handler);
    }

    public CompletableFuture<Boolean> requestApproval(String toolName, Map<String, Object> args,
            RiskLevel riskLevel, String reason) {
        return approvalCoordinator.requestApproval(toolName, args, riskLevel, reason);
    }

    /**
     * Decide a tool call end to end and audit the outcome.
     *
     * <p>
     * A denied check is audited as {@code denied/policy}, an auto-approvable one
     * as {@code auto-approved/auto}; otherwise the approval handler is asked and
     * the answer audited as {@code approved/user} or {@code denied/user}. A
     * failing handler counts as a denial.
     */
    public CompletableFuture<AuthorizationOutcome> authorize(String toolName, Map<String, Object> args,
            String principal) {
        PermissionCheckResult check = policyEngine.checkPermission(toolName, args, principal);

        if (!check.isAllowed()) {
            log.info("[Security] Denied {}: {}", toolName, check.getReason());
            return complete(DecisionState.AUTO_DENIED, check, toolName, args, principal);
        }
        if (!check.isRequiresApproval()) {
            return complete(DecisionState.AUTO_APPROVED, check, toolName, args, principal);
        }

        return approvalCoordinator.requestApproval(toolName, args, check.getRiskLevel(), check.getReason())
                .handle((approved, error) -> {
                    if (error != null) {
                        log.warn("[Security] Approval failed for {}, treating as denied: {}", toolName,
                                error.getMessage());
                        return DecisionState.DENIED;
                    }
                    return Boolean.TRUE.equals(approved) ? DecisionState.APPROVED : DecisionState.DENIED;
                })
                .thenCompose(state -> complete(state, check, toolName, args, principal));
    }

    // ==================== Grants ====================

    public PermissionGrant grantPermission(CapabilityCategory capability, String scope, Duration duration) {
        return grantStore.grant(capability, scope, duration);
    }

    public PermissionGrant grantPermission(CapabilityCategory capability, String scope, Duration duration,
            String principal, ApprovalSource grantedBy) {
        return grantStore.grant(capability, scope, duration, principal, grantedBy);
    }

    public boolean revokePermission(CapabilityCategory capability, String scope) {
        return grantStore.revoke(capability, scope);
    }

    public boolean revokePermission(CapabilityCategory capability, String scope, String principal) {
        return grantStore.revoke(capability, scope, principal);
    }

    public List<PermissionGrant> getGrants(String principal) {
        return grantStore.getGrants(principal);
    }

    // ==================== Audit ====================

    /**
     * Record an execution attempt. Listeners are notified once the entry is
     * persisted (or the persist attempt has failed).
     */
    public CompletableFuture<AuditLogEntry> logExecution(String toolName, List<CapabilityCategory> capabilities,
            Map<String, Object> args, AuditResult result, ApprovalSource approvalSource, String principal) {
        return auditLogService.log(toolName, capabilities, args, result, approvalSource, principal)
                .thenApply(entry -> {
                    eventDispatcher.auditLogged(entry);
                    return entry;
                });
    }

    public List<AuditLogEntry> getAuditLog() {
        return getAuditLog(DEFAULT_AUDIT_LIMIT);
    }

    public List<AuditLogEntry> getAuditLog(int limit) {
        return auditLogService.getRecent(limit);
    }

    // ==================== Policy ====================

    public SecurityPolicy getPolicy() {
        return policyService.getPolicy();
    }

    public SecurityPolicy updatePolicy(SecurityPolicyUpdate update) {
        return policyService.updatePolicy(update);
    }

    public SecurityPolicy applyPreset(SecurityPreset preset) {
        return policyService.applyPreset(preset);
    }

    public boolean addAllowedPath(String pattern) {
        return policyService.addAllowedPath(pattern);
    }

    public boolean addBlockedPath(String pattern) {
        return policyService.addBlockedPath(pattern);
    }

    public boolean addBlockedCommand(String pattern) {
        return policyService.addBlockedCommand(pattern);
    }

    public boolean isBlockedPath(String path) {
        return policyEngine.isBlockedPath(path);
    }

    public boolean isBlockedCommand(String command) {
        return policyEngine.isBlockedCommand(command);
    }

    // ==================== Listeners ====================

    public void addListener(SecurityEventListener listener) {
        eventDispatcher.addListener(listener);
    }

    public boolean removeListener(SecurityEventListener listener) {
        return eventDispatcher.removeListener(listener);
    }

    private CompletableFuture<AuthorizationOutcome> complete(DecisionState state, PermissionCheckResult check,
            String toolName, Map<String, Object> args, String principal) {
        List<CapabilityCategory> categories = permissionRegistry.lookup(toolName)
                .map(ToolPermission::getCategories)
                .orElse(List.of());
        return logExecution(toolName, categories, args, state.getAuditResult(), state.getApprovalSource(), principal)
                .thenApply(entry -> AuthorizationOutcome.builder()
                        .state(state)
                        .check(check)
                        .auditEntry(entry)
                        .build());
    }
}
