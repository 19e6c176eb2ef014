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

import me.golemcore.guard.domain.model.Capability;
import me.golemcore.guard.domain.model.CapabilityCategory;
import me.golemcore.guard.domain.model.PermissionCheckResult;
import me.golemcore.guard.domain.model.RiskLevel;
import me.golemcore.guard.domain.model.SecurityPolicy;
import me.golemcore.guard.domain.model.ToolPermission;
import me.golemcore.guard.security.DenyListMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a tool call may proceed and whether it needs a human.
 *
 * <p>
 * Decision order:
 * <ol>
 * <li>Unregistered tool: not allowed, dangerous.</li>
 * <li>Per declared capability: a deny-listed path (filesystem capabilities) or
 * command ({@code terminal.execute}) denies the call as destructive. Deny-list
 * matches win over grants.</li>
 * <li>Final gate on the highest declared risk: approval is required when the
 * tool always requires it or the policy cannot auto-approve that risk. Grants
 * never bypass this gate.</li>
 * </ol>
 *
 * <p>
 * Checks are synchronous and read a single policy snapshot per call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicyEngine {

    private static final int COMMAND_PREVIEW_LENGTH = 50;

    private final PermissionRegistry permissionRegistry;
    private final GrantStore grantStore;
    private final SecurityPolicyService policyService;
    private final DenyListMatcher denyListMatcher;

    public PermissionCheckResult checkPermission(String toolName, Map<String, Object> args) {
        return checkPermission(toolName, args, GrantStore.DEFAULT_PRINCIPAL);
    }

    public PermissionCheckResult checkPermission(String toolName, Map<String, Object> args, String principal) {
        Optional<ToolPermission> registered = permissionRegistry.lookup(toolName);
        if (registered.isEmpty()) {
            log.warn("[Security] Unknown tool: {}", toolName);
            return PermissionCheckResult.builder()
                    .allowed(false)
                    .requiresApproval(true)
                    .riskLevel(RiskLevel.DANGEROUS)
                    .reason("Unknown tool: " + toolName)
                    .build();
        }

        ToolPermission permission = registered.get();
        SecurityPolicy policy = policyService.snapshot();

        for (Capability capability : permission.getCapabilities()) {
            Optional<PermissionCheckResult> denial = checkDenyLists(capability, args, policy);
            if (denial.isPresent()) {
                return denial.get();
            }
            if (grantStore.hasGrant(capability.getCategory(), capability.getScope(), principal)) {
                log.debug("[Security] Capability {} covered by grant for {}", capability.getCategory(), principal);
            }
        }

        RiskLevel maxRisk = permission.getMaxRiskLevel();
        if (permission.isAlwaysRequireApproval() || !canAutoApprove(maxRisk, policy)) {
            return PermissionCheckResult.approvalRequired(maxRisk,
                    "Tool '" + toolName + "' requires user approval");
        }
        return PermissionCheckResult.autoApproved(maxRisk);
    }

    /**
     * Whether the current policy auto-approves the given risk level.
     */
    public boolean canAutoApprove(RiskLevel riskLevel) {
        return canAutoApprove(riskLevel, policyService.snapshot());
    }

    public boolean isBlockedPath(String path) {
        return denyListMatcher.isBlockedPath(path, policyService.snapshot().getBlockedPaths());
    }

    public boolean isBlockedCommand(String command) {
        return denyListMatcher.isBlockedCommand(command, policyService.snapshot().getBlockedCommands());
    }

    private Optional<PermissionCheckResult> checkDenyLists(Capability capability, Map<String, Object> args,
            SecurityPolicy policy) {
        CapabilityCategory category = capability.getCategory();

        if (category.isFilesystem()) {
            Optional<String> path = denyListMatcher.extractPath(args);
            if (path.isPresent() && denyListMatcher.isBlockedPath(path.get(), policy.getBlockedPaths())) {
                return Optional.of(PermissionCheckResult.denied(RiskLevel.DESTRUCTIVE,
                        "Path '" + path.get() + "' is blocked by security policy"));
            }
        }

        if (category == CapabilityCategory.TERMINAL_EXECUTE) {
            Optional<String> command = denyListMatcher.extractCommand(args);
            if (command.isPresent() && denyListMatcher.isBlockedCommand(command.get(), policy.getBlockedCommands())) {
                return Optional.of(PermissionCheckResult.denied(RiskLevel.DESTRUCTIVE,
                        "Command blocked by security policy: " + preview(command.get())));
            }
        }
        return Optional.empty();
    }

    private static boolean canAutoApprove(RiskLevel riskLevel, SecurityPolicy policy) {
        return switch (riskLevel) {
        case SAFE -> policy.isAutoApproveSafe();
        case MODERATE -> policy.isAutoApproveModerate();
        case DANGEROUS, DESTRUCTIVE -> !policy.isNeverAutoApproveDangerous();
        };
    }

    private static String preview(String command) {
        if (command.length() <= COMMAND_PREVIEW_LENGTH) {
            return command;
        }
        return command.substring(0, COMMAND_PREVIEW_LENGTH) + "...";
    }
}
