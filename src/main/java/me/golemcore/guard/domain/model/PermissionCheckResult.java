package me.golemcore.guard.domain.model;

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

import lombok.Builder;
import lombok.Value;

/**
 * Structured answer to "may this tool call proceed?". Denials are always
 * represented here, never as exceptions.
 */
@Value
@Builder
public class PermissionCheckResult {

    boolean allowed;
    boolean requiresApproval;
    String reason;
    RiskLevel riskLevel;

    public static PermissionCheckResult denied(RiskLevel riskLevel, String reason) {
        return PermissionCheckResult.builder()
                .allowed(false)
                .requiresApproval(false)
                .riskLevel(riskLevel)
                .reason(reason)
                .build();
    }

    public static PermissionCheckResult approvalRequired(RiskLevel riskLevel, String reason) {
        return PermissionCheckResult.builder()
                .allowed(true)
                .requiresApproval(true)
                .riskLevel(riskLevel)
                .reason(reason)
                .build();
    }

    public static PermissionCheckResult autoApproved(RiskLevel riskLevel) {
        return PermissionCheckResult.builder()
                .allowed(true)
                .requiresApproval(false)
                .riskLevel(riskLevel)
                .build();
    }
}
