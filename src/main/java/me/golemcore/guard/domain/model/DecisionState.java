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

/**
 * Terminal states of a single authorization decision.
 */
public enum DecisionState {

    AUTO_APPROVED(AuditResult.AUTO_APPROVED, ApprovalSource.AUTO),
    AUTO_DENIED(AuditResult.DENIED, ApprovalSource.POLICY),
    APPROVED(AuditResult.APPROVED, ApprovalSource.USER),
    DENIED(AuditResult.DENIED, ApprovalSource.USER);

    private final AuditResult auditResult;
    private final ApprovalSource approvalSource;

    DecisionState(AuditResult auditResult, ApprovalSource approvalSource) {
        this.auditResult = auditResult;
        this.approvalSource = approvalSource;
    }

    public AuditResult getAuditResult() {
        return auditResult;
    }

    public ApprovalSource getApprovalSource() {
        return approvalSource;
    }

    public boolean isPermitted() {
        return this == AUTO_APPROVED || this == APPROVED;
    }
}
