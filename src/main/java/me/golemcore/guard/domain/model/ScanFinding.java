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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A suspicious code fragment detected by the skill scanner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanFinding {

    private FindingType type;
    private Severity severity;
    private Integer line;
    private String code;
    private String description;
    private String mitigation;
    private int score;

    public enum FindingType {
        DATA_EXFILTRATION, CREDENTIAL_ACCESS, SHELL_EXECUTION, NETWORK_REQUEST, FILE_DELETION, CODE_INJECTION,
        OBFUSCATION, PRIVILEGE_ESCALATION, ENVIRONMENT_ACCESS, SUSPICIOUS_IMPORT
    }

    /**
     * Ordered from most to least severe.
     */
    public enum Severity {
        CRITICAL, DANGER, WARNING, INFO
    }
}
