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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of scanning one skill source: a 0-100 risk score, the derived level
 * and what to do with the skill.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResult {

    private String skillPath;
    private String skillName;
    private int riskScore;
    private ScanLevel riskLevel;

    @Builder.Default
    private List<ScanFinding> findings = new ArrayList<>();

    private Instant scannedAt;
    private Recommendation recommendation;

    public enum ScanLevel {
        SAFE, LOW, MEDIUM, HIGH, CRITICAL
    }

    public enum Recommendation {
        ALLOW, REVIEW, SANDBOX, BLOCK
    }
}
