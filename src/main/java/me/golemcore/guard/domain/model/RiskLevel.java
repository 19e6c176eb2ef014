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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;

/**
 * Ordinal harm classification of a capability. Declaration order is the risk
 * order: {@code SAFE < MODERATE < DANGEROUS < DESTRUCTIVE}.
 */
public enum RiskLevel {

    SAFE("safe", "Read-only operations with no side effects"),

    MODERATE("moderate", "Operations that modify local state reversibly"),

    DANGEROUS("dangerous", "Operations that could cause data loss or external effects"),

    DESTRUCTIVE("destructive", "Operations that permanently delete data or affect system integrity");

    private final String value;
    private final String description;

    RiskLevel(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * Highest level among the given ones, {@link #SAFE} for an empty input.
     */
    public static RiskLevel max(Collection<RiskLevel> levels) {
        RiskLevel max = SAFE;
        if (levels == null) {
            return max;
        }
        for (RiskLevel level : levels) {
            if (level != null && level.compareTo(max) > 0) {
                max = level;
            }
        }
        return max;
    }

    @JsonCreator
    public static RiskLevel fromValue(String value) {
        for (RiskLevel level : values()) {
            if (level.value.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown risk level: " + value);
    }
}
