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

/**
 * Outcome recorded for one execution attempt.
 */
public enum AuditResult {

    APPROVED("approved"),
    DENIED("denied"),
    AUTO_APPROVED("auto-approved");

    private final String value;

    AuditResult(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AuditResult fromValue(String value) {
        for (AuditResult result : values()) {
            if (result.value.equalsIgnoreCase(value)) {
                return result;
            }
        }
        throw new IllegalArgumentException("Unknown audit result: " + value);
    }
}
