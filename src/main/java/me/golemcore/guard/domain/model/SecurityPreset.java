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
 * Named combinations of the auto-approval flags.
 */
public enum SecurityPreset {

    /**
     * Every operation requires approval.
     */
    STRICT(false, false, true),

    /**
     * Safe operations are auto-approved.
     */
    BALANCED(true, false, true),

    /**
     * Safe and moderate operations are auto-approved.
     */
    DEVELOPER(true, true, true),

    /**
     * Everything is auto-approved unless deny-listed. Not recommended.
     */
    TRUST(true, true, false);

    private final boolean autoApproveSafe;
    private final boolean autoApproveModerate;
    private final boolean neverAutoApproveDangerous;

    SecurityPreset(boolean autoApproveSafe, boolean autoApproveModerate, boolean neverAutoApproveDangerous) {
        this.autoApproveSafe = autoApproveSafe;
        this.autoApproveModerate = autoApproveModerate;
        this.neverAutoApproveDangerous = neverAutoApproveDangerous;
    }

    public SecurityPolicyUpdate toUpdate() {
        return SecurityPolicyUpdate.builder()
                .autoApproveSafe(autoApproveSafe)
                .autoApproveModerate(autoApproveModerate)
                .neverAutoApproveDangerous(neverAutoApproveDangerous)
                .build();
    }

    public static SecurityPreset fromValue(String value) {
        for (SecurityPreset preset : values()) {
            if (preset.name().equalsIgnoreCase(value)) {
                return preset;
            }
        }
        throw new IllegalArgumentException("Unknown security preset: " + value);
    }
}
