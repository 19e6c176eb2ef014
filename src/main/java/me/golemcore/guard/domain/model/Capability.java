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
import lombok.NonNull;
import lombok.Value;

/**
 * One discrete permission a tool needs: a category, an optional scope glob
 * (e.g. {@code /projects/*}) and the risk of exercising it.
 */
@Value
@Builder
public class Capability {

    @NonNull
    CapabilityCategory category;

    String scope;

    @NonNull
    RiskLevel riskLevel;

    String description;

    public static Capability of(CapabilityCategory category, RiskLevel riskLevel, String description) {
        return Capability.builder()
                .category(category)
                .riskLevel(riskLevel)
                .description(description)
                .build();
    }
}
