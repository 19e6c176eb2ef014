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

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime security configuration consulted by the policy engine.
 *
 * <p>
 * Path patterns are globs ({@code *} matches anything, {@code ~} is the user
 * home). Command patterns are case-insensitive Java regular expressions.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SecurityPolicy {

    private boolean autoApproveSafe;
    private boolean autoApproveModerate;
    private boolean neverAutoApproveDangerous;

    @Builder.Default
    private List<String> allowedPaths = new ArrayList<>();

    @Builder.Default
    private List<String> blockedPaths = new ArrayList<>();

    @Builder.Default
    private List<String> blockedCommands = new ArrayList<>();

    public static SecurityPolicy defaults() {
        return SecurityPolicy.builder()
                .autoApproveSafe(true)
                .autoApproveModerate(false)
                .neverAutoApproveDangerous(true)
                .allowedPaths(new ArrayList<>(List.of(
                        Paths.get("").toAbsolutePath().toString(),
                        "./data/*",
                        "./memory/*")))
                .blockedPaths(new ArrayList<>(List.of(
                        "~/.ssh/*",
                        "~/.aws/*",
                        "~/.config/*",
                        "/etc/*",
                        "/System/*",
                        "C:\\Windows\\*")))
                .blockedCommands(new ArrayList<>(List.of(
                        "rm\\s+-rf\\s+/",
                        "sudo\\s+rm",
                        "chmod\\s+777",
                        "curl.*\\|.*sh",
                        "wget.*\\|.*sh",
                        "format\\s+",
                        "mkfs\\.",
                        ":\\(\\)\\s*\\{\\s*:\\|:&\\s*\\};:")))
                .build();
    }

    /**
     * Deep copy, so callers can never mutate the live policy lists.
     */
    public SecurityPolicy copy() {
        return toBuilder()
                .allowedPaths(new ArrayList<>(allowedPaths))
                .blockedPaths(new ArrayList<>(blockedPaths))
                .blockedCommands(new ArrayList<>(blockedCommands))
                .build();
    }
}
