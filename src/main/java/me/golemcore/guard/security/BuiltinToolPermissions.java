package me.golemcore.guard.security;

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
import me.golemcore.guard.domain.model.RiskLevel;
import me.golemcore.guard.domain.model.ToolPermission;

import java.util.List;

/**
 * Capability declarations of the standard agent tools, registered at startup
 * when {@code guard.tools.register-builtins} is enabled. Skill modules register
 * their own permissions on top of these.
 */
public final class BuiltinToolPermissions {

    private static final List<ToolPermission> PERMISSIONS = List.of(
            tool("read_file", CapabilityCategory.FILESYSTEM_READ, RiskLevel.SAFE, "Read file contents", false),
            tool("list_directory", CapabilityCategory.FILESYSTEM_READ, RiskLevel.SAFE, "List directory contents",
                    false),
            tool("search_files", CapabilityCategory.FILESYSTEM_READ, RiskLevel.SAFE, "Search for files", false),
            tool("write_file", CapabilityCategory.FILESYSTEM_WRITE, RiskLevel.MODERATE, "Write file contents",
                    false),
            tool("delete_file", CapabilityCategory.FILESYSTEM_DELETE, RiskLevel.DANGEROUS, "Delete files", true),
            tool("run_command", CapabilityCategory.TERMINAL_EXECUTE, RiskLevel.DANGEROUS, "Execute shell command",
                    true),
            tool("start_background_command", CapabilityCategory.TERMINAL_BACKGROUND, RiskLevel.DANGEROUS,
                    "Start background process", true),
            tool("browser_navigate", CapabilityCategory.BROWSER_NAVIGATE, RiskLevel.MODERATE, "Navigate to URL",
                    false),
            tool("browser_execute", CapabilityCategory.BROWSER_EXECUTE, RiskLevel.DANGEROUS, "Execute JavaScript",
                    true),
            tool("http_fetch", CapabilityCategory.NETWORK_HTTP, RiskLevel.MODERATE, "Make HTTP request", false),
            tool("remember", CapabilityCategory.MEMORY_WRITE, RiskLevel.SAFE, "Store in memory", false),
            tool("recall", CapabilityCategory.MEMORY_READ, RiskLevel.SAFE, "Retrieve from memory", false));

    private BuiltinToolPermissions() {
    }

    public static List<ToolPermission> all() {
        return PERMISSIONS;
    }

    private static ToolPermission tool(String name, CapabilityCategory category, RiskLevel risk, String description,
            boolean alwaysRequireApproval) {
        return ToolPermission.builder()
                .toolName(name)
                .capability(Capability.of(category, risk, description))
                .alwaysRequireApproval(alwaysRequireApproval)
                .build();
    }
}
