package me.golemcore.guard.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the guard, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code guard.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where persisted state lives</li>
 * <li>{@link PolicyProperties} - initial security policy</li>
 * <li>{@link AuditProperties} - audit log location and bounds</li>
 * <li>{@link ApprovalProperties} - built-in pending approval handler</li>
 * <li>{@link ToolsProperties} - built-in tool permission registration</li>
 * <li>{@link ScannerProperties} - skill scanner</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "guard")
@Data
public class GuardProperties {

    private StorageProperties storage = new StorageProperties();
    private PolicyProperties policy = new PolicyProperties();
    private AuditProperties audit = new AuditProperties();
    private ApprovalProperties approval = new ApprovalProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ScannerProperties scanner = new ScannerProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "./data";
    }

    /**
     * Initial policy: defaults, then {@code preset}, then any explicit flag, then
     * the extra patterns appended to the default lists.
     */
    @Data
    public static class PolicyProperties {
        private String preset;
        private Boolean autoApproveSafe;
        private Boolean autoApproveModerate;
        private Boolean neverAutoApproveDangerous;
        private List<String> allowedPaths = new ArrayList<>();
        private List<String> blockedPaths = new ArrayList<>();
        private List<String> blockedCommands = new ArrayList<>();
    }

    @Data
    public static class AuditProperties {
        private String directory = "security";
        private String file = "audit.json";
        private int memoryLimit = 1000;
        private int persistLimit = 500;
        private int maxValueLength = 500;
        private boolean backup = false;
    }

    @Data
    public static class ApprovalProperties {
        private boolean enabled = true;
        private int timeoutSeconds = 300;
    }

    @Data
    public static class ToolsProperties {
        private boolean registerBuiltins = true;
    }

    @Data
    public static class ScannerProperties {
        private List<String> extensions = new ArrayList<>(List.of(".ts", ".js", ".py", ".sh", ".java"));
        private long cacheTtlSeconds = 3600;
    }
}
