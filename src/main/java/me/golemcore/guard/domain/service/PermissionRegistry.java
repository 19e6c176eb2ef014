package me.golemcore.guard.domain.service;

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

import me.golemcore.guard.domain.model.ToolPermission;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the capabilities each tool declares, keyed by tool name.
 * Registering a name twice replaces the earlier declaration.
 */
@Service
@Slf4j
public class PermissionRegistry {

    private final Map<String, ToolPermission> permissions = new ConcurrentHashMap<>();

    public void register(ToolPermission permission) {
        ToolPermission previous = permissions.put(permission.getToolName(), permission);
        if (previous != null) {
            log.debug("[Security] Replaced tool permissions: {}", permission.getToolName());
        } else {
            log.debug("[Security] Registered tool permissions: {} -> {}", permission.getToolName(),
                    permission.getCategories());
        }
    }

    public Optional<ToolPermission> lookup(String toolName) {
        if (toolName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(permissions.get(toolName));
    }

    public boolean unregister(String toolName) {
        return toolName != null && permissions.remove(toolName) != null;
    }

    public List<ToolPermission> getAll() {
        return new ArrayList<>(permissions.values());
    }

    public int size() {
        return permissions.size();
    }
}
