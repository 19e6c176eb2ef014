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
 * Kind of side effect a tool may perform. Serialized by its dotted value, e.g.
 * {@code filesystem.write}.
 */
public enum CapabilityCategory {

    FILESYSTEM_READ("filesystem.read"),
    FILESYSTEM_WRITE("filesystem.write"),
    FILESYSTEM_DELETE("filesystem.delete"),
    TERMINAL_EXECUTE("terminal.execute"),
    TERMINAL_BACKGROUND("terminal.background"),
    NETWORK_HTTP("network.http"),
    NETWORK_WEBSOCKET("network.websocket"),
    BROWSER_NAVIGATE("browser.navigate"),
    BROWSER_EXECUTE("browser.execute"),
    DATABASE_READ("database.read"),
    DATABASE_WRITE("database.write"),
    GITHUB_READ("github.read"),
    GITHUB_WRITE("github.write"),
    MEMORY_READ("memory.read"),
    MEMORY_WRITE("memory.write"),
    SYSTEM_INFO("system.info");

    private static final String FILESYSTEM_PREFIX = "filesystem.";

    private final String value;

    CapabilityCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isFilesystem() {
        return value.startsWith(FILESYSTEM_PREFIX);
    }

    @JsonCreator
    public static CapabilityCategory fromValue(String value) {
        for (CapabilityCategory category : values()) {
            if (category.value.equals(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown capability category: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
