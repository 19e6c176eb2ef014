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

import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Strips secrets and oversized values from tool arguments before they are
 * stored in the audit log.
 */
@Component
public class AuditArgumentSanitizer {

    public static final String REDACTED = "[REDACTED]";
    public static final String TRUNCATED_SUFFIX = "...[truncated]";

    private static final List<String> SENSITIVE_KEYS = List.of("password", "token", "secret", "key", "apikey",
            "credential");

    private final int maxValueLength;

    public AuditArgumentSanitizer(GuardProperties properties) {
        this.maxValueLength = properties.getAudit().getMaxValueLength();
    }

    public Map<String, Object> sanitize(Map<String, Object> args) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        if (args == null) {
            return sanitized;
        }
        for (Map.Entry<String, Object> entry : args.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (isSensitive(key)) {
                sanitized.put(key, REDACTED);
            } else if (value instanceof String text && text.length() > maxValueLength) {
                sanitized.put(key, text.substring(0, maxValueLength) + TRUNCATED_SUFFIX);
            } else {
                sanitized.put(key, value);
            }
        }
        return sanitized;
    }

    private boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        return SENSITIVE_KEYS.stream().anyMatch(lower::contains);
    }
}
