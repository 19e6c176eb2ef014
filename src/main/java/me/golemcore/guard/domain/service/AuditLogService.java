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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.guard.domain.model.ApprovalSource;
import me.golemcore.guard.domain.model.AuditLogEntry;
import me.golemcore.guard.domain.model.AuditResult;
import me.golemcore.guard.domain.model.CapabilityCategory;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.port.outbound.StoragePort;
import me.golemcore.guard.security.AuditArgumentSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded audit trail of tool execution attempts.
 *
 * <p>
 * Entries are kept in memory as a ring of the latest
 * {@code guard.audit.memory-limit} entries; every write is followed by a flush
 * of the latest {@code guard.audit.persist-limit} entries to
 * {@code <directory>/<file>} as a JSON array. Flushes are chained so writes
 * never interleave, and a failed flush is logged without failing the caller.
 *
 * <p>
 * Arguments are sanitized before they are stored: sensitive keys are redacted
 * and long strings truncated.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AuditLogService {

    private static final TypeReference<List<AuditLogEntry>> ENTRY_LIST = new TypeReference<>() {
    };
    private static final String ID_PREFIX = "audit_";
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int ID_SUFFIX_LENGTH = 6;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AuditArgumentSanitizer sanitizer;
    private final String directory;
    private final String file;
    private final int memoryLimit;
    private final int persistLimit;
    private final boolean backup;

    private final Object lock = new Object();
    private final Deque<AuditLogEntry> entries = new ArrayDeque<>();
    private CompletableFuture<Void> pendingFlush = CompletableFuture.completedFuture(null);

    public AuditLogService(StoragePort storagePort, ObjectMapper objectMapper, GuardProperties properties,
            Clock clock, AuditArgumentSanitizer sanitizer) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sanitizer = sanitizer;
        GuardProperties.AuditProperties audit = properties.getAudit();
        this.directory = audit.getDirectory();
        this.file = audit.getFile();
        this.memoryLimit = requirePositive("guard.audit.memory-limit", audit.getMemoryLimit());
        this.persistLimit = requirePositive("guard.audit.persist-limit", audit.getPersistLimit());
        this.backup = audit.isBackup();
    }

    /**
     * Load previously persisted entries. A missing, unreadable or corrupt file
     * leaves the log empty.
     */
    public CompletableFuture<Void> initialize() {
        return storagePort.ensureDirectory(directory)
                .thenCompose(v -> storagePort.getText(directory, file))
                .thenAccept(this::loadEntries)
                .exceptionally(e -> {
                    log.warn("[Audit] Failed to load audit log, starting empty: {}", e.getMessage());
                    return null;
                });
    }

    /**
     * Record one execution attempt and persist the log.
     *
     * @return future completing with the stored entry once the flush has run
     */
    public CompletableFuture<AuditLogEntry> log(String toolName, List<CapabilityCategory> capabilities,
            Map<String, Object> args, AuditResult result, ApprovalSource approvalSource, String userId) {
        AuditLogEntry entry = AuditLogEntry.builder()
                .id(generateId())
                .timestamp(Instant.now(clock))
                .toolName(toolName)
                .capabilities(capabilities != null ? new ArrayList<>(capabilities) : new ArrayList<>())
                .args(sanitizer.sanitize(args))
                .result(result)
                .approvalSource(approvalSource)
                .userId(userId)
                .build();

        synchronized (lock) {
            append(entry);
        }
        log.debug("[Audit] {} {} ({})", toolName, result, approvalSource);

        return flush().thenApply(v -> entry);
    }

    /**
     * Persist the latest entries. Always completes normally.
     */
    public CompletableFuture<Void> flush() {
        synchronized (lock) {
            List<AuditLogEntry> snapshot = latest(persistLimit);
            pendingFlush = pendingFlush.thenCompose(v -> write(snapshot));
            return pendingFlush;
        }
    }

    /**
     * Latest entries, oldest first.
     */
    public List<AuditLogEntry> getRecent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        synchronized (lock) {
            return latest(limit);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    private void loadEntries(String json) {
        if (json == null || json.isBlank()) {
            return;
        }
        List<AuditLogEntry> loaded;
        try {
            loaded = objectMapper.readValue(json, ENTRY_LIST);
        } catch (JsonProcessingException e) {
            log.warn("[Audit] Corrupt audit log {}/{}, starting empty: {}", directory, file, e.getOriginalMessage());
            return;
        }
        if (loaded == null) {
            return;
        }

        synchronized (lock) {
            List<AuditLogEntry> recorded = new ArrayList<>(entries);
            entries.clear();
            for (AuditLogEntry entry : loaded) {
                if (entry != null) {
                    append(entry);
                }
            }
            recorded.forEach(this::append);
        }
        log.info("[Audit] Loaded {} audit entries", loaded.size());
    }

    private void append(AuditLogEntry entry) {
        entries.addLast(entry);
        while (entries.size() > memoryLimit) {
            entries.removeFirst();
        }
    }

    private List<AuditLogEntry> latest(int limit) {
        List<AuditLogEntry> all = new ArrayList<>(entries);
        int from = Math.max(0, all.size() - limit);
        return new ArrayList<>(all.subList(from, all.size()));
    }

    private CompletableFuture<Void> write(List<AuditLogEntry> snapshot) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
            return storagePort.putTextAtomic(directory, file, json, backup)
                    .exceptionally(e -> {
                        log.error("[Audit] Failed to persist audit log: {}", e.getMessage());
                        return null;
                    });
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("[Audit] Failed to persist audit log: {}", e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
    }

    private static int requirePositive(String property, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(property + " must be at least 1: " + value);
        }
        return value;
    }

    private String generateId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(ID_PREFIX)
                .append(Instant.now(clock).toEpochMilli())
                .append('_');
        for (int i = 0; i < ID_SUFFIX_LENGTH; i++) {
            sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return sb.toString();
    }
}
