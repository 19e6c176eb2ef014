package me.golemcore.guard.adapter.outbound.storage;

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
import me.golemcore.guard.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.CompletableFuture;

/**
 * Filesystem-backed {@link StoragePort}.
 *
 * <p>
 * Everything lives below {@code guard.storage.local.base-path}; the audit
 * directory is created at startup. Relative locations that would escape the
 * base path are rejected with {@link IllegalArgumentException}. I/O failures
 * complete the returned future exceptionally.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final String TEMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";

    private final GuardProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath()
                .replace("${user.home}", System.getProperty("user.home"));
        basePath = Paths.get(configured).toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath.resolve(properties.getAudit().getDirectory()));
            log.info("[Storage] Local storage ready at: {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Failed to create storage directories under {}", basePath, e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolvePath(directory, path);
            if (!Files.exists(file)) {
                return null;
            }
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new RuntimeException("Failed to read " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> ensureDirectory(String directory) {
        return CompletableFuture.runAsync(() -> {
            Path dir = resolveDirectory(directory);
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new RuntimeException("Failed to create " + directory, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path target = resolvePath(directory, path);
            Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
            try {
                writeSynced(temp, content.getBytes(StandardCharsets.UTF_8));
                if (backup && Files.exists(target)) {
                    Path copy = target.resolveSibling(target.getFileName() + BACKUP_SUFFIX);
                    Files.copy(target, copy, StandardCopyOption.REPLACE_EXISTING);
                    log.debug("[Storage] Backup written: {}", copy);
                }
                moveIntoPlace(temp, target);
                log.debug("[Storage] Replaced {}/{}", directory, path);
            } catch (IOException e) {
                deleteQuietly(temp);
                throw new RuntimeException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    private void writeSynced(Path file, byte[] bytes) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SYNC);
                FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            out.write(bytes);
            out.flush();
            channel.force(true);
        }
        if (Files.size(file) != bytes.length) {
            throw new IOException("Size mismatch after writing " + file);
        }
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move unsupported for {}, falling back to plain move", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[Storage] Could not remove temp file {}: {}", file, e.getMessage());
        }
    }

    private Path resolveDirectory(String directory) {
        return confine(basePath.resolve(directory).normalize(), directory);
    }

    private Path resolvePath(String directory, String path) {
        return confine(resolveDirectory(directory).resolve(path).normalize(), directory + "/" + path);
    }

    private Path confine(Path resolved, String requested) {
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + requested);
        }
        return resolved;
    }
}
