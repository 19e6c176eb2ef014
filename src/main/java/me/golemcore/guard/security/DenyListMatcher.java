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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates filesystem paths and shell commands against the policy deny-lists.
 *
 * <p>
 * Paths are expanded ({@code ~}), resolved and normalized, then matched against
 * blocked path globs compiled to anchored case-insensitive expressions. Commands
 * are searched with each blocked command pattern as a case-insensitive regular
 * expression.
 *
 * <p>
 * The values under test are taken from the tool arguments, using the first
 * string value found among {@link #PATH_KEYS} for paths and {@link #COMMAND_KEY}
 * for commands. Compiled patterns are cached; the component is thread-safe.
 */
@Component
@Slf4j
public class DenyListMatcher {

    /**
     * Argument names probed, in order, for the filesystem path of a tool call.
     */
    public static final List<String> PATH_KEYS = List.of("path", "filePath", "directory", "dir", "file",
            "targetPath");

    public static final String COMMAND_KEY = "command";

    private static final String HOME = "~";

    private final String homeDirectory;
    private final Map<String, Pattern> pathPatterns = new ConcurrentHashMap<>();
    private final Map<String, Pattern> commandPatterns = new ConcurrentHashMap<>();

    public DenyListMatcher() {
        this(System.getProperty("user.home"));
    }

    DenyListMatcher(String homeDirectory) {
        this.homeDirectory = homeDirectory != null ? homeDirectory : "";
    }

    public Optional<String> extractPath(Map<String, Object> args) {
        if (args == null) {
            return Optional.empty();
        }
        for (String key : PATH_KEYS) {
            if (args.get(key) instanceof String value) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public Optional<String> extractCommand(Map<String, Object> args) {
        if (args != null && args.get(COMMAND_KEY) instanceof String command) {
            return Optional.of(command);
        }
        return Optional.empty();
    }

    public boolean isBlockedPath(String path, List<String> blockedPaths) {
        if (path == null || blockedPaths == null || blockedPaths.isEmpty()) {
            return false;
        }

        String resolved;
        try {
            resolved = Paths.get(expandHome(path)).toAbsolutePath().normalize().toString();
        } catch (InvalidPathException e) {
            log.warn("[Security] Unparseable path treated as blocked: {}", path);
            return true;
        }

        evictStale(pathPatterns, blockedPaths);
        for (String glob : blockedPaths) {
            Pattern pattern = pathPatterns.computeIfAbsent(glob,
                    g -> GlobPattern.compile(expandHome(g), true));
            if (pattern.matcher(resolved).matches()) {
                log.warn("[Security] Blocked path: {} (pattern={})", resolved, glob);
                return true;
            }
        }
        return false;
    }

    public boolean isBlockedCommand(String command, List<String> blockedCommands) {
        if (command == null || blockedCommands == null || blockedCommands.isEmpty()) {
            return false;
        }
        evictStale(commandPatterns, blockedCommands);
        for (String regex : blockedCommands) {
            Pattern pattern = commandPatterns.computeIfAbsent(regex, DenyListMatcher::compileCommandPattern);
            if (pattern.matcher(command).find()) {
                log.warn("[Security] Blocked command: pattern={}", regex);
                return true;
            }
        }
        return false;
    }

    /**
     * Fail fast on a missing path glob.
     *
     * @throws IllegalArgumentException
     *             if the pattern is null or blank
     */
    public static void validatePathPattern(String glob) {
        if (glob == null || glob.isBlank()) {
            throw new IllegalArgumentException("Path pattern must not be blank");
        }
    }

    /**
     * Fail fast on a command pattern that is not a valid regular expression.
     *
     * @throws IllegalArgumentException
     *             if the pattern does not compile
     */
    public static void validateCommandPattern(String regex) {
        if (regex == null || regex.isBlank()) {
            throw new IllegalArgumentException("Blocked command pattern must not be blank");
        }
        try {
            compileCommandPattern(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid blocked command pattern: " + regex, e);
        }
    }

    private static Pattern compileCommandPattern(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    int cachedPatternCount() {
        return pathPatterns.size() + commandPatterns.size();
    }

    // Patterns dropped from the policy leave the cache once it outgrows the live list.
    private static void evictStale(Map<String, Pattern> cache, List<String> live) {
        if (cache.size() > live.size()) {
            cache.keySet().retainAll(new HashSet<>(live));
        }
    }

    private String expandHome(String value) {
        if (value.equals(HOME) || value.startsWith(HOME + "/") || value.startsWith(HOME + "\\")) {
            return homeDirectory + value.substring(1);
        }
        return value;
    }
}
