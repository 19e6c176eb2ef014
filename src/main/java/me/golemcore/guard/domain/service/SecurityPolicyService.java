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

import me.golemcore.guard.domain.model.SecurityPolicy;
import me.golemcore.guard.domain.model.SecurityPolicyUpdate;
import me.golemcore.guard.domain.model.SecurityPreset;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.security.DenyListMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Owner of the live {@link SecurityPolicy}.
 *
 * <p>
 * The policy is replaced copy-on-write: readers always see a complete policy
 * and never the one being edited. Callers only ever receive copies.
 *
 * <p>
 * The initial policy is built from the defaults, then the configured preset,
 * then explicit flag overrides, then the extra configured patterns.
 */
@Service
@Slf4j
public class SecurityPolicyService {

    private volatile SecurityPolicy policy;

    public SecurityPolicyService(GuardProperties properties) {
        this.policy = buildInitialPolicy(properties.getPolicy());
        log.info("[Security] Policy initialized: autoApproveSafe={}, autoApproveModerate={}, "
                + "neverAutoApproveDangerous={}",
                policy.isAutoApproveSafe(), policy.isAutoApproveModerate(), policy.isNeverAutoApproveDangerous());
    }

    /**
     * Copy of the current policy.
     */
    public SecurityPolicy getPolicy() {
        return policy.copy();
    }

    /**
     * Live policy for read-only use inside the engine.
     */
    SecurityPolicy snapshot() {
        return policy;
    }

    /**
     * Apply the non-null fields of a partial update. List fields replace the
     * current lists.
     *
     * @throws IllegalArgumentException
     *             if a path pattern is blank or a blocked command pattern is
     *             not a valid regular expression
     */
    public synchronized SecurityPolicy updatePolicy(SecurityPolicyUpdate update) {
        if (update == null) {
            return getPolicy();
        }
        if (update.getAllowedPaths() != null) {
            update.getAllowedPaths().forEach(DenyListMatcher::validatePathPattern);
        }
        if (update.getBlockedPaths() != null) {
            update.getBlockedPaths().forEach(DenyListMatcher::validatePathPattern);
        }
        if (update.getBlockedCommands() != null) {
            update.getBlockedCommands().forEach(DenyListMatcher::validateCommandPattern);
        }

        SecurityPolicy next = policy.copy();
        apply(next, update);
        policy = next;
        log.info("[Security] Policy updated");
        return next.copy();
    }

    public SecurityPolicy applyPreset(SecurityPreset preset) {
        SecurityPolicy updated = updatePolicy(preset.toUpdate());
        log.info("[Security] Applied preset: {}", preset);
        return updated;
    }

    public boolean addAllowedPath(String pattern) {
        return addPattern(pattern, SecurityPolicy::getAllowedPaths);
    }

    public boolean addBlockedPath(String pattern) {
        return addPattern(pattern, SecurityPolicy::getBlockedPaths);
    }

    /**
     * @throws IllegalArgumentException
     *             if the pattern is not a valid regular expression
     */
    public boolean addBlockedCommand(String pattern) {
        DenyListMatcher.validateCommandPattern(pattern);
        return addPattern(pattern, SecurityPolicy::getBlockedCommands);
    }

    private synchronized boolean addPattern(String pattern, Function<SecurityPolicy, List<String>> list) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Pattern must not be blank");
        }
        if (list.apply(policy).contains(pattern)) {
            return false;
        }
        SecurityPolicy next = policy.copy();
        list.apply(next).add(pattern);
        policy = next;
        log.info("[Security] Policy pattern added: {}", pattern);
        return true;
    }

    private static SecurityPolicy buildInitialPolicy(GuardProperties.PolicyProperties config) {
        SecurityPolicy initial = SecurityPolicy.defaults();
        if (config == null) {
            return initial;
        }
        if (config.getPreset() != null && !config.getPreset().isBlank()) {
            apply(initial, SecurityPreset.fromValue(config.getPreset().trim()).toUpdate());
        }
        if (config.getAutoApproveSafe() != null) {
            initial.setAutoApproveSafe(config.getAutoApproveSafe());
        }
        if (config.getAutoApproveModerate() != null) {
            initial.setAutoApproveModerate(config.getAutoApproveModerate());
        }
        if (config.getNeverAutoApproveDangerous() != null) {
            initial.setNeverAutoApproveDangerous(config.getNeverAutoApproveDangerous());
        }
        appendAbsent(initial.getAllowedPaths(), config.getAllowedPaths());
        appendAbsent(initial.getBlockedPaths(), config.getBlockedPaths());
        if (config.getBlockedCommands() != null) {
            config.getBlockedCommands().forEach(DenyListMatcher::validateCommandPattern);
        }
        appendAbsent(initial.getBlockedCommands(), config.getBlockedCommands());
        return initial;
    }

    private static void apply(SecurityPolicy target, SecurityPolicyUpdate update) {
        if (update.getAutoApproveSafe() != null) {
            target.setAutoApproveSafe(update.getAutoApproveSafe());
        }
        if (update.getAutoApproveModerate() != null) {
            target.setAutoApproveModerate(update.getAutoApproveModerate());
        }
        if (update.getNeverAutoApproveDangerous() != null) {
            target.setNeverAutoApproveDangerous(update.getNeverAutoApproveDangerous());
        }
        if (update.getAllowedPaths() != null) {
            target.setAllowedPaths(new ArrayList<>(update.getAllowedPaths()));
        }
        if (update.getBlockedPaths() != null) {
            target.setBlockedPaths(new ArrayList<>(update.getBlockedPaths()));
        }
        if (update.getBlockedCommands() != null) {
            target.setBlockedCommands(new ArrayList<>(update.getBlockedCommands()));
        }
    }

    private static void appendAbsent(List<String> target, List<String> extra) {
        if (extra == null) {
            return;
        }
        for (String pattern : extra) {
            if (pattern != null && !pattern.isBlank() && !target.contains(pattern)) {
                target.add(pattern);
            }
        }
    }
}
