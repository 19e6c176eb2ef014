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

import me.golemcore.guard.domain.model.ApprovalSource;
import me.golemcore.guard.domain.model.CapabilityCategory;
import me.golemcore.guard.domain.model.PermissionGrant;
import me.golemcore.guard.security.GlobPattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Per-principal store of time-scoped capability grants.
 *
 * <p>
 * A grant covers a request when the categories match exactly, the grant has not
 * expired and either the request carries no scope or the grant's scope glob
 * matches the requested scope. A grant without scope never covers a scoped
 * request. Expired grants stay stored until {@link #purgeExpired()} but are
 * ignored by every lookup.
 *
 * <p>
 * All operations are mutually exclusive.
 */
@Service
@Slf4j
public class GrantStore {

    public static final String DEFAULT_PRINCIPAL = "default";

    private final Clock clock;
    private final Map<String, List<PermissionGrant>> grants = new HashMap<>();
    private final Map<String, Pattern> scopePatterns = new HashMap<>();

    public GrantStore(Clock clock) {
        this.clock = clock;
    }

    public PermissionGrant grant(CapabilityCategory capability, String scope) {
        return grant(capability, scope, null, DEFAULT_PRINCIPAL, ApprovalSource.USER);
    }

    public PermissionGrant grant(CapabilityCategory capability, String scope, Duration duration) {
        return grant(capability, scope, duration, DEFAULT_PRINCIPAL, ApprovalSource.USER);
    }

    /**
     * Add a grant.
     *
     * @param duration
     *            lifetime of the grant, {@code null} for a permanent grant
     * @param principal
     *            owner of the grant, {@code null} for {@value #DEFAULT_PRINCIPAL}
     * @param grantedBy
     *            who issued the grant, {@code null} for
     *            {@link ApprovalSource#USER}
     * @throws IllegalArgumentException
     *             if the duration is zero or negative
     */
    public synchronized PermissionGrant grant(CapabilityCategory capability, String scope, Duration duration,
            String principal, ApprovalSource grantedBy) {
        Objects.requireNonNull(capability, "capability");
        if (duration != null && (duration.isZero() || duration.isNegative())) {
            throw new IllegalArgumentException("Grant duration must be positive: " + duration);
        }

        Instant now = Instant.now(clock);
        PermissionGrant grant = PermissionGrant.builder()
                .capability(capability)
                .scope(scope)
                .grantedAt(now)
                .expiresAt(duration != null ? now.plus(duration) : null)
                .grantedBy(grantedBy != null ? grantedBy : ApprovalSource.USER)
                .build();

        grants.computeIfAbsent(principalOrDefault(principal), p -> new ArrayList<>()).add(grant);
        log.info("[Security] Permission granted: {}{} to {} (expires: {})", capability,
                scope != null ? " (" + scope + ")" : "", principalOrDefault(principal),
                grant.getExpiresAt() != null ? grant.getExpiresAt() : "never");
        return grant.toBuilder().build();
    }

    public boolean revoke(CapabilityCategory capability, String scope) {
        return revoke(capability, scope, DEFAULT_PRINCIPAL);
    }

    /**
     * Remove every grant of the principal with exactly this category and scope.
     *
     * @return true if at least one grant was removed
     */
    public synchronized boolean revoke(CapabilityCategory capability, String scope, String principal) {
        List<PermissionGrant> principalGrants = grants.get(principalOrDefault(principal));
        if (principalGrants == null) {
            return false;
        }
        boolean removed = principalGrants.removeIf(
                g -> g.getCapability() == capability && Objects.equals(g.getScope(), scope));
        if (removed) {
            evictUnusedScopes();
            log.info("[Security] Permission revoked: {}{} from {}", capability,
                    scope != null ? " (" + scope + ")" : "", principalOrDefault(principal));
        }
        return removed;
    }

    public boolean hasGrant(CapabilityCategory capability, String requiredScope) {
        return hasGrant(capability, requiredScope, DEFAULT_PRINCIPAL);
    }

    public synchronized boolean hasGrant(CapabilityCategory capability, String requiredScope, String principal) {
        List<PermissionGrant> principalGrants = grants.get(principalOrDefault(principal));
        if (principalGrants == null) {
            return false;
        }
        Instant now = Instant.now(clock);
        return principalGrants.stream()
                .filter(g -> g.getCapability() == capability)
                .filter(g -> !g.isExpired(now))
                .anyMatch(g -> scopeMatches(requiredScope, g.getScope()));
    }

    /**
     * Active grants of a principal, as copies.
     */
    public synchronized List<PermissionGrant> getGrants(String principal) {
        List<PermissionGrant> principalGrants = grants.get(principalOrDefault(principal));
        if (principalGrants == null) {
            return List.of();
        }
        Instant now = Instant.now(clock);
        return principalGrants.stream()
                .filter(g -> !g.isExpired(now))
                .map(g -> g.toBuilder().build())
                .toList();
    }

    /**
     * Drop expired grants of every principal.
     *
     * @return number of grants removed
     */
    public synchronized int purgeExpired() {
        Instant now = Instant.now(clock);
        int removed = 0;
        for (List<PermissionGrant> principalGrants : grants.values()) {
            int before = principalGrants.size();
            principalGrants.removeIf(g -> g.isExpired(now));
            removed += before - principalGrants.size();
        }
        grants.values().removeIf(List::isEmpty);
        if (removed > 0) {
            evictUnusedScopes();
            log.debug("[Security] Purged {} expired grants", removed);
        }
        return removed;
    }

    /**
     * Number of compiled scope globs held, one per distinct stored scope at most.
     */
    synchronized int compiledScopeCount() {
        return scopePatterns.size();
    }

    private boolean scopeMatches(String requiredScope, String grantedScope) {
        if (requiredScope == null) {
            return true;
        }
        if (grantedScope == null) {
            return false;
        }
        return scopePatterns.computeIfAbsent(grantedScope, scope -> GlobPattern.compile(scope, false))
                .matcher(requiredScope)
                .matches();
    }

    private void evictUnusedScopes() {
        Set<String> inUse = new HashSet<>();
        grants.values().forEach(list -> list.forEach(g -> inUse.add(g.getScope())));
        scopePatterns.keySet().retainAll(inUse);
    }

    private static String principalOrDefault(String principal) {
        return principal != null ? principal : DEFAULT_PRINCIPAL;
    }
}
