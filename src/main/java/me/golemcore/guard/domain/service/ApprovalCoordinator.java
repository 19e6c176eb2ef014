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

import me.golemcore.guard.domain.model.ApprovalRequest;
import me.golemcore.guard.domain.model.RiskLevel;
import me.golemcore.guard.port.outbound.ApprovalPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Routes approval requests to the single installed {@link ApprovalPort}.
 *
 * <p>
 * Listeners see "requested" before the handler runs and "result" after it
 * answers. A handler that throws or fails its future propagates the failure to
 * the caller and produces no result notification. Without a handler every
 * request is denied.
 */
@Service
@Slf4j
public class ApprovalCoordinator {

    private final Clock clock;
    private final SecurityEventDispatcher eventDispatcher;

    private volatile ApprovalPort approvalHandler;

    public ApprovalCoordinator(Clock clock, SecurityEventDispatcher eventDispatcher) {
        this.clock = clock;
        this.eventDispatcher = eventDispatcher;
    }

    /**
     * Install the approval handler, replacing any previous one. {@code null}
     * removes it.
     */
    public void setApprovalHandler(ApprovalPort handler) {
        this.approvalHandler = handler;
        log.info("[Approval] Approval handler {}", handler != null ? "installed" : "cleared");
    }

    public boolean hasApprovalHandler() {
        return approvalHandler != null;
    }

    public CompletableFuture<Boolean> requestApproval(String toolName, Map<String, Object> args,
            RiskLevel riskLevel, String reason) {
        ApprovalPort handler = approvalHandler;
        if (handler == null) {
            log.warn("[Approval] No approval handler set, denying by default: {}", toolName);
            return CompletableFuture.completedFuture(false);
        }

        ApprovalRequest request = ApprovalRequest.builder()
                .toolName(toolName)
                .args(args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of())
                .riskLevel(riskLevel)
                .riskDescription(riskLevel != null ? riskLevel.getDescription() : null)
                .reason(reason)
                .timestamp(Instant.now(clock))
                .build();

        eventDispatcher.approvalRequested(request);
        log.info("[Approval] Requesting approval: tool={}, risk={}", toolName, riskLevel);

        CompletableFuture<Boolean> answer;
        try {
            answer = handler.requestApproval(request);
        } catch (RuntimeException e) {
            log.error("[Approval] Approval handler failed for {}", toolName, e);
            return CompletableFuture.failedFuture(e);
        }
        if (answer == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Approval handler returned no result for " + toolName));
        }

        return answer.thenApply(approved -> {
            boolean result = Boolean.TRUE.equals(approved);
            log.info("[Approval] {} {}", toolName, result ? "approved" : "denied");
            eventDispatcher.approvalResult(request, result);
            return result;
        });
    }
}
