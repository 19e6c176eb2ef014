package me.golemcore.guard.adapter.outbound.approval;

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

import me.golemcore.guard.domain.model.ApprovalCallbackEvent;
import me.golemcore.guard.domain.model.ApprovalRequest;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.port.outbound.ApprovalPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Channel-agnostic approval handler that parks requests until someone answers
 * them.
 *
 * <p>
 * Each request is stored under a short generated id. An inbound channel (chat
 * bot, web dashboard, CLI) lists the pending requests, shows them to a human
 * and answers either by calling {@link #resolve(String, boolean)} or by
 * publishing an {@link ApprovalCallbackEvent}. Requests not answered within
 * {@code guard.approval.timeout-seconds} are denied.
 *
 * <p>
 * When {@code guard.approval.enabled} is false every request is denied
 * immediately.
 *
 * @see ApprovalPort
 */
@Component
@Slf4j
public class PendingApprovalAdapter implements ApprovalPort {

    private final Clock clock;
    private final boolean enabled;
    private final long timeoutSeconds;
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    public PendingApprovalAdapter(GuardProperties properties, Clock clock) {
        this.clock = clock;
        this.enabled = properties.getApproval().isEnabled();
        this.timeoutSeconds = properties.getApproval().getTimeoutSeconds();
    }

    @Override
    public boolean isAvailable() {
        return enabled;
    }

    @Override
    public CompletableFuture<Boolean> requestApproval(ApprovalRequest request) {
        if (!enabled) {
            log.debug("[Approval] Pending approvals disabled, denying {}", request.getToolName());
            return CompletableFuture.completedFuture(false);
        }

        String approvalId = UUID.randomUUID().toString().substring(0, 8);
        CompletableFuture<Boolean> future = new CompletableFuture<>();
        pending.put(approvalId, new Pending(new PendingApproval(approvalId, request, Instant.now(clock)), future));
        log.info("[Approval] Awaiting approval {}: tool={}, risk={}", approvalId, request.getToolName(),
                request.getRiskLevel());

        return future.orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .exceptionally(ex -> {
                    log.info("[Approval] Approval {} timed out or failed, denying", approvalId);
                    pending.remove(approvalId);
                    return false;
                });
    }

    /**
     * Requests still waiting for an answer, oldest first.
     */
    public List<PendingApproval> getPendingApprovals() {
        return pending.values().stream()
                .map(Pending::approval)
                .sorted(Comparator.comparing(PendingApproval::createdAt))
                .toList();
    }

    /**
     * Answer a pending request.
     *
     * @return false if no request with this id is pending
     */
    public boolean resolve(String approvalId, boolean approved) {
        Pending entry = approvalId != null ? pending.remove(approvalId) : null;
        if (entry == null) {
            log.debug("[Approval] No pending approval found for id: {}", approvalId);
            return false;
        }
        entry.future().complete(approved);
        log.info("[Approval] Approval {} resolved: approved={}", approvalId, approved);
        return true;
    }

    /**
     * Handle approval answers published by inbound channel adapters.
     */
    @EventListener
    public void onApprovalCallback(ApprovalCallbackEvent event) {
        resolve(event.approvalId(), event.approved());
    }

    public record PendingApproval(String id, ApprovalRequest request, Instant createdAt) {
    }

    private record Pending(PendingApproval approval, CompletableFuture<Boolean> future) {
    }
}
