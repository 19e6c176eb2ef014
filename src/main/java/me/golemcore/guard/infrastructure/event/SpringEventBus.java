package me.golemcore.guard.infrastructure.event;

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
import me.golemcore.guard.domain.model.ApprovalRequestedEvent;
import me.golemcore.guard.domain.model.ApprovalResultEvent;
import me.golemcore.guard.domain.model.AuditLogEntry;
import me.golemcore.guard.domain.model.AuditLoggedEvent;
import me.golemcore.guard.port.outbound.SecurityEventListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Republishes security notifications as Spring application events.
 *
 * <p>
 * Events are delivered synchronously to all registered Spring
 * {@code @EventListener} methods, so other components can observe approvals
 * and audit entries without depending on the capability manager:
 * {@link ApprovalRequestedEvent}, {@link ApprovalResultEvent} and
 * {@link AuditLoggedEvent}.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus implements SecurityEventListener {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void onApprovalRequested(ApprovalRequest request) {
        publish(new ApprovalRequestedEvent(request));
    }

    @Override
    public void onApprovalResult(ApprovalRequest request, boolean approved) {
        publish(new ApprovalResultEvent(request, approved));
    }

    @Override
    public void onAuditLogged(AuditLogEntry entry) {
        publish(new AuditLoggedEvent(entry));
    }

    /**
     * Publish an event.
     */
    public void publish(Object event) {
        log.debug("Publishing event: {}", event.getClass().getSimpleName());
        eventPublisher.publishEvent(event);
    }
}
