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
import me.golemcore.guard.domain.model.AuditLogEntry;
import me.golemcore.guard.port.outbound.SecurityEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans security notifications out to every registered
 * {@link SecurityEventListener}. A failing listener is logged and skipped.
 */
@Service
@Slf4j
public class SecurityEventDispatcher {

    private final CopyOnWriteArrayList<SecurityEventListener> listeners;

    public SecurityEventDispatcher(List<SecurityEventListener> listeners) {
        this.listeners = new CopyOnWriteArrayList<>(listeners != null ? listeners : List.of());
    }

    public void addListener(SecurityEventListener listener) {
        if (listener != null) {
            listeners.addIfAbsent(listener);
        }
    }

    public boolean removeListener(SecurityEventListener listener) {
        return listeners.remove(listener);
    }

    public void approvalRequested(ApprovalRequest request) {
        notifyListeners("onApprovalRequested", l -> l.onApprovalRequested(request));
    }

    public void approvalResult(ApprovalRequest request, boolean approved) {
        notifyListeners("onApprovalResult", l -> l.onApprovalResult(request, approved));
    }

    public void auditLogged(AuditLogEntry entry) {
        notifyListeners("onAuditLogged", l -> l.onAuditLogged(entry));
    }

    private void notifyListeners(String event, Consumer<SecurityEventListener> action) {
        for (SecurityEventListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (RuntimeException e) {
                log.warn("[Security] Listener {} failed on {}: {}", listener.getClass().getSimpleName(), event,
                        e.getMessage());
            }
        }
    }
}
