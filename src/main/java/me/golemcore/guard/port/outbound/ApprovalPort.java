package me.golemcore.guard.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for asking a human whether a tool call may proceed. Exactly one handler
 * is installed on the capability manager at a time.
 */
@FunctionalInterface
public interface ApprovalPort {

    /**
     * Request approval for a tool call.
     *
     * @param request
     *            what the approver is shown
     * @return future that completes with true (approved) or false (denied); an
     *         exceptional completion is reported to the caller as-is
     */
    CompletableFuture<Boolean> requestApproval(ApprovalRequest request);

    /**
     * Check if the handler can currently reach an approver.
     */
    default boolean isAvailable() {
        return true;
    }
}
