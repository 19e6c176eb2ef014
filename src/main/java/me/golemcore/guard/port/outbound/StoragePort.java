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

import java.util.concurrent.CompletableFuture;

/**
 * Text persistence for guard state, addressed as {@code directory/path}
 * relative to the storage root.
 */
public interface StoragePort {

    /**
     * @return future with the file content, or {@code null} when the file is
     *         absent
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Replace a file so readers see either the old or the new content, never a
     * partial write. The content goes to a synced temporary sibling first and is
     * then renamed over the target.
     *
     * @param backup
     *            keep the replaced content next to the target with a
     *            {@code .bak} suffix
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    CompletableFuture<Void> ensureDirectory(String directory);
}
