package me.golemcore.forum.domain.runtime;

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


import me.golemcore.forum.domain.model.Message;

import java.util.concurrent.CompletableFuture;

/**
 * Where the next message of a conversation attaches: after a message promise,
 * at the root of a new tree, or undetermined (decided by whatever is appended
 * first).
 */
public record BranchPoint(MessagePromise promise, boolean undetermined) {

    public static final BranchPoint ROOT = new BranchPoint(null, false);
    public static final BranchPoint UNDETERMINED = new BranchPoint(null, true);

    public static BranchPoint of(MessagePromise promise) {
        return promise != null ? new BranchPoint(promise, false) : ROOT;
    }

    public boolean isRoot() {
        return promise == null && !undetermined;
    }

    /**
     * The message to attach after, or {@code null} for the root and undetermined
     * branch points.
     */
    public CompletableFuture<Message> materialize() {
        return promise != null ? promise.materialize() : CompletableFuture.completedFuture(null);
    }
}
