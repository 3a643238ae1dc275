package me.golemcore.forum.port.outbound;

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


import me.golemcore.forum.domain.model.Immutable;

import java.util.concurrent.CompletableFuture;

/**
 * Port for a content-addressable store of immutable objects. Objects are keyed
 * by their hash key.
 */
public interface ImmutableStoragePort {

    /**
     * Store an immutable object. Storing an object whose hash key is already
     * present is a no-op.
     */
    CompletableFuture<Void> storeImmutable(Immutable immutable);

    /**
     * Retrieve an immutable object by its hash key. The future fails with
     * {@link me.golemcore.forum.domain.exception.ImmutableNotFoundException} if
     * there is no such object.
     */
    CompletableFuture<Immutable> retrieveImmutable(String hashKey);
}
