package me.golemcore.forum.adapter.outbound.storage;

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


import lombok.extern.slf4j.Slf4j;
import me.golemcore.forum.domain.exception.ImmutableNotFoundException;
import me.golemcore.forum.domain.model.Immutable;
import me.golemcore.forum.port.outbound.ImmutableStoragePort;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ImmutableStoragePort. Objects live as long as
 * the adapter does; concurrent stores of the same hash key keep the first
 * object.
 */
@Slf4j
public class InMemoryImmutableStorageAdapter implements ImmutableStoragePort {

    private final Map<String, Immutable> immutables = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Void> storeImmutable(Immutable immutable) {
        if (immutables.putIfAbsent(immutable.getHashKey(), immutable) == null) {
            log.trace("Stored {} under {}", immutable.getClass().getSimpleName(), immutable.getHashKey());
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Immutable> retrieveImmutable(String hashKey) {
        Immutable immutable = immutables.get(hashKey);
        if (immutable == null) {
            return CompletableFuture.failedFuture(new ImmutableNotFoundException(hashKey));
        }
        return CompletableFuture.completedFuture(immutable);
    }

    public int size() {
        return immutables.size();
    }
}
