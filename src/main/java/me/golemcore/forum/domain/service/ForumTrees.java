package me.golemcore.forum.domain.service;

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


import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.forum.domain.exception.ForumValidationException;
import me.golemcore.forum.domain.model.ForwardedMessage;
import me.golemcore.forum.domain.model.Immutable;
import me.golemcore.forum.domain.model.Message;
import me.golemcore.forum.port.outbound.ImmutableStoragePort;

import java.util.concurrent.CompletableFuture;

/**
 * Message trees of a forum on top of a content-addressable store. Messages
 * retrieved through this service always come back with the originals of
 * forwarded messages attached.
 */
@RequiredArgsConstructor
@Slf4j
public class ForumTrees {

    private final ImmutableStoragePort storagePort;

    public CompletableFuture<Void> storeImmutable(Immutable immutable) {
        return storagePort.storeImmutable(immutable);
    }

    /**
     * Store a message and return it once it is stored.
     */
    public <M extends Message> CompletableFuture<M> storeMessage(M message) {
        return storagePort.storeImmutable(message).thenApply(ignored -> {
            log.trace("[Trees] Stored {} {} from '{}'", message.getModel(), message.getHashKey(),
                    message.getSenderAlias());
            return message;
        });
    }

    public CompletableFuture<Message> retrieveMessage(String hashKey) {
        return storagePort.retrieveImmutable(hashKey).thenCompose(immutable -> {
            if (!(immutable instanceof Message message)) {
                throw new ForumValidationException("Expected a Message under " + hashKey + ", got "
                        + immutable.getClass().getSimpleName());
            }
            if (message instanceof ForwardedMessage forwarded && !forwarded.isOriginalMessageAttached()) {
                CompletableFuture<Message> attached = retrieveMessage(forwarded.getOriginalMsgHashKey())
                        .thenApply(original -> {
                            forwarded.attachOriginalMessage(original);
                            return forwarded;
                        });
                return attached;
            }
            return CompletableFuture.completedFuture(message);
        });
    }
}
