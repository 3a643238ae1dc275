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


import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.forum.domain.exception.ForumValidationException;
import me.golemcore.forum.domain.model.Message;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An ordered, multi-consumer stream of message promises. A single producer
 * sends contents and eventually closes the sequence; every consumer sees the
 * full backlog followed by the live tail, in send order.
 *
 * <p>
 * Every send is appended to the underlying conversation only after the
 * previous send is fully appended, so a spliced sub-sequence occupies exactly
 * the position of the send call.
 */
@Slf4j
public class AsyncMessageSequence {

    @Getter
    private final ConversationTracker conversation;
    @Getter
    private final String defaultSenderAlias;
    private final boolean doNotForwardIfPossible;
    private final Sinks.Many<MessagePromise> promises = Sinks.many().replay().all();

    private final Object lock = new Object();
    private CompletableFuture<Void> pendingSends = CompletableFuture.completedFuture(null);
    private boolean producerOpened;
    private boolean closed;

    public AsyncMessageSequence(ConversationTracker conversation, String defaultSenderAlias) {
        this(conversation, defaultSenderAlias, true);
    }

    public AsyncMessageSequence(ConversationTracker conversation, String defaultSenderAlias,
            boolean doNotForwardIfPossible) {
        this.conversation = conversation;
        this.defaultSenderAlias = defaultSenderAlias;
        this.doNotForwardIfPossible = doNotForwardIfPossible;
    }

    /**
     * The only way to send messages into this sequence. Can be called once.
     */
    public MessageProducer openProducer() {
        synchronized (lock) {
            if (producerOpened) {
                throw new ForumValidationException("A producer was already opened for this message sequence");
            }
            producerOpened = true;
        }
        return new MessageProducer();
    }

    public Flux<MessagePromise> asFlux() {
        return promises.asFlux();
    }

    /**
     * All the messages of this sequence, once it is closed.
     */
    public CompletableFuture<List<Message>> materializeAll() {
        return asFlux()
                .concatMap(promise -> Mono.fromFuture(promise.materialize(), true))
                .collectList()
                .toFuture();
    }

    /**
     * The last promise of this sequence, once it is closed. Completes with
     * {@code null} for an empty sequence unless {@code raiseIfNone} is set.
     */
    public CompletableFuture<MessagePromise> getConcludingMessagePromise(boolean raiseIfNone) {
        Mono<MessagePromise> concluding = asFlux().takeLast(1).singleOrEmpty();
        if (raiseIfNone) {
            concluding = concluding.switchIfEmpty(Mono.error(
                    () -> new ForumValidationException("The message sequence is empty")));
        }
        return concluding.toFuture();
    }

    public CompletableFuture<Message> materializeConcludingMessage() {
        return getConcludingMessagePromise(true).thenCompose(MessagePromise::materialize);
    }

    private CompletableFuture<Void> appendToSequence(MessageContent content, String overrideSenderAlias,
            Map<String, ?> metadata) {
        return conversation
                .append(content, defaultSenderAlias, overrideSenderAlias, doNotForwardIfPossible, metadata)
                .doOnNext(this::emit)
                .onErrorResume(error -> {
                    log.warn("[Sequence] Failed to append to sequence of '{}', appending the error instead",
                            defaultSenderAlias, error);
                    return conversation
                            .append(MessageContent.of(error), defaultSenderAlias, overrideSenderAlias,
                                    doNotForwardIfPossible, Map.of())
                            .doOnNext(this::emit);
                })
                .then()
                .toFuture();
    }

    private void emit(MessagePromise promise) {
        Sinks.EmitResult result = promises.tryEmitNext(promise);
        if (result.isFailure()) {
            throw new IllegalStateException("Failed to emit a message promise: " + result);
        }
    }

    private void complete() {
        Sinks.EmitResult result = promises.tryEmitComplete();
        if (result.isFailure()) {
            log.warn("[Sequence] Failed to complete sequence of '{}': {}", defaultSenderAlias, result);
        }
    }

    /**
     * Sends contents into the sequence and closes it.
     */
    public final class MessageProducer implements AutoCloseable {

        private MessageProducer() {
        }

        public MessageProducer send(String text) {
            return send(MessageContent.of(text), null, Map.of());
        }

        public MessageProducer send(MessageContent content) {
            return send(content, null, Map.of());
        }

        public MessageProducer send(MessageContent content, Map<String, ?> metadata) {
            return send(content, null, metadata);
        }

        /**
         * Appends the content after everything sent before it. Returns
         * immediately: the content is appended in the background.
         *
         * @throws ForumValidationException
         *             if the sequence is already closed
         */
        public MessageProducer send(MessageContent content, String overrideSenderAlias, Map<String, ?> metadata) {
            synchronized (lock) {
                if (closed) {
                    throw new ForumValidationException("Cannot send to a closed message sequence");
                }
                pendingSends = pendingSends
                        .thenCompose(ignored -> appendToSequence(content, overrideSenderAlias, metadata))
                        .exceptionally(error -> {
                            log.error("[Sequence] Message of '{}' was lost", defaultSenderAlias, error);
                            return null;
                        });
            }
            return this;
        }

        public boolean isClosed() {
            synchronized (lock) {
                return closed;
            }
        }

        /**
         * Closes the sequence once everything sent so far is appended. Closing
         * twice is a no-op.
         */
        @Override
        public void close() {
            synchronized (lock) {
                if (closed) {
                    return;
                }
                closed = true;
                pendingSends = pendingSends.whenComplete((ignored, error) -> complete());
            }
        }
    }
}
