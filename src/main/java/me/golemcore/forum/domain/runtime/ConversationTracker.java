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
import me.golemcore.forum.domain.model.Message;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tracks the tip of a conversation branch. Every appended message attaches
 * after the current tip and becomes the new tip.
 *
 * <p>
 * The tip may also be a message sequence that is still being produced; it is
 * replaced by the concluding message of that sequence (or the root, if the
 * sequence turns out empty) before anything else is appended.
 *
 * <p>
 * Not thread-safe: a tracker must be driven by one writer at a time.
 */
public class ConversationTracker {

    @Getter
    private final Forum forum;
    private volatile BranchPoint tip;
    private volatile AsyncMessageSequence pendingSequence;

    public ConversationTracker(Forum forum) {
        this(forum, BranchPoint.ROOT);
    }

    public ConversationTracker(Forum forum, BranchPoint branchFrom) {
        this.forum = forum;
        this.tip = branchFrom != null ? branchFrom : BranchPoint.ROOT;
    }

    public ConversationTracker(Forum forum, MessagePromise branchFrom) {
        this(forum, BranchPoint.of(branchFrom));
    }

    public ConversationTracker(Forum forum, AsyncMessageSequence branchFrom) {
        this(forum, BranchPoint.ROOT);
        this.pendingSequence = branchFrom;
    }

    /**
     * A conversation whose root is decided by whatever is appended first.
     */
    public static ConversationTracker undetermined(Forum forum) {
        return new ConversationTracker(forum, BranchPoint.UNDETERMINED);
    }

    /**
     * A new tracker that starts at the current tip of this one.
     */
    public ConversationTracker branch() {
        ConversationTracker branch = new ConversationTracker(forum, tip);
        branch.pendingSequence = pendingSequence;
        return branch;
    }

    public boolean hasPriorHistory() {
        return pendingSequence != null || tip.promise() != null;
    }

    public BranchPoint getBranchPoint() {
        return tip;
    }

    public void advanceTo(MessagePromise promise) {
        pendingSequence = null;
        tip = BranchPoint.of(promise);
    }

    /**
     * The message at the tip, or {@code null} if nothing was appended yet.
     */
    public CompletableFuture<Message> materializeTip() {
        return settlePendingSequence().thenCompose(ignored -> tip.materialize());
    }

    public Flux<MessagePromise> append(MessageContent content, String defaultSenderAlias) {
        return append(content, defaultSenderAlias, null, true, Map.of());
    }

    /**
     * Appends zero or more messages. Nothing happens until the returned flux is
     * subscribed to; each promise becomes the tip right before it is emitted.
     */
    public Flux<MessagePromise> append(MessageContent content, String defaultSenderAlias, String overrideSenderAlias,
            boolean doNotForwardIfPossible, Map<String, ?> overrideMetadata) {
        return Mono.fromFuture(this::settlePendingSequence)
                .thenMany(Flux.defer(() -> content.accept(new Appender(defaultSenderAlias, overrideSenderAlias,
                        doNotForwardIfPossible, overrideMetadata))));
    }

    private CompletableFuture<Void> settlePendingSequence() {
        AsyncMessageSequence sequence = pendingSequence;
        if (sequence == null) {
            return CompletableFuture.completedFuture(null);
        }
        return sequence.getConcludingMessagePromise(false).thenAccept(concluding -> {
            if (pendingSequence == sequence) {
                pendingSequence = null;
                tip = BranchPoint.of(concluding);
            }
        });
    }

    private final class Appender implements MessageContent.Visitor<Flux<MessagePromise>> {

        private final String defaultSenderAlias;
        private final String overrideSenderAlias;
        private final boolean doNotForwardIfPossible;
        private final Map<String, ?> overrideMetadata;

        private Appender(String defaultSenderAlias, String overrideSenderAlias, boolean doNotForwardIfPossible,
                Map<String, ?> overrideMetadata) {
            this.defaultSenderAlias = defaultSenderAlias;
            this.overrideSenderAlias = overrideSenderAlias;
            this.doNotForwardIfPossible = doNotForwardIfPossible;
            this.overrideMetadata = overrideMetadata;
        }

        private Flux<MessagePromise> single(MessageContent content) {
            MessagePromise promise = MessagePromise.builder()
                    .forum(forum)
                    .content(content)
                    .defaultSenderAlias(defaultSenderAlias)
                    .overrideSenderAlias(overrideSenderAlias)
                    .branchFrom(tip)
                    .doNotForwardIfPossible(doNotForwardIfPossible)
                    .overrideMetadata(overrideMetadata)
                    .build();
            advanceTo(promise);
            return Flux.just(promise);
        }

        @Override
        public Flux<MessagePromise> visitText(MessageContent.Text text) {
            return single(text);
        }

        @Override
        public Flux<MessagePromise> visitError(MessageContent.ErrorContent error) {
            return single(error);
        }

        @Override
        public Flux<MessagePromise> visitExistingMessage(MessageContent.ExistingMessage existing) {
            return single(existing);
        }

        @Override
        public Flux<MessagePromise> visitExistingPromise(MessageContent.ExistingPromise existing) {
            return single(existing);
        }

        @Override
        public Flux<MessagePromise> visitFieldOverride(MessageContent.FieldOverride fieldOverride) {
            return single(fieldOverride);
        }

        @Override
        public Flux<MessagePromise> visitSequence(MessageContent.Sequence sequence) {
            return Flux.from(sequence.contents())
                    .concatMap(item -> append(item, defaultSenderAlias, overrideSenderAlias,
                            doNotForwardIfPossible, overrideMetadata));
        }
    }
}
