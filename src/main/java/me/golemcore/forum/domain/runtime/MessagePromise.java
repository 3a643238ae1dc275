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


import lombok.Builder;
import lombok.Getter;
import me.golemcore.forum.domain.exception.ForumValidationException;
import me.golemcore.forum.domain.model.ForwardedMessage;
import me.golemcore.forum.domain.model.Message;
import me.golemcore.forum.domain.service.ForumTrees;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * A message that may not be known yet. The promise resolves at most once: the
 * first {@link #materialize()} call builds and stores the message, every
 * later call gets the same future.
 *
 * <p>
 * Existing messages (and promises of them) are reused as they are when that
 * does not break the branch they are appended to, otherwise they are forwarded
 * on behalf of the sender of this promise.
 */
public class MessagePromise {

    @Getter
    private final Forum forum;
    @Getter
    private final MessageContent content;
    @Getter
    private final String defaultSenderAlias;
    @Getter
    private final String overrideSenderAlias;
    @Getter
    private final BranchPoint branchFrom;
    @Getter
    private final boolean doNotForwardIfPossible;
    @Getter
    private final Map<String, Object> overrideMetadata;

    private final Object lock = new Object();
    private CompletableFuture<Message> materialized;

    @Builder
    MessagePromise(Forum forum, MessageContent content, String defaultSenderAlias, String overrideSenderAlias,
            BranchPoint branchFrom, boolean doNotForwardIfPossible, Map<String, ?> overrideMetadata) {
        if (content instanceof MessageContent.Sequence) {
            throw new ForumValidationException("A message promise cannot be built from a sequence of contents");
        }
        this.forum = Objects.requireNonNull(forum, "forum");
        this.content = Objects.requireNonNull(content, "content");
        this.defaultSenderAlias = defaultSenderAlias;
        this.overrideSenderAlias = overrideSenderAlias;
        this.branchFrom = branchFrom != null ? branchFrom : BranchPoint.ROOT;
        this.doNotForwardIfPossible = doNotForwardIfPossible;
        this.overrideMetadata = overrideMetadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(overrideMetadata))
                : Map.of();
    }

    /**
     * For promises that build their message in {@link #doMaterialize()}
     * themselves.
     */
    protected MessagePromise(Forum forum, BranchPoint branchFrom) {
        this.forum = Objects.requireNonNull(forum, "forum");
        this.content = null;
        this.defaultSenderAlias = null;
        this.overrideSenderAlias = null;
        this.branchFrom = branchFrom;
        this.doNotForwardIfPossible = false;
        this.overrideMetadata = Map.of();
    }

    public CompletableFuture<Message> materialize() {
        CompletableFuture<Message> result;
        boolean first = false;
        synchronized (lock) {
            if (materialized == null) {
                materialized = new CompletableFuture<>();
                first = true;
            }
            result = materialized;
        }
        if (first) {
            CompletableFuture<Message> future;
            try {
                future = doMaterialize();
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            future.whenComplete((message, error) -> {
                if (error != null) {
                    result.completeExceptionally(unwrap(error));
                } else {
                    result.complete(message);
                }
            });
        }
        return result;
    }

    public CompletableFuture<Message> materializePreviousMessage(boolean skipAgentCalls) {
        return materialize().thenCompose(message -> message.getPreviousMessage(skipAgentCalls));
    }

    /**
     * The whole branch ending with this message, oldest message first.
     */
    public CompletableFuture<List<Message>> materializeHistory(boolean skipAgentCalls) {
        return materialize().thenCompose(message -> message.getFullChat(skipAgentCalls));
    }

    public boolean isError() {
        if (Boolean.TRUE.equals(overrideMetadata.get(Message.IS_ERROR))) {
            return true;
        }
        if (content == null) {
            return false;
        }
        return content.accept(new MessageContent.Visitor<Boolean>() {
            @Override
            public Boolean visitText(MessageContent.Text text) {
                return false;
            }

            @Override
            public Boolean visitError(MessageContent.ErrorContent error) {
                return true;
            }

            @Override
            public Boolean visitExistingMessage(MessageContent.ExistingMessage existing) {
                return existing.message().isError();
            }

            @Override
            public Boolean visitExistingPromise(MessageContent.ExistingPromise existing) {
                return existing.promise().isError();
            }

            @Override
            public Boolean visitFieldOverride(MessageContent.FieldOverride fieldOverride) {
                return Boolean.TRUE.equals(fieldOverride.fields().get(Message.IS_ERROR));
            }

            @Override
            public Boolean visitSequence(MessageContent.Sequence sequence) {
                return false;
            }
        });
    }

    /**
     * The exception behind this message if it is an error message that still
     * carries one.
     */
    public Throwable getErrorCause() {
        if (content instanceof MessageContent.ErrorContent error) {
            return error.error();
        }
        if (content instanceof MessageContent.ExistingMessage existing) {
            return existing.message().getError();
        }
        if (content instanceof MessageContent.ExistingPromise existing) {
            return existing.promise().getErrorCause();
        }
        return null;
    }

    protected CompletableFuture<Message> doMaterialize() {
        return branchFrom.materialize().thenCompose(previous -> content.accept(new Materializer(previous)));
    }

    protected ForumTrees forumTrees() {
        return forum.getForumTrees();
    }

    protected static String hashKeyOf(Message message) {
        return message != null ? message.getHashKey() : null;
    }

    private String senderAlias() {
        return overrideSenderAlias != null ? overrideSenderAlias : defaultSenderAlias;
    }

    private CompletableFuture<Message> store(Message message) {
        return forumTrees().storeMessage(message);
    }

    private CompletableFuture<Message> forwardIfNeeded(Message original, Message previous) {
        boolean noOverrides = overrideSenderAlias == null && overrideMetadata.isEmpty();
        boolean continuesBranch = branchFrom.undetermined()
                || Objects.equals(original.getPrevMsgHashKey(), hashKeyOf(previous));
        if (doNotForwardIfPossible && noOverrides && continuesBranch) {
            return CompletableFuture.completedFuture(original);
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (original.isError()) {
            metadata.put(Message.IS_ERROR, true);
        }
        metadata.putAll(overrideMetadata);
        return store(ForwardedMessage.forward(forumTrees(), original, senderAlias(), hashKeyOf(previous), metadata));
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private final class Materializer implements MessageContent.Visitor<CompletableFuture<Message>> {

        private final Message previous;

        private Materializer(Message previous) {
            this.previous = previous;
        }

        @Override
        public CompletableFuture<Message> visitText(MessageContent.Text text) {
            return store(new Message(forumTrees(), text.text(), senderAlias(), hashKeyOf(previous),
                    overrideMetadata));
        }

        @Override
        public CompletableFuture<Message> visitError(MessageContent.ErrorContent error) {
            return forum.getErrorFormatter().format(error.error(), previous).thenCompose(formatted -> {
                Map<String, Object> metadata = new LinkedHashMap<>(formatted.metadata());
                metadata.putAll(overrideMetadata);
                metadata.put(Message.IS_ERROR, true);
                return store(new Message(forumTrees(), formatted.text(), senderAlias(), hashKeyOf(previous),
                        metadata, error.error()));
            });
        }

        @Override
        public CompletableFuture<Message> visitExistingMessage(MessageContent.ExistingMessage existing) {
            return forwardIfNeeded(existing.message(), previous);
        }

        @Override
        public CompletableFuture<Message> visitExistingPromise(MessageContent.ExistingPromise existing) {
            return existing.promise().materialize().thenCompose(original -> forwardIfNeeded(original, previous));
        }

        @Override
        public CompletableFuture<Message> visitFieldOverride(MessageContent.FieldOverride fieldOverride) {
            Map<String, Object> metadata = new LinkedHashMap<>(fieldOverride.fields());
            if (!(metadata.remove(Message.CONTENT) instanceof String text)) {
                throw new ForumValidationException("`content` of type String is required to build a message");
            }
            Object sender = metadata.remove(Message.SENDER_ALIAS);
            if (sender != null && !(sender instanceof String)) {
                throw new ForumValidationException("`sender_alias` must be a String, got "
                        + sender.getClass().getSimpleName());
            }
            metadata.putAll(overrideMetadata);
            String senderAlias = overrideSenderAlias != null
                    ? overrideSenderAlias
                    : sender != null ? (String) sender : defaultSenderAlias;
            return store(new Message(forumTrees(), text, senderAlias, hashKeyOf(previous), metadata));
        }

        @Override
        public CompletableFuture<Message> visitSequence(MessageContent.Sequence sequence) {
            throw new ForumValidationException("A message promise cannot be built from a sequence of contents");
        }
    }
}
