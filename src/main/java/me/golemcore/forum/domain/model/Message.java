package me.golemcore.forum.domain.model;

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

import me.golemcore.forum.domain.exception.ForumValidationException;
import me.golemcore.forum.domain.service.ForumTrees;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * A message in the forum. Messages assemble into a tree: every message points
 * to at most one predecessor via {@code prev_msg_hash_key}, and a branch
 * appears whenever two messages point to the same predecessor.
 *
 * <p>
 * Every field that is not defined by the message type itself is metadata. The
 * {@link ForumTrees} the message belongs to and the original exception of an
 * error message are not fields and do not affect the hash key.
 */
public class Message extends Freeform {

    public static final String MODEL = "message";

    public static final String CONTENT = "content";
    public static final String SENDER_ALIAS = "sender_alias";
    public static final String PREV_MSG_HASH_KEY = "prev_msg_hash_key";
    public static final String IS_ERROR = "is_error";

    private static final Set<String> MESSAGE_FIELDS = Set.of(MODEL_FIELD, CONTENT, SENDER_ALIAS, PREV_MSG_HASH_KEY);

    private final ForumTrees forumTrees;
    private final Throwable error;

    public Message(ForumTrees forumTrees, String content, String senderAlias, String prevMsgHashKey,
            Map<String, ?> metadata) {
        this(forumTrees, messageFields(MODEL, content, senderAlias, prevMsgHashKey, Map.of(), metadata), null);
    }

    public Message(ForumTrees forumTrees, String content, String senderAlias, String prevMsgHashKey,
            Map<String, ?> metadata, Throwable error) {
        this(forumTrees, messageFields(MODEL, content, senderAlias, prevMsgHashKey, Map.of(), metadata), error);
    }

    protected Message(ForumTrees forumTrees, Map<String, Object> fields, Throwable error) {
        super(fields);
        this.forumTrees = forumTrees;
        this.error = error;
    }

    /**
     * Builds the field map of a message: the model discriminator, the common
     * message fields, the fields specific to a message subtype and the metadata.
     * Metadata must not redefine any of the other fields.
     */
    protected static Map<String, Object> messageFields(String model, String content, String senderAlias,
            String prevMsgHashKey, Map<String, Object> typeFields, Map<String, ?> metadata) {
        if (content == null) {
            throw new ForumValidationException("`content` is required in a message");
        }
        if (senderAlias == null) {
            throw new ForumValidationException("`sender_alias` is required in a message");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(MODEL_FIELD, model);
        fields.put(CONTENT, content);
        fields.put(SENDER_ALIAS, senderAlias);
        fields.put(PREV_MSG_HASH_KEY, prevMsgHashKey);
        fields.putAll(typeFields);
        if (metadata != null) {
            for (Map.Entry<String, ?> entry : metadata.entrySet()) {
                if (fields.containsKey(entry.getKey())) {
                    throw new ForumValidationException(
                            "metadata cannot override the `" + entry.getKey() + "` field of a message");
                }
                fields.put(entry.getKey(), entry.getValue());
            }
        }
        return fields;
    }

    public String getModel() {
        return (String) getField(MODEL_FIELD);
    }

    public String getContent() {
        return (String) getField(CONTENT);
    }

    public String getSenderAlias() {
        return (String) getField(SENDER_ALIAS);
    }

    public String getPrevMsgHashKey() {
        return (String) getField(PREV_MSG_HASH_KEY);
    }

    public ForumTrees getForumTrees() {
        return forumTrees;
    }

    /**
     * The exception this error message was created from, if it is still around
     * (it is never stored, so messages retrieved from a persistent store lose
     * it).
     */
    public Throwable getError() {
        return error;
    }

    public boolean isError() {
        return Boolean.TRUE.equals(getField(IS_ERROR));
    }

    /**
     * All the custom fields of this message (those not defined by the message
     * type).
     */
    public Freeform getMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        getFields().forEach((key, value) -> {
            if (!messageFieldNames().contains(key)) {
                metadata.put(key, value);
            }
        });
        return Freeform.of(metadata);
    }

    protected Set<String> messageFieldNames() {
        return MESSAGE_FIELDS;
    }

    /**
     * Get the original message this message is a forward of. A plain message is
     * its own original.
     */
    public Message getOriginalMessage(boolean returnSelfIfNone) {
        return returnSelfIfNone ? this : null;
    }

    /**
     * Get the previous message in the forum, or {@code null} if this message is
     * the root of its branch. When {@code skipAgentCalls} is set, agent call
     * markers are substituted by their own predecessors.
     */
    public CompletableFuture<Message> getPreviousMessage(boolean skipAgentCalls) {
        if (getPrevMsgHashKey() == null) {
            return CompletableFuture.completedFuture(null);
        }
        if (forumTrees == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Message " + getHashKey() + " is not attached to any forum trees"));
        }
        CompletableFuture<Message> previous = forumTrees.retrieveMessage(getPrevMsgHashKey());
        if (!skipAgentCalls) {
            return previous;
        }
        return previous.thenCompose(message -> message instanceof AgentCallMsg
                ? message.getPreviousMessage(true)
                : CompletableFuture.completedFuture(message));
    }

    /**
     * The whole branch that ends with this message, oldest message first.
     */
    public CompletableFuture<List<Message>> getFullChat(boolean skipAgentCalls) {
        Deque<Message> history = new ArrayDeque<>();
        if (!(skipAgentCalls && this instanceof AgentCallMsg)) {
            history.addFirst(this);
        }
        return collectHistory(this, skipAgentCalls, history);
    }

    private static CompletableFuture<List<Message>> collectHistory(Message message, boolean skipAgentCalls,
            Deque<Message> history) {
        return message.getPreviousMessage(skipAgentCalls).thenCompose(previous -> {
            if (previous == null) {
                return CompletableFuture.completedFuture(List.copyOf(history));
            }
            history.addFirst(previous);
            return collectHistory(previous, skipAgentCalls, history);
        });
    }
}
