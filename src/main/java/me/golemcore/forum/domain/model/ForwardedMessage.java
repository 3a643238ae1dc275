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

import java.util.Map;
import java.util.Set;

/**
 * A message re-emitted by another sender. The content is a verbatim copy of
 * the original message's content, and the original is referenced by its hash
 * key. The original message itself has to be attached after construction (or
 * after retrieval from a store) by whoever resolves it.
 */
public class ForwardedMessage extends Message {

    public static final String MODEL = "forward";

    public static final String ORIGINAL_MSG_HASH_KEY = "original_msg_hash_key";

    private static final Set<String> FORWARD_FIELDS = Set.of(
            MODEL_FIELD, CONTENT, SENDER_ALIAS, PREV_MSG_HASH_KEY, ORIGINAL_MSG_HASH_KEY);

    private volatile Message originalMessage;

    public ForwardedMessage(ForumTrees forumTrees, String content, String senderAlias, String prevMsgHashKey,
            String originalMsgHashKey, Map<String, ?> metadata) {
        this(forumTrees, content, senderAlias, prevMsgHashKey, originalMsgHashKey, metadata, null);
    }

    public ForwardedMessage(ForumTrees forumTrees, String content, String senderAlias, String prevMsgHashKey,
            String originalMsgHashKey, Map<String, ?> metadata, Throwable error) {
        super(forumTrees, messageFields(MODEL, content, senderAlias, prevMsgHashKey,
                Map.of(ORIGINAL_MSG_HASH_KEY, requireHashKey(originalMsgHashKey)), metadata), error);
    }

    /**
     * Forwards the given message: copies its content and references it by hash.
     * The original is attached right away.
     */
    public static ForwardedMessage forward(ForumTrees forumTrees, Message original, String senderAlias,
            String prevMsgHashKey, Map<String, ?> metadata) {
        ForwardedMessage forwarded = new ForwardedMessage(forumTrees, original.getContent(),
                senderAlias, prevMsgHashKey, original.getHashKey(), metadata, original.getError());
        forwarded.attachOriginalMessage(original);
        return forwarded;
    }

    private static String requireHashKey(String originalMsgHashKey) {
        if (originalMsgHashKey == null) {
            throw new ForumValidationException("`original_msg_hash_key` is required in a forwarded message");
        }
        return originalMsgHashKey;
    }

    public String getOriginalMsgHashKey() {
        return (String) getField(ORIGINAL_MSG_HASH_KEY);
    }

    public void attachOriginalMessage(Message original) {
        this.originalMessage = original;
    }

    public boolean isOriginalMessageAttached() {
        return originalMessage != null;
    }

    /**
     * A forwarded message always has an original, so {@code returnSelfIfNone}
     * makes no difference here.
     *
     * @throws IllegalStateException
     *             if the original was never attached
     * @throws ForumValidationException
     *             if the attached original does not have the referenced hash key
     */
    @Override
    public Message getOriginalMessage(boolean returnSelfIfNone) {
        Message original = originalMessage;
        if (original == null) {
            throw new IllegalStateException("Original message of forward " + getHashKey() + " was not attached");
        }
        if (!original.getHashKey().equals(getOriginalMsgHashKey())) {
            throw new ForumValidationException("original_msg_hash_key does not match the hash key of the original "
                    + "message: " + getOriginalMsgHashKey() + " != " + original.getHashKey());
        }
        return original;
    }

    @Override
    protected Set<String> messageFieldNames() {
        return FORWARD_FIELDS;
    }
}
