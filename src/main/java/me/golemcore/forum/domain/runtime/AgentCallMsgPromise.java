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
import me.golemcore.forum.domain.model.AgentCallMsg;
import me.golemcore.forum.domain.model.Freeform;
import me.golemcore.forum.domain.model.Message;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Promise of the call marker of an agent call. It resolves once the request
 * sequence is closed: the marker follows the last request message (or the
 * branch point of the request conversation if there were no requests) and
 * remembers which message the request started with.
 */
public class AgentCallMsgPromise extends MessagePromise {

    @Getter
    private final String receiverAlias;
    @Getter
    private final Freeform functionKwargs;
    private final AsyncMessageSequence requestMessages;
    private final ConversationTracker requestConversation;

    AgentCallMsgPromise(Forum forum, AsyncMessageSequence requestMessages, ConversationTracker requestConversation,
            String receiverAlias, Freeform functionKwargs) {
        super(forum, requestConversation.getBranchPoint());
        this.requestMessages = requestMessages;
        this.requestConversation = requestConversation;
        this.receiverAlias = receiverAlias;
        this.functionKwargs = functionKwargs != null ? functionKwargs : Freeform.empty();
    }

    @Override
    protected CompletableFuture<Message> doMaterialize() {
        return requestMessages.materializeAll()
                .thenCompose(requests -> requestConversation.materializeTip()
                        .thenCompose(previous -> forumTrees().storeMessage(new AgentCallMsg(forumTrees(),
                                receiverAlias, hashKeyOf(previous), functionKwargs, firstHashKey(requests)))))
                .thenApply(Message.class::cast);
    }

    private static String firstHashKey(List<Message> requests) {
        return requests.isEmpty() ? null : requests.get(0).getHashKey();
    }
}
