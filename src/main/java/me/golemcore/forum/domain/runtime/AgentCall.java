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
import me.golemcore.forum.domain.exception.NoAskingAgentException;
import me.golemcore.forum.domain.model.Freeform;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * A single invocation of an agent.
 *
 * <p>
 * Requests are collected on a temporary branch off the caller's conversation.
 * The caller's own conversation gets the call marker and, when asking, the
 * responses, so the responses continue the caller's branch.
 */
@Slf4j
public class AgentCall {

    @Getter
    private final Forum forum;
    @Getter
    private final Agent receivingAgent;
    @Getter
    private final boolean asking;
    @Getter
    private final AgentCallMsgPromise callMsgPromise;
    @Getter
    private final AsyncMessageSequence requestMessages;

    private final InteractionContext callerContext;
    private final Freeform functionKwargs;
    private final AsyncMessageSequence.MessageProducer requestProducer;
    private final AsyncMessageSequence responseMessages;
    private final AsyncMessageSequence.MessageProducer responseProducer;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    AgentCall(Forum forum, ConversationTracker conversation, InteractionContext callerContext, Agent receivingAgent,
            boolean asking, boolean doNotForwardIfPossible, Freeform functionKwargs) {
        this.forum = forum;
        this.receivingAgent = receivingAgent;
        this.asking = asking;
        this.callerContext = callerContext;
        this.functionKwargs = functionKwargs;

        ConversationTracker requestConversation = conversation.branch();
        this.requestMessages = new AsyncMessageSequence(requestConversation,
                callerContext.getThisAgent().getAlias(), doNotForwardIfPossible);
        this.requestProducer = requestMessages.openProducer();

        this.callMsgPromise = new AgentCallMsgPromise(forum, requestMessages, requestConversation,
                receivingAgent.getAlias(), functionKwargs);
        conversation.advanceTo(callMsgPromise);

        if (asking) {
            this.responseMessages = new AsyncMessageSequence(conversation, receivingAgent.getAlias());
            this.responseProducer = responseMessages.openProducer();
        } else {
            this.responseMessages = null;
            this.responseProducer = null;
        }
    }

    public AgentCall sendRequest(MessageContent content) {
        return sendRequest(content, null, Map.of());
    }

    public AgentCall sendRequest(MessageContent content, Map<String, ?> metadata) {
        return sendRequest(content, null, metadata);
    }

    public AgentCall sendRequest(MessageContent content, String overrideSenderAlias, Map<String, ?> metadata) {
        requestProducer.send(content, overrideSenderAlias, metadata);
        return this;
    }

    /**
     * Finishes the call and returns the responses of the agent. No requests can
     * be sent afterwards.
     *
     * @throws NoAskingAgentException
     *             if the agent was told rather than asked
     */
    public AsyncMessageSequence responseSequence() {
        if (!asking) {
            throw new NoAskingAgentException("Cannot get the response sequence of an agent call that is not asking, "
                    + "use ask()/startAsking() instead of tell()/startTelling()");
        }
        finish();
        return responseMessages;
    }

    /**
     * Finishes sending requests. This does not wait for the agent function.
     */
    public AgentCall finish() {
        requestProducer.close();
        return this;
    }

    public boolean isFinished() {
        return requestProducer.isClosed();
    }

    /**
     * Completes when the agent function and every call it made are done. Fails
     * with {@link me.golemcore.forum.domain.exception.AgentFailureException} if
     * the agent function failed and the failure could not be responded.
     */
    public CompletableFuture<Void> completion() {
        return completion;
    }

    void start(ExecutorService executor) {
        CompletableFuture<CompletableFuture<Void>> scheduled;
        try {
            scheduled = CompletableFuture.supplyAsync(() -> receivingAgent.runAgentFunction(this), executor);
        } catch (RejectedExecutionException e) {
            log.error("[Agent] Could not schedule {}", receivingAgent.getAlias(), e);
            closeResponses();
            completion.completeExceptionally(e);
            return;
        }
        scheduled.thenCompose(Function.identity()).whenComplete((ignored, error) -> {
            if (error != null) {
                closeResponses();
                completion.completeExceptionally(
                        error instanceof CompletionException && error.getCause() != null ? error.getCause() : error);
            } else {
                completion.complete(null);
            }
        });
    }

    InteractionContext newInteractionContext() {
        return new InteractionContext(forum, receivingAgent, requestMessages, responseProducer, callerContext,
                functionKwargs);
    }

    void closeResponses() {
        if (responseProducer != null) {
            responseProducer.close();
        }
    }

    @Override
    public String toString() {
        return "AgentCall[" + callerContext.getThisAgent().getAlias() + (asking ? " asks " : " tells ")
                + receivingAgent.getAlias() + "]";
    }
}
