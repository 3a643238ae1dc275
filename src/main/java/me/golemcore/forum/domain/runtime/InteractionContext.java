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
import me.golemcore.forum.domain.exception.NoAskingAgentException;
import me.golemcore.forum.domain.model.Freeform;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runtime record of one agent invocation: which agent runs, the requests it
 * serves, where its responses go and which context called it. The context is
 * passed explicitly to the agent function and has to be passed on to every
 * agent it calls.
 *
 * <p>
 * The root context of a forum represents the user and has no parent.
 */
@Slf4j
public class InteractionContext {

    @Getter
    private final Forum forum;
    @Getter
    private final Agent thisAgent;
    @Getter
    private final AsyncMessageSequence requestMessages;
    @Getter
    private final InteractionContext parentContext;
    @Getter
    private final Freeform functionKwargs;

    private final AsyncMessageSequence.MessageProducer responseProducer;
    private final List<AgentCall> childCalls = new CopyOnWriteArrayList<>();
    private final AtomicBoolean entered = new AtomicBoolean();

    InteractionContext(Forum forum, Agent thisAgent, AsyncMessageSequence requestMessages,
            AsyncMessageSequence.MessageProducer responseProducer, InteractionContext parentContext,
            Freeform functionKwargs) {
        this.forum = forum;
        this.thisAgent = thisAgent;
        this.requestMessages = requestMessages;
        this.responseProducer = responseProducer;
        this.parentContext = parentContext;
        this.functionKwargs = functionKwargs != null ? functionKwargs : Freeform.empty();
    }

    static InteractionContext root(Forum forum, Agent userAgent) {
        return new InteractionContext(forum, userAgent, null, null, null, Freeform.empty());
    }

    public boolean isRoot() {
        return parentContext == null;
    }

    /**
     * Whether the caller expects responses from this invocation.
     */
    public boolean wasAsked() {
        return responseProducer != null;
    }

    public Object getFunctionKwarg(String name) {
        return functionKwargs.get(name);
    }

    public void respond(String text) {
        respond(MessageContent.of(text), Map.of());
    }

    public void respond(AsyncMessageSequence sequence) {
        respond(MessageContent.of(sequence), Map.of());
    }

    public void respond(Throwable error) {
        respond(MessageContent.of(error), Map.of());
    }

    public void respond(MessageContent content) {
        respond(content, Map.of());
    }

    /**
     * Sends the content to the responses of this invocation, or of the closest
     * asked invocation up the chain if this one was told.
     *
     * @throws NoAskingAgentException
     *             if no invocation up the chain was asked
     */
    public void respond(MessageContent content, Map<String, ?> metadata) {
        InteractionContext asked = getAskedContext();
        asked.responseProducer.send(content, metadata);
    }

    public InteractionContext getAskedContext() {
        InteractionContext ctx = this;
        while (ctx != null) {
            if (ctx.wasAsked()) {
                return ctx;
            }
            ctx = ctx.parentContext;
        }
        throw new NoAskingAgentException("There is no agent up the chain of parent contexts that is currently asking");
    }

    public List<AgentCall> getChildCalls() {
        return List.copyOf(childCalls);
    }

    void registerChildCall(AgentCall call) {
        if (isRoot()) {
            childCalls.removeIf(child -> child.completion().isDone());
        }
        childCalls.add(call);
    }

    void enter() {
        if (!entered.compareAndSet(false, true)) {
            throw new ForumValidationException("InteractionContext is not reentrant");
        }
    }

    /**
     * Finishes every child call that was not finished explicitly and waits for
     * all of them to complete. Child failures are collected, never propagated.
     */
    CompletableFuture<List<Throwable>> exit() {
        List<AgentCall> children = List.copyOf(childCalls);
        children.forEach(AgentCall::finish);
        List<CompletableFuture<Throwable>> outcomes = new ArrayList<>(children.size());
        for (AgentCall child : children) {
            outcomes.add(child.completion().handle((ignored, error) -> unwrap(error)));
        }
        return CompletableFuture.allOf(outcomes.toArray(new CompletableFuture<?>[0])).thenApply(ignored -> {
            List<Throwable> failures = outcomes.stream()
                    .map(CompletableFuture::join)
                    .filter(Objects::nonNull)
                    .toList();
            if (!failures.isEmpty()) {
                log.debug("[Agent] {} of the calls made by {} failed", failures.size(), thisAgent.getAlias());
            }
            entered.set(false);
            return failures;
        });
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
