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
import me.golemcore.forum.domain.exception.AgentFailureException;
import me.golemcore.forum.domain.exception.ForumValidationException;
import me.golemcore.forum.domain.exception.NoAskingAgentException;
import me.golemcore.forum.domain.model.Freeform;
import me.golemcore.forum.infrastructure.config.ForumProperties;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * An agent function registered in a forum under an alias. Agents are called by
 * asking (the caller gets a sequence of responses) or by telling
 * (fire-and-forget). Either way the agent function starts running right away on
 * the forum's executor.
 *
 * <p>
 * Methods without an {@link InteractionContext} argument call the agent on
 * behalf of the forum's root context (the user).
 */
@Slf4j
public class Agent {

    private static final String ALIAS_PLACEHOLDER = "{AGENT_ALIAS}";

    @Getter
    private final Forum forum;
    @Getter
    private final String alias;
    @Getter
    private final String description;
    private final AgentFunction function;

    Agent(Forum forum, AgentFunction function, String alias, String description) {
        this.forum = forum;
        this.function = function;
        ForumProperties.AgentsProperties settings = forum.getProperties().getAgents();
        AgentInfo info = function != null ? function.getClass().getAnnotation(AgentInfo.class) : null;
        this.alias = resolveAlias(function, alias, info, settings.isUppercaseAliases());
        this.description = resolveDescription(description, info, settings.isNormalizeDescriptionSpaces(),
                this.alias);
    }

    private static String resolveAlias(AgentFunction function, String alias, AgentInfo info, boolean uppercase) {
        if (alias != null && !alias.isBlank()) {
            return alias;
        }
        if (info != null && !info.alias().isBlank()) {
            return info.alias();
        }
        if (function == null) {
            throw new ForumValidationException("An agent without a function needs an explicit alias");
        }
        Class<?> type = function.getClass();
        if (type.isHidden() || type.isSynthetic() || type.isAnonymousClass()) {
            throw new ForumValidationException(
                    "An alias is required for agents defined as lambdas or anonymous classes");
        }
        String name = type.getSimpleName();
        return uppercase ? name.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT) : name;
    }

    private static String resolveDescription(String description, AgentInfo info, boolean normalizeSpaces,
            String alias) {
        String result = description;
        if (result == null && info != null && !info.description().isBlank()) {
            result = info.description();
            if (normalizeSpaces) {
                result = String.join(" ", result.trim().split("\\s+"));
            }
        }
        return result != null ? result.replace(ALIAS_PLACEHOLDER, alias) : null;
    }

    public AsyncMessageSequence ask(MessageContent content) {
        return ask(forum.getRootContext(), content, AgentCallOptions.DEFAULTS);
    }

    public AsyncMessageSequence ask(MessageContent content, AgentCallOptions options) {
        return ask(forum.getRootContext(), content, options);
    }

    public AsyncMessageSequence ask(InteractionContext caller, MessageContent content) {
        return ask(caller, content, AgentCallOptions.DEFAULTS);
    }

    /**
     * Asks the agent and returns its responses right away. {@code content} may be
     * {@code null} to ask without any request messages.
     */
    public AsyncMessageSequence ask(InteractionContext caller, MessageContent content, AgentCallOptions options) {
        AgentCall call = startCall(caller, true, options);
        sendInitialRequest(call, content, options);
        return call.responseSequence();
    }

    public void tell(MessageContent content) {
        tell(forum.getRootContext(), content, AgentCallOptions.DEFAULTS);
    }

    public void tell(MessageContent content, AgentCallOptions options) {
        tell(forum.getRootContext(), content, options);
    }

    public void tell(InteractionContext caller, MessageContent content) {
        tell(caller, content, AgentCallOptions.DEFAULTS);
    }

    public void tell(InteractionContext caller, MessageContent content, AgentCallOptions options) {
        AgentCall call = startCall(caller, false, options);
        sendInitialRequest(call, content, options);
        call.finish();
    }

    public AgentCall startAsking() {
        return startCall(forum.getRootContext(), true, AgentCallOptions.DEFAULTS);
    }

    public AgentCall startAsking(AgentCallOptions options) {
        return startCall(forum.getRootContext(), true, options);
    }

    /**
     * Starts asking the agent. Requests are sent with
     * {@link AgentCall#sendRequest(MessageContent)} and the responses are obtained
     * with {@link AgentCall#responseSequence()}.
     */
    public AgentCall startAsking(InteractionContext caller, AgentCallOptions options) {
        return startCall(caller, true, options);
    }

    public AgentCall startTelling() {
        return startCall(forum.getRootContext(), false, AgentCallOptions.DEFAULTS);
    }

    public AgentCall startTelling(AgentCallOptions options) {
        return startCall(forum.getRootContext(), false, options);
    }

    public AgentCall startTelling(InteractionContext caller, AgentCallOptions options) {
        return startCall(caller, false, options);
    }

    private void sendInitialRequest(AgentCall call, MessageContent content, AgentCallOptions options) {
        if (content != null) {
            call.sendRequest(content, options.getOverrideSenderAlias(), null);
        }
    }

    private AgentCall startCall(InteractionContext caller, boolean asking, AgentCallOptions options) {
        if (caller.getForum() != forum) {
            throw new ForumValidationException("Agent " + alias + " cannot be called from another forum");
        }
        if (options.getBranchFrom() != null && options.getConversation() != null) {
            throw new ForumValidationException("Cannot specify both `conversation` and `branchFrom` in an agent call");
        }
        ConversationTracker conversation = options.getBranchFrom() != null
                ? new ConversationTracker(forum, options.getBranchFrom())
                : options.getConversation();
        if (conversation == null) {
            conversation = ConversationTracker.undetermined(forum);
        } else if (options.isForceNewConversation() && conversation.hasPriorHistory()) {
            throw new ForumValidationException(
                    "Cannot force a new conversation when there is prior history in the conversation");
        }

        AgentCall call = new AgentCall(forum, conversation, caller, this, asking,
                !options.isForceNewConversation(), Freeform.of(options.getFunctionKwargs()));
        caller.registerChildCall(call);
        call.start(forum.getExecutor());
        log.debug("[Agent] {} {} {}", caller.getThisAgent().getAlias(), asking ? "asked" : "told", alias);
        return call;
    }

    /**
     * Runs the agent function inside a fresh interaction context. A failure of
     * the function is responded as an error message; the returned future fails
     * with {@link AgentFailureException} only if nobody up the chain was asking.
     */
    CompletableFuture<Void> runAgentFunction(AgentCall call) {
        InteractionContext ctx = call.newInteractionContext();
        ctx.enter();
        Throwable undelivered = null;
        try {
            if (function != null) {
                function.call(ctx);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Agent] Agent function of {} was interrupted", alias);
            undelivered = respondWithFailure(ctx, e);
        } catch (Throwable e) { // NOSONAR - agent failures of any kind become error messages
            log.warn("[Agent] Agent function of {} failed: {}", alias, e.getMessage(), e);
            undelivered = respondWithFailure(ctx, e);
        }
        Throwable failure = undelivered;
        return ctx.exit().thenAccept(childFailures -> {
            call.closeResponses();
            if (failure != null) {
                throw new AgentFailureException(alias, failure);
            }
        });
    }

    private Throwable respondWithFailure(InteractionContext ctx, Throwable failure) {
        try {
            ctx.respond(MessageContent.of(failure));
            return null;
        } catch (NoAskingAgentException e) {
            log.debug("[Agent] Nobody is asking {}, the failure stays with its task", alias);
            return failure;
        } catch (RuntimeException e) { // NOSONAR - the failure is kept on the task instead
            log.warn("[Agent] Failure of {} could not be responded: {}", alias, e.getMessage());
            failure.addSuppressed(e);
            return failure;
        }
    }

    @Override
    public String toString() {
        return "Agent[" + alias + "]";
    }
}
