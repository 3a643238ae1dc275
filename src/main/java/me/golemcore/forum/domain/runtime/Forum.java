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
import me.golemcore.forum.domain.model.Immutable;
import me.golemcore.forum.domain.model.Message;
import me.golemcore.forum.domain.service.ForumTrees;
import me.golemcore.forum.infrastructure.config.ForumProperties;
import me.golemcore.forum.port.outbound.ErrorFormatterPort;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * A forum for agents to communicate. Owns the message trees, the registry of
 * agents and conversations and the root interaction context that represents
 * the external initiator (the user).
 */
@Slf4j
public class Forum {

    @Getter
    private final ForumTrees forumTrees;
    @Getter
    private final ErrorFormatterPort errorFormatter;
    @Getter
    private final ExecutorService executor;
    @Getter
    private final ForumProperties properties;

    private final Map<String, ConversationTracker> conversations = new ConcurrentHashMap<>();
    private final Map<String, Agent> agents = new ConcurrentHashMap<>();

    @Getter
    private final Agent userAgent;
    @Getter
    private final InteractionContext rootContext;

    public Forum(ForumTrees forumTrees, ErrorFormatterPort errorFormatter, ExecutorService executor,
            ForumProperties properties) {
        this.forumTrees = forumTrees;
        this.errorFormatter = errorFormatter;
        this.executor = executor;
        this.properties = properties;
        this.userAgent = new Agent(this, null, properties.getUserAlias(), null);
        this.rootContext = InteractionContext.root(this, userAgent);
    }

    /**
     * Registers an agent function under the alias derived from its class (see
     * {@link AgentInfo}).
     */
    public Agent agent(AgentFunction function) {
        return agent(null, null, function);
    }

    public Agent agent(String alias, AgentFunction function) {
        return agent(alias, null, function);
    }

    public Agent agent(String alias, String description, AgentFunction function) {
        Agent agent = new Agent(this, function, alias, description);
        Agent previous = agents.put(agent.getAlias(), agent);
        if (previous != null) {
            log.info("[Forum] Agent {} was re-registered", agent.getAlias());
        } else {
            log.debug("[Forum] Registered agent {}", agent.getAlias());
        }
        return agent;
    }

    public Optional<Agent> getAgent(String alias) {
        return Optional.ofNullable(agents.get(alias));
    }

    public List<Agent> getAgents() {
        return List.copyOf(agents.values());
    }

    public ConversationTracker getConversation(Immutable descriptor) {
        return getConversation(descriptor, BranchPoint.ROOT);
    }

    /**
     * The tracker of the conversation identified by the hash key of the
     * descriptor. A new tracker starts at {@code branchFromIfNew}; for an existing
     * one that argument is ignored.
     */
    public ConversationTracker getConversation(Immutable descriptor, BranchPoint branchFromIfNew) {
        return conversations.computeIfAbsent(descriptor.getHashKey(),
                hashKey -> new ConversationTracker(this, branchFromIfNew));
    }

    public CompletableFuture<Message> retrieveMessage(String hashKey) {
        return forumTrees.retrieveMessage(hashKey);
    }
}
