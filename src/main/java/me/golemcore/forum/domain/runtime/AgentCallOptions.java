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
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * How an agent call attaches to the conversation and what it passes to the
 * agent function.
 */
@Value
@Builder
public class AgentCallOptions {

    public static final AgentCallOptions DEFAULTS = AgentCallOptions.builder().build();

    /** Sender alias of the request messages instead of the caller's alias. */
    String overrideSenderAlias;

    /** Start the call right after this message. */
    MessagePromise branchFrom;

    /**
     * Continue this conversation; cannot be combined with {@link #branchFrom}.
     * The responses of an asked agent are appended to this conversation from
     * the agent's thread as they arrive, so wait for them (e.g.
     * {@link AsyncMessageSequence#materializeAll()}) before appending anything
     * else to it, or the branch interleaves.
     */
    ConversationTracker conversation;

    /**
     * Do not inherit the history of the request messages. Not allowed for a
     * conversation that already has history.
     */
    boolean forceNewConversation;

    @Singular
    Map<String, Object> functionKwargs;
}
