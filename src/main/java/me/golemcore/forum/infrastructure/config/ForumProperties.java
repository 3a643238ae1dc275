package me.golemcore.forum.infrastructure.config;

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


import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties of the forum, bound from {@code forum.*}.
 *
 * <p>
 * Nested property classes:
 * <ul>
 * <li>{@link AgentsProperties} - how agent aliases and descriptions are
 * derived</li>
 * <li>{@link ExecutorProperties} - the executor agent functions run on</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "forum")
@Data
public class ForumProperties {

    /**
     * Alias of the agent that represents the external initiator of
     * conversations.
     */
    private String userAlias = "USER";
    private AgentsProperties agents = new AgentsProperties();
    private ExecutorProperties executor = new ExecutorProperties();

    @Data
    public static class AgentsProperties {
        private boolean uppercaseAliases = true;
        private boolean normalizeDescriptionSpaces = true;
    }

    @Data
    public static class ExecutorProperties {
        private String threadNamePrefix = "forum-agent-";
    }
}
