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


import lombok.extern.slf4j.Slf4j;
import me.golemcore.forum.adapter.outbound.error.DefaultErrorFormatterAdapter;
import me.golemcore.forum.adapter.outbound.storage.InMemoryImmutableStorageAdapter;
import me.golemcore.forum.domain.runtime.Forum;
import me.golemcore.forum.domain.service.ForumTrees;
import me.golemcore.forum.port.outbound.ErrorFormatterPort;
import me.golemcore.forum.port.outbound.ImmutableStoragePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring Boot auto-configuration of a forum. Every bean backs off when the
 * application defines its own, so the store and the error formatter can be
 * replaced independently.
 */
@AutoConfiguration
@EnableConfigurationProperties(ForumProperties.class)
@Slf4j
public class ForumAutoConfiguration {

    public static final String EXECUTOR_BEAN_NAME = "forumAgentExecutor";

    @Bean
    @ConditionalOnMissingBean
    public ImmutableStoragePort immutableStoragePort() {
        return new InMemoryImmutableStorageAdapter();
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorFormatterPort errorFormatterPort() {
        return new DefaultErrorFormatterAdapter();
    }

    @Bean
    @ConditionalOnMissingBean
    public ForumTrees forumTrees(ImmutableStoragePort immutableStoragePort) {
        return new ForumTrees(immutableStoragePort);
    }

    @Bean(name = EXECUTOR_BEAN_NAME, destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = EXECUTOR_BEAN_NAME)
    public ExecutorService forumAgentExecutor(ForumProperties properties) {
        String prefix = properties.getExecutor().getThreadNamePrefix();
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public Forum forum(ForumTrees forumTrees, ErrorFormatterPort errorFormatterPort,
            @Qualifier(EXECUTOR_BEAN_NAME) ExecutorService forumAgentExecutor, ForumProperties properties) {
        log.info("[Forum] Initialized: userAlias={}, uppercaseAliases={}", properties.getUserAlias(),
                properties.getAgents().isUppercaseAliases());
        return new Forum(forumTrees, errorFormatterPort, forumAgentExecutor, properties);
    }
}
