package me.golemcore.forum.port.outbound;

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


import me.golemcore.forum.domain.model.FormattedError;
import me.golemcore.forum.domain.model.Message;

import java.util.concurrent.CompletableFuture;

/**
 * Port for rendering an error condition into the text and metadata of an error
 * message.
 */
public interface ErrorFormatterPort {

    /**
     * @param error
     *            the condition to render
     * @param precedingMessage
     *            the message the error message will follow, or {@code null} if
     *            it starts a new branch
     */
    CompletableFuture<FormattedError> format(Throwable error, Message precedingMessage);
}
