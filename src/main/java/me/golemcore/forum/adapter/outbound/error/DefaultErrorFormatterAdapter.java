package me.golemcore.forum.adapter.outbound.error;

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


import me.golemcore.forum.domain.exception.FormattedForumException;
import me.golemcore.forum.domain.model.FormattedError;
import me.golemcore.forum.domain.model.Message;
import me.golemcore.forum.port.outbound.ErrorFormatterPort;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Renders errors as {@code SimpleName: message}, recording the exception class
 * under {@code error_type}. A {@link FormattedForumException} is rendered with
 * its own message and metadata instead.
 */
public class DefaultErrorFormatterAdapter implements ErrorFormatterPort {

    public static final String ERROR_TYPE = "error_type";

    @Override
    public CompletableFuture<FormattedError> format(Throwable error, Message precedingMessage) {
        if (error instanceof FormattedForumException formatted) {
            return CompletableFuture.completedFuture(new FormattedError(
                    formatted.getMessage() != null ? formatted.getMessage() : "", formatted.getMetadata()));
        }
        String text = error.getMessage() != null
                ? error.getClass().getSimpleName() + ": " + error.getMessage()
                : error.getClass().getSimpleName();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ERROR_TYPE, error.getClass().getName());
        return CompletableFuture.completedFuture(new FormattedError(text, metadata));
    }
}
