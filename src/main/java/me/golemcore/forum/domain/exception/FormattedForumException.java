package me.golemcore.forum.domain.exception;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An error that already knows how it should look in a conversation. Agents may
 * throw (or respond with) it to control the text and metadata of the resulting
 * error message.
 */
public class FormattedForumException extends ForumException {

    private final transient Map<String, Object> metadata;

    public FormattedForumException(String message) {
        this(message, Map.of(), null);
    }

    public FormattedForumException(String message, Map<String, Object> metadata, Throwable cause) {
        super(message, cause);
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
