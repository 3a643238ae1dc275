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

/**
 * Thrown synchronously at the point of misuse: a disallowed field value in an
 * immutable object, a forwarded message whose original doesn't match its hash
 * key, a reentrant interaction context, conflicting call options and so on.
 */
public class ForumValidationException extends ForumException {

    public ForumValidationException(String message) {
        super(message);
    }
}
