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


import me.golemcore.forum.domain.model.Message;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Anything that can be appended to a conversation. Every shape except
 * {@link Sequence} turns into exactly one message; a sequence turns into zero
 * or more, flattened recursively in order.
 */
public sealed interface MessageContent {

    <R> R accept(Visitor<R> visitor);

    static MessageContent of(String text) {
        return new Text(text);
    }

    static MessageContent of(Throwable error) {
        return new ErrorContent(error);
    }

    static MessageContent of(Message message) {
        return new ExistingMessage(message);
    }

    static MessageContent of(MessagePromise promise) {
        return new ExistingPromise(promise);
    }

    /**
     * A fresh message built from the given fields: {@code content} is required,
     * {@code sender_alias} is optional and everything else is metadata.
     */
    static MessageContent of(Map<String, ?> fields) {
        return new FieldOverride(new LinkedHashMap<String, Object>(fields));
    }

    /**
     * Splices all the messages of the given sequence (backlog and live tail) at
     * this point.
     */
    static MessageContent of(AsyncMessageSequence sequence) {
        return new Sequence(sequence.asFlux().map(ExistingPromise::new));
    }

    static MessageContent of(List<? extends MessageContent> contents) {
        return new Sequence(Flux.fromIterable(contents));
    }

    static MessageContent of(MessageContent... contents) {
        return of(Arrays.asList(contents));
    }

    static MessageContent texts(String... texts) {
        return new Sequence(Flux.fromArray(texts).map(Text::new));
    }

    static MessageContent sequence(Publisher<? extends MessageContent> contents) {
        return new Sequence(contents);
    }

    record Text(String text) implements MessageContent {
        public Text {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitText(this);
        }
    }

    record ErrorContent(Throwable error) implements MessageContent {
        public ErrorContent {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitError(this);
        }
    }

    record ExistingMessage(Message message) implements MessageContent {
        public ExistingMessage {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExistingMessage(this);
        }
    }

    record ExistingPromise(MessagePromise promise) implements MessageContent {
        public ExistingPromise {
            Objects.requireNonNull(promise, "promise");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExistingPromise(this);
        }
    }

    record FieldOverride(Map<String, Object> fields) implements MessageContent {
        public FieldOverride {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFieldOverride(this);
        }
    }

    record Sequence(Publisher<? extends MessageContent> contents) implements MessageContent {
        public Sequence {
            Objects.requireNonNull(contents, "contents");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSequence(this);
        }
    }

    /**
     * Exhaustive dispatch over the content shapes.
     */
    interface Visitor<R> {

        R visitText(Text text);

        R visitError(ErrorContent error);

        R visitExistingMessage(ExistingMessage existing);

        R visitExistingPromise(ExistingPromise existing);

        R visitFieldOverride(FieldOverride fieldOverride);

        R visitSequence(Sequence sequence);
    }
}
