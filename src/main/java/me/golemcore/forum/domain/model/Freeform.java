package me.golemcore.forum.domain.model;

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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable object without predefined fields: it carries arbitrary named
 * fields (used for message metadata and agent call arguments). Nested values
 * may only be other {@code Freeform} objects.
 */
public class Freeform extends Immutable {

    private static final Freeform EMPTY = new Freeform(Map.of());

    public Freeform(Map<String, ?> fields) {
        super(fields);
    }

    public static Freeform empty() {
        return EMPTY;
    }

    public static Freeform of(Map<String, ?> fields) {
        return fields == null || fields.isEmpty() ? EMPTY : new Freeform(fields);
    }

    public boolean isEmpty() {
        return getFields().isEmpty();
    }

    public Object get(String name) {
        return getField(name);
    }

    /**
     * Creates a copy of this object with the given fields added or replaced.
     */
    public Freeform with(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(getFields());
        merged.putAll(overrides);
        return new Freeform(merged);
    }

    @Override
    protected boolean isAllowedNestedImmutable(Immutable value) {
        return value instanceof Freeform;
    }

    @Override
    protected String allowedNestedImmutableName() {
        return Freeform.class.getSimpleName();
    }
}
