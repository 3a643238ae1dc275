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

import me.golemcore.forum.domain.exception.ForumValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Base class for frozen value objects with a git-style hash key.
 *
 * <p>
 * Field values are validated recursively at construction time. Only
 * {@code null}, strings, integral and floating point numbers, booleans, lists
 * of those and nested immutable objects are allowed; maps are converted into
 * {@link Freeform} objects and lists are frozen. Subclasses may narrow the set
 * of nested immutable types via {@link #isAllowedNestedImmutable(Immutable)}.
 *
 * <p>
 * The hash key is the SHA-256 digest of the canonical JSON of all the fields
 * except {@link #excludeFromHash()}. It is calculated on first access and never
 * recalculated afterwards.
 */
public abstract class Immutable {

    public static final String MODEL_FIELD = "im_model_";

    private static final List<Class<?>> PRIMITIVE_TYPES = List.of(
            String.class, Integer.class, Long.class, Float.class, Double.class, Boolean.class);

    private final Map<String, Object> fields;

    private volatile String hashKey;
    private volatile Map<String, Object> dict;

    protected Immutable(Map<String, ?> fields) {
        Map<String, Object> validated = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((key, value) -> validated.put(key, validateValue(key, value)));
        }
        this.fields = Collections.unmodifiableMap(validated);
    }

    /**
     * Git-style hash key of this object.
     */
    public final String getHashKey() {
        String result = hashKey;
        if (result == null) {
            result = CanonicalJson.sha256Hex(CanonicalJson.toJson(this));
            hashKey = result;
        }
        return result;
    }

    /**
     * All the fields of this object, including the model discriminator.
     */
    public Map<String, Object> getFields() {
        return fields;
    }

    /**
     * Presentation projection: omits the model discriminator and everything that
     * is excluded from the hash key.
     */
    public Map<String, Object> asDict() {
        Map<String, Object> result = dict;
        if (result == null) {
            Map<String, Object> projection = new LinkedHashMap<>();
            fields.forEach((key, value) -> {
                if (!excludeFromDict().contains(key) && !excludeFromHash().contains(key)) {
                    projection.put(key, toDictValue(value));
                }
            });
            result = Collections.unmodifiableMap(projection);
            dict = result;
        }
        return result;
    }

    private static Object toDictValue(Object value) {
        if (value instanceof Immutable nested) {
            return nested.asDict();
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(toDictValue(item));
            }
            return Collections.unmodifiableList(items);
        }
        return value;
    }

    protected Object getField(String name) {
        return fields.get(name);
    }

    /**
     * Fields that are kept with the object (and persisted by stores that save
     * the whole field map) but do not take part in its identity: they are left
     * out of the hash key and of {@link #asDict()}.
     */
    protected Set<String> excludeFromHash() {
        return Set.of();
    }

    protected Set<String> excludeFromDict() {
        return Set.of(MODEL_FIELD);
    }

    protected boolean isAllowedNestedImmutable(Immutable value) {
        return true;
    }

    protected String allowedNestedImmutableName() {
        return Immutable.class.getSimpleName();
    }

    Map<String, Object> getHashableFields() {
        Set<String> excluded = excludeFromHash();
        if (excluded.isEmpty()) {
            return fields;
        }
        Map<String, Object> hashable = new LinkedHashMap<>();
        fields.forEach((key, value) -> {
            if (!excluded.contains(key)) {
                hashable.put(key, value);
            }
        });
        return hashable;
    }

    private Object validateValue(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(validateValue(key, item));
            }
            return Collections.unmodifiableList(items);
        }
        if (value instanceof Object[] array) {
            return validateValue(key, Arrays.asList(array));
        }
        if (value instanceof Map<?, ?> map) {
            return new Freeform(toStringKeyedMap(key, map));
        }
        if (value instanceof Immutable immutable) {
            if (isAllowedNestedImmutable(immutable)) {
                return immutable;
            }
        } else if (PRIMITIVE_TYPES.contains(value.getClass())) {
            return value;
        }
        throw new ForumValidationException("only {" + describeAllowedTypes() + "} are allowed as field values in "
                + getClass().getSimpleName() + ", got " + value.getClass().getSimpleName() + " in `" + key + "`");
    }

    private Map<String, Object> toStringKeyedMap(String key, Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String name)) {
                throw new ForumValidationException("only String keys are allowed in nested maps, got "
                        + (entry.getKey() == null ? "null" : entry.getKey().getClass().getSimpleName())
                        + " in `" + key + "`");
            }
            result.put(name, entry.getValue());
        }
        return result;
    }

    private String describeAllowedTypes() {
        List<String> names = new ArrayList<>();
        names.add("null");
        PRIMITIVE_TYPES.forEach(type -> names.add(type.getSimpleName()));
        names.add("List");
        names.add("Map");
        names.add(allowedNestedImmutableName());
        return String.join(", ", names);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        return getHashKey().equals(((Immutable) other).getHashKey());
    }

    @Override
    public int hashCode() {
        return getHashKey().hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + fields;
    }
}
