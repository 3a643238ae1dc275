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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical JSON encoding of immutable values and the git-style hash key
 * derived from it. Keys are sorted at every nesting level, nulls are kept and
 * non-ASCII characters are written as UTF-8, so structurally equal values
 * always produce the same bytes.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private CanonicalJson() {
    }

    public static String toJson(Immutable immutable) {
        try {
            return MAPPER.writeValueAsString(toCanonicalTree(immutable));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + immutable.getClass().getSimpleName(), e);
        }
    }

    public static String sha256Hex(String json) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(json.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    static Object toCanonicalTree(Object value) {
        if (value instanceof Immutable immutable) {
            Map<String, Object> tree = new TreeMap<>();
            immutable.getHashableFields().forEach((key, fieldValue) -> tree.put(key, toCanonicalTree(fieldValue)));
            return tree;
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(toCanonicalTree(item));
            }
            return items;
        }
        return value;
    }
}
