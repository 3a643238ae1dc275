package me.golemcore.forum.domain.model;

import me.golemcore.forum.domain.exception.ForumValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImmutableTest {

    @Test
    void shouldHashCanonicalJsonWithSortedKeysAndUnicode() {
        Sample nested = sample("юнікод", 3, null);
        Sample sample = sample("test", 2, nested);

        String expectedJson = "{\"im_model_\":\"sample\",\"some_opt_field\":2,\"some_req_field\":\"test\","
                + "\"sub_immutable\":{\"im_model_\":\"sample\",\"some_opt_field\":3,"
                + "\"some_req_field\":\"юнікод\",\"sub_immutable\":null}}";
        assertEquals(expectedJson, CanonicalJson.toJson(sample));
        assertEquals(CanonicalJson.sha256Hex(expectedJson), sample.getHashKey());
        assertEquals(64, sample.getHashKey().length());
    }

    @Test
    void shouldProduceSameHashForStructurallyEqualValues() {
        Map<String, Object> forward = new LinkedHashMap<>();
        forward.put("a", 1);
        forward.put("b", "two");
        Map<String, Object> backward = new LinkedHashMap<>();
        backward.put("b", "two");
        backward.put("a", 1);

        Freeform first = Freeform.of(forward);
        Freeform second = Freeform.of(backward);

        assertEquals(first.getHashKey(), second.getHashKey());
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void shouldProduceDifferentHashWhenSemanticFieldDiffers() {
        assertNotEquals(sample("test", 2, null).getHashKey(), sample("test", 3, null).getHashKey());
        assertNotEquals(Freeform.of(Map.of("a", 1)).getHashKey(), Freeform.of(Map.of("a", "1")).getHashKey());
    }

    @Test
    void shouldReturnMemoizedHashKey() {
        Sample sample = sample("test", 2, null);

        assertSame(sample.getHashKey(), sample.getHashKey());
    }

    @Test
    void shouldKeepNestedImmutableInstance() {
        Sample nested = sample("test", 2, null);
        Sample sample = sample("test", 2, nested);

        assertSame(nested, sample.getFields().get("sub_immutable"));
    }

    @Test
    void shouldRejectMutationOfFieldsAndLists() {
        List<Object> items = new ArrayList<>(List.of("a", "b"));
        Freeform freeform = Freeform.of(Map.of("items", items));
        items.add("c");

        List<?> stored = (List<?>) freeform.get("items");
        assertEquals(List.of("a", "b"), stored);
        assertThrows(UnsupportedOperationException.class, () -> freeform.getFields().put("x", 1));
        assertThrows(UnsupportedOperationException.class, () -> freeform.asDict().put("x", 1));
        assertThrows(UnsupportedOperationException.class, () -> ((List<Object>) stored).add("d"));
    }

    @Test
    void shouldConvertNestedMapsIntoFreeform() {
        Map<String, Object> inner = new HashMap<>();
        inner.put("depth", 2);
        Freeform freeform = Freeform.of(Map.of("inner", inner));

        Freeform converted = assertInstanceOf(Freeform.class, freeform.get("inner"));
        assertEquals(2, converted.get("depth"));
        assertEquals(Map.of("inner", Map.of("depth", 2)), freeform.asDict());
    }

    @Test
    void shouldRejectDisallowedFieldTypes() {
        ForumValidationException exception = assertThrows(ForumValidationException.class,
                () -> Freeform.of(Map.of("when", new Object())));

        assertTrue(exception.getMessage().contains("`when`"));
        assertTrue(exception.getMessage().contains("Freeform"));
        assertTrue(exception.getMessage().contains("got Object"));
    }

    @Test
    void shouldRejectNonFreeformImmutableInsideFreeform() {
        Sample sample = sample("test", 2, null);

        assertThrows(ForumValidationException.class, () -> Freeform.of(Map.of("sample", sample)));
        assertThrows(ForumValidationException.class, () -> Freeform.of(Map.of("list", List.of(sample))));
    }

    @Test
    void shouldRejectNonStringKeysInNestedMaps() {
        assertThrows(ForumValidationException.class, () -> Freeform.of(Map.of("inner", Map.of(1, "one"))));
    }

    @Test
    void shouldExcludeModelFieldFromDict() {
        Sample sample = sample("test", 2, null);

        assertFalse(sample.asDict().containsKey(Immutable.MODEL_FIELD));
        assertEquals("test", sample.asDict().get("some_req_field"));
    }

    @Test
    void shouldReturnSharedEmptyFreeform() {
        assertSame(Freeform.empty(), Freeform.of(Map.of()));
        assertSame(Freeform.empty(), Freeform.of(null));
        assertTrue(Freeform.empty().isEmpty());
    }

    @Test
    void shouldMergeOverridesIntoCopy() {
        Freeform original = Freeform.of(Map.of("a", 1, "b", 2));

        Freeform merged = original.with(Map.of("b", 3, "c", 4));

        assertEquals(Map.of("a", 1, "b", 3, "c", 4), merged.asDict());
        assertEquals(Map.of("a", 1, "b", 2), original.asDict());
    }

    @Test
    void shouldProjectFreeformItemsOfListsInDict() {
        Freeform freeform = Freeform.of(Map.of("items", List.of(Map.of("name", "a"), "plain")));

        assertEquals(List.of(Map.of("name", "a"), "plain"), freeform.asDict().get("items"));
    }

    @Test
    void shouldKeepHashKeyStableWhenExcludedFieldChanges() {
        CachedSample first = cachedSample("value", "2026-01-01");
        CachedSample second = cachedSample("value", "2026-10-19");

        assertEquals(first.getHashKey(), second.getHashKey());
        assertEquals(first, second);
        assertFalse(first.asDict().containsKey("cached_at"));
        assertEquals("2026-01-01", first.getFields().get("cached_at"));
        assertNotEquals(first.getHashKey(), cachedSample("other", "2026-01-01").getHashKey());
    }

    private static Sample sample(String requiredField, int optionalField, Sample subImmutable) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Immutable.MODEL_FIELD, "sample");
        fields.put("some_req_field", requiredField);
        fields.put("some_opt_field", optionalField);
        fields.put("sub_immutable", subImmutable);
        return new Sample(fields);
    }

    private static CachedSample cachedSample(String value, String cachedAt) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Immutable.MODEL_FIELD, "cached_sample");
        fields.put("value", value);
        fields.put("cached_at", cachedAt);
        return new CachedSample(fields);
    }

    private static final class CachedSample extends Immutable {

        private CachedSample(Map<String, ?> fields) {
            super(fields);
        }

        @Override
        protected Set<String> excludeFromHash() {
            return Set.of("cached_at");
        }
    }

    private static final class Sample extends Immutable {

        private Sample(Map<String, ?> fields) {
            super(fields);
        }
    }
}
