package me.golemcore.forum.adapter.outbound.storage;

import me.golemcore.forum.domain.exception.ImmutableNotFoundException;
import me.golemcore.forum.domain.model.Freeform;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutionException;

import static me.golemcore.forum.testsupport.TestForums.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryImmutableStorageAdapterTest {

    @Test
    void shouldStoreAndRetrieveByHashKey() throws Exception {
        InMemoryImmutableStorageAdapter adapter = new InMemoryImmutableStorageAdapter();
        Freeform value = Freeform.of(Map.of("a", 1));

        await(adapter.storeImmutable(value));

        assertSame(value, await(adapter.retrieveImmutable(value.getHashKey())));
    }

    @Test
    void shouldKeepFirstObjectWhenStoringSameHashTwice() throws Exception {
        InMemoryImmutableStorageAdapter adapter = new InMemoryImmutableStorageAdapter();
        Freeform first = Freeform.of(Map.of("a", 1));
        Freeform second = Freeform.of(Map.of("a", 1));

        await(adapter.storeImmutable(first));
        await(adapter.storeImmutable(second));

        assertEquals(1, adapter.size());
        assertSame(first, await(adapter.retrieveImmutable(second.getHashKey())));
    }

    @Test
    void shouldFailRetrievalOfUnknownHashKey() {
        InMemoryImmutableStorageAdapter adapter = new InMemoryImmutableStorageAdapter();

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> await(adapter.retrieveImmutable("unknown")));

        assertInstanceOf(ImmutableNotFoundException.class, exception.getCause());
    }
}
