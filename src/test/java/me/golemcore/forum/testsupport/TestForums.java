package me.golemcore.forum.testsupport;

import me.golemcore.forum.adapter.outbound.error.DefaultErrorFormatterAdapter;
import me.golemcore.forum.adapter.outbound.storage.InMemoryImmutableStorageAdapter;
import me.golemcore.forum.domain.runtime.Forum;
import me.golemcore.forum.domain.service.ForumTrees;
import me.golemcore.forum.infrastructure.config.ForumProperties;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class TestForums {

    private static final long TIMEOUT_SECONDS = 5;

    private TestForums() {
    }

    public static Forum create() {
        return create(new ForumProperties());
    }

    public static Forum create(ForumProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ExecutorService executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "test-agent-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return new Forum(new ForumTrees(new InMemoryImmutableStorageAdapter()), new DefaultErrorFormatterAdapter(),
                executor, properties);
    }

    public static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }
}
