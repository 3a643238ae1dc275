package me.golemcore.forum.domain.runtime;

import me.golemcore.forum.domain.exception.AgentFailureException;
import me.golemcore.forum.domain.exception.ForumValidationException;
import me.golemcore.forum.testsupport.TestForums;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static me.golemcore.forum.testsupport.TestForums.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InteractionContextTest {

    private Forum forum;

    @BeforeEach
    void setUp() {
        forum = TestForums.create();
    }

    @AfterEach
    void tearDown() {
        forum.getExecutor().shutdownNow();
    }

    @Test
    void shouldNotBeReentrant() throws Exception {
        InteractionContext ctx = forum.getRootContext();

        ctx.enter();
        assertThrows(ForumValidationException.class, ctx::enter);
        await(ctx.exit());
        ctx.enter();
        await(ctx.exit());
    }

    @Test
    void shouldCollectChildFailuresOnExit() throws Exception {
        Agent failing = forum.agent("_failing", ctx -> {
            throw new IllegalStateException("told and failed");
        });
        Agent quiet = forum.agent("_quiet", ctx -> {
        });
        InteractionContext root = forum.getRootContext();

        root.enter();
        failing.tell(MessageContent.of("go"));
        quiet.tell(MessageContent.of("go"));
        List<Throwable> failures = await(root.exit());

        assertEquals(1, failures.size());
        assertInstanceOf(AgentFailureException.class, failures.get(0));
    }

    @Test
    void shouldExposeCallDetailsToAgentFunction() throws Exception {
        AtomicReference<InteractionContext> seen = new AtomicReference<>();
        Agent agent = forum.agent("_agent", ctx -> {
            seen.set(ctx);
            ctx.respond("ok");
        });

        await(agent.ask(MessageContent.of("hello"), AgentCallOptions.builder().functionKwarg("mode", "fast").build())
                .materializeAll());

        InteractionContext ctx = seen.get();
        assertFalse(ctx.isRoot());
        assertTrue(ctx.wasAsked());
        assertSame(ctx, ctx.getAskedContext());
        assertSame(forum.getRootContext(), ctx.getParentContext());
        assertSame(agent, ctx.getThisAgent());
        assertEquals("fast", ctx.getFunctionKwarg("mode"));
        assertEquals(Map.of("mode", "fast"), ctx.getFunctionKwargs().asDict());
        assertEquals("hello", await(ctx.getRequestMessages().materializeConcludingMessage()).getContent());
    }

    @Test
    void shouldFinishUnfinishedChildCallsOnExit() throws Exception {
        AtomicReference<AgentCall> childCall = new AtomicReference<>();
        Agent child = forum.agent("_child", ctx -> ctx.respond(
                "got " + await(ctx.getRequestMessages().materializeAll()).size()));
        Agent parent = forum.agent("_parent", ctx -> {
            AgentCall call = child.startAsking(ctx, AgentCallOptions.DEFAULTS);
            call.sendRequest(MessageContent.of("one"));
            call.sendRequest(MessageContent.of("two"));
            childCall.set(call);
        });

        await(parent.ask(MessageContent.of("start")).materializeAll());

        assertTrue(childCall.get().isFinished());
        await(childCall.get().completion());
    }
}
