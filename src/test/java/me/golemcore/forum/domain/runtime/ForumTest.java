package me.golemcore.forum.domain.runtime;

import me.golemcore.forum.domain.exception.NoAskingAgentException;
import me.golemcore.forum.domain.model.Freeform;
import me.golemcore.forum.domain.model.Message;
import me.golemcore.forum.testsupport.TestForums;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static me.golemcore.forum.testsupport.TestForums.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ForumTest {

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
    void shouldReturnSameConversationForEqualDescriptors() {
        ConversationTracker first = forum.getConversation(Freeform.of(Map.of("chat_id", 42)));
        ConversationTracker second = forum.getConversation(Freeform.of(Map.of("chat_id", 42)));
        ConversationTracker other = forum.getConversation(Freeform.of(Map.of("chat_id", 43)));

        assertSame(first, second);
        assertNotSame(first, other);
    }

    @Test
    void shouldIgnoreBranchPointForExistingConversation() {
        Freeform descriptor = Freeform.of(Map.of("chat_id", 1));
        ConversationTracker created = forum.getConversation(descriptor);
        MessagePromise promise = new ConversationTracker(forum).append(MessageContent.of("elsewhere"), "USER")
                .blockLast();

        ConversationTracker existing = forum.getConversation(descriptor, BranchPoint.of(promise));

        assertSame(created, existing);
        assertFalse(existing.hasPriorHistory());
    }

    @Test
    void shouldStartNewConversationAtGivenBranchPoint() {
        MessagePromise promise = new ConversationTracker(forum).append(MessageContent.of("start"), "USER")
                .blockLast();

        ConversationTracker conversation = forum.getConversation(Freeform.of(Map.of("chat_id", 2)),
                BranchPoint.of(promise));

        assertSame(promise, conversation.getBranchPoint().promise());
    }

    @Test
    void shouldRegisterAndReplaceAgents() {
        Agent first = forum.agent("_agent", ctx -> ctx.respond("v1"));
        Agent second = forum.agent("_agent", ctx -> ctx.respond("v2"));
        forum.agent("_other", ctx -> ctx.respond("other"));

        assertSame(second, forum.getAgent("_agent").orElseThrow());
        assertNotSame(first, second);
        assertEquals(2, forum.getAgents().size());
        assertTrue(forum.getAgent("_missing").isEmpty());
    }

    @Test
    void shouldRepresentUserWithRootContext() {
        InteractionContext root = forum.getRootContext();

        assertEquals("USER", forum.getUserAgent().getAlias());
        assertSame(forum.getUserAgent(), root.getThisAgent());
        assertTrue(root.isRoot());
        assertFalse(root.wasAsked());
        assertThrows(NoAskingAgentException.class, () -> root.respond("nobody asked"));
    }

    @Test
    void shouldRetrieveStoredMessages() throws Exception {
        MessagePromise promise = new ConversationTracker(forum).append(MessageContent.of("stored"), "USER")
                .blockLast();
        Message message = await(promise.materialize());

        assertEquals(message, await(forum.retrieveMessage(message.getHashKey())));
    }

    @Test
    void shouldForgetFinishedCallsOfRootContext() throws Exception {
        Agent agent = forum.agent("_agent", ctx -> ctx.respond("done"));

        AgentCall first = agent.startAsking();
        await(first.responseSequence().materializeAll());
        await(first.completion());
        AgentCall second = agent.startAsking();

        assertEquals(1, forum.getRootContext().getChildCalls().size());
        assertSame(second, forum.getRootContext().getChildCalls().get(0));
        await(second.responseSequence().materializeAll());
    }
}
