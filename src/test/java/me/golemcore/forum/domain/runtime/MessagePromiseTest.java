package me.golemcore.forum.domain.runtime;

import me.golemcore.forum.domain.exception.ForumValidationException;
import me.golemcore.forum.domain.model.ForwardedMessage;
import me.golemcore.forum.domain.model.Message;
import me.golemcore.forum.testsupport.TestForums;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;

import static me.golemcore.forum.testsupport.TestForums.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessagePromiseTest {

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
    void shouldMaterializeOnlyOnce() throws Exception {
        MessagePromise promise = textPromise("hello", BranchPoint.ROOT);

        Message first = await(promise.materialize());
        Message second = await(promise.materialize());

        assertSame(first, second);
        assertSame(promise.materialize(), promise.materialize());
    }

    @Test
    void shouldStoreMaterializedMessageInForum() throws Exception {
        Message message = await(textPromise("hello", BranchPoint.ROOT).materialize());

        Message retrieved = await(forum.retrieveMessage(message.getHashKey()));

        assertEquals(message, retrieved);
        assertEquals("hello", retrieved.getContent());
        assertEquals("USER", retrieved.getSenderAlias());
    }

    @Test
    void shouldAttachAfterBranchPoint() throws Exception {
        MessagePromise first = textPromise("first", BranchPoint.ROOT);
        MessagePromise second = textPromise("second", BranchPoint.of(first));

        Message message = await(second.materialize());

        assertEquals(await(first.materialize()).getHashKey(), message.getPrevMsgHashKey());
        assertEquals(await(first.materialize()), await(second.materializePreviousMessage(false)));
        assertEquals(List.of("first", "second"),
                await(second.materializeHistory(false)).stream().map(Message::getContent).toList());
    }

    @Test
    void shouldForwardExistingMessageWhenSenderIsOverridden() throws Exception {
        Message original = await(textPromise("hello", BranchPoint.ROOT).materialize());
        MessagePromise promise = MessagePromise.builder()
                .forum(forum)
                .content(MessageContent.of(original))
                .defaultSenderAlias("USER")
                .overrideSenderAlias("_RELAY")
                .branchFrom(BranchPoint.UNDETERMINED)
                .doNotForwardIfPossible(true)
                .build();

        ForwardedMessage forwarded = assertInstanceOf(ForwardedMessage.class, await(promise.materialize()));

        assertEquals("_RELAY", forwarded.getSenderAlias());
        assertSame(original, forwarded.getOriginalMessage(false));
    }

    @Test
    void shouldCarryOverrideMetadataOnForward() throws Exception {
        Message original = await(textPromise("hello", BranchPoint.ROOT).materialize());
        MessagePromise promise = MessagePromise.builder()
                .forum(forum)
                .content(MessageContent.of(original))
                .defaultSenderAlias("_RELAY")
                .branchFrom(BranchPoint.UNDETERMINED)
                .doNotForwardIfPossible(true)
                .overrideMetadata(Map.of("reason", "audit"))
                .build();

        Message forwarded = await(promise.materialize());

        assertInstanceOf(ForwardedMessage.class, forwarded);
        assertEquals("audit", forwarded.getMetadata().get("reason"));
        assertEquals("hello", forwarded.getContent());
    }

    @Test
    void shouldReuseExistingPromiseThatContinuesBranch() throws Exception {
        MessagePromise first = textPromise("first", BranchPoint.ROOT);
        MessagePromise reused = MessagePromise.builder()
                .forum(forum)
                .content(MessageContent.of(first))
                .defaultSenderAlias("_AGENT")
                .branchFrom(BranchPoint.ROOT)
                .doNotForwardIfPossible(true)
                .build();

        assertSame(await(first.materialize()), await(reused.materialize()));
    }

    @Test
    void shouldKnowErrorBeforeMaterialization() {
        IllegalStateException error = new IllegalStateException("boom");
        MessagePromise errorPromise = MessagePromise.builder()
                .forum(forum)
                .content(MessageContent.of(error))
                .defaultSenderAlias("_AGENT")
                .build();
        MessagePromise textPromise = textPromise("fine", BranchPoint.ROOT);

        assertTrue(errorPromise.isError());
        assertSame(error, errorPromise.getErrorCause());
        assertFalse(textPromise.isError());
        assertNull(textPromise.getErrorCause());
    }

    @Test
    void shouldKeepErrorFlagWhenForwardingErrorMessage() throws Exception {
        MessagePromise errorPromise = MessagePromise.builder()
                .forum(forum)
                .content(MessageContent.of(new IllegalStateException("boom")))
                .defaultSenderAlias("_AGENT")
                .build();
        MessagePromise forward = MessagePromise.builder()
                .forum(forum)
                .content(MessageContent.of(errorPromise))
                .defaultSenderAlias("_PARENT")
                .branchFrom(BranchPoint.of(textPromise("before", BranchPoint.ROOT)))
                .build();

        Message forwarded = await(forward.materialize());

        assertTrue(forward.isError());
        assertInstanceOf(ForwardedMessage.class, forwarded);
        assertTrue(forwarded.isError());
        assertEquals("IllegalStateException: boom", forwarded.getContent());
    }

    @Test
    void shouldRejectSequenceContent() {
        MessageContent sequence = MessageContent.sequence(Flux.just(MessageContent.of("a")));

        assertThrows(ForumValidationException.class, () -> MessagePromise.builder()
                .forum(forum)
                .content(sequence)
                .defaultSenderAlias("USER")
                .build());
    }

    private MessagePromise textPromise(String text, BranchPoint branchFrom) {
        return MessagePromise.builder()
                .forum(forum)
                .content(MessageContent.of(text))
                .defaultSenderAlias("USER")
                .branchFrom(branchFrom)
                .doNotForwardIfPossible(true)
                .build();
    }
}
