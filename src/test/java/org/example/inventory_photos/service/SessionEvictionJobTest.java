package org.example.inventory_photos.service;

import org.example.inventory_photos.config.InventoryConfig;
import org.example.inventory_photos.handler.ConversationDispatcher;
import org.example.inventory_photos.model.Reply;
import org.example.inventory_photos.model.Session;
import org.example.inventory_photos.transport.ChatTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionEvictionJobTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private Clock clock;
    private SessionStore sessionStore;
    private ChatTransport chatTransport;
    private ConversationDispatcher dispatcher;
    private SessionEvictionJob job;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(T0);
        sessionStore = new SessionStore(clock);
        chatTransport = mock(ChatTransport.class);
        dispatcher = new ConversationDispatcher(2);
        job = new SessionEvictionJob(sessionStore, chatTransport, new InventoryConfig(1, 3, "PT30M"), dispatcher);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        dispatcher.shutdown();
    }

    private void drain(Long chatId) throws Exception {
        dispatcher.dispatch(chatId, () -> { }).get(2, TimeUnit.SECONDS);
    }

    @Test
    void evictsIdleSessionAndNotifiesChat() throws Exception {
        sessionStore.start(11L);
        sessionStore.start(12L);
        when(clock.instant()).thenReturn(T0.plus(Duration.ofMinutes(45)));

        job.evictIdleSessions();
        drain(11L);
        drain(12L);

        assertEquals(0, sessionStore.size());
        ArgumentCaptor<Reply> reply = ArgumentCaptor.forClass(Reply.class);
        verify(chatTransport).send(eq(11L), reply.capture());
        verify(chatTransport).send(eq(12L), any(Reply.class));
        assertEquals(Reply.KeyboardAction.REMOVE, reply.getValue().keyboardAction());
        assertTrue(reply.getValue().text().contains("expiró"));
    }

    @Test
    @DisplayName("event queued for the chat before eviction keeps the session alive")
    void activityInQueueWins() throws Exception {
        Session session = sessionStore.start(11L);
        when(clock.instant()).thenReturn(T0.plus(Duration.ofMinutes(45)));

        CountDownLatch release = new CountDownLatch(1);
        dispatcher.dispatch(11L, () -> {
            await(release);
            sessionStore.touch(session);
        });

        job.evictIdleSessions();
        release.countDown();
        drain(11L);

        assertSame(session, sessionStore.find(11L).orElseThrow());
        verify(chatTransport, never()).send(any(), any());
    }

    @Test
    void silentWhenNothingIdle() throws Exception {
        sessionStore.start(11L);

        job.evictIdleSessions();
        drain(11L);

        assertEquals(1, sessionStore.size());
        verify(chatTransport, never()).send(any(), any());
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
