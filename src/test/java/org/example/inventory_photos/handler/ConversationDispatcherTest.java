package org.example.inventory_photos.handler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ConversationDispatcherTest {

    private ConversationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new ConversationDispatcher(4);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        dispatcher.shutdown();
    }

    @Test
    void eventsOfOneChatRunInArrivalOrder() throws Exception {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        for (int i = 0; i < 50; i++) {
            int event = i;
            futures.add(dispatcher.dispatch(1L, () -> {
                if (event % 7 == 0) {
                    sleep(3);
                }
                seen.add(event);
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        assertEquals(IntStream.range(0, 50).boxed().collect(Collectors.toList()), seen);
    }

    @Test
    void differentChatsDoNotWaitForEachOther() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Void> blocked = dispatcher.dispatch(1L, () -> await(release));

        CompletableFuture<Void> other = dispatcher.dispatch(2L, () -> { });
        other.get(2, TimeUnit.SECONDS);

        assertFalse(blocked.isDone());
        release.countDown();
        blocked.get(2, TimeUnit.SECONDS);
    }

    @Test
    void failingEventDoesNotBlockTheChat() throws Exception {
        dispatcher.dispatch(1L, () -> {
            throw new IllegalStateException("boom");
        });
        List<String> seen = Collections.synchronizedList(new ArrayList<>());

        dispatcher.dispatch(1L, () -> seen.add("next")).get(2, TimeUnit.SECONDS);

        assertEquals(List.of("next"), seen);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
