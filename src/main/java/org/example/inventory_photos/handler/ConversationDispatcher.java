package org.example.inventory_photos.handler;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Очередь событий по чатам.
 * <p>
 * События одного чата выполняются строго друг за другом (следующее ждёт,
 * пока предыдущее полностью обработано, включая отправку ответов и загрузку).
 * Разные чаты обрабатываются параллельно на общем пуле потоков.
 * <p>
 * Реализация: для каждого чата держим "хвост" — future последнего события,
 * новое событие цепляем к нему через thenRunAsync.
 */
@Slf4j
@Component
public class ConversationDispatcher {

    private final ExecutorService executor;

    private final Map<Long, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public ConversationDispatcher(@Value("${inventory.dispatch.threads:4}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "conversation-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("ConversationDispatcher: threads={}", threads);
    }

    /**
     * Поставить событие чата в очередь.
     *
     * @return future, который завершится после обработки события
     */
    public CompletableFuture<Void> dispatch(Long chatId, Runnable task) {
        CompletableFuture<Void> next = tails.compute(chatId, (id, tail) ->
                (tail == null ? CompletableFuture.<Void>completedFuture(null) : tail)
                        .thenRunAsync(() -> runSafely(id, task), executor));

        // Чат затих — хвост больше не нужен
        next.whenComplete((ignored, error) -> tails.remove(chatId, next));
        return next;
    }

    /**
     * Ошибка одного события не должна ломать очередь чата.
     */
    private void runSafely(Long chatId, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Ошибка обработки события: chatId={}", chatId, e);
        }
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("ConversationDispatcher: не все события успели обработаться до остановки");
            executor.shutdownNow();
        }
    }
}
