package org.example.inventory_photos.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.inventory_photos.config.InventoryConfig;
import org.example.inventory_photos.handler.ConversationDispatcher;
import org.example.inventory_photos.model.Reply;
import org.example.inventory_photos.transport.ChatTransport;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Периодически выкидывает брошенные сессии.
 * <p>
 * Пользователь начал, ушёл и не вернулся — фото не грузим, просто забываем
 * и пишем ему, что процесс истёк.
 * <p>
 * Удаление идёт через очередь чата (ConversationDispatcher), как обычное событие:
 * оно не пересекается с обработкой сообщения этого чата, а простой
 * перепроверяется уже внутри очереди.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionEvictionJob {

    private final SessionStore sessionStore;
    private final ChatTransport chatTransport;
    private final InventoryConfig inventoryConfig;
    private final ConversationDispatcher conversationDispatcher;

    @Scheduled(fixedDelayString = "${inventory.session.eviction-interval:PT5M}")
    public void evictIdleSessions() {
        Duration idleTimeout = inventoryConfig.getSessionIdleTimeout();
        List<Long> candidates = sessionStore.findIdle(idleTimeout);
        if (!candidates.isEmpty()) {
            log.debug("Кандидаты на удаление по простою: {}", candidates);
        }
        for (Long chatId : candidates) {
            conversationDispatcher.dispatch(chatId, () -> evict(chatId, idleTimeout));
        }
    }

    private void evict(Long chatId, Duration idleTimeout) {
        if (sessionStore.evictIfIdle(chatId, idleTimeout)) {
            chatTransport.send(chatId, Reply.removingKeyboard(
                    "⌛ El proceso expiró por inactividad. Puedes iniciar nuevamente con /start."));
        }
    }
}
