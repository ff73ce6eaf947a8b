package org.example.inventory_photos.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.inventory_photos.model.Session;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Хранилище активных сессий сбора фото.
 * <p>
 * Ключ: chatId. Одна сессия на чат, только в памяти —
 * после рестарта бота незаконченные сессии пропадают (и это нормально).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionStore {

    private final Clock clock;

    private final Map<Long, Session> sessions = new ConcurrentHashMap<>();

    /**
     * Начать новую сессию. Старая сессия этого чата (если была) выкидывается.
     */
    public Session start(Long chatId) {
        Session session = new Session(chatId, clock.instant());
        Session previous = sessions.put(chatId, session);
        if (previous != null) {
            log.info("Сессия перезапущена: chatId={}, oldStage={}", chatId, previous.getStage());
        } else {
            log.info("Сессия создана: chatId={}", chatId);
        }
        return session;
    }

    public Optional<Session> find(Long chatId) {
        return Optional.ofNullable(sessions.get(chatId));
    }

    /**
     * Отметить активность — сессию не выкинет чистка по простою.
     */
    public void touch(Session session) {
        session.touch(clock.instant());
    }

    public void discard(Long chatId) {
        if (sessions.remove(chatId) != null) {
            log.info("Сессия удалена: chatId={}", chatId);
        }
    }

    /**
     * Чаты, чьи сессии простаивают дольше idleTimeout. Сами сессии не трогаем.
     */
    public List<Long> findIdle(Duration idleTimeout) {
        Instant threshold = clock.instant().minus(idleTimeout);
        List<Long> idle = new ArrayList<>();
        for (Session session : sessions.values()) {
            if (session.getLastActivity().isBefore(threshold)) {
                idle.add(session.getChatId());
            }
        }
        return idle;
    }

    /**
     * Удалить сессию чата, если она всё ещё простаивает дольше idleTimeout.
     *
     * @return true, если сессия удалена
     */
    public boolean evictIfIdle(Long chatId, Duration idleTimeout) {
        Session session = sessions.get(chatId);
        if (session == null) {
            return false;
        }
        Instant threshold = clock.instant().minus(idleTimeout);
        if (!session.getLastActivity().isBefore(threshold) || !sessions.remove(chatId, session)) {
            return false;
        }
        log.info("Сессия удалена по простою: chatId={}, stage={}", chatId, session.getStage());
        return true;
    }

    public int size() {
        return sessions.size();
    }
}
