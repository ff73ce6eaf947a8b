package org.example.inventory_photos.transport;

import org.example.inventory_photos.exception.PhotoDownloadException;
import org.example.inventory_photos.model.Reply;

/**
 * Канал общения с пользователем (у нас — Telegram).
 * <p>
 * Отправка "best effort": если сообщение не ушло, реализация логирует ошибку
 * и не бросает исключение наружу.
 */
public interface ChatTransport {

    void send(Long chatId, Reply reply);

    default void sendText(Long chatId, String text) {
        send(chatId, Reply.text(text));
    }

    /**
     * Скачать байты фото по его file_id.
     */
    byte[] downloadPhoto(String fileId) throws PhotoDownloadException;
}
