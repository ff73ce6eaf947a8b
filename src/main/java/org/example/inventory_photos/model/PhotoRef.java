package org.example.inventory_photos.model;

/**
 * Ссылка на фото, которое лежит у Telegram.
 * <p>
 * Байты мы не храним — только file_id, скачиваем их уже при финализации.
 *
 * @param fileId  file_id самого большого PhotoSize из сообщения
 * @param ordinal порядковый номер фото внутри своего акрила (с 1)
 */
public record PhotoRef(String fileId, int ordinal) {
}
