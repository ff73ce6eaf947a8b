package org.example.inventory_photos.model;

/**
 * Результат загрузки одного фото.
 *
 * SUCCESS — файл создан в Google Drive.
 * FAILED  — не скачали из Telegram или Drive не принял файл.
 */
public enum UploadStatus {
    SUCCESS,
    FAILED
}
