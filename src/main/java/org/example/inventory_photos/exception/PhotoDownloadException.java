package org.example.inventory_photos.exception;

/**
 * Не удалось скачать байты фото из чата.
 */
public class PhotoDownloadException extends Exception {

    public PhotoDownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
