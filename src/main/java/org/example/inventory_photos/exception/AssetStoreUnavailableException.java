package org.example.inventory_photos.exception;

/**
 * Клиент хранилища вообще не поднять: нет кредов, креды битые, не задана корневая папка.
 * <p>
 * Финализация сразу прерывается с одним сообщением пользователю.
 */
public class AssetStoreUnavailableException extends Exception {

    public AssetStoreUnavailableException(String message) {
        super(message);
    }

    public AssetStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
