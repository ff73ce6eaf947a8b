package org.example.inventory_photos.exception;

/**
 * Ошибка операции с хранилищем (поиск/создание папки, загрузка файла).
 * <p>
 * Не прерывает пачку: UploadPipeline записывает её в UploadOutcome как FAILED.
 */
public class AssetStoreException extends Exception {

    public enum Kind {
        /** Сеть, 5xx, лимиты — повтор когда-нибудь может помочь */
        TRANSIENT,
        /** 401/403 — у сервисного аккаунта нет прав на папку */
        PERMISSION
    }

    private final Kind kind;

    public AssetStoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
