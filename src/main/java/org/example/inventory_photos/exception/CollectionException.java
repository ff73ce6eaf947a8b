package org.example.inventory_photos.exception;

/**
 * Ошибки ввода во время диалога сбора фото.
 * <p>
 * Ловятся в CollectionStateMachine и превращаются в повторный вопрос,
 * сессия при этом не меняется.
 */
public abstract class CollectionException extends RuntimeException {

    protected CollectionException(String message) {
        super(message);
    }
}
