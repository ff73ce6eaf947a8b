package org.example.inventory_photos.exception;

/**
 * Кривой ввод: пустое название, неизвестная коробка, мусор вместо номеров акрилов.
 */
public class InputValidationException extends CollectionException {

    public InputValidationException(String message) {
        super(message);
    }
}
