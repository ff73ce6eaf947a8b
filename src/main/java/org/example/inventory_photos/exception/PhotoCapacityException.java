package org.example.inventory_photos.exception;

/**
 * Для акрила уже набран лимит фото.
 */
public class PhotoCapacityException extends CollectionException {

    private final String subItem;

    public PhotoCapacityException(String subItem, int limit) {
        super("Лимит " + limit + " фото для " + subItem + " исчерпан");
        this.subItem = subItem;
    }

    public String getSubItem() {
        return subItem;
    }
}
