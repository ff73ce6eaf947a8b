package org.example.inventory_photos.model;

/**
 * Шаги диалога сбора фото.
 * <p>
 * ФЛОУ:
 * POINT_OF_SALE → CONTAINER → SUB_ITEMS → PHOTOS ⇄ DECISION → DONE
 *
 * DONE — сессия закончена (финализирована или отменена), больше событий не принимает.
 */
public enum CollectionStage {

    /** Ждём название точки продаж */
    AWAITING_POINT_OF_SALE,

    /** Ждём выбор коробки (CAJA A … CAJA H) */
    AWAITING_CONTAINER,

    /** Ждём номера акрилов через запятую */
    AWAITING_SUB_ITEMS,

    /** Ждём фото для текущего акрила */
    AWAITING_PHOTOS,

    /** Фото получено — ждём решение: ещё фото / следующий акрил / финализировать */
    AWAITING_DECISION,

    DONE
}
