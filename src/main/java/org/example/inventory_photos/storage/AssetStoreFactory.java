package org.example.inventory_photos.storage;

import org.example.inventory_photos.exception.AssetStoreUnavailableException;

/**
 * Выдаёт готовый к работе AssetStore на одну финализацию.
 */
public interface AssetStoreFactory {

    /**
     * @throws AssetStoreUnavailableException нет кредов / креды не принимаются / не задана корневая папка
     */
    AssetStore open() throws AssetStoreUnavailableException;

    /**
     * Папка, внутри которой живут папки точек продаж.
     */
    String rootFolderId();

    /**
     * Заданы ли вообще настройки (для /health, без похода в сеть).
     */
    boolean isConfigured();
}
