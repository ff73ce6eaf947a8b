package org.example.inventory_photos.storage;

import org.example.inventory_photos.exception.AssetStoreException;

import java.util.Optional;

/**
 * Иерархическое хранилище файлов (у нас — Google Drive).
 * <p>
 * Клиент уже авторизован: как получены креды, здесь не важно.
 */
public interface AssetStore {

    /**
     * Найти не удалённую папку с точно таким именем прямо внутри parentId.
     */
    Optional<String> findFolder(String name, String parentId) throws AssetStoreException;

    /**
     * Создать папку и вернуть её id.
     */
    String createFolder(String name, String parentId) throws AssetStoreException;

    /**
     * Загрузить файл в папку и вернуть его id.
     */
    String createFile(String name, String parentId, byte[] content, String mimeType) throws AssetStoreException;
}
