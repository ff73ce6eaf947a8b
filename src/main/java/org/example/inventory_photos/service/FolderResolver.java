package org.example.inventory_photos.service;

import lombok.extern.slf4j.Slf4j;
import org.example.inventory_photos.exception.AssetStoreException;
import org.example.inventory_photos.storage.AssetStore;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Папка точки продаж в хранилище: найти существующую или создать.
 * <p>
 * Сначала всегда ищем — повторные сессии одной точки продаж кладут фото
 * в ту же папку. Две одновременные финализации одной точки могут создать
 * две папки; блокировок тут нет, такой дубль допустим.
 */
@Slf4j
@Component
public class FolderResolver {

    /**
     * @return id папки name внутри parentId
     * @throws AssetStoreException если не удалось ни найти, ни создать
     */
    public String resolve(AssetStore store, String name, String parentId) throws AssetStoreException {
        Optional<String> existing = store.findFolder(name, parentId);
        if (existing.isPresent()) {
            log.info("📁 Папка '{}' найдена: folderId={}", name, existing.get());
            return existing.get();
        }

        String folderId = store.createFolder(name, parentId);
        log.info("✅ Папка '{}' создана: folderId={}", name, folderId);
        return folderId;
    }
}
