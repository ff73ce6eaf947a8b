package org.example.inventory_photos.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Настройки Google Drive.
 * <p>
 * Креды — JSON ключа сервисного аккаунта, закодированный в base64
 * (чтобы влез в одну переменную окружения на хостинге).
 * <p>
 * Если что-то не задано — бот всё равно стартует, просто каждая финализация
 * закончится сообщением "нет связи с Google Drive".
 */
@Slf4j
@Getter
@Configuration
public class DriveConfig {

    /**
     * ID папки, внутри которой создаются папки точек продаж.
     */
    private final String rootFolderId;

    /**
     * base64(JSON ключа сервисного аккаунта).
     */
    private final String serviceAccountJson;

    private final String applicationName;

    public DriveConfig(@Value("${drive.root-folder-id:}") String rootFolderId,
                       @Value("${drive.service-account-json:}") String serviceAccountJson,
                       @Value("${drive.application-name:inventory-photos-bot}") String applicationName) {
        this.rootFolderId = rootFolderId;
        this.serviceAccountJson = serviceAccountJson;
        this.applicationName = applicationName;
    }

    public boolean hasRootFolder() {
        return rootFolderId != null && !rootFolderId.isBlank();
    }

    public boolean hasCredentials() {
        return serviceAccountJson != null && !serviceAccountJson.isBlank();
    }

    @PostConstruct
    public void init() {
        log.info("===========================================");
        log.info("GOOGLE DRIVE: rootFolderId={}, credentials={}",
                hasRootFolder() ? rootFolderId : "(не задан)",
                hasCredentials() ? "заданы" : "(не заданы)");
        log.info("===========================================");
        if (!hasRootFolder() || !hasCredentials()) {
            log.warn("Google Drive настроен не полностью — загрузка фото работать не будет");
        }
    }
}
