package org.example.inventory_photos.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Настройки сбора и загрузки фото.
 * <p>
 * Всё крутится в application.properties, код трогать не нужно.
 */
@Slf4j
@Getter
@Configuration
public class InventoryConfig {

    /**
     * Сколько фото грузим в Drive параллельно за одну финализацию.
     * 1 = строго по очереди.
     */
    private final int uploadParallelism;

    /**
     * Раз в сколько фото писать "Subiendo foto k/N". 0 — не писать.
     */
    private final int progressEvery;

    /**
     * Через сколько простоя выкидываем незаконченную сессию.
     */
    private final Duration sessionIdleTimeout;

    public InventoryConfig(@Value("${inventory.upload.parallelism:1}") int uploadParallelism,
                           @Value("${inventory.upload.progress-every:3}") int progressEvery,
                           @Value("${inventory.session.idle-timeout:PT2H}") String sessionIdleTimeout) {
        if (uploadParallelism < 1) {
            throw new IllegalArgumentException("inventory.upload.parallelism должен быть >= 1: " + uploadParallelism);
        }
        this.uploadParallelism = uploadParallelism;
        this.progressEvery = Math.max(0, progressEvery);
        this.sessionIdleTimeout = Duration.parse(sessionIdleTimeout);
    }

    @PostConstruct
    public void init() {
        log.info("ЗАГРУЗКА: parallelism={}, progressEvery={}, sessionIdleTimeout={}",
                uploadParallelism, progressEvery, sessionIdleTimeout);
    }
}
