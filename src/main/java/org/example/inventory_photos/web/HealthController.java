package org.example.inventory_photos.web;

import lombok.RequiredArgsConstructor;
import org.example.inventory_photos.service.SessionStore;
import org.example.inventory_photos.storage.AssetStoreFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET /health — для хостинга, который пингует веб-порт, чтобы понять, что процесс жив.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SessionStore sessionStore;
    private final AssetStoreFactory assetStoreFactory;

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("driveConfigured", assetStoreFactory.isConfigured());
        body.put("activeSessions", sessionStore.size());
        return body;
    }
}
