package org.example.inventory_photos.storage;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.DriveScopes;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.GoogleCredentials;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.inventory_photos.config.DriveConfig;
import org.example.inventory_photos.exception.AssetStoreUnavailableException;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.List;

/**
 * Собирает клиент Google Drive из ключа сервисного аккаунта.
 * <p>
 * Клиент создаётся один раз и переиспользуется. На каждый open() токен
 * обновляется (refreshIfExpired): битый ключ = AssetStoreUnavailableException до начала загрузки.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GoogleDriveAssetStoreFactory implements AssetStoreFactory {

    private final DriveConfig driveConfig;

    private GoogleCredentials credentials;
    private Drive drive;

    @Override
    public synchronized AssetStore open() throws AssetStoreUnavailableException {
        if (!driveConfig.hasCredentials()) {
            throw new AssetStoreUnavailableException("Не заданы креды сервисного аккаунта Google Drive");
        }
        if (!driveConfig.hasRootFolder()) {
            throw new AssetStoreUnavailableException("Не задана корневая папка Google Drive");
        }

        if (drive == null) {
            credentials = loadCredentials();
            drive = buildDrive(credentials);
            log.info("✅ Клиент Google Drive создан");
        }

        try {
            credentials.refreshIfExpired();
        } catch (IOException e) {
            log.error("❌ Google не принял креды сервисного аккаунта", e);
            throw new AssetStoreUnavailableException("Google не принял креды сервисного аккаунта", e);
        }
        return new GoogleDriveAssetStore(drive);
    }

    @Override
    public String rootFolderId() {
        return driveConfig.getRootFolderId();
    }

    @Override
    public boolean isConfigured() {
        return driveConfig.hasCredentials() && driveConfig.hasRootFolder();
    }

    private GoogleCredentials loadCredentials() throws AssetStoreUnavailableException {
        byte[] json;
        try {
            json = Base64.getDecoder().decode(driveConfig.getServiceAccountJson().trim());
        } catch (IllegalArgumentException e) {
            throw new AssetStoreUnavailableException("Креды Google Drive не в base64", e);
        }

        try {
            return GoogleCredentials.fromStream(new ByteArrayInputStream(json))
                    .createScoped(List.of(DriveScopes.DRIVE_FILE));
        } catch (IOException e) {
            log.error("❌ Не удалось прочитать ключ сервисного аккаунта", e);
            throw new AssetStoreUnavailableException("Не удалось прочитать ключ сервисного аккаунта", e);
        }
    }

    private Drive buildDrive(GoogleCredentials scoped) throws AssetStoreUnavailableException {
        try {
            return new Drive.Builder(
                    GoogleNetHttpTransport.newTrustedTransport(),
                    GsonFactory.getDefaultInstance(),
                    new HttpCredentialsAdapter(scoped))
                    .setApplicationName(driveConfig.getApplicationName())
                    .build();
        } catch (GeneralSecurityException | IOException e) {
            log.error("❌ Ошибка при создании клиента Google Drive", e);
            throw new AssetStoreUnavailableException("Ошибка при создании клиента Google Drive", e);
        }
    }
}
