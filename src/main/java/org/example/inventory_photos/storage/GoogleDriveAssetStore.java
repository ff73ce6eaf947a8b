package org.example.inventory_photos.storage;

import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.ByteArrayContent;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.model.File;
import com.google.api.services.drive.model.FileList;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.inventory_photos.exception.AssetStoreException;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * AssetStore поверх Google Drive API v3.
 * <p>
 * Все вызовы с supportsAllDrives — сервисный аккаунт обычно пишет
 * в папку, расшаренную ему из чужого (или общего) диска.
 */
@Slf4j
@RequiredArgsConstructor
public class GoogleDriveAssetStore implements AssetStore {

    static final String FOLDER_MIME_TYPE = "application/vnd.google-apps.folder";

    private final Drive drive;

    @Override
    public Optional<String> findFolder(String name, String parentId) throws AssetStoreException {
        String query = folderQuery(name, parentId);
        try {
            FileList result = drive.files().list()
                    .setQ(query)
                    .setSpaces("drive")
                    .setFields("files(id, name)")
                    .setSupportsAllDrives(true)
                    .setIncludeItemsFromAllDrives(true)
                    .execute();

            List<File> files = result.getFiles();
            if (files == null || files.isEmpty()) {
                return Optional.empty();
            }
            if (files.size() > 1) {
                // Дубли от гонки двух финализаций — берём первую, это допустимо
                log.warn("Найдено несколько папок с одним именем: name={}, parentId={}, count={}",
                        name, parentId, files.size());
            }
            return Optional.of(files.get(0).getId());
        } catch (IOException e) {
            throw translate("поиск папки '" + name + "'", e);
        }
    }

    @Override
    public String createFolder(String name, String parentId) throws AssetStoreException {
        File metadata = new File()
                .setName(name)
                .setMimeType(FOLDER_MIME_TYPE)
                .setParents(List.of(parentId));
        try {
            return drive.files().create(metadata)
                    .setFields("id")
                    .setSupportsAllDrives(true)
                    .execute()
                    .getId();
        } catch (IOException e) {
            throw translate("создание папки '" + name + "'", e);
        }
    }

    @Override
    public String createFile(String name, String parentId, byte[] content, String mimeType)
            throws AssetStoreException {
        File metadata = new File()
                .setName(name)
                .setParents(List.of(parentId));
        try {
            return drive.files().create(metadata, new ByteArrayContent(mimeType, content))
                    .setFields("id")
                    .setSupportsAllDrives(true)
                    .execute()
                    .getId();
        } catch (IOException e) {
            throw translate("загрузка файла '" + name + "'", e);
        }
    }

    /**
     * Запрос Drive: папка с точным именем, прямо в parentId, не в корзине.
     */
    static String folderQuery(String name, String parentId) {
        return "name='" + escape(name) + "'"
                + " and mimeType='" + FOLDER_MIME_TYPE + "'"
                + " and '" + escape(parentId) + "' in parents"
                + " and trashed=false";
    }

    /**
     * Экранировать строку для языка запросов Drive (\ и ').
     */
    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }

    private AssetStoreException translate(String operation, IOException e) {
        if (e instanceof GoogleJsonResponseException) {
            GoogleJsonResponseException response = (GoogleJsonResponseException) e;
            int status = response.getStatusCode();
            AssetStoreException.Kind kind = (status == 401 || status == 403)
                    ? AssetStoreException.Kind.PERMISSION
                    : AssetStoreException.Kind.TRANSIENT;
            String reason = response.getDetails() != null ? response.getDetails().getMessage() : response.getStatusMessage();
            return new AssetStoreException(kind, operation + ": HTTP " + status + " " + reason, e);
        }
        return new AssetStoreException(AssetStoreException.Kind.TRANSIENT, operation + ": " + e.getMessage(), e);
    }
}
