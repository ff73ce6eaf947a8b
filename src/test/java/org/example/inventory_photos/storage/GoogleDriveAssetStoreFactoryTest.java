package org.example.inventory_photos.storage;

import org.example.inventory_photos.config.DriveConfig;
import org.example.inventory_photos.exception.AssetStoreUnavailableException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class GoogleDriveAssetStoreFactoryTest {

    @Test
    void missingCredentialsMakeStoreUnavailable() {
        GoogleDriveAssetStoreFactory factory =
                new GoogleDriveAssetStoreFactory(new DriveConfig("root-id", "", "test"));

        assertFalse(factory.isConfigured());
        assertThrows(AssetStoreUnavailableException.class, factory::open);
    }

    @Test
    void missingRootFolderMakesStoreUnavailable() {
        GoogleDriveAssetStoreFactory factory =
                new GoogleDriveAssetStoreFactory(new DriveConfig("", "e30=", "test"));

        assertFalse(factory.isConfigured());
        assertThrows(AssetStoreUnavailableException.class, factory::open);
    }

    @Test
    void credentialsThatAreNotBase64AreRejected() {
        GoogleDriveAssetStoreFactory factory =
                new GoogleDriveAssetStoreFactory(new DriveConfig("root-id", "not base64 at all!", "test"));

        assertTrue(factory.isConfigured());
        AssetStoreUnavailableException e = assertThrows(AssetStoreUnavailableException.class, factory::open);
        assertTrue(e.getMessage().contains("base64"));
    }

    @Test
    void jsonWithoutServiceAccountTypeIsRejected() {
        String json = Base64.getEncoder().encodeToString("{}".getBytes(StandardCharsets.UTF_8));
        GoogleDriveAssetStoreFactory factory =
                new GoogleDriveAssetStoreFactory(new DriveConfig("root-id", json, "test"));

        assertThrows(AssetStoreUnavailableException.class, factory::open);
    }

    @Test
    void rootFolderComesFromConfig() {
        GoogleDriveAssetStoreFactory factory =
                new GoogleDriveAssetStoreFactory(new DriveConfig("root-id", "", "test"));

        assertEquals("root-id", factory.rootFolderId());
    }
}
