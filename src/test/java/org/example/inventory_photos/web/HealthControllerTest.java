package org.example.inventory_photos.web;

import org.example.inventory_photos.service.SessionStore;
import org.example.inventory_photos.storage.AssetStoreFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class HealthControllerTest {

    private SessionStore sessionStore;
    private AssetStoreFactory assetStoreFactory;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        sessionStore = mock(SessionStore.class);
        assetStoreFactory = mock(AssetStoreFactory.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(sessionStore, assetStoreFactory)).build();
    }

    @Test
    void reportsStatusDriveAndSessions() throws Exception {
        when(sessionStore.size()).thenReturn(2);
        when(assetStoreFactory.isConfigured()).thenReturn(true);

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.driveConfigured").value(true))
                .andExpect(jsonPath("$.activeSessions").value(2));
    }

    @Test
    void upEvenWithoutDrive() throws Exception {
        when(assetStoreFactory.isConfigured()).thenReturn(false);

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.driveConfigured").value(false));
    }
}
