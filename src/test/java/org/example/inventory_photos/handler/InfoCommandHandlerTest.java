package org.example.inventory_photos.handler;

import org.example.inventory_photos.service.SessionStore;
import org.example.inventory_photos.storage.AssetStoreFactory;
import org.example.inventory_photos.transport.ChatTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InfoCommandHandlerTest {

    private ChatTransport chatTransport;
    private AssetStoreFactory assetStoreFactory;
    private SessionStore sessionStore;
    private InfoCommandHandler handler;

    @BeforeEach
    void setUp() {
        chatTransport = mock(ChatTransport.class);
        assetStoreFactory = mock(AssetStoreFactory.class);
        sessionStore = mock(SessionStore.class);
        handler = new InfoCommandHandler(chatTransport, assetStoreFactory, sessionStore);
    }

    @Test
    void helpListsCommands() {
        handler.help(5L);

        verify(chatTransport).sendText(5L, InfoCommandHandler.HELP_TEXT);
        assertTrue(InfoCommandHandler.HELP_TEXT.contains("/finalizar"));
        assertTrue(InfoCommandHandler.HELP_TEXT.contains("/cancelar"));
    }

    @Test
    void healthShowsDriveStateAndActiveSessions() {
        when(assetStoreFactory.isConfigured()).thenReturn(false);
        when(sessionStore.size()).thenReturn(3);

        handler.health(5L);

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(chatTransport).sendText(eq(5L), text.capture());
        assertTrue(text.getValue().contains("Sin configurar"));
        assertTrue(text.getValue().contains("Procesos activos: 3"));
    }

    @Test
    void unknownCommandPointsToHelp() {
        handler.unknownCommand(5L, "/borrar");

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(chatTransport).sendText(eq(5L), text.capture());
        assertTrue(text.getValue().contains("/help"));
    }
}
