package org.example.inventory_photos.handler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.inventory_photos.service.SessionStore;
import org.example.inventory_photos.storage.AssetStoreFactory;
import org.example.inventory_photos.transport.ChatTransport;
import org.springframework.stereotype.Component;

/**
 * Служебные команды: /help, /health и ответ на неизвестную команду.
 * <p>
 * Работают с сессией и без, сессию не трогают.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InfoCommandHandler {

    static final String HELP_TEXT =
            "🤖 GUÍA DE USO DEL BOT\n\n" +
            "Comandos disponibles:\n" +
            "• /start - Iniciar proceso de subida\n" +
            "• /health - Verificar estado del bot\n" +
            "• /help - Mostrar esta ayuda\n" +
            "• /cancelar - Cancelar proceso actual\n\n" +
            "Durante el proceso:\n" +
            "• /Siguiente - Enviar otra foto del mismo acrílico\n" +
            "• /Acrilico - Cambiar al siguiente acrílico\n" +
            "• /finalizar - Guardar todo en Google Drive\n\n" +
            "Flujo del proceso:\n" +
            "1️⃣ Nombre del punto de venta\n" +
            "2️⃣ Seleccionar tipo de caja\n" +
            "3️⃣ Elegir acrílicos (números separados por comas)\n" +
            "4️⃣ Enviar fotos (máx. 5 por acrílico)\n" +
            "5️⃣ Subida automática a Google Drive\n\n" +
            "¿Necesitas ayuda? Contacta al administrador.";

    private final ChatTransport chatTransport;
    private final AssetStoreFactory assetStoreFactory;
    private final SessionStore sessionStore;

    public void help(Long chatId) {
        chatTransport.sendText(chatId, HELP_TEXT);
    }

    public void health(Long chatId) {
        boolean driveConfigured = assetStoreFactory.isConfigured();
        log.info("/health: chatId={}, driveConfigured={}, activeSessions={}",
                chatId, driveConfigured, sessionStore.size());

        chatTransport.sendText(chatId,
                "🟢 Bot funcionando correctamente!\n\n" +
                "☁️ Google Drive: " + (driveConfigured ? "Configurado" : "⚠️ Sin configurar") + "\n" +
                "👥 Procesos activos: " + sessionStore.size());
    }

    public void unknownCommand(Long chatId, String text) {
        log.debug("Неизвестная команда: chatId={}, text={}", chatId, text);
        chatTransport.sendText(chatId, "❓ Comando no reconocido. Usa /help para ver los comandos disponibles.");
    }
}
