package org.example.inventory_photos.service;

import lombok.RequiredArgsConstructor;
import org.example.inventory_photos.config.InventoryConfig;
import org.example.inventory_photos.model.PhotoRef;
import org.example.inventory_photos.model.Session;
import org.example.inventory_photos.model.SubItemCatalog;
import org.example.inventory_photos.model.UploadReport;
import org.example.inventory_photos.transport.ChatTransport;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Тексты про загрузку: сводка перед стартом, "Subiendo foto k/N", итоговый отчёт.
 * <p>
 * Состояния нет — всё считается из Session / UploadReport.
 */
@Component
@RequiredArgsConstructor
public class ProgressReporter {

    private final ChatTransport chatTransport;
    private final InventoryConfig inventoryConfig;

    /**
     * Слушатель, который шлёт тексты в конкретный чат.
     */
    public UploadProgressListener forChat(Long chatId) {
        return new UploadProgressListener() {
            @Override
            public void onBatchStarting(Session session, int totalPhotos) {
                chatTransport.sendText(chatId, summaryText(session));
            }

            @Override
            public void onPhotoStarting(int position, int total, String fileName) {
                if (shouldAnnounce(position, total)) {
                    chatTransport.sendText(chatId, progressText(position, total));
                }
            }

            @Override
            public void onBatchCompleted(UploadReport report) {
                chatTransport.sendText(chatId, reportText(report));
            }
        };
    }

    public String summaryText(Session session) {
        StringBuilder perSubItem = new StringBuilder();
        for (Map.Entry<String, List<PhotoRef>> entry : session.getPhotosBySubItem().entrySet()) {
            perSubItem.append("  • ")
                    .append(SubItemCatalog.displayName(entry.getKey()))
                    .append(": ")
                    .append(entry.getValue().size())
                    .append(" foto(s)\n");
        }

        return "📋 RESUMEN DEL PROCESO\n\n" +
                "📍 Punto de venta: " + session.getPointOfSale() + "\n" +
                "📦 Caja: " + session.getContainerCategory() + "\n" +
                "📸 Total de fotos: " + session.totalPhotos() + "\n\n" +
                "🧊 Fotos por acrílico:\n" + perSubItem + "\n" +
                "⏳ Subiendo a Google Drive...";
    }

    /**
     * Писать ли прогресс для этого фото: 1-е, (1+every)-е, … и последнее.
     */
    public boolean shouldAnnounce(int position, int total) {
        int every = inventoryConfig.getProgressEvery();
        if (every <= 0) {
            return false;
        }
        return (position - 1) % every == 0 || position == total;
    }

    public String progressText(int position, int total) {
        return "📤 Subiendo foto " + position + "/" + total + "...";
    }

    public String reportText(UploadReport report) {
        if (report.isAborted()) {
            return "❌ No se pudo conectar con Google Drive. Por favor, contacta al administrador.";
        }
        if (report.total() == 0) {
            return "ℹ️ No se registraron fotos, no hay nada que subir.\n" +
                    "Puedes iniciar nuevamente con /start.";
        }
        if (report.failedCount() == 0) {
            return "🎉 ¡PROCESO COMPLETADO EXITOSAMENTE!\n\n" +
                    "✅ " + report.successCount() + " fotos subidas correctamente\n" +
                    "📁 Revisa tu Google Drive en la carpeta: " + report.folderName() + "\n\n" +
                    "¡Gracias por usar el bot! 😊";
        }
        return "⚠️ PROCESO COMPLETADO CON ADVERTENCIAS\n\n" +
                "✅ " + report.successCount() + " fotos subidas correctamente\n" +
                "❌ " + report.failedCount() + " fotos con errores\n" +
                "📁 Revisa tu Google Drive en la carpeta: " + report.folderName();
    }
}
