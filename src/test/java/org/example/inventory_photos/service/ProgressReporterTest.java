package org.example.inventory_photos.service;

import org.example.inventory_photos.config.InventoryConfig;
import org.example.inventory_photos.model.Session;
import org.example.inventory_photos.model.UploadOutcome;
import org.example.inventory_photos.model.UploadReport;
import org.example.inventory_photos.transport.ChatTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ProgressReporterTest {

    private ChatTransport chatTransport;
    private ProgressReporter reporter;

    @BeforeEach
    void setUp() {
        chatTransport = mock(ChatTransport.class);
        reporter = new ProgressReporter(chatTransport, new InventoryConfig(1, 3, "PT2H"));
    }

    @Test
    @DisplayName("progress for 1st, 4th, 7th and last photo")
    void announcesEveryThirdAndLast() {
        List<Integer> announced = IntStream.rangeClosed(1, 8)
                .filter(position -> reporter.shouldAnnounce(position, 8))
                .boxed()
                .collect(Collectors.toList());

        assertEquals(List.of(1, 4, 7, 8), announced);
    }

    @Test
    void zeroCadenceDisablesProgress() {
        ProgressReporter silent = new ProgressReporter(chatTransport, new InventoryConfig(1, 0, "PT2H"));

        assertFalse(silent.shouldAnnounce(1, 5));
        assertFalse(silent.shouldAnnounce(5, 5));
    }

    @Test
    void summaryListsPhotosPerSubItem() {
        Session session = new Session(1L, Instant.EPOCH);
        session.setPointOfSale("Tienda 1");
        session.setContainerCategory("CAJA_A");
        session.selectSubItems(List.of("ACRILICO_1", "ACRILICO_3"));
        session.appendPhoto("a");
        session.appendPhoto("b");

        String summary = reporter.summaryText(session);

        assertTrue(summary.contains("📍 Punto de venta: Tienda 1"));
        assertTrue(summary.contains("📸 Total de fotos: 2"));
        assertTrue(summary.contains("• ACRILICO 1: 2 foto(s)"));
        assertTrue(summary.contains("• ACRILICO 3: 0 foto(s)"));
    }

    @Test
    void reportTexts() {
        UploadReport allOk = UploadReport.completed("TIENDA_1",
                List.of(UploadOutcome.success("a.jpg"), UploadOutcome.success("b.jpg")));
        UploadReport partial = UploadReport.completed("TIENDA_1",
                List.of(UploadOutcome.success("a.jpg"), UploadOutcome.failed("b.jpg", "HTTP 500")));

        assertTrue(reporter.reportText(allOk).contains("✅ 2 fotos subidas correctamente"));
        assertTrue(reporter.reportText(allOk).contains("TIENDA_1"));
        assertTrue(reporter.reportText(partial).startsWith("⚠️ PROCESO COMPLETADO CON ADVERTENCIAS"));
        assertTrue(reporter.reportText(partial).contains("❌ 1 fotos con errores"));
        assertTrue(reporter.reportText(UploadReport.aborted("TIENDA_1", "sin credenciales"))
                .contains("No se pudo conectar con Google Drive"));
        assertTrue(reporter.reportText(UploadReport.completed("TIENDA_1", List.of()))
                .contains("No se registraron fotos"));
    }

    @Test
    void chatListenerSendsSummaryProgressAndReport() {
        Session session = new Session(9L, Instant.EPOCH);
        session.setPointOfSale("Tienda 1");
        session.setContainerCategory("CAJA_A");
        session.selectSubItems(List.of("ACRILICO_1"));
        session.appendPhoto("a");
        session.appendPhoto("b");
        UploadProgressListener listener = reporter.forChat(9L);

        listener.onBatchStarting(session, 2);
        listener.onPhotoStarting(1, 2, "x_1.jpg");
        listener.onPhotoStarting(2, 2, "x_2.jpg");
        listener.onBatchCompleted(UploadReport.completed("TIENDA_1",
                List.of(UploadOutcome.success("x_1.jpg"), UploadOutcome.success("x_2.jpg"))));

        ArgumentCaptor<String> texts = ArgumentCaptor.forClass(String.class);
        verify(chatTransport, times(4)).sendText(eq(9L), texts.capture());
        assertTrue(texts.getAllValues().get(0).startsWith("📋 RESUMEN DEL PROCESO"));
        assertEquals("📤 Subiendo foto 1/2...", texts.getAllValues().get(1));
        assertEquals("📤 Subiendo foto 2/2...", texts.getAllValues().get(2));
        assertTrue(texts.getAllValues().get(3).startsWith("🎉"));
    }

    @Test
    void listenerSkipsQuietPositions() {
        UploadProgressListener listener = reporter.forChat(9L);

        listener.onPhotoStarting(2, 8, "x_2.jpg");

        verify(chatTransport, never()).sendText(eq(9L), anyString());
    }
}
