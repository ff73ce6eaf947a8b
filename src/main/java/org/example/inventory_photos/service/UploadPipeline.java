package org.example.inventory_photos.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.inventory_photos.config.InventoryConfig;
import org.example.inventory_photos.exception.AssetStoreException;
import org.example.inventory_photos.exception.AssetStoreUnavailableException;
import org.example.inventory_photos.exception.PhotoDownloadException;
import org.example.inventory_photos.model.AssetNaming;
import org.example.inventory_photos.model.PhotoRef;
import org.example.inventory_photos.model.Session;
import org.example.inventory_photos.model.UploadOutcome;
import org.example.inventory_photos.model.UploadReport;
import org.example.inventory_photos.storage.AssetStore;
import org.example.inventory_photos.storage.AssetStoreFactory;
import org.example.inventory_photos.transport.ChatTransport;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Загрузка фото завершённой сессии в хранилище.
 * <p>
 * Правила:
 * 1. Имя файла строится детерминированно: TIENDA_1_CAJA_A_ACRILICO_1_1.jpg
 * 2. Одно фото упало — пишем FAILED и идём дальше, пачку не прерываем
 * 3. На каждое фото ровно один UploadOutcome, в порядке сессии
 *    (акрилы как выбирали, фото как присылали), даже при параллельной загрузке
 * 4. Нет кредов / Drive не поднять — сразу выходим с одним сообщением
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadPipeline {

    private static final int MAX_ERROR_DETAIL_LENGTH = 200;

    private final AssetStoreFactory assetStoreFactory;
    private final FolderResolver folderResolver;
    private final ChatTransport chatTransport;
    private final InventoryConfig inventoryConfig;

    /**
     * Одно запланированное фото. position — номер в пачке, по нему держим порядок.
     */
    record PlannedUpload(int position, String fileName, PhotoRef photo) {
    }

    public UploadReport upload(Session session, UploadProgressListener listener) {
        List<PlannedUpload> plan = plan(session);
        String folderName = AssetNaming.folderName(session.getPointOfSale());
        log.info("Старт загрузки: chatId={}, folder={}, photos={}", session.getChatId(), folderName, plan.size());

        notifyListener("onBatchStarting", () -> listener.onBatchStarting(session, plan.size()));

        UploadReport report;
        if (plan.isEmpty()) {
            report = UploadReport.completed(folderName, List.of());
        } else {
            report = uploadPlan(folderName, plan, listener);
        }

        if (report.isAborted()) {
            log.error("Загрузка прервана: chatId={}, reason={}", session.getChatId(), report.abortReason());
        } else {
            log.info("Загрузка завершена: chatId={}, folder={}, success={}, failed={}",
                    session.getChatId(), folderName, report.successCount(), report.failedCount());
        }
        UploadReport finalReport = report;
        notifyListener("onBatchCompleted", () -> listener.onBatchCompleted(finalReport));
        return report;
    }

    /**
     * Порядок пачки: акрилы в порядке выбора, внутри — фото в порядке получения.
     */
    List<PlannedUpload> plan(Session session) {
        List<PlannedUpload> plan = new ArrayList<>();
        for (Map.Entry<String, List<PhotoRef>> entry : session.getPhotosBySubItem().entrySet()) {
            for (PhotoRef photo : entry.getValue()) {
                String fileName = AssetNaming.fileName(
                        session.getPointOfSale(), session.getContainerCategory(), entry.getKey(), photo.ordinal());
                plan.add(new PlannedUpload(plan.size() + 1, fileName, photo));
            }
        }
        return plan;
    }

    private UploadReport uploadPlan(String folderName, List<PlannedUpload> plan, UploadProgressListener listener) {
        AssetStore store;
        try {
            store = assetStoreFactory.open();
        } catch (AssetStoreUnavailableException e) {
            return UploadReport.aborted(folderName, e.getMessage());
        }

        String folderId;
        try {
            folderId = folderResolver.resolve(store, folderName, assetStoreFactory.rootFolderId());
        } catch (AssetStoreException e) {
            // Без папки грузить некуда: каждое фото — FAILED с одной и той же причиной
            log.error("❌ Ошибка при поиске/создании папки '{}': kind={}", folderName, e.getKind(), e);
            String detail = shorten("carpeta no disponible: " + e.getMessage());
            List<UploadOutcome> outcomes = new ArrayList<>(plan.size());
            for (PlannedUpload upload : plan) {
                outcomes.add(UploadOutcome.failed(upload.fileName(), detail));
            }
            return UploadReport.completed(folderName, outcomes);
        }

        return UploadReport.completed(folderName, transferAll(store, folderId, plan, listener));
    }

    private List<UploadOutcome> transferAll(AssetStore store, String folderId, List<PlannedUpload> plan,
                                            UploadProgressListener listener) {
        int total = plan.size();
        int parallelism = Math.min(inventoryConfig.getUploadParallelism(), total);

        if (parallelism <= 1) {
            List<UploadOutcome> outcomes = new ArrayList<>(total);
            for (PlannedUpload upload : plan) {
                outcomes.add(transfer(store, folderId, upload, total, listener));
            }
            return outcomes;
        }

        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable, "upload-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            // Futures создаём в порядке плана и join'им в том же порядке —
            // порядок outcomes не зависит от того, кто закончил первым
            List<CompletableFuture<UploadOutcome>> futures = new ArrayList<>(total);
            for (PlannedUpload upload : plan) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> transfer(store, folderId, upload, total, listener), executor));
            }
            List<UploadOutcome> outcomes = new ArrayList<>(total);
            for (CompletableFuture<UploadOutcome> future : futures) {
                outcomes.add(future.join());
            }
            return outcomes;
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Скачать фото из чата и положить в папку. Никогда не бросает — любая ошибка = FAILED.
     */
    private UploadOutcome transfer(AssetStore store, String folderId, PlannedUpload upload, int total,
                                   UploadProgressListener listener) {
        String fileName = upload.fileName();
        notifyListener("onPhotoStarting", () -> listener.onPhotoStarting(upload.position(), total, fileName));
        try {
            byte[] content = chatTransport.downloadPhoto(upload.photo().fileId());
            store.createFile(fileName, folderId, content, AssetNaming.MIME_TYPE);

            log.info("✅ Фото загружено: {}", fileName);
            return UploadOutcome.success(fileName);

        } catch (PhotoDownloadException e) {
            log.warn("❌ Не скачали фото из Telegram: fileName={}, reason={}", fileName, e.getMessage());
            return UploadOutcome.failed(fileName, shorten(e.getMessage()));
        } catch (AssetStoreException e) {
            log.warn("❌ Drive не принял фото: fileName={}, kind={}, reason={}", fileName, e.getKind(), e.getMessage());
            return UploadOutcome.failed(fileName, shorten(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("❌ Неожиданная ошибка при загрузке {}", fileName, e);
            return UploadOutcome.failed(fileName, shorten(e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    /**
     * Прогресс не должен влиять на загрузку: ошибку слушателя только логируем.
     */
    private void notifyListener(String event, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Ошибка слушателя прогресса: event={}", event, e);
        }
    }

    private static String shorten(String detail) {
        if (detail == null) {
            return "error desconocido";
        }
        return detail.length() <= MAX_ERROR_DETAIL_LENGTH ? detail : detail.substring(0, MAX_ERROR_DETAIL_LENGTH) + "…";
    }
}
