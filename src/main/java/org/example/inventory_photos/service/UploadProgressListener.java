package org.example.inventory_photos.service;

import org.example.inventory_photos.model.Session;
import org.example.inventory_photos.model.UploadReport;

/**
 * События UploadPipeline для показа пользователю.
 * <p>
 * Слушатель только смотрит: ничего не повторяет и на результаты не влияет.
 * onPhotoStarting может прийти из разных потоков, если загрузка параллельная.
 */
public interface UploadProgressListener {

    void onBatchStarting(Session session, int totalPhotos);

    /**
     * @param position номер фото в пачке (с 1)
     */
    void onPhotoStarting(int position, int total, String fileName);

    void onBatchCompleted(UploadReport report);
}
