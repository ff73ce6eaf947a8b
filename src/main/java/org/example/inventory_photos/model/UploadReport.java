package org.example.inventory_photos.model;

import java.util.List;

/**
 * Итоговый отчёт одной финализации.
 * <p>
 * Два варианта:
 * - обычный — outcomes по одному на каждое фото, в порядке сессии;
 * - прерванный (abortReason != null) — Drive недоступен вообще, outcomes пустые.
 *
 * @param folderName  имя папки точки продаж в Drive
 * @param outcomes    результаты по каждому фото
 * @param abortReason почему не начали загрузку (нет/битые креды), иначе null
 */
public record UploadReport(String folderName, List<UploadOutcome> outcomes, String abortReason) {

    public UploadReport {
        outcomes = List.copyOf(outcomes);
    }

    public static UploadReport completed(String folderName, List<UploadOutcome> outcomes) {
        return new UploadReport(folderName, outcomes, null);
    }

    public static UploadReport aborted(String folderName, String abortReason) {
        return new UploadReport(folderName, List.of(), abortReason);
    }

    public boolean isAborted() {
        return abortReason != null;
    }

    public int total() {
        return outcomes.size();
    }

    public long successCount() {
        return outcomes.stream().filter(UploadOutcome::isSuccess).count();
    }

    public long failedCount() {
        return outcomes.size() - successCount();
    }
}
