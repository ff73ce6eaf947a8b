package org.example.inventory_photos.model;

/**
 * Итог попытки загрузить одно фото.
 * <p>
 * Создаётся только во время финализации, в БД не пишется.
 *
 * @param fileName    имя файла в Drive (TIENDA_1_CAJA_A_ACRILICO_1_1.jpg)
 * @param status      SUCCESS / FAILED
 * @param errorDetail короткая причина ошибки, null для SUCCESS
 */
public record UploadOutcome(String fileName, UploadStatus status, String errorDetail) {

    public static UploadOutcome success(String fileName) {
        return new UploadOutcome(fileName, UploadStatus.SUCCESS, null);
    }

    public static UploadOutcome failed(String fileName, String errorDetail) {
        return new UploadOutcome(fileName, UploadStatus.FAILED, errorDetail);
    }

    public boolean isSuccess() {
        return status == UploadStatus.SUCCESS;
    }
}
