package org.example.inventory_photos.model;

import java.util.Locale;

/**
 * Правила имён в Drive.
 * <p>
 * Формат менять нельзя — по нему уже разложен старый архив:
 * {POINT_OF_SALE}_{CONTAINER}_{SUBITEM}_{ordinal}.jpg
 * <p>
 * Пример: "Tienda 1" + "CAJA_A" + "ACRILICO_1" + 2 → TIENDA_1_CAJA_A_ACRILICO_1_2.jpg
 */
public final class AssetNaming {

    public static final String FILE_EXTENSION = ".jpg";
    public static final String MIME_TYPE = "image/jpeg";

    private AssetNaming() {
    }

    /**
     * Верхний регистр + пробелы в подчёркивания.
     */
    public static String normalize(String label) {
        return label.trim().replace(" ", "_").toUpperCase(Locale.ROOT);
    }

    /**
     * Имя папки точки продаж внутри корневой папки.
     */
    public static String folderName(String pointOfSale) {
        return normalize(pointOfSale);
    }

    public static String fileName(String pointOfSale, String container, String subItem, int ordinal) {
        return normalize(pointOfSale) + "_" + normalize(container) + "_" + subItem + "_" + ordinal + FILE_EXTENSION;
    }
}
