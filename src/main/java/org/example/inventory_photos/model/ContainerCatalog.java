package org.example.inventory_photos.model;

import org.example.inventory_photos.exception.InputValidationException;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Коробки, которые показываем кнопками на шаге AWAITING_CONTAINER.
 */
public final class ContainerCatalog {

    /** Две строки по четыре кнопки — как на клавиатуре в чате */
    public static final List<List<String>> KEYBOARD_ROWS = List.of(
            List.of("CAJA A", "CAJA B", "CAJA C", "CAJA D"),
            List.of("CAJA E", "CAJA F", "CAJA G", "CAJA H")
    );

    private static final Set<String> CODES = KEYBOARD_ROWS.stream()
            .flatMap(List::stream)
            .map(AssetNaming::normalize)
            .collect(Collectors.toUnmodifiableSet());

    private ContainerCatalog() {
    }

    /**
     * Привести ввод к коду коробки.
     * <p>
     * "caja a" → "CAJA_A". Всё, чего нет на клавиатуре, — ошибка ввода.
     *
     * @throws InputValidationException если такой коробки нет
     */
    public static String normalize(String input) {
        if (input == null || input.isBlank()) {
            throw new InputValidationException("Пустой выбор коробки");
        }
        String code = AssetNaming.normalize(input.trim().replaceAll("\\s+", " "));
        if (!CODES.contains(code)) {
            throw new InputValidationException("Неизвестная коробка: " + input);
        }
        return code;
    }
}
