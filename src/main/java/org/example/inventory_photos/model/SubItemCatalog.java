package org.example.inventory_photos.model;

import org.example.inventory_photos.exception.InputValidationException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Каталог акрилов: закрытый набор из 9 штук, ACRILICO_1 … ACRILICO_9.
 */
public final class SubItemCatalog {

    public static final int MIN_INDEX = 1;
    public static final int MAX_INDEX = 9;

    private static final String PREFIX = "ACRILICO";

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private SubItemCatalog() {
    }

    /**
     * Каноническое имя акрила по номеру: 3 → ACRILICO_3.
     */
    public static String nameOf(int index) {
        if (index < MIN_INDEX || index > MAX_INDEX) {
            throw new IllegalArgumentException("Номер акрила вне каталога: " + index);
        }
        return PREFIX + "_" + index;
    }

    /**
     * Как показываем пользователю: ACRILICO_3 → "ACRILICO 3".
     */
    public static String displayName(String subItem) {
        return subItem.replace('_', ' ');
    }

    /**
     * Разобрать ответ вида "1, 3,4".
     * <p>
     * Правила:
     * - любой кусок, который не число (включая пустой), — ошибка всего ввода;
     * - номера вне 1..9 молча выкидываем;
     * - повторы выкидываем, порядок первого появления сохраняем;
     * - если ничего не осталось — ошибка.
     *
     * @return канонические имена акрилов в порядке ввода
     * @throws InputValidationException если ввод не разобрать или пусто после фильтра
     */
    public static List<String> parseSelection(String input) {
        if (input == null || input.isBlank()) {
            throw new InputValidationException("Пустой список акрилов");
        }

        Set<Integer> indices = new LinkedHashSet<>();
        // limit -1: хвостовая запятая даёт пустой кусок, а пустой кусок — ошибка
        for (String rawToken : input.trim().split(",", -1)) {
            String token = rawToken.trim();
            if (!INTEGER.matcher(token).matches()) {
                throw new InputValidationException("Не число в списке акрилов: '" + token + "'");
            }
            int index;
            try {
                index = Integer.parseInt(token);
            } catch (NumberFormatException e) {
                // не влезло в int — заведомо вне 1..9
                continue;
            }
            if (index >= MIN_INDEX && index <= MAX_INDEX) {
                indices.add(index);
            }
        }

        if (indices.isEmpty()) {
            throw new InputValidationException("Нет ни одного акрила из диапазона 1-9: " + input);
        }

        List<String> names = new ArrayList<>(indices.size());
        for (Integer index : indices) {
            names.add(nameOf(index));
        }
        return names;
    }

    /**
     * Текст со списком акрилов, три строки по три.
     */
    public static String menuText() {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < 3; row++) {
            if (row > 0) {
                sb.append("\n");
            }
            for (int col = 1; col <= 3; col++) {
                if (col > 1) {
                    sb.append(", ");
                }
                sb.append(displayName(nameOf(row * 3 + col)));
            }
        }
        return sb.toString();
    }
}
