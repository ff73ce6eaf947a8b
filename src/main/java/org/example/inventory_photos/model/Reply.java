package org.example.inventory_photos.model;

import java.util.List;

/**
 * Одно исходящее сообщение бота.
 * <p>
 * Про клавиатуру:
 * - NONE   — клавиатуру не трогаем;
 * - SHOW   — показать кнопки choices (одноразовая reply-клавиатура);
 * - REMOVE — убрать кнопки, которые показывали раньше.
 */
public record Reply(String text, List<List<String>> choices, KeyboardAction keyboardAction) {

    public enum KeyboardAction {
        NONE,
        SHOW,
        REMOVE
    }

    public Reply {
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    public static Reply text(String text) {
        return new Reply(text, List.of(), KeyboardAction.NONE);
    }

    public static Reply withChoices(String text, List<List<String>> choices) {
        return new Reply(text, choices, KeyboardAction.SHOW);
    }

    public static Reply removingKeyboard(String text) {
        return new Reply(text, List.of(), KeyboardAction.REMOVE);
    }
}
