package org.example.inventory_photos.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Команды бота.
 * <p>
 * Вместо сравнения строк по всему коду — один закрытый enum.
 * Регистр не важен, хвост "@BotUsername" (в группах) отрезаем.
 */
public enum BotCommand {

    /** Начать сбор заново */
    BEGIN("/start"),

    /** Выкинуть текущую сессию */
    CANCEL("/cancelar", "/cancel"),

    /** Ещё одно фото того же акрила */
    CONTINUE_SAME_CATEGORY("/siguiente"),

    /** Перейти к следующему акрилу (на последнем — сразу финализация) */
    ADVANCE_CATEGORY("/acrilico", "/acrílico"),

    /** Загрузить всё в Drive и закончить */
    FINALIZE("/finalizar"),

    HELP("/help", "/ayuda"),

    HEALTH("/health");

    private final List<String> spellings;

    BotCommand(String... spellings) {
        this.spellings = List.of(spellings);
    }

    /**
     * Команды, которые работают внутри сессии и идут через CollectionStateMachine.
     * HELP / HEALTH / BEGIN обрабатываются отдельно.
     */
    public boolean isSessionCommand() {
        return this == CANCEL || this == CONTINUE_SAME_CATEGORY
                || this == ADVANCE_CATEGORY || this == FINALIZE;
    }

    /**
     * Похоже ли сообщение на команду вообще (начинается с "/").
     */
    public static boolean looksLikeCommand(String text) {
        return text != null && text.trim().startsWith("/");
    }

    /**
     * Распознать команду в тексте.
     *
     * @return команда или empty, если это обычный текст или неизвестная команда
     */
    public static Optional<BotCommand> parse(String text) {
        if (!looksLikeCommand(text)) {
            return Optional.empty();
        }
        String token = text.trim().split("\\s+", 2)[0];
        int at = token.indexOf('@');
        if (at > 0) {
            token = token.substring(0, at);
        }
        String normalized = token.toLowerCase(Locale.ROOT);
        for (BotCommand command : values()) {
            if (command.spellings.contains(normalized)) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}
