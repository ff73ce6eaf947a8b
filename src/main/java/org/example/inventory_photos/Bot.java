package org.example.inventory_photos;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.inventory_photos.handler.ConversationDispatcher;
import org.example.inventory_photos.handler.InfoCommandHandler;
import org.example.inventory_photos.handler.InventoryCollectionHandler;
import org.example.inventory_photos.model.BotCommand;
import org.example.inventory_photos.transport.ChatTransport;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.util.List;
import java.util.Optional;

/**
 * Главный класс бота — слушает Telegram (long polling) и раздаёт события обработчикам.
 * <p>
 * Сам ничего не решает:
 * - /help, /health, неизвестные команды → InfoCommandHandler
 * - /start, команды сессии, текст, фото → InventoryCollectionHandler
 * <p>
 * Каждое событие идёт через ConversationDispatcher: события одного чата
 * по очереди, разные чаты — параллельно.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Bot extends TelegramLongPollingBot {

    // Обязательное свойство, значения по умолчанию нет
    @Value("${telegram.bot.token}")
    private String botToken;

    @Value("${telegram.bot.username}")
    private String botUsername;

    private final ConversationDispatcher conversationDispatcher;

    private final InventoryCollectionHandler inventoryCollectionHandler;

    private final InfoCommandHandler infoCommandHandler;

    private final ChatTransport chatTransport;

    @Override
    public void onUpdateReceived(Update update) {
        // Нас интересуют только обычные сообщения (текст / фото)
        if (!update.hasMessage()) {
            return;
        }

        Message message = update.getMessage();
        Long chatId = message.getChatId();
        conversationDispatcher.dispatch(chatId, () -> route(chatId, message));
    }

    private void route(Long chatId, Message message) {
        try {
            if (message.hasPhoto()) {
                inventoryCollectionHandler.handlePhoto(chatId, largestPhotoFileId(message.getPhoto()));
                return;
            }
            if (!message.hasText()) {
                log.debug("Сообщение без текста и фото пропущено: chatId={}", chatId);
                return;
            }

            String text = message.getText();
            Optional<BotCommand> command = BotCommand.parse(text);
            if (command.isPresent()) {
                routeCommand(chatId, message, command.get());
            } else if (BotCommand.looksLikeCommand(text)) {
                infoCommandHandler.unknownCommand(chatId, text);
            } else {
                inventoryCollectionHandler.handleText(chatId, text);
            }

        } catch (Exception e) {
            log.error("Ошибка обработки сообщения: chatId={}", chatId, e);
            chatTransport.sendText(chatId,
                    "❌ Ocurrió un error inesperado. Por favor, intenta nuevamente o contacta al soporte.");
        }
    }

    private void routeCommand(Long chatId, Message message, BotCommand command) {
        switch (command) {
            case BEGIN -> inventoryCollectionHandler.begin(chatId,
                    message.getFrom() != null ? message.getFrom().getFirstName() : null);
            case HELP -> infoCommandHandler.help(chatId);
            case HEALTH -> infoCommandHandler.health(chatId);
            default -> inventoryCollectionHandler.handleCommand(chatId, command);
        }
    }

    /**
     * Telegram присылает одно фото в нескольких размерах — берём самое большое (последнее).
     */
    private String largestPhotoFileId(List<PhotoSize> photos) {
        return photos.get(photos.size() - 1).getFileId();
    }

    @Override
    public String getBotUsername() {
        return botUsername;
    }

    /**
     * Токен бота (из application.properties / переменной BOT_TOKEN).
     */
    @Override
    public String getBotToken() {
        return botToken;
    }
}
