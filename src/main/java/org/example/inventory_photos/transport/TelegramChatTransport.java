package org.example.inventory_photos.transport;

import lombok.extern.slf4j.Slf4j;
import org.example.inventory_photos.Bot;
import org.example.inventory_photos.exception.PhotoDownloadException;
import org.example.inventory_photos.model.Reply;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.telegram.telegrambots.meta.api.methods.GetFile;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.File;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardRemove;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.ArrayList;
import java.util.List;

/**
 * ChatTransport поверх Telegram Bot API.
 * <p>
 * Тексты шлём без parseMode: в названиях точек и файлов полно "_".
 */
@Slf4j
@Component
public class TelegramChatTransport implements ChatTransport {

    // @Lazy — разрываем цикл Bot → handler → transport → Bot
    @Autowired
    @Lazy
    private Bot bot;

    @Value("${telegram.bot.token}")
    private String botToken;

    private final RestTemplate restTemplate = new RestTemplate();

    @Override
    public void send(Long chatId, Reply reply) {
        SendMessage message = new SendMessage();
        message.setChatId(chatId.toString());
        message.setText(reply.text());

        switch (reply.keyboardAction()) {
            case SHOW -> message.setReplyMarkup(buildKeyboard(reply.choices()));
            case REMOVE -> message.setReplyMarkup(new ReplyKeyboardRemove(true));
            case NONE -> {
            }
        }

        try {
            bot.execute(message);
        } catch (TelegramApiException e) {
            log.error("Ошибка отправки сообщения: chatId={}", chatId, e);
        }
    }

    @Override
    public byte[] downloadPhoto(String fileId) throws PhotoDownloadException {
        try {
            // Сначала узнаём путь файла на серверах Telegram, потом качаем по прямой ссылке
            File file = bot.execute(GetFile.builder().fileId(fileId).build());
            byte[] content = restTemplate.getForObject(file.getFileUrl(botToken), byte[].class);
            if (content == null || content.length == 0) {
                throw new PhotoDownloadException("Telegram devolvió un archivo vacío", null);
            }
            return content;
        } catch (TelegramApiException | RestClientException e) {
            throw new PhotoDownloadException("No se pudo descargar la foto de Telegram: " + e.getMessage(), e);
        }
    }

    private ReplyKeyboardMarkup buildKeyboard(List<List<String>> choices) {
        List<KeyboardRow> rows = new ArrayList<>();
        for (List<String> choiceRow : choices) {
            KeyboardRow row = new KeyboardRow();
            for (String choice : choiceRow) {
                row.add(choice);
            }
            rows.add(row);
        }

        ReplyKeyboardMarkup keyboard = new ReplyKeyboardMarkup();
        keyboard.setKeyboard(rows);
        keyboard.setResizeKeyboard(true);
        keyboard.setOneTimeKeyboard(true);
        return keyboard;
    }
}
