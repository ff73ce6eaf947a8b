package org.example.inventory_photos;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.time.Clock;

@Slf4j
@Configuration
public class Config {

    /**
     * Регистрирует Telegram-бота (long polling) при старте приложения.
     *
     * @param bot — основной Bot
     * @return TelegramBotsApi
     */
    @Bean
    TelegramBotsApi telegramBotsApi(Bot bot) {
        TelegramBotsApi telegramBotsApi;
        try {
            telegramBotsApi = new TelegramBotsApi(DefaultBotSession.class);
            telegramBotsApi.registerBot(bot);
            log.info("🤖 Бот зарегистрирован: @{}", bot.getBotUsername());
        } catch (TelegramApiException e) {
            log.error("КРИТИЧЕСКАЯ ОШИБКА: не удалось зарегистрировать бота в Telegram API", e);
            throw new IllegalStateException("No se pudo registrar el bot de Telegram. Revisa BOT_TOKEN y la conexión.", e);
        }
        return telegramBotsApi;
    }

    /**
     * Часы для времени активности сессий (в тестах подменяются моком).
     */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
