package org.example.inventory_photos.handler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.inventory_photos.model.BotCommand;
import org.example.inventory_photos.model.Reply;
import org.example.inventory_photos.model.Session;
import org.example.inventory_photos.model.UploadReport;
import org.example.inventory_photos.service.CollectionStateMachine;
import org.example.inventory_photos.service.ProgressReporter;
import org.example.inventory_photos.service.SessionStore;
import org.example.inventory_photos.service.StepResult;
import org.example.inventory_photos.service.UploadPipeline;
import org.example.inventory_photos.transport.ChatTransport;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Обработчик диалога сбора фото.
 * <p>
 * Достаёт сессию чата, отдаёт событие в CollectionStateMachine,
 * отправляет ответы и выполняет эффект шага:
 * - FINALIZE → UploadPipeline, потом сессию удаляем;
 * - DISCARD  → просто удаляем сессию.
 * <p>
 * События одного чата сюда приходят строго по очереди (см. ConversationDispatcher).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InventoryCollectionHandler {

    private final SessionStore sessionStore;
    private final CollectionStateMachine stateMachine;
    private final UploadPipeline uploadPipeline;
    private final ProgressReporter progressReporter;
    private final ChatTransport chatTransport;

    /**
     * /start — новая сессия (незаконченная старая выкидывается).
     */
    public void begin(Long chatId, String firstName) {
        log.info("Начало сбора фото: chatId={}", chatId);
        Session session = sessionStore.start(chatId);
        apply(session, stateMachine.begin(session, firstName));
    }

    public void handleText(Long chatId, String text) {
        Optional<Session> session = activeSession(chatId);
        session.ifPresent(s -> apply(s, stateMachine.onText(s, text)));
    }

    public void handlePhoto(Long chatId, String fileId) {
        Optional<Session> session = activeSession(chatId);
        session.ifPresent(s -> apply(s, stateMachine.onPhoto(s, fileId)));
    }

    public void handleCommand(Long chatId, BotCommand command) {
        Optional<Session> session = sessionStore.find(chatId);
        if (session.isEmpty()) {
            if (command == BotCommand.CANCEL) {
                chatTransport.send(chatId, Reply.removingKeyboard("No hay ningún proceso activo. Usa /start para comenzar."));
            } else {
                sendNoSessionHint(chatId);
            }
            return;
        }
        sessionStore.touch(session.get());
        apply(session.get(), stateMachine.onCommand(session.get(), command));
    }

    private Optional<Session> activeSession(Long chatId) {
        Optional<Session> session = sessionStore.find(chatId);
        if (session.isEmpty()) {
            sendNoSessionHint(chatId);
            return Optional.empty();
        }
        sessionStore.touch(session.get());
        return session;
    }

    private void apply(Session session, StepResult result) {
        Long chatId = session.getChatId();
        for (Reply reply : result.replies()) {
            chatTransport.send(chatId, reply);
        }

        switch (result.effect()) {
            case FINALIZE -> {
                try {
                    UploadReport report = uploadPipeline.upload(session, progressReporter.forChat(chatId));
                    log.info("Финализация завершена: chatId={}, success={}, failed={}, aborted={}",
                            chatId, report.successCount(), report.failedCount(), report.isAborted());
                } finally {
                    sessionStore.discard(chatId);
                }
            }
            case DISCARD -> sessionStore.discard(chatId);
            case NONE -> {
            }
        }
    }

    private void sendNoSessionHint(Long chatId) {
        chatTransport.sendText(chatId, "👋 Usa /start para iniciar el registro de fotos.");
    }
}
