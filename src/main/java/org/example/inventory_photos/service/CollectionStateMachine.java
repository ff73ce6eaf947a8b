package org.example.inventory_photos.service;

import lombok.extern.slf4j.Slf4j;
import org.example.inventory_photos.exception.InputValidationException;
import org.example.inventory_photos.exception.PhotoCapacityException;
import org.example.inventory_photos.model.BotCommand;
import org.example.inventory_photos.model.CollectionStage;
import org.example.inventory_photos.model.ContainerCatalog;
import org.example.inventory_photos.model.Reply;
import org.example.inventory_photos.model.Session;
import org.example.inventory_photos.model.SubItemCatalog;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Пошаговый сбор фото: точка продаж → коробка → акрилы → фото.
 * <p>
 * Сам ничего не отправляет и не хранит — получает Session, меняет её
 * и возвращает StepResult (что ответить и что делать с сессией дальше).
 * Отправкой и загрузкой в Drive занимается InventoryCollectionHandler.
 * <p>
 * Таблица переходов:
 * <pre>
 * AWAITING_POINT_OF_SALE  текст            → AWAITING_CONTAINER
 * AWAITING_CONTAINER      кнопка коробки   → AWAITING_SUB_ITEMS
 * AWAITING_SUB_ITEMS      "1,3,4"          → AWAITING_PHOTOS (первый акрил)
 * AWAITING_PHOTOS         фото             → AWAITING_DECISION
 * AWAITING_DECISION       /Siguiente       → AWAITING_PHOTOS (тот же акрил)
 * AWAITING_DECISION       /Acrilico        → AWAITING_PHOTOS (следующий) или финализация
 * AWAITING_DECISION       /finalizar       → DONE + загрузка
 * любой                   /cancelar        → DONE без загрузки
 * </pre>
 * Ошибка ввода = повторный вопрос на том же шаге, сессия не меняется.
 */
@Slf4j
@Component
public class CollectionStateMachine {

    private static final String DECISION_OPTIONS =
            "Opciones:\n" +
            "• /Siguiente - Enviar otra foto del mismo acrílico\n" +
            "• /Acrilico - Pasar al siguiente acrílico\n" +
            "• /finalizar - Guardar todo en Google Drive";

    /**
     * Старт диалога: приветствие и вопрос про точку продаж.
     */
    public StepResult begin(Session session, String firstName) {
        session.setStage(CollectionStage.AWAITING_POINT_OF_SALE);
        String name = (firstName == null || firstName.isBlank()) ? "" : " " + firstName;
        return StepResult.stay(Reply.removingKeyboard(
                "¡Hola" + name + "! 👋\n\n" +
                "📍 Ingrese el nombre del punto de venta:"));
    }

    /**
     * Обычный текст от пользователя.
     */
    public StepResult onText(Session session, String text) {
        return switch (session.getStage()) {
            case AWAITING_POINT_OF_SALE -> acceptPointOfSale(session, text);
            case AWAITING_CONTAINER -> acceptContainer(session, text);
            case AWAITING_SUB_ITEMS -> acceptSubItems(session, text);
            case AWAITING_PHOTOS -> StepResult.stay(Reply.text(
                    "📷 Envía una foto del " + session.currentSubItem() + " para continuar."));
            case AWAITING_DECISION -> StepResult.stay(Reply.text(DECISION_OPTIONS));
            case DONE -> finishedSession();
        };
    }

    /**
     * Фото от пользователя (file_id самого большого размера).
     */
    public StepResult onPhoto(Session session, String fileId) {
        return switch (session.getStage()) {
            case AWAITING_PHOTOS -> acceptPhoto(session, fileId);
            case AWAITING_DECISION -> StepResult.stay(Reply.text(
                    "ℹ️ Usa /Siguiente para enviar otra foto del " + session.currentSubItem()
                            + ", /Acrilico para pasar al siguiente acrílico o /finalizar para guardar todo."));
            case DONE -> finishedSession();
            default -> StepResult.stay(
                    Reply.text("⚠️ Todavía no es momento de enviar fotos."),
                    currentPrompt(session));
        };
    }

    /**
     * Команды внутри сессии: /cancelar, /Siguiente, /Acrilico, /finalizar.
     */
    public StepResult onCommand(Session session, BotCommand command) {
        if (!command.isSessionCommand()) {
            throw new IllegalArgumentException("Команда не относится к сессии: " + command);
        }
        if (session.getStage() == CollectionStage.DONE) {
            return finishedSession();
        }
        if (command == BotCommand.CANCEL) {
            log.info("Сессия отменена: chatId={}, stage={}", session.getChatId(), session.getStage());
            session.setStage(CollectionStage.DONE);
            return StepResult.discard(Reply.removingKeyboard(
                    "❌ Proceso cancelado. Puedes iniciar nuevamente con /start."));
        }
        if (session.getStage() != CollectionStage.AWAITING_DECISION) {
            return StepResult.stay(
                    Reply.text("⚠️ Ese comando no está disponible en este paso."),
                    currentPrompt(session));
        }

        return switch (command) {
            case CONTINUE_SAME_CATEGORY -> continueSameSubItem(session);
            case ADVANCE_CATEGORY -> advanceSubItem(session);
            case FINALIZE -> finalizeSession(session);
            default -> throw new IllegalStateException("Необработанная команда: " + command);
        };
    }

    /**
     * Вопрос текущего шага — для повторов после ошибок.
     */
    public Reply currentPrompt(Session session) {
        return switch (session.getStage()) {
            case AWAITING_POINT_OF_SALE -> Reply.text("📍 Ingrese el nombre del punto de venta:");
            case AWAITING_CONTAINER -> containerPrompt();
            case AWAITING_SUB_ITEMS -> subItemsPrompt();
            case AWAITING_PHOTOS -> photosPrompt(session, "📸 Envía las fotos del " + session.currentSubItem()
                    + " (máximo " + Session.MAX_PHOTOS_PER_SUB_ITEM + " fotos).");
            case AWAITING_DECISION -> Reply.text(DECISION_OPTIONS);
            case DONE -> Reply.text("Usa /start para comenzar un nuevo proceso.");
        };
    }

    // ======= ШАГИ =======

    private StepResult acceptPointOfSale(Session session, String text) {
        String pointOfSale = text == null ? "" : text.trim();
        if (pointOfSale.isEmpty()) {
            log.warn("Пустая точка продаж: chatId={}", session.getChatId());
            return StepResult.stay(Reply.text(
                    "⚠️ El nombre del punto de venta no puede estar vacío. Ingréselo nuevamente:"));
        }

        session.setPointOfSale(pointOfSale);
        session.setStage(CollectionStage.AWAITING_CONTAINER);
        log.info("Точка продаж: chatId={}, pointOfSale={}", session.getChatId(), pointOfSale);
        return StepResult.stay(containerPrompt());
    }

    private StepResult acceptContainer(Session session, String text) {
        String container;
        try {
            container = ContainerCatalog.normalize(text);
        } catch (InputValidationException e) {
            log.warn("Неверная коробка: chatId={}, input='{}'", session.getChatId(), text);
            return StepResult.stay(Reply.withChoices(
                    "⚠️ Caja no reconocida. Selecciona una de las opciones:",
                    ContainerCatalog.KEYBOARD_ROWS));
        }

        session.setContainerCategory(container);
        session.setStage(CollectionStage.AWAITING_SUB_ITEMS);
        log.info("Коробка: chatId={}, container={}", session.getChatId(), container);
        return StepResult.stay(subItemsPrompt());
    }

    private StepResult acceptSubItems(Session session, String text) {
        List<String> subItems;
        try {
            subItems = SubItemCatalog.parseSelection(text);
        } catch (InputValidationException e) {
            log.warn("Неверный список акрилов: chatId={}, reason={}", session.getChatId(), e.getMessage());
            return StepResult.stay(Reply.text(
                    "⚠️ Entrada inválida. Por favor, escribe los números de los acrílicos "
                            + "separados por comas (ej: 1,2,3)."));
        }

        session.selectSubItems(subItems);
        session.setStage(CollectionStage.AWAITING_PHOTOS);
        log.info("Акрилы: chatId={}, subItems={}", session.getChatId(), subItems);
        return StepResult.stay(currentPrompt(session));
    }

    private StepResult acceptPhoto(Session session, String fileId) {
        String subItem = session.currentSubItem();
        try {
            session.appendPhoto(fileId);
        } catch (PhotoCapacityException e) {
            log.warn("Лимит фото: chatId={}, subItem={}", session.getChatId(), e.getSubItem());
            session.setStage(CollectionStage.AWAITING_DECISION);
            return StepResult.stay(Reply.text(
                    "⚠️ Ya has enviado el máximo de " + Session.MAX_PHOTOS_PER_SUB_ITEM
                            + " fotos para este acrílico.\n\n" + DECISION_OPTIONS));
        }

        int count = session.currentPhotoCount();
        session.setStage(CollectionStage.AWAITING_DECISION);
        log.info("Фото получено: chatId={}, subItem={}, total={}", session.getChatId(), subItem, count);
        return StepResult.stay(Reply.text(
                "✅ Foto recibida (" + count + "/" + Session.MAX_PHOTOS_PER_SUB_ITEM + " para " + subItem + ").\n\n"
                        + DECISION_OPTIONS));
    }

    private StepResult continueSameSubItem(Session session) {
        if (session.isCurrentSubItemFull()) {
            return StepResult.stay(Reply.text(
                    "🚫 Ya has alcanzado el límite de " + Session.MAX_PHOTOS_PER_SUB_ITEM
                            + " fotos para este acrílico. Usa /Acrilico o /finalizar."));
        }
        session.setStage(CollectionStage.AWAITING_PHOTOS);
        return StepResult.stay(Reply.text(
                "📸 Puedes enviar otra foto del " + session.currentSubItem()
                        + " (" + session.currentPhotoCount() + "/" + Session.MAX_PHOTOS_PER_SUB_ITEM + ")."));
    }

    private StepResult advanceSubItem(Session session) {
        if (!session.hasNextSubItem()) {
            // Последний акрил — финализируем сразу, без лишнего нажатия
            log.info("Все акрилы пройдены, автофинализация: chatId={}", session.getChatId());
            session.setStage(CollectionStage.DONE);
            return StepResult.finalizeBatch(Reply.text(
                    "✅ Has completado todos los acrílicos. Finalizando automáticamente..."));
        }

        session.advanceSubItem();
        session.setStage(CollectionStage.AWAITING_PHOTOS);
        log.info("Следующий акрил: chatId={}, subItem={}", session.getChatId(), session.currentSubItem());
        return StepResult.stay(photosPrompt(session, "📸 Ahora envía las fotos del " + session.currentSubItem()
                + " (máx. " + Session.MAX_PHOTOS_PER_SUB_ITEM + ")."));
    }

    private StepResult finalizeSession(Session session) {
        log.info("Финализация: chatId={}, photos={}", session.getChatId(), session.totalPhotos());
        session.setStage(CollectionStage.DONE);
        return StepResult.finalizeBatch();
    }

    private StepResult finishedSession() {
        return StepResult.stay(Reply.text("Este proceso ya terminó. Usa /start para comenzar uno nuevo."));
    }

    // ======= ВОПРОСЫ =======

    private Reply containerPrompt() {
        return Reply.withChoices("📦 Selecciona el tipo de caja:", ContainerCatalog.KEYBOARD_ROWS);
    }

    private Reply subItemsPrompt() {
        return Reply.removingKeyboard(
                "🧊 Selecciona los acrílicos (escribe los números separados por comas, ej: 1,2,4):\n\n"
                        + SubItemCatalog.menuText());
    }

    private Reply photosPrompt(Session session, String header) {
        return Reply.text(header + "\n\n📊 Progreso: Acrílico "
                + (session.getCurrentSubItemIndex() + 1) + " de " + session.getSubItems().size());
    }
}
