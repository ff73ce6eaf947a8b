package org.example.inventory_photos.service;

import org.example.inventory_photos.model.Reply;

import java.util.List;

/**
 * Что сделать после одного шага CollectionStateMachine.
 *
 * @param replies сообщения пользователю, по порядку
 * @param effect  что делать с сессией дальше
 */
public record StepResult(List<Reply> replies, Effect effect) {

    public enum Effect {
        /** Сессия живёт дальше */
        NONE,
        /** Запустить UploadPipeline, потом выкинуть сессию */
        FINALIZE,
        /** Выкинуть сессию без загрузки (отмена) */
        DISCARD
    }

    public StepResult {
        replies = List.copyOf(replies);
    }

    public static StepResult stay(Reply... replies) {
        return new StepResult(List.of(replies), Effect.NONE);
    }

    public static StepResult finalizeBatch(Reply... replies) {
        return new StepResult(List.of(replies), Effect.FINALIZE);
    }

    public static StepResult discard(Reply... replies) {
        return new StepResult(List.of(replies), Effect.DISCARD);
    }
}
