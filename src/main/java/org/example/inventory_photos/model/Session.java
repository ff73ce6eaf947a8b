package org.example.inventory_photos.model;

import lombok.Getter;
import lombok.Setter;
import org.example.inventory_photos.exception.PhotoCapacityException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Временные данные одного диалога сбора фото.
 * <p>
 * Живёт в памяти (SessionStore), пока пользователь не нажмёт /finalizar или /cancelar,
 * либо пока сессию не выкинет чистка по простою. В БД ничего не пишем.
 * <p>
 * Инварианты:
 * - ключи photosBySubItem ровно совпадают с subItems (и в том же порядке);
 * - у каждого акрила не больше MAX_PHOTOS_PER_SUB_ITEM фото;
 * - на шагах PHOTOS / DECISION currentSubItemIndex указывает на существующий акрил.
 */
@Getter
public class Session {

    public static final int MAX_PHOTOS_PER_SUB_ITEM = 5;

    private final Long chatId;

    @Setter
    private CollectionStage stage = CollectionStage.AWAITING_POINT_OF_SALE;

    @Setter
    private String pointOfSale;

    @Setter
    private String containerCategory;

    private List<String> subItems = List.of();

    private int currentSubItemIndex;

    // LinkedHashMap — порядок акрилов = порядок загрузки
    private final Map<String, List<PhotoRef>> photosBySubItem = new LinkedHashMap<>();

    // читается из потока чистки сессий
    private volatile Instant lastActivity;

    public Session(Long chatId, Instant createdAt) {
        this.chatId = chatId;
        this.lastActivity = createdAt;
    }

    /**
     * Зафиксировать выбранные акрилы и встать на первый.
     */
    public void selectSubItems(List<String> selected) {
        if (selected.isEmpty()) {
            throw new IllegalArgumentException("Список акрилов не может быть пустым");
        }
        this.subItems = List.copyOf(selected);
        this.photosBySubItem.clear();
        for (String subItem : subItems) {
            photosBySubItem.put(subItem, new ArrayList<>());
        }
        this.currentSubItemIndex = 0;
    }

    public String currentSubItem() {
        return subItems.get(currentSubItemIndex);
    }

    public List<PhotoRef> photosOf(String subItem) {
        List<PhotoRef> photos = photosBySubItem.get(subItem);
        return photos == null ? List.of() : Collections.unmodifiableList(photos);
    }

    public int currentPhotoCount() {
        return photosOf(currentSubItem()).size();
    }

    public boolean isCurrentSubItemFull() {
        return currentPhotoCount() >= MAX_PHOTOS_PER_SUB_ITEM;
    }

    /**
     * Добавить фото к текущему акрилу.
     *
     * @throws PhotoCapacityException если лимит уже набран (список не трогаем)
     */
    public PhotoRef appendPhoto(String fileId) {
        String subItem = currentSubItem();
        List<PhotoRef> photos = photosBySubItem.get(subItem);
        if (photos.size() >= MAX_PHOTOS_PER_SUB_ITEM) {
            throw new PhotoCapacityException(subItem, MAX_PHOTOS_PER_SUB_ITEM);
        }
        PhotoRef ref = new PhotoRef(fileId, photos.size() + 1);
        photos.add(ref);
        return ref;
    }

    public boolean hasNextSubItem() {
        return currentSubItemIndex + 1 < subItems.size();
    }

    public void advanceSubItem() {
        if (!hasNextSubItem()) {
            throw new IllegalStateException("Акрилы закончились: " + currentSubItem() + " последний");
        }
        currentSubItemIndex++;
    }

    public int totalPhotos() {
        return photosBySubItem.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Только для чтения: и карта, и списки фото внутри неё.
     */
    public Map<String, List<PhotoRef>> getPhotosBySubItem() {
        Map<String, List<PhotoRef>> view = new LinkedHashMap<>();
        for (Map.Entry<String, List<PhotoRef>> entry : photosBySubItem.entrySet()) {
            view.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
        }
        return Collections.unmodifiableMap(view);
    }

    public void touch(Instant now) {
        this.lastActivity = now;
    }
}
