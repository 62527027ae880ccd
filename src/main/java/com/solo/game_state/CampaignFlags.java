package com.solo.game_state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Типизированное состояние прохождения кампании: зачищенные комнаты, трупы, открытые сундуки
 * и булевы флаги сюжета (scout_helped, gate_opened, ...).
 */
public class CampaignFlags {
    private List<String> defeatedRooms = new ArrayList<>();
    private Map<String, List<CorpseRecord>> corpses = new LinkedHashMap<>();
    private int nextCorpseId = 1;
    private List<String> lootedContainers = new ArrayList<>();
    private Map<String, Boolean> progress = new LinkedHashMap<>();

    public boolean isRoomDefeated(String roomId) {
        return getDefeatedRooms().contains(roomId);
    }

    /**
     * Отмечает комнату зачищенной; повторный вызов ничего не меняет
     */
    public void markRoomDefeated(String roomId) {
        if (!isRoomDefeated(roomId)) {
            getDefeatedRooms().add(roomId);
        }
    }

    public List<CorpseRecord> corpsesIn(String roomId) {
        List<CorpseRecord> records = getCorpses().get(roomId);
        return records != null ? records : List.of();
    }

    public void putCorpses(String roomId, List<CorpseRecord> records) {
        getCorpses().put(roomId, new ArrayList<>(records));
    }

    public int allocateCorpseId() {
        if (nextCorpseId < 1) {
            nextCorpseId = 1;
        }
        return nextCorpseId++;
    }

    public boolean isContainerLooted(String roomId) {
        return getLootedContainers().contains(roomId);
    }

    public void markContainerLooted(String roomId) {
        if (!isContainerLooted(roomId)) {
            getLootedContainers().add(roomId);
        }
    }

    public boolean isSet(String flag) {
        return Boolean.TRUE.equals(getProgress().get(flag));
    }

    public void set(String flag) {
        getProgress().put(flag, Boolean.TRUE);
    }

    public List<String> getDefeatedRooms() {
        if (defeatedRooms == null) {
            defeatedRooms = new ArrayList<>();
        }
        return defeatedRooms;
    }

    public Map<String, List<CorpseRecord>> getCorpses() {
        if (corpses == null) {
            corpses = new LinkedHashMap<>();
        }
        return corpses;
    }

    public int getNextCorpseId() { return nextCorpseId; }
    public void setNextCorpseId(int nextCorpseId) { this.nextCorpseId = nextCorpseId; }

    public List<String> getLootedContainers() {
        if (lootedContainers == null) {
            lootedContainers = new ArrayList<>();
        }
        return lootedContainers;
    }

    public Map<String, Boolean> getProgress() {
        if (progress == null) {
            progress = new LinkedHashMap<>();
        }
        return progress;
    }
}
