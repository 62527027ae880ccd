package com.solo.game_state;

import com.solo.content.EquipmentSlot;
import com.solo.content.ItemDefinition;

import java.util.*;

/**
 * Состояние текущей игры: агрегат всех изменяемых данных партии и кампании
 */
public class GameState {
    public static final int SAVE_VERSION = 2;
    public static final int DEFAULT_INVENTORY_LIMIT = 10;
    public static final int RESPONSE_LOG_WINDOW = 50;

    private int version = SAVE_VERSION;
    private String sessionId = "";
    private String campaignId;
    private Character player;
    private List<Companion> companions = new ArrayList<>();
    private String roomId;
    private List<String> visited = new ArrayList<>();
    private List<ItemDefinition> inventory = new ArrayList<>();
    private Map<String, ItemDefinition> equipment = emptyEquipment();
    private int inventoryLimit = DEFAULT_INVENTORY_LIMIT;
    private boolean inCombat;
    private List<Enemy> enemies = new ArrayList<>();
    private int turn;
    private List<String> turnLog = new ArrayList<>();
    private String lastEvent = "";
    private String lastPlayerInput = "";
    private List<NarrationEntry> responseLog = new ArrayList<>();
    private boolean playerDefending;
    private boolean companionDefending;
    private boolean gameOver;
    private int restStreak;
    private List<PendingDecision> pendingDecisions = new ArrayList<>();
    private CampaignFlags flags = new CampaignFlags();

    public GameState() {
    }

    public GameState(String campaignId, Character player, List<Companion> companions, String roomId) {
        this.campaignId = campaignId;
        this.player = player;
        this.companions = new ArrayList<>(companions);
        this.roomId = roomId;
    }

    public static Map<String, ItemDefinition> emptyEquipment() {
        Map<String, ItemDefinition> slots = new LinkedHashMap<>();
        for (EquipmentSlot slot : EquipmentSlot.values()) {
            slots.put(slot.getValue(), null);
        }
        return slots;
    }

    /**
     * Активный спутник: единственный, кто действует в бою и является целью врагов.
     * Остальные спутники только сопровождают партию.
     */
    public Companion getActiveCompanion() {
        if (companions == null || companions.isEmpty()) {
            throw new IllegalStateException("Party has no companion");
        }
        return companions.get(0);
    }

    public boolean hasCompanion() {
        return companions != null && !companions.isEmpty();
    }

    public List<Enemy> livingEnemies() {
        List<Enemy> alive = new ArrayList<>();
        for (Enemy enemy : getEnemies()) {
            if (enemy.getHp() > 0) {
                alive.add(enemy);
            }
        }
        return alive;
    }

    public void markVisited(String room) {
        if (!getVisited().contains(room)) {
            getVisited().add(room);
        }
    }

    /**
     * Гарантирует наличие всех шести слотов экипировки
     */
    public void normalizeEquipment() {
        Map<String, ItemDefinition> normalized = emptyEquipment();
        if (equipment != null) {
            for (Map.Entry<String, ItemDefinition> entry : equipment.entrySet()) {
                if (normalized.containsKey(entry.getKey())) {
                    normalized.put(entry.getKey(), entry.getValue());
                }
            }
        }
        equipment = normalized;
    }

    public void addNarration(NarrationEntry entry) {
        getResponseLog().add(entry);
        trimResponseLog();
    }

    public void trimResponseLog() {
        List<NarrationEntry> log = getResponseLog();
        if (log.size() > RESPONSE_LOG_WINDOW) {
            responseLog = new ArrayList<>(log.subList(log.size() - RESPONSE_LOG_WINDOW, log.size()));
        }
    }

    // Getters and Setters
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getCampaignId() { return campaignId; }
    public void setCampaignId(String campaignId) { this.campaignId = campaignId; }

    public Character getPlayer() { return player; }
    public void setPlayer(Character player) { this.player = player; }

    public List<Companion> getCompanions() {
        if (companions == null) {
            companions = new ArrayList<>();
        }
        return companions;
    }
    public void setCompanions(List<Companion> companions) { this.companions = new ArrayList<>(companions); }

    public String getRoomId() { return roomId; }
    public void setRoomId(String roomId) { this.roomId = roomId; }

    public List<String> getVisited() {
        if (visited == null) {
            visited = new ArrayList<>();
        }
        return visited;
    }

    public List<ItemDefinition> getInventory() {
        if (inventory == null) {
            inventory = new ArrayList<>();
        }
        return inventory;
    }
    public void setInventory(List<ItemDefinition> inventory) { this.inventory = new ArrayList<>(inventory); }

    public Map<String, ItemDefinition> getEquipment() {
        if (equipment == null) {
            equipment = emptyEquipment();
        }
        return equipment;
    }
    public void setEquipment(Map<String, ItemDefinition> equipment) {
        this.equipment = equipment;
        normalizeEquipment();
    }

    public int getInventoryLimit() { return inventoryLimit; }
    public void setInventoryLimit(int inventoryLimit) { this.inventoryLimit = inventoryLimit; }

    public boolean isInCombat() { return inCombat; }
    public void setInCombat(boolean inCombat) { this.inCombat = inCombat; }

    public List<Enemy> getEnemies() {
        if (enemies == null) {
            enemies = new ArrayList<>();
        }
        return enemies;
    }
    public void setEnemies(List<Enemy> enemies) { this.enemies = new ArrayList<>(enemies); }

    public int getTurn() { return turn; }
    public void setTurn(int turn) { this.turn = turn; }

    public List<String> getTurnLog() {
        if (turnLog == null) {
            turnLog = new ArrayList<>();
        }
        return turnLog;
    }

    public String getLastEvent() { return lastEvent != null ? lastEvent : ""; }
    public void setLastEvent(String lastEvent) { this.lastEvent = lastEvent; }

    public String getLastPlayerInput() { return lastPlayerInput != null ? lastPlayerInput : ""; }
    public void setLastPlayerInput(String lastPlayerInput) { this.lastPlayerInput = lastPlayerInput; }

    public List<NarrationEntry> getResponseLog() {
        if (responseLog == null) {
            responseLog = new ArrayList<>();
        }
        return responseLog;
    }

    public boolean isPlayerDefending() { return playerDefending; }
    public void setPlayerDefending(boolean playerDefending) { this.playerDefending = playerDefending; }

    public boolean isCompanionDefending() { return companionDefending; }
    public void setCompanionDefending(boolean companionDefending) { this.companionDefending = companionDefending; }

    public boolean isGameOver() { return gameOver; }
    public void setGameOver(boolean gameOver) { this.gameOver = gameOver; }

    public int getRestStreak() { return restStreak; }
    public void setRestStreak(int restStreak) { this.restStreak = restStreak; }

    public List<PendingDecision> getPendingDecisions() {
        if (pendingDecisions == null) {
            pendingDecisions = new ArrayList<>();
        }
        return pendingDecisions;
    }

    public CampaignFlags getFlags() {
        if (flags == null) {
            flags = new CampaignFlags();
        }
        return flags;
    }
    public void setFlags(CampaignFlags flags) { this.flags = flags; }
}
