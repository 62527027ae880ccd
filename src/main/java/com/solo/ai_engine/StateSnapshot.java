package com.solo.ai_engine;

import com.solo.content.ContentRegistry;
import com.solo.content.ItemDefinition;
import com.solo.content.Room;
import com.solo.game_state.Character;
import com.solo.game_state.Companion;
import com.solo.game_state.Enemy;
import com.solo.game_state.GameState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Неизменяемый снимок состояния для рассказчика. Обратно в правила ничего не попадает.
 */
public class StateSnapshot {
    private final String roomName;
    private final String roomKind;
    private final String npc;
    private final String playerName;
    private final String playerRace;
    private final String playerClass;
    private final int playerLevel;
    private final int playerHp;
    private final int playerMaxHp;
    private final String playerStats;
    private final int playerMana;
    private final int playerMaxMana;
    private final int gold;
    private final List<String> companions;
    private final List<String> enemies;
    private final List<String> inventory;
    private final boolean inCombat;
    private final String lastEvent;
    private final List<String> flags;
    private final boolean everyoneAtFullHp;
    private final String leadCompanionName;

    private StateSnapshot(Builder builder) {
        this.roomName = builder.roomName;
        this.roomKind = builder.roomKind;
        this.npc = builder.npc;
        this.playerName = builder.playerName;
        this.playerRace = builder.playerRace;
        this.playerClass = builder.playerClass;
        this.playerLevel = builder.playerLevel;
        this.playerHp = builder.playerHp;
        this.playerMaxHp = builder.playerMaxHp;
        this.playerStats = builder.playerStats;
        this.playerMana = builder.playerMana;
        this.playerMaxMana = builder.playerMaxMana;
        this.gold = builder.gold;
        this.companions = Collections.unmodifiableList(new ArrayList<>(builder.companions));
        this.enemies = Collections.unmodifiableList(new ArrayList<>(builder.enemies));
        this.inventory = Collections.unmodifiableList(new ArrayList<>(builder.inventory));
        this.inCombat = builder.inCombat;
        this.lastEvent = builder.lastEvent;
        this.flags = Collections.unmodifiableList(new ArrayList<>(builder.flags));
        this.everyoneAtFullHp = builder.everyoneAtFullHp;
        this.leadCompanionName = builder.leadCompanionName;
    }

    public static StateSnapshot of(GameState state, ContentRegistry registry) {
        Room room = registry.getRoom(state.getCampaignId(), state.getRoomId());
        Character player = state.getPlayer();
        Builder builder = new Builder();
        builder.roomName = room.getName();
        builder.roomKind = room.getKind().getValue();
        builder.npc = room.getNpc();
        builder.playerName = player.getName();
        builder.playerRace = player.getRace().getValue();
        builder.playerClass = player.getCharacterClass().getValue();
        builder.playerLevel = player.getLevel();
        builder.playerHp = player.getHp();
        builder.playerMaxHp = player.getMaxHp();
        builder.playerStats = player.getStats().toString();
        builder.playerMana = player.getMana();
        builder.playerMaxMana = player.getMaxMana();
        builder.gold = player.getGold();
        boolean fullHp = !player.isWounded();
        for (Companion companion : state.getCompanions()) {
            builder.companions.add(companion.getName() + " HP " + companion.getHp() + "/" + companion.getMaxHp());
            fullHp = fullHp && !companion.isWounded();
        }
        builder.everyoneAtFullHp = fullHp;
        if (state.hasCompanion()) {
            builder.leadCompanionName = state.getActiveCompanion().getName();
        }
        for (Enemy enemy : state.getEnemies()) {
            builder.enemies.add(enemy.getName() + " HP " + enemy.getHp() + "/" + enemy.getMaxHp());
        }
        builder.inventory = state.getInventory().stream().map(ItemDefinition::getName).collect(Collectors.toList());
        builder.inCombat = state.isInCombat();
        builder.lastEvent = state.getLastEvent();
        builder.flags.addAll(state.getFlags().getDefeatedRooms().stream()
            .map(roomId -> "defeated=" + roomId).collect(Collectors.toList()));
        state.getFlags().getProgress().forEach((key, value) -> builder.flags.add(key + "=" + value));
        return new StateSnapshot(builder);
    }

    public String getRoomName() { return roomName; }
    public String getRoomKind() { return roomKind; }
    public String getNpc() { return npc; }
    public String getPlayerName() { return playerName; }
    public String getPlayerRace() { return playerRace; }
    public String getPlayerClass() { return playerClass; }
    public int getPlayerLevel() { return playerLevel; }
    public int getPlayerHp() { return playerHp; }
    public int getPlayerMaxHp() { return playerMaxHp; }
    public String getPlayerStats() { return playerStats; }
    public int getPlayerMana() { return playerMana; }
    public int getPlayerMaxMana() { return playerMaxMana; }
    public int getGold() { return gold; }
    public List<String> getCompanions() { return companions; }
    public List<String> getEnemies() { return enemies; }
    public List<String> getInventory() { return inventory; }
    public boolean isInCombat() { return inCombat; }
    public String getLastEvent() { return lastEvent; }
    public List<String> getFlags() { return flags; }
    public boolean isEveryoneAtFullHp() { return everyoneAtFullHp; }

    public String getLeadCompanionName() { return leadCompanionName; }

    private static class Builder {
        private String roomName;
        private String roomKind;
        private String npc;
        private String playerName;
        private String playerRace;
        private String playerClass;
        private int playerLevel;
        private int playerHp;
        private int playerMaxHp;
        private String playerStats;
        private int playerMana;
        private int playerMaxMana;
        private int gold;
        private List<String> companions = new ArrayList<>();
        private List<String> enemies = new ArrayList<>();
        private List<String> inventory = new ArrayList<>();
        private boolean inCombat;
        private String lastEvent;
        private List<String> flags = new ArrayList<>();
        private boolean everyoneAtFullHp;
        private String leadCompanionName = "Your companion";
    }
}
