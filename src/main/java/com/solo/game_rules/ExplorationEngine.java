package com.solo.game_rules;

import com.solo.content.ContentRegistry;
import com.solo.content.ItemDefinition;
import com.solo.content.LootConfig;
import com.solo.content.Room;
import com.solo.content.RoomKind;
import com.solo.content.SocialConfig;
import com.solo.game_state.CorpseRecord;
import com.solo.game_state.GameState;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Исследование: вход в комнату, перемещение и действия, зависящие от типа комнаты
 */
public class ExplorationEngine {
    private static final Set<String> TALK_VERBS = Set.of("talk", "speak", "parley", "approach");
    private static final Set<String> OPEN_VERBS = Set.of("search", "open", "loot", "inspect");
    private static final Set<String> MOVE_VERBS = Set.of("leave", "move", "continue", "go");

    private final ContentRegistry registry;
    private final DiceRoller dice;
    private final EntityFactory entities;
    private final InventoryRules inventory;

    public ExplorationEngine(ContentRegistry registry, DiceRoller dice, EntityFactory entities,
                             InventoryRules inventory) {
        this.registry = registry;
        this.dice = dice;
        this.entities = entities;
        this.inventory = inventory;
    }

    /**
     * Вход в комнату. Непобеждённая боевая комната создаёт врагов и начинает бой.
     */
    public String startRoom(GameState state, Room room) {
        state.markVisited(room.getId());
        if (room.getKind() == RoomKind.COMBAT && !state.getFlags().isRoomDefeated(room.getId())) {
            if (state.getEnemies().isEmpty()) {
                state.setEnemies(entities.createEnemies(state.getCampaignId(), room.getEnemyName()));
            }
            state.setInCombat(true);
            String enemyName = room.getEnemyName() != null ? room.getEnemyName() : "enemies";
            return "A fight breaks out with " + enemyName + ".";
        }
        return room.getDescription();
    }

    /**
     * Выходы комнаты. Комната без карты выходов ведёт к следующей по порядку кампании.
     */
    public Map<String, String> exitsFor(GameState state) {
        Map<String, String> exits = registry.getExits(state.getCampaignId(), state.getRoomId());
        if (exits.isEmpty()) {
            registry.nextRoomId(state.getCampaignId(), state.getRoomId()).ifPresent(next -> {
                exits.put("forward", next);
                exits.put(next, next);
            });
        }
        return exits;
    }

    /**
     * Движение без направления: подсказка с выходами, ход не тратится
     */
    public RuleResult askDestination(GameState state) {
        Map<String, String> exits = exitsFor(state);
        String options = exits.isEmpty() ? "none" : String.join(", ", new TreeSet<>(exits.values()));
        return RuleResult.rejected("Where to? Exits: " + options);
    }

    /**
     * Перемещение по карте выходов: сначала по ключу, затем по id комнаты назначения
     */
    public RuleResult moveTo(GameState state, String destination) {
        Map<String, String> exits = exitsFor(state);
        String key = destination == null ? "" : destination.trim().toLowerCase();
        String target = exits.get(key);
        if (target == null && exits.containsValue(key)) {
            target = key;
        }
        if (target == null) {
            if (exits.isEmpty()) {
                return RuleResult.rejected("There's nowhere to go from here.");
            }
            String options = new TreeSet<>(exits.values()).stream().collect(Collectors.joining(", "));
            return RuleResult.rejected("Can't go that way. Options: " + options + ".");
        }
        state.setRoomId(target);
        return RuleResult.consumed(startRoom(state, registry.getRoom(state.getCampaignId(), target)));
    }

    /**
     * Действие вне боя в текущей комнате
     */
    public RuleResult act(GameState state, String verb, String argument) {
        Room room = registry.getRoom(state.getCampaignId(), state.getRoomId());
        String action = verb == null ? "" : verb.toLowerCase();
        String token = argument == null ? "" : argument.trim().toLowerCase();
        return switch (room.getKind()) {
            case SOCIAL -> social(state, room, action);
            case LOOT -> lootRoom(state, room, action);
            case COMBAT -> combatRoom(state, room, action, token);
            case PASSAGE -> passage(room, action);
        };
    }

    private RuleResult social(GameState state, Room room, String action) {
        if (TALK_VERBS.contains(action)) {
            SocialConfig config = room.getSocial();
            if (config == null) {
                String npc = room.getNpc() != null ? room.getNpc() : "Someone";
                return RuleResult.consumed(npc + " has nothing to say.");
            }
            DiceRoller.CheckResult check = dice.check(state.getPlayer().getStat(config.getStat()), config.getDc());
            state.getFlags().set(config.getDoneFlag());
            if (check.isSuccess()) {
                if (config.getSuccessFlag() != null) {
                    state.getFlags().set(config.getSuccessFlag());
                }
                return RuleResult.consumed(config.getSuccessMsg() != null
                    ? formatCheck(config.getSuccessMsg(), check)
                    : "You succeed (roll " + check.getRoll() + " -> " + check.getTotal() + ").");
            }
            return RuleResult.consumed(config.getFailMsg() != null
                ? formatCheck(config.getFailMsg(), check)
                : "You fail (roll " + check.getRoll() + " -> " + check.getTotal() + ").");
        }
        if (MOVE_VERBS.contains(action)) {
            return RuleResult.consumed("You prepare to move on.");
        }
        String npc = room.getNpc() != null ? room.getNpc() : "Someone";
        return RuleResult.consumed(npc + " waits, watching for your move.");
    }

    private RuleResult lootRoom(GameState state, Room room, String action) {
        if (OPEN_VERBS.contains(action)) {
            if (state.getFlags().isContainerLooted(room.getId())) {
                return RuleResult.consumed("The chest is already open and empty.");
            }
            LootConfig config = room.getLootConfig();
            DiceRoller.CheckResult check = dice.check(state.getPlayer().getStat(config.getStat()), config.getDc());
            if (check.isSuccess()) {
                String winItemId = config.getWinItemId() != null ? config.getWinItemId() : room.getLoot();
                state.getFlags().markContainerLooted(room.getId());
                if (winItemId != null) {
                    ItemDefinition item = registry.itemFromId(state.getCampaignId(), winItemId);
                    RuleResult added = InventoryRules.add(state, item);
                    if (!added.isConsumed()) {
                        return RuleResult.consumed("You force the lock (roll " + check.getRoll() + " -> "
                            + check.getTotal() + ") but inventory is full.");
                    }
                }
                if (config.isGameOver()) {
                    state.setGameOver(true);
                }
                return RuleResult.consumed(config.getSuccessMsg() != null
                    ? formatCheck(config.getSuccessMsg(), check)
                    : "You work the lock free (roll " + check.getRoll() + " -> " + check.getTotal() + ").");
            }
            state.getFlags().set(room.getId() + "_lock_failed");
            return RuleResult.consumed(config.getFailMsg() != null
                ? formatCheck(config.getFailMsg(), check)
                : "Your tools slip (roll " + check.getRoll() + " -> " + check.getTotal() + "). The lock resists for now.");
        }
        if (MOVE_VERBS.contains(action)) {
            return RuleResult.consumed("There's nowhere left to go but the chest.");
        }
        return RuleResult.consumed("Wind whistles through the spire. The chest waits.");
    }

    private RuleResult combatRoom(GameState state, Room room, String action, String token) {
        if (!state.getFlags().isRoomDefeated(room.getId())) {
            return RuleResult.consumed("The enemy blocks your way, ready to strike.");
        }
        if ("loot".equals(action)) {
            return lootCorpses(state, room, token);
        }
        if ("search".equals(action) || "inspect".equals(action)) {
            return RuleResult.consumed("You search the " + room.getName().toLowerCase()
                + ". Most supplies are rotted or picked clean.");
        }
        return RuleResult.consumed("The room falls silent after the fight.");
    }

    /**
     * loot [номер|all|имя]: номер считается среди ещё не обысканных трупов
     */
    public RuleResult lootCorpses(GameState state, Room room, String token) {
        List<CorpseRecord> records = state.getFlags().corpsesIn(room.getId());
        if (records.isEmpty()) {
            return RuleResult.rejected("Nothing here to loot.");
        }
        List<CorpseRecord> selected = records.stream().filter(record -> !record.isLooted()).collect(Collectors.toList());
        if (selected.isEmpty()) {
            return RuleResult.rejected("You already searched the corpses.");
        }
        if (!token.isEmpty() && token.chars().allMatch(java.lang.Character::isDigit)) {
            int idx = Integer.parseInt(token) - 1;
            if (idx < 0 || idx >= selected.size()) {
                return RuleResult.rejected("That corpse does not exist.");
            }
            selected = List.of(selected.get(idx));
        } else if (!token.isEmpty() && !"all".equals(token)) {
            List<CorpseRecord> matches = selected.stream()
                .filter(record -> record.getName().toLowerCase().contains(token))
                .collect(Collectors.toList());
            if (matches.isEmpty()) {
                return RuleResult.rejected("No such corpse.");
            }
            if (matches.size() > 1) {
                return RuleResult.rejected("Be more specific.");
            }
            selected = matches;
        } else if (token.isEmpty() && selected.size() > 1) {
            return RuleResult.rejected("Multiple corpses here. Use 'loot <number>' or 'loot all'.");
        }

        int totalGold = 0;
        List<String> itemTexts = new ArrayList<>();
        for (CorpseRecord record : selected) {
            InventoryRules.LootRoll roll = inventory.rollLoot(state.getCampaignId(), record.getName());
            totalGold += roll.getGold();
            if (roll.getItemId() != null) {
                ItemDefinition item = registry.itemFromId(state.getCampaignId(), roll.getItemId());
                RuleResult added = InventoryRules.add(state, item);
                if (added.isConsumed()) {
                    itemTexts.add("You find " + item.getName() + ".");
                } else {
                    itemTexts.add("You spot " + item.getName() + ", but " + added.getMessage().toLowerCase());
                }
            }
            record.setLooted(true);
        }
        state.getPlayer().setGold(state.getPlayer().getGold() + totalGold);
        if (totalGold == 0 && itemTexts.isEmpty()) {
            return RuleResult.consumed("You search the corpse but find nothing.");
        }
        String itemText = itemTexts.isEmpty() ? "" : " " + String.join(" ", itemTexts);
        return RuleResult.consumed("You loot the corpse and gain " + totalGold + " gold." + itemText);
    }

    private RuleResult passage(Room room, String action) {
        if ("search".equals(action) || "inspect".equals(action) || "look".equals(action)) {
            return RuleResult.consumed(room.getDescription());
        }
        return RuleResult.consumed("You press onward.");
    }

    private static String formatCheck(String template, DiceRoller.CheckResult check) {
        return template
            .replace("{roll}", String.valueOf(check.getRoll()))
            .replace("{total}", String.valueOf(check.getTotal()));
    }
}
