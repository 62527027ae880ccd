package com.solo.game_rules;

import com.solo.content.ContentRegistry;
import com.solo.content.EffectType;
import com.solo.content.EquipmentSlot;
import com.solo.content.ItemDefinition;
import com.solo.content.ItemKind;
import com.solo.content.LootTable;
import com.solo.game_state.Combatant;
import com.solo.game_state.Companion;
import com.solo.game_state.GameState;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Инвентарь с ограничением вместимости и шесть слотов экипировки.
 * Квестовые предметы не занимают место.
 */
public class InventoryRules {
    private static final Set<String> SELF_TARGETS = Set.of("me", "self", "player", "you", "myself");
    private static final Set<String> COMPANION_TARGETS = Set.of("companion", "her", "him", "them", "ally");

    private final ContentRegistry registry;
    private final DiceRoller dice;

    public InventoryRules(ContentRegistry registry, DiceRoller dice) {
        this.registry = registry;
        this.dice = dice;
    }

    public static int inventoryUsed(GameState state) {
        int count = 0;
        for (ItemDefinition item : state.getInventory()) {
            if (item.isCountsTowardLimit()) {
                count++;
            }
        }
        return count;
    }

    public static boolean canAdd(GameState state, ItemDefinition item) {
        if (!item.isCountsTowardLimit()) {
            return true;
        }
        return inventoryUsed(state) < state.getInventoryLimit();
    }

    public static RuleResult add(GameState state, ItemDefinition item) {
        if (!canAdd(state, item)) {
            return RuleResult.rejected("Inventory is full.");
        }
        state.getInventory().add(item);
        return RuleResult.consumed("Added " + item.getName() + " to your pack.");
    }

    public static int equipmentAcBonus(GameState state) {
        int bonus = 0;
        for (ItemDefinition item : state.getEquipment().values()) {
            if (item != null) {
                bonus += item.getArmorBonus();
            }
        }
        return bonus;
    }

    /**
     * AC = базовый AC + бонусы надетых предметов
     */
    public static void syncPlayerAc(GameState state) {
        state.getPlayer().setAc(state.getPlayer().getBaseAc() + equipmentAcBonus(state));
    }

    /**
     * Поиск предмета по части имени, id или типу. При нескольких совпадениях возвращается ошибка с перечнем.
     */
    public static ItemLookup find(GameState state, String query, ItemKind kindFilter) {
        String key = query == null ? "" : query.trim().toLowerCase();
        if (key.isEmpty()) {
            return ItemLookup.error("Use what?");
        }
        List<ItemDefinition> matches = new ArrayList<>();
        for (ItemDefinition item : state.getInventory()) {
            ItemKind kind = item.getKind();
            if (kindFilter != null && kind != kindFilter) {
                continue;
            }
            String name = item.getName().toLowerCase();
            String id = item.getId().toLowerCase();
            if (key.equals(id) || name.contains(key)) {
                matches.add(item);
            } else if (kind == ItemKind.POTION && Set.of("potion", "healing", "heal").contains(key)) {
                matches.add(item);
            } else if (kind == ItemKind.ARMOR && Set.of("armor", "armour").contains(key)) {
                matches.add(item);
            }
        }
        if (matches.isEmpty()) {
            return ItemLookup.error("You don't have that.");
        }
        if (matches.size() > 1) {
            // Одинаковые зелья взаимозаменяемы
            boolean identical = matches.stream().map(ItemDefinition::getId).distinct().count() == 1
                && !"unknown".equals(matches.get(0).getId());
            if (identical) {
                return ItemLookup.found(matches.get(0));
            }
            String names = matches.stream().map(ItemDefinition::getName).collect(Collectors.joining(", "));
            return ItemLookup.error("Be more specific or use an item number: " + names);
        }
        return ItemLookup.found(matches.get(0));
    }

    /**
     * Цель лечения: явное указание стороны, иначе тот, у кого меньше доля HP (при равенстве игрок)
     */
    public static Combatant resolveHealTarget(GameState state, String target) {
        String key = target == null ? "" : target.trim().toLowerCase();
        if (!state.hasCompanion() || SELF_TARGETS.contains(key)) {
            return state.getPlayer();
        }
        Companion companion = state.getActiveCompanion();
        if (!key.isEmpty() && (COMPANION_TARGETS.contains(key) || companion.getName().toLowerCase().startsWith(key))) {
            return companion;
        }
        if (!companion.isDown() && companion.hpRatio() < state.getPlayer().hpRatio()) {
            return companion;
        }
        return state.getPlayer();
    }

    public RuleResult useItem(GameState state, String query, String target) {
        ItemLookup lookup = find(state, query, ItemKind.POTION);
        if (lookup.getError() != null) {
            return RuleResult.rejected(lookup.getError());
        }
        ItemDefinition item = lookup.getItem();
        if (item.getEffect() == null || item.getEffect().getType() != EffectType.HEAL) {
            return RuleResult.rejected(item.getName() + " has no usable effect yet.");
        }
        Combatant healTarget = resolveHealTarget(state, target);
        DiceRoller.DiceResult roll = dice.roll(item.getEffect().getDice());
        int healed = healTarget.heal(roll.getTotal());
        state.getInventory().remove(item);
        return RuleResult.consumed("You use " + item.getName() + " on " + healTarget.getName()
            + ", healing " + healed + " (" + roll.getDetail() + ").");
    }

    public RuleResult equip(GameState state, String query) {
        String key = query == null ? "" : query.trim();
        ItemDefinition item;
        if (!key.isEmpty() && key.chars().allMatch(java.lang.Character::isDigit)) {
            int idx = Integer.parseInt(key) - 1;
            if (idx < 0 || idx >= state.getInventory().size()) {
                return RuleResult.rejected("That item number does not exist.");
            }
            item = state.getInventory().get(idx);
            if (item.getKind() != ItemKind.ARMOR) {
                return RuleResult.rejected("That item is not armor.");
            }
        } else {
            ItemLookup lookup = find(state, key, ItemKind.ARMOR);
            if (lookup.getError() != null) {
                String error = "Use what?".equals(lookup.getError()) ? "Equip what?" : lookup.getError();
                return RuleResult.rejected(error);
            }
            item = lookup.getItem();
        }
        EquipmentSlot slot = item.getSlot();
        if (slot == null) {
            return RuleResult.rejected("That armor can't be equipped.");
        }
        ItemDefinition current = state.getEquipment().get(slot.getValue());
        if (current != null) {
            // Снятый предмет возвращается в рюкзак, новый освобождает своё место
            int usedAfterSwap = inventoryUsed(state) - (item.isCountsTowardLimit() ? 1 : 0);
            if (current.isCountsTowardLimit() && usedAfterSwap >= state.getInventoryLimit()) {
                return RuleResult.rejected("Inventory is full; unequip something first.");
            }
        }
        state.getInventory().remove(item);
        if (current != null) {
            state.getInventory().add(current);
        }
        state.getEquipment().put(slot.getValue(), item);
        syncPlayerAc(state);
        return RuleResult.consumed("Equipped " + item.getName() + " to " + slot.getValue() + ".");
    }

    public RuleResult unequip(GameState state, String slotName) {
        EquipmentSlot slot = EquipmentSlot.fromString(slotName);
        if (slot == null) {
            return RuleResult.rejected("Unknown equipment slot.");
        }
        ItemDefinition current = state.getEquipment().get(slot.getValue());
        if (current == null) {
            return RuleResult.rejected("That slot is already empty.");
        }
        if (!canAdd(state, current)) {
            return RuleResult.rejected("Inventory is full.");
        }
        state.getInventory().add(current);
        state.getEquipment().put(slot.getValue(), null);
        syncPlayerAc(state);
        return RuleResult.consumed("Removed " + current.getName() + " from " + slot.getValue() + ".");
    }

    /**
     * Добыча с трупа: золото по выражению и один случайный предмет из таблицы
     */
    public LootRoll rollLoot(String campaignId, String mobName) {
        if (mobName == null || mobName.isEmpty()) {
            return new LootRoll(0, null);
        }
        LootTable loot = registry.getMobProfile(campaignId, mobName).getLoot();
        int gold = loot.getGold() != null ? dice.roll(loot.getGold()).getTotal() : 0;
        List<String> items = loot.getItems();
        if (items.isEmpty()) {
            return new LootRoll(gold, null);
        }
        String itemId = items.get(dice.rollDie(items.size()) - 1);
        return new LootRoll(gold, itemId);
    }

    /**
     * Убирает квестовые предметы кампании из инвентаря и экипировки
     */
    public void stripQuestItems(GameState state) {
        Set<String> questIds = new HashSet<>(registry.questItemIds(state.getCampaignId()));
        if (questIds.isEmpty()) {
            return;
        }
        state.getInventory().removeIf(item -> questIds.contains(item.getId()));
        for (Map.Entry<String, ItemDefinition> entry : state.getEquipment().entrySet()) {
            if (entry.getValue() != null && questIds.contains(entry.getValue().getId())) {
                entry.setValue(null);
            }
        }
    }

    public static class ItemLookup {
        private final ItemDefinition item;
        private final String error;

        private ItemLookup(ItemDefinition item, String error) {
            this.item = item;
            this.error = error;
        }

        public static ItemLookup found(ItemDefinition item) {
            return new ItemLookup(item, null);
        }

        public static ItemLookup error(String error) {
            return new ItemLookup(null, error);
        }

        public ItemDefinition getItem() { return item; }
        public String getError() { return error; }
    }

    public static class LootRoll {
        private final int gold;
        private final String itemId;

        public LootRoll(int gold, String itemId) {
            this.gold = gold;
            this.itemId = itemId;
        }

        public int getGold() { return gold; }
        public String getItemId() { return itemId; }
    }
}
