package com.solo.game_rules;

import com.solo.content.ContentRegistry;
import com.solo.content.ItemKind;
import com.solo.game_state.Companion;
import com.solo.game_state.GameState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InventoryRulesTest {
    private final ContentRegistry registry = TestFixtures.registry();
    private ScriptedRandom random;
    private InventoryRules inventory;
    private GameState state;

    @BeforeEach
    void setUp() {
        random = new ScriptedRandom();
        GameEngine engine = new GameEngine(registry, new DiceRoller(random));
        inventory = engine.getInventory();
        state = engine.newGame(TestFixtures.WATCHTOWER, TestFixtures.fighter("Hero"), null, 10);
    }

    @Test
    void startingKitFillsFiveSlots() {
        assertThat(InventoryRules.inventoryUsed(state)).isEqualTo(5);
        assertThat(state.getInventory()).extracting(item -> item.getId())
            .containsExactly("healing_potion", "healing_potion", "healing_potion", "leather_cap", "worn_boots");
    }

    @Test
    void potionHealsPlayerWhenCompanionIsHealthier() {
        state.getPlayer().setHp(10);
        random.queue(3);

        RuleResult result = inventory.useItem(state, "potion", "");

        assertThat(result.isConsumed()).isTrue();
        assertThat(result.getMessage()).isEqualTo("You use Healing Potion on Hero, healing 5 (3+2).");
        assertThat(state.getPlayer().getHp()).isEqualTo(15);
        assertThat(state.getInventory()).hasSize(4);
    }

    @Test
    void potionGoesToMoreWoundedCompanionByDefault() {
        Companion mara = state.getActiveCompanion();
        mara.setHp(3);
        random.queue(6);

        RuleResult result = inventory.useItem(state, "healing potion", "");

        assertThat(result.getMessage()).contains("on Mara");
        assertThat(mara.getHp()).isEqualTo(10);
    }

    @Test
    void explicitSelfTargetWins() {
        state.getActiveCompanion().setHp(3);
        state.getPlayer().setHp(16);
        random.queue(1);

        inventory.useItem(state, "potion", "me");

        assertThat(state.getPlayer().getHp()).isEqualTo(17);
        assertThat(state.getActiveCompanion().getHp()).isEqualTo(3);
    }

    @Test
    void usingArmorOrMissingItemIsRejected() {
        RuleResult missing = inventory.useItem(state, "scroll", "");
        RuleResult empty = inventory.useItem(state, "", "");

        assertThat(missing.isConsumed()).isFalse();
        assertThat(missing.getMessage()).isEqualTo("You don't have that.");
        assertThat(empty.getMessage()).isEqualTo("Use what?");
        assertThat(state.getInventory()).hasSize(5);
    }

    @Test
    void equipMovesArmorToSlotAndRaisesAc() {
        RuleResult result = inventory.equip(state, "cap");

        assertThat(result.getMessage()).isEqualTo("Equipped Leather Cap to head.");
        assertThat(state.getEquipment().get("head").getId()).isEqualTo("leather_cap");
        assertThat(state.getPlayer().getAc()).isEqualTo(16);
        assertThat(InventoryRules.inventoryUsed(state)).isEqualTo(4);
    }

    @Test
    void equipByNumberChecksKind() {
        RuleResult potion = inventory.equip(state, "1");
        RuleResult boots = inventory.equip(state, "5");
        RuleResult outOfRange = inventory.equip(state, "12");

        assertThat(potion.getMessage()).isEqualTo("That item is not armor.");
        assertThat(boots.isConsumed()).isTrue();
        assertThat(state.getEquipment().get("feet").getName()).isEqualTo("Worn Boots");
        assertThat(outOfRange.getMessage()).isEqualTo("That item number does not exist.");
    }

    @Test
    void swapReturnsOldArmorEvenWhenPackIsFull() {
        inventory.equip(state, "cap");
        state.getInventory().add(registry.itemFromId(TestFixtures.WATCHTOWER, "leather_cap"));
        state.setInventoryLimit(5);

        RuleResult result = inventory.equip(state, "leather cap");

        assertThat(result.isConsumed()).isTrue();
        assertThat(InventoryRules.inventoryUsed(state)).isEqualTo(5);
        assertThat(state.getPlayer().getAc()).isEqualTo(16);
    }

    @Test
    void unequipReturnsItemAndValidatesSlot() {
        inventory.equip(state, "boots");

        RuleResult removed = inventory.unequip(state, "feet");
        RuleResult empty = inventory.unequip(state, "feet");
        RuleResult unknown = inventory.unequip(state, "tail");

        assertThat(removed.getMessage()).isEqualTo("Removed Worn Boots from feet.");
        assertThat(state.getPlayer().getAc()).isEqualTo(15);
        assertThat(empty.getMessage()).isEqualTo("That slot is already empty.");
        assertThat(unknown.getMessage()).isEqualTo("Unknown equipment slot.");
    }

    @Test
    void fullPackRejectsCountedItemsButAcceptsQuestItems() {
        state.setInventoryLimit(5);

        RuleResult potion = InventoryRules.add(state, registry.itemFromId(TestFixtures.WATCHTOWER, "healing_potion"));
        RuleResult locket = InventoryRules.add(state, registry.itemFromId(TestFixtures.WATCHTOWER, "silver_locket"));

        assertThat(potion.isConsumed()).isFalse();
        assertThat(potion.getMessage()).isEqualTo("Inventory is full.");
        assertThat(locket.isConsumed()).isTrue();
        assertThat(InventoryRules.inventoryUsed(state)).isEqualTo(5);
    }

    @Test
    void ambiguousQueryListsCandidates() {
        state.getInventory().add(registry.itemFromId(TestFixtures.WATCHTOWER, "padded_arms"));

        InventoryRules.ItemLookup lookup = InventoryRules.find(state, "armor", ItemKind.ARMOR);

        assertThat(lookup.getItem()).isNull();
        assertThat(lookup.getError())
            .isEqualTo("Be more specific or use an item number: Leather Cap, Worn Boots, Padded Armguards");
    }

    @Test
    void questItemsAreStrippedFromPackAndSlots() {
        state.getInventory().add(registry.itemFromId(TestFixtures.WATCHTOWER, "silver_locket"));

        inventory.stripQuestItems(state);

        assertThat(state.getInventory()).extracting(item -> item.getId()).doesNotContain("silver_locket");
        assertThat(state.getInventory()).hasSize(5);
    }
}
