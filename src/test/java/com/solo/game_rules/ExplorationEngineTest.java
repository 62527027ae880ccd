package com.solo.game_rules;

import com.solo.content.ContentRegistry;
import com.solo.game_state.CorpseRecord;
import com.solo.game_state.GameState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExplorationEngineTest {
    private final ContentRegistry registry = TestFixtures.registry();
    private final ScriptedRandom random = new ScriptedRandom();
    private final DiceRoller dice = new DiceRoller(random);
    private final ExplorationEngine exploration = new ExplorationEngine(
        registry, dice, new EntityFactory(registry, dice), new InventoryRules(registry, dice));
    private GameState state;

    @BeforeEach
    void setUp() {
        state = new GameEngine(registry, dice).newGame(TestFixtures.WATCHTOWER, TestFixtures.fighter("Hero"), null, 10);
    }

    @Test
    void successfulParleySetsFlags() {
        random.queue(11);

        RuleResult result = exploration.act(state, "talk", "");

        assertThat(result.getMessage()).startsWith("You win Eryn's trust (roll 11 -> 13).");
        assertThat(state.getFlags().isSet("scout_helped")).isTrue();
        assertThat(state.getFlags().isSet("social_done")).isTrue();
    }

    @Test
    void failedParleyOnlyMarksSceneDone() {
        random.queue(10);

        RuleResult result = exploration.act(state, "talk", "");

        assertThat(result.getMessage()).startsWith("Eryn stays guarded (roll 10 -> 12).");
        assertThat(state.getFlags().isSet("scout_helped")).isFalse();
        assertThat(state.getFlags().isSet("social_done")).isTrue();
    }

    @Test
    void unknownExitListsDestinations() {
        RuleResult result = exploration.moveTo(state, "sideways");

        assertThat(result.isConsumed()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Can't go that way. Options: barracks, cellar.");
        assertThat(state.getRoomId()).isEqualTo("courtyard");
    }

    @Test
    void moveAcceptsRoomIdAsDestination() {
        RuleResult result = exploration.moveTo(state, "barracks");

        assertThat(result.isConsumed()).isTrue();
        assertThat(state.getRoomId()).isEqualTo("barracks");
        assertThat(state.isInCombat()).isTrue();
        assertThat(state.getVisited()).contains("barracks");
    }

    @Test
    void naturalTwentyOnSpireChestWinsTheLocket() {
        state.setRoomId("spire");
        random.queue(20);

        RuleResult result = exploration.act(state, "open", "");

        assertThat(result.getMessage()).startsWith("You work the rusted lock free (roll 20 -> 22).");
        assertThat(state.isGameOver()).isTrue();
        assertThat(state.getInventory()).extracting(item -> item.getId()).contains("silver_locket");
        assertThat(state.getFlags().isContainerLooted("spire")).isTrue();

        RuleResult again = exploration.act(state, "open", "");
        assertThat(again.getMessage()).isEqualTo("The chest is already open and empty.");
    }

    @Test
    void failedLockCanBeRetried() {
        state.setRoomId("spire");
        random.queue(5);

        RuleResult result = exploration.act(state, "search", "");

        assertThat(result.getMessage()).startsWith("Your tools slip (roll 5 -> 7).");
        assertThat(state.getFlags().isSet("spire_lock_failed")).isTrue();
        assertThat(state.isGameOver()).isFalse();
        assertThat(state.getFlags().isContainerLooted("spire")).isFalse();
    }

    @Test
    void undefeatedFoesBlockSearching() {
        state.setRoomId("barracks");

        RuleResult result = exploration.act(state, "loot", "");

        assertThat(result.getMessage()).isEqualTo("The enemy blocks your way, ready to strike.");
    }

    @Test
    void banditCorpseYieldsGoldAndArmguards() {
        state.setRoomId("barracks");
        state.getFlags().markRoomDefeated("barracks");
        state.getFlags().putCorpses("barracks", List.of(new CorpseRecord(1, "Watchtower Bandit", false)));
        random.queue(4, 1);

        RuleResult result = exploration.act(state, "loot", "");

        assertThat(result.getMessage()).isEqualTo("You loot the corpse and gain 6 gold. You find Padded Armguards.");
        assertThat(state.getPlayer().getGold()).isEqualTo(6);
        assertThat(state.getInventory()).extracting(item -> item.getId()).contains("padded_arms");

        RuleResult again = exploration.act(state, "loot", "");
        assertThat(again.isConsumed()).isFalse();
        assertThat(again.getMessage()).isEqualTo("You already searched the corpses.");
    }

    @Test
    void severalCorpsesNeedAnIndexOrAll() {
        state.setRoomId("cellar");
        state.getFlags().markRoomDefeated("cellar");
        state.getFlags().putCorpses("cellar", List.of(
            new CorpseRecord(1, "Big Rats", false), new CorpseRecord(2, "Big Rats", false)));

        RuleResult bare = exploration.act(state, "loot", "");
        RuleResult badIndex = exploration.act(state, "loot", "5");
        RuleResult all = exploration.act(state, "loot", "all");

        assertThat(bare.isConsumed()).isFalse();
        assertThat(bare.getMessage()).isEqualTo("Multiple corpses here. Use 'loot <number>' or 'loot all'.");
        assertThat(badIndex.getMessage()).isEqualTo("That corpse does not exist.");
        assertThat(all.getMessage()).isEqualTo("You search the corpse but find nothing.");
        assertThat(state.getFlags().corpsesIn("cellar")).allMatch(CorpseRecord::isLooted);
    }

    @Test
    void passageSearchRepeatsDescription() {
        GameState crypt = new GameEngine(registry, dice)
            .newGame(TestFixtures.CRYPT, TestFixtures.fighter("Hero"), "mara", 10);
        crypt.setRoomId("hallway");

        RuleResult result = exploration.act(crypt, "look", "");

        assertThat(result.getMessage()).startsWith("Torch sconces line the walls");
    }
}
