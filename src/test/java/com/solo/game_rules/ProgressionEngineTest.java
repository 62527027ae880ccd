package com.solo.game_rules;

import com.solo.content.Spell;
import com.solo.game_state.GameState;
import com.solo.game_state.PendingDecision;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressionEngineTest {
    private final ProgressionEngine progression = new ProgressionEngine();

    private GameState newState(com.solo.game_state.Character player) {
        GameEngine engine = new GameEngine(TestFixtures.registry(), new DiceRoller(new ScriptedRandom()));
        return engine.newGame(TestFixtures.WATCHTOWER, player, null, 10);
    }

    @Test
    void xpTableBoundaries() {
        assertThat(ProgressionEngine.levelFromXp(0)).isEqualTo(1);
        assertThat(ProgressionEngine.levelFromXp(99)).isEqualTo(1);
        assertThat(ProgressionEngine.levelFromXp(100)).isEqualTo(2);
        assertThat(ProgressionEngine.levelFromXp(10000)).isEqualTo(10);
        assertThat(ProgressionEngine.xpForLevel(3)).isEqualTo(250);
        assertThat(ProgressionEngine.maxLevel()).isEqualTo(10);
    }

    @Test
    void hundredXpReachesLevelTwo() {
        GameState state = newState(TestFixtures.fighter("Hero"));

        List<String> messages = progression.grantXp(state, 100);

        assertThat(messages).containsExactly("Level up! Hero is now level 2.");
        assertThat(state.getPlayer().getLevel()).isEqualTo(2);
        assertThat(state.getPlayer().getMaxHp()).isEqualTo(19);
        assertThat(state.getPlayer().getAttackBonus()).isEqualTo(4);
        assertThat(state.getPendingDecisions()).isEmpty();
    }

    @Test
    void largeGrantAppliesEveryLevel() {
        GameState state = newState(TestFixtures.fighter("Hero"));

        List<String> messages = progression.grantXp(state, 260);

        assertThat(messages).hasSize(2);
        assertThat(state.getPlayer().getLevel()).isEqualTo(3);
        assertThat(state.getPlayer().getXp()).isEqualTo(260);
    }

    @Test
    void levelStopsAtTopOfTable() {
        GameState state = newState(TestFixtures.fighter("Hero"));

        List<String> messages = progression.grantXp(state, 50000);

        assertThat(messages).hasSize(ProgressionEngine.maxLevel() - 1);
        assertThat(state.getPlayer().getLevel()).isEqualTo(10);
        assertThat(progression.grantXp(state, 5000)).isEmpty();
        assertThat(state.getPlayer().getLevel()).isEqualTo(10);
    }

    @Test
    void zeroGrantDoesNothing() {
        GameState state = newState(TestFixtures.fighter("Hero"));

        assertThat(progression.grantXp(state, 0)).isEmpty();
        assertThat(state.getPlayer().getXp()).isZero();
    }

    @Test
    void casterLevelUpQueuesSpellChoiceAndRefillsMana() {
        GameState state = newState(TestFixtures.wizard("Vex"));
        state.getPlayer().setMana(3);

        progression.grantXp(state, 100);

        assertThat(state.getPlayer().getMaxMana()).isEqualTo(12);
        assertThat(state.getPlayer().getMana()).isEqualTo(12);
        assertThat(state.getPendingDecisions()).hasSize(1);
        PendingDecision decision = state.getPendingDecisions().get(0);
        assertThat(decision.getLevel()).isEqualTo(2);
        assertThat(decision.getOptions()).containsExactly(Spell.MAGIC_MISSILE, Spell.SHIELD, Spell.SLEEP);
        assertThat(decision.isOffered()).isFalse();
    }
}
