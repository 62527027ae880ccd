package com.solo.prompts;

import com.solo.ai_engine.StateSnapshot;
import com.solo.game_rules.DiceRoller;
import com.solo.game_rules.GameEngine;
import com.solo.game_rules.ScriptedRandom;
import com.solo.game_rules.TestFixtures;
import com.solo.game_state.GameState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NarrationPromptsTest {
    private GameEngine engine;
    private GameState state;

    @BeforeEach
    void setUp() {
        engine = new GameEngine(TestFixtures.registry(), new DiceRoller(new ScriptedRandom()));
        state = engine.newGame(TestFixtures.WATCHTOWER, TestFixtures.fighter("Hero"), null, 10);
    }

    @Test
    void narratorStateDescribesRoomPartyAndFlags() {
        state.getFlags().set("scout_helped");

        String text = NarrationPrompts.formatStateForNarrator(StateSnapshot.of(state, engine.getRegistry()));

        assertThat(text)
            .contains("Room: Ruined Courtyard")
            .contains("Player: Hero (Human Fighter) Level 1 HP 17/17")
            .contains("Companions: Mara HP 10/10")
            .contains("In combat: false")
            .contains("Flags: scout_helped=true")
            .doesNotContain("Enemies:");
    }

    @Test
    void combatStateListsEnemies() {
        engine.handle(state, "up");

        String text = NarrationPrompts.formatStateForCompanion(StateSnapshot.of(state, engine.getRegistry()));

        assertThat(text)
            .contains("Room: Crumbling Barracks (combat)")
            .contains("Enemies: Watchtower Bandit HP 12/12")
            .contains("Last event: A fight breaks out with Watchtower Bandit.");
    }

    @Test
    void fullHealthNoteAppearsOnlyWhenNobodyIsHurt() {
        String healthy = NarrationPrompts.getSuggestionPrompt(
            StateSnapshot.of(state, engine.getRegistry()), List.of("talk", "rest [N]"));
        state.getActiveCompanion().setHp(4);
        String wounded = NarrationPrompts.getSuggestionPrompt(
            StateSnapshot.of(state, engine.getRegistry()), List.of("talk", "rest [N]"));

        assertThat(healthy).contains("Everyone at full HP").contains("Available actions: talk, rest [N]");
        assertThat(wounded).doesNotContain("Everyone at full HP");
    }

    @Test
    void systemPromptsCarryLimitsAndPersona() {
        assertThat(NarrationPrompts.getNarratorSystemPrompt(80)).contains("under 80 words");
        assertThat(NarrationPrompts.getCompanionSystemPrompt("Eldrin")).startsWith("You are Eldrin,");
    }
}
