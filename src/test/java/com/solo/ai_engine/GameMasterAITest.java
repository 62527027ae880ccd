package com.solo.ai_engine;

import com.solo.game_rules.DiceRoller;
import com.solo.game_rules.GameEngine;
import com.solo.game_rules.ScriptedRandom;
import com.solo.game_rules.TestFixtures;
import com.solo.game_state.GameState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameMasterAITest {
    @Mock
    private LocalLLMClient client;

    private StateSnapshot snapshot;

    @BeforeEach
    void setUp() {
        GameEngine engine = new GameEngine(TestFixtures.registry(), new DiceRoller(new ScriptedRandom()));
        GameState state = engine.newGame(TestFixtures.WATCHTOWER, TestFixtures.fighter("Hero"), null, 10);
        snapshot = StateSnapshot.of(state, TestFixtures.registry());
    }

    @Test
    void stubNarratorNeverCallsModel() {
        GameMasterAI gm = GameMasterAI.stub(new Random(3));

        GameMasterAI.Narration narration = gm.narrate(snapshot, "look", "You press onward.");

        assertThat(gm.isEnabled()).isFalse();
        assertThat(narration.getSource()).isEqualTo(GameMasterAI.SOURCE_STUB);
        assertThat(narration.getText()).endsWith("?");
        assertThat(gm.suggest(snapshot, List.of("talk"))).startsWith("Mara ");
    }

    @Test
    void modelNarrationIsUsedWhenAvailable() {
        when(client.generateResponse(anyString(), anyString())).thenReturn("Stone dust drifts down. What now?");
        GameMasterAI gm = new GameMasterAI(client, true, 3, 0, new Random(3));

        GameMasterAI.Narration narration = gm.narrate(snapshot, "look", "You press onward.");

        assertThat(narration.getSource()).isEqualTo(GameMasterAI.SOURCE_AI);
        assertThat(narration.getText()).isEqualTo("Stone dust drifts down. What now?");
        verify(client).generateResponse(contains("Keep responses under 120 words"), contains("RULES RESULT\nYou press onward."));
    }

    @Test
    void transientFailuresAreRetried() {
        when(client.generateResponse(anyString(), anyString()))
            .thenThrow(new LLMRequestException("connection refused"))
            .thenThrow(new LLMRequestException("timeout"))
            .thenReturn("The torches gutter. Your move?");
        GameMasterAI gm = new GameMasterAI(client, true, 3, 0, new Random(3));

        GameMasterAI.Narration narration = gm.narrate(snapshot, "look", "You press onward.");

        assertThat(narration.getSource()).isEqualTo(GameMasterAI.SOURCE_AI);
        verify(client, times(3)).generateResponse(anyString(), anyString());
    }

    @Test
    void exhaustedRetriesFallBackToCannedLine() {
        when(client.generateResponse(anyString(), anyString())).thenThrow(new LLMRequestException("down"));
        GameMasterAI gm = new GameMasterAI(client, true, 2, 0, new Random(3));

        GameMasterAI.Narration narration = gm.narrate(snapshot, "look", "You press onward.");

        assertThat(narration.getSource()).isEqualTo(GameMasterAI.SOURCE_FALLBACK);
        assertThat(narration.getText()).isNotBlank();
        verify(client, times(2)).generateResponse(anyString(), anyString());
    }

    @Test
    void suggestionSpeaksAsLeadCompanion() {
        when(client.generateResponse(anyString(), anyString())).thenReturn("Let's check the cellar first.");
        GameMasterAI gm = new GameMasterAI(client, true, 1, 0, new Random(3));

        String suggestion = gm.suggest(snapshot, GameEngine.vocabulary(new GameState()));

        assertThat(suggestion).isEqualTo("Let's check the cellar first.");
        verify(client).generateResponse(contains("You are Mara"), contains("Everyone at full HP"));
    }

    @Test
    void disabledFlagWithoutClientUsesStub() {
        GameMasterAI gm = new GameMasterAI(null, true, 3, 0, new Random(3));

        assertThat(gm.isEnabled()).isFalse();
        assertThat(gm.narrate(snapshot, "look", "ok").getSource()).isEqualTo(GameMasterAI.SOURCE_STUB);
        verifyNoInteractions(client);
    }

    @Test
    void unexpectedClientErrorStillFallsBack() {
        when(client.generateResponse(anyString(), anyString()))
            .thenThrow(new UnsupportedOperationException("JsonNull"));
        GameMasterAI gm = new GameMasterAI(client, true, 2, 0, new Random(3));

        GameMasterAI.Narration narration = gm.narrate(snapshot, "look", "You press onward.");

        assertThat(narration.getSource()).isEqualTo(GameMasterAI.SOURCE_FALLBACK);
        verify(client, times(2)).generateResponse(anyString(), anyString());
    }
}
