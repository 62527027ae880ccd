package com.solo.api;

import com.solo.ai_engine.GameMasterAI;
import com.solo.game_rules.DiceRoller;
import com.solo.game_rules.GameEngine;
import com.solo.game_rules.ScriptedRandom;
import com.solo.game_rules.TestFixtures;
import com.solo.game_state.CharacterRoster;
import com.solo.game_state.GameManager;
import com.solo.game_state.SaveCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AdventureServiceTest {
    @TempDir
    Path tempDir;

    private AdventureService service;
    private GameManager gameManager;

    @BeforeEach
    void setUp() {
        SaveCodec codec = new SaveCodec(TestFixtures.registry());
        gameManager = new GameManager(tempDir.resolve("adventure.db").toString(), codec);
        service = new AdventureService();
        ReflectionTestUtils.setField(service, "engine",
            new GameEngine(TestFixtures.registry(), new DiceRoller(new ScriptedRandom())));
        ReflectionTestUtils.setField(service, "gameManager", gameManager);
        ReflectionTestUtils.setField(service, "roster", new CharacterRoster(gameManager, codec, TestFixtures.registry()));
        ReflectionTestUtils.setField(service, "gameMaster", GameMasterAI.stub(new Random(7)));
        ReflectionTestUtils.setField(service, "inventoryLimit", 10);
    }

    private static Map<String, Object> newFighter(String name) {
        Map<String, Object> stats = new HashMap<>();
        stats.put("str", 3);
        stats.put("dex", 2);
        stats.put("con", 3);
        stats.put("int", 2);
        stats.put("wis", 1);
        stats.put("cha", 1);
        Map<String, Object> character = new HashMap<>();
        character.put("name", name);
        character.put("class", "Fighter");
        character.put("stats", stats);
        Map<String, Object> body = new HashMap<>();
        body.put("campaign_id", TestFixtures.WATCHTOWER);
        body.put("character", character);
        return body;
    }

    @Test
    @SuppressWarnings("unchecked")
    void createdGameIsSavedAndRostered() {
        Map<String, Object> created = service.createGame(newFighter("Hero"));

        String sessionId = (String) created.get("session_id");
        assertThat(sessionId).startsWith("game_");
        assertThat((String) created.get("intro")).startsWith("Broken stone and fallen beams");
        assertThat(gameManager.gameExists(sessionId)).isTrue();
        assertThat(service.listCharacters()).containsExactly("Hero");

        Map<String, Object> player = (Map<String, Object>) service.getStatus(sessionId).get("player");
        assertThat(player.get("hp")).isEqualTo(17);
    }

    @Test
    void unknownCampaignAndBadStatsAreRejected() {
        Map<String, Object> body = newFighter("Hero");
        body.put("campaign_id", "moon_base");
        assertThatThrownBy(() -> service.createGame(body))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("moon_base");

        Map<String, Object> greedy = newFighter("Greedy");
        @SuppressWarnings("unchecked")
        Map<String, Object> stats = (Map<String, Object>) ((Map<String, Object>) greedy.get("character")).get("stats");
        stats.put("str", 4);
        stats.put("dex", 4);
        assertThatThrownBy(() -> service.createGame(greedy)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void consumedActionIsNarratedAndPersisted() {
        String sessionId = (String) service.createGame(newFighter("Hero")).get("session_id");

        Map<String, Object> result = service.performAction(sessionId, "down");

        assertThat(result.get("consumed")).isEqualTo(true);
        assertThat(result.get("narration")).isNotNull();
        assertThat(result.get("narration_source")).isEqualTo("stub");
        assertThat(result.get("in_combat")).isEqualTo(true);
        assertThat(gameManager.loadGame(sessionId).getRoomId()).isEqualTo("cellar");
        assertThat(gameManager.loadGame(sessionId).getResponseLog()).hasSize(1);
    }

    @Test
    void rejectedActionSkipsNarration() {
        String sessionId = (String) service.createGame(newFighter("Hero")).get("session_id");

        Map<String, Object> result = service.performAction(sessionId, "dance wildly");

        assertThat(result.get("consumed")).isEqualTo(false);
        assertThat(result.get("narration")).isNull();
        assertThat((String) result.get("suggestion")).startsWith("Mara ");
        assertThat(gameManager.loadGame(sessionId).getTurn()).isZero();
    }

    @Test
    void missingSessionThrowsNotFound() {
        assertThatThrownBy(() -> service.performAction("ghost", "look"))
            .isInstanceOf(GameNotFoundException.class)
            .hasMessage("Game not found: ghost");
    }

    @Test
    void rosterCharacterStartsAnotherCampaign() {
        service.createGame(newFighter("Hero"));

        Map<String, Object> body = new HashMap<>();
        body.put("campaign_id", TestFixtures.CRYPT);
        body.put("roster_name", "Hero");
        Map<String, Object> created = service.createGame(body);

        assertThat(created.get("session_id")).isNotNull();
        assertThat(service.listCharacters()).isEqualTo(List.of("Hero"));
    }

    @Test
    void turnIsSavedEvenWhenNarrationBlowsUp() {
        String sessionId = (String) service.createGame(newFighter("Hero")).get("session_id");
        GameMasterAI broken = mock(GameMasterAI.class);
        when(broken.narrate(any(), anyString(), anyString())).thenThrow(new IllegalStateException("narrator crashed"));
        ReflectionTestUtils.setField(service, "gameMaster", broken);

        assertThatThrownBy(() -> service.performAction(sessionId, "down"))
            .isInstanceOf(IllegalStateException.class);

        assertThat(gameManager.loadGame(sessionId).getTurn()).isEqualTo(1);
        assertThat(gameManager.loadGame(sessionId).getRoomId()).isEqualTo("cellar");
        assertThat(gameManager.loadGame(sessionId).isInCombat()).isTrue();
    }

    @Test
    void concurrentActionsOnOneSessionAreAppliedOneAfterAnother() throws Exception {
        String sessionId = (String) service.createGame(newFighter("Hero")).get("session_id");
        int players = 8;
        ExecutorService pool = Executors.newFixedThreadPool(players);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Map<String, Object>>> results = new ArrayList<>();
        try {
            for (int i = 0; i < players; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return service.performAction(sessionId, "talk");
                }));
            }
            start.countDown();
            for (Future<Map<String, Object>> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS).get("consumed")).isEqualTo(true);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(gameManager.loadGame(sessionId).getTurn()).isEqualTo(players);
        assertThat(gameManager.loadGame(sessionId).getTurnLog()).hasSize(players);
        assertThat(gameManager.loadGame(sessionId).getResponseLog()).hasSize(players);
    }
}
