package com.solo.ai_engine;

import com.solo.game_rules.DiceRoller;
import com.solo.game_rules.GameEngine;
import com.solo.game_rules.ScriptedRandom;
import com.solo.game_rules.TestFixtures;
import com.solo.game_state.GameState;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalLLMClientTest {
    private MockWebServer server;
    private LocalLLMClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new LocalLLMClient(new LocalLLMClient.LocalLLMConfig("mistral:7b", 0.6, 150, 5),
            server.url("/").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void reply(String body) {
        server.enqueue(new MockResponse().setBody(body).setHeader("Content-Type", "application/json"));
    }

    @Test
    void textResponseIsTrimmedAndReturned() throws InterruptedException {
        reply("{\"response\": \"  Dust falls from the rafters.  \"}");

        String text = client.generateResponse("Be brief.", "RULES RESULT\nYou press onward.");

        assertThat(text).isEqualTo("Dust falls from the rafters.");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/generate");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"model\":\"mistral:7b\"").contains("\"stream\":false").contains("System: Be brief.");
    }

    @Test
    void jsonWrappedInNoiseIsRecovered() {
        reply("proxy says {\"response\": \"The gate creaks.\"} bye");

        assertThat(client.generateResponse(null, "look")).isEqualTo("The gate creaks.");
    }

    @Test
    void nullResponseFieldIsRequestFailure() {
        reply("{\"response\": null}");

        assertThatThrownBy(() -> client.generateResponse(null, "look"))
            .isInstanceOf(LLMRequestException.class)
            .hasMessageContaining("no text 'response' field");
    }

    @Test
    void objectResponseFieldIsRequestFailure() {
        reply("{\"response\": {\"text\": \"hi\"}}");

        assertThatThrownBy(() -> client.generateResponse(null, "look"))
            .isInstanceOf(LLMRequestException.class);
    }

    @Test
    void malformedBodiesAreRequestFailures() {
        reply("{ \"response\": }");
        reply("plain words, no json");
        reply("[\"response\"]");

        assertThatThrownBy(() -> client.generateResponse(null, "look")).isInstanceOf(LLMRequestException.class);
        assertThatThrownBy(() -> client.generateResponse(null, "look")).isInstanceOf(LLMRequestException.class);
        assertThatThrownBy(() -> client.generateResponse(null, "look")).isInstanceOf(LLMRequestException.class);
    }

    @Test
    void httpErrorIsRequestFailure() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("model not loaded"));

        assertThatThrownBy(() -> client.generateResponse(null, "look"))
            .isInstanceOf(LLMRequestException.class)
            .hasMessageContaining("500");
    }

    @Test
    void narratorFallsBackWhenModelAnswersWithNull() {
        reply("{\"response\": null}");
        reply("{\"response\": null}");
        GameMasterAI gm = new GameMasterAI(client, true, 2, 0, new Random(3));
        GameEngine engine = new GameEngine(TestFixtures.registry(), new DiceRoller(new ScriptedRandom()));
        GameState state = engine.newGame(TestFixtures.WATCHTOWER, TestFixtures.fighter("Hero"), null, 10);

        GameMasterAI.Narration narration = gm.narrate(StateSnapshot.of(state, TestFixtures.registry()), "look", "You press onward.");

        assertThat(narration.getSource()).isEqualTo(GameMasterAI.SOURCE_FALLBACK);
        assertThat(narration.getText()).isNotBlank();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }
}
