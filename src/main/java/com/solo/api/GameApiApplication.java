package com.solo.api;

import com.solo.ai_engine.GameMasterAI;
import com.solo.ai_engine.LocalLLMClient;
import com.solo.content.CampaignLoader;
import com.solo.content.ContentRegistry;
import com.solo.game_rules.DiceRoller;
import com.solo.game_rules.GameEngine;
import com.solo.game_state.CharacterRoster;
import com.solo.game_state.GameManager;
import com.solo.game_state.SaveCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.Arrays;
import java.util.Random;

/**
 * Spring Boot Application для одиночного приключения
 */
@SpringBootApplication
public class GameApiApplication {
    private static final Logger log = LoggerFactory.getLogger(GameApiApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GameApiApplication.class, args);
    }

    @Bean
    public ContentRegistry contentRegistry(@Value("${adventure.campaigns}") String campaigns) {
        return new CampaignLoader().loadRegistry(Arrays.asList(campaigns.split(",")));
    }

    /**
     * Кубики правил. Рассказчик берёт собственный генератор и не сдвигает эту последовательность.
     */
    @Bean
    public Random diceRandom(@Value("${adventure.dice.seed:}") String seed) {
        if (seed == null || seed.isBlank()) {
            return new Random();
        }
        log.info("Using fixed dice seed {}", seed);
        return new Random(Long.parseLong(seed.trim()));
    }

    @Bean
    public GameEngine gameEngine(ContentRegistry registry, Random diceRandom) {
        return new GameEngine(registry, new DiceRoller(diceRandom));
    }

    @Bean
    public SaveCodec saveCodec(ContentRegistry registry) {
        return new SaveCodec(registry);
    }

    @Bean
    public GameManager gameManager(@Value("${adventure.db.path}") String dbPath, SaveCodec codec) {
        log.info("Using save database {}", dbPath);
        return new GameManager(dbPath, codec);
    }

    @Bean
    public CharacterRoster characterRoster(GameManager gameManager, SaveCodec codec, ContentRegistry registry) {
        return new CharacterRoster(gameManager, codec, registry);
    }

    @Bean
    public GameMasterAI gameMasterAI(@Value("${adventure.narration.enabled:false}") boolean enabled,
                                     @Value("${adventure.ollama.base-url}") String baseUrl,
                                     @Value("${adventure.ollama.model}") String model,
                                     @Value("${adventure.narration.temperature}") double temperature,
                                     @Value("${adventure.narration.max-tokens}") int maxTokens,
                                     @Value("${adventure.narration.timeout-seconds}") int timeoutSeconds,
                                     @Value("${adventure.narration.max-retries}") int maxRetries,
                                     @Value("${adventure.narration.retry-base-delay-ms}") long retryBaseDelayMs) {
        Random narrationRandom = new Random();
        if (!enabled) {
            log.info("Narration disabled, using canned GM lines");
            return GameMasterAI.stub(narrationRandom);
        }
        LocalLLMClient.LocalLLMConfig config = new LocalLLMClient.LocalLLMConfig(
            model, temperature, maxTokens, timeoutSeconds);
        LocalLLMClient client = new LocalLLMClient(config, baseUrl);
        log.info("Narration via Ollama model {} at {}", model, client.getOllamaBaseUrl());
        return new GameMasterAI(client, true, maxRetries, retryBaseDelayMs, narrationRandom);
    }
}
