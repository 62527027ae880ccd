package com.solo.ai_engine;

import com.solo.prompts.NarrationPrompts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;

/**
 * Рассказчик и подсказки спутника поверх локальной модели.
 * Результат правил уже применён к состоянию; текст модели никогда не разбирается обратно.
 * Сбои модели гасятся повторами с экспоненциальной задержкой и заготовленной репликой.
 */
public class GameMasterAI {
    private static final Logger log = LoggerFactory.getLogger(GameMasterAI.class);

    public static final String SOURCE_AI = "ai";
    public static final String SOURCE_FALLBACK = "fallback";
    public static final String SOURCE_STUB = "stub";
    public static final int NARRATION_MAX_WORDS = 120;

    private static final List<String> STUB_NARRATION = List.of(
        "The ruin creaks with old stone. What do you do?",
        "You take a breath as the air shifts. What's your move?",
        "The shadows settle, silent and watchful. What do you do next?"
    );
    private static final List<String> STUB_SUGGESTIONS = List.of(
        "%s whispers, 'Keep your distance and watch for traps.'",
        "%s says, 'Let me cover you while you act.'",
        "%s mutters, 'Slow and steady, no sudden moves.'"
    );

    private final LocalLLMClient client;
    private final boolean enabled;
    private final int maxRetries;
    private final long retryBaseDelayMs;
    private final Random random;

    public GameMasterAI(LocalLLMClient client, boolean enabled, int maxRetries, long retryBaseDelayMs, Random random) {
        this.client = client;
        this.enabled = enabled && client != null;
        this.maxRetries = Math.max(1, maxRetries);
        this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        this.random = random;
    }

    /**
     * Заглушка без модели: только заготовленные реплики
     */
    public static GameMasterAI stub(Random random) {
        return new GameMasterAI(null, false, 1, 0, random);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Narration narrate(StateSnapshot snapshot, String playerInput, String rulesResult) {
        if (!enabled) {
            return new Narration(stubNarration(), SOURCE_STUB);
        }
        String systemPrompt = NarrationPrompts.getNarratorSystemPrompt(NARRATION_MAX_WORDS);
        String userPrompt = NarrationPrompts.getNarrationPrompt(snapshot, playerInput, rulesResult);
        String text = requestWithRetry(systemPrompt, userPrompt);
        if (text == null) {
            return new Narration(stubNarration(), SOURCE_FALLBACK);
        }
        return new Narration(text, SOURCE_AI);
    }

    /**
     * Однострочная подсказка спутника по доступному набору действий
     */
    public String suggest(StateSnapshot snapshot, List<String> actions) {
        if (!enabled) {
            return stubSuggestion(snapshot);
        }
        String systemPrompt = NarrationPrompts.getCompanionSystemPrompt(snapshot.getLeadCompanionName());
        String userPrompt = NarrationPrompts.getSuggestionPrompt(snapshot, actions);
        String text = requestWithRetry(systemPrompt, userPrompt);
        return text != null ? text : stubSuggestion(snapshot);
    }

    private String requestWithRetry(String systemPrompt, String userPrompt) {
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                return client.generateResponse(systemPrompt, userPrompt);
            } catch (LLMRequestException e) {
                log.warn("Narration attempt {}/{} failed: {}", attempt + 1, maxRetries, e.getMessage());
                if (attempt < maxRetries - 1 && !backoff(attempt)) {
                    break;
                }
            } catch (RuntimeException e) {
                // ошибка рассказчика не должна доходить до правил
                log.warn("Narration attempt {}/{} failed unexpectedly", attempt + 1, maxRetries, e);
                if (attempt < maxRetries - 1 && !backoff(attempt)) {
                    break;
                }
            }
        }
        log.warn("Narration unavailable after {} attempts, using fallback", maxRetries);
        return null;
    }

    private boolean backoff(int attempt) {
        long delay = retryBaseDelayMs * (1L << attempt);
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String stubNarration() {
        return STUB_NARRATION.get(random.nextInt(STUB_NARRATION.size()));
    }

    private String stubSuggestion(StateSnapshot snapshot) {
        String template = STUB_SUGGESTIONS.get(random.nextInt(STUB_SUGGESTIONS.size()));
        return String.format(template, snapshot.getLeadCompanionName());
    }

    public static class Narration {
        private final String text;
        private final String source;

        public Narration(String text, String source) {
            this.text = text;
            this.source = source;
        }

        public String getText() { return text; }
        public String getSource() { return source; }
    }
}
