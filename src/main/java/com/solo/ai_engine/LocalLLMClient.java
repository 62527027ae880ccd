package com.solo.ai_engine;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonReader;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.util.concurrent.TimeUnit;

/**
 * Клиент для локальной языковой модели через Ollama (/api/generate)
 */
public class LocalLLMClient {
    private static final Logger log = LoggerFactory.getLogger(LocalLLMClient.class);
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final LocalLLMConfig config;
    private final String ollamaBaseUrl;

    public LocalLLMClient(LocalLLMConfig config, String ollamaBaseUrl) {
        this.config = config;
        this.ollamaBaseUrl = ollamaBaseUrl != null && !ollamaBaseUrl.isEmpty()
            ? stripTrailingSlash(ollamaBaseUrl)
            : DEFAULT_OLLAMA_BASE_URL;
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
            .writeTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
            .callTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
            .build();
    }

    /**
     * Один запрос к модели. Любая ошибка транспорта или формата даёт LLMRequestException.
     */
    public String generateResponse(String systemPrompt, String userPrompt) {
        String prompt = (systemPrompt == null || systemPrompt.isEmpty() ? "" : "System: " + systemPrompt + "\n\n")
            + "User: " + userPrompt + "\n\nAssistant:";

        JsonObject generation = new JsonObject();
        generation.addProperty("temperature", config.getTemperature());
        generation.addProperty("num_predict", config.getMaxTokens());

        JsonObject payload = new JsonObject();
        payload.addProperty("model", config.getModelName());
        payload.addProperty("prompt", prompt);
        payload.addProperty("stream", false);
        payload.add("options", generation);

        Request request = new Request.Builder()
            .url(ollamaBaseUrl + "/api/generate")
            .post(RequestBody.create(payload.toString(), JSON))
            .build();

        long started = System.currentTimeMillis();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String raw = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new LLMRequestException("Ollama HTTP " + response.code() + " " + response.message() + ": " + raw);
            }
            JsonObject parsed = parseJsonLenient(raw);
            JsonElement answer = parsed == null ? null : parsed.get("response");
            if (answer == null || !answer.isJsonPrimitive()) {
                throw new LLMRequestException("Ollama response has no text 'response' field: " + raw);
            }
            String text = answer.getAsString().trim();
            if (text.isEmpty()) {
                throw new LLMRequestException("Ollama returned an empty response");
            }
            log.debug("Ollama ({}) answered in {} ms, {} chars", config.getModelName(),
                System.currentTimeMillis() - started, text.length());
            return text;
        } catch (IOException e) {
            throw new LLMRequestException("Ollama request failed: " + e.getMessage(), e);
        }
    }

    private JsonObject parseJsonLenient(String raw) {
        JsonElement element;
        try {
            element = JsonParser.parseString(raw);
        } catch (JsonParseException e) {
            // прокси иногда добавляет текст вокруг тела
            int open = raw.indexOf('{');
            int close = raw.lastIndexOf('}');
            if (open < 0 || close <= open) {
                throw new LLMRequestException("Cannot parse Ollama response: " + e.getMessage(), e);
            }
            try {
                JsonReader reader = new JsonReader(new StringReader(raw.substring(open, close + 1)));
                reader.setLenient(true);
                element = JsonParser.parseReader(reader);
            } catch (JsonParseException inner) {
                throw new LLMRequestException("Cannot parse Ollama response: " + inner.getMessage(), inner);
            }
        }
        if (element == null || !element.isJsonObject()) {
            throw new LLMRequestException("Ollama response is not a JSON object: " + raw);
        }
        return element.getAsJsonObject();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public LocalLLMConfig getConfig() {
        return config;
    }

    public String getOllamaBaseUrl() {
        return ollamaBaseUrl;
    }

    /**
     * Параметры генерации: модель, температура, лимит токенов и таймаут одного вызова
     */
    public static class LocalLLMConfig {
        private final String modelName;
        private final double temperature;
        private final int maxTokens;
        private final int timeoutSeconds;

        public LocalLLMConfig(String modelName, double temperature, int maxTokens, int timeoutSeconds) {
            if (modelName == null || modelName.isBlank()) {
                throw new IllegalArgumentException("Narration model name is required");
            }
            if (timeoutSeconds <= 0) {
                throw new IllegalArgumentException("Narration timeout must be positive: " + timeoutSeconds);
            }
            this.modelName = modelName;
            this.temperature = temperature;
            this.maxTokens = maxTokens;
            this.timeoutSeconds = timeoutSeconds;
        }

        public String getModelName() { return modelName; }
        public double getTemperature() { return temperature; }
        public int getMaxTokens() { return maxTokens; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
    }
}
