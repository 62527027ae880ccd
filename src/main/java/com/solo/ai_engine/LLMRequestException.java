package com.solo.ai_engine;

/**
 * Неудачный запрос к языковой модели
 */
public class LLMRequestException extends RuntimeException {
    public LLMRequestException(String message) {
        super(message);
    }

    public LLMRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
