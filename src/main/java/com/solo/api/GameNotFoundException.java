package com.solo.api;

/**
 * Запрошенная сессия не найдена в хранилище
 */
public class GameNotFoundException extends RuntimeException {
    public GameNotFoundException(String sessionId) {
        super("Game not found: " + sessionId);
    }
}
