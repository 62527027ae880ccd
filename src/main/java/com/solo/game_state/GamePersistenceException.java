package com.solo.game_state;

/**
 * Ошибка хранилища сохранений (SQLite)
 */
public class GamePersistenceException extends RuntimeException {
    public GamePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
