package com.solo.game_state;

/**
 * Сохранение существует, но повреждено или имеет неверную структуру
 */
public class SaveCorruptedException extends RuntimeException {
    public SaveCorruptedException(String message) {
        super(message);
    }

    public SaveCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
