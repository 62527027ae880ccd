package com.solo.game_rules;

/**
 * Итог применения правил: текст для рассказчика и признак того, что ход потрачен
 */
public class RuleResult {
    private final String message;
    private final boolean consumed;

    private RuleResult(String message, boolean consumed) {
        this.message = message;
        this.consumed = consumed;
    }

    public static RuleResult consumed(String message) {
        return new RuleResult(message, true);
    }

    /**
     * Ошибка ввода или нехватка ресурса: состояние не изменено, ход не потрачен
     */
    public static RuleResult rejected(String message) {
        return new RuleResult(message, false);
    }

    public String getMessage() { return message; }
    public boolean isConsumed() { return consumed; }

    @Override
    public String toString() {
        return message;
    }
}
