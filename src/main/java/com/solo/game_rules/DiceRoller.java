package com.solo.game_rules;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Утилита для бросков кубиков. Источник случайности подменяется в тестах.
 */
public class DiceRoller {
    private static final Pattern DICE_PATTERN = Pattern.compile("(\\d*)d(\\d+)([+-]\\d+)?");
    private static final Pattern LITERAL_PATTERN = Pattern.compile("[+-]?\\d+");

    private final Random random;

    public DiceRoller() {
        this(new Random());
    }

    public DiceRoller(Random random) {
        this.random = random;
    }

    /**
     * Равномерное целое в [1, sides]
     */
    public int rollDie(int sides) {
        if (sides < 1) {
            throw new IllegalArgumentException("Die must have at least one side: " + sides);
        }
        return random.nextInt(sides) + 1;
    }

    /**
     * Бросок кубиков по выражению ("1d8+1", "2d4", "d6", "1d4-1" или просто число)
     */
    public DiceResult roll(String expression) {
        String expr = normalize(expression);
        if (LITERAL_PATTERN.matcher(expr).matches()) {
            int value = Integer.parseInt(expr);
            return new DiceResult(value, List.of(), value, String.valueOf(value));
        }
        Matcher matcher = DICE_PATTERN.matcher(expr);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid dice expression: " + expression);
        }

        int numDice = matcher.group(1).isEmpty() ? 1 : Integer.parseInt(matcher.group(1));
        int sides = Integer.parseInt(matcher.group(2));
        String modifierStr = matcher.group(3);
        int modifier = modifierStr != null ? Integer.parseInt(modifierStr) : 0;

        List<Integer> rolls = new ArrayList<>();
        for (int i = 0; i < numDice; i++) {
            rolls.add(rollDie(sides));
        }
        int total = rolls.stream().mapToInt(Integer::intValue).sum() + modifier;

        StringJoiner joiner = new StringJoiner("+");
        rolls.forEach(r -> joiner.add(String.valueOf(r)));
        String detail = joiner.toString();
        if (modifier != 0) {
            detail = detail + signed(modifier);
        }
        return new DiceResult(total, rolls, modifier, detail);
    }

    /**
     * Проверка d20 + бонус против сложности
     */
    public CheckResult check(int statBonus, int dc) {
        int roll = rollDie(20);
        int total = roll + statBonus;
        return new CheckResult(total >= dc, roll, total);
    }

    public static boolean isValidExpression(String expression) {
        if (expression == null) {
            return false;
        }
        String expr = normalize(expression);
        if (LITERAL_PATTERN.matcher(expr).matches()) {
            return true;
        }
        Matcher matcher = DICE_PATTERN.matcher(expr);
        return matcher.matches() && Integer.parseInt(matcher.group(2)) > 0;
    }

    public static String signed(int value) {
        return value >= 0 ? "+" + value : String.valueOf(value);
    }

    private static String normalize(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("Dice expression is missing");
        }
        return expression.toLowerCase().replace(" ", "");
    }

    // Result classes
    public static class DiceResult {
        private final int total;
        private final List<Integer> rolls;
        private final int modifier;
        private final String detail;

        public DiceResult(int total, List<Integer> rolls, int modifier, String detail) {
            this.total = total;
            this.rolls = rolls;
            this.modifier = modifier;
            this.detail = detail;
        }

        public int getTotal() { return total; }
        public List<Integer> getRolls() { return rolls; }
        public int getModifier() { return modifier; }
        public String getDetail() { return detail; }
    }

    public static class CheckResult {
        private final boolean success;
        private final int roll;
        private final int total;

        public CheckResult(boolean success, int roll, int total) {
            this.success = success;
            this.roll = roll;
            this.total = total;
        }

        public boolean isSuccess() { return success; }
        public int getRoll() { return roll; }
        public int getTotal() { return total; }
    }
}
