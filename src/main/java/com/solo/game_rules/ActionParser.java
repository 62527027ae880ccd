package com.solo.game_rules;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Разбор уже нормализованной команды игрока на глагол и аргумент
 */
public class ActionParser {
    private static final Set<String> FILLER = Set.of("to", "the", "a", "an", "towards", "toward");
    private static final Set<String> MOVE_VERBS = Set.of("go", "move", "walk", "head", "enter", "travel", "leave");
    private static final Set<String> BARE_DIRECTIONS = Set.of("up", "down", "north", "south", "east", "west", "back");

    /**
     * Приводит ввод к нижнему регистру и убирает служебные слова после глаголов движения
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String cleaned = raw.trim().toLowerCase(Locale.ROOT);
        if (cleaned.isEmpty()) {
            return cleaned;
        }
        String[] tokens = cleaned.split("\\s+");
        if (!MOVE_VERBS.contains(tokens[0])) {
            return String.join(" ", tokens);
        }
        StringBuilder sb = new StringBuilder(tokens[0]);
        for (int i = 1; i < tokens.length; i++) {
            if (!FILLER.contains(tokens[i])) {
                sb.append(' ').append(tokens[i]);
            }
        }
        return sb.toString();
    }

    public static ParsedAction parse(String raw) {
        String action = normalize(raw);
        if (action.isEmpty()) {
            return new ParsedAction(action, "", "");
        }
        if (BARE_DIRECTIONS.contains(action)) {
            return new ParsedAction(action, "move", action);
        }
        int space = action.indexOf(' ');
        String verb = space < 0 ? action : action.substring(0, space);
        String argument = space < 0 ? "" : action.substring(space + 1).trim();
        if (MOVE_VERBS.contains(verb)) {
            verb = "move";
        } else if ("drink".equals(verb)) {
            verb = "use";
        }
        return new ParsedAction(action, verb, argument);
    }

    /**
     * Разделяет "предмет on цель" для команды use
     */
    public static List<String> splitTarget(String argument) {
        int idx = argument.indexOf(" on ");
        if (idx < 0) {
            return List.of(argument.trim(), "");
        }
        return List.of(argument.substring(0, idx).trim(), argument.substring(idx + 4).trim());
    }

    public static class ParsedAction {
        private final String normalized;
        private final String verb;
        private final String argument;

        public ParsedAction(String normalized, String verb, String argument) {
            this.normalized = normalized;
            this.verb = verb;
            this.argument = argument;
        }

        public String getNormalized() { return normalized; }
        public String getVerb() { return verb; }
        public String getArgument() { return argument; }
        public boolean hasArgument() { return !argument.isEmpty(); }
    }
}
