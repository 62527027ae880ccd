package com.solo.prompts;

import com.solo.ai_engine.StateSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Промпты рассказчика и спутника
 */
public class NarrationPrompts {

    /**
     * Системный промпт рассказчика: только пересказ уже разрешённого правилами
     */
    public static String getNarratorSystemPrompt(int maxWords) {
        return String.format("""
        You are the GM for a tiny solo fantasy adventure. Narrate outcomes that the rules engine \
        already resolved. Do NOT invent new outcomes, rolls, damage, or state changes. Ask the player \
        what they do next with a short question. Keep responses under %d words.
        """, maxWords);
    }

    /**
     * Системный промпт спутника
     */
    public static String getCompanionSystemPrompt(String companionName) {
        return String.format("""
        You are %s, a companion travelling with the player. Give a short, practical suggestion \
        (1 sentence) based on the current situation. Do NOT narrate outcomes or change the game state. \
        Only suggest actions that are actually available. Vary your suggestions: movement, exploration, \
        combat actions, or rest, whatever fits best. Only suggest healing or potions when someone is \
        wounded (HP below max) and it would help. When everyone is at full HP, never suggest healing.
        """, companionName);
    }

    public static String formatStateForNarrator(StateSnapshot snapshot) {
        List<String> parts = new ArrayList<>();
        parts.add("Room: " + snapshot.getRoomName());
        parts.add("Room kind: " + snapshot.getRoomKind());
        parts.add("Player: " + snapshot.getPlayerName() + " (" + snapshot.getPlayerRace() + " "
            + snapshot.getPlayerClass() + ") Level " + snapshot.getPlayerLevel()
            + " HP " + snapshot.getPlayerHp() + "/" + snapshot.getPlayerMaxHp());
        parts.add("Stats: " + snapshot.getPlayerStats());
        parts.add("Mana: " + snapshot.getPlayerMana() + "/" + snapshot.getPlayerMaxMana());
        parts.add("Gold: " + snapshot.getGold());
        parts.add("Companions: " + joinOr(snapshot.getCompanions(), " | ", "(none)"));
        parts.add("Inventory: " + joinOr(snapshot.getInventory(), ", ", "(empty)"));
        parts.add("In combat: " + snapshot.isInCombat());
        if (!snapshot.getEnemies().isEmpty()) {
            parts.add("Enemies: " + String.join(" | ", snapshot.getEnemies()));
        }
        if (snapshot.getLastEvent() != null && !snapshot.getLastEvent().isEmpty()) {
            parts.add("Last event: " + snapshot.getLastEvent());
        }
        if (!snapshot.getFlags().isEmpty()) {
            parts.add("Flags: " + String.join(", ", snapshot.getFlags()));
        }
        return String.join("\n", parts);
    }

    public static String formatStateForCompanion(StateSnapshot snapshot) {
        List<String> parts = new ArrayList<>();
        parts.add("Room: " + snapshot.getRoomName() + " (" + snapshot.getRoomKind() + ")");
        parts.add("Player Level " + snapshot.getPlayerLevel() + " HP " + snapshot.getPlayerHp() + "/"
            + snapshot.getPlayerMaxHp());
        parts.addAll(snapshot.getCompanions());
        parts.add("Mana: " + snapshot.getPlayerMana() + "/" + snapshot.getPlayerMaxMana());
        parts.add("Gold: " + snapshot.getGold());
        parts.add("Inventory: " + joinOr(snapshot.getInventory(), ", ", "(empty)"));
        parts.add("In combat: " + snapshot.isInCombat());
        if (!snapshot.getEnemies().isEmpty()) {
            parts.add("Enemies: " + String.join(" | ", snapshot.getEnemies()));
        }
        if (snapshot.getLastEvent() != null && !snapshot.getLastEvent().isEmpty()) {
            parts.add("Last event: " + snapshot.getLastEvent());
        }
        return String.join("\n", parts);
    }

    public static String getNarrationPrompt(StateSnapshot snapshot, String playerInput, String rulesResult) {
        return "STATE\n" + formatStateForNarrator(snapshot) + "\n\n"
            + "PLAYER INPUT\n" + playerInput + "\n\n"
            + "RULES RESULT\n" + rulesResult + "\n\n"
            + "Add brief atmospheric flavor (do not repeat RULES RESULT verbatim) and end with a short question "
            + "prompting the player's next action.";
    }

    public static String getSuggestionPrompt(StateSnapshot snapshot, List<String> actions) {
        String note = snapshot.isEveryoneAtFullHp()
            ? "\nEveryone at full HP. Suggest movement, exploration, or combat, not healing.\n"
            : "";
        return "STATE\n" + formatStateForCompanion(snapshot) + "\n"
            + note + "\n"
            + "Available actions: " + String.join(", ", actions) + "\n"
            + "Give a brief suggestion.";
    }

    private static String joinOr(List<String> values, String separator, String empty) {
        return values.isEmpty() ? empty : String.join(separator, values);
    }
}
