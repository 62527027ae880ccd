package com.solo.game_rules;

import com.solo.content.CharacterClass;
import com.solo.content.Spell;
import com.solo.game_state.Character;
import com.solo.game_state.DecisionType;
import com.solo.game_state.GameState;
import com.solo.game_state.PendingDecision;

import java.util.ArrayList;
import java.util.List;

/**
 * Опыт и повышение уровня. Выбор заклинаний откладывается до отдыха.
 */
public class ProgressionEngine {
    // Индекс 0 = уровень 1
    private static final int[] XP_TABLE = {0, 100, 250, 500, 1000, 2000, 3500, 5000, 7000, 10000};

    static int maxLevel() {
        return XP_TABLE.length;
    }

    public static int xpForLevel(int level) {
        if (level <= 0) {
            return 0;
        }
        int idx = Math.min(level - 1, XP_TABLE.length - 1);
        return XP_TABLE[idx];
    }

    static int levelFromXp(int xp) {
        for (int level = XP_TABLE.length; level > 0; level--) {
            if (xp >= XP_TABLE[level - 1]) {
                return level;
            }
        }
        return 1;
    }

    /**
     * Начисляет опыт и применяет все заработанные повышения. Возвращает сообщения о них.
     */
    public List<String> grantXp(GameState state, int amount) {
        List<String> messages = new ArrayList<>();
        if (amount <= 0) {
            return messages;
        }
        Character player = state.getPlayer();
        player.setXp(player.getXp() + amount);
        int earned = Math.min(levelFromXp(player.getXp()), maxLevel());
        while (player.getLevel() < earned) {
            messages.add(applyLevelUp(state));
        }
        return messages;
    }

    private String applyLevelUp(GameState state) {
        Character player = state.getPlayer();
        CharacterClass characterClass = player.getCharacterClass();
        player.setLevel(player.getLevel() + 1);

        int hpPerLevel = characterClass.getHpPerLevel();
        player.setMaxHp(player.getMaxHp() + hpPerLevel);
        player.setHp(player.getHp() + hpPerLevel);
        if (player.getLevel() % 2 == 0) {
            player.setAttackBonus(player.getAttackBonus() + 1);
        }
        if (player.isCaster()) {
            player.setMaxMana(player.getMaxMana() + 2);
            player.setMana(player.getMaxMana());
        }

        List<Spell> choices = characterClass.spellChoicesForLevel(player.getLevel(), player.getLearnedSpells());
        if (!choices.isEmpty()) {
            state.getPendingDecisions().add(new PendingDecision(DecisionType.SPELL, player.getLevel(), choices));
        }
        return "Level up! " + player.getName() + " is now level " + player.getLevel() + ".";
    }
}
