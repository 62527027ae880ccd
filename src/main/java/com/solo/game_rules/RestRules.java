package com.solo.game_rules;

import com.solo.content.Spell;
import com.solo.game_state.Companion;
import com.solo.game_state.GameState;
import com.solo.game_state.PendingDecision;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Отдых: восстановление маны, лечение на каждом втором отдыхе подряд и отложенные решения.
 * Выбор игрока движок не ждёт: отдых лишь предлагает решения, разрешаются они отдельным вызовом.
 */
public class RestRules {
    public static final int HEAL_STREAK = 2;

    public RuleResult applyRest(GameState state) {
        List<String> parts = new ArrayList<>();
        for (PendingDecision decision : state.getPendingDecisions()) {
            decision.setOffered(true);
            String options = decision.getOptions().stream()
                .map(Spell::getDisplayName)
                .collect(Collectors.joining(", "));
            parts.add("Choose a new spell (level " + decision.getLevel() + "): " + options + ".");
        }

        int manaGained = state.getPlayer().regenMana(1);
        for (Companion companion : state.getCompanions()) {
            manaGained += companion.regenMana(1);
        }

        int hpGained = 0;
        state.setRestStreak(state.getRestStreak() + 1);
        if (state.getRestStreak() >= HEAL_STREAK) {
            hpGained += state.getPlayer().heal(1);
            for (Companion companion : state.getCompanions()) {
                hpGained += companion.heal(1);
            }
            state.setRestStreak(0);
        }

        parts.add("You rest and regain your focus.");
        if (manaGained > 0) {
            parts.add("Mana +" + manaGained + ".");
        }
        if (hpGained > 0) {
            parts.add("HP +" + hpGained + ".");
        }
        return RuleResult.consumed(String.join(" ", parts));
    }

    /**
     * Разрешает предложенное отдыхом решение: index задаёт позицию в очереди (с нуля), choice задаёт название заклинания
     */
    public RuleResult resolveDecision(GameState state, int index, String choice) {
        List<PendingDecision> pending = state.getPendingDecisions();
        if (index < 0 || index >= pending.size()) {
            return RuleResult.rejected("There is no such decision to make.");
        }
        PendingDecision decision = pending.get(index);
        if (!decision.isOffered()) {
            return RuleResult.rejected("Rest first to consider your new options.");
        }
        Spell spell = decision.findOption(choice);
        if (spell == null) {
            String options = decision.getOptions().stream()
                .map(Spell::getDisplayName)
                .collect(Collectors.joining(", "));
            return RuleResult.rejected("Choose one of: " + options + ".");
        }
        pending.remove(index);
        if (!state.getPlayer().knows(spell)) {
            state.getPlayer().getLearnedSpells().add(spell);
        }
        return RuleResult.consumed("You learn " + spell.getDisplayName() + ".");
    }
}
