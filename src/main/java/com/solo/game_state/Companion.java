package com.solo.game_state;

import com.solo.content.Spell;

import java.util.ArrayList;
import java.util.List;

/**
 * Спутник игрока
 */
public class Companion extends Combatant {
    private int mana;
    private int maxMana;
    private List<Spell> learnedSpells = new ArrayList<>();
    private int defendHpThreshold = 3;

    private Companion() {
    }

    public Companion(String name, int hp, int maxHp, int ac, int attackBonus, String damage,
                     int mana, int maxMana, List<Spell> learnedSpells, int defendHpThreshold) {
        super(name, hp, maxHp, ac, attackBonus, damage);
        this.mana = mana;
        this.maxMana = maxMana;
        this.learnedSpells = new ArrayList<>(learnedSpells);
        this.defendHpThreshold = defendHpThreshold;
    }

    public boolean hasManaPool() {
        return maxMana > 0;
    }

    public int regenMana(int amount) {
        if (!hasManaPool()) {
            return 0;
        }
        int before = mana;
        mana = Math.min(maxMana, mana + amount);
        return mana - before;
    }

    public int getMana() { return mana; }
    public void setMana(int mana) { this.mana = Math.max(0, mana); }

    public int getMaxMana() { return maxMana; }
    public void setMaxMana(int maxMana) { this.maxMana = Math.max(0, maxMana); }

    public List<Spell> getLearnedSpells() {
        if (learnedSpells == null) {
            learnedSpells = new ArrayList<>();
        }
        return learnedSpells;
    }

    public int getDefendHpThreshold() { return defendHpThreshold; }
    public void setDefendHpThreshold(int defendHpThreshold) { this.defendHpThreshold = defendHpThreshold; }
}
