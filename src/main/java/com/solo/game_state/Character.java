package com.solo.game_state;

import com.google.gson.annotations.SerializedName;
import com.solo.content.Ability;
import com.solo.content.CharacterClass;
import com.solo.content.CharacterRace;
import com.solo.content.Spell;

import java.util.ArrayList;
import java.util.List;

/**
 * Персонаж игрока. Переживает кампании через реестр персонажей.
 */
public class Character extends Combatant {
    private CharacterRace race = CharacterRace.HUMAN;
    @SerializedName(value = "character_class", alternate = {"cls"})
    private CharacterClass characterClass;
    private AbilityScores stats = new AbilityScores();
    private int baseAc;
    private int mana;
    private int maxMana;
    private int gold;
    private int xp;
    private int level = 1;
    private List<Spell> learnedSpells = new ArrayList<>();

    private Character() {
    }

    public Character(String name, CharacterRace race, CharacterClass characterClass, AbilityScores stats,
                     int hp, int baseAc, int mana, int maxMana) {
        super(name, hp, hp, baseAc, characterClass.getAttackBonus(), characterClass.getDamage());
        this.race = race;
        this.characterClass = characterClass;
        this.stats = stats;
        this.baseAc = baseAc;
        this.mana = mana;
        this.maxMana = maxMana;
        this.learnedSpells = new ArrayList<>(characterClass.getStartingSpells());
    }

    public boolean isCaster() {
        return characterClass != null && characterClass.isCaster();
    }

    public int getStat(Ability ability) {
        return stats != null ? stats.get(ability) : 0;
    }

    public boolean knows(Spell spell) {
        return learnedSpells != null && learnedSpells.contains(spell);
    }

    /**
     * Восстанавливает ману, не превышая максимум; возвращает прирост
     */
    public int regenMana(int amount) {
        if (!isCaster() || maxMana <= 0) {
            return 0;
        }
        int before = mana;
        mana = Math.min(maxMana, mana + amount);
        return mana - before;
    }

    public boolean spendMana(int cost) {
        if (mana < cost) {
            return false;
        }
        mana -= cost;
        return true;
    }

    public CharacterRace getRace() { return race; }
    public void setRace(CharacterRace race) { this.race = race; }

    public CharacterClass getCharacterClass() { return characterClass; }
    public void setCharacterClass(CharacterClass characterClass) { this.characterClass = characterClass; }

    public AbilityScores getStats() { return stats; }
    public void setStats(AbilityScores stats) { this.stats = stats; }

    public int getBaseAc() { return baseAc; }
    public void setBaseAc(int baseAc) { this.baseAc = baseAc; }

    public int getMana() { return mana; }
    public void setMana(int mana) { this.mana = Math.max(0, mana); }

    public int getMaxMana() { return maxMana; }
    public void setMaxMana(int maxMana) { this.maxMana = Math.max(0, maxMana); }

    public int getGold() { return gold; }
    public void setGold(int gold) { this.gold = gold; }

    public int getXp() { return xp; }
    public void setXp(int xp) { this.xp = xp; }

    public int getLevel() { return level; }
    public void setLevel(int level) { this.level = level; }

    public List<Spell> getLearnedSpells() {
        if (learnedSpells == null) {
            learnedSpells = new ArrayList<>();
        }
        return learnedSpells;
    }
    public void setLearnedSpells(List<Spell> learnedSpells) { this.learnedSpells = new ArrayList<>(learnedSpells); }
}
