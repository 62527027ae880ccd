package com.solo.content;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Классы персонажей: роль, базовые боевые числа, стартовые и изучаемые заклинания
 */
public enum CharacterClass {
    @SerializedName(value = "Fighter", alternate = {"fighter"})
    FIGHTER("Fighter", ClassRole.MELEE, 14, 15, 3, "1d8+1", List.of(), 2,
            null, SpecialStyle.POWER_STRIKE, List.of(), "Hardy frontline combatant."),
    @SerializedName(value = "Rogue", alternate = {"rogue"})
    ROGUE("Rogue", ClassRole.MELEE, 10, 14, 2, "1d6+1", List.of(), 1,
            null, SpecialStyle.PRECISION, List.of(), "Agile skirmisher with precision strikes."),
    @SerializedName(value = "Wizard", alternate = {"wizard"})
    WIZARD("Wizard", ClassRole.CASTER, 8, 12, 1, "1d4+1", List.of(Spell.SPARK), 1,
            Ability.INT, SpecialStyle.SPELLCASTING,
            List.of(Spell.MAGIC_MISSILE, Spell.SHIELD, Spell.SLEEP), "Arcane caster with limited stamina."),
    @SerializedName(value = "Cleric", alternate = {"cleric"})
    CLERIC("Cleric", ClassRole.CASTER, 12, 14, 2, "1d6+1", List.of(Spell.CURE_WOUNDS), 1,
            Ability.WIS, SpecialStyle.PLAIN, List.of(), "Divine healer and support caster.");

    public static final int POWER_STRIKE_DAMAGE = 2;
    public static final int PRECISION_TO_HIT = 2;

    private final String value;
    private final ClassRole role;
    private final int baseHp;
    private final int baseAc;
    private final int attackBonus;
    private final String damage;
    private final List<Spell> startingSpells;
    private final int hpPerLevel;
    private final Ability spellcastingAbility;
    private final SpecialStyle specialStyle;
    private final List<Spell> learnableSpells;
    private final String description;

    CharacterClass(String value, ClassRole role, int baseHp, int baseAc, int attackBonus, String damage,
                   List<Spell> startingSpells, int hpPerLevel, Ability spellcastingAbility,
                   SpecialStyle specialStyle, List<Spell> learnableSpells, String description) {
        this.value = value;
        this.role = role;
        this.baseHp = baseHp;
        this.baseAc = baseAc;
        this.attackBonus = attackBonus;
        this.damage = damage;
        this.startingSpells = startingSpells;
        this.hpPerLevel = hpPerLevel;
        this.spellcastingAbility = spellcastingAbility;
        this.specialStyle = specialStyle;
        this.learnableSpells = learnableSpells;
        this.description = description;
    }

    public String getValue() { return value; }
    public ClassRole getRole() { return role; }
    public int getBaseHp() { return baseHp; }
    public int getBaseAc() { return baseAc; }
    public int getAttackBonus() { return attackBonus; }
    public String getDamage() { return damage; }
    public List<Spell> getStartingSpells() { return startingSpells; }
    public int getHpPerLevel() { return hpPerLevel; }
    public Ability getSpellcastingAbility() { return spellcastingAbility; }
    public SpecialStyle getSpecialStyle() { return specialStyle; }
    public List<Spell> getLearnableSpells() { return learnableSpells; }
    public String getDescription() { return description; }

    public boolean isCaster() {
        return role == ClassRole.CASTER;
    }

    /**
     * Заклинания на выбор при достижении уровня: только чётные уровни от 2 и только неизученные
     */
    public List<Spell> spellChoicesForLevel(int level, List<Spell> learned) {
        if (learnableSpells.isEmpty() || level < 2 || level % 2 != 0) {
            return List.of();
        }
        return learnableSpells.stream()
            .filter(spell -> learned == null || !learned.contains(spell))
            .collect(Collectors.toList());
    }

    public static CharacterClass fromString(String value) {
        for (CharacterClass cc : CharacterClass.values()) {
            if (cc.value.equalsIgnoreCase(value) || cc.name().equalsIgnoreCase(value)) {
                return cc;
            }
        }
        throw new IllegalArgumentException("Unknown character class: " + value);
    }
}
