package com.solo.game_state;

import com.google.gson.annotations.SerializedName;
import com.solo.content.Ability;

import java.util.EnumMap;
import java.util.Map;

/**
 * Характеристики персонажа (бонусы, а не значения 3-18)
 */
public class AbilityScores {
    @SerializedName("STR")
    private int strength;
    @SerializedName("DEX")
    private int dexterity;
    @SerializedName("CON")
    private int constitution;
    @SerializedName("INT")
    private int intelligence;
    @SerializedName("WIS")
    private int wisdom;
    @SerializedName("CHA")
    private int charisma;

    public AbilityScores() {
    }

    public AbilityScores(int strength, int dexterity, int constitution,
                         int intelligence, int wisdom, int charisma) {
        this.strength = strength;
        this.dexterity = dexterity;
        this.constitution = constitution;
        this.intelligence = intelligence;
        this.wisdom = wisdom;
        this.charisma = charisma;
    }

    public static AbilityScores fromMap(Map<Ability, Integer> values) {
        AbilityScores scores = new AbilityScores();
        for (Ability ability : Ability.values()) {
            scores.set(ability, values.getOrDefault(ability, 0));
        }
        return scores;
    }

    public Map<Ability, Integer> toMap() {
        Map<Ability, Integer> result = new EnumMap<>(Ability.class);
        for (Ability ability : Ability.values()) {
            result.put(ability, get(ability));
        }
        return result;
    }

    public int get(Ability ability) {
        return switch (ability) {
            case STR -> strength;
            case DEX -> dexterity;
            case CON -> constitution;
            case INT -> intelligence;
            case WIS -> wisdom;
            case CHA -> charisma;
        };
    }

    public void set(Ability ability, int value) {
        switch (ability) {
            case STR -> strength = value;
            case DEX -> dexterity = value;
            case CON -> constitution = value;
            case INT -> intelligence = value;
            case WIS -> wisdom = value;
            case CHA -> charisma = value;
        }
    }

    @Override
    public String toString() {
        return "STR " + strength + " DEX " + dexterity + " CON " + constitution
            + " INT " + intelligence + " WIS " + wisdom + " CHA " + charisma;
    }

    // Getters and Setters
    public int getStrength() { return strength; }
    public void setStrength(int strength) { this.strength = strength; }

    public int getDexterity() { return dexterity; }
    public void setDexterity(int dexterity) { this.dexterity = dexterity; }

    public int getConstitution() { return constitution; }
    public void setConstitution(int constitution) { this.constitution = constitution; }

    public int getIntelligence() { return intelligence; }
    public void setIntelligence(int intelligence) { this.intelligence = intelligence; }

    public int getWisdom() { return wisdom; }
    public void setWisdom(int wisdom) { this.wisdom = wisdom; }

    public int getCharisma() { return charisma; }
    public void setCharisma(int charisma) { this.charisma = charisma; }
}
