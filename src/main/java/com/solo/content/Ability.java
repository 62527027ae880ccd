package com.solo.content;

/**
 * Шесть характеристик персонажа (бонусы от 0 до 4)
 */
public enum Ability {
    STR,
    DEX,
    CON,
    INT,
    WIS,
    CHA;

    public static Ability fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Unknown ability: null");
        }
        for (Ability ability : values()) {
            if (ability.name().equalsIgnoreCase(value.trim())) {
                return ability;
            }
        }
        throw new IllegalArgumentException("Unknown ability: " + value);
    }
}
