package com.solo.content;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Каталог заклинаний
 */
public enum Spell {
    @SerializedName("Spark") SPARK("Spark", SpellKind.DAMAGE, "1d4", 2),
    @SerializedName("Magic Missile") MAGIC_MISSILE("Magic Missile", SpellKind.DAMAGE, "1d6", 2),
    @SerializedName("Cure Wounds") CURE_WOUNDS("Cure Wounds", SpellKind.HEAL, "1d8", 2),
    @SerializedName("Shield") SHIELD("Shield", SpellKind.WARD, null, 1),
    @SerializedName("Sleep") SLEEP("Sleep", SpellKind.UTILITY, null, 0);

    // Порядок предпочтения боевых заклинаний
    private static final List<Spell> DAMAGE_PREFERENCE = List.of(MAGIC_MISSILE, SPARK);

    private final String displayName;
    private final SpellKind kind;
    private final String dice;
    private final int manaCost;

    Spell(String displayName, SpellKind kind, String dice, int manaCost) {
        this.displayName = displayName;
        this.kind = kind;
        this.dice = dice;
        this.manaCost = manaCost;
    }

    public String getDisplayName() { return displayName; }
    public SpellKind getKind() { return kind; }
    public String getDice() { return dice; }
    public int getManaCost() { return manaCost; }

    public boolean isDamage() {
        return kind == SpellKind.DAMAGE;
    }

    /**
     * Лучшее известное боевое заклинание или null
     */
    public static Spell bestDamageSpell(List<Spell> learned) {
        if (learned == null) {
            return null;
        }
        for (Spell spell : DAMAGE_PREFERENCE) {
            if (learned.contains(spell)) {
                return spell;
            }
        }
        return null;
    }

    /**
     * Поиск по отображаемому имени без учёта регистра; null, если не найдено
     */
    public static Spell fromName(String name) {
        if (name == null) {
            return null;
        }
        String key = name.trim();
        for (Spell spell : values()) {
            if (spell.displayName.equalsIgnoreCase(key) || spell.name().equalsIgnoreCase(key)) {
                return spell;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
