package com.solo.content;

/**
 * Эффект предмета: лечение по выражению кубиков или бонус к AC
 */
public class ItemEffect {
    private EffectType type;
    private String dice;
    private int bonus;

    private ItemEffect() {
    }

    public ItemEffect(EffectType type, String dice, int bonus) {
        this.type = type;
        this.dice = dice;
        this.bonus = bonus;
    }

    public static ItemEffect heal(String dice) {
        return new ItemEffect(EffectType.HEAL, dice, 0);
    }

    public static ItemEffect armor(int bonus) {
        return new ItemEffect(EffectType.AC, null, bonus);
    }

    public EffectType getType() { return type; }
    public String getDice() { return dice != null ? dice : "1d6"; }
    public int getBonus() { return bonus; }
}
