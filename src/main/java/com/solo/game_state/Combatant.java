package com.solo.game_state;

/**
 * Общая форма участника боя. HP всегда в пределах [0, maxHp].
 */
public abstract class Combatant {
    private String name;
    private int hp;
    private int maxHp;
    private int ac;
    private int attackBonus;
    private String damage;

    protected Combatant() {
    }

    protected Combatant(String name, int hp, int maxHp, int ac, int attackBonus, String damage) {
        this.name = name;
        this.maxHp = Math.max(0, maxHp);
        this.hp = clampHp(hp);
        this.ac = ac;
        this.attackBonus = attackBonus;
        this.damage = damage;
    }

    /**
     * Наносит урон и возвращает новое значение HP
     */
    public int takeDamage(int amount) {
        hp = clampHp(hp - Math.max(0, amount));
        return hp;
    }

    /**
     * Лечит не выше максимума и возвращает фактически восстановленное HP
     */
    public int heal(int amount) {
        int before = hp;
        hp = clampHp(hp + Math.max(0, amount));
        return hp - before;
    }

    public void restoreFullHp() {
        hp = maxHp;
    }

    public boolean isDown() {
        return hp <= 0;
    }

    public boolean isWounded() {
        return hp < maxHp;
    }

    public double hpRatio() {
        return (double) hp / Math.max(1, maxHp);
    }

    private int clampHp(int value) {
        return Math.max(0, Math.min(maxHp, value));
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public int getHp() { return hp; }
    public void setHp(int hp) { this.hp = clampHp(hp); }

    public int getMaxHp() { return maxHp; }
    public void setMaxHp(int maxHp) {
        this.maxHp = Math.max(0, maxHp);
        this.hp = clampHp(hp);
    }

    public int getAc() { return ac; }
    public void setAc(int ac) { this.ac = ac; }

    public int getAttackBonus() { return attackBonus; }
    public void setAttackBonus(int attackBonus) { this.attackBonus = attackBonus; }

    public String getDamage() { return damage; }
    public void setDamage(String damage) { this.damage = damage; }
}
