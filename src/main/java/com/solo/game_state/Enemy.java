package com.solo.game_state;

/**
 * Противник в текущем бою. Имя совпадает с именем шаблона монстра.
 */
public class Enemy extends Combatant {
    private boolean asleep;

    private Enemy() {
    }

    public Enemy(String name, int hp, int ac, int attackBonus, String damage) {
        super(name, hp, hp, ac, attackBonus, damage);
    }

    public boolean isAsleep() { return asleep; }
    public void setAsleep(boolean asleep) { this.asleep = asleep; }
}
