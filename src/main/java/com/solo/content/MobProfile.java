package com.solo.content;

/**
 * Шаблон противника. Либо фиксированный hp, либо hpExpr с минимумом и количеством.
 */
public class MobProfile {
    private String name;
    private int hp = 1;
    private String hpExpr = "";
    private int hpMin = 1;
    private int count = 1;
    private int ac = 10;
    private int attackBonus;
    private String damage = "1d4";
    private LootTable loot;
    private AiPolicy ai = AiPolicy.FOCUS_WEAKEST;
    private int xp;

    private MobProfile() {
    }

    private MobProfile(String name, int hp, String hpExpr, int hpMin, int count, int ac,
                       int attackBonus, String damage, LootTable loot, AiPolicy ai, int xp) {
        this.name = name;
        this.hp = hp;
        this.hpExpr = hpExpr;
        this.hpMin = hpMin;
        this.count = count;
        this.ac = ac;
        this.attackBonus = attackBonus;
        this.damage = damage;
        this.loot = loot;
        this.ai = ai;
        this.xp = xp;
    }

    public static MobProfile fixed(String name, int hp, int ac, int attackBonus, String damage,
                                   LootTable loot, AiPolicy ai, int xp) {
        return new MobProfile(name, hp, "", 1, 1, ac, attackBonus, damage, loot, ai, xp);
    }

    public static MobProfile rolled(String name, String hpExpr, int hpMin, int count, int ac,
                                    int attackBonus, String damage, LootTable loot, AiPolicy ai, int xp) {
        return new MobProfile(name, 1, hpExpr, hpMin, count, ac, attackBonus, damage, loot, ai, xp);
    }

    public boolean hasHpExpression() {
        return hpExpr != null && !hpExpr.isBlank();
    }

    public String getName() { return name; }
    public int getHp() { return hp; }
    public String getHpExpr() { return hpExpr; }
    public int getHpMin() { return hpMin; }
    public int getCount() { return Math.max(1, count); }
    public int getAc() { return ac; }
    public int getAttackBonus() { return attackBonus; }
    public String getDamage() { return damage; }
    public LootTable getLoot() { return loot != null ? loot : LootTable.empty(); }
    public AiPolicy getAi() { return ai != null ? ai : AiPolicy.FOCUS_WEAKEST; }
    public int getXp() { return xp; }
}
