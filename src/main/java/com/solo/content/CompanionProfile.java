package com.solo.content;

import java.util.ArrayList;
import java.util.List;

/**
 * Шаблон спутника из данных кампании
 */
public class CompanionProfile {
    private String id;
    private String name;
    private int hp;
    private int maxHp;
    private int ac;
    private int attackBonus;
    private String damage;
    private int defendHpThreshold = 3;
    private int mana;
    private int maxMana;
    private List<Spell> spells = new ArrayList<>();

    private CompanionProfile() {
    }

    public CompanionProfile(String id, String name, int hp, int maxHp, int ac, int attackBonus,
                            String damage, int defendHpThreshold, int mana, int maxMana, List<Spell> spells) {
        this.id = id;
        this.name = name;
        this.hp = hp;
        this.maxHp = maxHp;
        this.ac = ac;
        this.attackBonus = attackBonus;
        this.damage = damage;
        this.defendHpThreshold = defendHpThreshold;
        this.mana = mana;
        this.maxMana = maxMana;
        this.spells = spells != null ? new ArrayList<>(spells) : new ArrayList<>();
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public int getHp() { return hp; }
    public int getMaxHp() { return maxHp > 0 ? maxHp : hp; }
    public int getAc() { return ac; }
    public int getAttackBonus() { return attackBonus; }
    public String getDamage() { return damage; }
    public int getDefendHpThreshold() { return defendHpThreshold; }
    public int getMana() { return mana; }
    public int getMaxMana() { return maxMana; }
    public List<Spell> getSpells() { return spells != null ? spells : List.of(); }
}
