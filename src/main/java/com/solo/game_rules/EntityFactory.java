package com.solo.game_rules;

import com.solo.content.Ability;
import com.solo.content.CharacterClass;
import com.solo.content.CharacterRace;
import com.solo.content.CompanionProfile;
import com.solo.content.ContentRegistry;
import com.solo.content.MobProfile;
import com.solo.game_state.AbilityScores;
import com.solo.game_state.Character;
import com.solo.game_state.Companion;
import com.solo.game_state.Enemy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Создание игрока, спутников и противников из шаблонов
 */
public class EntityFactory {
    public static final int STAT_POINTS = 12;
    public static final int MIN_RAW_STAT = 0;
    public static final int MAX_RAW_STAT = 4;

    private final ContentRegistry registry;
    private final DiceRoller dice;

    public EntityFactory(ContentRegistry registry, DiceRoller dice) {
        this.registry = registry;
        this.dice = dice;
    }

    /**
     * Новый персонаж: модификаторы расы, HP = база класса + max(0, CON), мана только у заклинателей
     */
    public static Character createPlayer(String name, CharacterClass characterClass,
                                          Map<Ability, Integer> rawStats, CharacterRace race) {
        AbilityScores stats = AbilityScores.fromMap(race.applyMods(rawStats));
        int hp = characterClass.getBaseHp() + Math.max(0, stats.get(Ability.CON));
        int mana = characterClass.isCaster() ? casterMana(characterClass, stats) : 0;
        return new Character(name, race, characterClass, stats, hp, characterClass.getBaseAc(), mana, mana);
    }

    /**
     * Распределение очков: каждая характеристика от 0 до 4, все 12 очков потрачены
     */
    public static void validateStatAllocation(Map<Ability, Integer> rawStats) {
        int total = 0;
        for (Ability ability : Ability.values()) {
            int value = rawStats.getOrDefault(ability, 0);
            if (value < MIN_RAW_STAT || value > MAX_RAW_STAT) {
                throw new IllegalArgumentException(ability + " must be between " + MIN_RAW_STAT + " and " + MAX_RAW_STAT);
            }
            total += value;
        }
        if (total != STAT_POINTS) {
            throw new IllegalArgumentException("Stats must spend exactly " + STAT_POINTS + " points, got " + total);
        }
    }

    /**
     * Запас маны заклинателя: 2 + 2 * max(0, управляющая характеристика)
     */
    public static int casterMana(CharacterClass characterClass, AbilityScores stats) {
        Ability governing = characterClass.getSpellcastingAbility() != null
            ? characterClass.getSpellcastingAbility()
            : Ability.INT;
        return 2 + 2 * Math.max(0, stats.get(governing));
    }

    /**
     * Восстанавливает пул маны после загрузки: пустой пересчитывается, лишняя мана срезается
     */
    public static void ensureCasterMana(Character player) {
        if (!player.isCaster()) {
            return;
        }
        if (player.getMaxMana() <= 0) {
            int max = casterMana(player.getCharacterClass(), player.getStats());
            player.setMaxMana(max);
            player.setMana(max);
        } else {
            player.setMana(Math.min(player.getMana(), player.getMaxMana()));
        }
    }

    public static Companion createCompanion(CompanionProfile profile) {
        return new Companion(
            profile.getName(),
            profile.getHp(),
            profile.getMaxHp(),
            profile.getAc(),
            profile.getAttackBonus(),
            profile.getDamage(),
            profile.getMana(),
            profile.getMaxMana(),
            profile.getSpells(),
            profile.getDefendHpThreshold()
        );
    }

    public Companion createCompanion(String campaignId, String companionId) {
        String id = companionId;
        if (id == null || id.isBlank()) {
            List<String> defaults = registry.getCampaign(campaignId).getDefaultCompanionIds();
            if (defaults.isEmpty()) {
                throw new IllegalArgumentException("Campaign '" + campaignId + "' defines no companions");
            }
            id = defaults.get(0);
        }
        return createCompanion(registry.getCompanionProfile(campaignId, id));
    }

    /**
     * Противники комнаты. При hpExpr HP бросается отдельно для каждой особи с нижней границей hpMin.
     */
    public List<Enemy> createEnemies(String campaignId, String mobName) {
        MobProfile template = registry.getMobProfile(campaignId, mobName);
        List<Enemy> enemies = new ArrayList<>();
        for (int i = 0; i < template.getCount(); i++) {
            int hp = template.hasHpExpression()
                ? Math.max(template.getHpMin(), dice.roll(template.getHpExpr()).getTotal())
                : template.getHp();
            enemies.add(new Enemy(mobName, hp, template.getAc(), template.getAttackBonus(), template.getDamage()));
        }
        return enemies;
    }
}
