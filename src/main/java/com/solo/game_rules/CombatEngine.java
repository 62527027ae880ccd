package com.solo.game_rules;

import com.solo.content.AiPolicy;
import com.solo.content.CharacterClass;
import com.solo.content.ContentRegistry;
import com.solo.content.Spell;
import com.solo.content.SpellKind;
import com.solo.game_state.Character;
import com.solo.game_state.Combatant;
import com.solo.game_state.Companion;
import com.solo.game_state.CorpseRecord;
import com.solo.game_state.Enemy;
import com.solo.game_state.GameState;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Боевой раунд: действие игрока, действие спутника, по одному действию каждого живого врага,
 * затем снятие однораундовых стоек и проверка конца боя.
 */
public class CombatEngine {
    public static final int DEFEND_AC_BONUS = 2;

    private final ContentRegistry registry;
    private final DiceRoller dice;
    private final ProgressionEngine progression;
    private final InventoryRules inventory;

    public CombatEngine(ContentRegistry registry, DiceRoller dice, ProgressionEngine progression,
                        InventoryRules inventory) {
        this.registry = registry;
        this.dice = dice;
        this.progression = progression;
        this.inventory = inventory;
    }

    // ---- Раунд целиком ----

    public RuleResult attack(GameState state, String target) {
        return runRound(state, playerAttack(state, target));
    }

    public RuleResult defend(GameState state) {
        return runRound(state, playerDefend(state));
    }

    public RuleResult special(GameState state, String target) {
        return runRound(state, playerSpecial(state, target));
    }

    public RuleResult cast(GameState state, String argument) {
        return runRound(state, playerCast(state, argument));
    }

    public RuleResult useItem(GameState state, String query, String target) {
        return runRound(state, inventory.useItem(state, query, target));
    }

    /**
     * Доигрывает раунд после принятого действия игрока. Отклонённое действие раунд не запускает.
     */
    public RuleResult runRound(GameState state, RuleResult playerResult) {
        if (!playerResult.isConsumed()) {
            return playerResult;
        }
        List<String> results = new ArrayList<>();
        results.add(playerResult.getMessage());
        if (state.hasCompanion()) {
            results.add(companionAction(state));
        }
        results.addAll(enemyActions(state));
        clearStances(state);
        String end = endCombatIfNeeded(state);
        if (end != null) {
            results.add(end);
        }
        regenMana(state);
        return RuleResult.consumed(String.join(" ", results));
    }

    // ---- Действия игрока ----

    public RuleResult playerDefend(GameState state) {
        state.setPlayerDefending(true);
        return RuleResult.consumed(state.getPlayer().getName()
            + " takes a defensive stance (+" + DEFEND_AC_BONUS + " AC until next attack).");
    }

    public RuleResult playerAttack(GameState state, String target) {
        TargetSelection selection = selectEnemy(state, target);
        if (selection.getError() != null) {
            return RuleResult.rejected(selection.getError());
        }
        Character player = state.getPlayer();
        return RuleResult.consumed(strike("", selection.getEnemy(), player.getAttackBonus(), player.getDamage(), 0));
    }

    /**
     * Классовый приём: силовой удар, точный выстрел, лучшее боевое заклинание или обычная атака
     */
    public RuleResult playerSpecial(GameState state, String target) {
        TargetSelection selection = selectEnemy(state, target);
        if (selection.getError() != null) {
            return RuleResult.rejected(selection.getError());
        }
        Character player = state.getPlayer();
        Enemy enemy = selection.getEnemy();
        return switch (player.getCharacterClass().getSpecialStyle()) {
            case POWER_STRIKE -> RuleResult.consumed(strike("You drive a heavy power strike. ", enemy,
                player.getAttackBonus(), player.getDamage(), CharacterClass.POWER_STRIKE_DAMAGE));
            case PRECISION -> RuleResult.consumed(strike("You line up a precise shot. ", enemy,
                player.getAttackBonus() + CharacterClass.PRECISION_TO_HIT, player.getDamage(), 0));
            case PLAIN -> RuleResult.consumed(strike("", enemy, player.getAttackBonus(), player.getDamage(), 0));
            case SPELLCASTING -> {
                Spell spell = Spell.bestDamageSpell(player.getLearnedSpells());
                if (spell == null) {
                    yield RuleResult.rejected("You have no damage spells to cast.");
                }
                yield castDamageSpell(player, spell, enemy);
            }
        };
    }

    /**
     * cast &lt;заклинание&gt; [цель]
     */
    public RuleResult playerCast(GameState state, String argument) {
        String text = argument == null ? "" : argument.trim().toLowerCase();
        if (text.isEmpty()) {
            return RuleResult.rejected("Cast which spell?");
        }
        Spell spell = null;
        String target = "";
        for (Spell candidate : Spell.values()) {
            String name = candidate.getDisplayName().toLowerCase();
            boolean longer = spell == null || name.length() > spell.getDisplayName().length();
            if ((text.equals(name) || text.startsWith(name + " ")) && longer) {
                spell = candidate;
                target = text.substring(name.length()).trim();
            }
        }
        if (spell == null) {
            return RuleResult.rejected("Unknown spell.");
        }
        Character player = state.getPlayer();
        if (!player.knows(spell)) {
            return RuleResult.rejected("You don't know " + spell.getDisplayName() + ".");
        }
        if (spell.getKind() == SpellKind.UTILITY) {
            return RuleResult.rejected(spell.getDisplayName() + " has no effect in combat yet.");
        }
        if (spell.getKind() == SpellKind.DAMAGE) {
            TargetSelection selection = selectEnemy(state, target);
            if (selection.getError() != null) {
                return RuleResult.rejected(selection.getError());
            }
            return castDamageSpell(player, spell, selection.getEnemy());
        }
        if (!player.spendMana(spell.getManaCost())) {
            return RuleResult.rejected("You are out of mana.");
        }
        if (spell.getKind() == SpellKind.WARD) {
            state.setPlayerDefending(true);
            return RuleResult.consumed("You raise a shimmering " + spell.getDisplayName()
                + " (+" + DEFEND_AC_BONUS + " AC this round).");
        }
        Combatant healTarget = InventoryRules.resolveHealTarget(state, target);
        DiceRoller.DiceResult roll = dice.roll(spell.getDice());
        int healed = healTarget.heal(roll.getTotal());
        return RuleResult.consumed("You channel " + spell.getDisplayName() + " on " + healTarget.getName()
            + ", healing " + healed + " (" + roll.getDetail() + ").");
    }

    private RuleResult castDamageSpell(Character player, Spell spell, Enemy enemy) {
        if (!player.spendMana(spell.getManaCost())) {
            return RuleResult.rejected("You are out of mana.");
        }
        int toHit = player.getAttackBonus() + player.getStat(player.getCharacterClass().getSpellcastingAbility());
        return RuleResult.consumed(strike("You channel " + spell.getDisplayName() + ". ", enemy, toHit, spell.getDice(), 0));
    }

    private String strike(String flavor, Enemy enemy, int attackBonus, String damage, int flatBonus) {
        AttackRoll roll = attackRoll(attackBonus, enemy.getAc(), false);
        if (roll.isHit()) {
            String detail = applyDamage(enemy, damage, flatBonus);
            return flavor + "Hit " + enemy.getName() + " (roll " + roll.getRoll() + " -> " + roll.getTotal()
                + ") for " + detail + " damage.";
        }
        return flavor + "Miss " + enemy.getName() + " (roll " + roll.getRoll() + " -> " + roll.getTotal() + ").";
    }

    // ---- Спутник ----

    public String companionAction(GameState state) {
        Companion companion = state.getActiveCompanion();
        if (companion.isDown()) {
            return companion.getName() + " is down and cannot act.";
        }
        state.setCompanionDefending(false);
        if (companion.getHp() <= companion.getDefendHpThreshold()) {
            state.setCompanionDefending(true);
            return companion.getName() + " keeps their distance and braces (+" + DEFEND_AC_BONUS + " AC).";
        }
        TargetSelection selection = selectEnemy(state, null);
        if (selection.getError() != null) {
            return companion.getName() + " scans the room, weapon lowered.";
        }
        Enemy enemy = selection.getEnemy();

        Spell spell = Spell.bestDamageSpell(companion.getLearnedSpells());
        if (spell != null && companion.hasManaPool() && companion.getMana() >= spell.getManaCost()) {
            companion.setMana(companion.getMana() - spell.getManaCost());
            AttackRoll roll = attackRoll(companion.getAttackBonus(), enemy.getAc(), false);
            String prefix = companion.getName() + " channels " + spell.getDisplayName() + ". ";
            if (roll.isHit()) {
                String detail = applyDamage(enemy, spell.getDice(), 0);
                return prefix + "Hit " + enemy.getName() + " (roll " + roll.getRoll() + " -> " + roll.getTotal()
                    + ") for " + detail + " damage.";
            }
            return prefix + "Miss " + enemy.getName() + " (roll " + roll.getRoll() + " -> " + roll.getTotal() + ").";
        }

        AttackRoll roll = attackRoll(companion.getAttackBonus(), enemy.getAc(), false);
        if (roll.isHit()) {
            String detail = applyDamage(enemy, companion.getDamage(), 0);
            return companion.getName() + " strikes " + enemy.getName() + " (roll " + roll.getRoll() + " -> "
                + roll.getTotal() + ") for " + detail + " damage.";
        }
        return companion.getName() + " misses " + enemy.getName() + " (roll " + roll.getRoll() + " -> "
            + roll.getTotal() + ").";
    }

    // ---- Противники ----

    public List<String> enemyActions(GameState state) {
        List<Enemy> alive = state.livingEnemies();
        if (alive.isEmpty()) {
            return List.of("The foes are down.");
        }
        Character player = state.getPlayer();
        Companion companion = state.hasCompanion() ? state.getActiveCompanion() : null;
        List<String> results = new ArrayList<>();
        for (Enemy enemy : alive) {
            AiPolicy ai = registry.getMobProfile(state.getCampaignId(), enemy.getName()).getAi();
            boolean targetPlayer = companion == null || switch (ai) {
                case FOCUS_PLAYER -> !player.isDown();
                case FOCUS_COMPANION -> companion.isDown();
                case FOCUS_WEAKEST -> companion.isDown() || player.getHp() <= companion.getHp();
            };

            if (targetPlayer) {
                AttackRoll roll = attackRoll(enemy.getAttackBonus(), player.getAc(), state.isPlayerDefending());
                if (roll.isHit()) {
                    String detail = applyDamage(player, enemy.getDamage(), 0);
                    results.add(enemy.getName() + " strikes " + player.getName() + " (roll " + roll.getRoll()
                        + " -> " + roll.getTotal() + ") for " + detail + " damage.");
                } else {
                    results.add(enemy.getName() + " misses " + player.getName() + " (roll " + roll.getRoll()
                        + " -> " + roll.getTotal() + ").");
                }
                continue;
            }

            AttackRoll roll = attackRoll(enemy.getAttackBonus(), companion.getAc(), state.isCompanionDefending());
            if (roll.isHit()) {
                String detail = applyDamage(companion, enemy.getDamage(), 0);
                results.add(enemy.getName() + " lashes at " + companion.getName() + " (roll " + roll.getRoll()
                    + " -> " + roll.getTotal() + ") for " + detail + " damage.");
            } else {
                results.add(enemy.getName() + " misses " + companion.getName() + " (roll " + roll.getRoll()
                    + " -> " + roll.getTotal() + ").");
            }
        }
        return results;
    }

    public void clearStances(GameState state) {
        state.setPlayerDefending(false);
        state.setCompanionDefending(false);
    }

    /**
     * Проверка конца боя: сначала победа, затем поражение. Без активных врагов ничего не делает.
     */
    public String endCombatIfNeeded(GameState state) {
        List<Enemy> enemies = state.getEnemies();
        if (enemies.isEmpty()) {
            return null;
        }
        if (enemies.stream().allMatch(Enemy::isDown)) {
            state.setInCombat(false);
            state.getFlags().markRoomDefeated(state.getRoomId());

            int totalXp = 0;
            for (Enemy enemy : enemies) {
                totalXp += registry.getMobProfile(state.getCampaignId(), enemy.getName()).getXp();
            }
            List<String> levelMessages = progression.grantXp(state, totalXp);

            List<CorpseRecord> records = new ArrayList<>();
            for (Enemy enemy : enemies) {
                records.add(new CorpseRecord(state.getFlags().allocateCorpseId(), enemy.getName(), false));
            }
            state.getFlags().putCorpses(state.getRoomId(), records);
            state.setEnemies(new ArrayList<>());

            String corpseList = records.stream()
                .map(record -> record.getId() + ". " + record.getName())
                .collect(Collectors.joining(", "));
            List<String> parts = new ArrayList<>();
            parts.add("The foes fall. Corpses: " + corpseList + ". You can 'loot <number>' or 'loot all'."
                + " The way forward is clear.");
            if (totalXp > 0) {
                parts.add("XP +" + totalXp + ".");
            }
            parts.addAll(levelMessages);
            return String.join(" ", parts);
        }
        if (state.getPlayer().isDown()) {
            state.setGameOver(true);
            return "You collapse from your wounds. The adventure ends here.";
        }
        return null;
    }

    /**
     * +1 мана за раунд игроку-заклинателю и каждому спутнику с запасом маны
     */
    public int regenMana(GameState state) {
        int gained = state.getPlayer().regenMana(1);
        for (Companion companion : state.getCompanions()) {
            gained += companion.regenMana(1);
        }
        return gained;
    }

    // ---- Общие примитивы ----

    /**
     * d20 + бонус против AC цели; стойка защиты добавляет +2
     */
    public AttackRoll attackRoll(int attackBonus, int targetAc, boolean targetDefending) {
        int roll = dice.rollDie(20);
        int total = roll + attackBonus;
        int effectiveAc = targetAc + (targetDefending ? DEFEND_AC_BONUS : 0);
        return new AttackRoll(total >= effectiveAc, roll, total);
    }

    /**
     * Бросает урон, применяет к цели и возвращает текст вида "5 (4+1)"
     */
    public String applyDamage(Combatant target, String damageExpr, int flatBonus) {
        DiceRoller.DiceResult roll = dice.roll(damageExpr);
        String detail = roll.getDetail();
        if (flatBonus != 0) {
            detail = detail + DiceRoller.signed(flatBonus);
        }
        int damage = roll.getTotal() + flatBonus;
        target.takeDamage(damage);
        return damage + " (" + detail + ")";
    }

    /**
     * Цель атаки: номер среди живых, часть имени или по умолчанию самый раненый
     */
    public static TargetSelection selectEnemy(GameState state, String query) {
        List<Enemy> alive = state.livingEnemies();
        if (alive.isEmpty()) {
            return TargetSelection.error("There's nothing to attack.");
        }
        String token = query == null ? "" : query.trim().toLowerCase();
        if (token.isEmpty()) {
            return TargetSelection.of(alive.stream().min(Comparator.comparingInt(Enemy::getHp)).orElseThrow());
        }
        if (token.chars().allMatch(java.lang.Character::isDigit)) {
            int idx = Integer.parseInt(token) - 1;
            if (idx < 0 || idx >= alive.size()) {
                return TargetSelection.error("That target doesn't exist.");
            }
            return TargetSelection.of(alive.get(idx));
        }
        List<Enemy> matches = alive.stream()
            .filter(enemy -> enemy.getName().toLowerCase().contains(token))
            .collect(Collectors.toList());
        if (matches.isEmpty()) {
            return TargetSelection.error("No such target.");
        }
        if (matches.size() > 1) {
            return TargetSelection.error("Be more specific.");
        }
        return TargetSelection.of(matches.get(0));
    }

    public static class AttackRoll {
        private final boolean hit;
        private final int roll;
        private final int total;

        public AttackRoll(boolean hit, int roll, int total) {
            this.hit = hit;
            this.roll = roll;
            this.total = total;
        }

        public boolean isHit() { return hit; }
        public int getRoll() { return roll; }
        public int getTotal() { return total; }
    }

    public static class TargetSelection {
        private final Enemy enemy;
        private final String error;

        private TargetSelection(Enemy enemy, String error) {
            this.enemy = enemy;
            this.error = error;
        }

        static TargetSelection of(Enemy enemy) {
            return new TargetSelection(enemy, null);
        }

        static TargetSelection error(String error) {
            return new TargetSelection(null, error);
        }

        public Enemy getEnemy() { return enemy; }
        public String getError() { return error; }
    }
}
