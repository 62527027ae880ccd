package com.solo.game_rules;

import com.solo.content.Campaign;
import com.solo.content.ContentRegistry;
import com.solo.content.ItemDefinition;
import com.solo.content.Room;
import com.solo.content.Spell;
import com.solo.game_state.Character;
import com.solo.game_state.Companion;
import com.solo.game_state.Enemy;
import com.solo.game_state.GameState;
import com.solo.game_state.PendingDecision;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Единая точка входа правил: создание партии, разбор команды и маршрутизация
 * между исследованием и боем, учёт ходов и завершение кампании.
 */
public class GameEngine {
    public static final int STARTING_POTIONS = 3;
    public static final int MAX_REST_COUNT = 20;
    public static final String POTION_ID = "healing_potion";

    private static final List<String> STARTING_KIT = List.of(
        POTION_ID, POTION_ID, POTION_ID, "leather_cap", "worn_boots");
    private static final List<String> EXPLORATION_VOCABULARY = List.of(
        "talk", "search", "loot [number|all|name]", "move <destination>", "rest [N]",
        "use <item> [on <target>]", "equip <item>", "unequip <slot>");
    private static final List<String> COMBAT_VOCABULARY = List.of(
        "attack [target]", "defend", "special [target]", "cast <spell> [target]", "use <item> [on <target>]");
    private static final Set<String> TALK_VERBS = Set.of("talk", "speak", "parley", "approach");
    private static final Set<String> ROOM_VERBS = Set.of("search", "open", "inspect", "look", "continue");

    private final ContentRegistry registry;
    private final EntityFactory entities;
    private final InventoryRules inventory;
    private final ProgressionEngine progression;
    private final CombatEngine combat;
    private final ExplorationEngine exploration;
    private final RestRules rest;

    public GameEngine(ContentRegistry registry, DiceRoller dice) {
        this.registry = registry;
        this.entities = new EntityFactory(registry, dice);
        this.inventory = new InventoryRules(registry, dice);
        this.progression = new ProgressionEngine();
        this.combat = new CombatEngine(registry, dice, progression, inventory);
        this.exploration = new ExplorationEngine(registry, dice, entities, inventory);
        this.rest = new RestRules();
    }

    public ContentRegistry getRegistry() { return registry; }
    public EntityFactory getEntities() { return entities; }
    public InventoryRules getInventory() { return inventory; }

    // ---- Создание игры ----

    /**
     * Новая игра для нового персонажа: стартовый набор из трёх зелий, шапки и сапог
     */
    public GameState newGame(String campaignId, Character player, String companionId, int inventoryLimit) {
        List<ItemDefinition> kit = new ArrayList<>();
        for (String itemId : STARTING_KIT) {
            kit.add(registry.itemFromId(campaignId, itemId));
        }
        return newGameWithGear(campaignId, player, kit, GameState.emptyEquipment(), companionId, inventoryLimit);
    }

    /**
     * Новая игра для персонажа из реестра, со своим снаряжением
     */
    public GameState newGameWithGear(String campaignId, Character player, List<ItemDefinition> gear,
                                     Map<String, ItemDefinition> equipment, String companionId,
                                     int inventoryLimit) {
        Campaign campaign = registry.getCampaign(campaignId);
        Companion companion = entities.createCompanion(campaignId, companionId);
        GameState state = new GameState(campaignId, player, List.of(companion), campaign.getStartRoomId());
        state.setInventoryLimit(inventoryLimit);
        state.setInventory(gear);
        state.setEquipment(new LinkedHashMap<>(equipment));
        InventoryRules.syncPlayerAc(state);
        state.setLastEvent(exploration.startRoom(state, registry.getRoom(campaignId, state.getRoomId())));
        return state;
    }

    // ---- Ход ----

    public ActionOutcome handle(GameState state, String rawInput) {
        if (state.isGameOver()) {
            return ActionOutcome.of(state, RuleResult.rejected("The adventure is over."));
        }
        ActionParser.ParsedAction action = ActionParser.parse(rawInput);
        if (action.getVerb().isEmpty()) {
            return ActionOutcome.of(state, RuleResult.rejected("Say what you want to do."));
        }
        String input = rawInput == null ? "" : rawInput.trim();

        if (!state.isInCombat() && "rest".equals(action.getVerb())) {
            return ActionOutcome.of(state, restRepeatedly(state, input, action.getArgument()));
        }

        RuleResult result = state.isInCombat() ? handleCombat(state, action) : handleExploration(state, action);
        if (!result.isConsumed()) {
            return ActionOutcome.of(state, result);
        }

        state.setTurn(state.getTurn() + 1);
        state.setRestStreak(0);
        state.getPendingDecisions().forEach(decision -> decision.setOffered(false));
        String message = result.getMessage();
        if (state.isGameOver() && !state.getPlayer().isDown()) {
            message = message + " " + completeCampaign(state);
        }
        recordTurn(state, input, message);
        return ActionOutcome.of(state, RuleResult.consumed(message));
    }

    /**
     * Разрешает отложенное решение, предложенное последним отдыхом. Ход не тратится.
     */
    public ActionOutcome resolveDecision(GameState state, int index, String choice) {
        return ActionOutcome.of(state, rest.resolveDecision(state, index, choice));
    }

    private RuleResult restRepeatedly(GameState state, String input, String argument) {
        int count = 1;
        if (!argument.isEmpty()) {
            try {
                count = Math.max(1, Math.min(Integer.parseInt(argument.split("\\s+")[0]), MAX_REST_COUNT));
            } catch (NumberFormatException e) {
                count = 1;
            }
        }
        List<String> results = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String result = rest.applyRest(state).getMessage();
            state.setTurn(state.getTurn() + 1);
            recordTurn(state, input, result);
            results.add(result);
        }
        String message = String.join(" | ", results);
        state.setLastEvent(message);
        return RuleResult.consumed(message);
    }

    private RuleResult handleCombat(GameState state, ActionParser.ParsedAction action) {
        String argument = action.getArgument();
        switch (action.getVerb()) {
            case "attack":
                return combat.attack(state, argument);
            case "defend":
                return combat.defend(state);
            case "special":
                return combat.special(state, argument);
            case "cast":
                return combat.cast(state, argument);
            case "use": {
                List<String> parts = ActionParser.splitTarget(argument);
                return combat.useItem(state, parts.get(0), parts.get(1));
            }
            default:
                break;
        }
        // "magic missile 2" как сокращение для cast
        for (Spell spell : Spell.values()) {
            String name = spell.getDisplayName().toLowerCase();
            String normalized = action.getNormalized();
            if (normalized.equals(name) || normalized.startsWith(name + " ")) {
                return combat.cast(state, normalized);
            }
        }
        return RuleResult.rejected("Choose attack, defend, special, cast <spell> [target], or use <item>.");
    }

    private RuleResult handleExploration(GameState state, ActionParser.ParsedAction action) {
        String verb = action.getVerb();
        String argument = action.getArgument();
        if ("move".equals(verb)) {
            if (argument.isEmpty()) {
                return exploration.askDestination(state);
            }
            return exploration.moveTo(state, argument);
        }
        if ("use".equals(verb)) {
            List<String> parts = ActionParser.splitTarget(argument);
            return inventory.useItem(state, parts.get(0), parts.get(1));
        }
        if ("equip".equals(verb)) {
            return inventory.equip(state, argument);
        }
        if ("unequip".equals(verb)) {
            return inventory.unequip(state, argument);
        }
        if ("loot".equals(verb) || TALK_VERBS.contains(verb) || ROOM_VERBS.contains(verb)) {
            return exploration.act(state, verb, argument);
        }
        return RuleResult.rejected("Unknown action. Try: " + String.join(", ", EXPLORATION_VOCABULARY) + ".");
    }

    /**
     * Финал кампании с живым героем: опыт за прохождение, изъятие квестовых предметов, пересчёт AC
     */
    private String completeCampaign(GameState state) {
        List<String> parts = new ArrayList<>();
        int completionXp = registry.getCampaign(state.getCampaignId()).getCompletionXp();
        if (completionXp > 0) {
            parts.add("Campaign complete! XP +" + completionXp + ".");
            parts.addAll(progression.grantXp(state, completionXp));
        } else {
            parts.add("Campaign complete!");
        }
        inventory.stripQuestItems(state);
        InventoryRules.syncPlayerAc(state);
        return String.join(" ", parts);
    }

    private void recordTurn(GameState state, String input, String result) {
        state.setLastEvent(result);
        state.setLastPlayerInput(input);
        state.getTurnLog().add("Turn " + state.getTurn() + ": input='" + input + "' | " + result);
    }

    // ---- Представление ----

    public static List<String> vocabulary(GameState state) {
        return state.isInCombat() ? COMBAT_VOCABULARY : EXPLORATION_VOCABULARY;
    }

    /**
     * Сводка состояния для клиента
     */
    public Map<String, Object> status(GameState state) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("session_id", state.getSessionId());
        view.put("campaign_id", state.getCampaignId());
        view.put("turn", state.getTurn());

        Room room = registry.getRoom(state.getCampaignId(), state.getRoomId());
        Map<String, Object> roomView = new LinkedHashMap<>();
        roomView.put("id", room.getId());
        roomView.put("name", room.getName());
        roomView.put("kind", room.getKind().getValue());
        view.put("room", roomView);

        Character player = state.getPlayer();
        Map<String, Object> playerView = new LinkedHashMap<>();
        playerView.put("name", player.getName());
        playerView.put("race", player.getRace().getValue());
        playerView.put("class", player.getCharacterClass().getValue());
        playerView.put("hp", player.getHp());
        playerView.put("max_hp", player.getMaxHp());
        playerView.put("ac", player.getAc());
        playerView.put("level", player.getLevel());
        playerView.put("xp", player.getXp());
        playerView.put("gold", player.getGold());
        if (player.isCaster()) {
            playerView.put("mana", player.getMana());
            playerView.put("max_mana", player.getMaxMana());
        }
        playerView.put("spells", player.getLearnedSpells().stream().map(Spell::getDisplayName).collect(Collectors.toList()));
        playerView.put("defending", state.isPlayerDefending());
        view.put("player", playerView);

        List<Map<String, Object>> companions = new ArrayList<>();
        for (Companion companion : state.getCompanions()) {
            Map<String, Object> companionView = new LinkedHashMap<>();
            companionView.put("name", companion.getName());
            companionView.put("hp", companion.getHp());
            companionView.put("max_hp", companion.getMaxHp());
            companionView.put("ac", companion.getAc());
            if (companion.hasManaPool()) {
                companionView.put("mana", companion.getMana());
                companionView.put("max_mana", companion.getMaxMana());
            }
            companions.add(companionView);
        }
        view.put("companions", companions);

        view.put("in_combat", state.isInCombat());
        List<Map<String, Object>> enemies = new ArrayList<>();
        int index = 1;
        for (Enemy enemy : state.livingEnemies()) {
            Map<String, Object> enemyView = new LinkedHashMap<>();
            enemyView.put("index", index++);
            enemyView.put("name", enemy.getName());
            enemyView.put("hp", enemy.getHp());
            enemyView.put("max_hp", enemy.getMaxHp());
            enemyView.put("ac", enemy.getAc());
            enemies.add(enemyView);
        }
        view.put("enemies", enemies);

        Map<String, Integer> grouped = new LinkedHashMap<>();
        List<Map<String, Object>> detailed = new ArrayList<>();
        index = 1;
        for (ItemDefinition item : state.getInventory()) {
            grouped.merge(item.getName(), 1, Integer::sum);
            Map<String, Object> itemView = new LinkedHashMap<>();
            itemView.put("index", index++);
            itemView.put("id", item.getId());
            itemView.put("name", item.getName());
            itemView.put("kind", item.getKind() != null ? item.getKind().getValue() : null);
            detailed.add(itemView);
        }
        view.put("inventory", grouped);
        view.put("inventory_detailed", detailed);
        view.put("inventory_used", InventoryRules.inventoryUsed(state));
        view.put("inventory_limit", state.getInventoryLimit());

        Map<String, String> equipment = new LinkedHashMap<>();
        state.getEquipment().forEach((slot, item) -> equipment.put(slot, item != null ? item.getName() : null));
        view.put("equipment", equipment);

        view.put("exits", new TreeSet<>(exploration.exitsFor(state).values()));
        view.put("actions", vocabulary(state));
        view.put("pending_decisions", describeDecisions(state.getPendingDecisions()));
        view.put("last_event", state.getLastEvent());
        view.put("game_over", state.isGameOver());
        return view;
    }

    public static List<Map<String, Object>> describeDecisions(List<PendingDecision> decisions) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (int i = 0; i < decisions.size(); i++) {
            PendingDecision decision = decisions.get(i);
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("index", i);
            view.put("type", decision.getType().getValue());
            view.put("level", decision.getLevel());
            view.put("options", decision.getOptions().stream().map(Spell::getDisplayName).collect(Collectors.toList()));
            view.put("offered", decision.isOffered());
            result.add(view);
        }
        return result;
    }

    /**
     * Итог обработки команды: текст правил, признак потраченного хода и решения, ожидающие выбора
     */
    public static class ActionOutcome {
        private final String message;
        private final boolean consumed;
        private final List<PendingDecision> offeredDecisions;
        private final boolean gameOver;
        private final boolean inCombat;

        public ActionOutcome(String message, boolean consumed, List<PendingDecision> offeredDecisions,
                             boolean gameOver, boolean inCombat) {
            this.message = message;
            this.consumed = consumed;
            this.offeredDecisions = offeredDecisions;
            this.gameOver = gameOver;
            this.inCombat = inCombat;
        }

        static ActionOutcome of(GameState state, RuleResult result) {
            List<PendingDecision> offered = state.getPendingDecisions().stream()
                .filter(PendingDecision::isOffered)
                .collect(Collectors.toList());
            return new ActionOutcome(result.getMessage(), result.isConsumed(), offered,
                state.isGameOver(), state.isInCombat());
        }

        public String getMessage() { return message; }
        public boolean isConsumed() { return consumed; }
        public List<PendingDecision> getOfferedDecisions() { return offeredDecisions; }
        public boolean isGameOver() { return gameOver; }
        public boolean isInCombat() { return inCombat; }
    }
}
