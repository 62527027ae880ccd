package com.solo.api;

import com.solo.ai_engine.GameMasterAI;
import com.solo.ai_engine.StateSnapshot;
import com.solo.content.Ability;
import com.solo.content.Campaign;
import com.solo.content.CharacterClass;
import com.solo.content.CharacterRace;
import com.solo.content.CompanionProfile;
import com.solo.content.ContentRegistry;
import com.solo.game_rules.EntityFactory;
import com.solo.game_rules.GameEngine;
import com.solo.game_state.Character;
import com.solo.game_state.CharacterRoster;
import com.solo.game_state.GameManager;
import com.solo.game_state.GameState;
import com.solo.game_state.NarrationEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Сервис игровых сессий: создание, ход, решения и сохранение после каждого принятого действия
 */
@Service
public class AdventureService {
    private static final Logger log = LoggerFactory.getLogger(AdventureService.class);

    @Autowired
    private GameEngine engine;

    @Autowired
    private GameManager gameManager;

    @Autowired
    private CharacterRoster roster;

    @Autowired
    private GameMasterAI gameMaster;

    @Value("${adventure.inventory.limit:10}")
    private int inventoryLimit = GameState.DEFAULT_INVENTORY_LIMIT;

    // загрузка, ход и сохранение одной сессии идут под её монитором
    private final ConcurrentHashMap<String, Object> sessionLocks = new ConcurrentHashMap<>();

    public List<Map<String, Object>> listCampaigns() {
        List<Map<String, Object>> result = new ArrayList<>();
        ContentRegistry registry = engine.getRegistry();
        for (Campaign campaign : registry.listCampaigns()) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("id", campaign.getId());
            view.put("name", campaign.getName());
            view.put("description", campaign.getDescription());
            List<Map<String, Object>> companions = new ArrayList<>();
            for (String companionId : campaign.getDefaultCompanionIds()) {
                CompanionProfile profile = registry.getCompanionProfile(campaign.getId(), companionId);
                Map<String, Object> companion = new LinkedHashMap<>();
                companion.put("id", companionId);
                companion.put("name", profile.getName());
                companions.add(companion);
            }
            view.put("companions", companions);
            result.add(view);
        }
        return result;
    }

    public List<String> listCharacters() {
        return roster.listNames();
    }

    /**
     * Новая игра: персонаж из реестра (roster_name) или новый (character)
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> createGame(Map<String, Object> body) {
        String campaignId = stringField(body, "campaign_id");
        if (campaignId == null || !engine.getRegistry().hasCampaign(campaignId)) {
            throw new IllegalArgumentException("Unknown campaign: " + campaignId);
        }
        String companionId = stringField(body, "companion_id");
        if (companionId != null
                && !engine.getRegistry().getCampaign(campaignId).getDefaultCompanionIds().contains(companionId)) {
            throw new IllegalArgumentException("Companion '" + companionId + "' is not available in " + campaignId);
        }

        GameState state;
        String rosterName = stringField(body, "roster_name");
        if (rosterName != null) {
            CharacterRoster.RosterEntry entry = roster.load(rosterName, campaignId);
            if (entry == null) {
                throw new IllegalArgumentException("Character not found: " + rosterName);
            }
            state = engine.newGameWithGear(campaignId, entry.getCharacter(), entry.getInventory(),
                entry.getEquipment(), companionId, inventoryLimit);
        } else {
            Object raw = body.get("character");
            if (!(raw instanceof Map)) {
                throw new IllegalArgumentException("Either 'character' or 'roster_name' is required");
            }
            Character player = parseCharacter((Map<String, Object>) raw);
            state = engine.newGame(campaignId, player, companionId, inventoryLimit);
        }

        String sessionId = stringField(body, "session_id");
        state.setSessionId(sessionId != null ? sessionId : GameManager.newSessionId());
        gameManager.saveGame(state);
        roster.save(state);
        log.info("New game {} in {} for {}", state.getSessionId(), campaignId, state.getPlayer().getName());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("session_id", state.getSessionId());
        result.put("intro", state.getLastEvent());
        result.put("status", engine.status(state));
        return result;
    }

    public Map<String, Object> getStatus(String sessionId) {
        return engine.status(loadRequired(sessionId));
    }

    /**
     * Один ход. Принятое действие сохраняется и синхронизируется в реестр до рассказа,
     * так что сбой рассказчика не теряет ход. Ходы одной сессии выполняются по очереди.
     */
    public Map<String, Object> performAction(String sessionId, String action) {
        synchronized (lockFor(sessionId)) {
            return performLocked(sessionId, action);
        }
    }

    private Map<String, Object> performLocked(String sessionId, String action) {
        GameState state = loadRequired(sessionId);
        GameEngine.ActionOutcome outcome = engine.handle(state, action);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("rules_result", outcome.getMessage());
        result.put("consumed", outcome.isConsumed());
        String narration = null;
        String narrationSource = null;
        if (outcome.isConsumed()) {
            gameManager.saveGame(state);
            roster.save(state);
            StateSnapshot snapshot = StateSnapshot.of(state, engine.getRegistry());
            GameMasterAI.Narration told = gameMaster.narrate(snapshot, state.getLastPlayerInput(), outcome.getMessage());
            narration = told.getText();
            narrationSource = told.getSource();
            state.addNarration(new NarrationEntry(state.getTurn(), state.getLastPlayerInput(),
                outcome.getMessage(), narration, narrationSource));
            gameManager.saveGame(state);
            if (state.isGameOver()) {
                log.info("Game {} over (player {})", sessionId, state.getPlayer().isDown() ? "defeated" : "victorious");
            }
        }
        result.put("narration", narration);
        result.put("narration_source", narrationSource);
        result.put("suggestion", state.isGameOver()
            ? null
            : gameMaster.suggest(StateSnapshot.of(state, engine.getRegistry()), GameEngine.vocabulary(state)));
        result.put("pending_decisions", GameEngine.describeDecisions(outcome.getOfferedDecisions()));
        result.put("game_over", outcome.isGameOver());
        result.put("in_combat", outcome.isInCombat());
        return result;
    }

    public Map<String, Object> resolveDecision(String sessionId, int index, String choice) {
        synchronized (lockFor(sessionId)) {
            GameState state = loadRequired(sessionId);
            GameEngine.ActionOutcome outcome = engine.resolveDecision(state, index, choice);
            if (outcome.isConsumed()) {
                gameManager.saveGame(state);
                roster.save(state);
            }
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("result", outcome.getMessage());
            result.put("resolved", outcome.isConsumed());
            result.put("pending_decisions", GameEngine.describeDecisions(state.getPendingDecisions()));
            return result;
        }
    }

    private Object lockFor(String sessionId) {
        return sessionLocks.computeIfAbsent(String.valueOf(sessionId), id -> new Object());
    }

    private GameState loadRequired(String sessionId) {
        GameState state = gameManager.loadGame(sessionId);
        if (state == null) {
            throw new GameNotFoundException(sessionId);
        }
        return state;
    }

    private Character parseCharacter(Map<String, Object> data) {
        String name = stringField(data, "name");
        if (name == null) {
            name = "Adventurer";
        }
        String className = stringField(data, "class");
        if (className == null) {
            throw new IllegalArgumentException("Character class is required");
        }
        CharacterClass characterClass = CharacterClass.fromString(className);
        String raceName = stringField(data, "race");
        CharacterRace race = raceName == null ? CharacterRace.HUMAN : CharacterRace.fromString(raceName);
        Map<Ability, Integer> stats = new EnumMap<>(Ability.class);
        Object rawStats = data.get("stats");
        if (rawStats instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) rawStats).entrySet()) {
                Ability ability = Ability.fromString(String.valueOf(entry.getKey()));
                if (!(entry.getValue() instanceof Number)) {
                    throw new IllegalArgumentException("Stat " + ability + " must be a number");
                }
                stats.put(ability, ((Number) entry.getValue()).intValue());
            }
        }
        EntityFactory.validateStatAllocation(stats);
        return EntityFactory.createPlayer(name, characterClass, stats, race);
    }

    private static String stringField(Map<String, Object> body, String key) {
        Object value = body == null ? null : body.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
