package com.solo.game_state;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.solo.content.ContentRegistry;
import com.solo.content.ItemDefinition;
import com.solo.game_rules.EntityFactory;
import com.solo.game_rules.GameEngine;
import com.solo.game_rules.InventoryRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Сериализация состояния игры в JSON и обратно, с миграцией старых версий и ремонтом после загрузки
 */
public class SaveCodec {
    private static final Logger log = LoggerFactory.getLogger(SaveCodec.class);

    private final ContentRegistry registry;
    private final Gson gson;
    private final SaveMigrator migrator;

    public SaveCodec(ContentRegistry registry) {
        this.registry = registry;
        this.gson = createGson();
        this.migrator = new SaveMigrator(registry, gson);
    }

    public static Gson createGson() {
        return new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .serializeNulls()
            .create();
    }

    public Gson getGson() {
        return gson;
    }

    /**
     * В запись попадает только хвост журнала повествования
     */
    public String toJson(GameState state) {
        state.trimResponseLog();
        state.setVersion(GameState.SAVE_VERSION);
        return gson.toJson(state);
    }

    /**
     * Разбирает запись. Повреждённая или структурно неполная запись даёт SaveCorruptedException.
     */
    public GameState fromJson(String json) {
        JsonObject data;
        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (parsed == null || !parsed.isJsonObject()) {
                throw new SaveCorruptedException("Save record is not a JSON object");
            }
            data = migrator.migrate(parsed.getAsJsonObject());
        } catch (SaveCorruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            // поле неверного типа в старой записи: UnsupportedOperationException, NumberFormatException
            throw new SaveCorruptedException("Save record is corrupt or invalid JSON: " + e.getMessage(), e);
        }

        GameState state;
        try {
            state = gson.fromJson(data, GameState.class);
        } catch (RuntimeException e) {
            throw new SaveCorruptedException("Save record has an incompatible format: " + e.getMessage(), e);
        }
        validate(state);
        repair(state);
        return state;
    }

    private void validate(GameState state) {
        if (state == null || state.getPlayer() == null) {
            throw new SaveCorruptedException("Save record has no player");
        }
        if (state.getPlayer().getCharacterClass() == null || state.getPlayer().getRace() == null) {
            throw new SaveCorruptedException("Save record has an unknown class or race");
        }
        if (state.getCampaignId() == null || !registry.hasCampaign(state.getCampaignId())) {
            throw new SaveCorruptedException("Save record references unknown campaign '" + state.getCampaignId() + "'");
        }
        String roomId = state.getRoomId();
        if (roomId == null || !registry.getCampaign(state.getCampaignId()).getRooms().containsKey(roomId)) {
            throw new SaveCorruptedException("Save record references unknown room '" + roomId + "'");
        }
        if (!state.hasCompanion()) {
            throw new SaveCorruptedException("Save record has no companion");
        }
    }

    /**
     * Слоты экипировки, AC, мана заклинателя и аварийный запас зелий
     */
    private void repair(GameState state) {
        state.normalizeEquipment();
        InventoryRules.syncPlayerAc(state);
        EntityFactory.ensureCasterMana(state.getPlayer());
        if (state.getInventory().isEmpty()) {
            log.warn("Save '{}' has an empty inventory, restocking {} potions",
                state.getSessionId(), GameEngine.STARTING_POTIONS);
            for (int i = 0; i < GameEngine.STARTING_POTIONS; i++) {
                ItemDefinition potion = registry.itemFromId(state.getCampaignId(), GameEngine.POTION_ID);
                state.getInventory().add(potion);
            }
        }
        state.trimResponseLog();
    }
}
