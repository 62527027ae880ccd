package com.solo.game_state;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.solo.content.Campaign;
import com.solo.content.ContentRegistry;
import com.solo.content.ItemDefinition;
import com.solo.content.Room;
import com.solo.content.RoomKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Однократное обновление сохранений версии 1 до текущего формата.
 * Версия 1 хранила флаги плоским словарём, одного спутника и одного врага отдельными полями,
 * а предметы инвентаря иногда просто именами.
 */
public class SaveMigrator {
    private static final Logger log = LoggerFactory.getLogger(SaveMigrator.class);
    private static final String DEFAULT_CAMPAIGN = "ruined_watchtower";
    private static final Set<String> LEGACY_BANDIT_KEYS = Set.of("bandit_defeated", "bandit_looted", "enemy_name");
    private static final Set<String> STRUCTURED_KEYS = Set.of(
        "defeated_rooms", "corpses", "next_corpse_id", "looted_corpses", "loot_taken", "active_enemy_name");

    private final ContentRegistry registry;
    private final Gson gson;

    public SaveMigrator(ContentRegistry registry, Gson gson) {
        this.registry = registry;
        this.gson = gson;
    }

    public static int versionOf(JsonObject data) {
        JsonElement version = data.get("version");
        if (version == null || !version.isJsonPrimitive() || !version.getAsJsonPrimitive().isNumber()) {
            return 1;
        }
        return version.getAsInt();
    }

    /**
     * Приводит запись к текущей версии. Запись уже текущей версии возвращается без изменений.
     */
    public JsonObject migrate(JsonObject data) {
        int version = versionOf(data);
        if (version >= GameState.SAVE_VERSION) {
            return data;
        }
        log.warn("Migrating save '{}' from version {} to {}",
            stringOr(data, "session_id", "?"), version, GameState.SAVE_VERSION);

        if (!data.has("campaign_id") || data.get("campaign_id").isJsonNull()) {
            data.addProperty("campaign_id", DEFAULT_CAMPAIGN);
        }
        String campaignId = data.get("campaign_id").getAsString();

        migrateCompanions(data);
        migrateEnemies(data);
        migrateInventory(data, campaignId);
        migrateEquipment(data);
        migratePendingChoices(data);
        data.add("flags", migrateFlags(data, campaignId));
        data.addProperty("version", GameState.SAVE_VERSION);
        return data;
    }

    private void migrateCompanions(JsonObject data) {
        JsonElement companions = data.get("companions");
        boolean empty = companions == null || !companions.isJsonArray() || companions.getAsJsonArray().isEmpty();
        if (empty && data.has("companion") && data.get("companion").isJsonObject()) {
            JsonArray list = new JsonArray();
            list.add(data.get("companion"));
            data.add("companions", list);
        }
        data.remove("companion");
    }

    private void migrateEnemies(JsonObject data) {
        JsonElement enemies = data.get("enemies");
        boolean empty = enemies == null || !enemies.isJsonArray() || enemies.getAsJsonArray().isEmpty();
        if (empty && data.has("enemy") && data.get("enemy").isJsonObject()) {
            JsonArray list = new JsonArray();
            list.add(data.get("enemy"));
            data.add("enemies", list);
        }
        data.remove("enemy");
    }

    private void migrateInventory(JsonObject data, String campaignId) {
        JsonElement raw = data.get("inventory");
        if (raw == null || !raw.isJsonArray()) {
            data.add("inventory", new JsonArray());
            return;
        }
        JsonArray upgraded = new JsonArray();
        for (JsonElement entry : raw.getAsJsonArray()) {
            if (entry.isJsonObject()) {
                upgraded.add(entry);
            } else if (entry.isJsonPrimitive()) {
                upgraded.add(gson.toJsonTree(itemByName(campaignId, entry.getAsString())));
            }
        }
        data.add("inventory", upgraded);
    }

    private void migrateEquipment(JsonObject data) {
        JsonElement raw = data.get("equipment");
        JsonObject equipment = new JsonObject();
        if (raw != null && raw.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : raw.getAsJsonObject().entrySet()) {
                if (entry.getValue().isJsonObject()) {
                    equipment.add(entry.getKey(), entry.getValue());
                }
            }
        }
        data.add("equipment", equipment);
    }

    private void migratePendingChoices(JsonObject data) {
        JsonElement raw = data.remove("pending_level_choices");
        if (raw == null || !raw.isJsonArray() || data.has("pending_decisions")) {
            return;
        }
        JsonArray decisions = new JsonArray();
        for (JsonElement entry : raw.getAsJsonArray()) {
            if (!entry.isJsonObject()) {
                continue;
            }
            JsonObject choice = entry.getAsJsonObject();
            JsonObject decision = new JsonObject();
            decision.addProperty("type", stringOr(choice, "type", "spell"));
            decision.addProperty("level", choice.has("level") ? choice.get("level").getAsInt() : 0);
            decision.add("options", choice.has("choices") ? choice.get("choices") : new JsonArray());
            decisions.add(decision);
        }
        data.add("pending_decisions", decisions);
    }

    private JsonObject migrateFlags(JsonObject data, String campaignId) {
        JsonElement raw = data.get("flags");
        JsonObject flat = raw != null && raw.isJsonObject() ? raw.getAsJsonObject() : new JsonObject();

        Set<String> defeatedRooms = new LinkedHashSet<>(stringList(flat.get("defeated_rooms")));
        Set<String> lootedCorpseRooms = new LinkedHashSet<>(stringList(flat.get("looted_corpses")));
        JsonObject corpses = flat.has("corpses") && flat.get("corpses").isJsonObject()
            ? flat.getAsJsonObject("corpses")
            : new JsonObject();

        if (LEGACY_BANDIT_KEYS.stream().anyMatch(flat::has)) {
            String roomId = DEFAULT_CAMPAIGN.equals(campaignId) ? "barracks" : stringOr(data, "room_id", "");
            if (isTrue(flat.get("bandit_defeated"))) {
                defeatedRooms.add(roomId);
            }
            String enemyName = stringOr(flat, "enemy_name", null);
            if (enemyName != null && !corpses.has(roomId)) {
                JsonArray single = new JsonArray();
                single.add(corpse(1, enemyName, false));
                corpses.add(roomId, single);
            }
            if (isTrue(flat.get("bandit_looted"))) {
                lootedCorpseRooms.add(roomId);
            }
        }

        JsonObject typedCorpses = new JsonObject();
        int maxId = 0;
        for (Map.Entry<String, JsonElement> entry : corpses.entrySet()) {
            JsonArray records = new JsonArray();
            JsonElement value = entry.getValue();
            if (value.isJsonArray()) {
                int idx = 0;
                for (JsonElement record : value.getAsJsonArray()) {
                    idx++;
                    if (record.isJsonObject()) {
                        records.add(record);
                    } else if (record.isJsonPrimitive()) {
                        records.add(corpse(idx, record.getAsString(), false));
                    }
                }
            } else if (value.isJsonPrimitive()) {
                records.add(corpse(1, value.getAsString(), false));
            }
            if (lootedCorpseRooms.contains(entry.getKey())) {
                for (JsonElement record : records) {
                    record.getAsJsonObject().addProperty("looted", true);
                }
            }
            for (JsonElement record : records) {
                JsonElement id = record.getAsJsonObject().get("id");
                if (id != null && id.isJsonPrimitive()) {
                    maxId = Math.max(maxId, id.getAsInt());
                }
            }
            typedCorpses.add(entry.getKey(), records);
        }

        JsonArray lootedContainers = new JsonArray();
        if (isTrue(flat.get("loot_taken")) && registry.hasCampaign(campaignId)) {
            for (Room room : registry.getCampaign(campaignId).getRooms().values()) {
                if (room.getKind() == RoomKind.LOOT) {
                    lootedContainers.add(room.getId());
                }
            }
        }

        JsonObject progress = new JsonObject();
        for (Map.Entry<String, JsonElement> entry : flat.entrySet()) {
            if (STRUCTURED_KEYS.contains(entry.getKey()) || LEGACY_BANDIT_KEYS.contains(entry.getKey())) {
                continue;
            }
            JsonElement value = entry.getValue();
            if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean()) {
                progress.addProperty(entry.getKey(), value.getAsBoolean());
            }
        }

        int nextCorpseId = maxId + 1;
        JsonElement storedNext = flat.get("next_corpse_id");
        if (storedNext != null && storedNext.isJsonPrimitive() && storedNext.getAsJsonPrimitive().isNumber()) {
            nextCorpseId = Math.max(nextCorpseId, storedNext.getAsInt());
        }

        JsonArray defeated = new JsonArray();
        defeatedRooms.forEach(defeated::add);

        JsonObject typed = new JsonObject();
        typed.add("defeated_rooms", defeated);
        typed.add("corpses", typedCorpses);
        typed.addProperty("next_corpse_id", nextCorpseId);
        typed.add("looted_containers", lootedContainers);
        typed.add("progress", progress);
        return typed;
    }

    private ItemDefinition itemByName(String campaignId, String name) {
        if (!registry.hasCampaign(campaignId)) {
            return ItemDefinition.unknown(name);
        }
        Campaign campaign = registry.getCampaign(campaignId);
        if (campaign.getItems().containsKey(name)) {
            return registry.itemFromId(campaignId, name);
        }
        return registry.itemFromName(campaignId, name);
    }

    private static JsonObject corpse(int id, String name, boolean looted) {
        JsonObject record = new JsonObject();
        record.addProperty("id", id);
        record.addProperty("name", name);
        record.addProperty("looted", looted);
        return record;
    }

    private static List<String> stringList(JsonElement element) {
        List<String> values = new ArrayList<>();
        if (element != null && element.isJsonArray()) {
            for (JsonElement entry : element.getAsJsonArray()) {
                if (entry.isJsonPrimitive()) {
                    values.add(entry.getAsString());
                }
            }
        }
        return values;
    }

    private static boolean isTrue(JsonElement element) {
        if (element == null || !element.isJsonPrimitive()) {
            return false;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        return !primitive.getAsString().isEmpty();
    }

    private static String stringOr(JsonObject object, String key, String fallback) {
        JsonElement value = object.get(key);
        if (value == null || !value.isJsonPrimitive()) {
            return fallback;
        }
        return value.getAsString();
    }
}
