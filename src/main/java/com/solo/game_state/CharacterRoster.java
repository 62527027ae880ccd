package com.solo.game_state;

import com.google.gson.JsonParseException;
import com.solo.content.ContentRegistry;
import com.solo.content.ItemDefinition;
import com.solo.game_rules.EntityFactory;
import com.solo.game_rules.GameEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.*;

/**
 * Реестр персонажей, переходящих из кампании в кампанию. Ключ: безопасный slug имени.
 */
public class CharacterRoster {
    private static final Logger log = LoggerFactory.getLogger(CharacterRoster.class);

    private final GameManager store;
    private final SaveCodec codec;
    private final ContentRegistry registry;

    public CharacterRoster(GameManager store, SaveCodec codec, ContentRegistry registry) {
        this.store = store;
        this.codec = codec;
        this.registry = registry;
    }

    public static String slug(String name) {
        String safe = (name == null ? "" : name.toLowerCase(Locale.ROOT))
            .replaceAll("[^\\w\\s-]", "")
            .replaceAll("[-\\s]+", "_");
        safe = safe.replaceAll("^_+|_+$", "");
        return safe.isEmpty() ? "character" : safe;
    }

    public void save(GameState state) {
        RosterEntry entry = new RosterEntry(state.getPlayer(), state.getInventory(), state.getEquipment());
        String data = codec.getGson().toJson(entry);
        try (Connection conn = store.connect();
             PreparedStatement stmt = conn.prepareStatement(
                 "INSERT OR REPLACE INTO characters (slug, name, character_data) VALUES (?, ?, ?)")) {
            stmt.setString(1, slug(state.getPlayer().getName()));
            stmt.setString(2, state.getPlayer().getName());
            stmt.setString(3, data);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new GamePersistenceException("Failed to save character " + state.getPlayer().getName(), e);
        }
    }

    public List<String> listNames() {
        Set<String> names = new TreeSet<>();
        try (Connection conn = store.connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT name FROM characters")) {
            while (rs.next()) {
                names.add(rs.getString("name"));
            }
        } catch (SQLException e) {
            throw new GamePersistenceException("Failed to list characters", e);
        }
        return new ArrayList<>(names);
    }

    /**
     * Персонаж для новой кампании: полное HP и мана, не меньше трёх зелий лечения.
     * Неизвестное имя даёт null.
     */
    public RosterEntry load(String name, String campaignId) {
        String data;
        try (Connection conn = store.connect();
             PreparedStatement stmt = conn.prepareStatement("SELECT character_data FROM characters WHERE slug = ?")) {
            stmt.setString(1, slug(name));
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                data = rs.getString("character_data");
            }
        } catch (SQLException e) {
            throw new GamePersistenceException("Failed to load character " + name, e);
        }

        RosterEntry entry;
        try {
            entry = codec.getGson().fromJson(data, RosterEntry.class);
        } catch (JsonParseException | IllegalStateException e) {
            throw new SaveCorruptedException("Character record for '" + name + "' is corrupt", e);
        }
        if (entry == null || entry.getCharacter() == null || entry.getCharacter().getCharacterClass() == null) {
            throw new SaveCorruptedException("Character record for '" + name + "' is incomplete");
        }

        Character character = entry.getCharacter();
        EntityFactory.ensureCasterMana(character);
        character.restoreFullHp();
        character.setMana(character.getMaxMana());

        long potions = entry.getInventory().stream()
            .filter(item -> GameEngine.POTION_ID.equalsIgnoreCase(item.getId()))
            .count();
        for (long i = potions; i < GameEngine.STARTING_POTIONS; i++) {
            entry.getInventory().add(registry.itemFromId(campaignId, GameEngine.POTION_ID));
        }
        log.info("Loaded character '{}' (level {}) for campaign {}", character.getName(), character.getLevel(), campaignId);
        return entry;
    }

    /**
     * Запись реестра: персонаж с инвентарём и экипировкой
     */
    public static class RosterEntry {
        private int version = 1;
        private Character character;
        private List<ItemDefinition> inventory = new ArrayList<>();
        private Map<String, ItemDefinition> equipment = GameState.emptyEquipment();

        private RosterEntry() {
        }

        public RosterEntry(Character character, List<ItemDefinition> inventory, Map<String, ItemDefinition> equipment) {
            this.character = character;
            this.inventory = new ArrayList<>(inventory);
            this.equipment = new LinkedHashMap<>(equipment);
        }

        public int getVersion() { return version; }
        public Character getCharacter() { return character; }

        public List<ItemDefinition> getInventory() {
            if (inventory == null) {
                inventory = new ArrayList<>();
            }
            return inventory;
        }

        public Map<String, ItemDefinition> getEquipment() {
            Map<String, ItemDefinition> slots = GameState.emptyEquipment();
            if (equipment != null) {
                equipment.forEach((slot, item) -> {
                    if (slots.containsKey(slot)) {
                        slots.put(slot, item);
                    }
                });
            }
            return slots;
        }
    }
}
