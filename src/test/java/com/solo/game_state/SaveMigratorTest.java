package com.solo.game_state;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.solo.content.CharacterClass;
import com.solo.content.Spell;
import com.solo.game_rules.TestFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SaveMigratorTest {
    private static final String LEGACY_SAVE = """
        {
          "session_id": "old_game",
          "room_id": "barracks",
          "player": {
            "name": "Bryn", "race": "Human", "cls": "Fighter",
            "stats": {"STR": 3, "DEX": 2, "CON": 3, "INT": 2, "WIS": 1, "CHA": 1},
            "hp": 12, "max_hp": 17, "ac": 15, "base_ac": 15,
            "attack_bonus": 3, "damage": "1d8+1", "level": 1, "xp": 40, "gold": 7
          },
          "companion": {"name": "Mara", "hp": 10, "max_hp": 10, "ac": 13, "attack_bonus": 2, "damage": "1d6"},
          "inventory": ["Healing Potion", "leather_cap", "Mystery Box"],
          "flags": {
            "bandit_defeated": true,
            "enemy_name": "Watchtower Bandit",
            "loot_taken": true,
            "scout_helped": true,
            "social_done": true
          },
          "pending_level_choices": [{"type": "spell", "level": 2, "choices": ["Shield", "Sleep"]}]
        }
        """;

    private final SaveCodec codec = new SaveCodec(TestFixtures.registry());

    @Test
    void legacySaveIsUpgradedToTypedState() {
        GameState state = codec.fromJson(LEGACY_SAVE);

        assertThat(state.getVersion()).isEqualTo(GameState.SAVE_VERSION);
        assertThat(state.getCampaignId()).isEqualTo("ruined_watchtower");
        assertThat(state.getPlayer().getCharacterClass()).isEqualTo(CharacterClass.FIGHTER);
        assertThat(state.getPlayer().getHp()).isEqualTo(12);
        assertThat(state.getPlayer().getGold()).isEqualTo(7);
        assertThat(state.getCompanions()).extracting(Companion::getName).containsExactly("Mara");
        assertThat(state.getEquipment()).hasSize(6);
    }

    @Test
    void legacyFlagsBecomeTypedProgress() {
        CampaignFlags flags = codec.fromJson(LEGACY_SAVE).getFlags();

        assertThat(flags.isRoomDefeated("barracks")).isTrue();
        assertThat(flags.corpsesIn("barracks")).hasSize(1);
        CorpseRecord corpse = flags.corpsesIn("barracks").get(0);
        assertThat(corpse.getName()).isEqualTo("Watchtower Bandit");
        assertThat(corpse.isLooted()).isFalse();
        assertThat(flags.getNextCorpseId()).isEqualTo(2);
        assertThat(flags.isContainerLooted("spire")).isTrue();
        assertThat(flags.isSet("scout_helped")).isTrue();
        assertThat(flags.getProgress()).doesNotContainKeys("loot_taken", "bandit_defeated", "enemy_name");
    }

    @Test
    void namedInventoryAndLevelChoicesAreResolved() {
        GameState state = codec.fromJson(LEGACY_SAVE);

        assertThat(state.getInventory()).extracting(item -> item.getId())
            .containsExactly("healing_potion", "leather_cap", "unknown");
        assertThat(state.getInventory().get(2).getName()).isEqualTo("Mystery Box");
        assertThat(state.getPendingDecisions()).hasSize(1);
        PendingDecision decision = state.getPendingDecisions().get(0);
        assertThat(decision.getType()).isEqualTo(DecisionType.SPELL);
        assertThat(decision.getLevel()).isEqualTo(2);
        assertThat(decision.getOptions()).containsExactly(Spell.SHIELD, Spell.SLEEP);
        assertThat(decision.isOffered()).isFalse();
    }

    @Test
    void currentVersionPassesThroughUntouched() {
        SaveMigrator migrator = new SaveMigrator(TestFixtures.registry(), SaveCodec.createGson());
        JsonObject current = JsonParser.parseString("{\"version\": 2, \"flags\": {\"loot_taken\": true}}")
            .getAsJsonObject();

        JsonObject migrated = migrator.migrate(current);

        assertThat(migrated).isSameAs(current);
        assertThat(migrated.getAsJsonObject("flags").has("loot_taken")).isTrue();
        assertThat(SaveMigrator.versionOf(JsonParser.parseString("{}").getAsJsonObject())).isEqualTo(1);
    }
}
