package com.solo.game_rules;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.solo.content.Ability;
import com.solo.content.Campaign;
import com.solo.content.CampaignLoader;
import com.solo.content.CharacterClass;
import com.solo.content.CharacterRace;
import com.solo.content.ContentRegistry;
import com.solo.game_state.Character;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

public final class TestFixtures {
    public static final String WATCHTOWER = "ruined_watchtower";
    public static final String CRYPT = "lost_crypt";

    private static ContentRegistry registry;

    private TestFixtures() {
    }

    public static synchronized ContentRegistry registry() {
        if (registry == null) {
            registry = new CampaignLoader().loadRegistry(List.of(WATCHTOWER, CRYPT));
        }
        return registry;
    }

    /**
     * Реестр из одной кампании, JSON которой правится перед загрузкой
     */
    public static ContentRegistry editedRegistry(String campaignName, Consumer<JsonObject> edit) {
        try (InputStream in = TestFixtures.class.getResourceAsStream("/campaigns/" + campaignName + ".json");
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            JsonObject json = JsonParser.parseReader(reader).getAsJsonObject();
            edit.accept(json);
            Campaign campaign = new CampaignLoader().parse(new StringReader(json.toString()));
            return new ContentRegistry(List.of(campaign));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * STR 3, DEX 2, CON 3, INT 2, WIS 1, CHA 1
     */
    public static Map<Ability, Integer> balancedStats() {
        Map<Ability, Integer> stats = new EnumMap<>(Ability.class);
        stats.put(Ability.STR, 3);
        stats.put(Ability.DEX, 2);
        stats.put(Ability.CON, 3);
        stats.put(Ability.INT, 2);
        stats.put(Ability.WIS, 1);
        stats.put(Ability.CHA, 1);
        return stats;
    }

    public static Character fighter(String name) {
        return EntityFactory.createPlayer(name, CharacterClass.FIGHTER, balancedStats(), CharacterRace.HUMAN);
    }

    public static Character wizard(String name) {
        Map<Ability, Integer> stats = new EnumMap<>(Ability.class);
        stats.put(Ability.STR, 1);
        stats.put(Ability.DEX, 2);
        stats.put(Ability.CON, 2);
        stats.put(Ability.INT, 4);
        stats.put(Ability.WIS, 2);
        stats.put(Ability.CHA, 1);
        return EntityFactory.createPlayer(name, CharacterClass.WIZARD, stats, CharacterRace.HUMAN);
    }
}
