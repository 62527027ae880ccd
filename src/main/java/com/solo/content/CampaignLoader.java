package com.solo.content;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.solo.game_rules.DiceRoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Загрузчик кампаний из JSON-ресурсов campaigns/*.json.
 * Каждая кампания проверяется при загрузке; ошибка данных фатальна.
 */
public class CampaignLoader {
    private static final Logger log = LoggerFactory.getLogger(CampaignLoader.class);
    private static final String RESOURCE_DIR = "campaigns/";

    private final Gson gson;
    private final ClassLoader classLoader;

    public CampaignLoader() {
        this(CampaignLoader.class.getClassLoader());
    }

    public CampaignLoader(ClassLoader classLoader) {
        this.classLoader = classLoader;
        this.gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();
    }

    public ContentRegistry loadRegistry(List<String> campaignNames) {
        List<Campaign> campaigns = new ArrayList<>();
        for (String name : campaignNames) {
            String trimmed = name.trim();
            if (!trimmed.isEmpty()) {
                campaigns.add(loadResource(trimmed));
            }
        }
        if (campaigns.isEmpty()) {
            throw new IllegalStateException("No campaigns configured");
        }
        return new ContentRegistry(campaigns);
    }

    public Campaign loadResource(String name) {
        String path = RESOURCE_DIR + name + ".json";
        try (InputStream in = classLoader.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Campaign resource not found: " + path);
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                Campaign campaign = parse(reader);
                log.info("Loaded campaign '{}' ({} rooms, {} mobs)",
                    campaign.getId(), campaign.getRooms().size(), campaign.getMobs().size());
                return campaign;
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read campaign resource " + path, e);
        }
    }

    public Campaign parse(Reader reader) {
        Campaign campaign;
        try {
            campaign = gson.fromJson(reader, Campaign.class);
        } catch (JsonParseException e) {
            throw new IllegalStateException("Malformed campaign data: " + e.getMessage(), e);
        }
        if (campaign == null) {
            throw new IllegalStateException("Empty campaign data");
        }
        validate(campaign);
        return campaign;
    }

    /**
     * Проверка целостности кампании
     */
    public static void validate(Campaign campaign) {
        List<String> problems = new ArrayList<>();
        if (campaign.getId() == null || campaign.getId().isBlank()) {
            problems.add("campaign id is missing");
        }
        if (campaign.getRoomOrder().isEmpty()) {
            problems.add("room order is empty");
        }
        for (String roomId : campaign.getRoomOrder()) {
            if (!campaign.getRooms().containsKey(roomId)) {
                problems.add("room order names unknown room '" + roomId + "'");
            }
        }

        for (Map.Entry<String, Room> entry : campaign.getRooms().entrySet()) {
            Room room = entry.getValue();
            if (!entry.getKey().equals(room.getId())) {
                problems.add("room key '" + entry.getKey() + "' does not match id '" + room.getId() + "'");
            }
            if (room.getKind() == null) {
                problems.add("room '" + entry.getKey() + "' has no kind");
                continue;
            }
            switch (room.getKind()) {
                case COMBAT -> {
                    if (room.getEnemyName() == null || !campaign.getMobs().containsKey(room.getEnemyName())) {
                        problems.add("combat room '" + room.getId() + "' names unknown mob '" + room.getEnemyName() + "'");
                    }
                }
                case LOOT -> {
                    String winItem = room.getLootConfig() != null && room.getLootConfig().getWinItemId() != null
                        ? room.getLootConfig().getWinItemId()
                        : room.getLoot();
                    if (winItem == null || !campaign.getItems().containsKey(winItem)) {
                        problems.add("loot room '" + room.getId() + "' names unknown item '" + winItem + "'");
                    }
                }
                case SOCIAL, PASSAGE -> {
                }
            }
        }

        for (Map.Entry<String, Map<String, String>> entry : campaign.getExits().entrySet()) {
            if (!campaign.getRooms().containsKey(entry.getKey())) {
                problems.add("exits declared for unknown room '" + entry.getKey() + "'");
            }
            for (String destination : entry.getValue().values()) {
                if (!campaign.getRooms().containsKey(destination)) {
                    problems.add("exit from '" + entry.getKey() + "' leads to unknown room '" + destination + "'");
                }
            }
        }

        for (ItemDefinition item : campaign.getItems().values()) {
            if (item.getEffect() != null && item.getEffect().getType() == EffectType.HEAL
                    && !DiceRoller.isValidExpression(item.getEffect().getDice())) {
                problems.add("item '" + item.getId() + "' has invalid dice '" + item.getEffect().getDice() + "'");
            }
        }

        for (Map.Entry<String, MobProfile> entry : campaign.getMobs().entrySet()) {
            MobProfile mob = entry.getValue();
            if (!DiceRoller.isValidExpression(mob.getDamage())) {
                problems.add("mob '" + entry.getKey() + "' has invalid damage '" + mob.getDamage() + "'");
            }
            if (mob.hasHpExpression() && !DiceRoller.isValidExpression(mob.getHpExpr())) {
                problems.add("mob '" + entry.getKey() + "' has invalid hp expression '" + mob.getHpExpr() + "'");
            }
            String gold = mob.getLoot().getGold();
            if (gold != null && !DiceRoller.isValidExpression(gold)) {
                problems.add("mob '" + entry.getKey() + "' has invalid gold expression '" + gold + "'");
            }
            for (String itemId : mob.getLoot().getItems()) {
                if (!campaign.getItems().containsKey(itemId)) {
                    problems.add("mob '" + entry.getKey() + "' drops unknown item '" + itemId + "'");
                }
            }
        }

        for (CompanionProfile companion : campaign.getCompanions().values()) {
            if (!DiceRoller.isValidExpression(companion.getDamage())) {
                problems.add("companion '" + companion.getId() + "' has invalid damage '" + companion.getDamage() + "'");
            }
        }
        for (String companionId : campaign.getDefaultCompanionIds()) {
            if (!campaign.getCompanions().containsKey(companionId)) {
                problems.add("default companion '" + companionId + "' is not defined");
            }
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Campaign '" + campaign.getId() + "' is invalid: " + String.join("; ", problems));
        }
    }
}
