package com.solo.content;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Неизменяемый справочник кампаний. Передаётся в движки явно.
 * Неизвестные кампании, комнаты, монстры и спутники считаются ошибкой данных.
 */
public class ContentRegistry {
    private final Map<String, Campaign> campaigns;

    public ContentRegistry(List<Campaign> campaigns) {
        Map<String, Campaign> byId = new LinkedHashMap<>();
        for (Campaign campaign : campaigns) {
            byId.put(campaign.getId(), campaign);
        }
        this.campaigns = Collections.unmodifiableMap(byId);
    }

    public Campaign getCampaign(String campaignId) {
        Campaign campaign = campaigns.get(campaignId);
        if (campaign == null) {
            throw new IllegalArgumentException("Unknown campaign: " + campaignId);
        }
        return campaign;
    }

    public boolean hasCampaign(String campaignId) {
        return campaignId != null && campaigns.containsKey(campaignId);
    }

    public List<Campaign> listCampaigns() {
        return new ArrayList<>(campaigns.values());
    }

    public Room getRoom(String campaignId, String roomId) {
        Room room = getCampaign(campaignId).getRooms().get(roomId);
        if (room == null) {
            throw new IllegalArgumentException("Unknown room '" + roomId + "' in campaign '" + campaignId + "'");
        }
        return room;
    }

    /**
     * Следующая комната в линейном порядке кампании
     */
    public Optional<String> nextRoomId(String campaignId, String currentRoomId) {
        List<String> order = getCampaign(campaignId).getRoomOrder();
        int idx = order.indexOf(currentRoomId);
        if (idx < 0 || idx + 1 >= order.size()) {
            return Optional.empty();
        }
        return Optional.of(order.get(idx + 1));
    }

    /**
     * Новый экземпляр предмета по id; неизвестный id даёт синтетический предмет
     */
    public ItemDefinition itemFromId(String campaignId, String itemId) {
        ItemDefinition item = getCampaign(campaignId).getItems().get(itemId);
        if (item == null) {
            return ItemDefinition.unknown(itemId);
        }
        return item.copy();
    }

    public ItemDefinition itemFromName(String campaignId, String name) {
        for (ItemDefinition item : getCampaign(campaignId).getItems().values()) {
            if (item.getName().equalsIgnoreCase(name)) {
                return item.copy();
            }
        }
        return ItemDefinition.unknown(name);
    }

    public MobProfile getMobProfile(String campaignId, String name) {
        MobProfile profile = getCampaign(campaignId).getMobs().get(name);
        if (profile == null) {
            throw new IllegalArgumentException("Unknown mob '" + name + "' in campaign '" + campaignId + "'");
        }
        return profile;
    }

    public CompanionProfile getCompanionProfile(String campaignId, String companionId) {
        CompanionProfile profile = getCampaign(campaignId).getCompanions().get(companionId);
        if (profile == null) {
            throw new IllegalArgumentException("Unknown companion '" + companionId + "' in campaign '" + campaignId + "'");
        }
        return profile;
    }

    /**
     * Копия карты выходов комнаты: команда -> комната назначения
     */
    public Map<String, String> getExits(String campaignId, String roomId) {
        Map<String, String> exits = getCampaign(campaignId).getExits().get(roomId);
        return exits != null ? new LinkedHashMap<>(exits) : new LinkedHashMap<>();
    }

    public List<String> questItemIds(String campaignId) {
        return getCampaign(campaignId).getItems().entrySet().stream()
            .filter(entry -> entry.getValue().getKind() == ItemKind.QUEST)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }
}
