package com.solo.content;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Кампания: порядок комнат, комнаты, каталог предметов, шаблоны монстров и спутников, граф выходов
 */
public class Campaign {
    private String id;
    private String name;
    private String description = "";
    private int completionXp;
    private List<String> roomOrder = new ArrayList<>();
    private List<String> defaultCompanionIds = new ArrayList<>();
    private Map<String, Room> rooms = new LinkedHashMap<>();
    private Map<String, ItemDefinition> items = new LinkedHashMap<>();
    private Map<String, MobProfile> mobs = new LinkedHashMap<>();
    private Map<String, CompanionProfile> companions = new LinkedHashMap<>();
    private Map<String, Map<String, String>> exits = new LinkedHashMap<>();

    private Campaign() {
    }

    public Campaign(String id, String name, String description, int completionXp, List<String> roomOrder,
                    List<String> defaultCompanionIds, Map<String, Room> rooms, Map<String, ItemDefinition> items,
                    Map<String, MobProfile> mobs, Map<String, CompanionProfile> companions,
                    Map<String, Map<String, String>> exits) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.completionXp = completionXp;
        this.roomOrder = new ArrayList<>(roomOrder);
        this.defaultCompanionIds = new ArrayList<>(defaultCompanionIds);
        this.rooms = new LinkedHashMap<>(rooms);
        this.items = new LinkedHashMap<>(items);
        this.mobs = new LinkedHashMap<>(mobs);
        this.companions = new LinkedHashMap<>(companions);
        this.exits = new LinkedHashMap<>(exits);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public int getCompletionXp() { return completionXp; }
    public List<String> getRoomOrder() { return roomOrder != null ? roomOrder : List.of(); }
    public Map<String, Room> getRooms() { return rooms != null ? rooms : Map.of(); }
    public Map<String, ItemDefinition> getItems() { return items != null ? items : Map.of(); }
    public Map<String, MobProfile> getMobs() { return mobs != null ? mobs : Map.of(); }
    public Map<String, CompanionProfile> getCompanions() { return companions != null ? companions : Map.of(); }
    public Map<String, Map<String, String>> getExits() { return exits != null ? exits : Map.of(); }

    /**
     * Спутники на выбор; если список не задан, первый объявленный спутник
     */
    public List<String> getDefaultCompanionIds() {
        if (defaultCompanionIds != null && !defaultCompanionIds.isEmpty()) {
            return defaultCompanionIds;
        }
        return getCompanions().keySet().stream().limit(1).collect(Collectors.toList());
    }

    public String getStartRoomId() {
        return getRoomOrder().isEmpty() ? null : getRoomOrder().get(0);
    }
}
