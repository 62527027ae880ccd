package com.solo.content;

/**
 * Комната кампании. Тип комнаты задаёт поведение, конфигурация задаёт детали проверки.
 */
public class Room {
    private String id;
    private String name;
    private String description = "";
    private RoomKind kind;
    private String npc;
    private String enemyName;
    private String loot;
    private SocialConfig social;
    private LootConfig lootConfig;

    private Room() {
    }

    public Room(String id, String name, String description, RoomKind kind, String npc,
                String enemyName, SocialConfig social, LootConfig lootConfig) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.kind = kind;
        this.npc = npc;
        this.enemyName = enemyName;
        this.social = social;
        this.lootConfig = lootConfig;
        this.loot = lootConfig != null ? lootConfig.getWinItemId() : null;
    }

    public String getId() { return id; }
    public String getName() { return name != null ? name : id; }
    public String getDescription() { return description != null ? description : ""; }
    public RoomKind getKind() { return kind; }
    public String getNpc() { return npc; }
    public String getEnemyName() { return enemyName; }
    public String getLoot() { return loot; }
    public SocialConfig getSocial() { return social; }
    public LootConfig getLootConfig() { return lootConfig; }
}
