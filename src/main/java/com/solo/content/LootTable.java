package com.solo.content;

import java.util.ArrayList;
import java.util.List;

/**
 * Добыча с монстра: выражение золота и список возможных предметов
 */
public class LootTable {
    private String gold;
    private List<String> items = new ArrayList<>();

    private LootTable() {
    }

    public LootTable(String gold, List<String> items) {
        this.gold = gold;
        this.items = items != null ? new ArrayList<>(items) : new ArrayList<>();
    }

    public static LootTable empty() {
        return new LootTable(null, List.of());
    }

    public String getGold() { return gold; }
    public List<String> getItems() { return items != null ? items : List.of(); }
}
