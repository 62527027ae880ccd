package com.solo.content;

import com.google.gson.annotations.SerializedName;

/**
 * Тип комнаты определяет единственный допустимый набор действий
 */
public enum RoomKind {
    @SerializedName("social") SOCIAL("social"),
    @SerializedName("combat") COMBAT("combat"),
    @SerializedName("loot") LOOT("loot"),
    @SerializedName("passage") PASSAGE("passage");

    private final String value;

    RoomKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
