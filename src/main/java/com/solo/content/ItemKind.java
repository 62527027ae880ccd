package com.solo.content;

import com.google.gson.annotations.SerializedName;

/**
 * Категории предметов
 */
public enum ItemKind {
    @SerializedName("potion") POTION("potion"),
    @SerializedName("armor") ARMOR("armor"),
    @SerializedName("quest") QUEST("quest"),
    @SerializedName("unknown") UNKNOWN("unknown");

    private final String value;

    ItemKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
