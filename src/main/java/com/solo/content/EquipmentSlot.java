package com.solo.content;

import com.google.gson.annotations.SerializedName;

/**
 * Слоты экипировки (ровно шесть)
 */
public enum EquipmentSlot {
    @SerializedName("head") HEAD("head"),
    @SerializedName("arms") ARMS("arms"),
    @SerializedName("hands") HANDS("hands"),
    @SerializedName("chest") CHEST("chest"),
    @SerializedName("legs") LEGS("legs"),
    @SerializedName("feet") FEET("feet");

    private final String value;

    EquipmentSlot(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Поиск слота по имени; null, если такого слота нет
     */
    public static EquipmentSlot fromString(String value) {
        if (value == null) {
            return null;
        }
        String key = value.trim().toLowerCase();
        for (EquipmentSlot slot : values()) {
            if (slot.value.equals(key)) {
                return slot;
            }
        }
        return null;
    }
}
