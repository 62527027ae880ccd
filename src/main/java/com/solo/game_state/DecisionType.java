package com.solo.game_state;

import com.google.gson.annotations.SerializedName;

public enum DecisionType {
    @SerializedName("spell") SPELL("spell");

    private final String value;

    DecisionType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
