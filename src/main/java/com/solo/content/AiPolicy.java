package com.solo.content;

import com.google.gson.annotations.SerializedName;

/**
 * Политика выбора цели для противников
 */
public enum AiPolicy {
    @SerializedName("focus_player") FOCUS_PLAYER,
    @SerializedName("focus_companion") FOCUS_COMPANION,
    @SerializedName("focus_weakest") FOCUS_WEAKEST
}
