package com.solo.content;

import com.google.gson.annotations.SerializedName;

public enum EffectType {
    @SerializedName("heal") HEAL,
    @SerializedName("ac") AC
}
