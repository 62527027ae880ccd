package com.solo.content;

public enum ClassRole {
    CASTER,
    MELEE
}
