package com.solo.content;

public enum SpellKind {
    DAMAGE,
    HEAL,
    WARD,
    UTILITY
}
