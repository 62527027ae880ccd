package com.solo.content;

/**
 * Чем класс отвечает на команду special
 */
public enum SpecialStyle {
    POWER_STRIKE,
    PRECISION,
    SPELLCASTING,
    // обычная атака без бонусов
    PLAIN
}
