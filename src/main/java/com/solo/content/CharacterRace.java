package com.solo.content;

import com.google.gson.annotations.SerializedName;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Расы персонажей и их модификаторы характеристик
 */
public enum CharacterRace {
    @SerializedName(value = "Human", alternate = {"human"})
    HUMAN("Human", "Versatile and adaptable.", Map.of(), List.of(), List.of()),
    @SerializedName(value = "Elf", alternate = {"elf"})
    ELF("Elf", "Graceful and perceptive, with keen senses.",
            Map.of(Ability.DEX, 1, Ability.INT, 1),
            List.of("darkvision", "keen_senses"), List.of("bows")),
    @SerializedName(value = "Dwarf", alternate = {"dwarf"})
    DWARF("Dwarf", "Sturdy and resilient, at home underground.",
            Map.of(Ability.STR, 1, Ability.CON, 1, Ability.CHA, -1),
            List.of("darkvision", "stonecunning"), List.of("axes")),
    @SerializedName(value = "Halfling", alternate = {"halfling"})
    HALFLING("Halfling", "Small and nimble, quick to avoid danger.",
            Map.of(Ability.DEX, 1, Ability.STR, -1),
            List.of("lucky", "nimble"), List.of("stealth"));

    public static final int MIN_STAT = 0;
    public static final int MAX_STAT = 4;

    private final String value;
    private final String description;
    private final Map<Ability, Integer> statMods;
    private final List<String> abilities;
    private final List<String> proficiencies;

    CharacterRace(String value, String description, Map<Ability, Integer> statMods,
                  List<String> abilities, List<String> proficiencies) {
        this.value = value;
        this.description = description;
        this.statMods = statMods;
        this.abilities = abilities;
        this.proficiencies = proficiencies;
    }

    public String getValue() { return value; }
    public String getDescription() { return description; }
    public Map<Ability, Integer> getStatMods() { return statMods; }
    public List<String> getAbilities() { return abilities; }
    public List<String> getProficiencies() { return proficiencies; }

    /**
     * Применяет модификаторы расы. Изменённые характеристики зажимаются в [0, 4].
     */
    public Map<Ability, Integer> applyMods(Map<Ability, Integer> raw) {
        Map<Ability, Integer> result = new EnumMap<>(Ability.class);
        for (Ability ability : Ability.values()) {
            result.put(ability, raw != null ? raw.getOrDefault(ability, 0) : 0);
        }
        for (Map.Entry<Ability, Integer> mod : statMods.entrySet()) {
            int value = result.get(mod.getKey()) + mod.getValue();
            result.put(mod.getKey(), Math.max(MIN_STAT, Math.min(MAX_STAT, value)));
        }
        return result;
    }

    public static CharacterRace fromString(String value) {
        for (CharacterRace cr : CharacterRace.values()) {
            if (cr.value.equalsIgnoreCase(value) || cr.name().equalsIgnoreCase(value)) {
                return cr;
            }
        }
        throw new IllegalArgumentException("Unknown character race: " + value);
    }
}
