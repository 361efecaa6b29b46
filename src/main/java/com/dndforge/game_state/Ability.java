package com.dndforge.game_state;

import com.google.gson.annotations.SerializedName;

/**
 * Шесть характеристик персонажа
 */
public enum Ability {
    @SerializedName("Strength") STRENGTH("Strength"),
    @SerializedName("Dexterity") DEXTERITY("Dexterity"),
    @SerializedName("Constitution") CONSTITUTION("Constitution"),
    @SerializedName("Intelligence") INTELLIGENCE("Intelligence"),
    @SerializedName("Wisdom") WISDOM("Wisdom"),
    @SerializedName("Charisma") CHARISMA("Charisma");

    private final String value;

    Ability(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Поиск по имени без учета регистра; принимает также сокращения вида "STR"
     */
    public static Ability fromString(String value) {
        if (value != null) {
            String normalized = value.trim();
            for (Ability ability : Ability.values()) {
                if (ability.value.equalsIgnoreCase(normalized)
                    || ability.value.substring(0, 3).equalsIgnoreCase(normalized)) {
                    return ability;
                }
            }
        }
        throw new IllegalArgumentException("Unknown ability: " + value);
    }

    public static boolean isAbility(String value) {
        try {
            fromString(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    // Ключи Map при сериализации Gson пишутся через toString
    @Override
    public String toString() {
        return value;
    }
}
