package com.dndforge.game_state;

import com.google.gson.annotations.SerializedName;

/**
 * Мировоззрение персонажа
 */
public enum Alignment {
    @SerializedName("Unaligned") UNALIGNED("Unaligned"),
    @SerializedName("Lawful Good") LAWFUL_GOOD("Lawful Good"),
    @SerializedName("Neutral Good") NEUTRAL_GOOD("Neutral Good"),
    @SerializedName("Chaotic Good") CHAOTIC_GOOD("Chaotic Good"),
    @SerializedName("Lawful Neutral") LAWFUL_NEUTRAL("Lawful Neutral"),
    @SerializedName("True Neutral") TRUE_NEUTRAL("True Neutral"),
    @SerializedName("Chaotic Neutral") CHAOTIC_NEUTRAL("Chaotic Neutral"),
    @SerializedName("Lawful Evil") LAWFUL_EVIL("Lawful Evil"),
    @SerializedName("Neutral Evil") NEUTRAL_EVIL("Neutral Evil"),
    @SerializedName("Chaotic Evil") CHAOTIC_EVIL("Chaotic Evil");

    private final String value;

    Alignment(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Alignment fromString(String value) {
        for (Alignment alignment : Alignment.values()) {
            if (alignment.value.equalsIgnoreCase(value)) {
                return alignment;
            }
        }
        throw new IllegalArgumentException("Unknown alignment: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
