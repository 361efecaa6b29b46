package com.dndforge.game_state;

import com.google.gson.annotations.SerializedName;

/**
 * Шаги создания персонажа, в порядке прохождения
 */
public enum CreationStep {
    @SerializedName("class") CLASS("class"),
    @SerializedName("subclass") SUBCLASS("subclass"),
    @SerializedName("class_choices") CLASS_CHOICES("class_choices"),
    @SerializedName("background") BACKGROUND("background"),
    @SerializedName("species") SPECIES("species"),
    @SerializedName("species_traits") SPECIES_TRAITS("species_traits"),
    @SerializedName("lineage") LINEAGE("lineage"),
    @SerializedName("languages") LANGUAGES("languages"),
    @SerializedName("ability_scores") ABILITY_SCORES("ability_scores"),
    @SerializedName("background_bonuses") BACKGROUND_BONUSES("background_bonuses"),
    @SerializedName("equipment") EQUIPMENT("equipment"),
    @SerializedName("complete") COMPLETE("complete");

    private final String value;

    CreationStep(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
