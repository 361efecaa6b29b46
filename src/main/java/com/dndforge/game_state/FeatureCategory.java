package com.dndforge.game_state;

import com.google.gson.annotations.SerializedName;

/**
 * Источник способности в записи персонажа
 */
public enum FeatureCategory {
    @SerializedName("class") CLASS("class"),
    @SerializedName("subclass") SUBCLASS("subclass"),
    @SerializedName("species") SPECIES("species"),
    @SerializedName("lineage") LINEAGE("lineage"),
    @SerializedName("background") BACKGROUND("background"),
    @SerializedName("feat") FEAT("feat");

    private final String value;

    FeatureCategory(String value) {
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
