package com.dndforge.game_rules;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * Порог масштабирования: значение действует начиная с уровня minLevel
 */
public class Breakpoint {
    @SerializedName("min_level")
    private int minLevel;
    private String value;

    public Breakpoint() {
    }

    public Breakpoint(int minLevel, String value) {
        this.minLevel = minLevel;
        this.value = value;
    }

    public int getMinLevel() { return minLevel; }

    public String getValue() { return value; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Breakpoint)) return false;
        Breakpoint that = (Breakpoint) o;
        return minLevel == that.minLevel && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minLevel, value);
    }

    @Override
    public String toString() {
        return "Breakpoint{" + minLevel + "=" + value + "}";
    }
}
