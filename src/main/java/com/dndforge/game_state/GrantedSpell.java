package com.dndforge.game_state;

import java.util.Objects;

/**
 * Заклинание или заговор, всегда подготовленный благодаря способности, черте или линии
 */
public class GrantedSpell {
    private int level;
    private String source;
    private boolean oncePerDay;
    private boolean countsAgainstLimit;

    public GrantedSpell() {
    }

    public GrantedSpell(int level, String source, boolean oncePerDay, boolean countsAgainstLimit) {
        this.level = level;
        this.source = source;
        this.oncePerDay = oncePerDay;
        this.countsAgainstLimit = countsAgainstLimit;
    }

    public boolean isCantrip() {
        return level == 0;
    }

    // Getters
    public int getLevel() { return level; }
    public String getSource() { return source; }
    public boolean isOncePerDay() { return oncePerDay; }
    public boolean isCountsAgainstLimit() { return countsAgainstLimit; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GrantedSpell)) return false;
        GrantedSpell that = (GrantedSpell) o;
        return level == that.level
            && oncePerDay == that.oncePerDay
            && countsAgainstLimit == that.countsAgainstLimit
            && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, source, oncePerDay, countsAgainstLimit);
    }

    @Override
    public String toString() {
        return "GrantedSpell{level=" + level + ", source='" + source + "'}";
    }
}
