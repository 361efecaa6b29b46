package com.dndforge.game_state;

import java.util.*;

/**
 * Значения характеристик персонажа.
 * Заполняется целиком, одной стратегией: рекомендованной раскладкой класса или вручную.
 */
public class AbilityScores {
    public static final List<Integer> STANDARD_ARRAY = List.of(15, 14, 13, 12, 10, 8);

    private Map<Ability, Integer> scores = new EnumMap<>(Ability.class);

    public AbilityScores() {
    }

    public AbilityScores(Map<Ability, Integer> scores) {
        this.scores = new EnumMap<>(Ability.class);
        this.scores.putAll(scores);
    }

    /**
     * Все шесть характеристик заданы положительными числами
     */
    public boolean isComplete() {
        for (Ability ability : Ability.values()) {
            Integer score = scores.get(ability);
            if (score == null || score <= 0) {
                return false;
            }
        }
        return true;
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    public Integer getScore(Ability ability) {
        return scores.get(ability);
    }

    /**
     * Модификатор с учетом бонусов предыстории
     */
    public int getModifier(Ability ability, Map<Ability, Integer> bonuses) {
        int total = getScore(ability) != null ? getScore(ability) : 10;
        if (bonuses != null) {
            total += bonuses.getOrDefault(ability, 0);
        }
        return Math.floorDiv(total - 10, 2);
    }

    public Map<Ability, Integer> asMap() {
        return Collections.unmodifiableMap(scores);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AbilityScores)) return false;
        return Objects.equals(scores, ((AbilityScores) o).scores);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scores);
    }

    @Override
    public String toString() {
        return scores.toString();
    }
}
