package com.dndforge.game_state;

import java.util.*;

/**
 * Бонус к проверкам навыков от модификатора характеристики (например, Thaumaturge: Мудрость к Arcana и Religion).
 * Фиксированное значение value, если задано, заменяет модификатор.
 */
public class SkillBonus {
    private Ability ability;
    private List<String> skills = new ArrayList<>();
    private Integer value;
    private int minimum;
    private String source;

    public SkillBonus() {
    }

    public SkillBonus(Ability ability, List<String> skills, Integer value, int minimum, String source) {
        this.ability = ability;
        this.skills = new ArrayList<>(skills);
        this.value = value;
        this.minimum = minimum;
        this.source = source;
    }

    /**
     * Величина бонуса при заданном модификаторе характеристики
     */
    public int amount(int abilityModifier) {
        int base = value != null ? value : abilityModifier;
        return Math.max(minimum, base);
    }

    // Getters
    public Ability getAbility() { return ability; }
    public List<String> getSkills() { return Collections.unmodifiableList(skills); }
    public Integer getValue() { return value; }
    public int getMinimum() { return minimum; }
    public String getSource() { return source; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SkillBonus)) return false;
        SkillBonus that = (SkillBonus) o;
        return minimum == that.minimum
            && ability == that.ability
            && Objects.equals(skills, that.skills)
            && Objects.equals(value, that.value)
            && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ability, skills, value, minimum, source);
    }
}
