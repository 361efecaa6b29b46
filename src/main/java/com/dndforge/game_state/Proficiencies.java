package com.dndforge.game_state;

import java.util.*;

/**
 * Владения персонажа. Только накапливаются: добавление без дублей, без перезаписи.
 */
public class Proficiencies {
    private SortedSet<String> weapons = new TreeSet<>();
    private SortedSet<String> armor = new TreeSet<>();
    private SortedSet<String> skills = new TreeSet<>();
    private SortedSet<String> tools = new TreeSet<>();
    private SortedSet<String> savingThrows = new TreeSet<>();

    public void addWeapons(Collection<String> values) { weapons.addAll(values); }

    public void addArmor(Collection<String> values) { armor.addAll(values); }

    public void addSkills(Collection<String> values) { skills.addAll(values); }

    public void addTools(Collection<String> values) { tools.addAll(values); }

    public void addSavingThrows(Collection<String> values) { savingThrows.addAll(values); }

    // Getters
    public SortedSet<String> getWeapons() { return Collections.unmodifiableSortedSet(weapons); }

    public SortedSet<String> getArmor() { return Collections.unmodifiableSortedSet(armor); }

    public SortedSet<String> getSkills() { return Collections.unmodifiableSortedSet(skills); }

    public SortedSet<String> getTools() { return Collections.unmodifiableSortedSet(tools); }

    public SortedSet<String> getSavingThrows() { return Collections.unmodifiableSortedSet(savingThrows); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Proficiencies)) return false;
        Proficiencies that = (Proficiencies) o;
        return weapons.equals(that.weapons) && armor.equals(that.armor) && skills.equals(that.skills)
            && tools.equals(that.tools) && savingThrows.equals(that.savingThrows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(weapons, armor, skills, tools, savingThrows);
    }
}
