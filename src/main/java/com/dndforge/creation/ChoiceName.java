package com.dndforge.creation;

import com.dndforge.game_state.CreationStep;

/**
 * Логические имена выборов и шаги, к которым они привязаны.
 * Порядок констант задает порядок применения при воспроизведении журнала.
 */
public enum ChoiceName {
    NAME("name", null),
    ALIGNMENT("alignment", null),
    LEVEL("level", CreationStep.CLASS),
    CLASS("class", CreationStep.CLASS),
    SUBCLASS("subclass", CreationStep.SUBCLASS),
    CLASS_CHOICES("class_choices", CreationStep.CLASS_CHOICES),
    BACKGROUND("background", CreationStep.BACKGROUND),
    SPECIES("species", CreationStep.SPECIES),
    SPECIES_TRAIT("species_trait:", CreationStep.SPECIES_TRAITS),
    LINEAGE("lineage", CreationStep.LINEAGE),
    LANGUAGES("languages", CreationStep.LANGUAGES),
    ABILITY_SCORES("ability_scores", CreationStep.ABILITY_SCORES),
    BACKGROUND_BONUSES("background_bonuses", CreationStep.BACKGROUND_BONUSES),
    EQUIPMENT_SELECTIONS("equipment_selections", CreationStep.EQUIPMENT),
    // необязательны: шаг equipment выполняется без них
    SPELL_SELECTIONS("spell_selections", CreationStep.EQUIPMENT),
    WEAPON_MASTERY_SELECTIONS("weapon_mastery_selections", CreationStep.EQUIPMENT);

    private final String key;
    private final CreationStep step;

    ChoiceName(String key, CreationStep step) {
        this.key = key;
        this.step = step;
    }

    public String getKey() {
        return key;
    }

    /**
     * Шаг, к которому привязан выбор; null - выбор допустим всегда
     */
    public CreationStep getStep() {
        return step;
    }

    public static String speciesTraitKey(String traitName) {
        return SPECIES_TRAIT.key + traitName;
    }

    public static String traitNameOf(String key) {
        return key.substring(SPECIES_TRAIT.key.length());
    }

    public static ChoiceName fromKey(String key) {
        if (key != null) {
            if (key.startsWith(SPECIES_TRAIT.key) && key.length() > SPECIES_TRAIT.key.length()) {
                return SPECIES_TRAIT;
            }
            for (ChoiceName name : ChoiceName.values()) {
                if (name != SPECIES_TRAIT && name.key.equals(key)) {
                    return name;
                }
            }
        }
        throw new UnknownReferenceException("choice", key, "Неизвестный выбор: " + key);
    }
}
