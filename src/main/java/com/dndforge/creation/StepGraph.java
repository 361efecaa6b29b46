package com.dndforge.creation;

import com.dndforge.game_rules.ContentCatalog;
import com.dndforge.game_rules.RuleDocument;
import com.dndforge.game_state.CharacterRecord;
import com.dndforge.game_state.CreationStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Граф шагов создания персонажа.
 * <p>
 * class → (subclass) → class_choices → background → species → (species_traits) →
 * (lineage) → languages → ability_scores → background_bonuses → equipment → complete.
 * Текущий шаг - первый невыполненный шаг на пути от class, поэтому он целиком выводится из записи.
 */
public class StepGraph {
    private final ContentCatalog catalog;

    public StepGraph(ContentCatalog catalog) {
        this.catalog = catalog;
    }

    public CreationStep next(CreationStep current, CharacterRecord record) {
        switch (current) {
            case CLASS:
                return needsSubclass(record) ? CreationStep.SUBCLASS : CreationStep.CLASS_CHOICES;
            case SUBCLASS:
                return CreationStep.CLASS_CHOICES;
            case CLASS_CHOICES:
                return CreationStep.BACKGROUND;
            case BACKGROUND:
                return CreationStep.SPECIES;
            case SPECIES:
                if (hasChoiceTraits(record)) {
                    return CreationStep.SPECIES_TRAITS;
                }
                return hasLineages(record) ? CreationStep.LINEAGE : CreationStep.LANGUAGES;
            case SPECIES_TRAITS:
                return hasLineages(record) ? CreationStep.LINEAGE : CreationStep.LANGUAGES;
            case LINEAGE:
                return CreationStep.LANGUAGES;
            case LANGUAGES:
                return CreationStep.ABILITY_SCORES;
            case ABILITY_SCORES:
                return CreationStep.BACKGROUND_BONUSES;
            case BACKGROUND_BONUSES:
                return CreationStep.EQUIPMENT;
            case EQUIPMENT:
            case COMPLETE:
            default:
                return CreationStep.COMPLETE;
        }
    }

    /**
     * Первый невыполненный шаг на пути от начала графа
     */
    public CreationStep resume(CharacterRecord record) {
        List<CreationStep> path = visited(record);
        return path.get(path.size() - 1);
    }

    /**
     * Шаги, пройденные записью: выполненные шаги пути и текущий шаг последним
     */
    public List<CreationStep> visited(CharacterRecord record) {
        List<CreationStep> path = new ArrayList<>();
        CreationStep step = CreationStep.CLASS;
        path.add(step);
        while (step != CreationStep.COMPLETE && isSatisfied(step, record)) {
            step = next(step, record);
            path.add(step);
        }
        return path;
    }

    /**
     * Выполнено ли все, что требует шаг, чтобы перейти к следующему
     */
    public boolean isSatisfied(CreationStep step, CharacterRecord record) {
        switch (step) {
            case CLASS:
                return record.getClassName() != null;
            case SUBCLASS:
                return record.getSubclassName() != null;
            case CLASS_CHOICES:
                return record.hasChoice(ChoiceName.CLASS_CHOICES.getKey());
            case BACKGROUND:
                return record.getBackgroundName() != null;
            case SPECIES:
                return record.getSpeciesName() != null;
            case SPECIES_TRAITS:
                return species(record)
                    .map(doc -> record.getTraitChoices().keySet().containsAll(doc.getChoiceTraits().keySet()))
                    .orElse(false);
            case LINEAGE:
                return record.getLineageName() != null;
            case LANGUAGES:
                return record.hasChoice(ChoiceName.LANGUAGES.getKey());
            case ABILITY_SCORES:
                return record.getAbilityScores().isComplete();
            case BACKGROUND_BONUSES:
                return record.hasChoice(ChoiceName.BACKGROUND_BONUSES.getKey());
            case EQUIPMENT:
                return record.hasChoice(ChoiceName.EQUIPMENT_SELECTIONS.getKey());
            case COMPLETE:
            default:
                return false;
        }
    }

    /**
     * Подкласс выбирается с уровня открытия, если в каталоге есть подклассы этого класса
     */
    public boolean needsSubclass(CharacterRecord record) {
        return catalog.findClass(record.getClassName())
            .map(doc -> record.getLevel() >= doc.getSubclassUnlockLevel()
                && !catalog.getSubclassesForClass(doc.getName()).isEmpty())
            .orElse(false);
    }

    public boolean hasChoiceTraits(CharacterRecord record) {
        return species(record).map(doc -> !doc.getChoiceTraits().isEmpty()).orElse(false);
    }

    public boolean hasLineages(CharacterRecord record) {
        return species(record).map(doc -> !doc.getLineages().isEmpty()).orElse(false);
    }

    private Optional<RuleDocument> species(CharacterRecord record) {
        return catalog.findSpecies(record.getSpeciesName());
    }
}
