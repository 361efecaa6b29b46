package com.dndforge.creation;

import static org.assertj.core.api.Assertions.assertThat;

import com.dndforge.game_rules.CatalogFixtures;
import com.dndforge.game_state.CharacterRecord;
import com.dndforge.game_state.CreationStep;
import com.google.gson.JsonParser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class StepGraphTest {

    private final StepGraph graph = new StepGraph(CatalogFixtures.catalog());

    private static CharacterRecord record(String className, int level, String species) {
        CharacterRecord record = new CharacterRecord();
        record.setClassName(className);
        record.setLevel(level);
        record.setSpeciesName(species);
        return record;
    }

    @Test
    void classRoutesToSubclassOnlyFromUnlockLevel() {
        assertThat(graph.next(CreationStep.CLASS, record("Fighter", 3, null))).isEqualTo(CreationStep.SUBCLASS);
        assertThat(graph.next(CreationStep.CLASS, record("Fighter", 5, null))).isEqualTo(CreationStep.SUBCLASS);
        assertThat(graph.next(CreationStep.CLASS, record("Fighter", 2, null))).isEqualTo(CreationStep.CLASS_CHOICES);
        assertThat(graph.next(CreationStep.SUBCLASS, record("Fighter", 5, null))).isEqualTo(CreationStep.CLASS_CHOICES);
    }

    @Test
    void classWithoutSubclassDocumentsSkipsSubclassStep() {
        assertThat(graph.needsSubclass(record("Rogue", 3, null))).isFalse();
        assertThat(graph.next(CreationStep.CLASS, record("Rogue", 3, null))).isEqualTo(CreationStep.CLASS_CHOICES);
        assertThat(graph.next(CreationStep.CLASS, record("Rogue", 12, null))).isEqualTo(CreationStep.CLASS_CHOICES);
    }

    @Test
    void plainSpeciesGoesStraightToLanguages() {
        assertThat(graph.next(CreationStep.SPECIES, record("Fighter", 1, "Human"))).isEqualTo(CreationStep.LANGUAGES);
        assertThat(graph.next(CreationStep.SPECIES, record("Fighter", 1, "Dwarf"))).isEqualTo(CreationStep.LANGUAGES);
    }

    @Test
    void speciesWithChoiceTraitsAndLineagesVisitsBoth() {
        CharacterRecord elf = record("Fighter", 1, "Elf");

        assertThat(graph.next(CreationStep.SPECIES, elf)).isEqualTo(CreationStep.SPECIES_TRAITS);
        assertThat(graph.next(CreationStep.SPECIES_TRAITS, elf)).isEqualTo(CreationStep.LINEAGE);
        assertThat(graph.next(CreationStep.LINEAGE, elf)).isEqualTo(CreationStep.LANGUAGES);
    }

    @Test
    void tailOfGraphIsFixed() {
        CharacterRecord record = record("Fighter", 1, "Human");

        assertThat(graph.next(CreationStep.CLASS_CHOICES, record)).isEqualTo(CreationStep.BACKGROUND);
        assertThat(graph.next(CreationStep.BACKGROUND, record)).isEqualTo(CreationStep.SPECIES);
        assertThat(graph.next(CreationStep.LANGUAGES, record)).isEqualTo(CreationStep.ABILITY_SCORES);
        assertThat(graph.next(CreationStep.ABILITY_SCORES, record)).isEqualTo(CreationStep.BACKGROUND_BONUSES);
        assertThat(graph.next(CreationStep.BACKGROUND_BONUSES, record)).isEqualTo(CreationStep.EQUIPMENT);
        assertThat(graph.next(CreationStep.EQUIPMENT, record)).isEqualTo(CreationStep.COMPLETE);
        assertThat(graph.next(CreationStep.COMPLETE, record)).isEqualTo(CreationStep.COMPLETE);
    }

    @Test
    void speciesTraitsSatisfiedWhenEveryChoiceTraitIsChosen() {
        CharacterRecord elf = record("Fighter", 1, "Elf");
        assertThat(graph.isSatisfied(CreationStep.SPECIES_TRAITS, elf)).isFalse();

        elf.getTraitChoices().put("Keen Senses", "Perception");
        assertThat(graph.isSatisfied(CreationStep.SPECIES_TRAITS, elf)).isTrue();
    }

    @Test
    void completeIsNeverSatisfied() {
        assertThat(graph.isSatisfied(CreationStep.COMPLETE, record("Fighter", 1, "Human"))).isFalse();
    }

    @Test
    void resumeIsTheFirstUnsatisfiedStep() {
        CharacterRecord record = new CharacterRecord();
        assertThat(graph.resume(record)).isEqualTo(CreationStep.CLASS);
        assertThat(graph.visited(record)).containsExactly(CreationStep.CLASS);

        record.setClassName("Fighter");
        record.setLevel(5);
        assertThat(graph.resume(record)).isEqualTo(CreationStep.SUBCLASS);

        record.setSubclassName("Champion");
        record.recordChoice("class_choices", JsonParser.parseString("{}"));
        record.setBackgroundName("Soldier");
        assertThat(graph.visited(record)).containsExactly(
            CreationStep.CLASS, CreationStep.SUBCLASS, CreationStep.CLASS_CHOICES, CreationStep.BACKGROUND,
            CreationStep.SPECIES);
    }

    @Test
    void lowerLevelRemovesSubclassFromThePath() {
        CharacterRecord record = record("Fighter", 2, null);
        record.recordChoice("class_choices", JsonParser.parseString("{}"));

        assertThat(graph.visited(record)).containsExactly(
            CreationStep.CLASS, CreationStep.CLASS_CHOICES, CreationStep.BACKGROUND);
    }
}
