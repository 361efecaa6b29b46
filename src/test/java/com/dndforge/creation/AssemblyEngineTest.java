package com.dndforge.creation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.dndforge.game_rules.CatalogFixtures;
import com.dndforge.game_rules.ContentCatalog;
import com.dndforge.game_state.Ability;
import com.dndforge.game_state.CharacterRecord;
import com.dndforge.game_state.CreationStep;
import com.dndforge.game_state.FeatureCategory;
import com.dndforge.game_state.FeatureRecord;
import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class AssemblyEngineTest {

    private final ContentCatalog catalog = CatalogFixtures.catalog();

    private AssemblyEngine completedFighter() {
        AssemblyEngine engine = new AssemblyEngine(catalog);
        engine.setName("Valeria");
        engine.setAlignment("Neutral Good");
        engine.setLevel(5);
        engine.selectClass("Fighter");
        engine.selectSubclass("Champion");
        engine.applyClassChoices(List.of("Perception", "Survival"), Map.of("Fighting Style", "Defense"));
        engine.selectBackground("Soldier");
        engine.selectSpecies("Human");
        engine.chooseLanguages(List.of());
        engine.useRecommendedAbilityScores();
        engine.useSuggestedBackgroundBonuses();
        engine.selectEquipment(Map.of("class_equipment", "A", "background_equipment", "B"));
        return engine;
    }

    private AssemblyEngine completedElfCleric() {
        AssemblyEngine engine = new AssemblyEngine(catalog);
        engine.setLevel(3);
        engine.selectClass("Cleric");
        engine.selectSubclass("Life Domain");
        engine.applyClassChoices(List.of("Medicine", "Religion"), Map.of("Divine Order", "Thaumaturge"));
        engine.selectBackground("Sage");
        engine.selectSpecies("Elf");
        engine.chooseSpeciesTrait("Keen Senses", "Insight");
        engine.selectLineage("Wood Elf");
        engine.chooseLanguages(List.of("Sylvan"));
        engine.assignAbilityScores(Map.of(
            Ability.STRENGTH, 10, Ability.DEXTERITY, 12, Ability.CONSTITUTION, 14,
            Ability.INTELLIGENCE, 8, Ability.WISDOM, 15, Ability.CHARISMA, 13));
        engine.assignBackgroundBonuses(Map.of(Ability.WISDOM, 2, Ability.CONSTITUTION, 1));
        engine.selectEquipment(Map.of("class_equipment", "A"));
        return engine;
    }

    @Test
    void fighterAtLevelFiveWalksTheWholeGraph() {
        AssemblyEngine engine = new AssemblyEngine(catalog);
        assertThat(engine.currentStep()).isEqualTo(CreationStep.CLASS);

        engine.setLevel(5);
        engine.selectClass("Fighter");
        assertThat(engine.currentStep()).isEqualTo(CreationStep.SUBCLASS);
        assertThat(engine.getAvailableSubclasses()).containsExactly("Battle Master", "Champion");

        engine.selectSubclass("Champion");
        assertThat(engine.currentStep()).isEqualTo(CreationStep.CLASS_CHOICES);

        engine.applyClassChoices(List.of("Perception"), Map.of("Fighting Style", "Archery"));
        engine.selectBackground("Soldier");
        engine.selectSpecies("Human");
        assertThat(engine.currentStep()).isEqualTo(CreationStep.LANGUAGES);

        engine.chooseLanguages(List.of());
        assertThat(engine.getRecord().getLanguages()).containsExactly("Common");

        engine.useRecommendedAbilityScores();
        Map<Ability, Integer> expected = CreationOptions.toAbilityMap(
            catalog.findClass("Fighter").orElseThrow().getStandardArrayAssignment());
        assertThat(engine.getRecord().getAbilityScores().asMap()).isEqualTo(expected);
        assertThat(engine.currentStep()).isEqualTo(CreationStep.BACKGROUND_BONUSES);

        engine.useSuggestedBackgroundBonuses();
        engine.selectEquipment(Map.of("class_equipment", "C"));
        assertThat(engine.isComplete()).isTrue();
    }

    @Test
    void lowLevelClassSkipsSubclass() {
        AssemblyEngine engine = new AssemblyEngine(catalog);

        engine.selectClass("Fighter");

        assertThat(engine.currentStep()).isEqualTo(CreationStep.CLASS_CHOICES);
        assertThatThrownBy(() -> engine.selectSubclass("Champion")).isInstanceOf(StepSequenceException.class);
    }

    @Test
    void elfVisitsTraitsAndLineageSteps() {
        AssemblyEngine engine = new AssemblyEngine(catalog);
        engine.selectClass("Cleric");
        engine.applyClassChoices(List.of(), Map.of());
        engine.selectBackground("Acolyte");
        engine.selectSpecies("Elf");

        assertThat(engine.currentStep()).isEqualTo(CreationStep.SPECIES_TRAITS);
        assertThat(engine.getSpeciesTraitChoices()).containsOnlyKeys("Keen Senses");

        engine.chooseSpeciesTrait("Keen Senses", "Survival");
        assertThat(engine.currentStep()).isEqualTo(CreationStep.LINEAGE);

        engine.selectLineage("High Elf");
        assertThat(engine.currentStep()).isEqualTo(CreationStep.LANGUAGES);
        assertThat(engine.getLanguageOptions().getAllowance()).isEqualTo(2);
    }

    @Test
    void rejectedChoiceDoesNotAdvance() {
        AssemblyEngine engine = new AssemblyEngine(catalog);
        engine.selectClass("Fighter");
        engine.applyClassChoices(List.of(), Map.of());
        engine.selectBackground("Soldier");
        engine.selectSpecies("Human");
        engine.chooseLanguages(List.of());
        engine.useRecommendedAbilityScores();

        CharacterRecord before = snapshot(engine);
        assertThatThrownBy(() -> engine.assignBackgroundBonuses(Map.of(Ability.STRENGTH, 4)))
            .isInstanceOf(RuleConstraintException.class);

        assertThat(engine.currentStep()).isEqualTo(CreationStep.BACKGROUND_BONUSES);
        assertThat(engine.getRecord()).isEqualTo(before);
    }

    @Test
    void replayingTheLogReproducesTheRecord() {
        for (AssemblyEngine engine : List.of(completedFighter(), completedElfCleric())) {
            CharacterRecord original = engine.getRecord();

            AssemblyEngine replayed = AssemblyEngine.replay(catalog, original.getChoicesMade());

            assertThat(replayed.getRecord()).isEqualTo(original);
            assertThat(replayed.isComplete()).isTrue();
        }
    }

    @Test
    void replayOfPartialLogStopsAtTheSameStep() {
        AssemblyEngine engine = new AssemblyEngine(catalog);
        engine.setLevel(4);
        engine.selectClass("Fighter");
        engine.selectSubclass("Battle Master");

        AssemblyEngine replayed = AssemblyEngine.replay(catalog, engine.getRecord().getChoicesMade());

        assertThat(replayed.currentStep()).isEqualTo(CreationStep.CLASS_CHOICES);
        assertThat(replayed.getRecord()).isEqualTo(engine.getRecord());
    }

    @Test
    void serializeThenDeserializeIsIdentity() {
        AssemblyEngine engine = completedElfCleric();

        AssemblyEngine restored = AssemblyEngine.deserialize(catalog, engine.serialize());

        assertThat(restored.getRecord()).isEqualTo(engine.getRecord());
        assertThat(restored.currentStep()).isEqualTo(CreationStep.COMPLETE);
    }

    @Test
    void batchAppliesInStepOrderAndCollectsFailures() {
        Map<String, JsonElement> choices = new LinkedHashMap<>();
        choices.put("languages", JsonParser.parseString("[]"));
        choices.put("species", new JsonPrimitive("Human"));
        choices.put("class", new JsonPrimitive("Fighter"));
        choices.put("background", new JsonPrimitive("Noble"));
        choices.put("class_choices", JsonParser.parseString("{\"skills\":[\"Athletics\"]}"));
        choices.put("name", new JsonPrimitive("Bran"));
        choices.put("mood", new JsonPrimitive("grim"));

        AssemblyEngine engine = new AssemblyEngine(catalog);
        BatchResult result = engine.applyAll(choices);

        assertThat(result.getApplied()).containsExactly("name", "class", "class_choices", "species", "languages");
        assertThat(result.getFailures()).containsOnlyKeys("mood", "background");
        assertThat(result.getFailures().get("mood")).isInstanceOf(UnknownReferenceException.class);
        assertThat(result.getFailures().get("background")).isInstanceOf(UnknownReferenceException.class);
        assertThat(engine.currentStep()).isEqualTo(CreationStep.BACKGROUND);
        assertThat(engine.getRecord().getName()).isEqualTo("Bran");
        assertThat(engine.getRecord().getSpeciesName()).isEqualTo("Human");
    }

    @Test
    void batchFailureOfOneKeyDoesNotCascade() {
        Map<String, JsonElement> choices = new LinkedHashMap<>();
        choices.put("level", new JsonPrimitive(5));
        choices.put("class", new JsonPrimitive("Fighter"));
        choices.put("subclass", new JsonPrimitive("Bogus"));
        choices.put("class_choices", JsonParser.parseString("{}"));
        choices.put("background", new JsonPrimitive("Soldier"));
        choices.put("species", new JsonPrimitive("Human"));
        choices.put("languages", JsonParser.parseString("[]"));

        AssemblyEngine engine = new AssemblyEngine(catalog);
        BatchResult result = engine.applyAll(choices);

        assertThat(result.getFailures()).containsOnlyKeys("subclass");
        assertThat(result.getFailures().get("subclass")).isInstanceOf(UnknownReferenceException.class);
        assertThat(result.getApplied())
            .containsExactly("level", "class", "class_choices", "background", "species", "languages");
        assertThat(engine.getRecord().getBackgroundName()).isEqualTo("Soldier");
        assertThat(engine.getRecord().getLanguages()).containsExactly("Common");
        assertThat(engine.currentStep()).isEqualTo(CreationStep.SUBCLASS);

        engine.selectSubclass("Champion");
        assertThat(engine.currentStep()).isEqualTo(CreationStep.ABILITY_SCORES);
    }

    @Test
    void failedBatchKeyKeepsItsPreviousValue() {
        AssemblyEngine engine = completedFighter();
        CharacterRecord before = snapshot(engine);

        Map<String, JsonElement> choices = new LinkedHashMap<>();
        choices.put("background", new JsonPrimitive("Noble"));
        choices.put("name", new JsonPrimitive("Bran"));
        BatchResult result = engine.applyAll(choices);

        assertThat(result.getApplied()).containsExactly("name");
        assertThat(result.getFailures()).containsOnlyKeys("background");
        assertThat(engine.getRecord().getBackgroundName()).isEqualTo("Soldier");
        assertThat(engine.getRecord().getBackgroundBonuses()).isEqualTo(before.getBackgroundBonuses());
        assertThat(engine.getRecord().getEquipmentSelections()).isEqualTo(before.getEquipmentSelections());
        assertThat(engine.getRecord().getName()).isEqualTo("Bran");
        assertThat(engine.isComplete()).isTrue();
    }

    // Повторный выбор

    @Test
    void abilityScoreStrategyCanBeSwitchedAfterTheStepIsPassed() {
        AssemblyEngine engine = completedFighter();
        Map<Ability, Integer> manual = Map.of(
            Ability.STRENGTH, 8, Ability.DEXTERITY, 15, Ability.CONSTITUTION, 14,
            Ability.INTELLIGENCE, 13, Ability.WISDOM, 12, Ability.CHARISMA, 10);

        engine.assignAbilityScores(manual);

        assertThat(engine.getRecord().getAbilityScores().asMap()).isEqualTo(manual);
        assertThat(engine.getRecord().getChoicesMade().get("ability_scores").getAsJsonObject().get("method").getAsString())
            .isEqualTo("manual");
        assertThat(engine.isComplete()).isTrue();

        engine.useRecommendedAbilityScores();
        assertThat(engine.getRecord().getAbilityScores().getScore(Ability.STRENGTH)).isEqualTo(15);
        assertThat(engine.getRecord().getChoicesMade().get("ability_scores"))
            .isEqualTo(JsonParser.parseString("{\"method\":\"recommended\"}"));
        assertThat(AssemblyEngine.replay(catalog, engine.getRecord().getChoicesMade()).getRecord())
            .isEqualTo(engine.getRecord());
    }

    @Test
    void recommendedScoresCanBeReplacedRightAfterAutoAdvance() {
        AssemblyEngine engine = new AssemblyEngine(catalog);
        engine.selectClass("Fighter");
        engine.applyClassChoices(List.of(), Map.of());
        engine.selectBackground("Soldier");
        engine.selectSpecies("Human");
        engine.chooseLanguages(List.of());
        engine.useRecommendedAbilityScores();
        assertThat(engine.currentStep()).isEqualTo(CreationStep.BACKGROUND_BONUSES);

        engine.assignAbilityScores(Map.of(
            Ability.STRENGTH, 12, Ability.DEXTERITY, 15, Ability.CONSTITUTION, 14,
            Ability.INTELLIGENCE, 8, Ability.WISDOM, 13, Ability.CHARISMA, 10));

        assertThat(engine.getRecord().getAbilityScores().getScore(Ability.DEXTERITY)).isEqualTo(15);
        assertThat(engine.currentStep()).isEqualTo(CreationStep.BACKGROUND_BONUSES);
    }

    @Test
    void backgroundBonusStrategyCanBeSwitchedAndOverBudgetKeepsPrior() {
        AssemblyEngine engine = completedFighter();

        engine.assignBackgroundBonuses(Map.of(Ability.DEXTERITY, 2, Ability.CONSTITUTION, 1));
        assertThat(engine.getRecord().getBackgroundBonuses())
            .containsOnly(Map.entry(Ability.DEXTERITY, 2), Map.entry(Ability.CONSTITUTION, 1));

        assertThatThrownBy(() -> engine.assignBackgroundBonuses(Map.of(Ability.STRENGTH, 2, Ability.DEXTERITY, 2)))
            .isInstanceOf(RuleConstraintException.class);
        assertThat(engine.getRecord().getBackgroundBonuses())
            .containsOnly(Map.entry(Ability.DEXTERITY, 2), Map.entry(Ability.CONSTITUTION, 1));

        engine.useSuggestedBackgroundBonuses();
        assertThat(engine.getRecord().getBackgroundBonuses())
            .containsOnly(Map.entry(Ability.STRENGTH, 2), Map.entry(Ability.CONSTITUTION, 1));
        assertThat(engine.isComplete()).isTrue();
    }

    @Test
    void switchingClassLeavesNoTraceOfThePreviousOne() {
        AssemblyEngine engine = new AssemblyEngine(catalog);
        engine.setLevel(3);
        engine.selectClass("Fighter");
        engine.selectSubclass("Champion");
        engine.applyClassChoices(List.of("Athletics", "Perception"), Map.of("Fighting Style", "Blind Fighting"));
        engine.selectBackground("Soldier");
        engine.selectSpecies("Human");
        engine.chooseLanguages(List.of());

        engine.selectClass("Cleric");

        CharacterRecord record = engine.getRecord();
        assertThat(record.getClassName()).isEqualTo("Cleric");
        assertThat(record.getSubclassName()).isNull();
        assertThat(record.getProficiencies().getSavingThrows()).containsExactly("Charisma", "Wisdom");
        assertThat(record.getProficiencies().getWeapons()).containsExactly("Simple");
        assertThat(record.getProficiencies().getSkills()).containsExactly("Athletics", "Intimidation");
        assertThat(record.getDarkvision()).isZero();
        assertThat(record.getFeatures(FeatureCategory.CLASS)).extracting(FeatureRecord::getName)
            .doesNotContain("Second Wind", "Action Surge");
        assertThat(record.getFeatures(FeatureCategory.SUBCLASS)).isEmpty();
        assertThat(record.getChoicesMade()).doesNotContainKeys("subclass", "class_choices");
        assertThat(engine.currentStep()).isEqualTo(CreationStep.SUBCLASS);

        Map<String, JsonElement> freshCleric = new LinkedHashMap<>();
        freshCleric.put("level", new JsonPrimitive(3));
        freshCleric.put("class", new JsonPrimitive("Cleric"));
        freshCleric.put("background", new JsonPrimitive("Soldier"));
        freshCleric.put("species", new JsonPrimitive("Human"));
        freshCleric.put("languages", JsonParser.parseString("[]"));
        assertThat(AssemblyEngine.replay(catalog, freshCleric).getRecord()).isEqualTo(record);
    }

    @Test
    void switchingBackgroundReplacesItsGrants() {
        AssemblyEngine engine = completedFighter();

        engine.selectBackground("Sage");

        CharacterRecord record = engine.getRecord();
        assertThat(record.getProficiencies().getTools()).containsExactly("Calligrapher's Supplies");
        assertThat(record.getProficiencies().getSkills()).contains("Arcana", "History").doesNotContain("Intimidation");
        assertThat(record.getFeatures(FeatureCategory.BACKGROUND)).isEmpty();
        assertThat(record.getFeatures(FeatureCategory.FEAT)).extracting(FeatureRecord::getName)
            .doesNotContain("Savage Attacker");
        assertThat(record.getBackgroundBonuses()).containsEntry(Ability.INTELLIGENCE, 2).doesNotContainKey(Ability.STRENGTH);
        assertThat(engine.isComplete()).isTrue();
        assertThat(AssemblyEngine.replay(catalog, record.getChoicesMade()).getRecord()).isEqualTo(record);
    }

    @Test
    void switchingSpeciesDropsTraitAndLineageChoices() {
        AssemblyEngine engine = completedElfCleric();

        engine.selectSpecies("Human");

        CharacterRecord record = engine.getRecord();
        assertThat(record.getSpeed()).isEqualTo(30);
        assertThat(record.getDarkvision()).isZero();
        assertThat(record.getLineageName()).isNull();
        assertThat(record.getTraitChoices()).isEmpty();
        assertThat(record.getAlwaysPrepared()).isEmpty();
        assertThat(record.getProficiencies().getSkills()).doesNotContain("Insight", "Nature");
        assertThat(record.getFeatures(FeatureCategory.LINEAGE)).isEmpty();
        assertThat(record.getChoicesMade()).doesNotContainKeys("species_trait:Keen Senses", "lineage");
        assertThat(record.getLanguages()).contains("Sylvan");
        assertThat(engine.isComplete()).isTrue();
    }

    @Test
    void raisingLevelPastUnlockReopensSubclassStep() {
        AssemblyEngine engine = new AssemblyEngine(catalog);
        engine.setLevel(2);
        engine.selectClass("Fighter");
        engine.applyClassChoices(List.of("Perception"), Map.of("Fighting Style", "Defense"));
        engine.selectBackground("Soldier");
        engine.selectSpecies("Human");
        engine.chooseLanguages(List.of());
        engine.useRecommendedAbilityScores();
        engine.useSuggestedBackgroundBonuses();
        engine.selectEquipment(Map.of("class_equipment", "A"));
        assertThat(engine.isComplete()).isTrue();

        engine.setLevel(5);

        assertThat(engine.currentStep()).isEqualTo(CreationStep.SUBCLASS);
        assertThat(engine.getRecord().getBackgroundName()).isEqualTo("Soldier");
        assertThat(engine.getRecord().getFeatures(FeatureCategory.CLASS)).extracting(FeatureRecord::getName)
            .contains("Extra Attack");

        engine.selectSubclass("Champion");
        assertThat(engine.isComplete()).isTrue();
    }

    @Test
    void loweringLevelDropsChoicesThatNoLongerFit() {
        AssemblyEngine engine = completedFighter();
        engine.selectWeaponMasteries(List.of("Greatsword", "Longbow", "Longsword", "Shortsword"));

        engine.setLevel(2);

        CharacterRecord record = engine.getRecord();
        assertThat(record.getSubclassName()).isNull();
        assertThat(record.getFeatures(FeatureCategory.SUBCLASS)).isEmpty();
        assertThat(record.getFeatures(FeatureCategory.CLASS)).extracting(FeatureRecord::getName)
            .doesNotContain("Extra Attack");
        assertThat(record.getWeaponMasteries()).isEmpty();
        assertThat(record.getChoicesMade()).doesNotContainKeys("subclass", "weapon_mastery_selections");
        assertThat(engine.isComplete()).isTrue();
    }

    @Test
    void choiceForAStepNotYetReachedIsRejected() {
        AssemblyEngine engine = new AssemblyEngine(catalog);
        engine.selectClass("Fighter");

        assertThatThrownBy(() -> engine.selectBackground("Soldier"))
            .isInstanceOf(StepSequenceException.class)
            .extracting("currentStep").isEqualTo(CreationStep.CLASS_CHOICES);
        assertThatThrownBy(() -> engine.selectWeaponMasteries(List.of("Longsword")))
            .isInstanceOf(StepSequenceException.class);
        assertThat(engine.getRecord().getChoicesMade()).containsOnlyKeys("class");
    }

    // Заклинания и приемы оружия

    @Test
    void spellAndMasterySelectionsReplayLikeAnyOtherChoice() {
        AssemblyEngine cleric = completedElfCleric();
        assertThat(cleric.getSpellOptions().getCantripLimit()).isEqualTo(3);
        assertThat(cleric.getSpellOptions().getBonusCantrips()).isEqualTo(1);

        assertThatThrownBy(() -> cleric.selectSpells(List.of("Druidcraft"), List.of(), List.of()))
            .isInstanceOf(RuleConstraintException.class);
        cleric.selectSpells(List.of("Guidance", "Light", "Thaumaturgy"), List.of("Bless"), List.of("Mending"));

        AssemblyEngine fighter = completedFighter();
        fighter.selectWeaponMasteries(List.of("Longsword", "Javelin"));
        assertThat(fighter.getWeaponMasteryOptions().getSelected()).containsExactly("Javelin", "Longsword");
        assertThat(fighter.getWeaponMasteryOptions().getLimit()).isEqualTo(4);

        for (AssemblyEngine engine : List.of(cleric, fighter)) {
            AssemblyEngine replayed = AssemblyEngine.replay(catalog, engine.getRecord().getChoicesMade());
            assertThat(replayed.getRecord()).isEqualTo(engine.getRecord());
            assertThat(replayed.isComplete()).isTrue();
        }
        assertThat(cleric.getRecord().getPreparedSpells()).containsExactly("Bless");
    }

    @Test
    void reapplyingChoiceOverwritesOnlyItsKey() {
        AssemblyEngine engine = new AssemblyEngine(catalog);
        engine.setName("First");
        engine.setLevel(2);
        engine.setLevel(3);
        engine.setName("Second");

        assertThat(engine.getRecord().getChoicesMade()).containsOnlyKeys("name", "level");
        assertThat(engine.getRecord().getChoicesMade().get("level").getAsInt()).isEqualTo(3);
        assertThat(engine.getRecord().getName()).isEqualTo("Second");
    }

    @Test
    void publicViewResolvesFeatureTextAtRecordLevel() {
        CharacterView view = completedFighter().toPublicView();

        assertThat(view.getProficiencyBonus()).isEqualTo(3);
        assertThat(view.getAbilityScores()).containsEntry(Ability.STRENGTH, 17).containsEntry(Ability.CONSTITUTION, 15);
        assertThat(view.getAbilityModifiers()).containsEntry(Ability.STRENGTH, 3).containsEntry(Ability.INTELLIGENCE, -1);
        assertThat(view.getFeatures().get(FeatureCategory.CLASS))
            .filteredOn(feature -> feature.getName().equals("Second Wind"))
            .singleElement()
            .extracting(CharacterView.Feature::getDescription)
            .isEqualTo("You can use Second Wind 3 times per Long Rest.");
        assertThat(view.getFeatures().get(FeatureCategory.CLASS))
            .extracting(CharacterView.Feature::getName)
            .contains("Fighting Style: Defense");
        assertThat(view.getStep()).isEqualTo("complete");
    }

    @Test
    void publicViewShowsGrantedSpellsAndSkillBonuses() {
        CharacterView view = completedElfCleric().toPublicView();

        assertThat(view.getAlwaysPrepared()).containsOnlyKeys("Druidcraft", "Longstrider");
        assertThat(view.getAlwaysPrepared().get("Longstrider").isOncePerDay()).isTrue();
        assertThat(view.getSkillBonuses()).containsEntry("Arcana", 3).containsEntry("Religion", 3);
    }

    @Test
    void readHelpersRequireTheirPrerequisites() {
        AssemblyEngine engine = new AssemblyEngine(catalog);

        assertThatThrownBy(engine::getAbilityScoreRecommendation).isInstanceOf(StepSequenceException.class);
        assertThatThrownBy(engine::getBackgroundBonusOptions).isInstanceOf(StepSequenceException.class);
        assertThatThrownBy(engine::getLanguageOptions).isInstanceOf(StepSequenceException.class);

        engine.setLevel(5);
        engine.selectClass("Fighter");
        CreationOptions.ClassFeatureListing listing = engine.getClassFeatures();
        assertThat(listing.getFeaturesByLevel().keySet()).containsExactly(1, 2, 5);
        assertThat(listing.getSkillChoice().getCount()).isEqualTo(2);
        assertThat(listing.getChoices()).extracting(CreationOptions.FeatureChoice::getName)
            .containsExactly("Skill Proficiencies", "Fighting Style");
        assertThat(engine.getAbilityScoreRecommendation().getStandardArray()).containsExactly(15, 14, 13, 12, 10, 8);
    }

    @Test
    void resetStartsOver() {
        AssemblyEngine engine = completedFighter();

        engine.reset();

        assertThat(engine.currentStep()).isEqualTo(CreationStep.CLASS);
        assertThat(engine.getRecord()).isEqualTo(new CharacterRecord());
    }

    private static CharacterRecord snapshot(AssemblyEngine engine) {
        CharacterRecordCodec codec = new CharacterRecordCodec();
        return codec.fromJson(codec.toJson(engine.getRecord()));
    }
}
