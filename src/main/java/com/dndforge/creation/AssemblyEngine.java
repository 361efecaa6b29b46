package com.dndforge.creation;

import com.dndforge.game_rules.ContentCatalog;
import com.dndforge.game_rules.ScalingResolver;
import com.dndforge.game_state.Ability;
import com.dndforge.game_state.CharacterRecord;
import com.dndforge.game_state.CreationStep;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Consumer;

/**
 * Сессия создания одного персонажа.
 * <p>
 * Владеет записью персонажа и применяет выборы через ChoiceApplicator. Запись после каждого
 * выбора собирается из журнала выборов, а текущий шаг - первый невыполненный шаг графа.
 * Не потокобезопасен: одна сессия - один владелец.
 */
public class AssemblyEngine {
    private static final Logger log = LoggerFactory.getLogger(AssemblyEngine.class);

    private final ContentCatalog catalog;
    private final ScalingResolver resolver;
    private final StepGraph graph;
    private final CreationOptions options;
    private final ChoiceApplicator applicator;
    private final CharacterRecordCodec codec = new CharacterRecordCodec();
    private final String baseLanguage;
    private CharacterRecord record;

    public AssemblyEngine(ContentCatalog catalog) {
        this(catalog, new ScalingResolver(), CharacterRecord.DEFAULT_BASE_LANGUAGE);
    }

    public AssemblyEngine(ContentCatalog catalog, ScalingResolver resolver, String baseLanguage) {
        this.catalog = catalog;
        this.resolver = resolver;
        this.baseLanguage = baseLanguage;
        this.graph = new StepGraph(catalog);
        this.options = new CreationOptions(catalog, resolver);
        this.applicator = new ChoiceApplicator(catalog, options);
        this.record = new CharacterRecord(baseLanguage);
    }

    /**
     * Восстанавливает сессию из журнала выборов
     */
    public static AssemblyEngine replay(ContentCatalog catalog, ScalingResolver resolver, String baseLanguage,
                                        Map<String, JsonElement> choices) {
        AssemblyEngine engine = new AssemblyEngine(catalog, resolver, baseLanguage);
        BatchResult result = engine.applyAll(choices);
        if (!result.isSuccessful()) {
            log.warn("Replay skipped {} choices: {}", result.getFailures().size(), result.getFailures().keySet());
        }
        return engine;
    }

    public static AssemblyEngine replay(ContentCatalog catalog, Map<String, JsonElement> choices) {
        return replay(catalog, new ScalingResolver(), CharacterRecord.DEFAULT_BASE_LANGUAGE, choices);
    }

    /**
     * Восстанавливает сессию из сериализованной записи
     */
    public static AssemblyEngine deserialize(ContentCatalog catalog, ScalingResolver resolver, JsonElement json) {
        return fromRecord(catalog, resolver, new CharacterRecordCodec().fromJson(json));
    }

    public static AssemblyEngine deserialize(ContentCatalog catalog, ScalingResolver resolver, String json) {
        return fromRecord(catalog, resolver, new CharacterRecordCodec().fromJson(json));
    }

    private static AssemblyEngine fromRecord(ContentCatalog catalog, ScalingResolver resolver, CharacterRecord restored) {
        AssemblyEngine engine = new AssemblyEngine(catalog, resolver, restored.getBaseLanguage());
        engine.record = restored;
        return engine;
    }

    public static AssemblyEngine deserialize(ContentCatalog catalog, JsonElement json) {
        return deserialize(catalog, new ScalingResolver(), json);
    }

    public CreationStep currentStep() {
        return record.getStep();
    }

    public boolean isComplete() {
        return record.getStep() == CreationStep.COMPLETE;
    }

    /**
     * Применяет выбор по ключу журнала. При ошибке запись не меняется.
     */
    public CharacterRecord apply(String key, JsonElement value) {
        ChoiceName choice = ChoiceName.fromKey(key);
        return change(choice, key, target -> applicator.apply(target, key, value));
    }

    /**
     * Применяет набор выборов вместе с уже сделанными, в порядке шагов. Каждый выбор
     * проверяется отдельно: ошибочный не применяется и сохраняет прежнее значение,
     * остальные применяются.
     */
    public BatchResult applyAll(Map<String, JsonElement> choices) {
        Map<String, JsonElement> previous = record.getChoicesMade();
        Map<String, JsonElement> merged = new TreeMap<>(previous);
        merged.putAll(choices);

        CharacterRecord rebuilt = new CharacterRecord(record.getBaseLanguage());
        BatchResult outcome = replayInto(rebuilt, merged);

        Map<String, ChoiceValidationException> restored = new LinkedHashMap<>();
        for (String key : choices.keySet()) {
            ChoiceValidationException error = outcome.getFailures().get(key);
            if (error != null && previous.containsKey(key)) {
                merged.put(key, previous.get(key));
                restored.put(key, error);
            }
        }
        if (!restored.isEmpty()) {
            rebuilt = new CharacterRecord(record.getBaseLanguage());
            outcome = replayInto(rebuilt, merged);
        }
        record = rebuilt;

        BatchResult result = new BatchResult();
        for (String key : outcome.getApplied()) {
            if (choices.containsKey(key) && !restored.containsKey(key)) {
                result.markApplied(key);
            }
        }
        restored.forEach(result::markFailed);
        outcome.getFailures().forEach((key, error) -> {
            if (choices.containsKey(key)) {
                if (!restored.containsKey(key)) {
                    result.markFailed(key, error);
                }
            } else {
                log.info("Choice {} no longer applies and was dropped: {}", key, error.getMessage());
            }
        });
        log.debug("Batch applied: {}", result);
        return result;
    }

    /**
     * Выбор шага, который еще не достигнут, отклоняется. Выбор достигнутого шага проверяется
     * на копии записи, после чего запись собирается заново из обновленного журнала: так повторный
     * выбор не оставляет следов прежнего, а выборы, которые после него больше не проходят проверку,
     * удаляются из журнала.
     */
    private CharacterRecord change(ChoiceName choice, String key, Consumer<CharacterRecord> operation) {
        if (choice.getStep() == null) {
            operation.accept(record);
            return record;
        }
        List<CreationStep> visited = graph.visited(record);
        if (!visited.contains(choice.getStep())) {
            throw new StepSequenceException(key, record.getStep(),
                "Выбор " + key + " относится к шагу " + choice.getStep() + ", который еще не достигнут; текущий шаг "
                    + record.getStep());
        }

        CharacterRecord draft = codec.fromJson(codec.toJson(record));
        operation.accept(draft);

        CharacterRecord rebuilt = new CharacterRecord(record.getBaseLanguage());
        BatchResult result = replayInto(rebuilt, draft.getChoicesMade());
        ChoiceValidationException failure = result.getFailures().get(key);
        if (failure != null) {
            throw failure;
        }
        result.getFailures().forEach((dropped, error) ->
            log.info("Choice {} no longer applies after {} changed and was dropped: {}", dropped, key, error.getMessage()));

        CreationStep before = record.getStep();
        record = rebuilt;
        if (before != record.getStep()) {
            log.debug("Step {} -> {}", before, record.getStep());
        }
        return record;
    }

    /**
     * Применяет выборы к записи в порядке шагов, проверяя только правила содержимого,
     * и выставляет шаг записи по графу
     */
    private BatchResult replayInto(CharacterRecord target, Map<String, JsonElement> choices) {
        BatchResult result = new BatchResult();
        List<Map.Entry<ChoiceName, String>> ordered = new ArrayList<>();
        for (String key : choices.keySet()) {
            try {
                ordered.add(new AbstractMap.SimpleEntry<>(ChoiceName.fromKey(key), key));
            } catch (ChoiceValidationException e) {
                result.markFailed(key, e);
            }
        }
        ordered.sort(Comparator.<Map.Entry<ChoiceName, String>, ChoiceName>comparing(Map.Entry::getKey)
            .thenComparing(Map.Entry::getValue));

        for (Map.Entry<ChoiceName, String> entry : ordered) {
            try {
                applicator.apply(target, entry.getValue(), choices.get(entry.getValue()));
                result.markApplied(entry.getValue());
            } catch (ChoiceValidationException e) {
                result.markFailed(entry.getValue(), e);
            }
        }
        target.setStep(graph.resume(target));
        return result;
    }

    // Типизированные операции

    public CharacterRecord setName(String name) {
        return change(ChoiceName.NAME, ChoiceName.NAME.getKey(), target -> applicator.setName(target, name));
    }

    public CharacterRecord setAlignment(String alignment) {
        return change(ChoiceName.ALIGNMENT, ChoiceName.ALIGNMENT.getKey(),
            target -> applicator.setAlignment(target, alignment));
    }

    public CharacterRecord setLevel(int level) {
        return change(ChoiceName.LEVEL, ChoiceName.LEVEL.getKey(), target -> applicator.setLevel(target, level));
    }

    public CharacterRecord selectClass(String className) {
        return change(ChoiceName.CLASS, ChoiceName.CLASS.getKey(), target -> applicator.selectClass(target, className));
    }

    public CharacterRecord selectSubclass(String subclassName) {
        return change(ChoiceName.SUBCLASS, ChoiceName.SUBCLASS.getKey(),
            target -> applicator.selectSubclass(target, subclassName));
    }

    public CharacterRecord applyClassChoices(List<String> skills, Map<String, String> featureChoices) {
        return change(ChoiceName.CLASS_CHOICES, ChoiceName.CLASS_CHOICES.getKey(),
            target -> applicator.applyClassChoices(target, skills, featureChoices));
    }

    public CharacterRecord selectBackground(String backgroundName) {
        return change(ChoiceName.BACKGROUND, ChoiceName.BACKGROUND.getKey(),
            target -> applicator.selectBackground(target, backgroundName));
    }

    public CharacterRecord selectSpecies(String speciesName) {
        return change(ChoiceName.SPECIES, ChoiceName.SPECIES.getKey(),
            target -> applicator.selectSpecies(target, speciesName));
    }

    public CharacterRecord chooseSpeciesTrait(String traitName, String option) {
        return change(ChoiceName.SPECIES_TRAIT, ChoiceName.speciesTraitKey(traitName),
            target -> applicator.chooseSpeciesTrait(target, traitName, option));
    }

    public CharacterRecord selectLineage(String lineageName) {
        return change(ChoiceName.LINEAGE, ChoiceName.LINEAGE.getKey(),
            target -> applicator.selectLineage(target, lineageName));
    }

    public CharacterRecord chooseLanguages(List<String> languages) {
        return change(ChoiceName.LANGUAGES, ChoiceName.LANGUAGES.getKey(),
            target -> applicator.chooseLanguages(target, languages));
    }

    public CharacterRecord useRecommendedAbilityScores() {
        return change(ChoiceName.ABILITY_SCORES, ChoiceName.ABILITY_SCORES.getKey(),
            target -> applicator.setAbilityScores(target, ChoiceApplicator.AbilityScoreMethod.RECOMMENDED, null));
    }

    public CharacterRecord assignAbilityScores(Map<Ability, Integer> scores) {
        return change(ChoiceName.ABILITY_SCORES, ChoiceName.ABILITY_SCORES.getKey(),
            target -> applicator.setAbilityScores(target, ChoiceApplicator.AbilityScoreMethod.MANUAL, scores));
    }

    public CharacterRecord useSuggestedBackgroundBonuses() {
        return change(ChoiceName.BACKGROUND_BONUSES, ChoiceName.BACKGROUND_BONUSES.getKey(),
            target -> applicator.setBackgroundBonuses(target, ChoiceApplicator.BonusMethod.SUGGESTED, null));
    }

    public CharacterRecord assignBackgroundBonuses(Map<Ability, Integer> bonuses) {
        return change(ChoiceName.BACKGROUND_BONUSES, ChoiceName.BACKGROUND_BONUSES.getKey(),
            target -> applicator.setBackgroundBonuses(target, ChoiceApplicator.BonusMethod.MANUAL, bonuses));
    }

    public CharacterRecord selectEquipment(Map<String, String> selections) {
        return change(ChoiceName.EQUIPMENT_SELECTIONS, ChoiceName.EQUIPMENT_SELECTIONS.getKey(),
            target -> applicator.selectEquipment(target, selections));
    }

    public CharacterRecord selectSpells(List<String> cantrips, List<String> spells, List<String> bonusCantrips) {
        return change(ChoiceName.SPELL_SELECTIONS, ChoiceName.SPELL_SELECTIONS.getKey(),
            target -> applicator.selectSpells(target, cantrips, spells, bonusCantrips));
    }

    public CharacterRecord selectWeaponMasteries(List<String> weapons) {
        return change(ChoiceName.WEAPON_MASTERY_SELECTIONS, ChoiceName.WEAPON_MASTERY_SELECTIONS.getKey(),
            target -> applicator.selectWeaponMasteries(target, weapons));
    }

    // Чтение

    public CreationOptions.AbilityScoreRecommendation getAbilityScoreRecommendation() {
        return options.abilityScoreRecommendation(record);
    }

    public CreationOptions.BackgroundBonusOptions getBackgroundBonusOptions() {
        return options.backgroundBonusOptions(record);
    }

    public CreationOptions.ClassFeatureListing getClassFeatures() {
        return options.classFeatures(record);
    }

    public Map<String, CreationOptions.TraitChoice> getSpeciesTraitChoices() {
        return options.speciesTraitChoices(record);
    }

    public CreationOptions.LanguageOptions getLanguageOptions() {
        return options.languageOptions(record);
    }

    public CreationOptions.SpellOptions getSpellOptions() {
        return options.spellOptions(record);
    }

    public CreationOptions.WeaponMasteryOptions getWeaponMasteryOptions() {
        return options.weaponMasteryOptions(record);
    }

    public List<String> getAvailableSubclasses() {
        List<String> names = new ArrayList<>();
        catalog.getSubclassesForClass(record.getClassName()).forEach(doc -> names.add(doc.getName()));
        return names;
    }

    public JsonObject serialize() {
        return codec.toJson(record);
    }

    public CharacterView toPublicView() {
        return CharacterView.of(record, resolver);
    }

    /**
     * Начинает создание заново с пустой записью
     */
    public void reset() {
        record = new CharacterRecord(baseLanguage);
        log.debug("Session reset");
    }

    public CharacterRecord getRecord() {
        return record;
    }
}
