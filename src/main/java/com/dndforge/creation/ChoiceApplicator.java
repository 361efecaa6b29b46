package com.dndforge.creation;

import com.dndforge.game_rules.ContentCatalog;
import com.dndforge.game_rules.RuleDocument;
import com.dndforge.game_rules.ScaledText;
import com.dndforge.game_state.*;
import com.google.gson.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Применяет выборы игрока к записи персонажа.
 * <p>
 * Каждая операция сначала полностью проверяет выбор и только потом меняет запись:
 * при исключении запись остается прежней. Принятый выбор пишется в журнал choicesMade
 * под своим ключом в исходном виде.
 * <p>
 * Порядок шагов здесь не проверяется, только правила содержимого. Повторный выбор
 * накладывается поверх записи; AssemblyEngine поэтому пересобирает запись из журнала.
 */
public class ChoiceApplicator {
    private static final Logger log = LoggerFactory.getLogger(ChoiceApplicator.class);
    private static final Gson gson = new Gson();

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 20;

    public enum AbilityScoreMethod {
        RECOMMENDED("recommended"),
        MANUAL("manual");

        private final String value;

        AbilityScoreMethod(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        public static AbilityScoreMethod fromString(String value) {
            for (AbilityScoreMethod method : values()) {
                if (method.value.equalsIgnoreCase(value)) {
                    return method;
                }
            }
            throw new UnknownReferenceException("ability_scores", value, "Неизвестный способ распределения: " + value);
        }
    }

    public enum BonusMethod {
        SUGGESTED("suggested"),
        MANUAL("manual");

        private final String value;

        BonusMethod(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        public static BonusMethod fromString(String value) {
            for (BonusMethod method : values()) {
                if (method.value.equalsIgnoreCase(value)) {
                    return method;
                }
            }
            throw new UnknownReferenceException("background_bonuses", value, "Неизвестный способ распределения: " + value);
        }
    }

    private final ContentCatalog catalog;
    private final CreationOptions options;

    public ChoiceApplicator(ContentCatalog catalog, CreationOptions options) {
        this.catalog = catalog;
        this.options = options;
    }

    /**
     * Применяет выбор, заданный ключом журнала и значением в JSON
     */
    public void apply(CharacterRecord record, String key, JsonElement value) {
        ChoiceName choice = ChoiceName.fromKey(key);
        switch (choice) {
            case NAME:
                setName(record, asString(key, value));
                break;
            case ALIGNMENT:
                setAlignment(record, asString(key, value));
                break;
            case LEVEL:
                setLevel(record, asInt(key, value));
                break;
            case CLASS:
                selectClass(record, asString(key, value));
                break;
            case SUBCLASS:
                selectSubclass(record, asString(key, value));
                break;
            case CLASS_CHOICES: {
                JsonObject object = asObject(key, value);
                List<String> skills = object.has("skills") ? asStringList("skills", object.get("skills")) : List.of();
                Map<String, String> features = object.has("features")
                    ? asStringMap("features", object.get("features")) : Map.of();
                applyClassChoices(record, skills, features);
                break;
            }
            case BACKGROUND:
                selectBackground(record, asString(key, value));
                break;
            case SPECIES:
                selectSpecies(record, asString(key, value));
                break;
            case SPECIES_TRAIT:
                chooseSpeciesTrait(record, ChoiceName.traitNameOf(key), asString(key, value));
                break;
            case LINEAGE:
                selectLineage(record, asString(key, value));
                break;
            case LANGUAGES:
                chooseLanguages(record, asStringList(key, value));
                break;
            case ABILITY_SCORES: {
                JsonObject object = asObject(key, value);
                AbilityScoreMethod method = AbilityScoreMethod.fromString(methodOf(key, object));
                Map<String, Integer> scores = object.has("scores") ? asIntMap(key, object.get("scores")) : Map.of();
                setAbilityScores(record, method, toAbilities(key, scores));
                break;
            }
            case BACKGROUND_BONUSES: {
                JsonObject object = asObject(key, value);
                BonusMethod method = BonusMethod.fromString(methodOf(key, object));
                Map<String, Integer> bonuses = object.has("bonuses") ? asIntMap(key, object.get("bonuses")) : Map.of();
                setBackgroundBonuses(record, method, toAbilities(key, bonuses));
                break;
            }
            case EQUIPMENT_SELECTIONS:
                selectEquipment(record, asStringMap(key, value));
                break;
            case SPELL_SELECTIONS: {
                JsonObject object = asObject(key, value);
                selectSpells(record, optionalList(key, object, "cantrips"), optionalList(key, object, "spells"),
                    optionalList(key, object, "bonus_cantrips"));
                break;
            }
            case WEAPON_MASTERY_SELECTIONS:
                selectWeaponMasteries(record, asStringList(key, value));
                break;
            default:
                throw new UnknownReferenceException("choice", key);
        }
    }

    // Личность

    public void setName(CharacterRecord record, String name) {
        String trimmed = name != null ? name.trim() : "";
        record.setName(trimmed);
        record.recordChoice(ChoiceName.NAME.getKey(), new JsonPrimitive(trimmed));
    }

    public void setAlignment(CharacterRecord record, String value) {
        Alignment alignment;
        try {
            alignment = Alignment.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new UnknownReferenceException("alignment", value);
        }
        record.setAlignment(alignment);
        record.recordChoice(ChoiceName.ALIGNMENT.getKey(), new JsonPrimitive(alignment.getValue()));
    }

    public void setLevel(CharacterRecord record, int level) {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new RuleConstraintException("level", level,
                "Уровень должен быть от " + MIN_LEVEL + " до " + MAX_LEVEL + ": " + level);
        }
        record.setLevel(level);
        record.recordChoice(ChoiceName.LEVEL.getKey(), new JsonPrimitive(level));
    }

    // Класс

    public void selectClass(CharacterRecord record, String className) {
        RuleDocument classDoc = catalog.findClass(className)
            .orElseThrow(() -> new UnknownReferenceException("class", className));

        record.setClassName(classDoc.getName());
        record.setSubclassName(null);
        record.clearFeatures(FeatureCategory.CLASS);
        record.clearFeatures(FeatureCategory.SUBCLASS);

        Proficiencies proficiencies = record.getProficiencies();
        proficiencies.addSavingThrows(classDoc.getStringList("saving_throw_proficiencies"));
        proficiencies.addArmor(classDoc.getStringList("armor_proficiencies"));
        proficiencies.addWeapons(classDoc.getStringList("weapon_proficiencies"));
        addLeveledFeatures(record, classDoc, FeatureCategory.CLASS);

        record.recordChoice(ChoiceName.CLASS.getKey(), new JsonPrimitive(classDoc.getName()));
        log.debug("Class {} applied at level {}", classDoc.getName(), record.getLevel());
    }

    public void selectSubclass(CharacterRecord record, String subclassName) {
        RuleDocument classDoc = options.requireClass(record, "subclass");
        if (record.getLevel() < classDoc.getSubclassUnlockLevel()) {
            throw new RuleConstraintException("subclass", subclassName,
                "Подкласс доступен с уровня " + classDoc.getSubclassUnlockLevel());
        }
        RuleDocument subclassDoc = catalog.findSubclass(record.getClassName(), subclassName)
            .orElseThrow(() -> new UnknownReferenceException("subclass", subclassName));

        record.setSubclassName(subclassDoc.getName());
        record.clearFeatures(FeatureCategory.SUBCLASS);
        addLeveledFeatures(record, subclassDoc, FeatureCategory.SUBCLASS);

        record.recordChoice(ChoiceName.SUBCLASS.getKey(), new JsonPrimitive(subclassDoc.getName()));
        log.debug("Subclass {} applied", subclassDoc.getName());
    }

    /**
     * Навыки класса и варианты способностей класса и подкласса
     */
    public void applyClassChoices(CharacterRecord record, List<String> skills, Map<String, String> featureChoices) {
        RuleDocument classDoc = options.requireClass(record, "class_choices");

        List<String> skillOptions = options.skillOptions(classDoc);
        int skillCount = classDoc.getInt("skill_proficiencies_count", 0);
        Set<String> chosenSkills = new LinkedHashSet<>(skills);
        for (String skill : chosenSkills) {
            if (!skillOptions.contains(skill)) {
                throw new UnknownReferenceException("skills", skill, "Навык недоступен классу: " + skill);
            }
        }
        if (chosenSkills.size() > skillCount) {
            throw new RuleConstraintException("skills", skills,
                "Можно выбрать не больше " + skillCount + " навыков");
        }

        Optional<RuleDocument> subclassDoc = catalog.findSubclass(record.getClassName(), record.getSubclassName());
        Map<String, List<Map<String, Object>>> effectsByFeature = new LinkedHashMap<>();
        Map<String, RuleDocument> ownerByFeature = new HashMap<>();
        for (Map.Entry<String, String> choice : featureChoices.entrySet()) {
            String featureName = choice.getKey();
            RuleDocument owner = classDoc;
            Map<String, Object> feature = findLeveledFeature(classDoc, featureName, record.getLevel());
            if (feature == null && subclassDoc.isPresent()) {
                owner = subclassDoc.get();
                feature = findLeveledFeature(owner, featureName, record.getLevel());
            }
            if (feature == null) {
                throw new UnknownReferenceException("features", featureName, "Нет способности с выбором: " + featureName);
            }
            if (!owner.getChoiceOptions(feature).contains(choice.getValue())) {
                throw new UnknownReferenceException("features", choice.getValue(),
                    "Недопустимый вариант для " + featureName + ": " + choice.getValue());
            }
            effectsByFeature.put(featureName, owner.getOptionEffects(feature, choice.getValue()));
            ownerByFeature.put(featureName, owner);
        }

        record.getProficiencies().addSkills(chosenSkills);
        for (Map.Entry<String, String> choice : featureChoices.entrySet()) {
            record.findFeature(choice.getKey(), FeatureCategory.CLASS, FeatureCategory.SUBCLASS)
                .ifPresent(feature -> feature.setSelection(choice.getValue()));
            RuleDocument owner = ownerByFeature.get(choice.getKey());
            applyEffects(record, effectsByFeature.get(choice.getKey()), owner.getName(),
                owner == classDoc ? FeatureCategory.CLASS : FeatureCategory.SUBCLASS);
        }

        JsonObject logged = new JsonObject();
        logged.add("skills", gson.toJsonTree(new ArrayList<>(chosenSkills)));
        logged.add("features", gson.toJsonTree(new TreeMap<>(featureChoices)));
        record.recordChoice(ChoiceName.CLASS_CHOICES.getKey(), logged);
    }

    // Предыстория и вид

    public void selectBackground(CharacterRecord record, String backgroundName) {
        RuleDocument background = catalog.findBackground(backgroundName)
            .orElseThrow(() -> new UnknownReferenceException("background", backgroundName));

        record.setBackgroundName(background.getName());
        record.setBackgroundBonuses(Map.of());
        record.clearFeatures(FeatureCategory.BACKGROUND);
        record.clearFeatures(FeatureCategory.FEAT);

        record.getProficiencies().addSkills(background.getStringList("skill_proficiencies"));
        record.getProficiencies().addTools(background.getStringList("tool_proficiencies"));
        record.addLanguages(background.getGrantedLanguages());

        for (Map.Entry<String, Object> feature : background.getMap("features").entrySet()) {
            record.addFeature(FeatureCategory.BACKGROUND, new FeatureRecord(feature.getKey(), background.getName(),
                null, ScaledText.fromContent(feature.getValue())));
            applyEffects(record, effectsOf(feature.getValue()), background.getName(), FeatureCategory.BACKGROUND);
        }

        String featName = background.getString("feat");
        if (featName != null && !featName.isBlank()) {
            ScaledText text = catalog.findFeat(featName)
                .map(feat -> new ScaledText(Objects.toString(feat.getString("description"), ""), null))
                .orElse(new ScaledText("Feat granted by " + background.getName(), null));
            record.addFeature(FeatureCategory.FEAT, new FeatureRecord(featName, background.getName(), null, text));
        }

        record.recordChoice(ChoiceName.BACKGROUND.getKey(), new JsonPrimitive(background.getName()));
        log.debug("Background {} applied", background.getName());
    }

    public void selectSpecies(CharacterRecord record, String speciesName) {
        RuleDocument species = catalog.findSpecies(speciesName)
            .orElseThrow(() -> new UnknownReferenceException("species", speciesName));

        record.setSpeciesName(species.getName());
        record.setLineageName(null);
        record.getTraitChoices().clear();
        record.clearFeatures(FeatureCategory.SPECIES);
        record.clearFeatures(FeatureCategory.LINEAGE);
        record.setSpeed(species.getInt("speed", CharacterRecord.DEFAULT_SPEED));
        record.setDarkvision(species.getInt("darkvision", 0));
        record.addLanguages(species.getGrantedLanguages());

        Map<String, Map<String, Object>> choiceTraits = species.getChoiceTraits();
        for (Map.Entry<String, Object> trait : species.getTraits().entrySet()) {
            record.addFeature(FeatureCategory.SPECIES, new FeatureRecord(trait.getKey(), species.getName(),
                null, ScaledText.fromContent(trait.getValue())));
            if (!choiceTraits.containsKey(trait.getKey())) {
                applyEffects(record, effectsOf(trait.getValue()), species.getName(), FeatureCategory.SPECIES);
            }
        }

        record.recordChoice(ChoiceName.SPECIES.getKey(), new JsonPrimitive(species.getName()));
        log.debug("Species {} applied", species.getName());
    }

    /**
     * Выбор варианта черты вида. Эффекты вариантов применяются, когда выбраны все черты,
     * поэтому повторный выбор до этого момента не оставляет следов предыдущего варианта.
     */
    public void chooseSpeciesTrait(CharacterRecord record, String traitName, String option) {
        String field = ChoiceName.speciesTraitKey(traitName);
        RuleDocument species = options.requireSpecies(record, field);
        Map<String, Map<String, Object>> choiceTraits = species.getChoiceTraits();
        Map<String, Object> trait = choiceTraits.get(traitName);
        if (trait == null) {
            throw new UnknownReferenceException(field, traitName, "У вида нет черты с выбором: " + traitName);
        }
        if (!species.getChoiceOptions(trait).contains(option)) {
            throw new UnknownReferenceException(field, option, "Недопустимый вариант для " + traitName + ": " + option);
        }

        record.getTraitChoices().put(traitName, option);
        record.findFeature(traitName, FeatureCategory.SPECIES).ifPresent(feature -> feature.setSelection(option));
        record.recordChoice(field, new JsonPrimitive(option));

        if (record.getTraitChoices().keySet().containsAll(choiceTraits.keySet())) {
            for (Map.Entry<String, Map<String, Object>> chosen : choiceTraits.entrySet()) {
                applyEffects(record, species.getOptionEffects(chosen.getValue(),
                    record.getTraitChoices().get(chosen.getKey())), species.getName(), FeatureCategory.SPECIES);
            }
        }
    }

    public void selectLineage(CharacterRecord record, String lineageName) {
        RuleDocument species = options.requireSpecies(record, "lineage");
        List<String> lineages = species.getLineages();
        if (lineages.isEmpty()) {
            throw new RuleConstraintException("lineage", lineageName, "У вида " + species.getName() + " нет линий");
        }
        if (!lineages.contains(lineageName)) {
            throw new UnknownReferenceException("lineage", lineageName);
        }

        record.setLineageName(lineageName);
        record.clearFeatures(FeatureCategory.LINEAGE);
        catalog.findLineage(lineageName).ifPresent(lineage -> {
            if (lineage.has("speed")) {
                record.setSpeed(lineage.getInt("speed", record.getSpeed()));
            }
            if (lineage.has("darkvision")) {
                record.setDarkvision(Math.max(record.getDarkvision(), lineage.getInt("darkvision", 0)));
            }
            for (Map.Entry<String, Object> trait : lineage.getTraits().entrySet()) {
                record.addFeature(FeatureCategory.LINEAGE, new FeatureRecord(trait.getKey(), lineageName,
                    null, ScaledText.fromContent(trait.getValue())));
                applyEffects(record, effectsOf(trait.getValue()), lineageName, FeatureCategory.LINEAGE);
            }
        });

        record.recordChoice(ChoiceName.LINEAGE.getKey(), new JsonPrimitive(lineageName));
    }

    /**
     * Языки на выбор. Заменяет прежний выбор; выданные языки остаются всегда.
     */
    public void chooseLanguages(CharacterRecord record, List<String> selected) {
        CreationOptions.LanguageOptions languageOptions = options.languageOptions(record);

        Set<String> extra = new TreeSet<>();
        for (String language : selected) {
            if (!catalog.isLanguage(language)) {
                throw new UnknownReferenceException("languages", language);
            }
            if (!languageOptions.getGranted().contains(language)) {
                extra.add(language);
            }
        }
        if (extra.size() > languageOptions.getAllowance()) {
            throw new RuleConstraintException("languages", selected,
                "Можно выбрать не больше " + languageOptions.getAllowance() + " языков");
        }

        Set<String> languages = new TreeSet<>(languageOptions.getGranted());
        languages.addAll(extra);
        record.setLanguages(languages);
        record.recordChoice(ChoiceName.LANGUAGES.getKey(), gson.toJsonTree(new ArrayList<>(selected)));
    }

    // Характеристики

    /**
     * Устанавливает характеристики одной стратегией; другая стратегия при этом полностью заменяется
     */
    public void setAbilityScores(CharacterRecord record, AbilityScoreMethod method, Map<Ability, Integer> manual) {
        JsonObject logged = new JsonObject();
        logged.addProperty("method", method.getValue());

        AbilityScores scores;
        if (method == AbilityScoreMethod.RECOMMENDED) {
            CreationOptions.AbilityScoreRecommendation recommendation = options.abilityScoreRecommendation(record);
            scores = new AbilityScores(recommendation.getAllocation());
            if (!scores.isComplete()) {
                throw new RuleConstraintException("ability_scores", method.getValue(),
                    "У класса " + record.getClassName() + " нет полной рекомендованной раскладки");
            }
        } else {
            scores = new AbilityScores(manual != null ? manual : Map.of());
            if (!scores.isComplete()) {
                throw new RuleConstraintException("ability_scores", manual,
                    "Нужно задать все шесть характеристик положительными числами");
            }
            logged.add("scores", gson.toJsonTree(new TreeMap<>(scores.asMap())));
        }

        record.setAbilityScores(scores);
        record.recordChoice(ChoiceName.ABILITY_SCORES.getKey(), logged);
    }

    public void setBackgroundBonuses(CharacterRecord record, BonusMethod method, Map<Ability, Integer> manual) {
        CreationOptions.BackgroundBonusOptions bonusOptions = options.backgroundBonusOptions(record);
        JsonObject logged = new JsonObject();
        logged.addProperty("method", method.getValue());

        Map<Ability, Integer> bonuses;
        if (method == BonusMethod.SUGGESTED) {
            bonuses = bonusOptions.getSuggested();
        } else {
            Map<Ability, Integer> requested = manual != null ? manual : Map.of();
            for (Map.Entry<Ability, Integer> entry : requested.entrySet()) {
                if (entry.getValue() == null || entry.getValue() < 0) {
                    throw new RuleConstraintException("background_bonuses", entry.getValue(),
                        "Бонус не может быть отрицательным: " + entry.getKey());
                }
            }
            bonuses = CreationOptions.withoutZeros(requested);
            logged.add("bonuses", gson.toJsonTree(new TreeMap<>(bonuses)));
        }

        int total = 0;
        for (Map.Entry<Ability, Integer> entry : bonuses.entrySet()) {
            if (!bonusOptions.getAbilityOptions().contains(entry.getKey())) {
                throw new RuleConstraintException("background_bonuses", entry.getKey(),
                    "Предыстория не дает бонус к " + entry.getKey());
            }
            total += entry.getValue();
        }
        if (total > bonusOptions.getTotalPoints()) {
            throw new RuleConstraintException("background_bonuses", total,
                "Сумма бонусов " + total + " больше " + bonusOptions.getTotalPoints());
        }

        record.setBackgroundBonuses(bonuses);
        record.recordChoice(ChoiceName.BACKGROUND_BONUSES.getKey(), logged);
    }

    // Снаряжение

    public void selectEquipment(CharacterRecord record, Map<String, String> selections) {
        Map<String, String> accepted = new TreeMap<>();
        for (Map.Entry<String, String> entry : selections.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                continue;
            }
            RuleDocument source;
            if ("class_equipment".equals(entry.getKey())) {
                source = options.requireClass(record, "equipment_selections");
            } else if ("background_equipment".equals(entry.getKey())) {
                source = options.requireBackground(record, "equipment_selections");
            } else {
                throw new UnknownReferenceException("equipment_selections", entry.getKey());
            }
            if (!source.getStartingEquipment().containsKey(entry.getValue())) {
                throw new UnknownReferenceException(entry.getKey(), entry.getValue());
            }
            accepted.put(entry.getKey(), entry.getValue());
        }

        record.setEquipmentSelections(accepted);
        record.recordChoice(ChoiceName.EQUIPMENT_SELECTIONS.getKey(), gson.toJsonTree(accepted));
    }

    // Заклинания и приемы оружия

    /**
     * Подготовленные заговоры и заклинания, а также заговоры, выданные на выбор эффектами grant_cantrip_choice.
     * Заменяет прежний выбор целиком.
     */
    public void selectSpells(CharacterRecord record, List<String> cantrips, List<String> spells, List<String> bonusCantrips) {
        String field = ChoiceName.SPELL_SELECTIONS.getKey();
        RuleDocument classDoc = options.requireClass(record, field);
        SortedSet<String> chosenCantrips = distinctNames(field, cantrips);
        SortedSet<String> chosenSpells = distinctNames(field, spells);
        SortedSet<String> chosenBonus = distinctNames(field, bonusCantrips);

        if (!classDoc.isSpellcaster() && !(chosenCantrips.isEmpty() && chosenSpells.isEmpty())) {
            throw new RuleConstraintException(field, classDoc.getName(), "Класс " + classDoc.getName() + " не колдует");
        }
        for (String name : union(chosenCantrips, chosenSpells, chosenBonus)) {
            if (record.getAlwaysPrepared().containsKey(name)) {
                throw new RuleConstraintException(field, name, "Заклинание уже подготовлено всегда: " + name);
            }
        }
        CreationOptions.SpellOptions spellOptions = options.spellOptions(record);
        if (chosenCantrips.size() > spellOptions.getCantripLimit()) {
            throw new RuleConstraintException(field, cantrips,
                "Можно подготовить не больше " + spellOptions.getCantripLimit() + " заговоров");
        }
        if (chosenSpells.size() > spellOptions.getSpellLimit()) {
            throw new RuleConstraintException(field, spells,
                "Можно подготовить не больше " + spellOptions.getSpellLimit() + " заклинаний");
        }
        if (chosenBonus.size() > spellOptions.getBonusCantrips()) {
            throw new RuleConstraintException(field, bonusCantrips,
                "Можно выбрать не больше " + spellOptions.getBonusCantrips() + " дополнительных заговоров");
        }

        record.setPreparedCantrips(chosenCantrips);
        record.setPreparedSpells(chosenSpells);
        record.setBonusCantrips(chosenBonus);

        JsonObject logged = new JsonObject();
        logged.add("cantrips", gson.toJsonTree(new ArrayList<>(chosenCantrips)));
        logged.add("spells", gson.toJsonTree(new ArrayList<>(chosenSpells)));
        logged.add("bonus_cantrips", gson.toJsonTree(new ArrayList<>(chosenBonus)));
        record.recordChoice(field, logged);
    }

    public void selectWeaponMasteries(CharacterRecord record, List<String> weapons) {
        String field = ChoiceName.WEAPON_MASTERY_SELECTIONS.getKey();
        RuleDocument classDoc = options.requireClass(record, field);
        SortedSet<String> chosen = distinctNames(field, weapons);
        List<String> masterable = classDoc.getMasterableWeapons();
        if (masterable.isEmpty() && !chosen.isEmpty()) {
            throw new RuleConstraintException(field, weapons, "У класса " + classDoc.getName() + " нет приемов оружия");
        }
        for (String weapon : chosen) {
            if (!masterable.contains(weapon)) {
                throw new UnknownReferenceException(field, weapon, "Оружие недоступно для приемов: " + weapon);
            }
        }
        int limit = classDoc.getMasteryLimit(record.getLevel());
        if (chosen.size() > limit) {
            throw new RuleConstraintException(field, weapons, "Можно выбрать не больше " + limit + " видов оружия");
        }

        record.setWeaponMasteries(chosen);
        record.recordChoice(field, gson.toJsonTree(new ArrayList<>(chosen)));
    }

    // Эффекты

    /**
     * Применяет эффекты способности или варианта. Неизвестные типы пропускаются.
     *
     * @param source имя документа, давшего эффект (класс, вид, линия...)
     */
    public void applyEffects(CharacterRecord record, List<Map<String, Object>> effects, String source,
                             FeatureCategory category) {
        if (effects == null) {
            return;
        }
        for (Map<String, Object> effect : effects) {
            String type = String.valueOf(effect.get("type"));
            switch (type) {
                case "grant_weapon_proficiency":
                    record.getProficiencies().addWeapons(RuleDocument.toStringList(effect.get("proficiencies")));
                    break;
                case "grant_armor_proficiency":
                    record.getProficiencies().addArmor(RuleDocument.toStringList(effect.get("proficiencies")));
                    break;
                case "grant_skill_proficiency":
                    record.getProficiencies().addSkills(RuleDocument.toStringList(effect.get("skills")));
                    break;
                case "grant_damage_resistance":
                    if (effect.get("damage_type") != null) {
                        record.getResistances().add(String.valueOf(effect.get("damage_type")));
                    }
                    break;
                case "grant_darkvision":
                    record.setDarkvision(Math.max(record.getDarkvision(), intOf(effect.get("range"), 60)));
                    break;
                case "increase_speed":
                    record.setSpeed(record.getSpeed() + intOf(effect.get("value"), 0));
                    break;
                case "grant_cantrip":
                    if (effect.get("spell") != null) {
                        record.getAlwaysPrepared().put(String.valueOf(effect.get("spell")),
                            new GrantedSpell(0, source, false, Boolean.TRUE.equals(effect.get("counts_against_limit"))));
                    }
                    break;
                case "grant_spell":
                    if (effect.get("spell") != null && record.getLevel() >= intOf(effect.get("min_level"), 1)) {
                        boolean innate = category == FeatureCategory.SPECIES || category == FeatureCategory.LINEAGE;
                        record.getAlwaysPrepared().put(String.valueOf(effect.get("spell")),
                            new GrantedSpell(intOf(effect.get("level"), 1), source, innate,
                                Boolean.TRUE.equals(effect.get("counts_against_limit"))));
                    }
                    break;
                case "grant_cantrip_choice":
                    record.getBonusCantripChoices().merge(source, intOf(effect.get("count"), 1), Integer::sum);
                    break;
                case "ability_bonus":
                    addSkillBonus(record, effect, source);
                    break;
                default:
                    log.debug("Effect type {} is not supported, skipped", type);
            }
        }
    }

    private void addSkillBonus(CharacterRecord record, Map<String, Object> effect, String source) {
        Object ability = effect.get("ability");
        if (ability == null || !Ability.isAbility(String.valueOf(ability))) {
            log.warn("ability_bonus from {} names unknown ability {}, skipped", source, ability);
            return;
        }
        Integer value = effect.get("value") instanceof Number ? ((Number) effect.get("value")).intValue() : null;
        SkillBonus bonus = new SkillBonus(Ability.fromString(String.valueOf(ability)),
            RuleDocument.toStringList(effect.get("skills")), value, intOf(effect.get("minimum"), 0), source);
        if (!record.getSkillBonuses().contains(bonus)) {
            record.getSkillBonuses().add(bonus);
        }
    }

    private void addLeveledFeatures(CharacterRecord record, RuleDocument doc, FeatureCategory category) {
        for (Map.Entry<Integer, Map<String, Object>> levelEntry : doc.getFeaturesByLevel().entrySet()) {
            if (levelEntry.getKey() > record.getLevel()) {
                break;
            }
            for (Map.Entry<String, Object> feature : levelEntry.getValue().entrySet()) {
                record.addFeature(category, new FeatureRecord(feature.getKey(), doc.getName(),
                    levelEntry.getKey(), ScaledText.fromContent(feature.getValue())));
                applyEffects(record, effectsOf(feature.getValue()), doc.getName(), category);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> findLeveledFeature(RuleDocument doc, String featureName, int level) {
        for (Map.Entry<Integer, Map<String, Object>> levelEntry : doc.getFeaturesByLevel().entrySet()) {
            if (levelEntry.getKey() > level) {
                break;
            }
            Object feature = levelEntry.getValue().get(featureName);
            if (feature instanceof Map && !doc.getChoiceOptions((Map<String, Object>) feature).isEmpty()) {
                return (Map<String, Object>) feature;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> effectsOf(Object content) {
        if (content instanceof Map) {
            return RuleDocument.toMapList(((Map<String, Object>) content).get("effects"));
        }
        return List.of();
    }

    private static int intOf(Object value, int defaultValue) {
        return value instanceof Number ? ((Number) value).intValue() : defaultValue;
    }

    private static SortedSet<String> distinctNames(String field, List<String> names) {
        SortedSet<String> result = new TreeSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw malformed(field, names);
            }
            result.add(name.trim());
        }
        return result;
    }

    @SafeVarargs
    private static Set<String> union(Set<String>... sets) {
        Set<String> result = new TreeSet<>();
        for (Set<String> set : sets) {
            result.addAll(set);
        }
        return result;
    }

    // Разбор значений журнала

    private static String asString(String key, JsonElement value) {
        if (value == null || !value.isJsonPrimitive()) {
            throw malformed(key, value);
        }
        return value.getAsString();
    }

    private static int asInt(String key, JsonElement value) {
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
            throw malformed(key, value);
        }
        return value.getAsInt();
    }

    private static JsonObject asObject(String key, JsonElement value) {
        if (value == null || !value.isJsonObject()) {
            throw malformed(key, value);
        }
        return value.getAsJsonObject();
    }

    private static List<String> asStringList(String key, JsonElement value) {
        if (value == null || !value.isJsonArray()) {
            throw malformed(key, value);
        }
        List<String> result = new ArrayList<>();
        for (JsonElement item : value.getAsJsonArray()) {
            result.add(asString(key, item));
        }
        return result;
    }

    private static Map<String, String> asStringMap(String key, JsonElement value) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : asObject(key, value).entrySet()) {
            result.put(entry.getKey(), entry.getValue().isJsonNull() ? null : asString(key, entry.getValue()));
        }
        return result;
    }

    private static Map<String, Integer> asIntMap(String key, JsonElement value) {
        Map<String, Integer> result = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : asObject(key, value).entrySet()) {
            result.put(entry.getKey(), asInt(key, entry.getValue()));
        }
        return result;
    }

    private static List<String> optionalList(String key, JsonObject object, String member) {
        return object.has(member) ? asStringList(key, object.get(member)) : List.of();
    }

    private static String methodOf(String key, JsonObject object) {
        if (!object.has("method")) {
            throw malformed(key, object);
        }
        return asString(key, object.get("method"));
    }

    private static Map<Ability, Integer> toAbilities(String key, Map<String, Integer> raw) {
        Map<Ability, Integer> result = new EnumMap<>(Ability.class);
        for (Map.Entry<String, Integer> entry : raw.entrySet()) {
            if (!Ability.isAbility(entry.getKey())) {
                throw new UnknownReferenceException(key, entry.getKey(), "Неизвестная характеристика: " + entry.getKey());
            }
            result.put(Ability.fromString(entry.getKey()), entry.getValue());
        }
        return result;
    }

    private static RuleConstraintException malformed(String key, Object value) {
        return new RuleConstraintException(key, value, "Неверный формат значения для " + key + ": " + value);
    }
}
