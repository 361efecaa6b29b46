package com.dndforge.creation;

import com.dndforge.game_rules.ContentCatalog;
import com.dndforge.game_rules.RuleDocument;
import com.dndforge.game_rules.ScaledText;
import com.dndforge.game_rules.ScalingResolver;
import com.dndforge.game_state.Ability;
import com.dndforge.game_state.AbilityScores;
import com.dndforge.game_state.CharacterRecord;
import com.dndforge.game_state.GrantedSpell;
import com.google.gson.JsonElement;

import java.util.*;

/**
 * Производные данные для отображения шагов. Только чтение, запись не изменяется.
 * <p>
 * Здесь сосредоточена логика правил, чтобы транспортный слой не разбирал документы каталога сам.
 */
public class CreationOptions {
    public static final int DEFAULT_LANGUAGE_CHOICES = 2;

    public static final List<String> ALL_SKILLS = List.of(
        "Acrobatics", "Animal Handling", "Arcana", "Athletics", "Deception", "History",
        "Insight", "Intimidation", "Investigation", "Medicine", "Nature", "Perception",
        "Performance", "Persuasion", "Religion", "Sleight of Hand", "Stealth", "Survival"
    );

    private final ContentCatalog catalog;
    private final ScalingResolver resolver;

    public CreationOptions(ContentCatalog catalog, ScalingResolver resolver) {
        this.catalog = catalog;
        this.resolver = resolver;
    }

    /**
     * Рекомендованная раскладка характеристик класса
     */
    public AbilityScoreRecommendation abilityScoreRecommendation(CharacterRecord record) {
        RuleDocument classDoc = requireClass(record, "ability_scores");
        Map<Ability, Integer> allocation = toAbilityMap(classDoc.getStandardArrayAssignment());
        return new AbilityScoreRecommendation(
            strategyOf(record, ChoiceName.ABILITY_SCORES),
            classDoc.getPrimaryAbilities(),
            AbilityScores.STANDARD_ARRAY,
            allocation
        );
    }

    /**
     * Бонусы предыстории: бюджет очков, рекомендованное распределение и допустимые характеристики
     */
    public BackgroundBonusOptions backgroundBonusOptions(CharacterRecord record) {
        RuleDocument background = requireBackground(record, "background_bonuses");
        return new BackgroundBonusOptions(
            strategyOf(record, ChoiceName.BACKGROUND_BONUSES),
            background.getBonusPoints(),
            withoutZeros(toAbilityMap(background.getSuggestedBonuses())),
            legalBonusAbilities(background)
        );
    }

    public List<Ability> legalBonusAbilities(RuleDocument background) {
        List<String> declared = background.getBonusAbilityOptions();
        List<Ability> result = new ArrayList<>();
        for (Ability ability : Ability.values()) {
            if (declared.isEmpty() || declared.stream().anyMatch(name -> name.equalsIgnoreCase(ability.getValue()))) {
                result.add(ability);
            }
        }
        return result;
    }

    /**
     * Способности класса и подкласса по уровням до текущего, с подставленными значениями
     */
    public ClassFeatureListing classFeatures(CharacterRecord record) {
        RuleDocument classDoc = requireClass(record, "class_choices");
        Optional<RuleDocument> subclassDoc = catalog.findSubclass(record.getClassName(), record.getSubclassName());
        int level = record.getLevel();

        SortedMap<Integer, List<FeatureEntry>> byLevel = new TreeMap<>();
        List<FeatureChoice> choices = new ArrayList<>();

        FeatureChoice skillChoice = skillChoice(classDoc);
        if (skillChoice != null) {
            choices.add(skillChoice);
        }

        collectFeatures(classDoc, record.getClassName(), level, byLevel, choices);
        subclassDoc.ifPresent(doc -> collectFeatures(doc, record.getSubclassName(), level, byLevel, choices));

        return new ClassFeatureListing(byLevel, choices, skillChoice);
    }

    private void collectFeatures(RuleDocument doc, String source, int level,
                                 SortedMap<Integer, List<FeatureEntry>> byLevel, List<FeatureChoice> choices) {
        for (Map.Entry<Integer, Map<String, Object>> levelEntry : doc.getFeaturesByLevel().entrySet()) {
            int featureLevel = levelEntry.getKey();
            if (featureLevel > level) {
                break;
            }
            for (Map.Entry<String, Object> feature : levelEntry.getValue().entrySet()) {
                String description = resolver.resolve(ScaledText.fromContent(feature.getValue()), level);
                boolean isChoice = false;
                if (feature.getValue() instanceof Map) {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> data = (Map<String, Object>) feature.getValue();
                    List<String> options = doc.getChoiceOptions(data);
                    if (!options.isEmpty()) {
                        isChoice = true;
                        choices.add(new FeatureChoice(feature.getKey(), description, options,
                            doc.getChoiceCount(data), featureLevel, source));
                    }
                }
                byLevel.computeIfAbsent(featureLevel, l -> new ArrayList<>())
                    .add(new FeatureEntry(feature.getKey(), description, featureLevel, source, isChoice));
            }
        }
    }

    /**
     * Выбор навыков класса, либо null если класс его не предлагает
     */
    public FeatureChoice skillChoice(RuleDocument classDoc) {
        int count = classDoc.getInt("skill_proficiencies_count", 0);
        List<String> options = skillOptions(classDoc);
        if (count <= 0 || options.isEmpty()) {
            return null;
        }
        return new FeatureChoice("Skill Proficiencies",
            "Choose " + count + " skill proficiencies from the available options.",
            options, count, 1, classDoc.getName());
    }

    public List<String> skillOptions(RuleDocument classDoc) {
        List<String> options = classDoc.getStringList("skill_options");
        if (options.size() == 1 && "Any".equalsIgnoreCase(options.get(0))) {
            return ALL_SKILLS;
        }
        return options;
    }

    /**
     * Черты вида, требующие выбора
     */
    public Map<String, TraitChoice> speciesTraitChoices(CharacterRecord record) {
        RuleDocument species = requireSpecies(record, "species_traits");
        Map<String, TraitChoice> result = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Object>> trait : species.getChoiceTraits().entrySet()) {
            Object description = trait.getValue().get("description");
            result.put(trait.getKey(), new TraitChoice(
                trait.getKey(),
                description != null ? String.valueOf(description) : "",
                species.getChoiceOptions(trait.getValue()),
                species.getChoiceCount(trait.getValue()),
                record.getTraitChoices().get(trait.getKey())
            ));
        }
        return result;
    }

    /**
     * Языки: уже выданные, доступные для выбора и сколько можно выбрать
     */
    public LanguageOptions languageOptions(CharacterRecord record) {
        RuleDocument species = requireSpecies(record, "languages");
        Optional<RuleDocument> background = catalog.findBackground(record.getBackgroundName());

        SortedSet<String> granted = grantedLanguages(record);
        List<String> available = new ArrayList<>();
        for (String language : catalog.getLanguages()) {
            if (!granted.contains(language)) {
                available.add(language);
            }
        }

        int allowance = species.getLanguageChoices() + background.map(RuleDocument::getLanguageChoices).orElse(0);
        boolean declared = species.has("language_choices") || species.get("languages") instanceof Number
            || background.map(doc -> doc.get("languages") instanceof Number).orElse(false);
        if (!declared) {
            allowance = DEFAULT_LANGUAGE_CHOICES;
        }

        SortedSet<String> selected = new TreeSet<>(record.getLanguages());
        selected.removeAll(granted);
        return new LanguageOptions(granted, available, allowance, selected);
    }

    public SortedSet<String> grantedLanguages(CharacterRecord record) {
        SortedSet<String> granted = new TreeSet<>();
        granted.add(record.getBaseLanguage());
        catalog.findSpecies(record.getSpeciesName()).ifPresent(doc -> granted.addAll(doc.getGrantedLanguages()));
        catalog.findBackground(record.getBackgroundName()).ifPresent(doc -> granted.addAll(doc.getGrantedLanguages()));
        catalog.findClass(record.getClassName()).ifPresent(doc -> granted.addAll(doc.getGrantedLanguages()));
        return granted;
    }

    /**
     * Лимиты подготовки заклинаний класса на текущем уровне.
     * Всегда подготовленные заклинания с counts_against_limit уменьшают лимит.
     */
    public SpellOptions spellOptions(CharacterRecord record) {
        RuleDocument classDoc = requireClass(record, ChoiceName.SPELL_SELECTIONS.getKey());
        int level = record.getLevel();
        int countedCantrips = 0;
        int countedSpells = 0;
        for (GrantedSpell spell : record.getAlwaysPrepared().values()) {
            if (spell.isCountsAgainstLimit()) {
                if (spell.isCantrip()) {
                    countedCantrips++;
                } else {
                    countedSpells++;
                }
            }
        }

        int cantripLimit = 0;
        int spellLimit = 0;
        if (classDoc.isSpellcaster()) {
            cantripLimit = classDoc.getCantripLimit(level);
            spellLimit = classDoc.getPreparedSpellLimit(level);
            if (spellLimit == 0 && classDoc.has("spell_preparation_formula")) {
                spellLimit = Math.max(1, level + spellcastingModifier(record, classDoc));
            }
        }
        int bonusCantrips = 0;
        for (Integer count : record.getBonusCantripChoices().values()) {
            bonusCantrips += count;
        }
        return new SpellOptions(classDoc.getString("spellcasting_ability"),
            Math.max(0, cantripLimit - countedCantrips), Math.max(0, spellLimit - countedSpells), bonusCantrips,
            new TreeMap<>(record.getAlwaysPrepared()));
    }

    private static int spellcastingModifier(CharacterRecord record, RuleDocument classDoc) {
        String ability = classDoc.getString("spellcasting_ability");
        if (!Ability.isAbility(ability) || record.getAbilityScores().isEmpty()) {
            return 0;
        }
        return record.getAbilityScores().getModifier(Ability.fromString(ability), record.getBackgroundBonuses());
    }

    public WeaponMasteryOptions weaponMasteryOptions(CharacterRecord record) {
        RuleDocument classDoc = requireClass(record, ChoiceName.WEAPON_MASTERY_SELECTIONS.getKey());
        List<String> weapons = new ArrayList<>(classDoc.getMasterableWeapons());
        Collections.sort(weapons);
        return new WeaponMasteryOptions(weapons, classDoc.getMasteryLimit(record.getLevel()),
            new TreeSet<>(record.getWeaponMasteries()));
    }

    // Проверки предусловий чтения

    RuleDocument requireClass(CharacterRecord record, String field) {
        if (record.getClassName() == null) {
            throw new StepSequenceException(field, record.getStep(), "Класс еще не выбран");
        }
        return catalog.findClass(record.getClassName())
            .orElseThrow(() -> new UnknownReferenceException("class", record.getClassName()));
    }

    RuleDocument requireBackground(CharacterRecord record, String field) {
        if (record.getBackgroundName() == null) {
            throw new StepSequenceException(field, record.getStep(), "Предыстория еще не выбрана");
        }
        return catalog.findBackground(record.getBackgroundName())
            .orElseThrow(() -> new UnknownReferenceException("background", record.getBackgroundName()));
    }

    RuleDocument requireSpecies(CharacterRecord record, String field) {
        if (record.getSpeciesName() == null) {
            throw new StepSequenceException(field, record.getStep(), "Вид еще не выбран");
        }
        return catalog.findSpecies(record.getSpeciesName())
            .orElseThrow(() -> new UnknownReferenceException("species", record.getSpeciesName()));
    }

    static Map<Ability, Integer> toAbilityMap(Map<String, Integer> raw) {
        Map<Ability, Integer> result = new EnumMap<>(Ability.class);
        for (Map.Entry<String, Integer> entry : raw.entrySet()) {
            if (Ability.isAbility(entry.getKey())) {
                result.put(Ability.fromString(entry.getKey()), entry.getValue());
            }
        }
        return result;
    }

    static Map<Ability, Integer> withoutZeros(Map<Ability, Integer> bonuses) {
        Map<Ability, Integer> result = new EnumMap<>(Ability.class);
        bonuses.forEach((ability, value) -> {
            if (value != null && value != 0) {
                result.put(ability, value);
            }
        });
        return result;
    }

    private static String strategyOf(CharacterRecord record, ChoiceName choice) {
        JsonElement logged = record.getChoicesMade().get(choice.getKey());
        if (logged != null && logged.isJsonObject() && logged.getAsJsonObject().has("method")) {
            return logged.getAsJsonObject().get("method").getAsString();
        }
        return null;
    }

    // Result classes
    public static class AbilityScoreRecommendation {
        private final String currentMethod;
        private final List<String> primaryAbilities;
        private final List<Integer> standardArray;
        private final Map<Ability, Integer> allocation;

        public AbilityScoreRecommendation(String currentMethod, List<String> primaryAbilities,
                                          List<Integer> standardArray, Map<Ability, Integer> allocation) {
            this.currentMethod = currentMethod;
            this.primaryAbilities = primaryAbilities;
            this.standardArray = standardArray;
            this.allocation = allocation;
        }

        public String getCurrentMethod() { return currentMethod; }
        public List<String> getPrimaryAbilities() { return primaryAbilities; }
        public List<Integer> getStandardArray() { return standardArray; }
        public Map<Ability, Integer> getAllocation() { return allocation; }
    }

    public static class BackgroundBonusOptions {
        private final String currentMethod;
        private final int totalPoints;
        private final Map<Ability, Integer> suggested;
        private final List<Ability> abilityOptions;

        public BackgroundBonusOptions(String currentMethod, int totalPoints,
                                      Map<Ability, Integer> suggested, List<Ability> abilityOptions) {
            this.currentMethod = currentMethod;
            this.totalPoints = totalPoints;
            this.suggested = suggested;
            this.abilityOptions = abilityOptions;
        }

        public String getCurrentMethod() { return currentMethod; }
        public int getTotalPoints() { return totalPoints; }
        public Map<Ability, Integer> getSuggested() { return suggested; }
        public List<Ability> getAbilityOptions() { return abilityOptions; }
    }

    public static class FeatureEntry {
        private final String name;
        private final String description;
        private final int level;
        private final String source;
        private final boolean choice;

        public FeatureEntry(String name, String description, int level, String source, boolean choice) {
            this.name = name;
            this.description = description;
            this.level = level;
            this.source = source;
            this.choice = choice;
        }

        public String getName() { return name; }
        public String getDescription() { return description; }
        public int getLevel() { return level; }
        public String getSource() { return source; }
        public boolean isChoice() { return choice; }
    }

    public static class FeatureChoice {
        private final String name;
        private final String description;
        private final List<String> options;
        private final int count;
        private final int level;
        private final String source;

        public FeatureChoice(String name, String description, List<String> options, int count, int level, String source) {
            this.name = name;
            this.description = description;
            this.options = options;
            this.count = count;
            this.level = level;
            this.source = source;
        }

        public String getName() { return name; }
        public String getDescription() { return description; }
        public List<String> getOptions() { return options; }
        public int getCount() { return count; }
        public int getLevel() { return level; }
        public String getSource() { return source; }
    }

    public static class ClassFeatureListing {
        private final SortedMap<Integer, List<FeatureEntry>> featuresByLevel;
        private final List<FeatureChoice> choices;
        private final FeatureChoice skillChoice;

        public ClassFeatureListing(SortedMap<Integer, List<FeatureEntry>> featuresByLevel,
                                   List<FeatureChoice> choices, FeatureChoice skillChoice) {
            this.featuresByLevel = featuresByLevel;
            this.choices = choices;
            this.skillChoice = skillChoice;
        }

        public SortedMap<Integer, List<FeatureEntry>> getFeaturesByLevel() { return featuresByLevel; }
        public List<FeatureChoice> getChoices() { return choices; }
        public FeatureChoice getSkillChoice() { return skillChoice; }
    }

    public static class TraitChoice {
        private final String name;
        private final String description;
        private final List<String> options;
        private final int count;
        private final String selected;

        public TraitChoice(String name, String description, List<String> options, int count, String selected) {
            this.name = name;
            this.description = description;
            this.options = options;
            this.count = count;
            this.selected = selected;
        }

        public String getName() { return name; }
        public String getDescription() { return description; }
        public List<String> getOptions() { return options; }
        public int getCount() { return count; }
        public String getSelected() { return selected; }
    }

    public static class LanguageOptions {
        private final SortedSet<String> granted;
        private final List<String> available;
        private final int allowance;
        private final SortedSet<String> selected;

        public LanguageOptions(SortedSet<String> granted, List<String> available, int allowance, SortedSet<String> selected) {
            this.granted = granted;
            this.available = available;
            this.allowance = allowance;
            this.selected = selected;
        }

        /** Языки, известные без выбора, включая базовый */
        public SortedSet<String> getGranted() { return granted; }
        public List<String> getAvailable() { return available; }
        /** Сколько языков можно выбрать сверх выданных */
        public int getAllowance() { return allowance; }
        public SortedSet<String> getSelected() { return selected; }
    }

    public static class SpellOptions {
        private final String spellcastingAbility;
        private final int cantripLimit;
        private final int spellLimit;
        private final int bonusCantrips;
        private final SortedMap<String, GrantedSpell> alwaysPrepared;

        public SpellOptions(String spellcastingAbility, int cantripLimit, int spellLimit, int bonusCantrips,
                            SortedMap<String, GrantedSpell> alwaysPrepared) {
            this.spellcastingAbility = spellcastingAbility;
            this.cantripLimit = cantripLimit;
            this.spellLimit = spellLimit;
            this.bonusCantrips = bonusCantrips;
            this.alwaysPrepared = alwaysPrepared;
        }

        /** null, если класс не колдует */
        public String getSpellcastingAbility() { return spellcastingAbility; }
        public int getCantripLimit() { return cantripLimit; }
        public int getSpellLimit() { return spellLimit; }
        public int getBonusCantrips() { return bonusCantrips; }
        public SortedMap<String, GrantedSpell> getAlwaysPrepared() { return alwaysPrepared; }
    }

    public static class WeaponMasteryOptions {
        private final List<String> weapons;
        private final int limit;
        private final SortedSet<String> selected;

        public WeaponMasteryOptions(List<String> weapons, int limit, SortedSet<String> selected) {
            this.weapons = weapons;
            this.limit = limit;
            this.selected = selected;
        }

        public List<String> getWeapons() { return weapons; }
        public int getLimit() { return limit; }
        public SortedSet<String> getSelected() { return selected; }
    }
}
