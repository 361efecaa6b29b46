package com.dndforge.game_state;

import com.google.gson.JsonElement;

import java.util.*;

/**
 * Запись создаваемого персонажа.
 * <p>
 * Изменяется только через ChoiceApplicator. Журнал choicesMade является
 * источником истины: остальные поля выводятся из него и каталога правил.
 */
public class CharacterRecord {
    public static final String DEFAULT_BASE_LANGUAGE = "Common";
    public static final int DEFAULT_SPEED = 30;

    // Личность
    private String name = "";
    private int level = 1;
    private Alignment alignment;

    // Класс
    private String className;
    private String subclassName;

    // Характеристики
    private AbilityScores abilityScores = new AbilityScores();
    private String backgroundName;
    private SortedMap<Ability, Integer> backgroundBonuses = new TreeMap<>();

    // Вид
    private String speciesName;
    private String lineageName;
    private SortedMap<String, String> traitChoices = new TreeMap<>();

    private String baseLanguage = DEFAULT_BASE_LANGUAGE;
    private SortedSet<String> languages = new TreeSet<>();
    private Proficiencies proficiencies = new Proficiencies();
    private int speed = DEFAULT_SPEED;
    private int darkvision = 0;
    private SortedSet<String> resistances = new TreeSet<>();

    // Заклинания и приемы оружия
    private SortedMap<String, GrantedSpell> alwaysPrepared = new TreeMap<>();
    private SortedMap<String, Integer> bonusCantripChoices = new TreeMap<>();
    private SortedSet<String> preparedCantrips = new TreeSet<>();
    private SortedSet<String> preparedSpells = new TreeSet<>();
    private SortedSet<String> bonusCantrips = new TreeSet<>();
    private SortedSet<String> weaponMasteries = new TreeSet<>();
    private List<SkillBonus> skillBonuses = new ArrayList<>();

    private Map<FeatureCategory, List<FeatureRecord>> features = new EnumMap<>(FeatureCategory.class);
    private SortedMap<String, String> equipmentSelections = new TreeMap<>();
    private SortedMap<String, JsonElement> choicesMade = new TreeMap<>();
    private CreationStep step = CreationStep.CLASS;

    public CharacterRecord() {
        this(DEFAULT_BASE_LANGUAGE);
    }

    public CharacterRecord(String baseLanguage) {
        this.baseLanguage = baseLanguage;
        this.languages.add(baseLanguage);
        for (FeatureCategory category : FeatureCategory.values()) {
            features.put(category, new ArrayList<>());
        }
    }

    public List<FeatureRecord> getFeatures(FeatureCategory category) {
        return features.computeIfAbsent(category, c -> new ArrayList<>());
    }

    public void addFeature(FeatureCategory category, FeatureRecord feature) {
        List<FeatureRecord> list = getFeatures(category);
        for (FeatureRecord existing : list) {
            if (Objects.equals(existing.getName(), feature.getName())) {
                return;
            }
        }
        list.add(feature);
    }

    public void clearFeatures(FeatureCategory category) {
        getFeatures(category).clear();
    }

    public Optional<FeatureRecord> findFeature(String featureName, FeatureCategory... categories) {
        for (FeatureCategory category : categories) {
            for (FeatureRecord feature : getFeatures(category)) {
                if (feature.getName().equals(featureName)) {
                    return Optional.of(feature);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Языки заменяются целиком; базовый язык всегда остается в наборе
     */
    public void setLanguages(Collection<String> languages) {
        this.languages = new TreeSet<>(languages);
        this.languages.add(baseLanguage);
    }

    public void addLanguages(Collection<String> languages) {
        this.languages.addAll(languages);
    }

    public void recordChoice(String key, JsonElement value) {
        choicesMade.put(key, value);
    }

    public boolean hasChoice(String key) {
        return choicesMade.containsKey(key);
    }

    // Getters and Setters
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public int getLevel() { return level; }
    public void setLevel(int level) { this.level = level; }

    public Alignment getAlignment() { return alignment; }
    public void setAlignment(Alignment alignment) { this.alignment = alignment; }

    public String getClassName() { return className; }
    public void setClassName(String className) { this.className = className; }

    public String getSubclassName() { return subclassName; }
    public void setSubclassName(String subclassName) { this.subclassName = subclassName; }

    public AbilityScores getAbilityScores() { return abilityScores; }
    public void setAbilityScores(AbilityScores abilityScores) { this.abilityScores = abilityScores; }

    public String getBackgroundName() { return backgroundName; }
    public void setBackgroundName(String backgroundName) { this.backgroundName = backgroundName; }

    public SortedMap<Ability, Integer> getBackgroundBonuses() { return Collections.unmodifiableSortedMap(backgroundBonuses); }
    public void setBackgroundBonuses(Map<Ability, Integer> backgroundBonuses) { this.backgroundBonuses = new TreeMap<>(backgroundBonuses); }

    public String getSpeciesName() { return speciesName; }
    public void setSpeciesName(String speciesName) { this.speciesName = speciesName; }

    public String getLineageName() { return lineageName; }
    public void setLineageName(String lineageName) { this.lineageName = lineageName; }

    public SortedMap<String, String> getTraitChoices() { return traitChoices; }

    public String getBaseLanguage() { return baseLanguage; }

    public SortedSet<String> getLanguages() { return Collections.unmodifiableSortedSet(languages); }

    public Proficiencies getProficiencies() { return proficiencies; }

    public int getSpeed() { return speed; }
    public void setSpeed(int speed) { this.speed = speed; }

    public int getDarkvision() { return darkvision; }
    public void setDarkvision(int darkvision) { this.darkvision = darkvision; }

    public SortedSet<String> getResistances() { return resistances; }

    public SortedMap<String, GrantedSpell> getAlwaysPrepared() { return alwaysPrepared; }

    /** Сколько заговоров на выбор дает каждый источник */
    public SortedMap<String, Integer> getBonusCantripChoices() { return bonusCantripChoices; }

    public SortedSet<String> getPreparedCantrips() { return Collections.unmodifiableSortedSet(preparedCantrips); }
    public void setPreparedCantrips(Collection<String> preparedCantrips) { this.preparedCantrips = new TreeSet<>(preparedCantrips); }

    public SortedSet<String> getPreparedSpells() { return Collections.unmodifiableSortedSet(preparedSpells); }
    public void setPreparedSpells(Collection<String> preparedSpells) { this.preparedSpells = new TreeSet<>(preparedSpells); }

    public SortedSet<String> getBonusCantrips() { return Collections.unmodifiableSortedSet(bonusCantrips); }
    public void setBonusCantrips(Collection<String> bonusCantrips) { this.bonusCantrips = new TreeSet<>(bonusCantrips); }

    public SortedSet<String> getWeaponMasteries() { return Collections.unmodifiableSortedSet(weaponMasteries); }
    public void setWeaponMasteries(Collection<String> weaponMasteries) { this.weaponMasteries = new TreeSet<>(weaponMasteries); }

    public List<SkillBonus> getSkillBonuses() { return skillBonuses; }

    public Map<FeatureCategory, List<FeatureRecord>> getAllFeatures() { return Collections.unmodifiableMap(features); }

    public SortedMap<String, String> getEquipmentSelections() { return Collections.unmodifiableSortedMap(equipmentSelections); }
    public void setEquipmentSelections(Map<String, String> equipmentSelections) { this.equipmentSelections = new TreeMap<>(equipmentSelections); }

    public SortedMap<String, JsonElement> getChoicesMade() { return Collections.unmodifiableSortedMap(choicesMade); }

    public CreationStep getStep() { return step; }
    public void setStep(CreationStep step) { this.step = step; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CharacterRecord)) return false;
        CharacterRecord that = (CharacterRecord) o;
        return level == that.level
            && speed == that.speed
            && darkvision == that.darkvision
            && Objects.equals(name, that.name)
            && alignment == that.alignment
            && Objects.equals(className, that.className)
            && Objects.equals(subclassName, that.subclassName)
            && Objects.equals(abilityScores, that.abilityScores)
            && Objects.equals(backgroundName, that.backgroundName)
            && Objects.equals(backgroundBonuses, that.backgroundBonuses)
            && Objects.equals(speciesName, that.speciesName)
            && Objects.equals(lineageName, that.lineageName)
            && Objects.equals(traitChoices, that.traitChoices)
            && Objects.equals(baseLanguage, that.baseLanguage)
            && Objects.equals(languages, that.languages)
            && Objects.equals(proficiencies, that.proficiencies)
            && Objects.equals(resistances, that.resistances)
            && Objects.equals(alwaysPrepared, that.alwaysPrepared)
            && Objects.equals(bonusCantripChoices, that.bonusCantripChoices)
            && Objects.equals(preparedCantrips, that.preparedCantrips)
            && Objects.equals(preparedSpells, that.preparedSpells)
            && Objects.equals(bonusCantrips, that.bonusCantrips)
            && Objects.equals(weaponMasteries, that.weaponMasteries)
            && Objects.equals(skillBonuses, that.skillBonuses)
            && Objects.equals(features, that.features)
            && Objects.equals(equipmentSelections, that.equipmentSelections)
            && Objects.equals(choicesMade, that.choicesMade)
            && step == that.step;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, level, alignment, className, subclassName, abilityScores, backgroundName,
            backgroundBonuses, speciesName, lineageName, traitChoices, languages, proficiencies, speed,
            darkvision, resistances, alwaysPrepared, bonusCantripChoices, preparedCantrips, preparedSpells,
            bonusCantrips, weaponMasteries, skillBonuses, features, equipmentSelections, choicesMade, step);
    }

    @Override
    public String toString() {
        return "CharacterRecord{name='" + name + "', level=" + level + ", class=" + className
            + ", species=" + speciesName + ", step=" + step + "}";
    }
}
