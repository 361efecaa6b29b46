package com.dndforge.creation;

import com.dndforge.game_rules.ScalingResolver;
import com.dndforge.game_state.*;

import java.util.*;

/**
 * Представление персонажа для внешнего слоя: итоговые характеристики,
 * модификаторы и описания способностей с подставленными значениями уровня.
 */
public class CharacterView {
    private final String name;
    private final int level;
    private final String alignment;
    private final String className;
    private final String subclassName;
    private final String backgroundName;
    private final String speciesName;
    private final String lineageName;
    private final Map<String, String> traitChoices;
    private final Map<Ability, Integer> abilityScores;
    private final Map<Ability, Integer> abilityModifiers;
    private final Map<Ability, Integer> backgroundBonuses;
    private final int proficiencyBonus;
    private final List<String> languages;
    private final List<String> skills;
    private final List<String> savingThrows;
    private final List<String> weapons;
    private final List<String> armor;
    private final List<String> tools;
    private final int speed;
    private final int darkvision;
    private final List<String> resistances;
    private final Map<String, GrantedSpell> alwaysPrepared;
    private final List<String> preparedCantrips;
    private final List<String> preparedSpells;
    private final List<String> bonusCantrips;
    private final List<String> weaponMasteries;
    private final Map<String, Integer> skillBonuses;
    private final Map<FeatureCategory, List<Feature>> features;
    private final Map<String, String> equipmentSelections;
    private final String step;

    private CharacterView(CharacterRecord record, ScalingResolver resolver) {
        this.name = record.getName();
        this.level = record.getLevel();
        this.alignment = record.getAlignment() != null ? record.getAlignment().getValue() : null;
        this.className = record.getClassName();
        this.subclassName = record.getSubclassName();
        this.backgroundName = record.getBackgroundName();
        this.speciesName = record.getSpeciesName();
        this.lineageName = record.getLineageName();
        this.traitChoices = new TreeMap<>(record.getTraitChoices());
        this.backgroundBonuses = new EnumMap<>(Ability.class);
        this.backgroundBonuses.putAll(record.getBackgroundBonuses());

        this.abilityScores = new EnumMap<>(Ability.class);
        this.abilityModifiers = new EnumMap<>(Ability.class);
        AbilityScores scores = record.getAbilityScores();
        if (!scores.isEmpty()) {
            for (Ability ability : Ability.values()) {
                Integer base = scores.getScore(ability);
                if (base != null) {
                    abilityScores.put(ability, base + backgroundBonuses.getOrDefault(ability, 0));
                    abilityModifiers.put(ability, scores.getModifier(ability, backgroundBonuses));
                }
            }
        }

        this.proficiencyBonus = proficiencyBonus(record.getLevel());
        this.languages = new ArrayList<>(record.getLanguages());
        Proficiencies proficiencies = record.getProficiencies();
        this.skills = new ArrayList<>(proficiencies.getSkills());
        this.savingThrows = new ArrayList<>(proficiencies.getSavingThrows());
        this.weapons = new ArrayList<>(proficiencies.getWeapons());
        this.armor = new ArrayList<>(proficiencies.getArmor());
        this.tools = new ArrayList<>(proficiencies.getTools());
        this.speed = record.getSpeed();
        this.darkvision = record.getDarkvision();
        this.resistances = new ArrayList<>(record.getResistances());

        this.alwaysPrepared = new TreeMap<>(record.getAlwaysPrepared());
        this.preparedCantrips = new ArrayList<>(record.getPreparedCantrips());
        this.preparedSpells = new ArrayList<>(record.getPreparedSpells());
        this.bonusCantrips = new ArrayList<>(record.getBonusCantrips());
        this.weaponMasteries = new ArrayList<>(record.getWeaponMasteries());
        this.skillBonuses = new TreeMap<>();
        for (SkillBonus bonus : record.getSkillBonuses()) {
            int modifier = scores.isEmpty() ? 0 : scores.getModifier(bonus.getAbility(), backgroundBonuses);
            for (String skill : bonus.getSkills()) {
                skillBonuses.merge(skill, bonus.amount(modifier), Integer::sum);
            }
        }

        this.features = new EnumMap<>(FeatureCategory.class);
        for (FeatureCategory category : FeatureCategory.values()) {
            List<Feature> resolved = new ArrayList<>();
            for (FeatureRecord feature : record.getFeatures(category)) {
                resolved.add(new Feature(feature.getDisplayName(),
                    resolver.resolve(feature.toScaledText(), record.getLevel()),
                    feature.getSource(), feature.getLevel()));
            }
            features.put(category, resolved);
        }

        this.equipmentSelections = new TreeMap<>(record.getEquipmentSelections());
        this.step = record.getStep().getValue();
    }

    public static CharacterView of(CharacterRecord record, ScalingResolver resolver) {
        return new CharacterView(record, resolver);
    }

    /**
     * Бонус мастерства по уровню: +2 на 1-4, +3 на 5-8 и т.д.
     */
    public static int proficiencyBonus(int level) {
        return 2 + (level - 1) / 4;
    }

    public static class Feature {
        private final String name;
        private final String description;
        private final String source;
        private final Integer level;

        public Feature(String name, String description, String source, Integer level) {
            this.name = name;
            this.description = description;
            this.source = source;
            this.level = level;
        }

        public String getName() { return name; }
        public String getDescription() { return description; }
        public String getSource() { return source; }
        public Integer getLevel() { return level; }
    }

    // Getters
    public String getName() { return name; }
    public int getLevel() { return level; }
    public String getAlignment() { return alignment; }
    public String getClassName() { return className; }
    public String getSubclassName() { return subclassName; }
    public String getBackgroundName() { return backgroundName; }
    public String getSpeciesName() { return speciesName; }
    public String getLineageName() { return lineageName; }
    public Map<String, String> getTraitChoices() { return traitChoices; }
    public Map<Ability, Integer> getAbilityScores() { return abilityScores; }
    public Map<Ability, Integer> getAbilityModifiers() { return abilityModifiers; }
    public Map<Ability, Integer> getBackgroundBonuses() { return backgroundBonuses; }
    public int getProficiencyBonus() { return proficiencyBonus; }
    public List<String> getLanguages() { return languages; }
    public List<String> getSkills() { return skills; }
    public List<String> getSavingThrows() { return savingThrows; }
    public List<String> getWeapons() { return weapons; }
    public List<String> getArmor() { return armor; }
    public List<String> getTools() { return tools; }
    public int getSpeed() { return speed; }
    public int getDarkvision() { return darkvision; }
    public List<String> getResistances() { return resistances; }
    public Map<String, GrantedSpell> getAlwaysPrepared() { return alwaysPrepared; }
    public List<String> getPreparedCantrips() { return preparedCantrips; }
    public List<String> getPreparedSpells() { return preparedSpells; }
    public List<String> getBonusCantrips() { return bonusCantrips; }
    public List<String> getWeaponMasteries() { return weaponMasteries; }
    /** Бонусы к проверкам навыков сверх владения */
    public Map<String, Integer> getSkillBonuses() { return skillBonuses; }
    public Map<FeatureCategory, List<Feature>> getFeatures() { return features; }
    public Map<String, String> getEquipmentSelections() { return equipmentSelections; }
    public String getStep() { return step; }
}
