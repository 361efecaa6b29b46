package com.dndforge.game_rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Документ правил (класс, подкласс, предыстория, вид, линия, черта).
 * <p>
 * Документы пишутся вручную и содержат произвольный набор необязательных полей,
 * поэтому каждый метод доступа допускает отсутствие поля и возвращает
 * пустое значение или значение по умолчанию.
 */
public class RuleDocument {
    private static final Logger log = LoggerFactory.getLogger(RuleDocument.class);

    public static final int DEFAULT_SUBCLASS_LEVEL = 3;
    public static final int DEFAULT_BONUS_POINTS = 3;

    public enum Kind {
        CLASS, SUBCLASS, BACKGROUND, SPECIES, LINEAGE, FEAT
    }

    private final Kind kind;
    private final Map<String, Object> data;

    public RuleDocument(Kind kind, Map<String, Object> data) {
        this.kind = kind;
        this.data = data != null ? data : Map.of();
    }

    public Kind getKind() { return kind; }

    public String getName() {
        return getString("name");
    }

    public boolean has(String key) {
        return data.get(key) != null;
    }

    public Object get(String key) {
        return data.get(key);
    }

    public String getString(String key) {
        Object value = data.get(key);
        return value != null ? String.valueOf(value) : null;
    }

    public int getInt(String key, int defaultValue) {
        Object value = data.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Список строк; одиночная строка превращается в список из одного элемента
     */
    public List<String> getStringList(String key) {
        return toStringList(data.get(key));
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = data.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    // Поля классов

    public List<String> getPrimaryAbilities() {
        Object value = data.get("primary_ability");
        if (value instanceof String) {
            List<String> result = new ArrayList<>();
            for (String part : ((String) value).split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
            return result;
        }
        return toStringList(value);
    }

    public int getSubclassUnlockLevel() {
        return getInt("subclass_selection_level", DEFAULT_SUBCLASS_LEVEL);
    }

    public Map<String, Integer> getStandardArrayAssignment() {
        return toIntMap(data.get("standard_array_assignment"));
    }

    public Map<String, Object> getStartingEquipment() {
        return getMap("starting_equipment");
    }

    /**
     * Способности по уровням, упорядоченные по возрастанию уровня.
     * Уровни, записанные не числом, пропускаются.
     */
    @SuppressWarnings("unchecked")
    public SortedMap<Integer, Map<String, Object>> getFeaturesByLevel() {
        SortedMap<Integer, Map<String, Object>> result = new TreeMap<>();
        for (Map.Entry<String, Object> entry : getMap("features_by_level").entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                continue;
            }
            try {
                result.put(Integer.parseInt(entry.getKey().trim()), (Map<String, Object>) entry.getValue());
            } catch (NumberFormatException e) {
                log.warn("{}: features_by_level key '{}' is not a level number, skipped", this, entry.getKey());
            }
        }
        return result;
    }

    /**
     * Значение таблицы по уровням ({"1": 2, "4": 3, ...}) для заданного уровня.
     * Если точного уровня нет, берется ближайший меньший; без подходящей записи - 0.
     */
    public int getLevelTableValue(String key, int level) {
        Map<String, Integer> table = toIntMap(data.get(key));
        int best = 0;
        int bestLevel = 0;
        for (Map.Entry<String, Integer> entry : table.entrySet()) {
            int entryLevel;
            try {
                entryLevel = Integer.parseInt(entry.getKey().trim());
            } catch (NumberFormatException e) {
                log.warn("{}: {} key '{}' is not a level number, skipped", this, key, entry.getKey());
                continue;
            }
            if (entryLevel <= level && entryLevel >= bestLevel) {
                best = entry.getValue();
                bestLevel = entryLevel;
            }
        }
        return best;
    }

    public boolean isSpellcaster() {
        return has("spellcasting_ability");
    }

    /**
     * Число подготовленных заговоров: cantrip_progression в виде таблицы или cantrips_by_level
     */
    public int getCantripLimit(int level) {
        if (data.get("cantrip_progression") instanceof Map) {
            return getLevelTableValue("cantrip_progression", level);
        }
        return getLevelTableValue("cantrips_by_level", level);
    }

    public int getPreparedSpellLimit(int level) {
        return getLevelTableValue("prepared_spells_by_level", level);
    }

    public List<String> getMasterableWeapons() {
        return getStringList("masterable_weapons");
    }

    public int getMasteryLimit(int level) {
        return getLevelTableValue("masteries_by_level", level);
    }

    // Поля видов и предысторий

    public Map<String, Object> getTraits() {
        return getMap("traits");
    }

    public List<String> getLineages() {
        return getStringList("lineages");
    }

    /**
     * Языки, выдаваемые документом напрямую (поле languages в виде списка)
     */
    public List<String> getGrantedLanguages() {
        Object value = data.get("languages");
        return value instanceof List ? toStringList(value) : List.of();
    }

    /**
     * Количество дополнительных языков на выбор: language_choices или languages в виде числа
     */
    public int getLanguageChoices() {
        Object value = data.get("languages");
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return getInt("language_choices", 0);
    }

    public int getBonusPoints() {
        Map<String, Object> asi = getMap("ability_score_increase");
        Object points = asi.get("points");
        return points instanceof Number ? ((Number) points).intValue() : DEFAULT_BONUS_POINTS;
    }

    public Map<String, Integer> getSuggestedBonuses() {
        return toIntMap(getMap("ability_score_increase").get("suggested"));
    }

    public List<String> getBonusAbilityOptions() {
        return toStringList(getMap("ability_score_increase").get("options"));
    }

    /**
     * Черты с выбором (type = "choice"), в порядке документа
     */
    @SuppressWarnings("unchecked")
    public Map<String, Map<String, Object>> getChoiceTraits() {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : getTraits().entrySet()) {
            if (entry.getValue() instanceof Map) {
                Map<String, Object> trait = (Map<String, Object>) entry.getValue();
                if ("choice".equals(trait.get("type"))) {
                    result.put(entry.getKey(), trait);
                }
            }
        }
        return result;
    }

    // Выбор внутри способности или черты

    /**
     * Варианты выбора: choices.source.options, либо ключи таблицы из этого же документа,
     * на которую ссылается choices.source.list
     */
    public List<String> getChoiceOptions(Map<String, Object> feature) {
        Map<String, Object> source = choiceSource(feature);
        List<String> options = toStringList(source.get("options"));
        if (!options.isEmpty()) {
            return options;
        }
        Object listName = source.get("list");
        if (listName != null) {
            Object table = feature.get(String.valueOf(listName));
            if (!(table instanceof Map)) {
                table = data.get(String.valueOf(listName));
            }
            if (table instanceof Map) {
                List<String> keys = new ArrayList<>();
                for (Object key : ((Map<?, ?>) table).keySet()) {
                    keys.add(String.valueOf(key));
                }
                return keys;
            }
        }
        return List.of();
    }

    public int getChoiceCount(Map<String, Object> feature) {
        Object choices = feature.get("choices");
        if (choices instanceof Map) {
            Object count = ((Map<?, ?>) choices).get("count");
            if (count instanceof Number) {
                return ((Number) count).intValue();
            }
        }
        return 1;
    }

    /**
     * Эффекты выбранного варианта: choice_effects черты или поле effects записи в таблице вариантов
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getOptionEffects(Map<String, Object> feature, String option) {
        Object choiceEffects = feature.get("choice_effects");
        if (choiceEffects instanceof Map) {
            return toMapList(((Map<String, Object>) choiceEffects).get(option));
        }
        Object listName = choiceSource(feature).get("list");
        if (listName != null) {
            Object table = feature.get(String.valueOf(listName));
            if (!(table instanceof Map)) {
                table = data.get(String.valueOf(listName));
            }
            if (table instanceof Map) {
                Object entry = ((Map<String, Object>) table).get(option);
                if (entry instanceof Map) {
                    return toMapList(((Map<String, Object>) entry).get("effects"));
                }
            }
        }
        return List.of();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> choiceSource(Map<String, Object> feature) {
        Object choices = feature.get("choices");
        if (choices instanceof Map) {
            Object source = ((Map<String, Object>) choices).get("source");
            if (source instanceof Map) {
                return (Map<String, Object>) source;
            }
        }
        return Map.of();
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> toMapList(Object value) {
        if (!(value instanceof List)) {
            return List.of();
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : (List<Object>) value) {
            if (item instanceof Map) {
                result.add((Map<String, Object>) item);
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public static List<String> toStringList(Object value) {
        if (value instanceof String) {
            return List.of((String) value);
        }
        if (!(value instanceof List)) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<Object>) value) {
            if (item != null) {
                result.add(String.valueOf(item));
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Integer> toIntMap(Object value) {
        Map<String, Integer> result = new LinkedHashMap<>();
        if (!(value instanceof Map)) {
            return result;
        }
        for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
            if (entry.getValue() instanceof Number) {
                result.put(entry.getKey(), ((Number) entry.getValue()).intValue());
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return kind + "(" + getName() + ")";
    }
}
