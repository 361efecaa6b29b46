package com.dndforge.game_rules;

import java.util.List;
import java.util.Optional;

/**
 * Каталог документов правил, доступный только для чтения.
 * Загружается один раз и не меняется за время работы процесса.
 */
public interface ContentCatalog {

    Optional<RuleDocument> findClass(String name);

    Optional<RuleDocument> findBackground(String name);

    Optional<RuleDocument> findSpecies(String name);

    Optional<RuleDocument> findLineage(String name);

    Optional<RuleDocument> findFeat(String name);

    Optional<RuleDocument> findSubclass(String className, String subclassName);

    List<RuleDocument> getSubclassesForClass(String className);

    List<String> getClassNames();

    List<String> getBackgroundNames();

    List<String> getSpeciesNames();

    /**
     * Все известные языки, в алфавитном порядке
     */
    List<String> getLanguages();

    default boolean isLanguage(String name) {
        return getLanguages().contains(name);
    }
}
