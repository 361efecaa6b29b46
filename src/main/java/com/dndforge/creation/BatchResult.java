package com.dndforge.creation;

import java.util.*;

/**
 * Итог пакетного применения выборов: принятые ключи и ошибки по ключам
 */
public class BatchResult {
    private final List<String> applied = new ArrayList<>();
    private final Map<String, ChoiceValidationException> failures = new LinkedHashMap<>();

    void markApplied(String key) {
        applied.add(key);
    }

    void markFailed(String key, ChoiceValidationException error) {
        failures.put(key, error);
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    // Getters
    public List<String> getApplied() { return Collections.unmodifiableList(applied); }

    public Map<String, ChoiceValidationException> getFailures() { return Collections.unmodifiableMap(failures); }

    @Override
    public String toString() {
        return "BatchResult{applied=" + applied + ", failures=" + failures.keySet() + "}";
    }
}
