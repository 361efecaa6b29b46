package com.dndforge.game_state;

import com.dndforge.game_rules.Breakpoint;
import com.dndforge.game_rules.ScaledText;

import java.util.*;

/**
 * Способность в записи персонажа.
 * Описание хранится в исходном шаблонном виде, подстановка выполняется при чтении.
 */
public class FeatureRecord {
    private String name;
    private String source;
    private Integer level;
    private String description = "";
    private Map<String, List<Breakpoint>> scaling = new LinkedHashMap<>();
    private String selection;

    public FeatureRecord() {
    }

    public FeatureRecord(String name, String source, Integer level, ScaledText text) {
        this.name = name;
        this.source = source;
        this.level = level;
        if (text != null) {
            this.description = text.getDescription();
            this.scaling = new LinkedHashMap<>(text.getScaling());
        }
    }

    public ScaledText toScaledText() {
        return new ScaledText(description, scaling);
    }

    /**
     * Имя для отображения: с выбранным вариантом, если он есть
     */
    public String getDisplayName() {
        return selection != null ? name + ": " + selection : name;
    }

    // Getters and Setters
    public String getName() { return name; }

    public String getSource() { return source; }

    public Integer getLevel() { return level; }

    public String getDescription() { return description; }

    public Map<String, List<Breakpoint>> getScaling() { return scaling; }

    public String getSelection() { return selection; }
    public void setSelection(String selection) { this.selection = selection; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureRecord)) return false;
        FeatureRecord that = (FeatureRecord) o;
        return Objects.equals(name, that.name)
            && Objects.equals(source, that.source)
            && Objects.equals(level, that.level)
            && Objects.equals(description, that.description)
            && Objects.equals(scaling, that.scaling)
            && Objects.equals(selection, that.selection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, source, level, description, scaling, selection);
    }

    @Override
    public String toString() {
        return "FeatureRecord{" + getDisplayName() + "}";
    }
}
