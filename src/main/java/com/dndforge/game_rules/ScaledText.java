package com.dndforge.game_rules;

import java.util.*;

/**
 * Шаблонное описание вместе с таблицей масштабирования (как в документах правил)
 */
public class ScaledText {
    private String description = "";
    private Map<String, List<Breakpoint>> scaling = new LinkedHashMap<>();

    public ScaledText() {
    }

    public ScaledText(String description, Map<String, List<Breakpoint>> scaling) {
        this.description = description != null ? description : "";
        if (scaling != null) {
            this.scaling = new LinkedHashMap<>(scaling);
        }
    }

    /**
     * Строит описание из содержимого документа: строки или объекта с description/scaling
     */
    @SuppressWarnings("unchecked")
    public static ScaledText fromContent(Object content) {
        if (content instanceof String) {
            return new ScaledText((String) content, null);
        }
        if (!(content instanceof Map)) {
            return new ScaledText("", null);
        }
        Map<String, Object> map = (Map<String, Object>) content;
        Object description = map.get("description");
        return new ScaledText(description != null ? String.valueOf(description) : "",
            parseScaling(map.get("scaling")));
    }

    @SuppressWarnings("unchecked")
    public static Map<String, List<Breakpoint>> parseScaling(Object raw) {
        Map<String, List<Breakpoint>> scaling = new LinkedHashMap<>();
        if (!(raw instanceof Map)) {
            return scaling;
        }
        for (Map.Entry<String, Object> entry : ((Map<String, Object>) raw).entrySet()) {
            if (!(entry.getValue() instanceof List)) {
                continue;
            }
            List<Breakpoint> breakpoints = new ArrayList<>();
            for (Object item : (List<Object>) entry.getValue()) {
                if (!(item instanceof Map)) {
                    continue;
                }
                Map<String, Object> point = (Map<String, Object>) item;
                Object minLevel = point.get("min_level");
                int level = minLevel instanceof Number ? ((Number) minLevel).intValue() : 0;
                Object value = point.get("value");
                breakpoints.add(new Breakpoint(level, value != null ? String.valueOf(value) : ""));
            }
            scaling.put(entry.getKey(), breakpoints);
        }
        return scaling;
    }

    public String getDescription() { return description; }

    public Map<String, List<Breakpoint>> getScaling() { return scaling; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScaledText)) return false;
        ScaledText that = (ScaledText) o;
        return Objects.equals(description, that.description) && Objects.equals(scaling, that.scaling);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, scaling);
    }
}
