package com.dndforge.game_rules;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Подстановка значений, зависящих от уровня, в шаблонные описания способностей.
 * <p>
 * Описание содержит токены вида {@code {uses}}; таблица scaling сопоставляет
 * каждому токену список порогов. Для уровня выбирается порог с наибольшим
 * minLevel, не превышающим уровень. Если ни один порог не подходит, токен
 * остается в тексте как есть.
 */
public class ScalingResolver {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");

    /**
     * Разрешает описание способности для уровня.
     * Строка возвращается без изменений, структурированная способность - с подстановкой.
     */
    public String resolve(Object feature, int level) {
        if (feature == null) {
            return "";
        }
        if (feature instanceof String) {
            return (String) feature;
        }
        if (feature instanceof ScaledText) {
            ScaledText text = (ScaledText) feature;
            return resolve(text.getDescription(), text.getScaling(), level);
        }
        if (feature instanceof Map) {
            return resolve(ScaledText.fromContent(feature), level);
        }
        return String.valueOf(feature);
    }

    public String resolve(String description, Map<String, List<Breakpoint>> scaling, int level) {
        if (description == null) {
            return "";
        }
        if (scaling == null || scaling.isEmpty()) {
            return description;
        }

        Map<String, String> values = new HashMap<>();
        for (Map.Entry<String, List<Breakpoint>> entry : scaling.entrySet()) {
            String value = valueAt(entry.getValue(), level);
            if (value != null) {
                values.put(entry.getKey(), value);
            }
        }

        // Один проход: подставленное значение повторно не сканируется
        Matcher matcher = PLACEHOLDER.matcher(description);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            String replacement = value != null ? value : matcher.group();
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Значение одного токена для уровня, либо null если уровень ниже всех порогов
     */
    public String valueAt(List<Breakpoint> breakpoints, int level) {
        if (breakpoints == null || breakpoints.isEmpty()) {
            return null;
        }
        List<Breakpoint> sorted = new ArrayList<>(breakpoints);
        sorted.sort(Comparator.comparingInt(Breakpoint::getMinLevel));

        String current = null;
        for (Breakpoint breakpoint : sorted) {
            if (breakpoint.getMinLevel() <= level) {
                current = breakpoint.getValue();
            }
        }
        return current;
    }
}
