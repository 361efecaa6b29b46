package com.dndforge.creation;

import com.dndforge.game_state.CharacterRecord;
import com.google.gson.*;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Сериализация записи персонажа в JSON и обратно
 */
public class CharacterRecordCodec {
    private static final Gson gson = new GsonBuilder().create();
    private static final Gson prettyGson = new GsonBuilder().setPrettyPrinting().create();

    public JsonObject toJson(CharacterRecord record) {
        return gson.toJsonTree(record).getAsJsonObject();
    }

    public String toJsonString(CharacterRecord record, boolean pretty) {
        return (pretty ? prettyGson : gson).toJson(record);
    }

    public CharacterRecord fromJson(JsonElement json) {
        if (json == null || !json.isJsonObject()) {
            throw new RuleConstraintException("record", json, "Ожидался JSON-объект записи персонажа");
        }
        CharacterRecord record;
        try {
            record = gson.fromJson(json, CharacterRecord.class);
        } catch (JsonParseException e) {
            throw new RuleConstraintException("record", json, "Не удалось прочитать запись: " + e.getMessage());
        }
        if (record.getStep() == null) {
            throw new RuleConstraintException("step", null, "В записи не указан шаг");
        }
        return record;
    }

    public CharacterRecord fromJson(String json) {
        try {
            return fromJson(JsonParser.parseString(json));
        } catch (JsonParseException e) {
            throw new RuleConstraintException("record", json, "Некорректный JSON: " + e.getMessage());
        }
    }

    /**
     * Журнал выборов из JSON-объекта (ключ выбора → значение)
     */
    public SortedMap<String, JsonElement> choicesFromJson(String json) {
        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new RuleConstraintException("choices", json, "Некорректный JSON: " + e.getMessage());
        }
        if (!parsed.isJsonObject()) {
            throw new RuleConstraintException("choices", json, "Ожидался JSON-объект выборов");
        }
        SortedMap<String, JsonElement> choices = new TreeMap<>();
        for (Map.Entry<String, JsonElement> entry : parsed.getAsJsonObject().entrySet()) {
            choices.put(entry.getKey(), entry.getValue());
        }
        return choices;
    }

    public String choicesToJson(Map<String, JsonElement> choices) {
        JsonObject object = new JsonObject();
        new TreeMap<>(choices).forEach(object::add);
        return gson.toJson(object);
    }
}
