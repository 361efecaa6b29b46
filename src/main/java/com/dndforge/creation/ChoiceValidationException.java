package com.dndforge.creation;

/**
 * Отклоненный выбор. Запись персонажа при этом не изменяется.
 */
public abstract class ChoiceValidationException extends RuntimeException {
    private final String field;
    private final Object value;

    protected ChoiceValidationException(String field, Object value, String message) {
        super(message);
        this.field = field;
        this.value = value;
    }

    /**
     * Имя выбора или поля, в котором ошибка
     */
    public String getField() {
        return field;
    }

    public Object getValue() {
        return value;
    }
}
