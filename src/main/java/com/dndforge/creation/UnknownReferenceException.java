package com.dndforge.creation;

/**
 * Имя не найдено в каталоге правил (класс, вид, язык, вариант черты и т.д.)
 */
public class UnknownReferenceException extends ChoiceValidationException {

    public UnknownReferenceException(String field, Object value) {
        super(field, value, "Не найдено (" + field + "): " + value);
    }

    public UnknownReferenceException(String field, Object value, String message) {
        super(field, value, message);
    }
}
