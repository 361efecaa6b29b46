package com.dndforge.creation;

/**
 * Корректно сформированный выбор, нарушающий правила: неполные характеристики,
 * превышение бюджета бонусов или лимита языков, ранний выбор подкласса.
 */
public class RuleConstraintException extends ChoiceValidationException {

    public RuleConstraintException(String field, Object value, String message) {
        super(field, value, message);
    }
}
