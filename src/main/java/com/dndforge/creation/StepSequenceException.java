package com.dndforge.creation;

import com.dndforge.game_state.CreationStep;

/**
 * Действие на шаге, который не является текущим, или чтение данных до выбора, от которого они зависят
 */
public class StepSequenceException extends ChoiceValidationException {
    private final CreationStep currentStep;

    public StepSequenceException(String field, CreationStep currentStep, String message) {
        super(field, null, message);
        this.currentStep = currentStep;
    }

    public CreationStep getCurrentStep() {
        return currentStep;
    }
}
