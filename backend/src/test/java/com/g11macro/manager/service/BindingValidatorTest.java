package com.g11macro.manager.service;

import com.g11macro.manager.model.Direction;
import com.g11macro.manager.model.KeyBinding;
import com.g11macro.manager.model.KeyValue;
import com.g11macro.manager.model.Step;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BindingValidatorTest {

    private final BindingValidator validator = new BindingValidator();

    @Test
    void validBindingHasNoViolations() {
        KeyBinding binding = new KeyBinding(3, 18, Direction.Release, List.of(
                new Step.Key(KeyValue.named("Escape"), Direction.Click),
                new Step.Key(KeyValue.unicode("q"), Direction.Click),
                new Step.Run("true")));

        assertThat(validator.validate(binding)).isEmpty();
    }

    @Test
    void rangesAreChecked() {
        assertThat(validator.validate(new KeyBinding(0, 19, Direction.Press)))
                .containsExactly(
                        "M0/G19: bank m must be between 1 and 3",
                        "M0/G19: key g must be between 1 and 18");
    }

    @Test
    void clickIsNotATrigger() {
        assertThat(validator.validate(new KeyBinding(1, 1, Direction.Click)))
                .containsExactly("M1/G1: trigger must be Press or Release");
    }

    @Test
    void stepProblemsAreNumbered() {
        KeyBinding binding = new KeyBinding(1, 4, Direction.Press, List.of(
                new Step.Text(""),
                new Step.Key(KeyValue.named("Hyper"), Direction.Press),
                new Step.Run("  ")));

        assertThat(validator.validate(binding)).containsExactly(
                "M1/G4 step 1: text to type cannot be empty",
                "M1/G4 step 2: unknown key name 'Hyper'",
                "M1/G4 step 3: program name cannot be empty");
    }

    @Test
    void repeatIsCappedAtOneHundred() {
        KeyBinding binding = new KeyBinding(1, 1, Direction.Press, List.of(
                new Step.Key(KeyValue.named("Tab"), Direction.Click, 100),
                new Step.Key(KeyValue.named("Tab"), Direction.Click, Integer.MAX_VALUE)));

        assertThat(validator.validate(binding)).containsExactly(
                "M1/G1 step 2: repeat must be between 1 and 100, got 2147483647");
        assertThat(validator.checkRepeats(List.of(binding))).containsExactly(
                "M1/G1 step 2: repeat must be between 1 and 100, got 2147483647");
    }

    @Test
    void repeatCheckIgnoresOtherProblems() {
        KeyBinding binding = new KeyBinding(9, 99, Direction.Click, List.of(
                new Step.Key(KeyValue.named("Hyper"), Direction.Click, 3)));

        assertThat(validator.checkRepeats(List.of(binding))).isEmpty();
    }

    @Test
    void validateAllCollectsEveryBinding() {
        assertThat(validator.validateAll(List.of(
                new KeyBinding(4, 1, Direction.Press),
                new KeyBinding(1, 1, Direction.Press),
                new KeyBinding(1, 0, Direction.Press)))).hasSize(2);
    }
}
