package com.g11macro.manager.service;

import com.g11macro.manager.model.Direction;
import com.g11macro.manager.model.KeyBinding;
import com.g11macro.manager.model.KeyValue;
import com.g11macro.manager.model.NamedKeys;
import com.g11macro.manager.model.Step;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Editor-side checks on bindings before they are saved. The parser deliberately accepts more
 * than this so that files written by newer daemons still load.
 */
@Component
public class BindingValidator {

    public static final int MIN_BANK = 1;
    public static final int MAX_BANK = 3;
    public static final int MIN_G_KEY = 1;
    public static final int MAX_G_KEY = 18;
    public static final int MAX_REPEAT = 100;

    public List<String> validate(KeyBinding binding) {
        List<String> violations = new ArrayList<>();
        String where = "M" + binding.m() + "/G" + binding.g();

        if (binding.m() < MIN_BANK || binding.m() > MAX_BANK) {
            violations.add(where + ": bank m must be between " + MIN_BANK + " and " + MAX_BANK);
        }
        if (binding.g() < MIN_G_KEY || binding.g() > MAX_G_KEY) {
            violations.add(where + ": key g must be between " + MIN_G_KEY + " and " + MAX_G_KEY);
        }
        if (binding.on() == Direction.Click) {
            violations.add(where + ": trigger must be Press or Release");
        }

        for (int i = 0; i < binding.script().size(); i++) {
            String problem = checkStep(binding.script().get(i));
            if (problem != null) {
                violations.add(where + " step " + (i + 1) + ": " + problem);
            }
        }
        return violations;
    }

    public List<String> validateAll(List<KeyBinding> bindings) {
        List<String> violations = new ArrayList<>();
        for (KeyBinding binding : bindings) {
            violations.addAll(validate(binding));
        }
        return violations;
    }

    /**
     * Only the repeat bound, which every serialized list must respect since each repetition
     * becomes its own line.
     */
    public List<String> checkRepeats(List<KeyBinding> bindings) {
        List<String> violations = new ArrayList<>();
        for (KeyBinding binding : bindings) {
            for (int i = 0; i < binding.script().size(); i++) {
                String problem = checkRepeat(binding.script().get(i));
                if (problem != null) {
                    violations.add("M" + binding.m() + "/G" + binding.g() + " step " + (i + 1) + ": " + problem);
                }
            }
        }
        return violations;
    }

    private String checkRepeat(Step step) {
        if (step instanceof Step.Key key && key.repeat() > MAX_REPEAT) {
            return "repeat must be between 1 and " + MAX_REPEAT + ", got " + key.repeat();
        }
        return null;
    }

    private String checkStep(Step step) {
        String repeatProblem = checkRepeat(step);
        if (repeatProblem != null) {
            return repeatProblem;
        }
        if (step instanceof Step.Key key && key.key() instanceof KeyValue.Named named
                && !NamedKeys.contains(named.name())) {
            return "unknown key name '" + named.name() + "'";
        }
        if (step instanceof Step.Text text && text.text().isEmpty()) {
            return "text to type cannot be empty";
        }
        if (step instanceof Step.Run run && run.program().isBlank()) {
            return "program name cannot be empty";
        }
        return null;
    }
}
