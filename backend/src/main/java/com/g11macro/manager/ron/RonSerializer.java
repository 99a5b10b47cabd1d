package com.g11macro.manager.ron;

import com.g11macro.manager.model.KeyBinding;
import com.g11macro.manager.model.KeyValue;
import com.g11macro.manager.model.Step;

import java.util.List;

/**
 * Writes key bindings in the canonical layout read by the macro daemon.
 *
 * <p>A {@link Step.Key} with {@code repeat = n} is written as {@code n} identical lines, so
 * parsing the output yields {@code n} single steps rather than one repeated step.
 */
public final class RonSerializer {

    public static final String HEADER = "#![enable(explicit_struct_names, implicit_some)]";

    private static final String BINDING_INDENT = "    ";
    private static final String FIELD_INDENT = "        ";
    private static final String STEP_INDENT = "            ";

    private static final Step.Visitor<String> STEP_WRITER = new StepWriter();

    private RonSerializer() {
    }

    public static String serialize(List<KeyBinding> bindings) {
        StringBuilder sb = new StringBuilder();
        sb.append(HEADER).append('\n');
        sb.append("[\n");

        for (KeyBinding binding : bindings) {
            sb.append(BINDING_INDENT).append("KeyBinding(\n");
            sb.append(FIELD_INDENT).append("m: ").append(binding.m()).append(",\n");
            sb.append(FIELD_INDENT).append("g: ").append(binding.g()).append(",\n");
            sb.append(FIELD_INDENT).append("on: ").append(binding.on().name()).append(",\n");
            sb.append(FIELD_INDENT).append("script: [\n");
            for (Step step : binding.script()) {
                String line = step.accept(STEP_WRITER);
                int count = step instanceof Step.Key key ? Math.max(1, key.repeat()) : 1;
                for (int i = 0; i < count; i++) {
                    sb.append(STEP_INDENT).append(line).append(",\n");
                }
            }
            sb.append(FIELD_INDENT).append("],\n");
            sb.append(BINDING_INDENT).append("),\n");
        }

        sb.append("]\n");
        return sb.toString();
    }

    static String writeKeyValue(KeyValue key) {
        if (key instanceof KeyValue.Unicode unicode) {
            String c = switch (unicode.character()) {
                case "'" -> "\\'";
                case "\\" -> "\\\\";
                case "\n" -> "\\n";
                case "\t" -> "\\t";
                default -> unicode.character();
            };
            return "Unicode('" + c + "')";
        }
        return ((KeyValue.Named) key).name();
    }

    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    static String quoteText(String value) {
        String escaped = value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\t", "\\t");
        return "\"" + escaped + "\"";
    }

    private static final class StepWriter implements Step.Visitor<String> {

        @Override
        public String visitKey(Step.Key step) {
            return "Key(" + writeKeyValue(step.key()) + ", " + step.direction().name() + ")";
        }

        @Override
        public String visitText(Step.Text step) {
            return "Text(" + quoteText(step.text()) + ")";
        }

        @Override
        public String visitButton(Step.Button step) {
            return "Button(" + step.button().name() + ", " + step.direction().name() + ")";
        }

        @Override
        public String visitMoveMouse(Step.MoveMouse step) {
            return "MoveMouse(" + step.x() + ", " + step.y() + ", " + step.coordinate().name() + ")";
        }

        @Override
        public String visitScroll(Step.Scroll step) {
            return "Scroll(" + step.magnitude() + ", " + step.axis().name() + ")";
        }

        @Override
        public String visitRun(Step.Run step) {
            if (step.args().isEmpty()) {
                return "Run(Program(" + quote(step.program()) + "))";
            }
            StringBuilder args = new StringBuilder();
            for (String arg : step.args()) {
                if (args.length() > 0) {
                    args.append(", ");
                }
                args.append(quote(arg));
            }
            return "Run(Program(" + quote(step.program()) + ", [" + args + "]))";
        }
    }
}
