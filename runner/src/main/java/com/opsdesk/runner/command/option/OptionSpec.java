package com.opsdesk.runner.command.option;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative definition of one command option.
 *
 * @param kind           how the value is collected
 * @param label          operator-facing label, also used in "is required" messages
 * @param required       value must be present and non-empty
 * @param defaultValue   applied when the request omits the option; may be null
 * @param numeric        render as a numeric input
 * @param choices        key → label, only meaningful for CHOICE
 * @param choiceResolver dynamic source for CHOICE options; wins over {@code choices}
 * @param rules          checks applied in declared order to a non-empty value
 * @param help           helper text
 * @param placeholder    input placeholder
 */
public record OptionSpec(
        OptionKind           kind,
        String               label,
        boolean              required,
        Object               defaultValue,
        boolean              numeric,
        Map<String, String>  choices,
        ChoiceResolver       choiceResolver,
        List<ValidationRule> rules,
        String               help,
        String               placeholder) {

    public OptionSpec {
        if (kind == null) throw new IllegalArgumentException("option kind is required");
        choices = choices == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(choices));
        rules = rules == null ? List.of() : List.copyOf(rules);
        if (kind == OptionKind.CHOICE && choices.isEmpty() && choiceResolver == null) {
            throw new IllegalArgumentException(
                    "Choice option '" + label + "' needs choices or a choice resolver");
        }
    }

    /** Choices as they should be offered right now. */
    public Map<String, String> resolvedChoices() {
        if (choiceResolver == null) return choices;
        Map<String, String> resolved = choiceResolver.resolve();
        return resolved == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(resolved));
    }

    public static Builder text(String label)     { return new Builder(OptionKind.TEXT, label); }
    public static Builder longText(String label) { return new Builder(OptionKind.LONG_TEXT, label); }
    public static Builder choice(String label)   { return new Builder(OptionKind.CHOICE, label); }
    public static Builder bool(String label)     { return new Builder(OptionKind.BOOLEAN, label); }

    public static final class Builder {

        private final OptionKind kind;
        private final String     label;
        private boolean          required;
        private Object           defaultValue;
        private boolean          numeric;
        private Map<String, String> choices = new LinkedHashMap<>();
        private ChoiceResolver   choiceResolver;
        private List<ValidationRule> rules = List.of();
        private String           help;
        private String           placeholder;

        private Builder(OptionKind kind, String label) {
            this.kind  = kind;
            this.label = label;
        }

        public Builder required()                       { this.required = true; return this; }
        public Builder defaultValue(Object value)       { this.defaultValue = value; return this; }
        public Builder numeric()                        { this.numeric = true; return this; }
        public Builder choice(String key, String label) { this.choices.put(key, label); return this; }
        public Builder choices(ChoiceResolver resolver) { this.choiceResolver = resolver; return this; }
        public Builder rules(ValidationRule... rules)   { this.rules = List.of(rules); return this; }
        public Builder rules(String rules)              { this.rules = ValidationRule.parse(rules); return this; }
        public Builder help(String help)                { this.help = help; return this; }
        public Builder placeholder(String placeholder)  { this.placeholder = placeholder; return this; }

        public OptionSpec build() {
            return new OptionSpec(kind, label, required, defaultValue, numeric,
                    choices, choiceResolver, rules, help, placeholder);
        }
    }
}
