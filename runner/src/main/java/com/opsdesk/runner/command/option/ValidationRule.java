package com.opsdesk.runner.command.option;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One declarative constraint on an option value.
 *
 * @param name which check to run
 * @param arg  bound for {@link Name#MIN} / {@link Name#MAX}; null otherwise
 */
public record ValidationRule(Name name, Integer arg) {

    public enum Name { INTEGER, NUMERIC, MIN, MAX }

    public ValidationRule {
        if (name == null) throw new IllegalArgumentException("rule name is required");
        if ((name == Name.MIN || name == Name.MAX) && arg == null) {
            throw new IllegalArgumentException(name + " rule needs a bound");
        }
    }

    public static ValidationRule integer()     { return new ValidationRule(Name.INTEGER, null); }
    public static ValidationRule numeric()     { return new ValidationRule(Name.NUMERIC, null); }
    public static ValidationRule min(int min)  { return new ValidationRule(Name.MIN, min); }
    public static ValidationRule max(int max)  { return new ValidationRule(Name.MAX, max); }

    /**
     * Parse the compact pipe syntax used in configuration, e.g.
     * {@code "integer|min:1|max:365"}. Unknown rule names are ignored; a
     * missing or unparsable bound counts as 0.
     */
    public static List<ValidationRule> parse(String rules) {
        List<ValidationRule> parsed = new ArrayList<>();
        if (rules == null || rules.isBlank()) return parsed;

        for (String rule : rules.split("\\|")) {
            String ruleName = rule;
            String ruleValue = null;
            int colon = rule.indexOf(':');
            if (colon >= 0) {
                ruleName  = rule.substring(0, colon);
                ruleValue = rule.substring(colon + 1);
            }
            switch (ruleName.strip().toLowerCase(Locale.ROOT)) {
                case "integer" -> parsed.add(integer());
                case "numeric" -> parsed.add(numeric());
                case "min"     -> parsed.add(min(bound(ruleValue)));
                case "max"     -> parsed.add(max(bound(ruleValue)));
                default        -> { }
            }
        }
        return parsed;
    }

    private static int bound(String value) {
        if (value == null) return 0;
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @Override
    public String toString() {
        return arg == null ? name.name() : name + ":" + arg;
    }
}
