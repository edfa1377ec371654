package com.opsdesk.runner.command.option;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Enforces an option schema against submitted values.
 *
 * Pure and stateless: only static methods, no I/O. For every option of the
 * schema, in schema order:
 * <ol>
 *   <li>a required option whose value is absent or empty fails with
 *       {@code MISSING_REQUIRED};</li>
 *   <li>a non-empty value is run through the option's rules in declared
 *       order and the first failing rule ends validation with
 *       {@code RULE_VIOLATION}.</li>
 * </ol>
 * Values for keys the schema does not declare are ignored.
 */
public final class OptionValidator {

    private OptionValidator() {}

    public static void validate(Map<String, ?> values, Map<String, OptionSpec> schema) {
        for (Map.Entry<String, OptionSpec> entry : schema.entrySet()) {
            String key = entry.getKey();
            OptionSpec spec = entry.getValue();
            Object value = values == null ? null : values.get(key);

            if (spec.required() && isEmpty(value)) {
                throw OptionValidationException.missingRequired(key, spec.label());
            }
            if (!isEmpty(value) && !spec.rules().isEmpty()) {
                for (ValidationRule rule : spec.rules()) {
                    apply(key, value, rule);
                }
            }
        }
    }

    private static void apply(String key, Object value, ValidationRule rule) {
        Optional<BigDecimal> number = asNumber(value);
        switch (rule.name()) {
            case INTEGER -> {
                if (number.isEmpty() || !isWhole(number.get())) {
                    throw OptionValidationException.ruleViolation(key, rule,
                            "Option '" + key + "' must be an integer");
                }
            }
            case NUMERIC -> {
                if (number.isEmpty()) {
                    throw OptionValidationException.ruleViolation(key, rule,
                            "Option '" + key + "' must be numeric");
                }
            }
            // MIN / MAX only constrain numeric values; anything else is left to INTEGER / NUMERIC.
            case MIN -> {
                if (number.isPresent() && number.get().compareTo(BigDecimal.valueOf(rule.arg())) < 0) {
                    throw OptionValidationException.ruleViolation(key, rule,
                            "Option '" + key + "' must be at least " + rule.arg());
                }
            }
            case MAX -> {
                if (number.isPresent() && number.get().compareTo(BigDecimal.valueOf(rule.arg())) > 0) {
                    throw OptionValidationException.ruleViolation(key, rule,
                            "Option '" + key + "' must not exceed " + rule.arg());
                }
            }
        }
    }

    /** Absent, null, blank text, {@code false}, or an empty collection / map. */
    public static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof CharSequence cs) return cs.toString().isBlank();
        if (value instanceof Boolean b) return !b;
        if (value instanceof Collection<?> c) return c.isEmpty();
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        return false;
    }

    /** Numeric reading of a submitted value: numbers as-is, text when it parses as a decimal. */
    public static Optional<BigDecimal> asNumber(Object value) {
        try {
            if (value instanceof BigDecimal bd) return Optional.of(bd);
            if (value instanceof Number n) return Optional.of(new BigDecimal(n.toString()));
            if (value instanceof CharSequence cs) {
                String s = cs.toString().strip();
                return s.isEmpty() ? Optional.empty() : Optional.of(new BigDecimal(s));
            }
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    private static boolean isWhole(BigDecimal n) {
        return n.signum() == 0 || n.stripTrailingZeros().scale() <= 0;
    }
}
