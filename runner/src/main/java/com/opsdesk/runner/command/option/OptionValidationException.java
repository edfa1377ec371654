package com.opsdesk.runner.command.option;

import com.opsdesk.runner.command.CommandException;

/**
 * An option value failed the schema: either a required option is missing,
 * or a declared rule rejected it.
 */
public class OptionValidationException extends CommandException {

    private final String optionKey;
    private final ValidationRule rule;

    private OptionValidationException(Kind kind, String optionKey, ValidationRule rule, String message) {
        super(kind, message);
        this.optionKey = optionKey;
        this.rule      = rule;
    }

    public static OptionValidationException missingRequired(String optionKey, String label) {
        String shown = label == null || label.isBlank() ? optionKey : label;
        return new OptionValidationException(Kind.MISSING_REQUIRED, optionKey, null,
                "Option '" + shown + "' is required");
    }

    public static OptionValidationException ruleViolation(String optionKey, ValidationRule rule, String message) {
        return new OptionValidationException(Kind.RULE_VIOLATION, optionKey, rule, message);
    }

    public String getOptionKey() { return optionKey; }

    /** The rule that failed; null for a missing required option. */
    public ValidationRule getRule() { return rule; }
}
