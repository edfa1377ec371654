package com.opsdesk.runner.command.option;

/**
 * How an option is collected from the operator. Drives form rendering only;
 * validation is governed by {@link OptionSpec#required()} and the rule list.
 */
public enum OptionKind {
    TEXT,
    LONG_TEXT,
    CHOICE,
    BOOLEAN
}
