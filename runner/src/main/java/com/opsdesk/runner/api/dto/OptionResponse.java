package com.opsdesk.runner.api.dto;

import com.opsdesk.runner.command.option.OptionSpec;
import com.opsdesk.runner.command.option.ValidationRule;

import java.util.Map;
import java.util.List;

/**
 * One option of a command schema. Dynamic choices are resolved at the time
 * of the request.
 */
public record OptionResponse(
        String              key,
        String              kind,
        String              label,
        boolean             required,
        Object              defaultValue,
        boolean             numeric,
        Map<String, String> choices,
        List<String>        rules,
        String              help,
        String              placeholder
) {
    public static OptionResponse from(String key, OptionSpec spec) {
        return new OptionResponse(
                key,
                spec.kind().name(),
                spec.label(),
                spec.required(),
                spec.defaultValue(),
                spec.numeric(),
                spec.resolvedChoices(),
                spec.rules().stream().map(ValidationRule::toString).toList(),
                spec.help(),
                spec.placeholder()
        );
    }
}
