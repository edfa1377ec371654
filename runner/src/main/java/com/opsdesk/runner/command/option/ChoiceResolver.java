package com.opsdesk.runner.command.option;

import java.util.Map;

/**
 * Supplies the choices of a {@link OptionKind#CHOICE} option at the moment the
 * schema is rendered, for lists that come from application state (e.g. the
 * queryable entity types). Keys are submitted values, values are labels;
 * iteration order is display order.
 */
@FunctionalInterface
public interface ChoiceResolver {

    Map<String, String> resolve();
}
