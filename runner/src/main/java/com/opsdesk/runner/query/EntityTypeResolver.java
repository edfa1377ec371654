package com.opsdesk.runner.query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source of queryable entity types, supplied by the host application.
 */
public interface EntityTypeResolver {

    /** Every queryable type, in a stable order. */
    List<EntityTypeInfo> entityTypes();

    /** Resolve a handle: the fully qualified class name or the simple name. */
    Optional<EntityTypeInfo> resolve(String handle);

    /** Handle → label, ready to back a choice option. */
    default Map<String, String> choices() {
        Map<String, String> choices = new LinkedHashMap<>();
        for (EntityTypeInfo type : entityTypes()) {
            choices.put(type.handle(), type.name());
        }
        return choices;
    }
}
