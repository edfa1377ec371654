package com.opsdesk.runner.query;

import java.util.List;
import java.util.Optional;

/**
 * A queryable entity type and the fields a query may reference.
 *
 * @param name     simple name shown to operators, e.g. "Member"
 * @param javaType the mapped class
 * @param fields   basic attributes in declaration order
 */
public record EntityTypeInfo(String name, Class<?> javaType, List<Field> fields) {

    /**
     * @param name     attribute name as used in queries
     * @param javaType attribute type
     * @param id       whether this is the identifier attribute
     */
    public record Field(String name, Class<?> javaType, boolean id) {}

    public EntityTypeInfo {
        fields = List.copyOf(fields);
    }

    public Optional<Field> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    public Optional<Field> idField() {
        return fields.stream().filter(Field::id).findFirst();
    }

    public List<String> fieldNames() {
        return fields.stream().map(Field::name).toList();
    }

    /** Handle submitted by clients: the fully qualified class name. */
    public String handle() {
        return javaType.getName();
    }
}
