package com.opsdesk.runner.api.dto;

import com.opsdesk.runner.query.EntityTypeInfo;

import java.util.List;

/**
 * One queryable entity type in GET /entity-types.
 */
public record EntityTypeResponse(String name, String handle, List<Field> fields) {

    public record Field(String name, String type, boolean id) {}

    public static EntityTypeResponse from(EntityTypeInfo info) {
        return new EntityTypeResponse(
                info.name(),
                info.handle(),
                info.fields().stream()
                        .map(f -> new Field(f.name(), f.javaType().getSimpleName(), f.id()))
                        .toList()
        );
    }
}
