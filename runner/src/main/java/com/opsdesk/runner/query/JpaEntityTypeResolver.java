package com.opsdesk.runner.query;

import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.SingularAttribute;
import org.springframework.stereotype.Component;

import java.lang.reflect.Field;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Entity types straight from the JPA metamodel.
 *
 * Only basic singular attributes are exposed as fields; associations and
 * embeddables are not queryable. The metamodel does not change while the
 * process runs, so the listing is computed once.
 */
@Component
public class JpaEntityTypeResolver implements EntityTypeResolver {

    private final EntityManagerFactory emf;
    private volatile List<EntityTypeInfo> cached;

    public JpaEntityTypeResolver(EntityManagerFactory emf) {
        this.emf = emf;
    }

    @Override
    public List<EntityTypeInfo> entityTypes() {
        List<EntityTypeInfo> types = cached;
        if (types == null) {
            types = emf.getMetamodel().getEntities().stream()
                    .filter(e -> e.getJavaType() != null)
                    .map(JpaEntityTypeResolver::describe)
                    .sorted(Comparator.comparing(EntityTypeInfo::name))
                    .toList();
            cached = types;
        }
        return types;
    }

    @Override
    public Optional<EntityTypeInfo> resolve(String handle) {
        if (handle == null || handle.isBlank()) return Optional.empty();
        String wanted = handle.strip();
        return entityTypes().stream()
                .filter(t -> t.handle().equals(wanted) || t.name().equalsIgnoreCase(wanted))
                .findFirst();
    }

    private static EntityTypeInfo describe(EntityType<?> entity) {
        List<String> declared = declaredFieldOrder(entity.getJavaType());
        List<EntityTypeInfo.Field> fields = new ArrayList<>();
        for (SingularAttribute<?, ?> attribute : entity.getSingularAttributes()) {
            if (attribute.getPersistentAttributeType() != Attribute.PersistentAttributeType.BASIC) continue;
            fields.add(new EntityTypeInfo.Field(attribute.getName(), attribute.getJavaType(), attribute.isId()));
        }
        fields.sort(Comparator.comparingInt((EntityTypeInfo.Field f) -> {
            int idx = declared.indexOf(f.name());
            return idx < 0 ? Integer.MAX_VALUE : idx;
        }).thenComparing(EntityTypeInfo.Field::name));
        return new EntityTypeInfo(entity.getName(), entity.getJavaType(), fields);
    }

    // Superclass fields first, then each subclass in declaration order.
    private static List<String> declaredFieldOrder(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }
        List<String> names = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field f : c.getDeclaredFields()) names.add(f.getName());
        }
        return names;
    }
}
