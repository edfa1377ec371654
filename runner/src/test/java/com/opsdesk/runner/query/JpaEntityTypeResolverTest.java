package com.opsdesk.runner.query;

import com.opsdesk.runner.audit.CommandExecution;
import com.opsdesk.runner.query.fixture.Member;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaEntityTypeResolver.class)
class JpaEntityTypeResolverTest {

    @Autowired JpaEntityTypeResolver resolver;

    @Test
    void resolve_bySimpleOrQualifiedName() {
        assertThat(resolver.resolve("Member")).get()
                .extracting(EntityTypeInfo::javaType).isEqualTo(Member.class);
        assertThat(resolver.resolve("member")).isPresent();
        assertThat(resolver.resolve(Member.class.getName())).isPresent();
        assertThat(resolver.resolve(" Member ")).isPresent();
    }

    @Test
    void resolve_unknownOrBlank_isEmpty() {
        assertThat(resolver.resolve("Nope")).isEmpty();
        assertThat(resolver.resolve("")).isEmpty();
        assertThat(resolver.resolve(null)).isEmpty();
    }

    @Test
    void fields_followDeclarationOrder_andMarkTheIdentifier() {
        EntityTypeInfo member = resolver.resolve("Member").orElseThrow();

        assertThat(member.fieldNames()).containsExactly("id", "name", "age", "status", "createdAt");
        assertThat(member.idField()).get().extracting(EntityTypeInfo.Field::name).isEqualTo("id");
        assertThat(member.field("createdAt")).get()
                .extracting(EntityTypeInfo.Field::javaType).isEqualTo(Instant.class);
    }

    @Test
    void choices_mapHandleToDisplayName() {
        assertThat(resolver.choices())
                .containsEntry(Member.class.getName(), "Member")
                .containsEntry(CommandExecution.class.getName(), "CommandExecution");
    }

    @Test
    void entityTypes_areSortedByName() {
        assertThat(resolver.entityTypes()).extracting(EntityTypeInfo::name).isSorted();
    }
}
