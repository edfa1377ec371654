package com.opsdesk.runner.command.option;

import com.opsdesk.runner.command.CommandException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OptionValidatorTest {

    static Map<String, OptionSpec> schema(String key, OptionSpec spec) {
        Map<String, OptionSpec> schema = new LinkedHashMap<>();
        schema.put(key, spec);
        return schema;
    }

    static Map<String, Object> values(String key, Object value) {
        Map<String, Object> values = new HashMap<>();
        values.put(key, value);
        return values;
    }

    // ------------------------------------------------------------------
    // Required options
    // ------------------------------------------------------------------

    @Test
    void required_absentOrBlank_throwsMissingRequiredWithLabel() {
        Map<String, OptionSpec> schema = schema("query", OptionSpec.longText("Query").required().build());

        for (Object empty : new Object[] {null, "", "   ", Boolean.FALSE, List.of(), Map.of()}) {
            assertThatThrownBy(() -> OptionValidator.validate(values("query", empty), schema))
                    .isInstanceOfSatisfying(OptionValidationException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(CommandException.Kind.MISSING_REQUIRED);
                        assertThat(e.getOptionKey()).isEqualTo("query");
                        assertThat(e.getRule()).isNull();
                    })
                    .hasMessageContaining("Option 'Query' is required");
        }
        assertThatThrownBy(() -> OptionValidator.validate(Map.of(), schema))
                .isInstanceOf(OptionValidationException.class);
        assertThatThrownBy(() -> OptionValidator.validate(null, schema))
                .isInstanceOf(OptionValidationException.class);
    }

    @Test
    void required_anyNonEmptyValue_isAccepted() {
        Map<String, OptionSpec> schema = schema("query", OptionSpec.longText("Query").required().build());

        assertThatCode(() -> OptionValidator.validate(values("query", "get()"), schema)).doesNotThrowAnyException();
        assertThatCode(() -> OptionValidator.validate(values("query", 0), schema)).doesNotThrowAnyException();
        assertThatCode(() -> OptionValidator.validate(values("query", "0"), schema)).doesNotThrowAnyException();
    }

    @Test
    void optional_emptyValue_skipsRules() {
        Map<String, OptionSpec> schema = schema("days", OptionSpec.text("Days").rules("integer|min:1").build());

        assertThatCode(() -> OptionValidator.validate(values("days", ""), schema)).doesNotThrowAnyException();
        assertThatCode(() -> OptionValidator.validate(Map.of(), schema)).doesNotThrowAnyException();
    }

    @Test
    void undeclaredKeys_areIgnored() {
        Map<String, OptionSpec> schema = schema("days", OptionSpec.text("Days").build());
        assertThatCode(() -> OptionValidator.validate(Map.of("other", "x"), schema)).doesNotThrowAnyException();
    }

    // ------------------------------------------------------------------
    // Rules
    // ------------------------------------------------------------------

    @Test
    void max_exceeded_throwsRuleViolationForMax() {
        Map<String, OptionSpec> schema = schema("limit",
                OptionSpec.text("Limit").numeric().rules(ValidationRule.integer(), ValidationRule.max(10000)).build());

        assertThatThrownBy(() -> OptionValidator.validate(values("limit", "50000"), schema))
                .isInstanceOfSatisfying(OptionValidationException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(CommandException.Kind.RULE_VIOLATION);
                    assertThat(e.getOptionKey()).isEqualTo("limit");
                    assertThat(e.getRule()).isEqualTo(ValidationRule.max(10000));
                })
                .hasMessageContaining("must not exceed 10000");
    }

    @Test
    void rules_runInDeclaredOrder_firstFailureWins() {
        Map<String, OptionSpec> schema = schema("days", OptionSpec.text("Days").rules("integer|min:1|max:365").build());

        assertThatThrownBy(() -> OptionValidator.validate(values("days", "abc"), schema))
                .isInstanceOfSatisfying(OptionValidationException.class,
                        e -> assertThat(e.getRule().name()).isEqualTo(ValidationRule.Name.INTEGER));
        assertThatThrownBy(() -> OptionValidator.validate(values("days", "0"), schema))
                .hasMessageContaining("must be at least 1");
        assertThatThrownBy(() -> OptionValidator.validate(values("days", "2.5"), schema))
                .hasMessageContaining("must be an integer");
        assertThatCode(() -> OptionValidator.validate(values("days", "365"), schema)).doesNotThrowAnyException();
        assertThatCode(() -> OptionValidator.validate(values("days", 30), schema)).doesNotThrowAnyException();
    }

    @Test
    void numeric_rejectsText_acceptsDecimals() {
        Map<String, OptionSpec> schema = schema("ratio", OptionSpec.text("Ratio").rules(ValidationRule.numeric()).build());

        assertThatThrownBy(() -> OptionValidator.validate(values("ratio", "ten"), schema))
                .hasMessageContaining("must be numeric");
        assertThatCode(() -> OptionValidator.validate(values("ratio", " 0.75 "), schema)).doesNotThrowAnyException();
    }

    @Test
    void minMax_ignoreNonNumericValues() {
        Map<String, OptionSpec> schema = schema("name", OptionSpec.text("Name").rules("min:3").build());
        assertThatCode(() -> OptionValidator.validate(values("name", "ab"), schema)).doesNotThrowAnyException();
    }

    // ------------------------------------------------------------------
    // Schema construction
    // ------------------------------------------------------------------

    @Test
    void parseRules_readsNamesAndBounds() {
        assertThat(ValidationRule.parse("integer|min:1|max:365"))
                .containsExactly(ValidationRule.integer(), ValidationRule.min(1), ValidationRule.max(365));
        assertThat(ValidationRule.parse("required|numeric")).containsExactly(ValidationRule.numeric());
        assertThat(ValidationRule.parse(null)).isEmpty();
        assertThat(ValidationRule.max(10000).toString()).isEqualTo("MAX:10000");
    }

    @Test
    void choiceOption_withoutChoicesOrResolver_isRejected() {
        assertThatThrownBy(() -> OptionSpec.choice("Entity").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Entity");
    }

    @Test
    void choiceResolver_isConsultedOnEveryResolution() {
        Map<String, String> source = new LinkedHashMap<>(Map.of("a", "A"));
        OptionSpec spec = OptionSpec.choice("Entity").choices(() -> source).build();

        assertThat(spec.resolvedChoices()).containsOnlyKeys("a");
        source.put("b", "B");
        assertThat(spec.resolvedChoices()).containsOnlyKeys("a", "b");
    }

    @Test
    void staticChoices_areCopied() {
        OptionSpec spec = OptionSpec.choice("Table").choice("t1", "One").choice("t2", "Two").build();
        assertThat(spec.resolvedChoices()).containsExactly(Map.entry("t1", "One"), Map.entry("t2", "Two"));
        assertThatThrownBy(() -> spec.choices().put("t3", "Three")).isInstanceOf(UnsupportedOperationException.class);
    }
}
