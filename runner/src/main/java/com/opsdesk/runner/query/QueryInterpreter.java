package com.opsdesk.runner.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdesk.runner.command.CommandException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Selection;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates a validated {@link QueryChain} against one entity type using the
 * JPA Criteria API.
 *
 * <p>Builder verbs accumulate restrictions, ordering, projection and paging.
 * The first terminal verb runs the query; verbs that apply to results then
 * transform the fetched value in memory. A chain without a terminal behaves
 * as if it ended in {@code get()}.
 *
 * <p>Records are always fetched as tuples, never as managed entities, so
 * evaluation cannot flush changes back to the database.
 *
 * <p>One instance per evaluation; not thread-safe.
 */
final class QueryInterpreter {

    static final String TIMEOUT_HINT = "jakarta.persistence.query.timeout";

    private static final String DEFAULT_TIMESTAMP = "createdAt";
    private static final int DEFAULT_PER_PAGE = 15;

    private static final Set<String> COMPARISON_OPERATORS =
            Set.of("=", "==", "!=", "<>", "<", "<=", ">", ">=", "like", "not like");
    private static final Set<String> COLUMN_OPERATORS =
            Set.of("=", "==", "!=", "<>", "<", "<=", ">", ">=");
    private static final Set<Class<?>> TEMPORAL_TYPES = Set.of(
            LocalDate.class, LocalDateTime.class, Instant.class, OffsetDateTime.class, ZonedDateTime.class);
    private static final Set<Class<?>> TIME_OF_DAY_TYPES = Set.of(
            LocalTime.class, LocalDateTime.class, Instant.class, OffsetDateTime.class, ZonedDateTime.class);
    private static final Set<Class<?>> INTEGRAL_TYPES = Set.of(
            Long.class, Integer.class, Short.class, Byte.class);

    // count(*), sum(age), ... as the left-hand side of having()
    private static final Pattern AGGREGATE = Pattern.compile(
            "\\s*(count|sum|avg|min|max)\\s*\\(\\s*(\\*|[A-Za-z_][A-Za-z0-9_]*)\\s*\\)\\s*",
            Pattern.CASE_INSENSITIVE);

    @FunctionalInterface
    private interface Clause {
        Predicate toPredicate(CriteriaBuilder cb, Root<?> root);
    }

    private record Sort(String field, boolean ascending) {}

    private final EntityManager entityManager;
    private final EntityTypeInfo type;
    private final ValueCoercer coercer;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Integer timeoutMillis;

    // OR of groups, each group an AND of clauses
    private final List<List<Clause>> groups = new ArrayList<>();
    private final List<Sort> orders = new ArrayList<>();
    private final Set<String> selects = new LinkedHashSet<>();
    private final Set<String> groupBy = new LinkedHashSet<>();
    private final List<Clause> having = new ArrayList<>();
    private final Set<String> havingFields = new LinkedHashSet<>();
    private boolean distinct;
    private Integer limit;
    private Integer offset;

    QueryInterpreter(EntityManager entityManager, EntityTypeInfo type, Clock clock,
                     ObjectMapper objectMapper, Integer timeoutMillis) {
        this.entityManager = entityManager;
        this.type = type;
        this.coercer = new ValueCoercer(clock.getZone());
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.timeoutMillis = timeoutMillis;
        this.groups.add(new ArrayList<>());
    }

    Object run(QueryChain chain) {
        Object result = null;
        boolean fetched = false;

        for (QueryCall call : chain.calls()) {
            QueryVerb verb = QueryVerb.lookup(call.verb())
                    .orElseThrow(() -> fail("Method '" + call.verb() + "' is not supported"));

            if (fetched) {
                if (!verb.appliesToResult()) {
                    throw fail(verb.verb() + "() cannot be applied to a fetched result");
                }
                result = applyToResult(verb, call, result);
                continue;
            }

            switch (verb.stage()) {
                case BUILDER  -> build(verb, call);
                case TERMINAL -> {
                    result = terminal(verb, call);
                    fetched = true;
                }
                case RESULT   -> {
                    result = applyToResult(verb, call, fetchRecords(limit, offset));
                    fetched = true;
                }
                case HELPER   -> throw fail(verb.verb() + "() can only be used as an argument");
            }
        }
        return fetched ? result : fetchRecords(limit, offset);
    }

    // -------------------------------------------------------------------------
    // Builder verbs
    // -------------------------------------------------------------------------

    private void build(QueryVerb verb, QueryCall call) {
        switch (verb) {
            case WHERE             -> addClause(false, comparison(call));
            case OR_WHERE          -> addClause(true, comparison(call));
            case WHERE_IN          -> addClause(false, membership(call, false));
            case WHERE_NOT_IN      -> addClause(false, membership(call, true));
            case WHERE_BETWEEN     -> addClause(false, between(call, false));
            case WHERE_NOT_BETWEEN -> addClause(false, between(call, true));
            case WHERE_NULL        -> {
                arity(call, 1, 1);
                String field = field(call, 0);
                addClause(false, (cb, root) -> cb.isNull(root.get(field)));
            }
            case WHERE_NOT_NULL    -> {
                arity(call, 1, 1);
                String field = field(call, 0);
                addClause(false, (cb, root) -> cb.isNotNull(root.get(field)));
            }
            case WHERE_DATE        -> addClause(false, calendarRange(call, false));
            case WHERE_YEAR        -> addClause(false, calendarRange(call, true));
            case WHERE_MONTH       -> addClause(false, monthOfYear(call));
            case WHERE_TIME        -> addClause(false, timeOfDay(call));
            case WHERE_COLUMN      -> addClause(false, columnComparison(call));
            case ORDER_BY          -> {
                arity(call, 1, 2);
                boolean ascending = call.arity() == 1 || ascending(text(call, 1));
                orders.add(new Sort(field(call, 0), ascending));
            }
            case ORDER_BY_DESC     -> {
                arity(call, 1, 1);
                orders.add(new Sort(field(call, 0), false));
            }
            case LATEST, OLDEST    -> {
                arity(call, 0, 1);
                String field = call.arity() == 0 ? requireField(DEFAULT_TIMESTAMP) : field(call, 0);
                orders.add(new Sort(field, verb == QueryVerb.OLDEST));
            }
            case LIMIT, TAKE       -> {
                arity(call, 1, 1);
                limit = nonNegative(call, 0);
            }
            case OFFSET, SKIP      -> {
                arity(call, 1, 1);
                offset = nonNegative(call, 0);
            }
            case SELECT            -> {
                selects.clear();
                selects.addAll(fieldList(call));
            }
            case ADD_SELECT        -> selects.addAll(fieldList(call));
            case DISTINCT          -> {
                arity(call, 0, 0);
                distinct = true;
            }
            case GROUP_BY          -> groupBy.addAll(fieldList(call));
            case HAVING            -> having.add(groupCondition(call));
            default                -> throw fail(verb.verb() + "() is not a builder method");
        }
    }

    private void addClause(boolean startsNewGroup, Clause clause) {
        List<Clause> current = groups.get(groups.size() - 1);
        if (startsNewGroup && !current.isEmpty()) {
            List<Clause> group = new ArrayList<>();
            group.add(clause);
            groups.add(group);
        } else {
            current.add(clause);
        }
    }

    private Clause comparison(QueryCall call) {
        arity(call, 2, 3);
        String field = field(call, 0);
        String operator = call.arity() == 2 ? "=" : operator(call, 1, COMPARISON_OPERATORS);
        Object raw = scalar(call.arg(call.arity() - 1));

        if (raw == null) {
            return switch (operator) {
                case "=", "==" -> (cb, root) -> cb.isNull(root.get(field));
                case "!=", "<>" -> (cb, root) -> cb.isNotNull(root.get(field));
                default -> throw fail("Operator '" + operator + "' cannot be used with null");
            };
        }

        if (operator.endsWith("like")) {
            String pattern = String.valueOf(raw);
            boolean negated = operator.startsWith("not");
            return (cb, root) -> {
                Expression<String> text = root.get(field).as(String.class);
                return negated ? cb.notLike(text, pattern) : cb.like(text, pattern);
            };
        }

        Object value = coercer.coerce(raw, fieldType(field), field);
        return switch (operator) {
            case "=", "==" -> (cb, root) -> cb.equal(root.get(field), value);
            case "!=", "<>" -> (cb, root) -> cb.notEqual(root.get(field), value);
            default -> {
                Comparable<?> bound = comparable(field, value);
                yield (cb, root) -> compare(cb, root.get(field), operator, bound);
            }
        };
    }

    private Clause membership(QueryCall call, boolean negated) {
        arity(call, 2, 2);
        String field = field(call, 0);
        List<Object> values = new ArrayList<>();
        for (Object item : list(call, 1)) {
            values.add(coercer.coerce(scalar(item), fieldType(field), field));
        }
        if (values.isEmpty()) {
            return negated ? (cb, root) -> cb.conjunction() : (cb, root) -> cb.disjunction();
        }
        return (cb, root) -> {
            Predicate in = root.get(field).in(values);
            return negated ? in.not() : in;
        };
    }

    private Clause between(QueryCall call, boolean negated) {
        arity(call, 2, 2);
        String field = field(call, 0);
        List<Object> bounds = list(call, 1);
        if (bounds.size() != 2) {
            throw fail(call.verb() + "() expects a list of exactly two bounds");
        }
        Comparable<?> low = comparable(field, coercer.coerce(scalar(bounds.get(0)), fieldType(field), field));
        Comparable<?> high = comparable(field, coercer.coerce(scalar(bounds.get(1)), fieldType(field), field));
        return (cb, root) -> {
            Predicate inRange = range(cb, root.get(field), low, high);
            return negated ? inRange.not() : inRange;
        };
    }

    /** whereDate / whereYear: compares the calendar day or year of a temporal field as a half-open range. */
    private Clause calendarRange(QueryCall call, boolean byYear) {
        arity(call, 2, 3);
        String field = field(call, 0);
        if (!TEMPORAL_TYPES.contains(fieldType(field))) {
            throw fail(call.verb() + "() requires a date or timestamp field, '" + field + "' is "
                    + fieldType(field).getSimpleName());
        }
        String operator = call.arity() == 2 ? "=" : operator(call, 1, COLUMN_OPERATORS);
        Object raw = scalar(call.arg(call.arity() - 1));
        if (raw == null) {
            throw fail(call.verb() + "() requires a value");
        }

        LocalDate start;
        LocalDate end;
        if (byYear) {
            start = LocalDate.of(wholeNumber(raw, call.verb()), 1, 1);
            end = start.plusYears(1);
        } else {
            start = coercer.toLocalDate(raw);
            end = start.plusDays(1);
        }
        Comparable<?> from = comparable(field, coercer.coerce(start, fieldType(field), field));
        Comparable<?> until = comparable(field, coercer.coerce(end, fieldType(field), field));

        return (cb, root) -> {
            Path<Object> path = root.get(field);
            return switch (operator) {
                case "=", "=="  -> cb.and(compare(cb, path, ">=", from), compare(cb, path, "<", until));
                case "!=", "<>" -> cb.or(compare(cb, path, "<", from), compare(cb, path, ">=", until));
                case "<"        -> compare(cb, path, "<", from);
                case "<="       -> compare(cb, path, "<", until);
                case ">"        -> compare(cb, path, ">=", until);
                default         -> compare(cb, path, ">=", from);
            };
        };
    }

    private Clause monthOfYear(QueryCall call) {
        arity(call, 2, 3);
        String field = temporalField(call, TEMPORAL_TYPES);
        String operator = call.arity() == 2 ? "=" : operator(call, 1, COLUMN_OPERATORS);
        Object raw = scalar(call.arg(call.arity() - 1));
        if (raw == null) {
            throw fail(call.verb() + "() requires a value");
        }
        int month;
        if (raw instanceof LocalDate d) {
            month = d.getMonthValue();
        } else if (raw instanceof LocalDateTime dt) {
            month = dt.getMonthValue();
        } else {
            month = wholeNumber(raw, call.verb());
        }
        if (month < 1 || month > 12) {
            throw fail(call.verb() + "() expects a month between 1 and 12, got " + month);
        }
        return (cb, root) -> compareValue(cb, cb.function("month", Integer.class, root.get(field)), operator, month);
    }

    /** Time of day as the database reads it from the stored value. */
    private Clause timeOfDay(QueryCall call) {
        arity(call, 2, 3);
        String field = temporalField(call, TIME_OF_DAY_TYPES);
        String operator = call.arity() == 2 ? "=" : operator(call, 1, COLUMN_OPERATORS);
        Object raw = scalar(call.arg(call.arity() - 1));
        LocalTime time;
        if (raw instanceof LocalDateTime dt) {
            time = dt.toLocalTime().withNano(0);
        } else {
            try {
                time = LocalTime.parse(String.valueOf(raw).strip());
            } catch (DateTimeParseException e) {
                throw fail(call.verb() + "() expects a time such as '14:30' or '14:30:00', got " + describe(raw));
            }
        }
        return (cb, root) -> compareValue(cb, root.get(field).as(LocalTime.class), operator, time);
    }

    /**
     * having(column, [op,] value) over a grouped field or one of
     * count(*), count(field), sum(field), avg(field), min(field), max(field).
     */
    private Clause groupCondition(QueryCall call) {
        arity(call, 2, 3);
        String column = text(call, 0);
        String operator = call.arity() == 2 ? "=" : operator(call, 1, COLUMN_OPERATORS);
        Object raw = scalar(call.arg(call.arity() - 1));
        if (raw == null) {
            throw fail(call.verb() + "() requires a value");
        }

        Matcher aggregate = AGGREGATE.matcher(column);
        if (!aggregate.matches()) {
            String field = requireField(column.strip());
            havingFields.add(field);
            Object value = coercer.coerce(raw, fieldType(field), field);
            return switch (operator) {
                case "=", "==" -> (cb, root) -> cb.equal(root.get(field), value);
                case "!=", "<>" -> (cb, root) -> cb.notEqual(root.get(field), value);
                default -> {
                    Comparable<?> bound = comparable(field, value);
                    yield (cb, root) -> compare(cb, root.get(field), operator, bound);
                }
            };
        }

        String function = aggregate.group(1).toLowerCase(Locale.ROOT);
        String argument = aggregate.group(2);
        if (function.equals("count")) {
            String field = argument.equals("*") ? null : requireField(argument);
            Long bound = (Long) coercer.coerce(raw, Long.class, column);
            return (cb, root) -> compareValue(cb, field == null ? cb.count(root) : cb.count(root.get(field)),
                    operator, bound);
        }

        String field = requireField(argument);
        Class<?> fieldType = fieldType(field);
        if (!Number.class.isAssignableFrom(fieldType)) {
            throw fail(function + "() in having() requires a numeric field, '" + field + "' is "
                    + fieldType.getSimpleName());
        }
        return switch (function) {
            case "avg" -> {
                Double bound = (Double) coercer.coerce(raw, Double.class, column);
                yield (cb, root) -> compareValue(cb, cb.avg(root.<Number>get(field)), operator, bound);
            }
            case "sum" -> sumCondition(field, fieldType, operator, raw, column);
            default -> {
                Comparable<?> bound = comparable(field, coercer.coerce(raw, fieldType, column));
                boolean max = function.equals("max");
                yield (cb, root) -> compareExtreme(cb, root.get(field), max, operator, bound);
            }
        };
    }

    private Clause sumCondition(String field, Class<?> fieldType, String operator, Object raw, String column) {
        if (INTEGRAL_TYPES.contains(fieldType)) {
            Long bound = (Long) coercer.coerce(raw, Long.class, column);
            return (cb, root) -> compareValue(cb, cb.sumAsLong(root.<Integer>get(field)), operator, bound);
        }
        if (fieldType == Double.class || fieldType == Float.class) {
            Double bound = (Double) coercer.coerce(raw, Double.class, column);
            return (cb, root) -> compareValue(cb, cb.sumAsDouble(root.<Float>get(field)), operator, bound);
        }
        BigDecimal bound = (BigDecimal) coercer.coerce(raw, BigDecimal.class, column);
        return (cb, root) -> compareValue(cb, cb.sum(root.<BigDecimal>get(field)), operator, bound);
    }

    private String temporalField(QueryCall call, Set<Class<?>> accepted) {
        String field = field(call, 0);
        if (!accepted.contains(fieldType(field))) {
            throw fail(call.verb() + "() requires a date or timestamp field, '" + field + "' is "
                    + fieldType(field).getSimpleName());
        }
        return field;
    }

    private Clause columnComparison(QueryCall call) {
        arity(call, 2, 3);
        String left = field(call, 0);
        String operator = call.arity() == 2 ? "=" : operator(call, 1, COLUMN_OPERATORS);
        String right = field(call, call.arity() - 1);
        return (cb, root) -> switch (operator) {
            case "=", "=="  -> cb.equal(root.get(left), root.get(right));
            case "!=", "<>" -> cb.notEqual(root.get(left), root.get(right));
            default         -> compareColumns(cb, root.get(left), operator, root.get(right));
        };
    }

    // -------------------------------------------------------------------------
    // Terminal verbs
    // -------------------------------------------------------------------------

    private Object terminal(QueryVerb verb, QueryCall call) {
        switch (verb) {
            case GET -> {
                arity(call, 0, 0);
                return fetchRecords(limit, offset);
            }
            case FIRST -> {
                arity(call, 0, 0);
                return firstRecord();
            }
            case FIND -> {
                arity(call, 1, 1);
                return findById(call.arg(0));
            }
            case FIND_OR_FAIL -> {
                arity(call, 1, 1);
                Object record = findById(call.arg(0));
                if (record == null) {
                    throw fail("No " + type.name() + " found with id " + scalar(call.arg(0)));
                }
                return record;
            }
            case SOLE -> {
                arity(call, 0, 0);
                List<Map<String, Object>> records = fetchRecords(2, offset);
                if (records.isEmpty()) {
                    throw fail("No " + type.name() + " record matches the query");
                }
                if (records.size() > 1) {
                    throw fail("Expected exactly one " + type.name() + " record but found more");
                }
                return records.get(0);
            }
            case PLUCK -> {
                arity(call, 1, 2);
                String valueField = field(call, 0);
                String keyField = call.arity() == 2 ? field(call, 1) : null;
                return pluck(fetchColumns(columnsOf(valueField, keyField), limit, offset), valueField, keyField);
            }
            case VALUE -> {
                arity(call, 1, 1);
                String field = field(call, 0);
                List<Map<String, Object>> rows = fetchColumns(List.of(field), 1, offset);
                return rows.isEmpty() ? null : rows.get(0).get(field);
            }
            case COUNT -> {
                arity(call, 0, 1);
                String field = call.arity() == 0 || "*".equals(call.arg(0)) ? null : field(call, 0);
                return count(field);
            }
            case MAX, MIN -> {
                arity(call, 1, 1);
                return extreme(field(call, 0), verb == QueryVerb.MAX);
            }
            case AVG -> {
                arity(call, 1, 1);
                return average(numericField(call, 0));
            }
            case SUM -> {
                arity(call, 1, 1);
                return sum(numericField(call, 0));
            }
            case EXISTS, DOESNT_EXIST -> {
                arity(call, 0, 0);
                boolean exists = !fetchColumns(List.of(probeColumn()), 1, offset).isEmpty();
                return verb == QueryVerb.EXISTS ? exists : !exists;
            }
            case PAGINATE -> {
                arity(call, 0, 2);
                return paginate(perPage(call), page(call));
            }
            case SIMPLE_PAGINATE -> {
                arity(call, 0, 2);
                return simplePaginate(perPage(call), page(call));
            }
            default -> throw fail(verb.verb() + "() is not a terminal method");
        }
    }

    private Map<String, Object> firstRecord() {
        List<Map<String, Object>> records = fetchRecords(1, offset);
        return records.isEmpty() ? null : records.get(0);
    }

    private Map<String, Object> findById(Object rawId) {
        EntityTypeInfo.Field id = type.idField()
                .orElseThrow(() -> fail(type.name() + " has no identifier attribute"));
        Object value = coercer.coerce(scalar(rawId), id.javaType(), id.name());
        addClause(false, (cb, root) -> cb.equal(root.get(id.name()), value));
        return firstRecord();
    }

    private Map<String, Object> paginate(int perPage, int page) {
        long total = count(null);
        long lastPage = Math.max(1, (total + perPage - 1) / perPage);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("currentPage", page);
        result.put("perPage", perPage);
        result.put("total", total);
        result.put("lastPage", lastPage);
        long skip = (page - 1L) * perPage;
        result.put("data", skip > Integer.MAX_VALUE ? List.of() : fetchRecords(perPage, (int) skip));
        return result;
    }

    private Map<String, Object> simplePaginate(int perPage, int page) {
        long skip = (page - 1L) * perPage;
        List<Map<String, Object>> records = skip > Integer.MAX_VALUE
                ? List.of()
                : fetchRecords(perPage == Integer.MAX_VALUE ? perPage : perPage + 1, (int) skip);
        boolean more = records.size() > perPage;
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("currentPage", page);
        result.put("perPage", perPage);
        result.put("hasMorePages", more);
        result.put("data", more ? new ArrayList<>(records.subList(0, perPage)) : records);
        return result;
    }

    // -------------------------------------------------------------------------
    // Result verbs
    // -------------------------------------------------------------------------

    private Object applyToResult(QueryVerb verb, QueryCall call, Object value) {
        switch (verb) {
            case TO_ARRAY -> {
                arity(call, 0, 0);
                return value;
            }
            case TO_JSON -> {
                arity(call, 0, 0);
                try {
                    return objectMapper.writeValueAsString(value);
                } catch (JsonProcessingException e) {
                    throw new CommandException(CommandException.Kind.EXECUTION_ERROR,
                            "Result cannot be rendered as JSON: " + e.getOriginalMessage(), e);
                }
            }
            case FIRST -> {
                arity(call, 0, 0);
                List<?> items = listResult(verb, value);
                return items.isEmpty() ? null : items.get(0);
            }
            case COUNT -> {
                arity(call, 0, 0);
                if (value instanceof Map<?, ?> map) return (long) map.size();
                return (long) listResult(verb, value).size();
            }
            case TAKE -> {
                arity(call, 1, 1);
                List<?> items = listResult(verb, value);
                int n = nonNegative(call, 0);
                return new ArrayList<>(items.subList(0, Math.min(n, items.size())));
            }
            case PLUCK -> {
                arity(call, 1, 2);
                List<Map<String, Object>> records = new ArrayList<>();
                for (Object item : listResult(verb, value)) {
                    if (!(item instanceof Map<?, ?> record)) {
                        throw fail("pluck() requires a list of records");
                    }
                    Map<String, Object> copy = new LinkedHashMap<>();
                    record.forEach((k, v) -> copy.put(String.valueOf(k), v));
                    records.add(copy);
                }
                String valueField = text(call, 0);
                String keyField = call.arity() == 2 ? text(call, 1) : null;
                for (Map<String, Object> record : records) {
                    if (!record.containsKey(valueField) || (keyField != null && !record.containsKey(keyField))) {
                        throw fail("Field '" + (record.containsKey(valueField) ? keyField : valueField)
                                + "' is not part of the result");
                    }
                }
                return pluck(records, valueField, keyField);
            }
            default -> throw fail(verb.verb() + "() cannot be applied to a fetched result");
        }
    }

    private static Object pluck(List<Map<String, Object>> rows, String valueField, String keyField) {
        if (keyField == null) {
            List<Object> values = new ArrayList<>(rows.size());
            rows.forEach(row -> values.add(row.get(valueField)));
            return values;
        }
        Map<Object, Object> keyed = new LinkedHashMap<>();
        rows.forEach(row -> keyed.put(row.get(keyField), row.get(valueField)));
        return keyed;
    }

    private List<?> listResult(QueryVerb verb, Object value) {
        if (value instanceof List<?> items) return items;
        throw fail(verb.verb() + "() requires a list result, got " + describe(value));
    }

    // -------------------------------------------------------------------------
    // Query construction
    // -------------------------------------------------------------------------

    private List<Map<String, Object>> fetchRecords(Integer maxResults, Integer firstResult) {
        return fetchColumns(recordColumns(), maxResults, firstResult);
    }

    private List<String> recordColumns() {
        if (!selects.isEmpty()) {
            if (!groupBy.isEmpty() && !groupBy.containsAll(selects)) {
                throw fail("Selected fields must all appear in groupBy()");
            }
            return List.copyOf(selects);
        }
        return groupBy.isEmpty() ? type.fieldNames() : List.copyOf(groupBy);
    }

    private List<Map<String, Object>> fetchColumns(List<String> columns, Integer maxResults, Integer firstResult) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<?> root = query.from(type.javaType());

        List<Selection<?>> selections = new ArrayList<>();
        for (String column : columns) {
            selections.add(root.get(column).alias(column));
        }
        query.multiselect(selections);
        restrict(cb, query, root);
        if (!groupBy.isEmpty()) {
            List<Expression<?>> grouping = new ArrayList<>();
            groupBy.forEach(name -> grouping.add(root.get(name)));
            query.groupBy(grouping);
        }
        if (!having.isEmpty()) {
            if (!groupBy.containsAll(havingFields)) {
                throw fail("Fields used in having() must appear in groupBy()");
            }
            query.having(cb.and(having.stream().map(c -> c.toPredicate(cb, root)).toArray(Predicate[]::new)));
        }
        if (!orders.isEmpty()) {
            List<Order> order = new ArrayList<>();
            for (Sort sort : orders) {
                order.add(sort.ascending() ? cb.asc(root.get(sort.field())) : cb.desc(root.get(sort.field())));
            }
            query.orderBy(order);
        }
        query.distinct(distinct);

        var typed = entityManager.createQuery(query);
        window(typed, maxResults, firstResult);

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Tuple tuple : typed.getResultList()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : columns) {
                row.put(column, tuple.get(column));
            }
            rows.add(row);
        }
        return rows;
    }

    private long count(String field) {
        if (!groupBy.isEmpty()) {
            throw fail("count() cannot be combined with groupBy(); use get() and count the result");
        }
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<?> root = query.from(type.javaType());
        Expression<?> counted = field == null ? root : root.get(field);
        query.select(distinct ? cb.countDistinct(counted) : cb.count(counted));
        restrict(cb, query, root);
        Long total = timed(entityManager.createQuery(query)).getSingleResult();
        return total == null ? 0L : total;
    }

    private <Y extends Comparable<? super Y>> Object extreme(String field, boolean max) {
        comparable(field, null);
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Object> query = cb.createQuery(Object.class);
        Root<?> root = query.from(type.javaType());
        Expression<Y> path = root.get(field);
        query.select(max ? cb.greatest(path) : cb.least(path));
        restrict(cb, query, root);
        return timed(entityManager.createQuery(query)).getSingleResult();
    }

    private Object average(String field) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Double> query = cb.createQuery(Double.class);
        Root<?> root = query.from(type.javaType());
        query.select(cb.avg(root.<Number>get(field)));
        restrict(cb, query, root);
        return timed(entityManager.createQuery(query)).getSingleResult();
    }

    private Object sum(String field) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Number> query = cb.createQuery(Number.class);
        Root<?> root = query.from(type.javaType());
        query.select(cb.sum(root.<Number>get(field)));
        restrict(cb, query, root);
        return timed(entityManager.createQuery(query)).getSingleResult();
    }

    private void restrict(CriteriaBuilder cb, CriteriaQuery<?> query, Root<?> root) {
        if (!having.isEmpty() && groupBy.isEmpty()) {
            throw fail("having() requires groupBy()");
        }
        List<Predicate> alternatives = new ArrayList<>();
        for (List<Clause> group : groups) {
            if (group.isEmpty()) continue;
            Predicate[] conjuncts = group.stream().map(c -> c.toPredicate(cb, root)).toArray(Predicate[]::new);
            alternatives.add(conjuncts.length == 1 ? conjuncts[0] : cb.and(conjuncts));
        }
        if (alternatives.size() == 1) {
            query.where(alternatives.get(0));
        } else if (!alternatives.isEmpty()) {
            query.where(cb.or(alternatives.toArray(Predicate[]::new)));
        }
    }

    private void window(Query query, Integer maxResults, Integer firstResult) {
        if (maxResults != null) query.setMaxResults(maxResults);
        if (firstResult != null) query.setFirstResult(firstResult);
        timed(query);
    }

    private <Q extends Query> Q timed(Q query) {
        if (timeoutMillis != null) {
            query.setHint(TIMEOUT_HINT, timeoutMillis);
        }
        return query;
    }

    /** Any of the column operators against a bound value. */
    private static <Y extends Comparable<? super Y>> Predicate compareValue(CriteriaBuilder cb, Expression<? extends Y> x,
                                                                            String operator, Y value) {
        return switch (operator) {
            case "=", "=="  -> cb.equal(x, value);
            case "!=", "<>" -> cb.notEqual(x, value);
            case "<"        -> cb.lessThan(x, value);
            case "<="       -> cb.lessThanOrEqualTo(x, value);
            case ">"        -> cb.greaterThan(x, value);
            default         -> cb.greaterThanOrEqualTo(x, value);
        };
    }

    // field types are checked by comparable() before these casts
    @SuppressWarnings("unchecked")
    private static <Y extends Comparable<? super Y>> Predicate compare(CriteriaBuilder cb, Expression<?> path,
                                                                       String operator, Comparable<?> bound) {
        return compareValue(cb, (Expression<Y>) path, operator, (Y) bound);
    }

    @SuppressWarnings("unchecked")
    private static <Y extends Comparable<? super Y>> Predicate compareExtreme(CriteriaBuilder cb, Expression<?> path,
                                                                              boolean max, String operator,
                                                                              Comparable<?> bound) {
        Expression<Y> typed = (Expression<Y>) path;
        return compareValue(cb, max ? cb.greatest(typed) : cb.least(typed), operator, (Y) bound);
    }

    @SuppressWarnings("unchecked")
    private static <Y extends Comparable<? super Y>> Predicate compareColumns(CriteriaBuilder cb, Expression<?> leftPath,
                                                                              String operator, Expression<?> rightPath) {
        Expression<Y> left = (Expression<Y>) leftPath;
        Expression<Y> right = (Expression<Y>) rightPath;
        return switch (operator) {
            case "<"  -> cb.lessThan(left, right);
            case "<=" -> cb.lessThanOrEqualTo(left, right);
            case ">"  -> cb.greaterThan(left, right);
            default   -> cb.greaterThanOrEqualTo(left, right);
        };
    }

    @SuppressWarnings("unchecked")
    private static <Y extends Comparable<? super Y>> Predicate range(CriteriaBuilder cb, Expression<?> path,
                                                                     Comparable<?> low, Comparable<?> high) {
        return cb.between((Expression<Y>) path, (Y) low, (Y) high);
    }

    // -------------------------------------------------------------------------
    // Argument handling
    // -------------------------------------------------------------------------

    private static void arity(QueryCall call, int min, int max) {
        if (call.arity() < min || call.arity() > max) {
            String expected = min == max ? String.valueOf(min) : min + " to " + max;
            throw fail(call.verb() + "() expects " + expected + " argument(s), got " + call.arity());
        }
    }

    /** Resolves helper calls such as {@code now()}; lists are rejected. */
    private Object scalar(Object arg) {
        if (arg instanceof QueryCall helper) {
            if (helper.arity() != 0) {
                throw fail(helper.verb() + "() takes no arguments");
            }
            QueryVerb verb = QueryVerb.lookup(helper.verb()).orElse(null);
            if (verb == QueryVerb.TODAY) return LocalDate.now(clock);
            if (verb == QueryVerb.NOW)   return LocalDateTime.now(clock);
            throw fail(helper.verb() + "() cannot be used as an argument");
        }
        if (arg instanceof List<?>) {
            throw fail("A list is not allowed here");
        }
        return arg;
    }

    private String field(QueryCall call, int index) {
        return requireField(text(call, index));
    }

    private String requireField(String name) {
        if (type.field(name).isEmpty()) {
            throw fail("Unknown field '" + name + "' on " + type.name()
                    + ". Available fields: " + String.join(", ", type.fieldNames()));
        }
        return name;
    }

    private Class<?> fieldType(String field) {
        return type.field(field).map(EntityTypeInfo.Field::javaType).map(QueryInterpreter::boxed)
                .orElseThrow(() -> fail("Unknown field '" + field + "'"));
    }

    private String numericField(QueryCall call, int index) {
        String field = field(call, index);
        if (!Number.class.isAssignableFrom(fieldType(field))) {
            throw fail(call.verb() + "() requires a numeric field, '" + field + "' is "
                    + fieldType(field).getSimpleName());
        }
        return field;
    }

    private Comparable<?> comparable(String field, Object value) {
        if (!Comparable.class.isAssignableFrom(fieldType(field))) {
            throw fail("Field '" + field + "' cannot be compared by order");
        }
        return (Comparable<?>) value;
    }

    private List<String> fieldList(QueryCall call) {
        List<Object> raw = call.arity() == 1 && call.arg(0) instanceof List<?> ? list(call, 0) : call.args();
        if (raw.isEmpty()) {
            throw fail(call.verb() + "() expects at least one field");
        }
        List<String> fields = new ArrayList<>();
        for (Object item : raw) {
            if (!(item instanceof String name)) {
                throw fail(call.verb() + "() expects field names, got " + describe(item));
            }
            fields.add(requireField(name));
        }
        return fields;
    }

    private static String text(QueryCall call, int index) {
        if (call.arg(index) instanceof String s) return s;
        throw fail(call.verb() + "() expects a string at argument " + (index + 1) + ", got " + describe(call.arg(index)));
    }

    private static String operator(QueryCall call, int index, Set<String> allowed) {
        String operator = text(call, index).strip().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        if (!allowed.contains(operator)) {
            throw fail("Unsupported operator '" + text(call, index) + "' in " + call.verb() + "()");
        }
        return operator;
    }

    private static boolean ascending(String direction) {
        return switch (direction.strip().toLowerCase(Locale.ROOT)) {
            case "asc"  -> true;
            case "desc" -> false;
            default -> throw fail("Sort direction must be 'asc' or 'desc', got '" + direction + "'");
        };
    }

    @SuppressWarnings("unchecked")
    private static List<Object> list(QueryCall call, int index) {
        if (call.arg(index) instanceof List<?> items) return (List<Object>) items;
        throw fail(call.verb() + "() expects a list at argument " + (index + 1) + ", got " + describe(call.arg(index)));
    }

    private static int nonNegative(QueryCall call, int index) {
        int n = wholeNumber(call.arg(index), call.verb());
        if (n < 0) {
            throw fail(call.verb() + "() expects a non-negative number, got " + n);
        }
        return n;
    }

    private static int wholeNumber(Object value, String verb) {
        try {
            BigDecimal n = value instanceof Number num ? new BigDecimal(num.toString())
                    : new BigDecimal(String.valueOf(value).strip());
            return n.intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw fail(verb + "() expects a whole number, got " + describe(value));
        }
    }

    private static int perPage(QueryCall call) {
        if (call.arity() < 1 || call.arg(0) == null) return DEFAULT_PER_PAGE;
        int perPage = wholeNumber(call.arg(0), call.verb());
        if (perPage < 1) throw fail(call.verb() + "() expects a positive page size");
        return perPage;
    }

    private static int page(QueryCall call) {
        if (call.arity() < 2 || call.arg(1) == null) return 1;
        int page = wholeNumber(call.arg(1), call.verb());
        if (page < 1) throw fail(call.verb() + "() expects a page number of at least 1");
        return page;
    }

    private String probeColumn() {
        return type.idField().map(EntityTypeInfo.Field::name).orElseGet(() -> type.fieldNames().get(0));
    }

    private static List<String> columnsOf(String valueField, String keyField) {
        return keyField == null || keyField.equals(valueField) ? List.of(valueField) : List.of(valueField, keyField);
    }

    private static Class<?> boxed(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class)     return Integer.class;
        if (type == long.class)    return Long.class;
        if (type == boolean.class) return Boolean.class;
        if (type == double.class)  return Double.class;
        if (type == float.class)   return Float.class;
        if (type == short.class)   return Short.class;
        if (type == byte.class)    return Byte.class;
        return Character.class;
    }

    private static String describe(Object value) {
        if (value == null) return "null";
        if (value instanceof String s) return "'" + s + "'";
        if (value instanceof QueryCall c) return c.verb() + "()";
        return value.toString();
    }

    private static CommandException fail(String message) {
        return new CommandException(CommandException.Kind.EXECUTION_ERROR, message);
    }
}
