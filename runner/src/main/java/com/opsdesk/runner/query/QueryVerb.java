package com.opsdesk.runner.query;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The read-only verb allowlist. A verb is accepted by the validator if and
 * only if it is listed here, and every listed verb is implemented by
 * {@link QueryInterpreter}; nothing else can run.
 *
 * Matching is case-insensitive.
 */
public enum QueryVerb {

    // filters
    WHERE("where", Stage.BUILDER),
    OR_WHERE("orWhere", Stage.BUILDER),
    WHERE_IN("whereIn", Stage.BUILDER),
    WHERE_NOT_IN("whereNotIn", Stage.BUILDER),
    WHERE_BETWEEN("whereBetween", Stage.BUILDER),
    WHERE_NOT_BETWEEN("whereNotBetween", Stage.BUILDER),
    WHERE_NULL("whereNull", Stage.BUILDER),
    WHERE_NOT_NULL("whereNotNull", Stage.BUILDER),
    WHERE_DATE("whereDate", Stage.BUILDER),
    WHERE_YEAR("whereYear", Stage.BUILDER),
    WHERE_MONTH("whereMonth", Stage.BUILDER),
    WHERE_TIME("whereTime", Stage.BUILDER),
    WHERE_COLUMN("whereColumn", Stage.BUILDER),

    // ordering
    ORDER_BY("orderBy", Stage.BUILDER),
    ORDER_BY_DESC("orderByDesc", Stage.BUILDER),
    LATEST("latest", Stage.BUILDER),
    OLDEST("oldest", Stage.BUILDER),

    // limiting; take also trims an already fetched list
    LIMIT("limit", Stage.BUILDER),
    TAKE("take", Stage.BUILDER, true),
    OFFSET("offset", Stage.BUILDER),
    SKIP("skip", Stage.BUILDER),

    // selection
    SELECT("select", Stage.BUILDER),
    ADD_SELECT("addSelect", Stage.BUILDER),
    DISTINCT("distinct", Stage.BUILDER),
    GROUP_BY("groupBy", Stage.BUILDER),
    HAVING("having", Stage.BUILDER),

    // terminals; pluck, first and count also apply to fetched results
    GET("get", Stage.TERMINAL),
    FIRST("first", Stage.TERMINAL, true),
    FIND("find", Stage.TERMINAL),
    FIND_OR_FAIL("findOrFail", Stage.TERMINAL),
    SOLE("sole", Stage.TERMINAL),
    PLUCK("pluck", Stage.TERMINAL, true),
    VALUE("value", Stage.TERMINAL),
    COUNT("count", Stage.TERMINAL, true),
    MAX("max", Stage.TERMINAL),
    MIN("min", Stage.TERMINAL),
    AVG("avg", Stage.TERMINAL),
    SUM("sum", Stage.TERMINAL),
    EXISTS("exists", Stage.TERMINAL),
    DOESNT_EXIST("doesntExist", Stage.TERMINAL),
    PAGINATE("paginate", Stage.TERMINAL),
    SIMPLE_PAGINATE("simplePaginate", Stage.TERMINAL),

    // result conversion; before a terminal they imply get()
    TO_ARRAY("toArray", Stage.RESULT, true),
    TO_JSON("toJson", Stage.RESULT, true),

    // argument helpers
    TODAY("today", Stage.HELPER),
    NOW("now", Stage.HELPER);

    /** Where in a chain a verb belongs. */
    public enum Stage { BUILDER, TERMINAL, RESULT, HELPER }

    private static final Map<String, QueryVerb> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(v -> v.verb.toLowerCase(Locale.ROOT), Function.identity()));

    private final String verb;
    private final Stage stage;
    private final boolean appliesToResult;

    QueryVerb(String verb, Stage stage) {
        this(verb, stage, false);
    }

    QueryVerb(String verb, Stage stage, boolean appliesToResult) {
        this.verb = verb;
        this.stage = stage;
        this.appliesToResult = appliesToResult;
    }

    public String verb()              { return verb; }
    public Stage stage()              { return stage; }

    /** Whether the verb may follow a terminal and operate on its result. */
    public boolean appliesToResult()  { return appliesToResult; }

    public static Optional<QueryVerb> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(BY_NAME.get(name.toLowerCase(Locale.ROOT)));
    }

    public static boolean isAllowed(String name) {
        return lookup(name).isPresent();
    }
}
