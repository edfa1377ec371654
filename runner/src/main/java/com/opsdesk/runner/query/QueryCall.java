package com.opsdesk.runner.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One {@code verb(args...)} invocation of a query chain.
 *
 * Arguments are already literal values: {@code String}, {@code Long},
 * {@code BigDecimal}, {@code Boolean}, {@code null}, {@code List} of
 * arguments, or a nested {@link QueryCall} for helpers such as
 * {@code today()}.
 *
 * @param verb     verb as written by the operator
 * @param args     parsed arguments, in order
 * @param position offset of the verb in the source expression
 */
public record QueryCall(String verb, List<Object> args, int position) {

    public QueryCall {
        // List.copyOf rejects null elements, and null is a legal argument.
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public int arity() {
        return args.size();
    }

    public Object arg(int index) {
        return args.get(index);
    }
}
