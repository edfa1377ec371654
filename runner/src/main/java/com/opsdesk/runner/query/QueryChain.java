package com.opsdesk.runner.query;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed query: the ordered calls of a {@code a(...)->b(...)->c(...)} chain.
 * This exact structure is what passes validation and what the interpreter
 * runs.
 */
public record QueryChain(List<QueryCall> calls) {

    public QueryChain {
        calls = List.copyOf(calls);
    }

    public boolean isEmpty() {
        return calls.isEmpty();
    }

    /**
     * Every invocation in order of appearance, including helper calls nested
     * in arguments and lists.
     */
    public List<QueryCall> allCalls() {
        List<QueryCall> out = new ArrayList<>();
        for (QueryCall call : calls) collect(call, out);
        return out;
    }

    private static void collect(QueryCall call, List<QueryCall> out) {
        out.add(call);
        for (Object arg : call.args()) collectArg(arg, out);
    }

    private static void collectArg(Object arg, List<QueryCall> out) {
        if (arg instanceof QueryCall nested) {
            collect(nested, out);
        } else if (arg instanceof List<?> list) {
            for (Object element : list) collectArg(element, out);
        }
    }
}
