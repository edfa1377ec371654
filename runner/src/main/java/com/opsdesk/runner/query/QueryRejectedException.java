package com.opsdesk.runner.query;

import com.opsdesk.runner.command.CommandException;

/**
 * The sandboxed validator refused an expression. Raised before any
 * evaluation is attempted.
 */
public class QueryRejectedException extends CommandException {

    private final QueryValidationResult result;

    public QueryRejectedException(QueryValidationResult result) {
        super(kindOf(result), result.message());
        this.result = result;
    }

    public QueryValidationResult getResult() { return result; }

    private static Kind kindOf(QueryValidationResult result) {
        if (result.rejectedVerb() != null)    return Kind.DISALLOWED_VERB;
        if (result.rejectedPattern() != null) return Kind.DISALLOWED_PATTERN;
        return Kind.PARSE_ERROR;
    }
}
