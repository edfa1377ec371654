package com.opsdesk.runner.query;

/**
 * Outcome of one validation call. Produced fresh per call; never cached.
 *
 * @param accepted        the expression may be evaluated
 * @param rejectedVerb    lower-cased verb that is not on the allowlist, if any
 * @param rejectedPattern denylist pattern that matched, if any
 * @param message         operator-facing explanation; null when accepted
 */
public record QueryValidationResult(
        boolean accepted,
        String  rejectedVerb,
        String  rejectedPattern,
        String  message) {

    public static QueryValidationResult accept() {
        return new QueryValidationResult(true, null, null, null);
    }

    public static QueryValidationResult disallowedVerb(String verb) {
        return new QueryValidationResult(false, verb, null,
                "Method '" + verb + "' is not allowed. Only read-only query methods are permitted.");
    }

    public static QueryValidationResult disallowedPattern(String pattern) {
        return new QueryValidationResult(false, null, pattern,
                "Query contains disallowed operations. Only SELECT-type queries are allowed.");
    }

    public static QueryValidationResult unparsable(String reason) {
        return new QueryValidationResult(false, null, null, "Query could not be parsed: " + reason);
    }

    public boolean isParseFailure() {
        return !accepted && rejectedVerb == null && rejectedPattern == null;
    }
}
