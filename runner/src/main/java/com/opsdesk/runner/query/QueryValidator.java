package com.opsdesk.runner.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether an untrusted query expression may be evaluated.
 *
 * Two passes, both must accept:
 * <ol>
 *   <li><b>Allowlist</b> - the expression is parsed with {@link QueryParser};
 *       every invocation in it, including helpers nested in arguments, must
 *       be a {@link QueryVerb}. The first verb that is not (in order of
 *       appearance) rejects the expression. An expression that cannot be
 *       parsed is rejected too.</li>
 *   <li><b>Denylist</b> - the raw text is scanned for patterns that signal
 *       writes, schema changes, raw statements, reflection or process
 *       execution. Any match rejects the expression, even when every verb is
 *       allowlisted (the pattern may sit inside a string literal or in text
 *       the grammar never sees as a call).</li>
 * </ol>
 * Pure and stateless; the same expression always yields the same result and
 * nothing is cached, so callers re-validate on every execution attempt.
 */
public final class QueryValidator {

    private static final Logger log = LoggerFactory.getLogger(QueryValidator.class);

    private static final List<Pattern> DENYLIST = compile(
            "save\\s*\\(",
            "create\\s*\\(",
            "update\\s*\\(",
            "delete\\s*\\(",
            "destroy\\s*\\(",
            "forceDelete\\s*\\(",
            "insert\\s*\\(",
            "truncate\\s*\\(",
            "exec\\s*\\(",
            "query\\s*\\(",
            "statement\\s*\\(",
            "dropIfExists\\s*\\(",
            "drop\\s*\\(",
            "alter\\s*\\(",
            "merge\\s*\\(",
            "persist\\s*\\(",
            "remove\\s*\\(",
            "flush\\s*\\(",
            "schema\\s*::",
            "DB\\s*::",
            "\\$_",
            "\\$\\{",
            "eval\\s*\\(",
            "assert\\s*\\(",
            "system\\s*\\(",
            "passthru\\s*\\(",
            "shell_exec\\s*\\(",
            "proc_open\\s*\\(",
            "runtime\\s*\\.",
            "processBuilder",
            "class\\s*\\.\\s*forName",
            "getClass\\s*\\(",
            "nativeQuery");

    private QueryValidator() {}

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    /** Run both passes and report the outcome. Never throws. */
    public static QueryValidationResult check(String expression) {
        QueryChain chain;
        try {
            chain = QueryParser.parse(expression);
        } catch (QuerySyntaxException e) {
            // Unparsable text may still carry a recognisable threat; name it if so.
            return deniedPattern(expression)
                    .map(QueryValidationResult::disallowedPattern)
                    .orElseGet(() -> QueryValidationResult.unparsable(e.getMessage()));
        }
        return check(expression, chain);
    }

    /**
     * Validate and return the parsed chain that was validated, which is the
     * structure the interpreter must run.
     *
     * @throws QueryRejectedException if either pass rejects the expression
     */
    public static QueryChain validate(String expression) {
        QueryChain chain;
        try {
            chain = QueryParser.parse(expression);
        } catch (QuerySyntaxException e) {
            throw rejected(expression, check(expression));
        }
        QueryValidationResult result = check(expression, chain);
        if (!result.accepted()) {
            throw rejected(expression, result);
        }
        return chain;
    }

    private static QueryValidationResult check(String expression, QueryChain chain) {
        for (QueryCall call : chain.allCalls()) {
            if (!QueryVerb.isAllowed(call.verb())) {
                return QueryValidationResult.disallowedVerb(call.verb().toLowerCase(Locale.ROOT));
            }
        }
        return deniedPattern(expression)
                .map(QueryValidationResult::disallowedPattern)
                .orElseGet(QueryValidationResult::accept);
    }

    private static Optional<String> deniedPattern(String expression) {
        if (expression == null) return Optional.empty();
        for (Pattern pattern : DENYLIST) {
            if (pattern.matcher(expression).find()) {
                return Optional.of(pattern.pattern());
            }
        }
        return Optional.empty();
    }

    private static QueryRejectedException rejected(String expression, QueryValidationResult result) {
        log.warn("Rejected query (verb={}, pattern={}): {}",
                result.rejectedVerb(), result.rejectedPattern(), abbreviate(expression));
        return new QueryRejectedException(result);
    }

    private static String abbreviate(String expression) {
        if (expression == null) return "null";
        return expression.length() <= 200 ? expression : expression.substring(0, 200) + "...";
    }
}
