package com.opsdesk.runner.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdesk.runner.command.CommandException;
import com.opsdesk.runner.config.RunnerProperties;
import jakarta.persistence.EntityManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Runs a read-only query expression against one entity type.
 *
 * <p>The expression is validated again on every call; a rejected expression
 * throws {@link QueryRejectedException} and nothing is evaluated. Anything
 * that goes wrong after validation (unknown entity type, type mismatch,
 * database error) is returned as a failed {@link ExecutionOutcome} with the
 * elapsed time up to the failure.
 *
 * <p>Evaluation runs in a read-only transaction and every JPA query carries
 * the configured maximum execution time as its timeout.
 */
@Component
public class QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    private final EntityManager entityManager;
    private final EntityTypeResolver entityTypes;
    private final TransactionTemplate readOnlyTx;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Integer timeoutMillis;

    public QueryExecutor(EntityManager entityManager,
                         EntityTypeResolver entityTypes,
                         PlatformTransactionManager transactionManager,
                         ObjectMapper objectMapper,
                         Clock clock,
                         RunnerProperties properties) {
        this.entityManager = entityManager;
        this.entityTypes = entityTypes;
        this.objectMapper = objectMapper;
        this.clock = clock;

        this.readOnlyTx = new TransactionTemplate(transactionManager);
        this.readOnlyTx.setReadOnly(true);
        Duration maxExecutionTime = properties.getMaxExecutionTime();
        if (maxExecutionTime != null && !maxExecutionTime.isZero() && !maxExecutionTime.isNegative()) {
            this.readOnlyTx.setTimeout((int) Math.max(1, maxExecutionTime.toSeconds()));
            this.timeoutMillis = (int) Math.min(Integer.MAX_VALUE, maxExecutionTime.toMillis());
        } else {
            this.timeoutMillis = null;
        }
    }

    /** Per-query timeout in milliseconds, or null when none is configured. */
    Integer timeoutMillis() {
        return timeoutMillis;
    }

    /**
     * @param entityTypeHandle fully qualified or simple entity class name
     * @param expression       the query chain, e.g. {@code where('age', '>', 18)->get()}
     * @throws QueryRejectedException if the expression fails validation
     */
    public ExecutionOutcome run(String entityTypeHandle, String expression) {
        QueryChain chain = QueryValidator.validate(expression);

        long start = System.nanoTime();
        try {
            EntityTypeInfo type = entityTypes.resolve(entityTypeHandle)
                    .orElseThrow(() -> new CommandException(CommandException.Kind.UNKNOWN_ENTITY_TYPE,
                            "Entity type '" + entityTypeHandle + "' is not a known entity"));

            Object value = readOnlyTx.execute(status ->
                    new QueryInterpreter(entityManager, type, clock, objectMapper, timeoutMillis).run(chain));

            double elapsed = elapsedSince(start);
            log.info("Query on {} completed in {}s", type.name(), elapsed);
            return ExecutionOutcome.success(value, elapsed);

        } catch (CommandException e) {
            double elapsed = elapsedSince(start);
            log.warn("Query on {} failed after {}s: {}", entityTypeHandle, elapsed, e.getDetail());
            return ExecutionOutcome.failure(e.getDetail(), elapsed);

        } catch (RuntimeException e) {
            double elapsed = elapsedSince(start);
            log.warn("Query on {} failed after {}s", entityTypeHandle, elapsed, e);
            return ExecutionOutcome.failure("Query execution failed: " + rootMessage(e), elapsed);
        }
    }

    static double elapsedSince(long startNanos) {
        return Math.round((System.nanoTime() - startNanos) / 1_000_000.0) / 1000.0;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
