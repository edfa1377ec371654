package com.opsdesk.runner.audit;

/**
 * Receives one record per execution attempt.
 *
 * Implementations must not throw: a failing audit write is logged and the
 * request it describes still completes.
 */
public interface AuditSink {

    void record(ExecutionAudit audit);
}
