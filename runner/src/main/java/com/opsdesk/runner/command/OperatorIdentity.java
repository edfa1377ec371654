package com.opsdesk.runner.command;

/**
 * Who asked for an execution. Captured into the audit log.
 *
 * @param id    operator id from the host application, null when unknown
 * @param name  display name; "CLI" when the request carries no identity
 * @param email optional contact address
 */
public record OperatorIdentity(String id, String name, String email) {

    public static final OperatorIdentity ANONYMOUS = new OperatorIdentity(null, "CLI", null);

    public OperatorIdentity {
        if (name == null || name.isBlank()) name = "CLI";
    }
}
