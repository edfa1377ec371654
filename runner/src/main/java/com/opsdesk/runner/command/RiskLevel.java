package com.opsdesk.runner.command;

/**
 * Risk classification of a registered command.
 *
 * LOW    - read-only or otherwise safe operations.
 * MEDIUM - may modify data, but the change is usually reversible.
 * HIGH   - critical operations that can lose data or take the system down.
 *
 * Anything above LOW always requires operator confirmation.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
