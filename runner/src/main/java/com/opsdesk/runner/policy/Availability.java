package com.opsdesk.runner.policy;

/**
 * How a command may be used in the current environment.
 *
 * AVAILABLE  - eligible: listed, and runnable under the normal confirmation rule.
 * RESTRICTED - risk not allowed here; left out of the eligible catalog and
 *              runnable only with an explicit confirmation.
 * DISABLED   - risk not allowed and the environment disables such commands
 *              outright; hidden and never runnable.
 */
public enum Availability {
    AVAILABLE,
    RESTRICTED,
    DISABLED;

    public boolean eligible() {
        return this == AVAILABLE;
    }
}
