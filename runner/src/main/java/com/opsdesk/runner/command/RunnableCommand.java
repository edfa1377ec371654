package com.opsdesk.runner.command;

import java.util.Map;

/**
 * Every operation an operator can run from the console is registered as a
 * RunnableCommand.
 *
 * A command is a pre-vetted, risk-classified execution unit with a
 * declarative option schema. Decoupling <em>what</em> it does from the
 * console lets the runner enforce confirmation and environment policy, and
 * collect timing, uniformly for every command.
 *
 * <p>Implementations usually extend {@link AbstractCommand}, which supplies
 * the schema validation pass.
 */
public interface RunnableCommand {

    /** Identity, presentation metadata, risk and option schema. */
    CommandDescriptor descriptor();

    /**
     * Check the submitted options before execution.
     *
     * @throws CommandException describing the first problem found
     */
    void validate(Map<String, Object> options);

    /**
     * Run the command. Callers validate first; implementations must not
     * assume the validation happened in the same request and re-check
     * anything safety-relevant.
     */
    CommandResult execute(Map<String, Object> options, CommandExecutionContext ctx);
}
