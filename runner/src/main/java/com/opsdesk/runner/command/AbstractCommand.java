package com.opsdesk.runner.command;

import com.opsdesk.runner.command.option.OptionValidator;

import java.util.Map;

/**
 * Base class for concrete commands.
 *
 * Subclasses that need domain checks override {@link #validate} and call
 * {@code super.validate(options)} first, so the schema pass always runs
 * before anything command-specific.
 */
public abstract class AbstractCommand implements RunnableCommand {

    private final CommandDescriptor descriptor;

    protected AbstractCommand(CommandDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    @Override
    public CommandDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public void validate(Map<String, Object> options) {
        OptionValidator.validate(options, descriptor.options());
    }
}
