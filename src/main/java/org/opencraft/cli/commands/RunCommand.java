package org.opencraft.cli.commands;

import org.opencraft.bootstrap.BootstrapException;
import org.opencraft.cli.CommandLineInterface;
import org.opencraft.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts Opencraft in the role selected by the configuration."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Mixin
    private BootstrapOptions options;

    @Override
    public Integer call() {
        final Node node;
        try {
            node = new Node(options.applyTo(parent.getConfig()));
            node.start();
        } catch (final BootstrapException e) {
            LOGGER.error("Startup aborted: {}", e.getMessage(), e);
            return 1;
        }

        // Keep the main thread alive to prevent the application from exiting.
        // The shutdown hook in the Node class will handle termination.
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.info("Node stopped gracefully.");
        }

        return 0;
    }
}
