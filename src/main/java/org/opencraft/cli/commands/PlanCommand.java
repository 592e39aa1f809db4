package org.opencraft.cli.commands;

import org.opencraft.bootstrap.BootstrapException;
import org.opencraft.bootstrap.catalog.SystemCatalogEntry;
import org.opencraft.bootstrap.world.World;
import org.opencraft.cli.CommandLineInterface;
import org.opencraft.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "plan",
    description = "Prints the worlds and systems the configuration would create, without starting them."
)
public class PlanCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlanCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Mixin
    private BootstrapOptions options;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final Node node;
        try {
            node = new Node(options.applyTo(parent.getConfig()));
            node.initialize();
        } catch (final BootstrapException e) {
            LOGGER.error("Startup aborted: {}", e.getMessage(), e);
            return 1;
        }

        final PrintWriter out = spec.commandLine().getOut();
        final World defaultWorld = node.getContext().getDefaultWorld().orElse(null);
        for (final World world : node.getContext().getRegistry().getWorlds()) {
            out.printf("%-20s %-18s %-22s%s%n",
                world.getName(),
                world.getKind(),
                world.getEndpoint().map(Object::toString).orElse("-"),
                world == defaultWorld ? " (default)" : "");
            for (final SystemCatalogEntry system : world.getSystems()) {
                out.printf("    %s (%s)%n", system.id(), system.name());
            }
        }
        if (node.getContext().getDeploymentWorld().isPresent()) {
            out.println("Game worlds are created after the deployment exchange completes.");
        }
        out.flush();
        return 0;
    }
}
