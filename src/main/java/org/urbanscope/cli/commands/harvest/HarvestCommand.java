package org.urbanscope.cli.commands.harvest;

import org.urbanscope.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "harvest",
    description = "Harvests new runs, appends kept records to the catalog and rebuilds the exports.",
    subcommands = {
        HarvestRecentCommand.class,
        HarvestDayCommand.class,
        HarvestCrawlCommand.class
    }
)
public class HarvestCommand {

    @ParentCommand
    private CommandLineInterface parent;

    public CommandLineInterface getParent() {
        return parent;
    }
}
