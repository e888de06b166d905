package org.urbanscope.cli;

import com.typesafe.config.Config;
import org.urbanscope.cli.commands.ExportCommand;
import org.urbanscope.cli.commands.harvest.HarvestCommand;
import org.urbanscope.cli.config.ConfigLoader;
import org.urbanscope.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "urbanscope",
    mixinStandardHelpOptions = true,
    version = "UrbanScope Harvester 1.0",
    description = "Harvests urban microbiome sequencing runs, deduplicates them per project and publishes static exports.",
    subcommands = {
        HarvestCommand.class,
        ExportCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("urbanscope");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration, root included
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile, new File("."));
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
