package org.flutterjs.analyzer.cli;

import org.flutterjs.analyzer.cli.commands.AnalyzeCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

@Command(
    name = "flutterjs-analyzer",
    mixinStandardHelpOptions = true,
    version = "FlutterJS Analyzer 0.1",
    description = "Incremental analyzer for Flutter projects",
    subcommands = {
        AnalyzeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Override
    public Integer call() {
        // Without a subcommand, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("flutterjs-analyzer");
        System.exit(commandLine.execute(args));
    }
}
