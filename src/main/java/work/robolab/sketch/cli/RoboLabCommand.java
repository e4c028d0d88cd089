package work.robolab.sketch.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "robolab",
    description = "Generate, validate and flash Arduino sketches built from blocks.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        GenerateCommand.class,
        ValidateCommand.class,
        BlocksCommand.class,
        BoardsCommand.class,
        FlashCommand.class
    }
)
final class RoboLabCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand.");
    }
}
