package work.robolab.sketch.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "boards",
    description = "List known board profiles.",
    mixinStandardHelpOptions = true
)
final class BoardsCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ToolkitOptions options = new ToolkitOptions();

    @Override
    public Integer call() {
        var toolkit = options.openToolkit();
        var out = spec.commandLine().getOut();
        for (var board : toolkit.boards().profiles()) {
            out.printf("%-8s %-24s %s%n", board.id(), board.name(), board.fqbn());
        }
        out.flush();
        return 0;
    }
}
