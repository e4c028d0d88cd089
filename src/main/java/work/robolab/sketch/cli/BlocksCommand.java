package work.robolab.sketch.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "blocks",
    description = "List palette entries of the block catalog.",
    mixinStandardHelpOptions = true
)
final class BlocksCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ToolkitOptions options = new ToolkitOptions();

    @CommandLine.Option(names = "--category", description = "Only list blocks of this category.")
    private String category;

    @Override
    public Integer call() {
        var toolkit = options.openToolkit();
        var out = spec.commandLine().getOut();
        for (var entry : toolkit.catalog().paletteEntries()) {
            if (category != null && !category.equals(entry.category())) continue;
            out.printf("%-16s %-10s %s%n", entry.id(), entry.category(), entry.title());
        }
        out.flush();
        return 0;
    }
}
