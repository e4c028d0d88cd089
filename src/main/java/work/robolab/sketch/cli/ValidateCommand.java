package work.robolab.sketch.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.robolab.sketch.validate.ProgramValidator;

@CommandLine.Command(
    name = "validate",
    description = "Check a project against the block catalog and board. Exits with 2 on errors.",
    mixinStandardHelpOptions = true
)
final class ValidateCommand implements Callable<Integer> {
    static final int EXIT_INVALID = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ToolkitOptions options = new ToolkitOptions();

    @CommandLine.Option(names = {"-p", "--project"}, required = true, description = "Project file (.robojson).")
    private Path project;

    @Override
    public Integer call() {
        var toolkit = options.openToolkit();
        var diagnostics = toolkit.validate(toolkit.loadProject(project));
        var out = spec.commandLine().getOut();
        if (diagnostics.isEmpty()) {
            out.println("OK");
        }
        diagnostics.forEach(diagnostic -> out.println(diagnostic.severity() + " " + diagnostic.code() + " " + diagnostic));
        out.flush();
        return ProgramValidator.hasErrors(diagnostics) ? EXIT_INVALID : 0;
    }
}
