package work.robolab.sketch.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.robolab.sketch.api.GenerationResult;
import work.robolab.sketch.firmware.CompileErrors;
import work.robolab.sketch.firmware.CompilerOutputParser;
import work.robolab.sketch.firmware.SketchWriter;

@CommandLine.Command(
    name = "flash",
    description = "Upload a firmware image for a project's board, optionally compiling the sketch first.",
    mixinStandardHelpOptions = true
)
final class FlashCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ToolkitOptions options = new ToolkitOptions();

    @CommandLine.Option(names = {"-p", "--project"}, required = true, description = "Project file (.robojson).")
    private Path project;

    @CommandLine.Option(names = "--port", required = true, description = "Serial port of the board.")
    private String port;

    @CommandLine.Option(names = "--hex", required = true, description = "Firmware image to upload.")
    private Path hex;

    @CommandLine.Option(
        names = "--compile",
        description = "Generate and compile the sketch into this directory before uploading.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path buildDir;

    @Override
    public Integer call() {
        var toolkit = options.openToolkit();
        var program = toolkit.loadProject(project);
        var board = toolkit.boardFor(program);
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        if (buildDir != null) {
            var result = toolkit.generate(program);
            if (result.status() != GenerationResult.Status.SUCCESS) {
                result.diagnostics().forEach(err::println);
                err.println(ShortErrorHandler.withBlock(
                    result.metadata().getOrDefault("error", "Generation refused"), result.metadata().get("blockId")));
                return result.status().exitCode();
            }
            var bundle = result.bundle().orElseThrow();
            var sketch = SketchWriter.write(buildDir, GenerateCommand.stem(project), bundle);
            var compiled = toolkit.toolchain().compile(sketch.getParent(), board);
            if (!compiled.success()) {
                var errors = CompilerOutputParser.parse(compiled.combinedOutput());
                CompileErrors.attribute(errors, bundle).forEach((error, blocks) ->
                    err.println(error.line() + ":" + error.column() + " " + error.message() + (blocks.isEmpty() ? "" : " " + blocks)));
                return compiled.exitCode() == 0 ? 1 : compiled.exitCode();
            }
        }

        var uploaded = toolkit.toolchain().upload(hex, board, port);
        out.print(uploaded.stdout());
        err.print(uploaded.stderr());
        out.flush();
        err.flush();
        return uploaded.success() ? 0 : 1;
    }
}
