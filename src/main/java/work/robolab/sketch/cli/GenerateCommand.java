package work.robolab.sketch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.robolab.sketch.api.GenerationResult;
import work.robolab.sketch.firmware.SketchWriter;
import work.robolab.sketch.generator.SketchBundle;

@CommandLine.Command(
    name = "generate",
    description = "Generate the Arduino sketch for a project.",
    mixinStandardHelpOptions = true
)
final class GenerateCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ToolkitOptions options = new ToolkitOptions();

    @CommandLine.Option(names = {"-p", "--project"}, required = true, description = "Project file (.robojson).")
    private Path project;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Output .ino file, or a directory receiving <name>/<name>.ino (default: stdout).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @CommandLine.Option(names = "--mapping", description = "Also emit the block to line mapping as JSON.")
    private boolean mapping;

    @Override
    public Integer call() throws Exception {
        var toolkit = options.openToolkit();
        var program = toolkit.loadProject(project);
        var result = toolkit.generate(program);
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        result.diagnostics().forEach(diagnostic -> err.println(diagnostic.severity() + " " + diagnostic));

        if (result.status() != GenerationResult.Status.SUCCESS) {
            var message = result.metadata().get("error");
            err.println(message != null
                ? ShortErrorHandler.withBlock(message, result.metadata().get("blockId"))
                : "Generation refused: validation reported errors");
            return result.status().exitCode();
        }
        var bundle = result.bundle().orElseThrow();
        if (output == null) {
            out.print(mapping ? result.toPrettyJson() + "\n" : bundle.code());
            out.flush();
            return 0;
        }
        var written = writeSketch(bundle);
        if (mapping) {
            var mapFile = written.resolveSibling(stem(written) + ".map.json");
            Files.writeString(mapFile, JSON_WRITER.writeValueAsString(bundle.mapping()) + "\n", StandardCharsets.UTF_8);
        }
        out.println(written);
        return 0;
    }

    private Path writeSketch(SketchBundle bundle) throws IOException {
        if (output.getFileName() != null && output.getFileName().toString().endsWith(".ino")) {
            var parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, bundle.code(), StandardCharsets.UTF_8);
            return output;
        }
        return SketchWriter.write(output, stem(project), bundle);
    }

    static String stem(Path path) {
        var name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
