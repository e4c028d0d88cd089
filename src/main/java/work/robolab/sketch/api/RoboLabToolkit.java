package work.robolab.sketch.api;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.robolab.sketch.ast.Program;
import work.robolab.sketch.board.BoardProfile;
import work.robolab.sketch.board.BoardProfileLoader;
import work.robolab.sketch.board.BoardRegistry;
import work.robolab.sketch.catalog.BlockCatalog;
import work.robolab.sketch.catalog.BlockCatalogLoader;
import work.robolab.sketch.firmware.CommandRunner;
import work.robolab.sketch.firmware.FirmwareToolchain;
import work.robolab.sketch.firmware.ProcessCommandRunner;
import work.robolab.sketch.generator.CodeGenerationException;
import work.robolab.sketch.generator.CodeGenerator;
import work.robolab.sketch.project.ProgramGraphConverter;
import work.robolab.sketch.project.ProjectFiles;
import work.robolab.sketch.validate.Diagnostic;
import work.robolab.sketch.validate.ProgramValidator;

/**
 * Public entry point for embedding the sketch pipeline: loads the catalog and board profiles
 * once, then validates, generates and persists programs against them.
 */
public final class RoboLabToolkit {
    private static final Logger LOG = LoggerFactory.getLogger(RoboLabToolkit.class);

    private final ToolkitConfiguration configuration;
    private final BlockCatalog catalog;
    private final BoardRegistry boards;
    private final ProgramGraphConverter converter;
    private final FirmwareToolchain toolchain;

    public RoboLabToolkit(ToolkitConfiguration configuration) {
        this(configuration, new ProcessCommandRunner());
    }

    public RoboLabToolkit(ToolkitConfiguration configuration, CommandRunner runner) {
        this(
            configuration,
            configuration.catalogPath().map(BlockCatalogLoader::load).orElseGet(BlockCatalogLoader::bundled),
            configuration.boardsPath().map(BoardProfileLoader::load).orElseGet(BoardProfileLoader::bundled),
            runner
        );
    }

    public RoboLabToolkit(ToolkitConfiguration configuration, BlockCatalog catalog, BoardRegistry boards, CommandRunner runner) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.boards = Objects.requireNonNull(boards, "boards");
        this.converter = new ProgramGraphConverter(catalog);
        this.toolchain = new FirmwareToolchain(configuration.toolsRoot(), runner);
        LOG.debug("Toolkit ready: {} blocks, {} boards", catalog.definitions().size(), boards.ids().size());
    }

    public List<Diagnostic> validate(Program program) {
        return new ProgramValidator(catalog, boardFor(program)).validate(program);
    }

    public GenerationResult generate(Program program) {
        var started = Instant.now();
        var board = boardFor(program);
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("board", board.id());
        metadata.put("strict", configuration.strict());

        var diagnostics = new ProgramValidator(catalog, board).validate(program);
        if (configuration.strict() && ProgramValidator.hasErrors(diagnostics)) {
            LOG.info("Generation refused: {} diagnostics", diagnostics.size());
            return GenerationResult.invalid(diagnostics, metadata, started);
        }
        try {
            var bundle = new CodeGenerator(catalog, board).build(program);
            metadata.put("lines", bundle.lines().size());
            metadata.put("blocks", bundle.mapping().size());
            return GenerationResult.success(bundle, diagnostics, metadata, started);
        } catch (CodeGenerationException ex) {
            if (ex.blockId() != null) {
                metadata.put("blockId", ex.blockId());
            }
            if (Boolean.getBoolean("robolab.debug")) {
                LOG.error("Generation failed", ex);
            }
            return GenerationResult.failure(ex.getMessage(), diagnostics, metadata, started);
        }
    }

    public Program loadProject(Path path) {
        var document = ProjectFiles.read(path, catalog);
        return converter.toProgram(document);
    }

    public void saveProject(Path path, Program program, String port) {
        ProjectFiles.write(path, converter.toDocument(program, port));
        LOG.info("Project saved to {}", path);
    }

    public BoardProfile board(String boardId) {
        return boards.get(boardId);
    }

    /**
     * Board named by the program when the registry knows it, else the configured default.
     */
    public BoardProfile boardFor(Program program) {
        var requested = program.boardId();
        if (requested != null && boards.find(requested).isPresent()) {
            return boards.get(requested);
        }
        if (requested != null) {
            LOG.warn("Unknown board {}, using {}", requested, configuration.boardId());
        }
        return boards.get(configuration.boardId());
    }

    public BlockCatalog catalog() {
        return catalog;
    }

    public BoardRegistry boards() {
        return boards;
    }

    public FirmwareToolchain toolchain() {
        return toolchain;
    }

    public ToolkitConfiguration configuration() {
        return configuration;
    }
}
