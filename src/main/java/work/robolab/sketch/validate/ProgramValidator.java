package work.robolab.sketch.validate;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.robolab.sketch.ast.BlockInstance;
import work.robolab.sketch.ast.Program;
import work.robolab.sketch.board.BoardProfile;
import work.robolab.sketch.catalog.BlockCatalog;
import work.robolab.sketch.catalog.BlockContainerSpec;
import work.robolab.sketch.catalog.BlockParameter;
import work.robolab.sketch.catalog.Section;
import work.robolab.sketch.shared.Values;

/**
 * Checks a program against the block catalog and the target board.
 *
 * <p>Validation is advisory: it never throws for malformed programs and never mutates them.
 */
public final class ProgramValidator {
    private static final Logger LOG = LoggerFactory.getLogger(ProgramValidator.class);

    private final BlockCatalog catalog;
    private final BoardProfile board;

    public ProgramValidator(BlockCatalog catalog, BoardProfile board) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.board = Objects.requireNonNull(board, "board");
    }

    public List<Diagnostic> validate(Program program) {
        var diagnostics = new ArrayList<Diagnostic>();
        var root = program.root();
        if (root.isEmpty()) {
            diagnostics.add(Diagnostic.of(DiagnosticCode.MISSING_ENTRY_BLOCK, "Program has no entry block " + catalog.entryBlockId()));
            return diagnostics;
        }
        var rootBlock = root.get();
        if (catalog.contains(rootBlock.definitionId()) && !catalog.entryBlockId().equals(rootBlock.definitionId())) {
            diagnostics.add(Diagnostic.forBlock(
                DiagnosticCode.ROOT_NOT_ENTRY,
                "Root block is " + rootBlock.definitionId() + ", expected " + catalog.entryBlockId(),
                rootBlock.id()
            ));
        }

        var populated = EnumSet.noneOf(Section.class);
        walk(program, rootBlock, null, populated, diagnostics);

        if (!populated.contains(Section.LOOP)) {
            diagnostics.add(Diagnostic.of(DiagnosticCode.LOOP_EMPTY, "loop() has no executable blocks"));
        }
        if (!populated.contains(Section.SETUP)) {
            diagnostics.add(Diagnostic.of(DiagnosticCode.SECTION_EMPTY, "Section '" + Section.SETUP.id() + "' is empty"));
        }
        LOG.debug("Validated program for board {}: {} diagnostics", board.id(), diagnostics.size());
        return diagnostics;
    }

    public static boolean hasErrors(List<Diagnostic> diagnostics) {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    private void walk(Program program, BlockInstance block, Section inherited, Set<Section> populated, List<Diagnostic> diagnostics) {
        var found = catalog.find(block.definitionId());
        if (found.isEmpty()) {
            diagnostics.add(Diagnostic.forBlock(
                DiagnosticCode.UNKNOWN_BLOCK_TYPE,
                "Unknown block type " + block.definitionId(),
                block.id()
            ));
            return;
        }
        var definition = found.get();
        definition.section().ifPresent(populated::add);
        if (definition.section().isEmpty() && !definition.isTransparent() && inherited != null) {
            populated.add(inherited);
        }
        if (!definition.setupSnippets().isEmpty()) {
            populated.add(Section.SETUP);
        }
        if (!definition.globalsSnippets().isEmpty()) {
            populated.add(Section.GLOBALS);
        }

        for (BlockParameter parameter : definition.parameters()) {
            checkParameter(block, parameter, diagnostics);
        }

        for (var container : block.containerNames()) {
            var childSection = definition.container(container)
                .map(BlockContainerSpec::section)
                .orElse(null);
            for (var child : program.children(block, container)) {
                walk(program, child, childSection, populated, diagnostics);
            }
        }
    }

    private void checkParameter(BlockInstance block, BlockParameter parameter, List<Diagnostic> diagnostics) {
        var value = effectiveValue(block, parameter);
        if (value == null) {
            diagnostics.add(Diagnostic.forBlock(
                DiagnosticCode.MISSING_PARAMETER,
                "Parameter '" + parameter.name() + "' is not set",
                block.id()
            ));
            return;
        }
        switch (parameter.type()) {
            case BlockParameter.DIGITAL_PIN -> checkDigitalPin(block, parameter, value, diagnostics);
            case BlockParameter.INT -> {
                if (Values.asInt(value).isEmpty()) {
                    diagnostics.add(Diagnostic.forBlock(
                        DiagnosticCode.INVALID_INTEGER,
                        "Parameter '" + parameter.name() + "' must be an integer",
                        block.id()
                    ));
                }
            }
            default -> {
                // remaining types are not checked
            }
        }
    }

    private void checkDigitalPin(BlockInstance block, BlockParameter parameter, Object value, List<Diagnostic> diagnostics) {
        var pin = Values.asPin(value);
        if (pin.isEmpty()) {
            diagnostics.add(Diagnostic.forBlock(
                DiagnosticCode.INVALID_PIN_FORMAT,
                "Parameter '" + parameter.name() + "' has an invalid pin value '" + value + "'",
                block.id()
            ));
            return;
        }
        if (!board.supportsDigital(pin.getAsInt())) {
            diagnostics.add(Diagnostic.forBlock(
                DiagnosticCode.PIN_UNAVAILABLE,
                "Pin D" + pin.getAsInt() + " is not available on board " + board.name(),
                block.id()
            ));
        }
    }

    static Object effectiveValue(BlockInstance block, BlockParameter parameter) {
        var value = block.value(parameter.name());
        return value != null ? value : parameter.defaultValue();
    }
}
