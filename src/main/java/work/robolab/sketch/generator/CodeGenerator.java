package work.robolab.sketch.generator;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.robolab.sketch.ast.BlockInstance;
import work.robolab.sketch.ast.Program;
import work.robolab.sketch.board.BoardProfile;
import work.robolab.sketch.catalog.BlockCatalog;
import work.robolab.sketch.catalog.BlockContainerSpec;
import work.robolab.sketch.catalog.BlockDefinition;
import work.robolab.sketch.catalog.BlockKind;
import work.robolab.sketch.catalog.BlockParameter;
import work.robolab.sketch.catalog.Section;
import work.robolab.sketch.catalog.UnknownBlockException;
import work.robolab.sketch.shared.Indentation;
import work.robolab.sketch.shared.Values;

/**
 * Lowers a program AST into Arduino sketch source.
 *
 * <p>A single depth-first walk from the root renders every block into one of the five
 * {@link Section} buffers, each line tagged with the instance that produced it. Assembly then
 * flattens the buffers in fixed order and derives the block → line mapping from the tags.
 * All state lives in a per-call {@link Session}; the generator itself is stateless and may be
 * shared between threads.
 */
public final class CodeGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(CodeGenerator.class);
    public static final String BASE_INCLUDE = "#include <Arduino.h>";
    public static final String GLOBALS_HEADER = "// ===== Globals =====";

    private final BlockCatalog catalog;
    private final BoardProfile board;

    public CodeGenerator(BlockCatalog catalog, BoardProfile board) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.board = Objects.requireNonNull(board, "board");
    }

    public SketchBundle build(Program program) {
        var root = program.root()
            .orElseThrow(() -> new CodeGenerationException("Program has no entry block " + catalog.entryBlockId()));
        var session = new Session(program);
        session.addInclude(BASE_INCLUDE, null);
        session.process(root, null, 0);
        var bundle = session.assemble();
        LOG.debug("Generated sketch for board {}: {} lines, {} blocks mapped", board.id(), bundle.lines().size(), bundle.mapping().size());
        return bundle;
    }

    public BoardProfile board() {
        return board;
    }

    private static int levelFor(Section section) {
        return section == Section.SETUP || section == Section.LOOP ? 1 : 0;
    }

    private final class Session {
        private final Program program;
        private final Map<Section, List<EmittedLine>> buffers = new EnumMap<>(Section.class);
        private final Map<String, String> includes = new LinkedHashMap<>();

        Session(Program program) {
            this.program = program;
            for (var section : Section.values()) {
                buffers.put(section, new ArrayList<>());
            }
        }

        void addInclude(String include, String origin) {
            for (var line : Indentation.lines(include)) {
                var trimmed = line.trim();
                if (!trimmed.isEmpty() && !includes.containsKey(trimmed)) {
                    includes.put(trimmed, origin);
                }
            }
        }

        void process(BlockInstance block, Section target, int indent) {
            var definition = resolve(block);
            var context = context(block, definition);
            emitSnippets(block, definition, context);

            if (definition.isTransparent()) {
                processContainers(block, definition);
                return;
            }
            var section = definition.section().orElse(target);
            if (section == null) {
                throw new CodeGenerationException(
                    "Block " + definition.id() + " (" + block.id() + ") has a template but no section",
                    block.id(),
                    null
                );
            }
            append(section, render(block, definition, context, indent), block.id());
        }

        /**
         * Renders a child of a placeholder container as text for its parent, without committing it
         * to a section. Its verbatim snippets are still emitted.
         */
        String renderInline(BlockInstance block) {
            var definition = resolve(block);
            var context = context(block, definition);
            emitSnippets(block, definition, context);
            if (definition.isTransparent()) {
                processContainers(block, definition);
                return "";
            }
            return render(block, definition, context, 0);
        }

        private String render(BlockInstance block, BlockDefinition definition, Map<String, String> context, int indent) {
            var placeholders = new LinkedHashMap<String, String>();
            for (BlockContainerSpec container : definition.containers()) {
                if (container.placeholder().isEmpty()) {
                    processChildren(block, container);
                    placeholders.put(container.name(), "");
                    continue;
                }
                var children = program.children(block, container.name());
                var texts = new ArrayList<String>();
                boolean expressionsOnly = !children.isEmpty();
                for (var child : children) {
                    var text = renderInline(child);
                    if (!text.isEmpty()) {
                        texts.add(text);
                    }
                    expressionsOnly &= catalog.find(child.definitionId()).map(BlockDefinition::kind).orElse(null) == BlockKind.EXPRESSION;
                }
                var joined = String.join("\n", texts);
                placeholders.put(container.placeholder().get(), expressionsOnly ? joined : Indentation.indent(joined, 1));
            }
            var rendered = Template.render(definition.template().orElse(""), token -> {
                var value = placeholders.get(token);
                return value != null ? value : context.get(token);
            });
            return Indentation.indent(rendered, indent);
        }

        private void processContainers(BlockInstance block, BlockDefinition definition) {
            for (BlockContainerSpec container : definition.containers()) {
                processChildren(block, container);
            }
        }

        private void processChildren(BlockInstance block, BlockContainerSpec container) {
            for (var child : program.children(block, container.name())) {
                process(child, container.section(), levelFor(container.section()));
            }
        }

        private void emitSnippets(BlockInstance block, BlockDefinition definition, Map<String, String> context) {
            for (var include : definition.includes()) {
                addInclude(Template.render(include, context::get), block.id());
            }
            for (var snippet : definition.globalsSnippets()) {
                append(Section.GLOBALS, Indentation.indent(Template.render(snippet, context::get), 0), block.id());
            }
            for (var snippet : definition.functionsSnippets()) {
                append(Section.FUNCTIONS, Template.render(snippet, context::get), block.id());
            }
            for (var snippet : definition.setupSnippets()) {
                append(Section.SETUP, Indentation.indent(Template.render(snippet, context::get), 1), block.id());
            }
        }

        private void append(Section section, String text, String origin) {
            if (text == null || text.isBlank()) {
                return;
            }
            var buffer = buffers.get(section);
            for (var line : Indentation.lines(text)) {
                buffer.add(new EmittedLine(line, origin));
            }
        }

        private BlockDefinition resolve(BlockInstance block) {
            try {
                return catalog.get(block.definitionId());
            } catch (UnknownBlockException ex) {
                throw new CodeGenerationException(
                    "Unknown block type " + block.definitionId() + " (" + block.id() + ")",
                    block.id(),
                    ex
                );
            }
        }

        private Map<String, String> context(BlockInstance block, BlockDefinition definition) {
            var context = new LinkedHashMap<String, String>();
            context.put("id", block.id());
            for (BlockParameter parameter : definition.parameters()) {
                var value = block.value(parameter.name());
                context.put(parameter.name(), Values.asText(value != null ? value : parameter.defaultValue()));
            }
            return context;
        }

        SketchBundle assemble() {
            buffers.get(Section.INCLUDES).clear();
            includes.forEach((text, origin) -> buffers.get(Section.INCLUDES).add(new EmittedLine(text, origin)));

            var lines = new ArrayList<EmittedLine>(buffers.get(Section.INCLUDES));
            lines.add(EmittedLine.BLANK);
            var globals = buffers.get(Section.GLOBALS);
            if (!globals.isEmpty()) {
                lines.add(EmittedLine.framing(GLOBALS_HEADER));
                lines.addAll(globals);
                lines.add(EmittedLine.BLANK);
            }
            lines.add(EmittedLine.framing("void setup() {"));
            lines.addAll(buffers.get(Section.SETUP));
            lines.add(EmittedLine.framing("}"));
            lines.add(EmittedLine.BLANK);
            lines.add(EmittedLine.framing("void loop() {"));
            lines.addAll(buffers.get(Section.LOOP));
            lines.add(EmittedLine.framing("}"));
            var functions = buffers.get(Section.FUNCTIONS);
            if (!functions.isEmpty()) {
                lines.add(EmittedLine.BLANK);
                lines.addAll(functions);
            }
            while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
                lines.remove(lines.size() - 1);
            }

            var code = new StringBuilder();
            var mapping = new LinkedHashMap<String, List<Integer>>();
            for (int i = 0; i < lines.size(); i++) {
                var line = lines.get(i);
                var text = i == lines.size() - 1 ? line.text().stripTrailing() : line.text();
                code.append(text).append('\n');
                if (line.origin() != null) {
                    mapping.computeIfAbsent(line.origin(), key -> new ArrayList<>()).add(i + 1);
                }
            }

            var sections = new EnumMap<Section, List<String>>(Section.class);
            buffers.forEach((section, buffer) -> sections.put(section, buffer.stream().map(EmittedLine::text).collect(Collectors.toList())));
            return new SketchBundle(code.toString(), mapping, sections);
        }
    }
}
