package work.robolab.sketch.catalog;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable catalog entry describing how a block type is generated.
 *
 * <p>The schema is checked per {@link BlockKind} on construction: expressions need a template and
 * are the only kind allowed a return type, container-only blocks need containers and no template.
 * Parameter and container names are unique.
 */
public record BlockDefinition(
    String id,
    String name,
    String category,
    BlockKind kind,
    Optional<Section> section,
    Optional<String> template,
    Optional<String> returns,
    List<BlockParameter> parameters,
    List<String> setupSnippets,
    List<String> globalsSnippets,
    List<String> includes,
    List<String> functionsSnippets,
    List<BlockContainerSpec> containers
) {
    public BlockDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(kind, "kind");
        section = section == null ? Optional.empty() : section;
        template = template == null ? Optional.empty() : template.filter(text -> !text.isEmpty());
        returns = returns == null ? Optional.empty() : returns.filter(text -> !text.isBlank());
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        setupSnippets = setupSnippets == null ? List.of() : List.copyOf(setupSnippets);
        globalsSnippets = globalsSnippets == null ? List.of() : List.copyOf(globalsSnippets);
        includes = includes == null ? List.of() : List.copyOf(includes);
        functionsSnippets = functionsSnippets == null ? List.of() : List.copyOf(functionsSnippets);
        containers = containers == null ? List.of() : List.copyOf(containers);
        checkSchema(id, kind, template, returns, parameters, containers);
    }

    public static Builder builder(String id, BlockKind kind) {
        return new Builder(id, kind);
    }

    public boolean isExpression() {
        return kind == BlockKind.EXPRESSION;
    }

    /**
     * A block without a template only forwards its containers.
     */
    public boolean isTransparent() {
        return template.isEmpty();
    }

    public Optional<BlockParameter> parameter(String parameterName) {
        return parameters.stream().filter(param -> param.name().equals(parameterName)).findFirst();
    }

    public Optional<BlockContainerSpec> container(String containerName) {
        return containers.stream().filter(spec -> spec.name().equals(containerName)).findFirst();
    }

    private static void checkSchema(
        String id,
        BlockKind kind,
        Optional<String> template,
        Optional<String> returns,
        List<BlockParameter> parameters,
        List<BlockContainerSpec> containers
    ) {
        switch (kind) {
            case EXPRESSION -> {
                if (template.isEmpty()) {
                    throw new IllegalArgumentException("expression block " + id + " requires a template");
                }
            }
            case CONTAINER -> {
                if (template.isPresent()) {
                    throw new IllegalArgumentException("container block " + id + " must not declare a template");
                }
                if (containers.isEmpty()) {
                    throw new IllegalArgumentException("container block " + id + " must declare containers");
                }
            }
            default -> {
                if (returns.isPresent()) {
                    throw new IllegalArgumentException(kind.id() + " block " + id + " must not declare a return type");
                }
            }
        }
        var parameterNames = new HashSet<String>();
        for (BlockParameter parameter : parameters) {
            if (!parameterNames.add(parameter.name())) {
                throw new IllegalArgumentException("block " + id + " declares parameter '" + parameter.name() + "' twice");
            }
        }
        var containerNames = new HashSet<String>();
        for (BlockContainerSpec container : containers) {
            if (!containerNames.add(container.name())) {
                throw new IllegalArgumentException("block " + id + " declares container '" + container.name() + "' twice");
            }
            if (container.isInline() && template.isEmpty()) {
                throw new IllegalArgumentException(
                    "block " + id + " has placeholder container '" + container.name() + "' but no template"
                );
            }
        }
    }

    public static final class Builder {
        private final String id;
        private final BlockKind kind;
        private String name;
        private String category = "misc";
        private Section section;
        private String template;
        private String returns;
        private final List<BlockParameter> parameters = new ArrayList<>();
        private final List<String> setupSnippets = new ArrayList<>();
        private final List<String> globalsSnippets = new ArrayList<>();
        private final List<String> includes = new ArrayList<>();
        private final List<String> functionsSnippets = new ArrayList<>();
        private final List<BlockContainerSpec> containers = new ArrayList<>();

        private Builder(String id, BlockKind kind) {
            this.id = id;
            this.kind = kind;
            this.name = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder section(Section section) {
            this.section = section;
            return this;
        }

        public Builder template(String template) {
            this.template = template;
            return this;
        }

        public Builder returns(String returns) {
            this.returns = returns;
            return this;
        }

        public Builder parameter(String parameterName, String type, Object defaultValue) {
            parameters.add(new BlockParameter(parameterName, type, defaultValue));
            return this;
        }

        public Builder setup(String snippet) {
            setupSnippets.add(snippet);
            return this;
        }

        public Builder global(String snippet) {
            globalsSnippets.add(snippet);
            return this;
        }

        public Builder include(String include) {
            includes.add(include);
            return this;
        }

        public Builder function(String snippet) {
            functionsSnippets.add(snippet);
            return this;
        }

        public Builder container(BlockContainerSpec container) {
            containers.add(container);
            return this;
        }

        public BlockDefinition build() {
            return new BlockDefinition(
                id,
                name,
                category,
                kind,
                Optional.ofNullable(section),
                Optional.ofNullable(template),
                Optional.ofNullable(returns),
                parameters,
                setupSnippets,
                globalsSnippets,
                includes,
                functionsSnippets,
                containers
            );
        }
    }
}
