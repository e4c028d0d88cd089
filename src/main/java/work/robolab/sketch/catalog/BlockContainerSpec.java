package work.robolab.sketch.catalog;

import java.util.Objects;
import java.util.Optional;

/**
 * Named slot for child blocks. With a placeholder, rendered children are substituted into the
 * parent template; without one they are emitted on their own into {@code section}.
 */
public record BlockContainerSpec(String name, Section section, Optional<String> placeholder) {
    public BlockContainerSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(section, "section");
        placeholder = placeholder == null ? Optional.empty() : placeholder.filter(value -> !value.isBlank());
    }

    public static BlockContainerSpec of(String name, Section section) {
        return new BlockContainerSpec(name, section, Optional.empty());
    }

    public static BlockContainerSpec withPlaceholder(String name, Section section, String placeholder) {
        return new BlockContainerSpec(name, section, Optional.ofNullable(placeholder));
    }

    public boolean isInline() {
        return placeholder.isPresent();
    }
}
