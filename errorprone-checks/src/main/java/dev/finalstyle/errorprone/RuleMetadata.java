package dev.finalstyle.errorprone;

import com.google.errorprone.BugPattern;
import com.google.errorprone.bugpatterns.BugChecker;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Read-only description of a check for tooling that assembles check sets: identifier, one-line description,
 * markdown documentation, tags (the style group) and the checks it cannot be combined with.
 */
public record RuleMetadata(
        String name, String description, String documentation, List<String> tags, List<String> incompatibleRules) {
    private static final Logger logger = LogManager.getLogger(RuleMetadata.class);

    public RuleMetadata {
        tags = List.copyOf(tags);
        incompatibleRules = List.copyOf(incompatibleRules);
    }

    /**
     * Builds the metadata from the checker's {@link BugPattern} and {@link IncompatibleWith} annotations. The
     * documentation comes from {@code <name>.md} next to the checker class, falling back to the pattern's explanation.
     *
     * @throws IllegalArgumentException if the class carries no {@link BugPattern}
     */
    public static RuleMetadata of(Class<? extends BugChecker> checker) {
        var pattern = checker.getAnnotation(BugPattern.class);
        if (pattern == null) {
            throw new IllegalArgumentException(checker.getName() + " is not annotated with @BugPattern");
        }
        var name = pattern.name().isEmpty() ? checker.getSimpleName() : pattern.name();
        var incompatible = Optional.ofNullable(checker.getAnnotation(IncompatibleWith.class))
                .map(a -> List.of(a.value()))
                .orElse(List.of());
        var documentation = loadDocumentation(checker, name).orElseGet(() -> {
            logger.warn("No documentation resource for {}, using its explanation", name);
            return pattern.explanation();
        });
        return new RuleMetadata(name, pattern.summary(), documentation, List.of(pattern.tags()), incompatible);
    }

    public boolean isIncompatibleWith(String otherRule) {
        return incompatibleRules.contains(otherRule);
    }

    private static Optional<String> loadDocumentation(Class<?> checker, String name) {
        var resource = name + ".md";
        try (InputStream in = checker.getResourceAsStream(resource)) {
            if (in == null) {
                return Optional.empty();
            }
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + resource, e);
        }
    }
}
