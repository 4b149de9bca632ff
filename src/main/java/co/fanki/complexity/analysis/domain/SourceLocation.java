package co.fanki.complexity.analysis.domain;

import co.fanki.complexity.shared.Preconditions;
import co.fanki.complexity.shared.ValueObject;

import java.nio.file.Path;

/**
 * Position of a syntax node in its source file.
 *
 * @param file the path of the source file as given to the parser
 * @param line the 1-based line of the node's first token
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SourceLocation(String file, int line) implements ValueObject {

    /**
     * Creates a new source location.
     *
     * @param file the source file path, not blank
     * @param line the 1-based line, must be positive
     */
    public SourceLocation {
        Preconditions.requireNonBlank(file, "File is required");
        Preconditions.requirePositive(line, "Line must be 1-based");
    }

    /**
     * Returns the base name of the source file, without directories.
     *
     * @return the file name, e.g. "OrderService.java"
     */
    public String fileName() {
        final Path name = Path.of(file).getFileName();
        return name == null ? file : name.toString();
    }

}
