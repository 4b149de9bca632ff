package co.fanki.complexity.analysis.domain;

import co.fanki.complexity.shared.Preconditions;

import java.nio.file.Path;

/**
 * The parsed syntax tree of one source file.
 *
 * @param file the parsed file
 * @param root the root node, usually a {@link SyntaxKind#COMPILATION_UNIT}
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SyntaxTree(Path file, SyntaxNode root) {

    /**
     * Creates a new syntax tree.
     *
     * @param file the parsed file, not null
     * @param root the root node, not null
     */
    public SyntaxTree {
        Preconditions.requireNonNull(file, "File is required");
        Preconditions.requireNonNull(root, "Root node is required");
    }

}
