package co.fanki.complexity.analysis.domain;

import co.fanki.complexity.shared.Preconditions;

import java.util.List;
import java.util.stream.Stream;

/**
 * Immutable node of a language neutral syntax tree.
 *
 * <p>Trees are built once by a {@link SourceParser} and never modified,
 * so they can be read from any number of threads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SyntaxNode {

    private final SyntaxKind kind;

    private final List<SyntaxNode> children;

    private final SourceLocation location;

    /**
     * Creates a new SyntaxNode.
     *
     * @param theKind the node kind, not null
     * @param theLocation the source location, not null
     * @param theChildren the ordered children, not null
     */
    public SyntaxNode(final SyntaxKind theKind,
            final SourceLocation theLocation,
            final List<SyntaxNode> theChildren) {
        this.kind = Preconditions.requireNonNull(theKind, "Kind is required");
        this.location = Preconditions.requireNonNull(theLocation,
                "Location is required");
        this.children = List.copyOf(Preconditions.requireNonNull(theChildren,
                "Children are required"));
    }

    /**
     * Creates a node with the given children.
     *
     * @param kind the node kind
     * @param location the source location
     * @param children the children in source order
     * @return the node
     */
    public static SyntaxNode of(final SyntaxKind kind,
            final SourceLocation location, final SyntaxNode... children) {
        return new SyntaxNode(kind, location, List.of(children));
    }

    public SyntaxKind kind() {
        return kind;
    }

    public List<SyntaxNode> children() {
        return children;
    }

    public SourceLocation location() {
        return location;
    }

    /**
     * Checks whether this node has no children.
     *
     * @return true for leaves
     */
    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Streams every node below this one in depth-first pre-order. The
     * node itself is not included.
     *
     * @return the descendants
     */
    public Stream<SyntaxNode> descendants() {
        return children.stream()
                .flatMap(child -> Stream.concat(
                        Stream.of(child), child.descendants()));
    }

    @Override
    public String toString() {
        return kind + "@" + location.fileName() + ":" + location.line();
    }

}
