package co.fanki.complexity.analysis.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Maximum nesting depth of control-flow constructs below a node.
 *
 * <p>The depth of a leaf is zero. The depth of any other node is the
 * maximum, over its children, of the child's depth plus one when the
 * child itself is a nesting construct. Ten sibling {@code if}s therefore
 * score one, while {@code if} inside {@code if} inside {@code while}
 * scores three.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NestingDepthMetric {

    /** Kinds that open one more nesting level. */
    public static final Set<SyntaxKind> NESTING_KINDS =
            Collections.unmodifiableSet(EnumSet.of(
                    SyntaxKind.ANONYMOUS_METHOD_EXPRESSION,
                    SyntaxKind.CHECKED_STATEMENT,
                    SyntaxKind.DO_STATEMENT,
                    SyntaxKind.FIXED_STATEMENT,
                    SyntaxKind.FOR_STATEMENT,
                    SyntaxKind.FOR_EACH_STATEMENT,
                    SyntaxKind.IF_STATEMENT,
                    SyntaxKind.LOCK_STATEMENT,
                    SyntaxKind.LAMBDA_EXPRESSION,
                    SyntaxKind.SWITCH_STATEMENT,
                    SyntaxKind.TRY_STATEMENT,
                    SyntaxKind.UNSAFE_STATEMENT,
                    SyntaxKind.UNCHECKED_STATEMENT,
                    SyntaxKind.WHILE_STATEMENT));

    private NestingDepthMetric() {
    }

    /**
     * Computes the nesting depth of a node.
     *
     * @param node the node to measure, not null
     * @return the depth, zero or more
     */
    public static int of(final SyntaxNode node) {
        int depth = 0;
        for (final SyntaxNode child : node.children()) {
            final int childDepth = of(child)
                    + (NESTING_KINDS.contains(child.kind()) ? 1 : 0);
            depth = Math.max(depth, childDepth);
        }
        return depth;
    }

}
