package co.fanki.complexity.analysis.domain;

/**
 * Number of simple statements in a subtree, regardless of how deep they
 * are nested.
 *
 * <p>Blocks are transparent, and compound statements ({@code if}, loops,
 * {@code try}...) are not counted themselves: only the statements they
 * enclose are. See {@link SyntaxKind#isCountedStatement()}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class StatementCountMetric {

    private StatementCountMetric() {
    }

    /**
     * Counts the statements in a subtree, the node itself included.
     *
     * @param node the subtree root, not null
     * @return the statement count, zero or more
     */
    public static int of(final SyntaxNode node) {
        int count = node.kind().isCountedStatement() ? 1 : 0;
        for (final SyntaxNode child : node.children()) {
            count += of(child);
        }
        return count;
    }

}
