package co.fanki.complexity.analysis.domain;

import java.util.function.ToIntFunction;

/**
 * The metrics members can be ranked by.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Metric {

    /** Number of simple statements, see {@link StatementCountMetric}. */
    STATEMENT_COUNT("statement count", StatementCountMetric::of),

    /** Control-flow nesting depth, see {@link NestingDepthMetric}. */
    NESTING_DEPTH("nesting depth", NestingDepthMetric::of);

    private final String displayName;

    private final ToIntFunction<SyntaxNode> function;

    Metric(final String theDisplayName,
            final ToIntFunction<SyntaxNode> theFunction) {
        this.displayName = theDisplayName;
        this.function = theFunction;
    }

    /**
     * Applies this metric to a node.
     *
     * @param node the node to score
     * @return the metric value
     */
    public int score(final SyntaxNode node) {
        return function.applyAsInt(node);
    }

    /**
     * Returns a human readable name for log messages.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

}
