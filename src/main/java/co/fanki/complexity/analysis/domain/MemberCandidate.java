package co.fanki.complexity.analysis.domain;

import co.fanki.complexity.shared.Preconditions;

/**
 * A function-like member selected by the {@link FunctionExtractor}.
 *
 * @param node the member node, e.g. a method or constructor declaration
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MemberCandidate(SyntaxNode node) {

    /**
     * Creates a new member candidate.
     *
     * @param node the member node, not null
     */
    public MemberCandidate {
        Preconditions.requireNonNull(node, "Member node is required");
    }

    /**
     * Returns the base name of the file declaring this member.
     *
     * @return the file name
     */
    public String fileName() {
        return node.location().fileName();
    }

    /**
     * Returns the line of the member's first token.
     *
     * @return the 1-based line
     */
    public int line() {
        return node.location().line();
    }

    /**
     * Scores this member with the given metric.
     *
     * @param metric the metric, not null
     * @return the scored result
     */
    public ScoredResult score(final Metric metric) {
        return new ScoredResult(fileName(), line(), metric.score(node));
    }

}
