package co.fanki.complexity.analysis.domain;

import co.fanki.complexity.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Orders scored members and keeps the top entries.
 *
 * <p>The order is total ({@link ScoredResult#RANKING_ORDER}) and the sort
 * stable, so the output only depends on the set of results and not on
 * the order in which parallel workers produced them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Ranker {

    private Ranker() {
    }

    /**
     * Scores candidates with a metric and ranks them.
     *
     * @param candidates the member candidates, not null
     * @param metric the metric to score with, not null
     * @param limit the maximum number of results, non-negative
     * @return at most {@code limit} results in ranking order
     */
    public static List<ScoredResult> rank(
            final Collection<MemberCandidate> candidates,
            final Metric metric, final int limit) {
        Preconditions.requireNonNull(candidates, "Candidates are required");
        Preconditions.requireNonNull(metric, "Metric is required");

        return top(candidates.stream()
                .map(candidate -> candidate.score(metric))
                .toList(), limit);
    }

    /**
     * Ranks already scored results.
     *
     * @param results the results in any order, not null
     * @param limit the maximum number of results, non-negative
     * @return the first {@code min(limit, results.size())} results in
     *      ranking order, as an unmodifiable list
     */
    public static List<ScoredResult> top(
            final Collection<ScoredResult> results, final int limit) {
        Preconditions.requireNonNull(results, "Results are required");
        Preconditions.requireNonNegative(limit, "Limit cannot be negative");

        final List<ScoredResult> sorted = new ArrayList<>(results);
        sorted.sort(ScoredResult.RANKING_ORDER);

        return List.copyOf(sorted.subList(0,
                Math.min(limit, sorted.size())));
    }

}
