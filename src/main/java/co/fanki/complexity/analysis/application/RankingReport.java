package co.fanki.complexity.analysis.application;

import co.fanki.complexity.analysis.domain.Metric;
import co.fanki.complexity.analysis.domain.ScoredResult;

import java.util.List;

/**
 * Both rankings of one source tree, produced from a single parse pass.
 *
 * @param root the analyzed root directory
 * @param statementCount the top members by statement count
 * @param nestingDepth the top members by nesting depth
 * @param scannedFiles the number of source files the parser accepted
 * @param failedFiles the number of those files that could not be parsed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RankingReport(
        String root,
        List<ScoredResult> statementCount,
        List<ScoredResult> nestingDepth,
        int scannedFiles,
        int failedFiles
) {

    /**
     * Returns the ranking for one metric.
     *
     * @param metric the metric
     * @return the ranked results
     */
    public List<ScoredResult> ranking(final Metric metric) {
        return switch (metric) {
            case STATEMENT_COUNT -> statementCount;
            case NESTING_DEPTH -> nestingDepth;
        };
    }

}
