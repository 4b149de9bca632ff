package co.fanki.complexity.analysis.domain;

import co.fanki.complexity.shared.Preconditions;
import co.fanki.complexity.shared.ValueObject;

import java.util.Comparator;

/**
 * The score of one member for one metric.
 *
 * @param file the base name of the member's source file
 * @param line the 1-based line where the member starts
 * @param value the metric value
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ScoredResult(String file, int line, int value)
        implements ValueObject {

    /**
     * Ranking order: highest value first, then file name, then line.
     */
    public static final Comparator<ScoredResult> RANKING_ORDER =
            Comparator.comparingInt(ScoredResult::value).reversed()
                    .thenComparing(ScoredResult::file)
                    .thenComparingInt(ScoredResult::line);

    /**
     * Creates a new scored result.
     *
     * @param file the file name, not blank
     * @param line the 1-based line, positive
     * @param value the metric value, non-negative
     */
    public ScoredResult {
        Preconditions.requireNonBlank(file, "File is required");
        Preconditions.requirePositive(line, "Line must be 1-based");
        Preconditions.requireNonNegative(value,
                "Metric value cannot be negative");
    }

    /**
     * Formats this result as a report line: value, a tab, then
     * {@code file:line}.
     *
     * @return the report line, without terminator
     */
    public String toReportLine() {
        return value + "\t" + file + ":" + line;
    }

}
