package co.fanki.complexity.analysis.application;

import co.fanki.complexity.analysis.domain.ScoredResult;
import co.fanki.complexity.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes rankings as plain text, one {@code value<TAB>file:line} line per
 * result, no header.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class RankingReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(
            RankingReportWriter.class);

    /** Lines end with a bare line feed on every platform. */
    private static final String LINE_TERMINATOR = "\n";

    /**
     * Formats a ranking as report lines.
     *
     * @param results the ranked results, not null
     * @return the lines, in ranking order
     */
    public List<String> format(final List<ScoredResult> results) {
        Preconditions.requireNonNull(results, "Results are required");
        return results.stream()
                .map(ScoredResult::toReportLine)
                .toList();
    }

    /**
     * Writes a ranking to a file, replacing any previous content.
     *
     * @param results the ranked results, not null
     * @param target the output file, not null
     * @throws IOException if the file cannot be written
     */
    public void write(final List<ScoredResult> results, final Path target)
            throws IOException {
        Preconditions.requireNonNull(target, "Target file is required");

        final Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, format(results).stream()
                        .map(line -> line + LINE_TERMINATOR)
                        .collect(Collectors.joining()),
                StandardCharsets.UTF_8);

        LOG.info("Wrote {} results to {}", results.size(), target);
    }

}
