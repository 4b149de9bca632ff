package co.fanki.complexity.config;

import co.fanki.complexity.analysis.application.ComplexityRankingService;
import co.fanki.complexity.analysis.application.RankingReport;
import co.fanki.complexity.analysis.application.RankingReportWriter;
import co.fanki.complexity.analysis.domain.Metric;
import co.fanki.complexity.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line mode: ranks a directory and writes both rankings to files.
 *
 * <p>Enabled with {@code ranking.cli.enabled=true} (the {@code cli}
 * profile). Usage:</p>
 * <pre>
 * java -jar complexity-ranker.jar --spring.profiles.active=cli \
 *     &lt;source-dir&gt; &lt;statements-out&gt; &lt;nesting-out&gt; [limit]
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "ranking.cli.enabled", havingValue = "true")
public class RankingCliConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            RankingCliConfiguration.class);

    static final String USAGE = "Usage: <source-dir> <statements-out>"
            + " <nesting-out> [limit]";

    @Value("${ranking.limit:100}")
    private int defaultLimit = 100;

    /**
     * Runs the ranking once with the non-option arguments.
     *
     * @param rankingService the service computing the rankings
     * @param reportWriter writes the ranking files
     * @return the runner
     */
    @Bean
    ApplicationRunner rankingCliRunner(
            final ComplexityRankingService rankingService,
            final RankingReportWriter reportWriter) {
        return args -> run(args.getNonOptionArgs(), rankingService,
                reportWriter);
    }

    void run(final List<String> args,
            final ComplexityRankingService rankingService,
            final RankingReportWriter reportWriter) throws IOException {

        Preconditions.require(args.size() == 3 || args.size() == 4, USAGE);

        final Path root = Path.of(args.get(0));
        final Path statementsOut = Path.of(args.get(1));
        final Path nestingOut = Path.of(args.get(2));
        final int limit = args.size() == 4
                ? parseLimit(args.get(3))
                : defaultLimit;

        final RankingReport report;
        try {
            report = rankingService.rankAll(root, limit);
        } catch (final RuntimeException e) {
            LOG.error("Ranking of {} failed: {}", root, e.getMessage());
            throw e;
        }

        reportWriter.write(report.ranking(Metric.STATEMENT_COUNT),
                statementsOut);
        reportWriter.write(report.ranking(Metric.NESTING_DEPTH), nestingOut);

        LOG.info("Ranked {} files ({} skipped)", report.scannedFiles(),
                report.failedFiles());
    }

    private int parseLimit(final String value) {
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Limit must be a number: " + value + ". " + USAGE, e);
        }
    }

}
