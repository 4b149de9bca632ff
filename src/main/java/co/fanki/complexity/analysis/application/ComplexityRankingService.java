package co.fanki.complexity.analysis.application;

import co.fanki.complexity.analysis.domain.FunctionExtractor;
import co.fanki.complexity.analysis.domain.MemberCandidate;
import co.fanki.complexity.analysis.domain.Metric;
import co.fanki.complexity.analysis.domain.Ranker;
import co.fanki.complexity.analysis.domain.ScoredResult;
import co.fanki.complexity.analysis.domain.SourceParseException;
import co.fanki.complexity.analysis.domain.SourceParser;
import co.fanki.complexity.analysis.domain.SyntaxTree;
import co.fanki.complexity.shared.DomainException;
import co.fanki.complexity.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Ranks the members of a source tree by statement count and nesting
 * depth.
 *
 * <p>Every accepted file is parsed, extracted and scored as an
 * independent task on a fixed thread pool. Tasks share nothing; the
 * service waits for all of them, concatenates their results and ranks
 * once, so the output does not depend on scheduling.</p>
 *
 * <p>A file that fails to parse is logged and skipped. Only a missing or
 * unreadable root directory aborts the run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ComplexityRankingService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ComplexityRankingService.class);

    private final SourceParser sourceParser;

    private final int parallelism;

    private final boolean recursive;

    /**
     * Creates a new ComplexityRankingService.
     *
     * @param theSourceParser the front end used to parse files
     * @param theParallelism the number of worker threads, 0 to use one per
     *      available processor
     * @param theRecursive whether to scan subdirectories of the root
     */
    public ComplexityRankingService(final SourceParser theSourceParser,
            @Value("${ranking.parallelism:0}") final int theParallelism,
            @Value("${ranking.scan.recursive:true}")
            final boolean theRecursive) {
        this.sourceParser = Preconditions.requireNonNull(theSourceParser,
                "Source parser is required");
        this.parallelism = Preconditions.requireNonNegative(theParallelism,
                "Parallelism cannot be negative");
        this.recursive = theRecursive;
    }

    /**
     * Ranks the members under a root directory by statement count.
     *
     * @param root the source root directory
     * @param limit the maximum number of results
     * @return the top members, highest count first
     * @throws DomainException if the root cannot be read
     */
    public List<ScoredResult> rankByStatementCount(final Path root,
            final int limit) {
        return rank(root, Metric.STATEMENT_COUNT, limit);
    }

    /**
     * Ranks the members under a root directory by nesting depth.
     *
     * @param root the source root directory
     * @param limit the maximum number of results
     * @return the top members, deepest first
     * @throws DomainException if the root cannot be read
     */
    public List<ScoredResult> rankByNestingDepth(final Path root,
            final int limit) {
        return rank(root, Metric.NESTING_DEPTH, limit);
    }

    /**
     * Ranks the members under a root directory by one metric.
     *
     * @param root the source root directory
     * @param metric the metric to rank by
     * @param limit the maximum number of results
     * @return the top members
     * @throws DomainException if the root cannot be read
     */
    public List<ScoredResult> rank(final Path root, final Metric metric,
            final int limit) {
        Preconditions.requireNonNull(metric, "Metric is required");
        return analyze(root, EnumSet.of(metric), limit).ranking(metric);
    }

    /**
     * Ranks the members under a root directory by every metric, parsing
     * each file only once.
     *
     * @param root the source root directory
     * @param limit the maximum number of results per metric
     * @return the report with both rankings
     * @throws DomainException if the root cannot be read
     */
    public RankingReport rankAll(final Path root, final int limit) {
        return analyze(root, EnumSet.allOf(Metric.class), limit);
    }

    private RankingReport analyze(final Path root, final Set<Metric> metrics,
            final int limit) {

        Preconditions.requireNonNull(root, "Source root is required");
        Preconditions.requireNonNegative(limit, "Limit cannot be negative");

        final List<Path> sources = discoverSources(root);
        LOG.info("Ranking {} {} source files under {}", sources.size(),
                sourceParser.language(), root);

        final Map<Metric, List<ScoredResult>> merged =
                new EnumMap<>(Metric.class);
        for (final Metric metric : metrics) {
            merged.put(metric, new ArrayList<>());
        }

        int failedFiles = 0;

        final ExecutorService executor =
                Executors.newFixedThreadPool(threadCount(sources.size()));
        try {
            final List<Future<FileScores>> futures =
                    new ArrayList<>(sources.size());
            for (final Path file : sources) {
                futures.add(executor.submit(
                        () -> scoreFile(file, metrics, limit)));
            }

            for (int i = 0; i < futures.size(); i++) {
                final FileScores scores = await(futures.get(i),
                        sources.get(i));
                if (scores.failed()) {
                    failedFiles++;
                    continue;
                }
                scores.results().forEach(
                        (metric, results) -> merged.get(metric)
                                .addAll(results));
            }
        } finally {
            executor.shutdownNow();
        }

        final Map<Metric, List<ScoredResult>> ranked =
                new EnumMap<>(Metric.class);
        for (final Metric metric : Metric.values()) {
            ranked.put(metric, Ranker.top(
                    merged.getOrDefault(metric, List.of()), limit));
        }

        if (failedFiles > 0) {
            LOG.warn("{} of {} files could not be parsed and were skipped",
                    failedFiles, sources.size());
        }
        for (final Metric metric : metrics) {
            LOG.info("Ranked {} members by {}", merged.get(metric).size(),
                    metric.displayName());
        }

        return new RankingReport(root.toString(),
                ranked.get(Metric.STATEMENT_COUNT),
                ranked.get(Metric.NESTING_DEPTH),
                sources.size(), failedFiles);
    }

    private List<Path> discoverSources(final Path root) {
        try {
            return sourceParser.enumerateFiles(root, recursive).stream()
                    .filter(sourceParser::accepts)
                    .toList();
        } catch (final IOException | UncheckedIOException e) {
            throw new DomainException("Cannot read source root: " + root,
                    DomainException.SOURCE_ROOT_UNREADABLE, e);
        }
    }

    /**
     * Parses, extracts and scores one file. Each metric keeps only the
     * file's own top {@code limit} results, which is enough for the
     * global ranking since the order is total.
     */
    private FileScores scoreFile(final Path file, final Set<Metric> metrics,
            final int limit) {

        final SyntaxTree tree;
        try {
            tree = sourceParser.parse(file);
        } catch (final IOException | SourceParseException e) {
            LOG.warn("Skipping {}: {}", file, e.getMessage());
            return FileScores.failure();
        }

        final List<MemberCandidate> candidates =
                FunctionExtractor.extract(tree);
        LOG.debug("Extracted {} members from {}", candidates.size(), file);

        final Map<Metric, List<ScoredResult>> results =
                new EnumMap<>(Metric.class);
        for (final Metric metric : metrics) {
            results.put(metric, Ranker.rank(candidates, metric, limit));
        }
        return new FileScores(results, false);
    }

    private FileScores await(final Future<FileScores> future,
            final Path file) {
        try {
            return future.get();
        } catch (final ExecutionException e) {
            LOG.warn("Skipping {}: unexpected failure {}", file,
                    String.valueOf(e.getCause()));
            return FileScores.failure();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DomainException("Ranking interrupted",
                    DomainException.RANKING_INTERRUPTED, e);
        }
    }

    private int threadCount(final int fileCount) {
        final int configured = parallelism > 0
                ? parallelism
                : Runtime.getRuntime().availableProcessors();
        return Math.max(1, Math.min(configured, fileCount));
    }

    /**
     * Per-file outcome of a scoring task.
     *
     * @param results the file's results per metric
     * @param failed whether the file could not be parsed
     */
    private record FileScores(Map<Metric, List<ScoredResult>> results,
            boolean failed) {

        static FileScores failure() {
            return new FileScores(Map.of(), true);
        }
    }

}
