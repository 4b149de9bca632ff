package co.fanki.complexity.analysis.application;

import co.fanki.complexity.analysis.domain.Metric;
import co.fanki.complexity.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.Map;

/**
 * REST controller exposing the complexity rankings of a local source
 * directory.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/rankings")
@Tag(name = "Rankings",
        description = "Rank source members by size and nesting")
public class RankingController {

    private static final Logger LOG = LoggerFactory.getLogger(
            RankingController.class);

    private final ComplexityRankingService rankingService;

    private final int defaultLimit;

    /**
     * Creates a new RankingController.
     *
     * @param theRankingService the ranking service
     * @param theDefaultLimit the limit used when the request has none
     */
    public RankingController(final ComplexityRankingService theRankingService,
            @Value("${ranking.limit:100}") final int theDefaultLimit) {
        this.rankingService = theRankingService;
        this.defaultLimit = theDefaultLimit;
    }

    /**
     * Ranks members by statement count.
     *
     * @param path the source directory on the server
     * @param limit the maximum number of results
     * @return the ranked results, or 400 with an error code
     */
    @GetMapping("/statements")
    @Operation(summary = "Rank members by statement count")
    public ResponseEntity<?> statements(
            @Parameter(description = "Source directory")
            @RequestParam final String path,
            @RequestParam(required = false) final Integer limit) {
        return rank(path, Metric.STATEMENT_COUNT, limit);
    }

    /**
     * Ranks members by nesting depth.
     *
     * @param path the source directory on the server
     * @param limit the maximum number of results
     * @return the ranked results, or 400 with an error code
     */
    @GetMapping("/nesting")
    @Operation(summary = "Rank members by control-flow nesting depth")
    public ResponseEntity<?> nesting(
            @Parameter(description = "Source directory")
            @RequestParam final String path,
            @RequestParam(required = false) final Integer limit) {
        return rank(path, Metric.NESTING_DEPTH, limit);
    }

    /**
     * Ranks members by both metrics in one pass.
     *
     * @param path the source directory on the server
     * @param limit the maximum number of results per metric
     * @return the full report, or 400 with an error code
     */
    @GetMapping("/report")
    @Operation(summary = "Rank members by every metric",
            description = "Parses the directory once and returns both"
                    + " rankings together with the number of scanned"
                    + " and skipped files.")
    public ResponseEntity<?> report(
            @Parameter(description = "Source directory")
            @RequestParam final String path,
            @RequestParam(required = false) final Integer limit) {

        LOG.info("Ranking report for {}", path);

        try {
            return ResponseEntity.ok(rankingService.rankAll(
                    Path.of(path), limitOrDefault(limit)));
        } catch (final DomainException e) {
            return failure(e.getMessage(), e.getErrorCode());
        } catch (final IllegalArgumentException e) {
            return failure(e.getMessage(), "INVALID_REQUEST");
        }
    }

    private ResponseEntity<?> rank(final String path, final Metric metric,
            final Integer limit) {

        LOG.info("Ranking {} by {}", path, metric.displayName());

        try {
            return ResponseEntity.ok(rankingService.rank(
                    Path.of(path), metric, limitOrDefault(limit)));
        } catch (final DomainException e) {
            return failure(e.getMessage(), e.getErrorCode());
        } catch (final IllegalArgumentException e) {
            return failure(e.getMessage(), "INVALID_REQUEST");
        }
    }

    private int limitOrDefault(final Integer limit) {
        return limit != null ? limit : defaultLimit;
    }

    private ResponseEntity<?> failure(final String message,
            final String errorCode) {
        LOG.warn("Ranking request failed: {}", message);
        return ResponseEntity.badRequest().body(
                Map.of("error", message, "errorCode", errorCode));
    }

}
