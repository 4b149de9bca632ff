package co.fanki.complexity.config;

import co.fanki.complexity.analysis.application.ComplexityRankingService;
import co.fanki.complexity.analysis.application.RankingReportWriter;
import co.fanki.complexity.analysis.domain.Metric;
import co.fanki.complexity.analysis.domain.ScoredResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Configures the MCP stdio server exposing the rankings as tools.
 *
 * <p>When the {@code mcp.server.stdio} property is set to {@code true},
 * this configuration starts an MCP server that communicates via
 * stdin/stdout using the JSON-RPC protocol. Use the {@code mcp} profile,
 * which also disables the web server.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "mcp.server.stdio", havingValue = "true")
public class McpStdioServerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            McpStdioServerConfiguration.class);

    private static final String RANK_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "path": {
                  "type": "string",
                  "description": "The source directory to analyze"
                },
                "limit": {
                  "type": "integer",
                  "description": "Maximum number of results (defaults to 100)"
                }
              },
              "required": ["path"]
            }
            """;

    @Value("${ranking.limit:100}")
    private int defaultLimit = 100;

    /**
     * Creates the stdio transport provider for MCP communication.
     *
     * @param objectMapper the Jackson ObjectMapper for JSON serialization
     * @return the stdio server transport provider
     */
    @Bean
    StdioServerTransportProvider stdioServerTransportProvider(
            final ObjectMapper objectMapper) {
        return new StdioServerTransportProvider(objectMapper);
    }

    /**
     * Creates and configures the MCP synchronous server with the ranking
     * tools.
     *
     * @param transportProvider the stdio transport provider
     * @param rankingService the service computing the rankings
     * @param reportWriter formats rankings as report lines
     * @return the configured MCP sync server
     */
    @Bean
    McpSyncServer mcpSyncServer(
            final StdioServerTransportProvider transportProvider,
            final ComplexityRankingService rankingService,
            final RankingReportWriter reportWriter) {

        final McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo("complexity-ranker", "0.0.1")
                .capabilities(ServerCapabilities.builder()
                        .tools(true)
                        .build())
                .build();

        server.addTool(rankTool("rank_by_statement_count",
                "Rank the methods, constructors and other members of a"
                        + " Java source directory by the number of"
                        + " statements they contain. Each result line is"
                        + " 'value<TAB>file:line'.",
                Metric.STATEMENT_COUNT, rankingService, reportWriter));
        server.addTool(rankTool("rank_by_nesting_depth",
                "Rank the members of a Java source directory by their"
                        + " deepest chain of nested control-flow"
                        + " constructs (if, loops, switch, try,"
                        + " synchronized, lambdas). Each result line is"
                        + " 'value<TAB>file:line'.",
                Metric.NESTING_DEPTH, rankingService, reportWriter));

        LOG.info("MCP stdio server initialized with 2 tools");

        return server;
    }

    /**
     * Keeps the JVM alive while the MCP server is running.
     *
     * @return the command line runner that blocks on a latch
     */
    @Bean
    CommandLineRunner mcpServerRunner() {
        return args -> {
            LOG.info("MCP stdio server is running. Waiting for input...");
            new CountDownLatch(1).await();
        };
    }

    private McpServerFeatures.SyncToolSpecification rankTool(
            final String name, final String description, final Metric metric,
            final ComplexityRankingService rankingService,
            final RankingReportWriter reportWriter) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool(name, description, RANK_SCHEMA),
                (exchange, arguments) -> {
                    try {
                        final Path root = Path.of(
                                (String) arguments.get("path"));
                        final List<ScoredResult> results = rankingService
                                .rank(root, metric, limit(arguments));
                        return textResult(String.join("\n",
                                reportWriter.format(results)));
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private int limit(final Map<String, Object> arguments) {
        return arguments.get("limit") instanceof Number n
                ? n.intValue() : defaultLimit;
    }

    private CallToolResult textResult(final String text) {
        return new CallToolResult(
                List.of(new McpSchema.TextContent(text)), false);
    }

    private CallToolResult errorResult(final Exception e) {
        LOG.error("Tool execution error", e);
        return new CallToolResult(
                List.of(new McpSchema.TextContent(
                        "Error: " + e.getMessage())), true);
    }

}
