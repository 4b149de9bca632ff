package co.fanki.complexity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Complexity Ranker Application.
 *
 * <p>Ranks the function-like members of a source directory by statement
 * count and by control-flow nesting depth. Runs as a REST service by
 * default, as a one-shot command with the {@code cli} profile, or as an
 * MCP stdio server with the {@code mcp} profile.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class ComplexityRankerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(ComplexityRankerApplication.class, args);
    }

}
