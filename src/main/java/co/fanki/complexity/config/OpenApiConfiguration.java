package co.fanki.complexity.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the ranking API.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Complexity Ranker API")
                        .description("""
                                Ranks the members of a Java source directory.

                                ## Metrics
                                - **Statement count**: simple statements in the member, \
                                at any depth
                                - **Nesting depth**: longest chain of nested if, loop, \
                                switch, try, synchronized and lambda constructs

                                Ties are broken by file name, then by line.

                                ## MCP Tools
                                - `rank_by_statement_count`
                                - `rank_by_nesting_depth`
                                """)
                        .version("0.0.1"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
