package co.fanki.complexity.config;

import co.fanki.complexity.analysis.domain.SourceParser;
import co.fanki.complexity.analysis.domain.java.JavaSourceParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the source front end.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class AnalysisConfiguration {

    /**
     * Creates the Java source parser.
     *
     * @return the parser used for every ranking run
     */
    @Bean
    public SourceParser sourceParser() {
        return new JavaSourceParser();
    }

}
