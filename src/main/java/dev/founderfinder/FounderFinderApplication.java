package dev.founderfinder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Founder Finder aggregation engine.
 *
 * <p>Runs without a web server; callers obtain {@link
 * dev.founderfinder.pipeline.AggregationPipeline} from the context and invoke it directly.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class FounderFinderApplication {
    public static void main(String[] args) {
        SpringApplication.run(FounderFinderApplication.class, args);
    }
}
