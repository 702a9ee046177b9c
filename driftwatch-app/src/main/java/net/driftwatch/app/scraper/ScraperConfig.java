package net.driftwatch.app.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.driftwatch.bootstrap.props.DriftwatchProperties;
import net.driftwatch.core.spi.Scraper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class ScraperConfig {

    @Bean
    @ConditionalOnProperty(prefix = "driftwatch.scraper", name = "snapshot-dir")
    public Scraper jsonFileScraper(DriftwatchProperties props, ObjectMapper mapper) {
        return new JsonFileScraper(Path.of(props.getScraper().getSnapshotDir()), mapper);
    }
}
