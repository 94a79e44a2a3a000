package mail.taxonomy.app.config;

import lombok.extern.slf4j.Slf4j;
import mail.taxonomy.app.schema.TaxonomyCatalog;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(TaxonomyProperties.class)
public class TaxonomyConfig {

    @Bean
    public TaxonomyCatalog taxonomyCatalog(TaxonomyProperties properties) {
        TaxonomyCatalog catalog = TaxonomyCatalog.load(properties.getCatalog().getLocation());
        log.info("Loaded taxonomy catalog from {} with business types {}",
                properties.getCatalog().getLocation(), catalog.businessTypes());
        return catalog;
    }
}
