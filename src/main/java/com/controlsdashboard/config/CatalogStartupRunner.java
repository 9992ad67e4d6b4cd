package com.controlsdashboard.config;

import com.controlsdashboard.dto.BaselineImportSummary;
import com.controlsdashboard.dto.IngestionSummary;
import com.controlsdashboard.service.CatalogIngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Optionally loads a catalog and then a baseline profile when the application starts.
 * Both sources are blank by default, which disables the runner.
 */
@Component
public class CatalogStartupRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(CatalogStartupRunner.class);

    private final CatalogIngestionService catalogIngestionService;
    private final String catalogSource;
    private final String profileSource;
    private final String baselineName;

    public CatalogStartupRunner(CatalogIngestionService catalogIngestionService,
                                @Value("${app.catalog.startup.catalog-source:}") String catalogSource,
                                @Value("${app.catalog.startup.profile-source:}") String profileSource,
                                @Value("${app.catalog.startup.baseline-name:MODERATE}") String baselineName) {
        this.catalogIngestionService = catalogIngestionService;
        this.catalogSource = catalogSource;
        this.profileSource = profileSource;
        this.baselineName = baselineName;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!catalogSource.isBlank()) {
            IngestionSummary summary = catalogIngestionService.ingestCatalog(catalogSource);
            logger.info("Startup catalog ingestion finished: {}", summary);
        }
        if (!profileSource.isBlank()) {
            BaselineImportSummary summary = catalogIngestionService.importBaseline(profileSource, baselineName);
            logger.info("Startup baseline import finished: baseline {} with {} controls", summary.baselineId(), summary.controlsWritten());
        }
    }
}
