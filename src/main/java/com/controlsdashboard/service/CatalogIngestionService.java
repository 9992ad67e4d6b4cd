package com.controlsdashboard.service;

import com.controlsdashboard.dto.BaselineImportSummary;
import com.controlsdashboard.dto.IngestionSummary;
import com.controlsdashboard.oscal.OscalDocumentParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;

/**
 * Source-aware entry points. Each document is read and parsed completely before the
 * normalization transaction begins, so an unparsable document writes nothing.
 */
@Service
public class CatalogIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(CatalogIngestionService.class);

    private final DocumentSourceLoader documentSourceLoader;
    private final OscalDocumentParser documentParser;
    private final CatalogNormalizationService catalogNormalizationService;
    private final BaselineProfileImporter baselineProfileImporter;

    public CatalogIngestionService(DocumentSourceLoader documentSourceLoader,
                                   OscalDocumentParser documentParser,
                                   CatalogNormalizationService catalogNormalizationService,
                                   BaselineProfileImporter baselineProfileImporter) {
        this.documentSourceLoader = documentSourceLoader;
        this.documentParser = documentParser;
        this.catalogNormalizationService = catalogNormalizationService;
        this.baselineProfileImporter = baselineProfileImporter;
    }

    public IngestionSummary ingestCatalog(String identifier) {
        logger.info("Starting catalog ingestion for identifier: {}", identifier);
        return ingestCatalog(documentSourceLoader.load(identifier), identifier);
    }

    public IngestionSummary ingestCatalog(byte[] content, String sourceName) {
        Document document = documentParser.parse(content, sourceName);
        IngestionSummary summary = catalogNormalizationService.normalizeCatalog(document);
        summary.setSource(sourceName);
        return summary;
    }

    public BaselineImportSummary importBaseline(String identifier, String baselineName) {
        logger.info("Starting baseline import '{}' for identifier: {}", baselineName, identifier);
        return importBaseline(documentSourceLoader.load(identifier), identifier, baselineName);
    }

    public BaselineImportSummary importBaseline(byte[] content, String sourceName, String baselineName) {
        Document document = documentParser.parse(content, sourceName);
        return baselineProfileImporter.importProfile(document, baselineName);
    }
}
