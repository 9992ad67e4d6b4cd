package com.controlsdashboard.controller;

import com.controlsdashboard.dto.BaselineImportSummary;
import com.controlsdashboard.dto.IngestionSummary;
import com.controlsdashboard.model.ControlFamily;
import com.controlsdashboard.oscal.CatalogParseException;
import com.controlsdashboard.service.CatalogIngestionService;
import com.controlsdashboard.service.CatalogReadService;
import com.controlsdashboard.service.DocumentSourceException;
import com.controlsdashboard.service.MalformedCatalogException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Control Catalog", description = "OSCAL catalog normalization and baseline import endpoints")
public class CatalogController {

    private static final Logger logger = LoggerFactory.getLogger(CatalogController.class);

    private final CatalogIngestionService catalogIngestionService;
    private final CatalogReadService catalogReadService;

    @Autowired
    public CatalogController(CatalogIngestionService catalogIngestionService,
                             CatalogReadService catalogReadService) {
        this.catalogIngestionService = catalogIngestionService;
        this.catalogReadService = catalogReadService;
    }

    @Operation(summary = "Normalize an uploaded OSCAL catalog XML file")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Catalog normalized"),
            @ApiResponse(responseCode = "400", description = "File is empty, not XML, or missing required data"),
            @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    @PostMapping("/catalogs")
    public ResponseEntity<?> uploadCatalog(
            @Parameter(description = "The catalog XML file to upload.", required = true)
            @RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body("File is empty");
        }
        String sourceName = "file-upload:" + file.getOriginalFilename();
        logger.info("Received catalog upload '{}'", file.getOriginalFilename());
        try {
            IngestionSummary summary = catalogIngestionService.ingestCatalog(file.getBytes(), sourceName);
            return ResponseEntity.ok(summary);
        } catch (IOException e) {
            logger.error("Error reading uploaded file", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Error reading file");
        } catch (CatalogParseException | MalformedCatalogException e) {
            logger.error("Rejected catalog {}: {}", sourceName, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(e.getMessage());
        }
    }

    @Operation(summary = "Normalize a catalog from a classpath:, file: or s3:// source")
    @PostMapping("/catalogs/ingest")
    public ResponseEntity<?> ingestCatalog(
            @Parameter(description = "Document identifier", required = true)
            @RequestParam("source") String source) {
        try {
            return ResponseEntity.ok(catalogIngestionService.ingestCatalog(source));
        } catch (DocumentSourceException e) {
            logger.error("Could not load catalog source {}: {}", source, e.getMessage());
            return ResponseEntity.status(statusFor(e)).body(e.getMessage());
        } catch (CatalogParseException | MalformedCatalogException e) {
            logger.error("Rejected catalog {}: {}", source, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(e.getMessage());
        }
    }

    @Operation(summary = "Import an uploaded OSCAL profile as a named baseline")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Baseline imported"),
            @ApiResponse(responseCode = "400", description = "File is empty, not XML, or no baseline name given")
    })
    @PostMapping("/baselines")
    public ResponseEntity<?> uploadBaseline(
            @Parameter(description = "Baseline name, e.g. MODERATE", required = true)
            @RequestParam("name") String name,
            @Parameter(description = "The profile XML file to upload.", required = true)
            @RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body("File is empty");
        }
        String sourceName = "file-upload:" + file.getOriginalFilename();
        try {
            BaselineImportSummary summary = catalogIngestionService.importBaseline(file.getBytes(), sourceName, name);
            return ResponseEntity.ok(summary);
        } catch (IOException e) {
            logger.error("Error reading uploaded file", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Error reading file");
        } catch (CatalogParseException | IllegalArgumentException e) {
            logger.error("Rejected profile {}: {}", sourceName, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(e.getMessage());
        }
    }

    @Operation(summary = "Fetch a normalized control with its parameters, parts, props, links and enhancements")
    @GetMapping("/controls/{id}")
    public ResponseEntity<?> getControl(@PathVariable("id") String id) {
        return catalogReadService.loadControl(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Control not found: " + id));
    }

    @Operation(summary = "List control families")
    @GetMapping("/families")
    public List<ControlFamily> listFamilies() {
        return catalogReadService.listFamilies();
    }

    @Operation(summary = "List the control ids included in a baseline")
    @GetMapping("/baselines/{id}/controls")
    public List<String> listBaselineControls(@PathVariable("id") Integer id) {
        return catalogReadService.listBaselineControlIds(id);
    }

    private static HttpStatus statusFor(DocumentSourceException e) {
        switch (e.getReason()) {
            case INVALID_IDENTIFIER:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            default:
                return HttpStatus.BAD_GATEWAY;
        }
    }
}
