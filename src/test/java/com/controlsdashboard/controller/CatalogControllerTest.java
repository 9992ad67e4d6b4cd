package com.controlsdashboard.controller;

import com.controlsdashboard.dto.BaselineImportSummary;
import com.controlsdashboard.dto.ControlView;
import com.controlsdashboard.dto.IngestionSummary;
import com.controlsdashboard.model.Control;
import com.controlsdashboard.oscal.CatalogParseException;
import com.controlsdashboard.service.CatalogIngestionService;
import com.controlsdashboard.service.CatalogReadService;
import com.controlsdashboard.service.DocumentSourceException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CatalogController.class)
class CatalogControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CatalogIngestionService catalogIngestionService;

    @MockBean
    private CatalogReadService catalogReadService;

    @Test
    void uploadedCatalogIsNormalized() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "catalog.xml", "application/xml", "<catalog/>".getBytes());
        when(catalogIngestionService.ingestCatalog(any(byte[].class), eq("file-upload:catalog.xml")))
                .thenReturn(new IngestionSummary());

        mockMvc.perform(multipart("/api/catalogs").file(file))
                .andExpect(status().isOk());
    }

    @Test
    void emptyUploadIsRejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "catalog.xml", "application/xml", new byte[0]);

        mockMvc.perform(multipart("/api/catalogs").file(file))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unparsableCatalogIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "bad.xml", "application/xml", "<catalog>".getBytes());
        when(catalogIngestionService.ingestCatalog(any(byte[].class), any()))
                .thenThrow(new CatalogParseException("Failed to parse bad.xml"));

        mockMvc.perform(multipart("/api/catalogs").file(file))
                .andExpect(status().isBadRequest());
    }

    @Test
    void missingSourceIsNotFound() throws Exception {
        when(catalogIngestionService.ingestCatalog("classpath:missing.xml"))
                .thenThrow(new DocumentSourceException(DocumentSourceException.Reason.NOT_FOUND, "Resource not found"));

        mockMvc.perform(post("/api/catalogs/ingest").param("source", "classpath:missing.xml"))
                .andExpect(status().isNotFound());
    }

    @Test
    void s3FailureIsBadGateway() throws Exception {
        when(catalogIngestionService.ingestCatalog("s3://bucket/x.xml"))
                .thenThrow(new DocumentSourceException(DocumentSourceException.Reason.READ_FAILED, "timeout"));

        mockMvc.perform(post("/api/catalogs/ingest").param("source", "s3://bucket/x.xml"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void baselineUploadReturnsSummary() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "profile.xml", "application/xml", "<profile/>".getBytes());
        when(catalogIngestionService.importBaseline(any(byte[].class), eq("file-upload:profile.xml"), eq("MODERATE")))
                .thenReturn(new BaselineImportSummary(3, "MODERATE", "Moderate", null, "1.0", 1, 2, 2));

        mockMvc.perform(multipart("/api/baselines").file(file).param("name", "MODERATE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.baselineId").value(3))
                .andExpect(jsonPath("$.controlsWritten").value(2));
    }

    @Test
    void blankBaselineNameIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "profile.xml", "application/xml", "<profile/>".getBytes());
        when(catalogIngestionService.importBaseline(any(byte[].class), any(), eq(" ")))
                .thenThrow(new IllegalArgumentException("Baseline name is required"));

        mockMvc.perform(multipart("/api/baselines").file(file).param("name", " "))
                .andExpect(status().isBadRequest());
    }

    @Test
    void controlLookup() throws Exception {
        Control control = new Control("ac-1", "ac", null, "Policy", "AC-01", null);
        when(catalogReadService.loadControl("ac-1"))
                .thenReturn(Optional.of(new ControlView(control, List.of(), List.of(), List.of(), List.of(), List.of("ac-1.1"))));
        when(catalogReadService.loadControl("zz-9")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/controls/ac-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.control.controlId").value("ac-1"))
                .andExpect(jsonPath("$.childControlIds[0]").value("ac-1.1"));
        mockMvc.perform(get("/api/controls/zz-9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void listsBaselineControls() throws Exception {
        when(catalogReadService.listBaselineControlIds(3)).thenReturn(List.of("ac-1", "ac-2"));

        mockMvc.perform(get("/api/baselines/3/controls"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1]").value("ac-2"));
    }
}
