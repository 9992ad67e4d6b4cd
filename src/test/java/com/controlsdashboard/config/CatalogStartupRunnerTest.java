package com.controlsdashboard.config;

import com.controlsdashboard.dto.BaselineImportSummary;
import com.controlsdashboard.dto.IngestionSummary;
import com.controlsdashboard.service.CatalogIngestionService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogStartupRunnerTest {

    @Mock
    private CatalogIngestionService catalogIngestionService;

    @Test
    void doesNothingWhenNoSourcesConfigured() {
        new CatalogStartupRunner(catalogIngestionService, "", "", "MODERATE")
                .run(new DefaultApplicationArguments());

        verifyNoInteractions(catalogIngestionService);
    }

    @Test
    void ingestsCatalogBeforeProfile() {
        when(catalogIngestionService.ingestCatalog("classpath:catalog.xml")).thenReturn(new IngestionSummary());
        when(catalogIngestionService.importBaseline("classpath:profile.xml", "LOW"))
                .thenReturn(new BaselineImportSummary(1, "LOW", null, null, null, 0, 3, 3));

        new CatalogStartupRunner(catalogIngestionService, "classpath:catalog.xml", "classpath:profile.xml", "LOW")
                .run(new DefaultApplicationArguments());

        InOrder order = inOrder(catalogIngestionService);
        order.verify(catalogIngestionService).ingestCatalog("classpath:catalog.xml");
        order.verify(catalogIngestionService).importBaseline("classpath:profile.xml", "LOW");
    }
}
