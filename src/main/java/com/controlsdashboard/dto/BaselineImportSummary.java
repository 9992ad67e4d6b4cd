package com.controlsdashboard.dto;

public record BaselineImportSummary(
        Integer baselineId,
        String name,
        String title,
        String lastModified,
        String version,
        int parties,
        int controlsListed,
        int controlsWritten
) {}
