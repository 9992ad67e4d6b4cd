package com.controlsdashboard.service;

import com.controlsdashboard.model.Parameter;

import java.util.List;
import java.util.Map;

/**
 * Output of label resolution: parameter id to display label, plus one record per parameter node.
 */
public record ParameterResolution(
        Map<String, String> labels,
        List<Parameter> parameters
) {
    String labelFor(String parameterId) {
        return labelOrFallback(labels, parameterId);
    }

    /**
     * Label for {@code parameterId} in {@code labels}, falling back to the bracketed id.
     */
    static String labelOrFallback(Map<String, String> labels, String parameterId) {
        String label = labels.get(parameterId);
        return label != null ? label : ParameterLabelResolver.fallbackLabel(parameterId);
    }
}
