package com.controlsdashboard.model;

import java.io.Serializable;

/**
 * Composite key for {@link BaselineControl}.
 */
public record BaselineControlId(
        Integer baselineId,
        String controlId
) implements Serializable {
}
