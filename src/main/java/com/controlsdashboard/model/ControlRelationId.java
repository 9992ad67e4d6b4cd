package com.controlsdashboard.model;

import java.io.Serializable;

/**
 * Composite key for {@link ControlRelation}.
 */
public record ControlRelationId(
        String parentControlId,
        String childControlId
) implements Serializable {
}
