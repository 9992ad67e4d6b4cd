package com.controlsdashboard.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * Nesting of one control (an enhancement) inside another.
 */
@Setter
@Getter
@Entity
@Table(name = "control_relations")
@IdClass(ControlRelationId.class)
public class ControlRelation {

    @Id
    @Column(name = "parent_control_id", nullable = false, columnDefinition = "TEXT")
    private String parentControlId;

    @Id
    @Column(name = "child_control_id", nullable = false, columnDefinition = "TEXT")
    private String childControlId;

    public ControlRelation() {
    }

    public ControlRelation(String parentControlId, String childControlId) {
        this.parentControlId = parentControlId;
        this.childControlId = childControlId;
    }
}
