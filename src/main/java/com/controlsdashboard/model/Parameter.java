package com.controlsdashboard.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
@Entity
@Table(name = "parameters")
public class Parameter {

    @Id
    @Column(name = "parameter_id", nullable = false, columnDefinition = "TEXT")
    private String parameterId;

    @Column(name = "control_id", columnDefinition = "TEXT")
    private String controlId;

    @Column(name = "label", nullable = false, columnDefinition = "TEXT")
    private String label;

    /**
     * Null when the parameter has no guideline element at all; empty when the element has no paragraphs.
     */
    @Column(name = "guideline", columnDefinition = "TEXT")
    private String guideline;

    public Parameter() {
    }

    public Parameter(String parameterId, String controlId, String label, String guideline) {
        this.parameterId = parameterId;
        this.controlId = controlId;
        this.label = label;
        this.guideline = guideline;
    }
}
