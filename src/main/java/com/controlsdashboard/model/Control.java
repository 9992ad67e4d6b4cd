package com.controlsdashboard.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * A single catalog control. Rows are written once per control id and never updated.
 */
@Setter
@Getter
@Entity
@Table(name = "controls")
public class Control {

    @Id
    @Column(name = "control_id", nullable = false, columnDefinition = "TEXT")
    private String controlId;

    // Owning group id; the source schema calls this column catalog_id
    @Column(name = "catalog_id", columnDefinition = "TEXT")
    private String catalogId;

    @Column(name = "class", columnDefinition = "TEXT")
    private String controlClass;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    /**
     * Zero-padded display label, e.g. {@code AC-01}.
     */
    @Column(name = "label", columnDefinition = "TEXT")
    private String label;

    @Column(name = "statement", columnDefinition = "TEXT")
    private String statement;

    public Control() {
    }

    public Control(String controlId, String catalogId, String controlClass, String title, String label, String statement) {
        this.controlId = controlId;
        this.catalogId = catalogId;
        this.controlClass = controlClass;
        this.title = title;
        this.label = label;
        this.statement = statement;
    }
}
