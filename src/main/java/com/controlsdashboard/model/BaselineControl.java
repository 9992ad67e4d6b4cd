package com.controlsdashboard.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
@Entity
@Table(name = "baseline_controls")
@IdClass(BaselineControlId.class)
public class BaselineControl {

    @Id
    @Column(name = "baseline_id", nullable = false)
    private Integer baselineId;

    @Id
    @Column(name = "control_id", nullable = false, columnDefinition = "TEXT")
    private String controlId;

    public BaselineControl() {
    }

    public BaselineControl(Integer baselineId, String controlId) {
        this.baselineId = baselineId;
        this.controlId = controlId;
    }
}
