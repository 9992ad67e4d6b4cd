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
@Table(name = "parts")
public class Part {

    @Id
    @Column(name = "part_id", nullable = false, columnDefinition = "TEXT")
    private String partId;

    @Column(name = "control_id", columnDefinition = "TEXT")
    private String controlId;

    @Column(name = "name", columnDefinition = "TEXT")
    private String name;

    @Column(name = "prose", columnDefinition = "TEXT")
    private String prose;

    @Column(name = "\"order\"")
    private Integer order;

    public Part() {
    }

    public Part(String partId, String controlId, String name, String prose, Integer order) {
        this.partId = partId;
        this.controlId = controlId;
        this.name = name;
        this.prose = prose;
        this.order = order;
    }
}
