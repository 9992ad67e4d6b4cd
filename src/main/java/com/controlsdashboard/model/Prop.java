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
@Table(name = "props")
public class Prop {

    @Id
    @Column(name = "prop_id", nullable = false, columnDefinition = "TEXT")
    private String propId;

    @Column(name = "control_id", columnDefinition = "TEXT")
    private String controlId;

    @Column(name = "name", columnDefinition = "TEXT")
    private String name;

    @Column(name = "value", columnDefinition = "TEXT")
    private String value;

    @Column(name = "ns", columnDefinition = "TEXT")
    private String ns;

    public Prop() {
    }

    public Prop(String propId, String controlId, String name, String value, String ns) {
        this.propId = propId;
        this.controlId = controlId;
        this.name = name;
        this.value = value;
        this.ns = ns;
    }
}
