package com.controlsdashboard.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Setter
@Getter
@Entity
@Table(name = "control_families")
public class ControlFamily {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "family_code", nullable = false, unique = true, length = 8)
    private String familyCode;

    @Column(name = "family_name", nullable = false)
    private String familyName;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    // Set by the database: column default on insert, now() in the insert-or-ignore statement
    @Column(name = "created_at", insertable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", insertable = false, updatable = false)
    private OffsetDateTime updatedAt;

    public ControlFamily() {
    }

    public ControlFamily(String familyCode, String familyName, String description) {
        this.familyCode = familyCode;
        this.familyName = familyName;
        this.description = description;
    }
}
