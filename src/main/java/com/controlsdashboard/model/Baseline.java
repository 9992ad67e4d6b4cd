package com.controlsdashboard.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * One imported profile document. A new row is created per import.
 */
@Setter
@Getter
@Entity
@Table(name = "baselines")
public class Baseline {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "baseline_id", updatable = false, nullable = false)
    private Integer baselineId;

    @Column(name = "name", nullable = false, columnDefinition = "TEXT")
    private String name;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    // Kept as the literal metadata string; profiles do not agree on a timestamp format
    @Column(name = "last_modified", columnDefinition = "TEXT")
    private String lastModified;

    @Column(name = "party_details", columnDefinition = "TEXT")
    private String partyDetails; // JSON array of PartyDetail

    @Column(name = "version", columnDefinition = "TEXT")
    private String version;

    public Baseline() {
    }

    public Baseline(String name, String title, String lastModified, String partyDetails, String version) {
        this.name = name;
        this.title = title;
        this.lastModified = lastModified;
        this.partyDetails = partyDetails;
        this.version = version;
    }
}
