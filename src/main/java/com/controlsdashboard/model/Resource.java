package com.controlsdashboard.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * Back-matter bibliographic entry. Re-extracting the same uuid overwrites title, location and citation.
 */
@Setter
@Getter
@Entity
@Table(name = "resources")
public class Resource {

    @Id
    @Column(name = "uuid", nullable = false, columnDefinition = "TEXT")
    private String uuid;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "location", columnDefinition = "TEXT")
    private String location;

    @Column(name = "citation", columnDefinition = "TEXT")
    private String citation;

    public Resource() {
    }

    public Resource(String uuid, String title, String location, String citation) {
        this.uuid = uuid;
        this.title = title;
        this.location = location;
        this.citation = citation;
    }
}
