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
@Table(name = "links")
public class Link {

    @Id
    @Column(name = "link_id", nullable = false, columnDefinition = "TEXT")
    private String linkId;

    @Column(name = "control_id", columnDefinition = "TEXT")
    private String controlId;

    @Column(name = "href", columnDefinition = "TEXT")
    private String href;

    @Column(name = "rel", columnDefinition = "TEXT")
    private String rel;

    @Column(name = "media_type", columnDefinition = "TEXT")
    private String mediaType;

    public Link() {
    }

    public Link(String linkId, String controlId, String href, String rel, String mediaType) {
        this.linkId = linkId;
        this.controlId = controlId;
        this.href = href;
        this.rel = rel;
        this.mediaType = mediaType;
    }
}
