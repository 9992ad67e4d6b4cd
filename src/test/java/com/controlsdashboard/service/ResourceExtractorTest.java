package com.controlsdashboard.service;

import com.controlsdashboard.model.Resource;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceExtractorTest {

    private final ResourceExtractor extractor = new ResourceExtractor();

    @Test
    void citationWithoutTextChildUsesFullCitationText() {
        Element root = OscalFixtures.element("catalog", "uuid=\"c\"",
                "<back-matter>"
                        + "<resource uuid=\"r-1\"><title>One</title><citation> Lead <em>x</em> tail </citation></resource>"
                        + "<resource uuid=\"r-2\"><title/><rlink href=\"h1\"/><rlink href=\"h2\"/></resource>"
                        + "</back-matter>");

        List<Resource> resources = extractor.extract(root);

        assertThat(resources).hasSize(2);
        assertThat(resources.get(0).getCitation()).isEqualTo("Lead x tail");
        assertThat(resources.get(0).getLocation()).isNull();
        assertThat(resources.get(1).getTitle()).isNull();
        assertThat(resources.get(1).getLocation()).isEqualTo("h1");
        assertThat(resources.get(1).getCitation()).isNull();
    }

    @Test
    void skipsResourcesWithoutUuid() {
        Element root = OscalFixtures.element("catalog", "",
                "<back-matter><resource><title>No uuid</title></resource><resource uuid=\"r-3\"/></back-matter>");

        assertThat(extractor.extract(root)).extracting(Resource::getUuid).containsExactly("r-3");
    }
}
