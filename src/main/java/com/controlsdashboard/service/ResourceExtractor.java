package com.controlsdashboard.service;

import com.controlsdashboard.model.Resource;
import com.controlsdashboard.oscal.OscalXml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code back-matter/resource} entries. A document without back-matter yields nothing.
 */
@Component
public class ResourceExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ResourceExtractor.class);

    public List<Resource> extract(Element root) {
        List<Resource> resources = new ArrayList<>();
        Element backMatter = OscalXml.firstChild(root, "back-matter");
        if (backMatter == null) {
            logger.debug("No back-matter present");
            return resources;
        }
        for (Element resource : OscalXml.children(backMatter, "resource")) {
            String uuid = OscalXml.attribute(resource, "uuid");
            if (uuid == null || uuid.isBlank()) {
                logger.warn("Skipping back-matter resource without a uuid");
                continue;
            }
            String title = OscalXml.trimmedChildText(resource, "title");
            Element rlink = OscalXml.firstChild(resource, "rlink");
            String location = OscalXml.attribute(rlink, "href");
            resources.add(new Resource(uuid, title, location, citation(resource)));
        }
        return resources;
    }

    /**
     * Full text of {@code citation/text}, or of {@code citation} itself when it has no text element.
     */
    static String citation(Element resource) {
        Element citation = OscalXml.firstChild(resource, "citation");
        if (citation == null) {
            return null;
        }
        Element text = OscalXml.firstChild(citation, "text");
        return OscalXml.fullText(text != null ? text : citation).strip();
    }
}
