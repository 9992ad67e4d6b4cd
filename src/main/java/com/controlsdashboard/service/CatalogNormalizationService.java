package com.controlsdashboard.service;

import com.controlsdashboard.dto.IngestionSummary;
import com.controlsdashboard.model.ControlFamily;
import com.controlsdashboard.model.ControlRelation;
import com.controlsdashboard.model.Link;
import com.controlsdashboard.model.Parameter;
import com.controlsdashboard.model.Part;
import com.controlsdashboard.model.Prop;
import com.controlsdashboard.model.Resource;
import com.controlsdashboard.oscal.OscalXml;
import com.controlsdashboard.repository.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Normalizes a parsed catalog into the relational tables.
 *
 * <p>Order of work: control families, parameters (two-pass label resolution), groups and their
 * controls, then back-matter resources. All writes of one document share one transaction.
 */
@Service
public class CatalogNormalizationService {

    private static final Logger logger = LoggerFactory.getLogger(CatalogNormalizationService.class);

    static final String FAMILY_CLASS = "family";

    private final CatalogStore catalogStore;
    private final ParameterLabelResolver parameterLabelResolver;
    private final ControlExtractor controlExtractor;
    private final ResourceExtractor resourceExtractor;

    public CatalogNormalizationService(CatalogStore catalogStore,
                                       ParameterLabelResolver parameterLabelResolver,
                                       ControlExtractor controlExtractor,
                                       ResourceExtractor resourceExtractor) {
        this.catalogStore = catalogStore;
        this.parameterLabelResolver = parameterLabelResolver;
        this.controlExtractor = controlExtractor;
        this.resourceExtractor = resourceExtractor;
    }

    @Transactional
    public IngestionSummary normalizeCatalog(Document document) {
        Element root = document.getDocumentElement();
        IngestionSummary summary = new IngestionSummary();

        populateControlFamilies(root, summary);

        ParameterResolution resolution = parameterLabelResolver.resolve(root);
        for (Parameter parameter : resolution.parameters()) {
            summary.countParameterWritten(catalogStore.insertParameter(parameter));
        }

        parseGroups(root, resolution.labels(), summary);
        parseResources(root, summary);

        logger.info("Catalog normalized: {}", summary);
        return summary;
    }

    /**
     * Drives control extraction for every group at any depth, then for controls placed directly
     * under the catalog root. A control inside nested groups is extracted once per enclosing
     * group; the first (outermost) group's row is the one kept.
     */
    void parseGroups(Element root, Map<String, String> labels, IngestionSummary summary) {
        for (Element group : OscalXml.descendants(root, "group")) {
            String groupId = OscalXml.attribute(group, "id");
            logger.info("Group ID: {}, Title: {}", groupId, OscalXml.trimmedChildText(group, "title"));
            summary.incrementGroups();
            for (Element control : OscalXml.descendants(group, "control")) {
                persistControl(control, groupId, labels, summary);
            }
        }

        List<Element> ungrouped = new ArrayList<>();
        for (Element control : OscalXml.children(root, "control")) {
            ungrouped.add(control);
            ungrouped.addAll(OscalXml.descendants(control, "control"));
        }
        if (!ungrouped.isEmpty()) {
            String catalogId = OscalXml.attribute(root, "uuid");
            logger.info("Catalog {}: {} controls outside any group", catalogId, ungrouped.size());
            for (Element control : ungrouped) {
                persistControl(control, catalogId, labels, summary);
            }
        }
    }

    private void persistControl(Element element, String groupId, Map<String, String> labels, IngestionSummary summary) {
        Optional<ExtractedControl> extracted = controlExtractor.extract(element, groupId, labels);
        if (extracted.isEmpty()) {
            summary.incrementControlsSkipped();
            return;
        }
        ExtractedControl ec = extracted.get();
        summary.incrementControlsExtracted();
        for (Part part : ec.parts()) {
            summary.countPartWritten(catalogStore.insertPart(part));
        }
        for (Prop prop : ec.props()) {
            summary.countPropWritten(catalogStore.insertProp(prop));
        }
        for (Link link : ec.links()) {
            summary.countLinkWritten(catalogStore.insertLink(link));
        }
        for (ControlRelation relation : ec.relations()) {
            summary.countRelationWritten(catalogStore.insertRelation(relation));
        }
        boolean written = catalogStore.insertControl(ec.control());
        summary.countControlWritten(written);
        logger.debug("Group {} - control {} {}", groupId, ec.control().getControlId(), written ? "inserted" : "already present");
    }

    /**
     * One family per top-level {@code group class="family"} that has both an id and a title.
     */
    void populateControlFamilies(Element root, IngestionSummary summary) {
        for (Element group : OscalXml.children(root, "group")) {
            if (!FAMILY_CLASS.equals(OscalXml.attribute(group, "class"))) {
                continue;
            }
            String familyCode = OscalXml.attribute(group, "id");
            String familyName = OscalXml.trimmedChildText(group, "title");
            if (familyCode == null || familyCode.isBlank() || familyName == null || familyName.isEmpty()) {
                logger.warn("Family group without id or title skipped (id: {})", familyCode);
                continue;
            }
            ControlFamily family = new ControlFamily(familyCode, familyName, overview(group));
            summary.countFamilyWritten(catalogStore.insertFamily(family));
        }
    }

    private static String overview(Element group) {
        for (Element part : OscalXml.children(group, "part")) {
            if ("overview".equals(OscalXml.attribute(part, "name"))) {
                String text = OscalXml.fullText(part).strip();
                return text.isEmpty() ? null : text;
            }
        }
        return null;
    }

    void parseResources(Element root, IngestionSummary summary) {
        for (Resource resource : resourceExtractor.extract(root)) {
            catalogStore.upsertResource(resource);
            summary.incrementResourcesUpserted();
            logger.debug("Inserted/updated resource uuid {}, title \"{}\", location \"{}\"",
                    resource.getUuid(), resource.getTitle(), resource.getLocation());
        }
    }
}
