package com.controlsdashboard.service;

import com.controlsdashboard.model.Control;
import com.controlsdashboard.model.ControlRelation;
import com.controlsdashboard.model.Link;
import com.controlsdashboard.model.Part;
import com.controlsdashboard.model.Prop;
import com.controlsdashboard.oscal.OscalXml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns one {@code control} element into a {@link Control} row plus its parts, props, links and
 * child relations.
 *
 * <p>Satellite elements are collected according to the configured {@link TraversalScope}. The
 * statement is always read from a <em>direct</em> {@code part name="statement"} child.
 */
@Component
public class ControlExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ControlExtractor.class);

    static final String INDENT = "    ";

    private final PartTreeFlattener partTreeFlattener;
    private final NarrativeReconstructor narrativeReconstructor;
    private final SatelliteKeyService satelliteKeyService;
    private final TraversalScope satelliteScope;
    private final boolean immediateRelationsOnly;
    private final boolean strict;

    @Autowired
    public ControlExtractor(PartTreeFlattener partTreeFlattener,
                            NarrativeReconstructor narrativeReconstructor,
                            SatelliteKeyService satelliteKeyService,
                            @Value("${app.catalog.satellite-scope:all_descendants}") String satelliteScope,
                            @Value("${app.catalog.relations.immediate-only:true}") boolean immediateRelationsOnly,
                            @Value("${app.catalog.strict:false}") boolean strict) {
        this(partTreeFlattener, narrativeReconstructor, satelliteKeyService,
                TraversalScope.valueOf(satelliteScope.trim().toUpperCase(Locale.ROOT)),
                immediateRelationsOnly, strict);
    }

    public ControlExtractor(PartTreeFlattener partTreeFlattener,
                            NarrativeReconstructor narrativeReconstructor,
                            SatelliteKeyService satelliteKeyService,
                            TraversalScope satelliteScope,
                            boolean immediateRelationsOnly,
                            boolean strict) {
        this.partTreeFlattener = partTreeFlattener;
        this.narrativeReconstructor = narrativeReconstructor;
        this.satelliteKeyService = satelliteKeyService;
        this.satelliteScope = satelliteScope;
        this.immediateRelationsOnly = immediateRelationsOnly;
        this.strict = strict;
    }

    /**
     * Extracts one control.
     *
     * @return empty when the control has no id and strict mode is off
     * @throws MalformedCatalogException when the control has no id and strict mode is on
     */
    public Optional<ExtractedControl> extract(Element control, String groupId, Map<String, String> labels) {
        String controlId = OscalXml.attribute(control, "id");
        if (controlId == null || controlId.isBlank()) {
            String title = OscalXml.trimmedChildText(control, "title");
            if (strict) {
                throw new MalformedCatalogException("Control without id in group " + groupId + " (title: " + title + ")");
            }
            logger.warn("Skipping control without id in group {} (title: {})", groupId, title);
            return Optional.empty();
        }

        String controlClass = OscalXml.attribute(control, "class");
        String title = OscalXml.childText(control, "title");
        String label = zeroPaddedLabel(control);

        List<Part> parts = extractParts(control, controlId, labels);
        List<Prop> props = extractProps(control, controlId);
        List<Link> links = extractLinks(control, controlId);
        List<ControlRelation> relations = extractRelations(control, controlId);
        String statement = buildStatement(control, controlId, labels);

        Control row = new Control(controlId, groupId, controlClass, title, label, statement);
        logger.debug("Group {} - control {} with class {}, title: {}, label: {}", groupId, controlId, controlClass, title, label);
        return Optional.of(new ExtractedControl(row, parts, props, links, relations));
    }

    /**
     * Value of a direct child carrying {@code name="label"} and {@code class="zero-padded"}; the last match wins.
     */
    static String zeroPaddedLabel(Element control) {
        String label = null;
        for (Element child : OscalXml.childElements(control)) {
            if ("label".equals(OscalXml.attribute(child, "name"))
                    && "zero-padded".equals(OscalXml.attribute(child, "class"))) {
                label = OscalXml.attribute(child, "value");
            }
        }
        return label;
    }

    private List<Part> extractParts(Element control, String controlId, Map<String, String> labels) {
        List<Part> parts = new ArrayList<>();
        for (Element part : satellites(control, "part")) {
            String id = satelliteKeyService.satelliteId(controlId, "part", OscalXml.elementPath(control, part));
            parts.add(new Part(id, controlId, OscalXml.attribute(part, "name"), prose(part, labels), order(part, controlId)));
        }
        return parts;
    }

    private List<Prop> extractProps(Element control, String controlId) {
        List<Prop> props = new ArrayList<>();
        for (Element prop : satellites(control, "prop")) {
            String id = satelliteKeyService.satelliteId(controlId, "prop", OscalXml.elementPath(control, prop));
            props.add(new Prop(id, controlId,
                    OscalXml.attribute(prop, "name"),
                    OscalXml.attribute(prop, "value"),
                    OscalXml.attribute(prop, "ns")));
        }
        return props;
    }

    private List<Link> extractLinks(Element control, String controlId) {
        List<Link> links = new ArrayList<>();
        for (Element link : satellites(control, "link")) {
            String id = satelliteKeyService.satelliteId(controlId, "link", OscalXml.elementPath(control, link));
            links.add(new Link(id, controlId,
                    OscalXml.attribute(link, "href"),
                    OscalXml.attribute(link, "rel"),
                    OscalXml.attribute(link, "media-type")));
        }
        return links;
    }

    private List<ControlRelation> extractRelations(Element control, String controlId) {
        List<Element> children = immediateRelationsOnly
                ? OscalXml.descendantsWithin(control, "control", "control")
                : OscalXml.descendants(control, "control");
        List<ControlRelation> relations = new ArrayList<>();
        for (Element child : children) {
            String childId = OscalXml.attribute(child, "id");
            if (childId == null || childId.isBlank()) {
                logger.warn("Control {} has a nested control without an id; relation skipped", controlId);
                continue;
            }
            if (childId.equals(controlId)) {
                logger.warn("Control {} is nested inside itself; self relation skipped", controlId);
                continue;
            }
            relations.add(new ControlRelation(controlId, childId));
        }
        return relations;
    }

    private String buildStatement(Element control, String controlId, Map<String, String> labels) {
        Element statementPart = null;
        for (Element part : OscalXml.children(control, "part")) {
            if ("statement".equals(OscalXml.attribute(part, "name"))) {
                statementPart = part;
            }
        }
        if (statementPart == null) {
            return null;
        }
        logger.debug("Building statement for control {} from part {}", controlId, OscalXml.attribute(statementPart, "id"));
        return assembleStatement(partTreeFlattener.flatten(statementPart, labels));
    }

    /**
     * One line per fragment: {@code label text}, trimmed, indented four spaces per depth level.
     */
    static String assembleStatement(List<StatementFragment> fragments) {
        return fragments.stream()
                .map(fragment -> {
                    String label = fragment.label() != null ? fragment.label() : "";
                    String line = (label + " " + fragment.text()).strip();
                    return INDENT.repeat(fragment.depth()) + line;
                })
                .collect(Collectors.joining("\n"));
    }

    private List<Element> satellites(Element control, String localName) {
        switch (satelliteScope) {
            case DIRECT_CHILDREN:
                return OscalXml.children(control, localName);
            case OWN_SUBTREE:
                return OscalXml.descendantsWithin(control, localName, "control");
            default:
                return OscalXml.descendants(control, localName);
        }
    }

    /**
     * A {@code prose} child's text when present, otherwise the part's own paragraphs joined by line breaks.
     */
    private String prose(Element part, Map<String, String> labels) {
        String prose = OscalXml.childText(part, "prose");
        if (prose != null) {
            return prose;
        }
        List<Element> paragraphs = OscalXml.children(part, "p");
        if (paragraphs.isEmpty()) {
            return null;
        }
        return paragraphs.stream()
                .map(p -> narrativeReconstructor.reconstruct(p, labels))
                .collect(Collectors.joining("\n"));
    }

    private Integer order(Element part, String controlId) {
        String order = OscalXml.attribute(part, "order");
        if (order == null || order.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(order.trim());
        } catch (NumberFormatException e) {
            logger.warn("Control {}: ignoring non-numeric part order '{}'", controlId, order);
            return null;
        }
    }
}
