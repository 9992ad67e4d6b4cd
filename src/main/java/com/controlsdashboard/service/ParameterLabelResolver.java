package com.controlsdashboard.service;

import com.controlsdashboard.model.Parameter;
import com.controlsdashboard.oscal.OscalXml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Resolves display labels for every {@code param} in a catalog.
 *
 * <p>Runs in two passes: the whole document is scanned first to map each parameter id to its
 * nearest enclosing control, then labels are resolved in document order. Resolution order for one
 * parameter, first non-empty wins:
 * <ol>
 *     <li>the {@code label} child's text</li>
 *     <li>the {@code select} child's choices joined with {@code " | "}</li>
 *     <li>the value of a {@code prop name="label"} child</li>
 *     <li>the {@code label} attribute</li>
 *     <li>the id itself in angle brackets</li>
 * </ol>
 */
@Component
public class ParameterLabelResolver {

    private static final Logger logger = LoggerFactory.getLogger(ParameterLabelResolver.class);

    static final String CHOICE_DELIMITER = " | ";

    public ParameterResolution resolve(Element root) {
        Map<String, String> owners = buildOwnerIndex(root);

        Map<String, String> labels = new LinkedHashMap<>();
        List<Parameter> parameters = new ArrayList<>();
        for (Element param : OscalXml.descendants(root, "param")) {
            String paramId = OscalXml.attribute(param, "id");
            if (paramId == null || paramId.isBlank()) {
                logger.warn("Skipping param without an id under control {}",
                        controlIdOf(OscalXml.nearestAncestor(param, "control")));
                continue;
            }
            String label = resolveLabel(param, paramId);
            labels.put(paramId, label);

            String owner = owners.get(paramId);
            if (owner == null) {
                logger.warn("Parameter {} has no owning control; storing it without one", paramId);
            }
            String guideline = resolveGuideline(param);
            parameters.add(new Parameter(paramId, owner, label, guideline));
            logger.debug(" {}: parameter {} with label {}, guideline: [ {} ]", owner, paramId, label, guideline);
        }
        logger.info("Resolved labels for {} parameters", parameters.size());
        return new ParameterResolution(labels, parameters);
    }

    /**
     * Maps every parameter id to the id of its nearest enclosing control.
     */
    Map<String, String> buildOwnerIndex(Element root) {
        Map<String, String> owners = new LinkedHashMap<>();
        for (Element param : OscalXml.descendants(root, "param")) {
            String paramId = OscalXml.attribute(param, "id");
            if (paramId == null) {
                continue;
            }
            String owner = controlIdOf(OscalXml.nearestAncestor(param, "control"));
            if (owner != null && !owner.isBlank()) {
                owners.put(paramId, owner);
            }
        }
        return owners;
    }

    String resolveLabel(Element param, String paramId) {
        String label = nonBlank(OscalXml.text(OscalXml.firstChild(param, "label")));

        if (label == null) {
            Element select = OscalXml.firstChild(param, "select");
            if (select != null) {
                String joined = OscalXml.children(select, "choice").stream()
                        .map(OscalXml::text)
                        .filter(Objects::nonNull)
                        .map(String::strip)
                        .filter(choice -> !choice.isEmpty())
                        .collect(Collectors.joining(CHOICE_DELIMITER));
                label = nonBlank(joined);
            }
        }

        if (label == null) {
            for (Element prop : OscalXml.children(param, "prop")) {
                if ("label".equals(OscalXml.attribute(prop, "name"))) {
                    label = nonBlank(OscalXml.attribute(prop, "value"));
                    break;
                }
            }
        }

        if (label == null) {
            label = nonBlank(OscalXml.attribute(param, "label"));
        }

        return label != null ? label : fallbackLabel(paramId);
    }

    /**
     * Space-joined guideline paragraphs; null when the parameter has no guideline element.
     */
    String resolveGuideline(Element param) {
        Element guideline = OscalXml.firstChild(param, "guideline");
        if (guideline == null) {
            return null;
        }
        return OscalXml.children(guideline, "p").stream()
                .map(OscalXml::text)
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining(" "));
    }

    static String fallbackLabel(String paramId) {
        return "<" + paramId + ">";
    }

    private static String controlIdOf(Element control) {
        return control == null ? null : OscalXml.attribute(control, "id");
    }

    private static String nonBlank(String value) {
        if (value == null) {
            return null;
        }
        String stripped = value.strip();
        return stripped.isEmpty() ? null : stripped;
    }
}
