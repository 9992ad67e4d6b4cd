package com.controlsdashboard.service;

import com.controlsdashboard.oscal.OscalXml;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Flattens a nested {@code part} tree into document-ordered paragraph fragments.
 *
 * <p>A part's own paragraphs are emitted before any of its child parts are entered, and child
 * parts are visited in document order. Statement assembly depends on this order.
 */
@Component
public class PartTreeFlattener {

    private final NarrativeReconstructor narrativeReconstructor;

    public PartTreeFlattener(NarrativeReconstructor narrativeReconstructor) {
        this.narrativeReconstructor = narrativeReconstructor;
    }

    public List<StatementFragment> flatten(Element part, Map<String, String> labels) {
        List<StatementFragment> fragments = new ArrayList<>();
        flatten(part, labels, Collections.emptyList(), 0, fragments);
        return fragments;
    }

    private void flatten(Element part,
                         Map<String, String> labels,
                         List<String> path,
                         int depth,
                         List<StatementFragment> out) {
        String partId = OscalXml.attribute(part, "id");
        String partName = OscalXml.attribute(part, "name");
        String label = labelOf(part);

        List<String> currentPath = path;
        if (partId != null) {
            currentPath = new ArrayList<>(path);
            currentPath.add(partId);
            currentPath = Collections.unmodifiableList(currentPath);
        }

        for (Element paragraph : OscalXml.children(part, "p")) {
            String text = narrativeReconstructor.reconstruct(paragraph, labels);
            out.add(new StatementFragment(currentPath, partId, partName, label, text, depth));
        }
        for (Element child : OscalXml.children(part, "part")) {
            flatten(child, labels, currentPath, depth + 1, out);
        }
    }

    /**
     * Value of the part's first direct {@code prop name="label"}, or null.
     */
    static String labelOf(Element part) {
        for (Element prop : OscalXml.children(part, "prop")) {
            if ("label".equals(OscalXml.attribute(prop, "name"))) {
                return OscalXml.attribute(prop, "value");
            }
        }
        return null;
    }
}
