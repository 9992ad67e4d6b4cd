package com.controlsdashboard.service;

import com.controlsdashboard.oscal.OscalXml;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.Map;

/**
 * Rebuilds the plain text of one {@code p} element.
 *
 * <p>The paragraph's own leading text is kept, each {@code insert} becomes {@code <label>}, and the
 * tail after every nested element is appended only when it holds no line break. Text inside other
 * inline elements ({@code em}, {@code a}, ...) is not carried over; their tails are.
 */
@Component
public class NarrativeReconstructor {

    // The paragraph's own tail belongs to the enclosing part, not to this paragraph
    public String reconstruct(Element paragraph, Map<String, String> labels) {
        if (paragraph == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        visit(paragraph, labels, text);
        return text.toString().strip();
    }

    private void visit(Element node, Map<String, String> labels, StringBuilder text) {
        if (OscalXml.is(node, "p")) {
            String own = OscalXml.text(node);
            if (own != null) {
                text.append(own);
            }
        } else if (OscalXml.is(node, "insert")) {
            String paramId = OscalXml.attribute(node, "id-ref");
            text.append('<')
                    .append(ParameterResolution.labelOrFallback(labels, paramId))
                    .append('>');
        }
        for (Element child : OscalXml.childElements(node)) {
            visit(child, labels, text);
            String tail = OscalXml.tail(child);
            // Multi-line tails are layout whitespace between block elements
            if (tail != null && tail.indexOf('\n') < 0) {
                text.append(tail);
            }
        }
    }
}
