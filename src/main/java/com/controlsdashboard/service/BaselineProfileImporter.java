package com.controlsdashboard.service;

import com.controlsdashboard.dto.BaselineImportSummary;
import com.controlsdashboard.dto.PartyDetail;
import com.controlsdashboard.model.Baseline;
import com.controlsdashboard.model.BaselineControl;
import com.controlsdashboard.oscal.OscalXml;
import com.controlsdashboard.repository.CatalogStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Imports a profile document as a named baseline: its metadata, parties and the control ids of
 * its {@code include-controls} lists.
 */
@Service
public class BaselineProfileImporter {

    private static final Logger logger = LoggerFactory.getLogger(BaselineProfileImporter.class);

    private static final Joiner ADDRESS_JOINER = Joiner.on(", ");

    private final CatalogStore catalogStore;
    private final ObjectMapper objectMapper;

    public BaselineProfileImporter(CatalogStore catalogStore, ObjectMapper objectMapper) {
        this.catalogStore = catalogStore;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public BaselineImportSummary importProfile(Document document, String baselineName) {
        if (baselineName == null || baselineName.isBlank()) {
            throw new IllegalArgumentException("Baseline name is required");
        }
        Element root = document.getDocumentElement();
        Element metadata = OscalXml.firstChild(root, "metadata");

        String title = OscalXml.trimmedChildText(metadata, "title");
        String lastModified = OscalXml.trimmedChildText(metadata, "last-modified");
        String version = OscalXml.trimmedChildText(metadata, "version");
        List<PartyDetail> parties = extractParties(metadata);

        Baseline baseline = new Baseline(baselineName, title, lastModified, serializeParties(parties), version);
        Integer baselineId = catalogStore.insertBaseline(baseline);

        Set<String> controlIds = includedControlIds(root);
        int written = 0;
        for (String controlId : controlIds) {
            if (catalogStore.insertBaselineControl(new BaselineControl(baselineId, controlId))) {
                written++;
            }
        }
        logger.info("Inserted baseline \"{}\" (id {}) with title \"{}\", last-modified \"{}\", version \"{}\", {} party(ies) and {} control(s)",
                baselineName, baselineId, title, lastModified, version, parties.size(), written);
        return new BaselineImportSummary(baselineId, baselineName, title, lastModified, version,
                parties.size(), controlIds.size(), written);
    }

    List<PartyDetail> extractParties(Element metadata) {
        List<PartyDetail> parties = new ArrayList<>();
        for (Element party : OscalXml.children(metadata, "party")) {
            parties.add(new PartyDetail(
                    OscalXml.attribute(party, "uuid"),
                    OscalXml.attribute(party, "type"),
                    emptyToNull(OscalXml.trimmedChildText(party, "name")),
                    emptyToNull(OscalXml.trimmedChildText(party, "email-address")),
                    address(OscalXml.firstChild(party, "address"))));
        }
        return parties;
    }

    /**
     * Non-blank address lines, city, state and postal code joined with {@code ", "}; null without an address element.
     */
    static String address(Element address) {
        if (address == null) {
            return null;
        }
        List<String> pieces = new ArrayList<>();
        for (Element line : OscalXml.children(address, "addr-line")) {
            pieces.add(OscalXml.text(line));
        }
        pieces.add(OscalXml.text(OscalXml.firstChild(address, "city")));
        pieces.add(OscalXml.text(OscalXml.firstChild(address, "state")));
        pieces.add(OscalXml.text(OscalXml.firstChild(address, "postal-code")));

        List<String> kept = new ArrayList<>();
        for (String piece : pieces) {
            String stripped = Strings.nullToEmpty(piece).strip();
            if (!stripped.isEmpty()) {
                kept.add(stripped);
            }
        }
        return ADDRESS_JOINER.join(kept);
    }

    /**
     * Trimmed {@code with-id} values under any {@code include-controls}, de-duplicated in document order.
     */
    static Set<String> includedControlIds(Element root) {
        Set<String> ids = new LinkedHashSet<>();
        for (Element include : OscalXml.descendants(root, "include-controls")) {
            for (Element withId : OscalXml.children(include, "with-id")) {
                String id = Strings.nullToEmpty(OscalXml.text(withId)).strip();
                if (id.isEmpty()) {
                    logger.warn("Ignoring empty with-id in include-controls");
                    continue;
                }
                if (!ids.add(id)) {
                    logger.debug("Duplicate with-id {} ignored", id);
                }
            }
        }
        return ids;
    }

    String serializeParties(List<PartyDetail> parties) {
        try {
            return objectMapper.writeValueAsString(parties);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize party details", e);
        }
    }

    private static String emptyToNull(String value) {
        return Strings.emptyToNull(value);
    }
}
