package com.controlsdashboard.service;

import com.controlsdashboard.dto.BaselineImportSummary;
import com.controlsdashboard.model.Baseline;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BaselineProfileImporterTest {

    private static final String PROFILE = """
            <profile xmlns="http://csrc.nist.gov/ns/oscal/1.0" uuid="prof-1">
              <metadata>
                <title> Moderate Baseline </title>
                <last-modified>2024-01-02T03:04:05Z</last-modified>
                <version>1.2</version>
                <party uuid="party-1" type="organization">
                  <name>Agency</name>
                  <email-address>sec@example.gov</email-address>
                  <address>
                    <addr-line>100 Main St</addr-line>
                    <addr-line>  </addr-line>
                    <city>Gaithersburg</city>
                    <state>MD</state>
                    <postal-code>20899</postal-code>
                  </address>
                </party>
                <party uuid="party-2" type="person"/>
              </metadata>
              <imports>
                <import href="#catalog">
                  <include-controls>
                    <with-id>ac-1</with-id>
                    <with-id> ac-2 </with-id>
                    <with-id>ac-1</with-id>
                    <with-id/>
                  </include-controls>
                </import>
              </imports>
            </profile>
            """;

    private InMemoryCatalogStore store;
    private ObjectMapper objectMapper;
    private BaselineProfileImporter importer;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
        objectMapper = new ObjectMapper();
        importer = new BaselineProfileImporter(store, objectMapper);
    }

    @Test
    void importsMetadataPartiesAndDeduplicatedControls() throws Exception {
        BaselineImportSummary summary = importer.importProfile(OscalFixtures.document(PROFILE), "MODERATE");

        Baseline baseline = store.baselines.get(summary.baselineId());
        assertThat(baseline.getName()).isEqualTo("MODERATE");
        assertThat(baseline.getTitle()).isEqualTo("Moderate Baseline");
        assertThat(baseline.getLastModified()).isEqualTo("2024-01-02T03:04:05Z");
        assertThat(baseline.getVersion()).isEqualTo("1.2");

        JsonNode parties = objectMapper.readTree(baseline.getPartyDetails());
        assertThat(parties.size()).isEqualTo(2);
        assertThat(parties.get(0).get("name").asText()).isEqualTo("Agency");
        assertThat(parties.get(0).get("email").asText()).isEqualTo("sec@example.gov");
        assertThat(parties.get(0).get("address").asText()).isEqualTo("100 Main St, Gaithersburg, MD, 20899");
        assertThat(parties.get(1).get("type").asText()).isEqualTo("person");
        assertThat(parties.get(1).has("name")).isFalse();

        assertThat(store.baselineControls).containsExactly(
                summary.baselineId() + ":ac-1",
                summary.baselineId() + ":ac-2");
        assertThat(summary.controlsListed()).isEqualTo(2);
        assertThat(summary.controlsWritten()).isEqualTo(2);
        assertThat(summary.parties()).isEqualTo(2);
    }

    @Test
    void emptyPartyListSerializesAsEmptyArray() {
        String xml = """
                <profile xmlns="http://csrc.nist.gov/ns/oscal/1.0">
                  <metadata><title>Low</title></metadata>
                </profile>
                """;

        BaselineImportSummary summary = importer.importProfile(OscalFixtures.document(xml), "LOW");

        assertThat(store.baselines.get(summary.baselineId()).getPartyDetails()).isEqualTo("[]");
        assertThat(store.baselineControls).isEmpty();
        assertThat(summary.version()).isNull();
    }

    @Test
    void eachImportCreatesANewBaseline() {
        BaselineImportSummary first = importer.importProfile(OscalFixtures.document(PROFILE), "MODERATE");
        BaselineImportSummary second = importer.importProfile(OscalFixtures.document(PROFILE), "MODERATE");

        assertThat(second.baselineId()).isNotEqualTo(first.baselineId());
        assertThat(store.baselineControls).hasSize(4);
    }

    @Test
    void rejectsBlankBaselineName() {
        assertThatThrownBy(() -> importer.importProfile(OscalFixtures.document(PROFILE), " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.baselines).isEmpty();
    }

    @Test
    void addressJoinsOnlyNonBlankPieces() {
        Element address = OscalFixtures.element("address", "",
                "<addr-line>Suite 5</addr-line><city/><state>VA</state>");

        assertThat(BaselineProfileImporter.address(address)).isEqualTo("Suite 5, VA");
        assertThat(BaselineProfileImporter.address(null)).isNull();
    }

    @Test
    void collectsWithIdsFromEveryIncludeControls() {
        Element root = OscalFixtures.element("profile", "",
                "<imports><import><include-controls><with-id>sc-7</with-id></include-controls></import>"
                        + "<import><include-controls><with-id>ac-1</with-id><with-id>sc-7</with-id></include-controls></import></imports>");

        assertThat(BaselineProfileImporter.includedControlIds(root)).containsExactly("sc-7", "ac-1");
    }
}
