package com.controlsdashboard.service;

import com.controlsdashboard.dto.IngestionSummary;
import com.controlsdashboard.model.Control;
import com.controlsdashboard.model.ControlFamily;
import com.controlsdashboard.model.Resource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogNormalizationServiceTest {

    private InMemoryCatalogStore store;
    private CatalogNormalizationService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
        NarrativeReconstructor reconstructor = new NarrativeReconstructor();
        ControlExtractor extractor = new ControlExtractor(new PartTreeFlattener(reconstructor), reconstructor,
                new SatelliteKeyService(SatelliteKeyService.Strategy.DETERMINISTIC),
                TraversalScope.ALL_DESCENDANTS, true, false);
        service = new CatalogNormalizationService(store, new ParameterLabelResolver(), extractor, new ResourceExtractor());
    }

    @Test
    void normalizesCatalogIntoAllTables() {
        IngestionSummary summary = service.normalizeCatalog(OscalFixtures.document(OscalFixtures.CATALOG));

        assertThat(store.controls).containsOnlyKeys("ac-1", "ac-1.1", "ac-1.1.1", "pm-1");
        assertThat(store.controls.get("pm-1").getCatalogId()).isEqualTo("pm");
        assertThat(store.parameters).containsOnlyKeys("ac-1_prm_1", "ac-1_prm_2");
        assertThat(store.relations).containsExactly("ac-1->ac-1.1", "ac-1.1->ac-1.1.1");
        assertThat(store.parts).hasSize(3);
        assertThat(store.props).hasSize(4);
        assertThat(store.links).hasSize(1);

        assertThat(summary.getGroups()).isEqualTo(2);
        assertThat(summary.getControlsWritten()).isEqualTo(4);
        assertThat(summary.getControlsSkipped()).isEqualTo(1);
        assertThat(summary.getFamiliesWritten()).isEqualTo(2);
        assertThat(summary.getResourcesUpserted()).isEqualTo(1);
    }

    @Test
    void extractsFamiliesFromTopLevelFamilyGroups() {
        service.normalizeCatalog(OscalFixtures.document(OscalFixtures.CATALOG));

        ControlFamily ac = store.families.get("ac");
        assertThat(ac.getFamilyName()).isEqualTo("Access Control");
        assertThat(ac.getDescription()).isEqualTo("Access control family overview.");
        assertThat(store.families.get("pm").getDescription()).isNull();
    }

    @Test
    void ignoresNestedAndNonFamilyGroupsForFamilies() {
        String xml = """
                <catalog xmlns="http://csrc.nist.gov/ns/oscal/1.0" uuid="c">
                  <group id="ac" class="family"><title>AC</title>
                    <group id="ac-sub" class="family"><title>Nested</title></group>
                  </group>
                  <group id="misc" class="other"><title>Misc</title></group>
                  <group class="family"><title>No id</title></group>
                  <group id="nt" class="family"/>
                </catalog>
                """;

        service.normalizeCatalog(OscalFixtures.document(xml));

        assertThat(store.families).containsOnlyKeys("ac");
    }

    @Test
    void rerunningUnchangedCatalogWritesNothingNew() {
        Document document = OscalFixtures.document(OscalFixtures.CATALOG);
        service.normalizeCatalog(document);
        int parts = store.parts.size();
        int props = store.props.size();
        int links = store.links.size();

        IngestionSummary second = service.normalizeCatalog(OscalFixtures.document(OscalFixtures.CATALOG));

        assertThat(second.getControlsWritten()).isZero();
        assertThat(second.getPartsWritten()).isZero();
        assertThat(second.getRelationsWritten()).isZero();
        assertThat(store.parts).hasSize(parts);
        assertThat(store.props).hasSize(props);
        assertThat(store.links).hasSize(links);
        assertThat(store.controls).hasSize(4);
    }

    @Test
    void resourceUpsertKeepsOneRowWithLatestValues() {
        service.normalizeCatalog(OscalFixtures.document(OscalFixtures.CATALOG));
        String updated = """
                <catalog xmlns="http://csrc.nist.gov/ns/oscal/1.0" uuid="c">
                  <back-matter>
                    <resource uuid="res-1"><title>Revised title</title></resource>
                  </back-matter>
                </catalog>
                """;

        service.normalizeCatalog(OscalFixtures.document(updated));

        assertThat(store.resources).hasSize(1);
        Resource resource = store.resources.get("res-1");
        assertThat(resource.getTitle()).isEqualTo("Revised title");
        assertThat(resource.getLocation()).isNull();
        assertThat(resource.getCitation()).isNull();
    }

    @Test
    void firstGroupWinsForControlsInNestedGroups() {
        String xml = """
                <catalog xmlns="http://csrc.nist.gov/ns/oscal/1.0" uuid="c">
                  <group id="outer"><title>Outer</title>
                    <group id="inner"><title>Inner</title>
                      <control id="c-1"><title>C</title></control>
                    </group>
                  </group>
                </catalog>
                """;

        IngestionSummary summary = service.normalizeCatalog(OscalFixtures.document(xml));

        assertThat(store.controls.get("c-1").getCatalogId()).isEqualTo("outer");
        assertThat(summary.getControlsExtracted()).isEqualTo(2);
        assertThat(summary.getControlsWritten()).isEqualTo(1);
    }

    @Test
    void controlsOutsideGroupsUseCatalogUuid() {
        String xml = """
                <catalog xmlns="http://csrc.nist.gov/ns/oscal/1.0" uuid="cat-9">
                  <control id="x-1"><title>Loose</title><control id="x-1.1"/></control>
                </catalog>
                """;

        service.normalizeCatalog(OscalFixtures.document(xml));

        assertThat(store.controls).containsOnlyKeys("x-1", "x-1.1");
        assertThat(store.controls.values()).extracting(Control::getCatalogId).containsOnly("cat-9");
        assertThat(store.relations).containsExactly("x-1->x-1.1");
    }

    @Test
    void catalogWithoutBackMatterHasNoResources() {
        String xml = "<catalog xmlns=\"http://csrc.nist.gov/ns/oscal/1.0\" uuid=\"c\"/>";

        IngestionSummary summary = service.normalizeCatalog(OscalFixtures.document(xml));

        assertThat(store.resources).isEmpty();
        assertThat(summary.getResourcesUpserted()).isZero();
        assertThat(summary.getGroups()).isZero();
    }

    @Test
    void resourceExtractorReadsBackMatter() {
        List<Resource> resources = new ResourceExtractor()
                .extract(OscalFixtures.document(OscalFixtures.CATALOG).getDocumentElement());

        assertThat(resources).singleElement().satisfies(r -> {
            assertThat(r.getUuid()).isEqualTo("res-1");
            assertThat(r.getTitle()).isEqualTo("NIST SP 800-53");
            assertThat(r.getLocation()).isEqualTo("https://example.org/sp800-53");
            assertThat(r.getCitation()).isEqualTo("NIST Special Publication");
        });
    }
}
