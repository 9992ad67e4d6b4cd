package com.controlsdashboard.oscal;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OscalDocumentParserTest {

    private final OscalDocumentParser parser = new OscalDocumentParser();

    @Test
    void mergesTextAroundDroppedComments() {
        Document doc = parser.parse("<p>one <!-- note -->two<em/></p>", "test");
        assertThat(OscalXml.text(doc.getDocumentElement())).isEqualTo("one two");
    }

    @Test
    void rejectsMalformedMarkup() {
        assertThatThrownBy(() -> parser.parse("<catalog><group></catalog>", "broken.xml"))
                .isInstanceOf(CatalogParseException.class)
                .hasMessageContaining("broken.xml");
    }

    @Test
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> parser.parse(new byte[0], "empty.xml"))
                .isInstanceOf(CatalogParseException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void rejectsDoctypeDeclarations() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE foo [<!ENTITY x \"y\">]><catalog>&x;</catalog>";
        assertThatThrownBy(() -> parser.parse(xml, "doctype.xml"))
                .isInstanceOf(CatalogParseException.class);
    }
}
