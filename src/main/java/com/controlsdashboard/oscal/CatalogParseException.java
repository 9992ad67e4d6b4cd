package com.controlsdashboard.oscal;

/**
 * The source document could not be parsed as XML. Raised before any write is issued.
 */
public class CatalogParseException extends RuntimeException {
    public CatalogParseException(String m) { super(m); }
    public CatalogParseException(String m, Throwable c) { super(m, c); }
}
