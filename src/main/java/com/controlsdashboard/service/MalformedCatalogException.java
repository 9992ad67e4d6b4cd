package com.controlsdashboard.service;

/**
 * The catalog parsed but is missing data required to normalize it, e.g. a control without an id.
 */
public class MalformedCatalogException extends RuntimeException {
    public MalformedCatalogException(String m) { super(m); }
}
